package com.metrics.indexer.cache;

import com.metrics.indexer.api.UseCaseKey;

/**
 * Builds cache keys for one partition.
 *
 * <pre>
 * indexer:&lt;partition&gt;:str:&lt;useCase&gt;:&lt;tenantId&gt;:&lt;string&gt;   forward
 * indexer:&lt;partition&gt;:id:&lt;useCase&gt;:&lt;tenantId&gt;:&lt;id&gt;         reverse
 * </pre>
 *
 * The string is the last segment, so colons inside it cannot make two keys collide.
 */
public final class CacheKeys {

    private final String forwardPrefix;
    private final String reversePrefix;

    public CacheKeys(String partitionKey) {
        this.forwardPrefix = "indexer:" + partitionKey + ":str:";
        this.reversePrefix = "indexer:" + partitionKey + ":id:";
    }

    public String forward(UseCaseKey useCase, long tenantId, String string) {
        return forwardPrefix + useCase.value() + ':' + tenantId + ':' + string;
    }

    public String reverse(UseCaseKey useCase, long tenantId, long id) {
        return reversePrefix + useCase.value() + ':' + tenantId + ':' + id;
    }
}
