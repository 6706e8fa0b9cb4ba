package com.metrics.indexer.store;

import com.metrics.indexer.api.IndexerException;

/**
 * Thrown when the backing store fails a request.
 */
public class IndexStoreException extends IndexerException {

    public IndexStoreException(String message) {
        super(message);
    }

    public IndexStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
