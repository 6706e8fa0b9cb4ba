package com.metrics.indexer.core;

import com.metrics.indexer.api.KeyCollection;
import com.metrics.indexer.api.KeyResult;
import com.metrics.indexer.api.KeyResults;
import com.metrics.indexer.api.StringIndexer;
import com.metrics.indexer.api.UseCaseKey;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Answers {@link SharedStrings} directly and forwards everything else to the
 * wrapped indexer.
 */
public class StaticStringIndexer implements StringIndexer {

    private final StringIndexer indexer;

    public StaticStringIndexer(StringIndexer indexer) {
        this.indexer = Objects.requireNonNull(indexer, "indexer");
    }

    @Override
    public KeyResults bulkRecord(UseCaseKey useCase, KeyCollection strings) {
        KeyResults staticResults = new KeyResults();
        KeyCollection.Builder remaining = KeyCollection.builder();
        for (KeyCollection.Key key : strings.asTuples()) {
            OptionalLong id = SharedStrings.idOf(key.string());
            if (id.isPresent()) {
                staticResults.addKeyResult(KeyResult.resolved(key.tenantId(), key.string(), id.getAsLong()));
            } else {
                remaining.add(key.tenantId(), key.string());
            }
        }

        KeyCollection dynamic = remaining.build();
        if (dynamic.isEmpty()) {
            return staticResults;
        }
        return staticResults.merge(indexer.bulkRecord(useCase, dynamic));
    }

    @Override
    public OptionalLong record(UseCaseKey useCase, long tenantId, String string) {
        OptionalLong id = SharedStrings.idOf(string);
        return id.isPresent() ? id : indexer.record(useCase, tenantId, string);
    }

    @Override
    public OptionalLong resolve(UseCaseKey useCase, long tenantId, String string) {
        OptionalLong id = SharedStrings.idOf(string);
        return id.isPresent() ? id : indexer.resolve(useCase, tenantId, string);
    }

    @Override
    public Optional<String> reverseResolve(UseCaseKey useCase, long tenantId, long id) {
        Optional<String> string = SharedStrings.stringOf(id);
        return string.isPresent() ? string : indexer.reverseResolve(useCase, tenantId, id);
    }

    public StringIndexer getIndexer() {
        return indexer;
    }
}
