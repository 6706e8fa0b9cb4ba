package com.metrics.indexer.api;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Maps metric names, tag keys and tag values to stable integer ids, per tenant
 * and use case, and back.
 *
 * <p>Once a string has an id it keeps it. Implementations may be stacked: a
 * caching indexer wraps a store-backed one, a static-string indexer wraps that.</p>
 */
public interface StringIndexer {

    /**
     * Ensures every {@code (tenant, string)} pair has an id, creating ids as needed.
     * A failure for one key is reported in its {@link KeyResult} and does not
     * affect the others.
     *
     * @param useCase the namespace to index under
     * @param strings strings to index, grouped by tenant
     * @return one result per requested pair
     */
    KeyResults bulkRecord(UseCaseKey useCase, KeyCollection strings);

    /**
     * Single-pair variant of {@link #bulkRecord}.
     *
     * @return the id, or empty if the key could not be recorded
     */
    OptionalLong record(UseCaseKey useCase, long tenantId, String string);

    /**
     * Looks up the id of a string without creating one.
     *
     * @return the id, or empty if the string has never been recorded
     */
    OptionalLong resolve(UseCaseKey useCase, long tenantId, String string);

    /**
     * Looks up the string behind an id.
     *
     * @return the string, or empty if no such id exists for the tenant
     */
    Optional<String> reverseResolve(UseCaseKey useCase, long tenantId, long id);
}
