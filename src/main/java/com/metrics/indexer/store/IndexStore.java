package com.metrics.indexer.store;

import com.metrics.indexer.api.UseCaseKey;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Persistent home of string entries. Abstracts the underlying database.
 *
 * <p>All ids crossing this interface are <em>encoded</em> ids (see
 * {@link com.metrics.indexer.codec.IdCodec}). Entries are unique per
 * {@code (tenantId, useCase, string)} and per {@code (tenantId, useCase, id)},
 * and are never rewritten once created.</p>
 */
public interface IndexStore extends AutoCloseable {

    /**
     * Looks up the encoded id of a string.
     *
     * @return the id, or empty if the string has never been recorded
     */
    OptionalLong lookup(UseCaseKey useCase, long tenantId, String string);

    /**
     * Looks up the string stored under an encoded id.
     *
     * @return the string, or empty if no entry has that id
     */
    Optional<String> reverseLookup(UseCaseKey useCase, long tenantId, long encodedId);

    /**
     * Creates an entry with {@code candidateId} unless one already exists for the string.
     * Concurrent calls for the same string all receive the id of whichever write won.
     *
     * @return the id now stored for the string
     * @throws IdConflictException if the string is new but {@code candidateId} belongs to another string
     */
    long insertIfAbsent(UseCaseKey useCase, long tenantId, String string, long candidateId);

    /**
     * Batched {@link #lookup}. Strings with no entry are missing from the result.
     *
     * @throws OperationNotImplementedException if the store has no batched lookup
     */
    default Map<String, Long> lookupMany(UseCaseKey useCase, long tenantId, Set<String> strings) {
        throw new OperationNotImplementedException(getName(), "lookupMany");
    }

    /**
     * Batched {@link #insertIfAbsent}. Candidate ids must be distinct within one call.
     *
     * @param candidates string to candidate id
     * @return string to the id now stored for it; a string whose candidate id
     *         belongs to another string is left out and nothing is written for it
     * @throws OperationNotImplementedException if the store has no batched insert
     */
    default Map<String, Long> insertManyIfAbsent(UseCaseKey useCase, long tenantId, Map<String, Long> candidates) {
        throw new OperationNotImplementedException(getName(), "insertManyIfAbsent");
    }

    /**
     * Issues a trivial query to prove the store is reachable.
     *
     * @throws IndexStoreException if it is not
     */
    void ping();

    /**
     * Short name used in logs and health reports.
     */
    String getName();

    @Override
    default void close() {
    }
}
