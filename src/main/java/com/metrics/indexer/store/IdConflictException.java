package com.metrics.indexer.store;

/**
 * Thrown by {@link IndexStore#insertIfAbsent} when the candidate id already
 * belongs to a different string. Nothing was written; retry with a fresh id.
 */
public class IdConflictException extends IndexStoreException {

    private final long candidateId;

    public IdConflictException(long candidateId) {
        super("Candidate id " + candidateId + " is already taken");
        this.candidateId = candidateId;
    }

    public long getCandidateId() {
        return candidateId;
    }
}
