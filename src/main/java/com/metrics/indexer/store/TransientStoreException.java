package com.metrics.indexer.store;

/**
 * Connection-level store failure that is expected to clear on its own,
 * such as a dropped socket or a refused connection during failover.
 */
public class TransientStoreException extends IndexStoreException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
