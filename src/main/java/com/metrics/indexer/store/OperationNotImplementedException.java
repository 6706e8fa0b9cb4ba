package com.metrics.indexer.store;

import com.metrics.indexer.api.IndexerException;

/**
 * Thrown by a store that does not provide an operation. Never means "not found":
 * absent keys are reported as empty results.
 */
public class OperationNotImplementedException extends IndexerException {

    private final String operation;

    public OperationNotImplementedException(String storeName, String operation) {
        super("Store '" + storeName + "' does not implement " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
