package com.polydoc.core.store;

/**
 * A transaction could not commit because a document it wrote was changed by another writer since
 * the transaction started.
 */
public class TransactionConflictException extends StoreException {
    public TransactionConflictException(String message) {
        super(message);
    }

    public TransactionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
