package com.polydoc.core.store;

/**
 * A store session that a transaction is bound to. A session is owned by one unit of work at a time
 * and must be closed by its owner.
 */
public interface Session extends AutoCloseable {
    void startTransaction();

    void commitTransaction();

    void abortTransaction();

    boolean hasActiveTransaction();

    @Override
    void close();
}
