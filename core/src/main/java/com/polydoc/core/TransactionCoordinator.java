package com.polydoc.core;

import com.polydoc.core.store.DocumentStore;
import com.polydoc.core.store.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs units of work atomically against a store.
 */
public class TransactionCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final DocumentStore store;

    public TransactionCoordinator(DocumentStore store) {
        this.store = store;
    }

    /**
     * Runs {@code work} in a transaction and commits it when the work returns. Anything the work
     * throws aborts the transaction and is rethrown as is.
     * <p>
     * A session in {@code options} that already has an active transaction is joined: the work runs
     * in it and completing the transaction is left to its owner. A session without one gets a new
     * transaction, and no session at all gets a new session.
     */
    public <R> R runInTransaction(UnitOfWork<R> work, OperationOptions options) {
        Session given = options != null ? options.session() : null;
        if (given != null && given.hasActiveTransaction()) {
            logger.debug("Joining the active transaction of the given session");
            return work.execute(given);
        }

        try (Transaction transaction = given != null ? Transaction.begin(given) : Transaction.begin(store)) {
            R result = work.execute(transaction.session());
            transaction.commit();
            return result;
        }
    }

    public <R> R runInTransaction(UnitOfWork<R> work) {
        return runInTransaction(work, OperationOptions.none());
    }
}
