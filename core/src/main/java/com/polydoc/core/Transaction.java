package com.polydoc.core;

import com.polydoc.core.store.DocumentStore;
import com.polydoc.core.store.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scope guard over a started transaction. Closing a transaction that was not committed aborts it,
 * and a session opened by the transaction is closed with it.
 */
public final class Transaction implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Transaction.class);

    private final Session session;
    private final boolean ownsSession;
    private boolean commitAttempted;

    private Transaction(Session session, boolean ownsSession) {
        this.session = session;
        this.ownsSession = ownsSession;
    }

    /**
     * Opens a session on the store and starts a transaction on it.
     */
    public static Transaction begin(DocumentStore store) {
        Session session = store.startSession();
        try {
            session.startTransaction();
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
        logger.debug("Started transaction on a new session");
        return new Transaction(session, true);
    }

    /**
     * Starts a transaction on a session owned by the caller, which stays open on close.
     */
    public static Transaction begin(Session session) {
        session.startTransaction();
        logger.debug("Started transaction on the given session");
        return new Transaction(session, false);
    }

    public Session session() {
        return session;
    }

    public void commit() {
        commitAttempted = true;
        session.commitTransaction();
        logger.debug("Committed transaction");
    }

    @Override
    public void close() {
        try {
            if (!commitAttempted && session.hasActiveTransaction()) {
                logger.debug("Aborting uncommitted transaction");
                session.abortTransaction();
            }
        } finally {
            if (ownsSession) {
                session.close();
            }
        }
    }
}
