package com.polydoc.repositories.mongo;

import com.polydoc.core.store.Session;
import com.polydoc.core.store.StoreException;
import com.polydoc.core.store.TransactionConflictException;
import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;

/**
 * A {@link ClientSession} seen as a store session. Transactions need a replica set or a sharded
 * cluster.
 */
public class MongoSession implements Session {
    private final ClientSession clientSession;

    MongoSession(ClientSession clientSession) {
        this.clientSession = clientSession;
    }

    ClientSession clientSession() {
        return clientSession;
    }

    @Override
    public void startTransaction() {
        clientSession.startTransaction();
    }

    @Override
    public void commitTransaction() {
        try {
            clientSession.commitTransaction();
        } catch (MongoException e) {
            if (e.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
                throw new TransactionConflictException("Transaction could not be committed: " + e.getMessage(), e);
            }
            throw new StoreException("Transaction could not be committed", e);
        }
    }

    @Override
    public void abortTransaction() {
        clientSession.abortTransaction();
    }

    @Override
    public boolean hasActiveTransaction() {
        return clientSession.hasActiveTransaction();
    }

    @Override
    public void close() {
        clientSession.close();
    }
}
