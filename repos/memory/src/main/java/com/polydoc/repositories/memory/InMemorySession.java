package com.polydoc.repositories.memory;

import com.polydoc.core.store.Session;
import org.bson.Document;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Session of an {@link InMemoryDocumentStore}. A transaction works on a private copy of the store
 * taken when it starts and publishes its writes on commit.
 */
public class InMemorySession implements Session {
    private final InMemoryStore store;

    private Map<String, Map<String, Document>> baseline;
    private Map<String, Map<String, Document>> workspace;
    private final Map<String, Set<String>> written = new HashMap<>();
    private boolean closed;

    InMemorySession(InMemoryStore store) {
        this.store = store;
    }

    boolean belongsTo(InMemoryStore other) {
        return store == other;
    }

    @Override
    public void startTransaction() {
        if (closed) {
            throw new IllegalStateException("The session has been closed");
        }
        if (hasActiveTransaction()) {
            throw new IllegalStateException("Transaction already in progress");
        }
        baseline = store.snapshot();
        workspace = new LinkedHashMap<>();
        baseline.forEach((name, documents) -> workspace.put(name, new LinkedHashMap<>(documents)));
    }

    @Override
    public void commitTransaction() {
        requireActiveTransaction();
        try {
            store.commit(baseline, workspace, written);
        } finally {
            reset();
        }
    }

    @Override
    public void abortTransaction() {
        requireActiveTransaction();
        reset();
    }

    @Override
    public boolean hasActiveTransaction() {
        return workspace != null;
    }

    @Override
    public void close() {
        if (hasActiveTransaction()) {
            reset();
        }
        closed = true;
    }

    Map<String, Document> workspace(String collection) {
        return workspace.computeIfAbsent(collection, key -> new LinkedHashMap<>());
    }

    void markWritten(String collection, String id) {
        written.computeIfAbsent(collection, key -> new LinkedHashSet<>()).add(id);
    }

    private void requireActiveTransaction() {
        if (!hasActiveTransaction()) {
            throw new IllegalStateException("No transaction started");
        }
    }

    private void reset() {
        baseline = null;
        workspace = null;
        written.clear();
    }
}
