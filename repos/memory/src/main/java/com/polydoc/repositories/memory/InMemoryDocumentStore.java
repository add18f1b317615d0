package com.polydoc.repositories.memory;

import com.polydoc.core.store.CollectionDefinition;
import com.polydoc.core.store.DocumentCollection;
import com.polydoc.core.store.DocumentStore;
import com.polydoc.core.store.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A document store keeping its data in memory, with snapshot-isolated transactions.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final InMemoryStore store;

    public InMemoryDocumentStore() {
        this(new InMemoryStore());
    }

    public InMemoryDocumentStore(InMemoryStore store) {
        this.store = store;
    }

    @Override
    public DocumentCollection collection(CollectionDefinition definition) {
        store.collection(definition.name());
        logger.debug("Opened in-memory collection {}", definition.name());
        return new InMemoryCollection(store, definition);
    }

    @Override
    public Session startSession() {
        return new InMemorySession(store);
    }
}
