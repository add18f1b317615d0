package com.polydoc.repositories.memory;

import com.polydoc.core.Plugin;
import com.polydoc.core.config.StorageConfig;
import com.polydoc.core.store.DocumentStore;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPlugin implements Plugin {
    private final Map<String, InMemoryStore> stores = new ConcurrentHashMap<>();

    @Override
    public DocumentStore createStore(StorageConfig sc) {
        InMemoryConfig config = (InMemoryConfig) sc;
        InMemoryStore store = stores.computeIfAbsent(config.name, name -> new InMemoryStore());
        return new InMemoryDocumentStore(store);
    }

    @Override
    public void cleanUp() {
        stores.clear();
    }
}
