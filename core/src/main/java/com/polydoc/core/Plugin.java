package com.polydoc.core;

import com.polydoc.core.config.StorageConfig;
import com.polydoc.core.store.DocumentStore;

/**
 * Creates document stores for one kind of backend.
 */
public interface Plugin {
    DocumentStore createStore(StorageConfig config);

    /**
     * Releases every resource held by the stores this plugin created.
     */
    void cleanUp();
}
