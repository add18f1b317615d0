package com.polydoc.repositories.memory;

import com.polydoc.core.config.StorageConfig;

public class InMemoryConfig extends StorageConfig {
    /**
     * Stores created for the same name share their data.
     */
    public String name = "default";

    public InMemoryConfig() {
        super("memory");
    }
}
