package com.polydoc.core.config;

/**
 * Backend-specific settings handed to a {@link com.polydoc.core.Plugin}.
 */
public abstract class StorageConfig {
    public final String type;

    protected StorageConfig(String type) {
        this.type = type;
    }
}
