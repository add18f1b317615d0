package com.polydoc.repositories.mongo;

import com.polydoc.core.config.StorageConfig;

public class MongoConfig extends StorageConfig {
    public String uri;
    public String db;

    public MongoConfig() {
        super("mongo");
    }
}
