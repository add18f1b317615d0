package com.polydoc.repositories.mongo;

import com.polydoc.core.Plugin;
import com.polydoc.core.config.StorageConfig;
import com.polydoc.core.store.DocumentStore;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class MongoPlugin implements Plugin {
    private static final Logger logger = LoggerFactory.getLogger(MongoPlugin.class);

    private final List<MongoClient> clients = new CopyOnWriteArrayList<>();

    @Override
    public DocumentStore createStore(StorageConfig sc) {
        MongoConfig config = (MongoConfig) sc;
        MongoClient mongoClient = MongoClients.create(config.uri);
        clients.add(mongoClient);
        logger.info("Connected document store to database {}", config.db);
        return new MongoDocumentStore(mongoClient, mongoClient.getDatabase(config.db));
    }

    @Override
    public void cleanUp() {
        for (MongoClient client : clients) {
            client.close();
        }
        clients.clear();
    }
}
