package com.polydoc.repositories.mongo;

import com.polydoc.core.store.CollectionDefinition;
import com.polydoc.core.store.DocumentCollection;
import com.polydoc.core.store.DocumentStore;
import com.polydoc.core.store.Session;
import com.polydoc.core.store.StoreException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MongoDocumentStore implements DocumentStore {
    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final MongoClient mongoClient;
    private final MongoDatabase database;

    /**
     * @param mongoClient client sessions are started on
     * @param database    database holding the collections
     */
    public MongoDocumentStore(MongoClient mongoClient, MongoDatabase database) {
        this.mongoClient = mongoClient;
        this.database = database;
    }

    /**
     * Opens a collection and makes sure every unique field of its definition has a unique index.
     * Indexes are not sparse, so documents missing a unique field collide with each other.
     */
    @Override
    public DocumentCollection collection(CollectionDefinition definition) {
        MongoCollection<Document> collection = database.getCollection(definition.name());
        try {
            for (String field : definition.uniqueFields()) {
                collection.createIndex(Indexes.ascending(field), new IndexOptions().unique(true));
                logger.debug("Ensured unique index on {}.{}", definition.name(), field);
            }
        } catch (MongoException e) {
            logger.error("Error creating indexes of {}: {}", definition.name(), e.getMessage(), e);
            throw new StoreException("Failed to create the indexes of " + definition.name(), e);
        }
        return new MongoDocumentCollection(collection, definition);
    }

    @Override
    public Session startSession() {
        return new MongoSession(mongoClient.startSession());
    }
}
