package com.polydoc.repositories.mongo;

import com.polydoc.repos.certification.RepositoryCertification;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import org.junit.jupiter.api.AfterAll;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MongoRepositoryCertificationTest extends RepositoryCertification {
    private static final Logger logger = LoggerFactory.getLogger(MongoRepositoryCertificationTest.class);
    private static final String DATABASE_NAME = "test_db";

    private static MongoServer server;
    private static MongoClient mongoClient;

    public static void setupMongo() {
        server = new MongoServer(new MemoryBackend());
        String connectionString = server.bindAndGetConnectionString();
        mongoClient = MongoClients.create(connectionString);
        logger.info("Connected to in-memory MongoDB at {}", connectionString);
    }

    @Override
    public void init() {
        if (server == null) {
            setupMongo();
        }
        store = new MongoDocumentStore(mongoClient, mongoClient.getDatabase(DATABASE_NAME));
    }

    @AfterAll
    public static void tini() {
        if (mongoClient != null) {
            mongoClient.close();
            mongoClient = null;
        }
        if (server != null) {
            server.shutdownNow();
            server = null;
        }
    }
}
