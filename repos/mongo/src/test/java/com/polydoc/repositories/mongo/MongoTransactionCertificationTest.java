package com.polydoc.repositories.mongo;

import com.polydoc.core.store.DocumentStore;
import com.polydoc.repos.certification.TransactionCertification;
import org.junit.jupiter.api.AfterAll;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Transactions need a replica set, so this suite runs against a real MongoDB in a container.
 */
@Testcontainers(disabledWithoutDocker = true)
public class MongoTransactionCertificationTest extends TransactionCertification {

    @Container
    private static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:6.0");

    private static final MongoPlugin plugin = new MongoPlugin();
    private static DocumentStore sharedStore;

    @Override
    public void init() {
        if (sharedStore == null) {
            MongoConfig config = new MongoConfig();
            config.uri = mongoDBContainer.getReplicaSetUrl();
            config.db = "transactions";
            sharedStore = plugin.createStore(config);
        }
        store = sharedStore;
    }

    @AfterAll
    public static void tearDown() {
        plugin.cleanUp();
        sharedStore = null;
    }
}
