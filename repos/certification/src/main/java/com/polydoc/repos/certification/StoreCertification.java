package com.polydoc.repos.certification;

import com.polydoc.core.store.DocumentStore;
import org.junit.jupiter.api.BeforeEach;

import java.util.UUID;

/**
 * Base of the certification suites: every test gets the store created by {@link #init()} and a
 * collection name no other test uses.
 */
public abstract class StoreCertification {
    protected DocumentStore store;
    protected String collectionName;

    /**
     * Sets {@link #store} to the store under certification.
     */
    public abstract void init();

    @BeforeEach
    public void setUpStore() {
        init();
        collectionName = "books_" + UUID.randomUUID().toString().replace("-", "");
    }
}
