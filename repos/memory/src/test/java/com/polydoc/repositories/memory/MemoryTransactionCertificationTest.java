package com.polydoc.repositories.memory;

import com.polydoc.repos.certification.TransactionCertification;
import org.junit.jupiter.api.AfterEach;

public class MemoryTransactionCertificationTest extends TransactionCertification {
    private final InMemoryPlugin plugin = new InMemoryPlugin();

    @Override
    public void init() {
        this.store = plugin.createStore(new InMemoryConfig());
    }

    @AfterEach
    public void tearDown() {
        plugin.cleanUp();
    }
}
