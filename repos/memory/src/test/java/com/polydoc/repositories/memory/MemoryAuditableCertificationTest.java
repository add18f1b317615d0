package com.polydoc.repositories.memory;

import com.polydoc.repos.certification.AuditableRepositoryCertification;

public class MemoryAuditableCertificationTest extends AuditableRepositoryCertification {

    @Override
    public void init() {
        this.store = new InMemoryDocumentStore();
    }
}
