package com.polydoc.repos.certification.domain;

import com.polydoc.core.DocumentRepository;
import com.polydoc.core.EntityType;
import com.polydoc.core.RepositoryOptions;
import com.polydoc.core.TypeRegistry;
import com.polydoc.core.store.DocumentStore;

import java.util.LinkedHashMap;
import java.util.Map;

public class AuditableBookRepository extends DocumentRepository<AuditablePublication> {

    public AuditableBookRepository(DocumentStore store, String collectionName) {
        super(typeMap(), store, RepositoryOptions.builder().collectionName(collectionName).build());
    }

    private static Map<String, EntityType<? extends AuditablePublication>> typeMap() {
        Map<String, EntityType<? extends AuditablePublication>> typeMap = new LinkedHashMap<>();
        typeMap.put(TypeRegistry.DEFAULT, EntityType.of(AuditableBook.class, BookSchemas.AUDITABLE_BOOK));
        typeMap.put("AuditablePaperBook", EntityType.of(AuditablePaperBook.class, BookSchemas.AUDITABLE_PAPER_BOOK));
        return typeMap;
    }
}
