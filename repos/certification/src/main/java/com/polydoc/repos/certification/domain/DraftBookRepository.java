package com.polydoc.repos.certification.domain;

import com.polydoc.core.EntityType;
import com.polydoc.core.RepositoryOptions;
import com.polydoc.core.TransactionalDocumentRepository;
import com.polydoc.core.TypeRegistry;
import com.polydoc.core.store.DocumentStore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The book collection under an older, looser schema that accepts books without a description.
 */
public class DraftBookRepository extends TransactionalDocumentRepository<Publication> {

    public DraftBookRepository(DocumentStore store, String collectionName) {
        super(typeMap(), store, RepositoryOptions.builder().collectionName(collectionName).build());
    }

    private static Map<String, EntityType<? extends Publication>> typeMap() {
        Map<String, EntityType<? extends Publication>> typeMap = new LinkedHashMap<>();
        typeMap.put(TypeRegistry.DEFAULT, EntityType.of(Book.class, BookSchemas.DRAFT_BOOK));
        return typeMap;
    }
}
