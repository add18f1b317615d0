package com.polydoc.repos.certification.domain;

import com.polydoc.core.EntityType;
import com.polydoc.core.RepositoryOptions;
import com.polydoc.core.TransactionalDocumentRepository;
import com.polydoc.core.store.DocumentStore;

import java.util.Map;

/**
 * The book collection as seen by a newer type map that also knows electronic books.
 */
public class ExtendedBookRepository extends TransactionalDocumentRepository<Publication> {

    public ExtendedBookRepository(DocumentStore store, String collectionName) {
        super(typeMap(), store, RepositoryOptions.builder().collectionName(collectionName).build());
    }

    private static Map<String, EntityType<? extends Publication>> typeMap() {
        Map<String, EntityType<? extends Publication>> typeMap = BookRepository.typeMap();
        typeMap.put("ElectronicBook", EntityType.of(ElectronicBook.class, BookSchemas.ELECTRONIC_BOOK));
        return typeMap;
    }
}
