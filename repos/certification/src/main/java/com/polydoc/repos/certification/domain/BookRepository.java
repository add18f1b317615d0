package com.polydoc.repos.certification.domain;

import com.polydoc.core.EntityType;
import com.polydoc.core.InvalidArgumentException;
import com.polydoc.core.RepositoryOptions;
import com.polydoc.core.TransactionalDocumentRepository;
import com.polydoc.core.TypeRegistry;
import com.polydoc.core.query.Filter;
import com.polydoc.core.store.DocumentStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Books, paper books and audio books sharing one collection.
 */
public class BookRepository extends TransactionalDocumentRepository<Publication> {

    public BookRepository(DocumentStore store, String collectionName) {
        super(typeMap(), store, RepositoryOptions.builder().collectionName(collectionName).build());
    }

    static Map<String, EntityType<? extends Publication>> typeMap() {
        Map<String, EntityType<? extends Publication>> typeMap = new LinkedHashMap<>();
        typeMap.put(TypeRegistry.DEFAULT, EntityType.of(Book.class, BookSchemas.BOOK));
        typeMap.put("PaperBook", EntityType.of(PaperBook.class, BookSchemas.PAPER_BOOK));
        typeMap.put("AudioBook", EntityType.of(AudioBook.class, BookSchemas.AUDIO_BOOK));
        return typeMap;
    }

    public <T extends Publication> Optional<T> findByIsbn(String isbn) {
        if (isbn == null || isbn.isBlank()) {
            throw new InvalidArgumentException("The given ISBN must be valid");
        }
        return collection().findOne(null, Filter.eq("isbn", isbn))
                .map(document -> this.<T>instantiateFrom(document));
    }
}
