package com.polydoc.repos.certification.domain;

import com.polydoc.core.DocumentRepository;
import com.polydoc.core.EntityType;
import com.polydoc.core.RepositoryOptions;
import com.polydoc.core.TypeRegistry;
import com.polydoc.core.store.DocumentStore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A book collection whose supertype has no class of its own; only subtypes can be instantiated.
 */
public class SubtypeOnlyBookRepository extends DocumentRepository<Publication> {

    public SubtypeOnlyBookRepository(DocumentStore store, String collectionName) {
        super(typeMap(), store, RepositoryOptions.builder()
                .collectionName(collectionName)
                .modelName("Book")
                .build());
    }

    private static Map<String, EntityType<? extends Publication>> typeMap() {
        Map<String, EntityType<? extends Publication>> typeMap = new LinkedHashMap<>();
        typeMap.put(TypeRegistry.DEFAULT, EntityType.named(null, BookSchemas.BOOK));
        typeMap.put("PaperBook", EntityType.of(PaperBook.class, BookSchemas.PAPER_BOOK));
        typeMap.put("AudioBook", EntityType.of(AudioBook.class, BookSchemas.AUDIO_BOOK));
        return typeMap;
    }
}
