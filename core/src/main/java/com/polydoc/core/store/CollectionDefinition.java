package com.polydoc.core.store;

import com.polydoc.core.Schema;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Describes a collection holding a supertype and its subtypes.
 *
 * @param name             collection name
 * @param modelName        supertype name, used in validation messages
 * @param discriminatorKey document key naming a document's subtype
 * @param schema           schema of supertype documents
 * @param subtypeSchemas   effective schemas of subtype documents, keyed by discriminator value
 */
public record CollectionDefinition(
        String name,
        String modelName,
        String discriminatorKey,
        Schema schema,
        Map<String, Schema> subtypeSchemas
) {
    public CollectionDefinition {
        subtypeSchemas = Collections.unmodifiableMap(new LinkedHashMap<>(subtypeSchemas));
    }

    /**
     * The schema a document is validated against, picked by its discriminator.
     */
    public Schema schemaFor(Object discriminator) {
        if (discriminator == null) {
            return schema;
        }
        return subtypeSchemas.getOrDefault(discriminator.toString(), schema);
    }

    /**
     * Validates a document against the schema its discriminator picks.
     *
     * @throws DocumentValidationException naming every violated field
     */
    public void validate(Document document) {
        Object discriminator = document.get(discriminatorKey);
        List<String> violations = schemaFor(discriminator).validate(document);
        if (!violations.isEmpty()) {
            throw new DocumentValidationException(
                    discriminator != null ? discriminator.toString() : modelName, violations);
        }
    }

    public List<String> uniqueFields() {
        Set<String> unique = new LinkedHashSet<>(schema.uniqueFields());
        for (Schema subtypeSchema : subtypeSchemas.values()) {
            unique.addAll(subtypeSchema.uniqueFields());
        }
        return new ArrayList<>(unique);
    }
}
