package com.polydoc.core;

import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static com.polydoc.core.Schema.FieldType.ANY;
import static com.polydoc.core.Schema.FieldType.ARRAY;
import static com.polydoc.core.Schema.FieldType.BOOLEAN;
import static com.polydoc.core.Schema.FieldType.DATE;
import static com.polydoc.core.Schema.FieldType.NUMBER;
import static com.polydoc.core.Schema.FieldType.OBJECT;
import static com.polydoc.core.Schema.FieldType.STRING;
import static org.junit.jupiter.api.Assertions.*;

class SchemaTest {
    private final Schema schema = Schema.builder()
            .required("title", STRING)
            .unique("isbn", STRING)
            .field("pages", NUMBER)
            .field("available", BOOLEAN)
            .field("publishedAt", DATE)
            .field("tags", ARRAY)
            .field("publisher", OBJECT)
            .field("extra", ANY)
            .build();

    @Test
    void validDocumentHasNoViolations() {
        Document document = new Document("title", "Dune")
                .append("isbn", "0441013597")
                .append("pages", 412)
                .append("available", true)
                .append("publishedAt", new Date())
                .append("tags", List.of("sf"))
                .append("publisher", Map.of("name", "Chilton"))
                .append("extra", 1.5)
                .append("undeclared", "kept");

        assertTrue(schema.validate(document).isEmpty());
    }

    @Test
    void missingRequiredFieldsAreReported() {
        List<String> violations = schema.validate(new Document("pages", 412));

        assertEquals(List.of("Path `title` is required.", "Path `isbn` is required."), violations);
    }

    @Test
    void valuesOfTheWrongTypeAreReported() {
        Document document = new Document("title", 42).append("isbn", "0441013597").append("available", "yes");

        assertEquals(List.of(
                "Path `title` expects a string but got Integer.",
                "Path `available` expects a boolean but got String."), schema.validate(document));
    }

    @Test
    void datesAcceptInstantsAndIsoStrings() {
        Document base = new Document("title", "Dune").append("isbn", "0441013597");

        assertTrue(schema.validate(new Document(base).append("publishedAt", Instant.now())).isEmpty());
        assertTrue(schema.validate(new Document(base).append("publishedAt", "1965-08-01T00:00:00Z")).isEmpty());
        assertEquals(1, schema.validate(new Document(base).append("publishedAt", "August 1965")).size());
    }

    @Test
    void uniqueFieldsAreRequired() {
        assertEquals(List.of("isbn"), schema.uniqueFields());
        assertTrue(schema.fields().stream().filter(Schema.Field::unique).allMatch(Schema.Field::required));
    }

    @Test
    void extensionFieldsReplaceSameNamedFields() {
        Schema extended = schema.extend(Schema.builder()
                .required("pages", NUMBER)
                .required("narrator", STRING)
                .build());

        List<String> violations = extended.validate(new Document("title", "Dune").append("isbn", "0441013597"));

        assertEquals(List.of("Path `pages` is required.", "Path `narrator` is required."), violations);
        assertTrue(schema.validate(new Document("title", "Dune").append("isbn", "0441013597")).isEmpty());
    }
}
