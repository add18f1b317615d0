package com.polydoc.core;

import org.bson.Document;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes the fields a stored document may carry. Stores validate every write against the
 * effective schema of the document's type and enforce the unique fields across the collection.
 */
public final class Schema {
    private final Map<String, Field> fields;

    private Schema(Map<String, Field> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Schema empty() {
        return new Schema(new LinkedHashMap<>());
    }

    public List<Field> fields() {
        return List.copyOf(fields.values());
    }

    public boolean declares(String name) {
        return fields.containsKey(name);
    }

    public List<String> uniqueFields() {
        List<String> unique = new ArrayList<>();
        for (Field field : fields.values()) {
            if (field.unique()) {
                unique.add(field.name());
            }
        }
        return unique;
    }

    /**
     * Returns a schema holding this schema's fields plus those of {@code extension}. Fields of the
     * extension replace same-named fields of this schema.
     */
    public Schema extend(Schema extension) {
        Map<String, Field> merged = new LinkedHashMap<>(fields);
        merged.putAll(extension.fields);
        return new Schema(merged);
    }

    /**
     * @return one message per violated field, empty when the document is valid
     */
    public List<String> validate(Document document) {
        List<String> violations = new ArrayList<>();
        for (Field field : fields.values()) {
            Object value = document.get(field.name());
            if (value == null) {
                if (field.required()) {
                    violations.add(String.format("Path `%s` is required.", field.name()));
                }
            } else if (!field.type().accepts(value)) {
                violations.add(String.format("Path `%s` expects a %s but got %s.",
                        field.name(), field.type().name().toLowerCase(), value.getClass().getSimpleName()));
            }
        }
        return violations;
    }

    public record Field(String name, FieldType type, boolean required, boolean unique) {
    }

    public enum FieldType {
        STRING,
        NUMBER,
        BOOLEAN,
        DATE,
        ARRAY,
        OBJECT,
        ANY;

        boolean accepts(Object value) {
            switch (this) {
                case STRING:
                    return value instanceof CharSequence;
                case NUMBER:
                    return value instanceof Number;
                case BOOLEAN:
                    return value instanceof Boolean;
                case DATE:
                    return value instanceof Instant || value instanceof Date || isIsoInstant(value);
                case ARRAY:
                    return value instanceof Collection || value.getClass().isArray();
                case OBJECT:
                    return value instanceof Map;
                default:
                    return true;
            }
        }

        private static boolean isIsoInstant(Object value) {
            if (!(value instanceof String)) {
                return false;
            }
            try {
                Instant.parse((String) value);
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }
    }

    public static class Builder {
        private final Map<String, Field> fields = new LinkedHashMap<>();

        public Builder field(String name, FieldType type) {
            return add(new Field(name, type, false, false));
        }

        public Builder required(String name, FieldType type) {
            return add(new Field(name, type, true, false));
        }

        public Builder unique(String name, FieldType type) {
            return add(new Field(name, type, true, true));
        }

        public Builder add(Field field) {
            this.fields.put(field.name(), field);
            return this;
        }

        public Schema build() {
            return new Schema(new LinkedHashMap<>(fields));
        }
    }
}
