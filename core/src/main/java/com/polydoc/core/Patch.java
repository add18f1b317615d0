package com.polydoc.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A sparse update of a stored entity. Only the fields set on the patch are written; a field set to
 * {@code null} is written as {@code null}, a field never set is left as stored.
 */
public final class Patch {
    private final String id;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private Patch(String id) {
        this.id = id;
    }

    public static Patch of(String id) {
        return new Patch(id);
    }

    public Patch set(String field, Object value) {
        if (field == null || field.isBlank()) {
            throw new InvalidArgumentException("A patched field must have a name");
        }
        if (DocumentCodec.ID.equals(field) || DocumentCodec.DISCRIMINATOR_KEY.equals(field)) {
            throw new InvalidArgumentException(String.format("The field '%s' cannot be patched", field));
        }
        fields.put(field, value);
        return this;
    }

    public String id() {
        return id;
    }

    public boolean isSet(String field) {
        return fields.containsKey(field);
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return "Patch{id=" + id + ", fields=" + fields + "}";
    }
}
