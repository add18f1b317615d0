package com.polydoc.core;

/**
 * A member of a repository's type map: the class documents are hydrated into and the schema they
 * are stored with.
 * <p>
 * A supertype may be abstract, in which case it has no class and must be given a name.
 *
 * @param type   concrete class, {@code null} for an abstract supertype
 * @param name   explicit name, {@code null} to use the class name
 * @param schema document schema
 */
public record EntityType<S extends Entity>(Class<S> type, String name, Schema schema) {

    public EntityType {
        if (schema == null) {
            throw new InvalidArgumentException("An entity type must declare a schema");
        }
    }

    public static <S extends Entity> EntityType<S> of(Class<S> type, Schema schema) {
        return new EntityType<>(type, null, schema);
    }

    public static <S extends Entity> EntityType<S> named(String name, Schema schema) {
        return new EntityType<>(null, name, schema);
    }

    public String resolvedName() {
        if (type != null) {
            return type.getSimpleName();
        }
        return name;
    }
}
