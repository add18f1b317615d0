package com.polydoc.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable map of the entity types a repository persists: one supertype, registered under
 * {@link #DEFAULT}, and any number of named subtypes sharing its collection.
 * <p>
 * Subtype names double as the discriminator values written on subtype documents.
 *
 * @param <T> the entity family
 */
public final class TypeRegistry<T extends Entity> {
    public static final String DEFAULT = "Default";

    private final Entry<T> supertype;
    private final Map<String, Entry<T>> subtypes;

    public TypeRegistry(Map<String, ? extends EntityType<? extends T>> typeMap) {
        this(typeMap, null);
    }

    /**
     * @param typeMap   supertype under {@link #DEFAULT} plus subtypes keyed by name
     * @param modelName name used for the supertype when it has neither a class nor an explicit name
     * @throws InvalidArgumentException if the supertype is missing or nameless, or a subtype has no class
     */
    public TypeRegistry(Map<String, ? extends EntityType<? extends T>> typeMap, String modelName) {
        if (typeMap == null || typeMap.get(DEFAULT) == null) {
            throw new InvalidArgumentException("The given map must include domain supertype data");
        }
        EntityType<? extends T> supertypeData = typeMap.get(DEFAULT);
        String supertypeName = supertypeData.resolvedName();
        if (isBlank(supertypeName)) {
            supertypeName = modelName;
        }
        if (isBlank(supertypeName)) {
            throw new InvalidArgumentException(
                    "Either a base class must be provided or the model name must be specified in the options");
        }
        this.supertype = new Entry<>(supertypeName, supertypeData.type(), supertypeData.schema());

        Map<String, Entry<T>> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends EntityType<? extends T>> entry : typeMap.entrySet()) {
            if (DEFAULT.equals(entry.getKey())) {
                continue;
            }
            EntityType<? extends T> subtype = entry.getValue();
            if (subtype == null || subtype.type() == null) {
                throw new InvalidArgumentException(
                        String.format("The subtype %s must declare an instantiable class", entry.getKey()));
            }
            if (entry.getKey().equals(supertypeName)) {
                throw new InvalidArgumentException(
                        String.format("The subtype name %s clashes with the supertype name", entry.getKey()));
            }
            entries.put(entry.getKey(), new Entry<>(entry.getKey(), subtype.type(), subtype.schema()));
        }
        this.subtypes = Collections.unmodifiableMap(entries);
    }

    public Optional<Entry<T>> resolve(String name) {
        if (supertype.name().equals(name)) {
            return Optional.of(supertype);
        }
        return Optional.ofNullable(subtypes.get(name));
    }

    public Entry<T> supertype() {
        return supertype;
    }

    public String supertypeName() {
        return supertype.name();
    }

    public Optional<Class<? extends T>> supertypeConstructor() {
        return Optional.ofNullable(supertype.type());
    }

    public List<Entry<T>> subtypeEntries() {
        return new ArrayList<>(subtypes.values());
    }

    public boolean contains(String name) {
        return name != null && (supertype.name().equals(name) || subtypes.containsKey(name));
    }

    /**
     * Finds the name an exact runtime class is registered under. Subclasses of a registered class
     * are not matched.
     */
    public Optional<String> nameOf(Class<?> type) {
        if (type == null) {
            return Optional.empty();
        }
        if (type.equals(supertype.type())) {
            return Optional.of(supertype.name());
        }
        return subtypes.values().stream()
                .filter(entry -> entry.type().equals(type))
                .map(Entry::name)
                .findFirst();
    }

    public boolean isSubtype(String name) {
        return subtypes.containsKey(name);
    }

    /**
     * The schema documents of the named type are validated against: the supertype schema, extended
     * by the subtype's own fields for subtypes.
     */
    public Schema schemaOf(String name) {
        Entry<T> subtype = subtypes.get(name);
        if (subtype == null) {
            return supertype.schema();
        }
        return supertype.schema().extend(subtype.schema());
    }

    public boolean isAuditable(String name) {
        return resolve(name).map(Entry::isAuditable).orElse(false);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record Entry<T extends Entity>(String name, Class<? extends T> type, Schema schema) {
        public boolean isAuditable() {
            return type != null && Auditable.class.isAssignableFrom(type);
        }
    }
}
