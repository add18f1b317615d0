package com.polydoc.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.bson.Document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Converts between entities and stored documents, using the discriminator key to pick the concrete
 * type of a document on the way back.
 *
 * @param <T> the entity family
 */
public class DocumentCodec<T extends Entity> {
    public static final String DISCRIMINATOR_KEY = "__t";
    public static final String ID = "id";

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final TypeRegistry<T> registry;
    private final ObjectMapper mapper;
    private final Map<String, Set<String>> properties = new ConcurrentHashMap<>();

    public DocumentCodec(TypeRegistry<T> registry) {
        this(registry, defaultMapper());
    }

    public DocumentCodec(TypeRegistry<T> registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    /**
     * Mapper used when none is supplied: ISO-8601 dates, nulls left out of documents, unknown
     * document keys ignored when binding.
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    public TypeRegistry<T> registry() {
        return registry;
    }

    /**
     * Instantiates the entity a stored document represents.
     *
     * @param document the stored document, {@code null} when nothing was found
     * @return the entity, or {@code null} for a {@code null} document
     * @throws UnregisteredConstructorException if no registered class can be instantiated for the document
     */
    @SuppressWarnings("unchecked")
    public <S extends T> S hydrate(Document document) {
        if (document == null) {
            return null;
        }
        String typeName = typeNameOf(document);
        Class<? extends T> type = registry.resolve(typeName)
                .map(TypeRegistry.Entry::type)
                .orElse(null);
        if (type == null) {
            throw new UnregisteredConstructorException(String.format(
                    "There is no registered instance constructor for the document with ID %s", document.get(ID)));
        }

        Map<String, Object> fields = new LinkedHashMap<>(document);
        fields.remove(DISCRIMINATOR_KEY);
        try {
            return (S) mapper.convertValue(fields, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(String.format(
                    "The document with ID %s cannot be bound to %s", document.get(ID), type.getSimpleName()), e);
        }
    }

    /**
     * Prepares an entity for storage. Subtype instances are stamped with their discriminator
     * unless the entity already carries one; {@code null} fields are left out.
     */
    public Document dehydrate(T entity) {
        Document document = new Document(mapper.convertValue(entity, FIELDS));
        registry.nameOf(entity.getClass())
                .filter(registry::isSubtype)
                .ifPresent(name -> document.putIfAbsent(DISCRIMINATOR_KEY, name));
        return document;
    }

    /**
     * Names of the properties the class registered under {@code typeName} binds, empty when the
     * type has no class.
     */
    public Set<String> propertiesOf(String typeName) {
        return properties.computeIfAbsent(typeName, name -> registry.resolve(name)
                .map(TypeRegistry.Entry::type)
                .map(type -> mapper.getSerializationConfig()
                        .introspect(mapper.constructType(type))
                        .findProperties()
                        .stream()
                        .map(BeanPropertyDefinition::getName)
                        .collect(Collectors.toUnmodifiableSet()))
                .orElse(Set.of()));
    }

    /**
     * The registry name a document belongs to: its discriminator, or the supertype name when it has none.
     */
    public String typeNameOf(Document document) {
        Object discriminator = document.get(DISCRIMINATOR_KEY);
        return discriminator != null ? discriminator.toString() : registry.supertypeName();
    }
}
