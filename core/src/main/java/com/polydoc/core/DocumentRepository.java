package com.polydoc.core;

import com.polydoc.core.query.Filter;
import com.polydoc.core.query.Pageable;
import com.polydoc.core.store.CollectionDefinition;
import com.polydoc.core.store.DocumentCollection;
import com.polydoc.core.store.DocumentStore;
import com.polydoc.core.store.DocumentValidationException;
import com.polydoc.core.store.DuplicateKeyException;
import com.polydoc.core.store.Query;
import com.polydoc.core.store.Session;
import com.polydoc.core.store.StoreException;
import com.polydoc.core.store.TransactionConflictException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.polydoc.core.DocumentCodec.DISCRIMINATOR_KEY;
import static com.polydoc.core.DocumentCodec.ID;

/**
 * Base class of repositories storing a polymorphic entity family in one collection.
 * <p>
 * Subclasses pass their type map to the constructor and may add domain queries on top of
 * {@link #collection()} and {@link #instantiateFrom(Document)}.
 *
 * @param <T> the entity family
 */
public abstract class DocumentRepository<T extends Entity> implements Repository<T> {
    private static final Logger logger = LoggerFactory.getLogger(DocumentRepository.class);

    private static final List<String> AUDIT_FIELDS = List.of(
            Auditable.VERSION, Auditable.CREATED_AT, Auditable.CREATED_BY, Auditable.UPDATED_AT, Auditable.UPDATED_BY);

    private final TypeRegistry<T> typeRegistry;
    private final DocumentCodec<T> codec;
    private final DocumentCollection collection;
    private final TransactionCoordinator coordinator;

    protected DocumentRepository(Map<String, ? extends EntityType<? extends T>> typeMap, DocumentStore store) {
        this(typeMap, store, RepositoryOptions.defaults());
    }

    /**
     * @param typeMap supertype under {@link TypeRegistry#DEFAULT} plus named subtypes
     * @param store   store holding the collection
     * @param options collection and model name overrides
     * @throws InvalidArgumentException if the type map is incomplete or no model name can be resolved
     */
    protected DocumentRepository(Map<String, ? extends EntityType<? extends T>> typeMap,
                                 DocumentStore store,
                                 RepositoryOptions options) {
        if (store == null) {
            throw new InvalidArgumentException("A document store must be provided");
        }
        RepositoryOptions resolved = options != null ? options : RepositoryOptions.defaults();
        this.typeRegistry = new TypeRegistry<>(typeMap, resolved.modelName());
        this.codec = new DocumentCodec<>(typeRegistry);
        this.collection = store.collection(definitionOf(typeRegistry, resolved));
        this.coordinator = new TransactionCoordinator(store);
    }

    private static CollectionDefinition definitionOf(TypeRegistry<?> registry, RepositoryOptions options) {
        Map<String, Schema> subtypeSchemas = new LinkedHashMap<>();
        for (TypeRegistry.Entry<?> subtype : registry.subtypeEntries()) {
            subtypeSchemas.put(subtype.name(), registry.schemaOf(subtype.name()));
        }
        return new CollectionDefinition(
                options.collectionNameFor(registry.supertypeName()),
                registry.supertypeName(),
                DISCRIMINATOR_KEY,
                registry.supertype().schema(),
                subtypeSchemas);
    }

    protected DocumentCollection collection() {
        return collection;
    }

    protected DocumentCodec<T> codec() {
        return codec;
    }

    protected TypeRegistry<T> typeRegistry() {
        return typeRegistry;
    }

    protected TransactionCoordinator coordinator() {
        return coordinator;
    }

    /**
     * Instantiates the entity a stored document represents, {@code null} for a {@code null} document.
     *
     * @throws UnregisteredConstructorException if the document's type is not registered
     */
    protected <S extends T> S instantiateFrom(Document document) {
        return codec.hydrate(document);
    }

    @Override
    public <S extends T> Optional<S> findById(String id, OperationOptions options) {
        if (isBlank(id)) {
            throw new InvalidArgumentException("The given ID must be valid");
        }
        return collection.findById(sessionOf(options), id)
                .map(document -> this.<S>instantiateFrom(document));
    }

    @Override
    public <S extends T> Optional<S> findOne(Filter filters, OperationOptions options) {
        Filter filter = options != null && options.filters() != null ? options.filters() : filters;
        if (filter == null) {
            throw new InvalidArgumentException("Missing search criteria (filters)");
        }
        return collection.findOne(sessionOf(options), filter)
                .map(document -> this.<S>instantiateFrom(document));
    }

    @Override
    public <S extends T> List<S> findAll(OperationOptions options) {
        OperationOptions resolved = orNone(options);
        Pageable pageable = resolved.pageable();
        if (pageable != null && pageable.pageNumber() < 0) {
            throw new InvalidArgumentException("The given page number must be a positive number");
        }
        if (pageable != null && pageable.offset() < 0) {
            throw new InvalidArgumentException("The given page offset must be a positive number");
        }

        long skip = pageable != null ? pageable.skip() : 0L;
        if (skip > Integer.MAX_VALUE) {
            logger.debug("Page {} of {} lies past any collection size, nothing to find",
                    pageable.pageNumber(), collection.name());
            return List.of();
        }
        Query query = new Query(
                resolved.filters(),
                resolved.sortBy(),
                (int) skip,
                pageable != null ? pageable.limit() : 0);
        List<Document> documents;
        try {
            documents = collection.find(resolved.session(), query);
        } catch (TransactionConflictException e) {
            throw e;
        } catch (StoreException e) {
            throw new InvalidArgumentException("The given optional parameters must be valid", e);
        }
        return documents.stream()
                .map(document -> this.<S>instantiateFrom(document))
                .collect(Collectors.toList());
    }

    @Override
    public <S extends T> S save(S entity, OperationOptions options) {
        if (entity == null) {
            throw new InvalidArgumentException("The given entity must be valid");
        }
        OperationOptions resolved = orNone(options);
        if (isBlank(entity.id())) {
            try {
                return rejectingInvalidData(() -> insert(entity, resolved));
            } catch (UnregisteredConstructorException e) {
                throw new InvalidArgumentException(notIncluded(entity.getClass()), e);
            }
        }
        return rejectingInvalidData(() -> update(entity.id(), changesOf(entity), resolved));
    }

    @Override
    public <S extends T> S save(Patch patch, OperationOptions options) {
        if (patch == null) {
            throw new InvalidArgumentException("The given entity must be valid");
        }
        if (isBlank(patch.id())) {
            throw new InvalidArgumentException("The given patch must specify the ID of the entity to update");
        }
        OperationOptions resolved = orNone(options);
        return rejectingInvalidData(() -> update(patch.id(), new Document(patch.fields()), resolved));
    }

    @Override
    public boolean deleteById(String id, OperationOptions options) {
        if (isBlank(id)) {
            throw new InvalidArgumentException("The given ID must be valid");
        }
        boolean deleted = collection.deleteById(sessionOf(options), id);
        logger.debug("Delete of {} from {} removed a document: {}", id, collection.name(), deleted);
        return deleted;
    }

    /**
     * Inserts a new entity, stamping audit fields when its type is auditable.
     *
     * @throws InvalidArgumentException if the entity is {@code null} or its class is not registered
     */
    protected <S extends T> S insert(S entity, OperationOptions options) {
        if (entity == null) {
            throw new InvalidArgumentException("The given entity must be valid");
        }
        String typeName = typeRegistry.nameOf(entity.getClass())
                .filter(typeRegistry::contains)
                .orElseThrow(() -> new InvalidArgumentException(notIncluded(entity.getClass())));

        Document document = codec.dehydrate(entity);
        document.remove(ID);
        if (typeRegistry.isAuditable(typeName)) {
            AUDIT_FIELDS.forEach(document::remove);
            Instant now = now();
            document.put(Auditable.VERSION, 0L);
            document.put(Auditable.CREATED_AT, now);
            document.put(Auditable.UPDATED_AT, now);
            if (options.userId() != null) {
                document.put(Auditable.CREATED_BY, options.userId());
                document.put(Auditable.UPDATED_BY, options.userId());
            }
        }

        Document stored = collection.insert(options.session(), document);
        logger.debug("Inserted {} with ID {} into {}", typeName, stored.get(ID), collection.name());
        return instantiateFrom(stored);
    }

    /**
     * Writes {@code changes} over the stored document with the given id. Keys absent from
     * {@code changes} keep their stored values. Auditable documents get their version bumped by one
     * and the write only succeeds if the stored version is unchanged in the meantime.
     *
     * @throws InvalidArgumentException if no document has the given id
     * @throws ValidationException      if the document was modified concurrently
     */
    protected <S extends T> S update(String id, Document changes, OperationOptions options) {
        Session session = options.session();
        Document stored = collection.findById(session, id)
                .orElseThrow(() -> new InvalidArgumentException(noDocumentMatching(id)));

        String typeName = codec.typeNameOf(stored);
        boolean auditable = typeRegistry.isAuditable(typeName);
        changes.remove(ID);
        changes.remove(DISCRIMINATOR_KEY);
        if (auditable) {
            AUDIT_FIELDS.forEach(changes::remove);
        }
        List<String> undeclared = changes.keySet().stream()
                .filter(field -> !isDeclared(typeName, field))
                .collect(Collectors.toList());
        if (!undeclared.isEmpty()) {
            logger.debug("Dropping fields {} not declared by {}", undeclared, typeName);
            undeclared.forEach(changes::remove);
        }

        Document merged = new Document(stored);
        merged.putAll(changes);
        Long expectedVersion = null;
        if (auditable) {
            expectedVersion = versionOf(stored);
            merged.put(Auditable.VERSION, (expectedVersion != null ? expectedVersion : 0L) + 1);
            merged.put(Auditable.UPDATED_AT, now());
            if (options.userId() != null) {
                merged.put(Auditable.UPDATED_BY, options.userId());
            }
        }

        if (!collection.replace(session, id, expectedVersion, merged)) {
            if (auditable) {
                throw new ValidationException(
                        String.format("The entity with ID '%s' was modified concurrently", id), null);
            }
            throw new InvalidArgumentException(noDocumentMatching(id));
        }
        logger.debug("Updated {} with ID {} in {}", typeName, id, collection.name());
        return instantiateFrom(merged);
    }

    /**
     * Whether updates of documents of the given type may write {@code field}: the field is part of
     * the type's effective schema or a property of its class. Other fields are dropped from updates.
     */
    protected boolean isDeclared(String typeName, String field) {
        return typeRegistry.schemaOf(typeName).declares(field) || codec.propertiesOf(typeName).contains(field);
    }

    private Document changesOf(T entity) {
        return codec.dehydrate(entity);
    }

    private static <R> R rejectingInvalidData(Supplier<R> write) {
        try {
            return write.get();
        } catch (DocumentValidationException | DuplicateKeyException e) {
            throw new ValidationException(
                    "One or more fields of the given entity do not specify valid values: " + e.getMessage(), e);
        }
    }

    private static Long versionOf(Document document) {
        Object version = document.get(Auditable.VERSION);
        return version instanceof Number ? ((Number) version).longValue() : null;
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String notIncluded(Class<?> type) {
        return String.format("The entity with name %s is not included in the setup of the repository",
                type.getSimpleName());
    }

    private static String noDocumentMatching(String id) {
        return String.format("There is no document matching the given ID '%s'", id);
    }

    private static Session sessionOf(OperationOptions options) {
        return options != null ? options.session() : null;
    }

    private static OperationOptions orNone(OperationOptions options) {
        return options != null ? options : OperationOptions.none();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
