package com.polydoc.core;

import com.polydoc.core.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A {@link DocumentRepository} whose bulk operations run in one transaction each.
 *
 * @param <T> the entity family
 */
public abstract class TransactionalDocumentRepository<T extends Entity>
        extends DocumentRepository<T>
        implements TransactionalRepository<T> {
    private static final Logger logger = LoggerFactory.getLogger(TransactionalDocumentRepository.class);

    /**
     * Document field set by {@link #deleteAll(OperationOptions)}.
     */
    public static final String DELETED = "deleted";

    protected TransactionalDocumentRepository(Map<String, ? extends EntityType<? extends T>> typeMap,
                                              DocumentStore store) {
        super(typeMap, store);
    }

    protected TransactionalDocumentRepository(Map<String, ? extends EntityType<? extends T>> typeMap,
                                              DocumentStore store,
                                              RepositoryOptions options) {
        super(typeMap, store, options);
    }

    @Override
    protected boolean isDeclared(String typeName, String field) {
        return DELETED.equals(field) || super.isDeclared(typeName, field);
    }

    @Override
    public <S extends T> List<S> saveAll(Collection<? extends S> entities, OperationOptions options) {
        if (entities == null) {
            throw new InvalidArgumentException("The given entities must be valid");
        }
        OperationOptions resolved = options != null ? options : OperationOptions.none();
        return coordinator().runInTransaction(session -> {
            OperationOptions inSession = resolved.withSession(session);
            List<S> saved = new ArrayList<>(entities.size());
            for (S entity : entities) {
                saved.add(save(entity, inSession));
            }
            return saved;
        }, resolved);
    }

    @Override
    public int deleteAll(OperationOptions options) {
        if (options == null || options.filters() == null) {
            throw new InvalidArgumentException("Null filters are disallowed");
        }
        int deleted = coordinator().runInTransaction(session -> {
            OperationOptions inSession = options.withSession(session);
            List<T> matching = findAll(OperationOptions.builder()
                    .session(session)
                    .filters(options.filters())
                    .build());
            for (T entity : matching) {
                save(Patch.of(entity.id()).set(DELETED, true), inSession);
            }
            return matching.size();
        }, options);
        logger.debug("Marked {} documents of {} as deleted", deleted, collection().name());
        return deleted;
    }
}
