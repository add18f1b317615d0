package com.polydoc.core;

import com.polydoc.core.query.Filter;

import java.util.Collection;
import java.util.List;

/**
 * A repository whose multi-entity operations are atomic.
 *
 * @param <T> the entity family
 */
public interface TransactionalRepository<T extends Entity> extends Repository<T> {

    /**
     * Saves every entity in one transaction. Either all of them are saved or none is.
     */
    <S extends T> List<S> saveAll(Collection<? extends S> entities, OperationOptions options);

    default <S extends T> List<S> saveAll(Collection<? extends S> entities) {
        return saveAll(entities, OperationOptions.none());
    }

    /**
     * Marks every entity matching {@code options.filters()} as deleted in one transaction.
     *
     * @return the number of entities marked
     * @throws InvalidArgumentException if {@code options.filters()} is {@code null}
     */
    int deleteAll(OperationOptions options);

    default int deleteAll() {
        return deleteAll(OperationOptions.builder().filters(Filter.all()).build());
    }
}
