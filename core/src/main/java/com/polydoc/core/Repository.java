package com.polydoc.core;

import com.polydoc.core.query.Filter;

import java.util.List;
import java.util.Optional;

/**
 * Stores and retrieves the members of one entity family.
 *
 * @param <T> the entity family
 */
public interface Repository<T extends Entity> {

    /**
     * @throws InvalidArgumentException if the id is {@code null} or empty
     */
    <S extends T> Optional<S> findById(String id, OperationOptions options);

    default <S extends T> Optional<S> findById(String id) {
        return findById(id, OperationOptions.none());
    }

    /**
     * Finds the first entity matching {@code options.filters()} or, when absent, {@code filters}.
     *
     * @throws InvalidArgumentException if neither predicate is given
     */
    <S extends T> Optional<S> findOne(Filter filters, OperationOptions options);

    default <S extends T> Optional<S> findOne(Filter filters) {
        return findOne(filters, OperationOptions.none());
    }

    /**
     * Finds the entities matching {@code options.filters()}, ordered by {@code options.sortBy()}
     * and restricted to {@code options.pageable()}.
     *
     * @throws InvalidArgumentException if the page number or offset is negative, or the store
     *                                  rejects the query
     */
    <S extends T> List<S> findAll(OperationOptions options);

    default <S extends T> List<S> findAll() {
        return findAll(OperationOptions.none());
    }

    /**
     * Inserts the entity when it has no id, otherwise updates the stored entity with its non-null fields.
     *
     * @throws InvalidArgumentException if the entity is {@code null}, its type is not part of this
     *                                  repository, or its id matches no stored entity
     * @throws ValidationException      if the store rejects the resulting document
     */
    <S extends T> S save(S entity, OperationOptions options);

    default <S extends T> S save(S entity) {
        return save(entity, OperationOptions.none());
    }

    /**
     * Applies the fields of a patch to the stored entity it names.
     *
     * @throws InvalidArgumentException if the patch is {@code null} or names no stored entity
     * @throws ValidationException      if the store rejects the resulting document
     */
    <S extends T> S save(Patch patch, OperationOptions options);

    default <S extends T> S save(Patch patch) {
        return save(patch, OperationOptions.none());
    }

    /**
     * Physically removes an entity.
     *
     * @return {@code true} if an entity was removed
     * @throws InvalidArgumentException if the id is {@code null} or empty
     */
    boolean deleteById(String id, OperationOptions options);

    default boolean deleteById(String id) {
        return deleteById(id, OperationOptions.none());
    }
}
