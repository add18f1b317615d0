package com.polydoc.core.store;

import com.polydoc.core.query.Filter;
import com.polydoc.core.query.Sort;

/**
 * A find request against a collection.
 *
 * @param filter predicate, {@code null} for every document
 * @param sort   ordering, {@code null} for storage order
 * @param skip   documents to skip
 * @param limit  maximum documents to return, 0 for no limit
 */
public record Query(Filter filter, Sort sort, int skip, int limit) {
    public static Query of(Filter filter) {
        return new Query(filter, null, 0, 0);
    }
}
