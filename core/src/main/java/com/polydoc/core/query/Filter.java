package com.polydoc.core.query;

import java.util.Arrays;
import java.util.List;

/**
 * A predicate over stored documents. Field names may be dotted paths into nested documents; the
 * field {@code id} addresses the document identifier.
 * <p>
 * Stores translate filters into their own query language.
 */
public interface Filter {

    static Filter all() {
        return new All();
    }

    static Filter eq(String field, Object value) {
        return new Eq(field, value);
    }

    static Filter ne(String field, Object value) {
        return new Ne(field, value);
    }

    static Filter in(String field, Object... values) {
        return new In(field, Arrays.asList(values));
    }

    static Filter in(String field, List<?> values) {
        return new In(field, List.copyOf(values));
    }

    static Filter nin(String field, Object... values) {
        return new Nin(field, Arrays.asList(values));
    }

    static Filter gt(String field, Object value) {
        return new Comparison(field, Operator.GT, value);
    }

    static Filter gte(String field, Object value) {
        return new Comparison(field, Operator.GTE, value);
    }

    static Filter lt(String field, Object value) {
        return new Comparison(field, Operator.LT, value);
    }

    static Filter lte(String field, Object value) {
        return new Comparison(field, Operator.LTE, value);
    }

    static Filter exists(String field) {
        return new Exists(field, true);
    }

    static Filter missing(String field) {
        return new Exists(field, false);
    }

    static Filter and(Filter... filters) {
        return new And(List.of(filters));
    }

    static Filter or(Filter... filters) {
        return new Or(List.of(filters));
    }

    static Filter not(Filter filter) {
        return new Not(filter);
    }

    enum Operator {
        GT, GTE, LT, LTE
    }

    record All() implements Filter {
    }

    record Eq(String field, Object value) implements Filter {
    }

    record Ne(String field, Object value) implements Filter {
    }

    record In(String field, List<?> values) implements Filter {
    }

    record Nin(String field, List<?> values) implements Filter {
    }

    record Comparison(String field, Operator operator, Object value) implements Filter {
    }

    record Exists(String field, boolean exists) implements Filter {
    }

    record And(List<Filter> filters) implements Filter {
    }

    record Or(List<Filter> filters) implements Filter {
    }

    record Not(Filter filter) implements Filter {
    }
}
