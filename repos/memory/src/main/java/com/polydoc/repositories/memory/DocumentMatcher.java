package com.polydoc.repositories.memory;

import com.polydoc.core.query.Filter;
import org.bson.Document;

import java.util.Collection;
import java.util.function.Predicate;

import static com.polydoc.repositories.memory.Documents.compareValues;
import static com.polydoc.repositories.memory.Documents.sameKind;
import static com.polydoc.repositories.memory.Documents.valueAt;
import static com.polydoc.repositories.memory.Documents.valuesEqual;

/**
 * Evaluates filters against documents held in memory, following MongoDB query semantics: equality
 * on an array field matches any element, and {@code null} matches a missing field.
 */
final class DocumentMatcher {
    private DocumentMatcher() {
    }

    static boolean matches(Document document, Filter filter) {
        if (filter == null || filter instanceof Filter.All) {
            return true;
        }
        if (filter instanceof Filter.Eq) {
            Filter.Eq eq = (Filter.Eq) filter;
            return anyValue(valueAt(document, eq.field()), value -> valuesEqual(value, eq.value()));
        }
        if (filter instanceof Filter.Ne) {
            Filter.Ne ne = (Filter.Ne) filter;
            return !anyValue(valueAt(document, ne.field()), value -> valuesEqual(value, ne.value()));
        }
        if (filter instanceof Filter.In) {
            Filter.In in = (Filter.In) filter;
            return anyValue(valueAt(document, in.field()), value -> containsValue(in.values(), value));
        }
        if (filter instanceof Filter.Nin) {
            Filter.Nin nin = (Filter.Nin) filter;
            return !anyValue(valueAt(document, nin.field()), value -> containsValue(nin.values(), value));
        }
        if (filter instanceof Filter.Comparison) {
            Filter.Comparison comparison = (Filter.Comparison) filter;
            return anyValue(valueAt(document, comparison.field()), value -> compare(value, comparison));
        }
        if (filter instanceof Filter.Exists) {
            Filter.Exists exists = (Filter.Exists) filter;
            return Documents.hasPath(document, exists.field()) == exists.exists();
        }
        if (filter instanceof Filter.And) {
            return ((Filter.And) filter).filters().stream().allMatch(inner -> matches(document, inner));
        }
        if (filter instanceof Filter.Or) {
            return ((Filter.Or) filter).filters().stream().anyMatch(inner -> matches(document, inner));
        }
        if (filter instanceof Filter.Not) {
            return !matches(document, ((Filter.Not) filter).filter());
        }
        throw new IllegalArgumentException("Unsupported filter: " + filter);
    }

    private static boolean anyValue(Object value, Predicate<Object> predicate) {
        if (predicate.test(value)) {
            return true;
        }
        if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                if (predicate.test(element)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean containsValue(Collection<?> candidates, Object value) {
        for (Object candidate : candidates) {
            if (valuesEqual(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean compare(Object value, Filter.Comparison comparison) {
        if (value == null || comparison.value() == null || !sameKind(value, comparison.value())) {
            return false;
        }
        int result = compareValues(value, comparison.value());
        switch (comparison.operator()) {
            case GT:
                return result > 0;
            case GTE:
                return result >= 0;
            case LT:
                return result < 0;
            default:
                return result <= 0;
        }
    }
}
