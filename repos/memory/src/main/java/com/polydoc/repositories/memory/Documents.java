package com.polydoc.repositories.memory;

import com.polydoc.core.query.Sort;
import org.bson.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Helpers for documents held in memory: deep copies, dotted path lookups and the value ordering
 * used by sorts and range filters.
 */
final class Documents {
    private static final Object MISSING = new Object();

    private Documents() {
    }

    static Document copy(Document document) {
        Document copy = new Document();
        document.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            Document nested = new Document();
            ((Map<String, Object>) value).forEach((key, inner) -> nested.put(key, copyValue(inner)));
            return nested;
        }
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                list.add(copyValue(element));
            }
            return list;
        }
        return value;
    }

    /**
     * @return the value at a dotted path, {@code null} when any segment is missing
     */
    static Object valueAt(Document document, String path) {
        Object value = lookup(document, path);
        return value == MISSING ? null : value;
    }

    static boolean hasPath(Document document, String path) {
        return lookup(document, path) != MISSING;
    }

    private static Object lookup(Document document, String path) {
        Object current = document;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map) || !((Map<?, ?>) current).containsKey(segment)) {
                return MISSING;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current;
    }

    static Comparator<Document> comparator(Sort sort) {
        Comparator<Document> comparator = (left, right) -> 0;
        for (Sort.Order order : sort.orders()) {
            Comparator<Document> byField = (left, right) ->
                    compareValues(valueAt(left, order.field()), valueAt(right, order.field()));
            comparator = comparator.thenComparing(order.direction() == Sort.Direction.DESC ? byField.reversed() : byField);
        }
        return comparator;
    }

    /**
     * Orders values by kind first (null, numbers, strings, documents, arrays, booleans, dates), then
     * by value within a kind.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareValues(Object left, Object right) {
        int byKind = Integer.compare(rank(left), rank(right));
        if (byKind != 0) {
            return byKind;
        }
        if (left == null) {
            return 0;
        }
        if (left instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (rank(left) == 6) {
            return toInstant(left).compareTo(toInstant(right));
        }
        if (left instanceof Comparable && left.getClass().equals(right.getClass())) {
            return ((Comparable) left).compareTo(right);
        }
        return left.toString().compareTo(right.toString());
    }

    static boolean sameKind(Object left, Object right) {
        return rank(left) == rank(right);
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compareValues(left, right) == 0;
        }
        if (rank(left) == 6 && rank(right) == 6) {
            return toInstant(left).equals(toInstant(right));
        }
        return left == null ? right == null : left.equals(right);
    }

    private static int rank(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return 1;
        }
        if (value instanceof CharSequence) {
            return 2;
        }
        if (value instanceof Map) {
            return 3;
        }
        if (value instanceof Collection) {
            return 4;
        }
        if (value instanceof Boolean) {
            return 5;
        }
        if (value instanceof Date || value instanceof Instant) {
            return 6;
        }
        return 7;
    }

    private static Instant toInstant(Object value) {
        return value instanceof Date ? ((Date) value).toInstant() : (Instant) value;
    }
}
