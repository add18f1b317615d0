package com.polydoc.core.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordering applied to the results of a find. Earlier orders take precedence.
 */
public record Sort(List<Order> orders) {

    public Sort {
        orders = List.copyOf(orders);
    }

    public static Sort ascending(String... fields) {
        return of(Direction.ASC, fields);
    }

    public static Sort descending(String... fields) {
        return of(Direction.DESC, fields);
    }

    public Sort and(Sort other) {
        List<Order> combined = new ArrayList<>(orders);
        combined.addAll(other.orders);
        return new Sort(combined);
    }

    private static Sort of(Direction direction, String... fields) {
        List<Order> orders = new ArrayList<>();
        for (String field : fields) {
            orders.add(new Order(field, direction));
        }
        return new Sort(orders);
    }

    public enum Direction {
        ASC, DESC
    }

    public record Order(String field, Direction direction) {
    }
}
