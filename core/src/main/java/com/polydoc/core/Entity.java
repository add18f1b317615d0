package com.polydoc.core;

/**
 * A domain object eligible for persistence.
 * <p>
 * The id is {@code null} until the entity has been stored for the first time and never changes
 * afterwards.
 */
public interface Entity {
    String id();

    default boolean sameIdentityAs(Entity other) {
        if (other == null || id() == null || other.id() == null) {
            return false;
        }
        return id().equals(other.id());
    }
}
