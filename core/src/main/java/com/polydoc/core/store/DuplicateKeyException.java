package com.polydoc.core.store;

/**
 * A write would have stored a value already taken in a unique field.
 */
public class DuplicateKeyException extends StoreException {
    private final String field;

    public DuplicateKeyException(String collection, String field, Object value) {
        super(String.format("duplicate key error collection: %s index: %s dup key: { %s: \"%s\" }",
                collection, field, field, value));
        this.field = field;
    }

    public DuplicateKeyException(String message, String field, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
