package com.polydoc.core;

/**
 * The store rejected the data of a write, e.g. a schema violation or a duplicate unique value.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
