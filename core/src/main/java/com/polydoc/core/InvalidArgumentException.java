package com.polydoc.core;

/**
 * The caller supplied a structurally invalid request. Always raised before the store is touched.
 */
public class InvalidArgumentException extends IllegalArgumentException {
    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
