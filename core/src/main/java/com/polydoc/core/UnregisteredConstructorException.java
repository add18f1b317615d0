package com.polydoc.core;

/**
 * A stored document names a type that the running type map cannot instantiate.
 */
public class UnregisteredConstructorException extends RuntimeException {
    public UnregisteredConstructorException(String message) {
        super(message);
    }
}
