package com.polydoc.core.store;

import java.util.List;

/**
 * A document did not satisfy its schema.
 */
public class DocumentValidationException extends StoreException {
    private final List<String> violations;

    public DocumentValidationException(String modelName, List<String> violations) {
        super(String.format("%s validation failed: %s", modelName, String.join(" ", violations)));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
