package com.polydoc.core.store;

/**
 * A document database able to hold one logical collection per entity family, with
 * discriminator-aware validation and session-scoped transactions.
 */
public interface DocumentStore {
    /**
     * Opens, creating where needed, the collection described by {@code definition}. Unique fields
     * of the definition's schemas are enforced from then on.
     */
    DocumentCollection collection(CollectionDefinition definition);

    Session startSession();
}
