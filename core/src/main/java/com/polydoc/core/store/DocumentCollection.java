package com.polydoc.core.store;

import com.polydoc.core.query.Filter;
import org.bson.Document;

import java.util.List;
import java.util.Optional;

/**
 * CRUD access to one collection. Every operation takes an optional session: {@code null} runs the
 * operation standalone, otherwise it runs inside the session's transaction.
 * <p>
 * Documents carry their identifier under {@code id}.
 */
public interface DocumentCollection {
    String name();

    /**
     * Validates and stores a new document, generating its id when it has none.
     *
     * @return the stored document, id included
     * @throws DocumentValidationException if the document violates its schema
     * @throws DuplicateKeyException       if a unique field value is already taken
     */
    Document insert(Session session, Document document);

    Optional<Document> findById(Session session, String id);

    Optional<Document> findOne(Session session, Filter filter);

    List<Document> find(Session session, Query query);

    /**
     * Validates and replaces a stored document.
     *
     * @param expectedVersion when not {@code null}, the replacement only happens if the stored
     *                        document still has this version
     * @return {@code false} when no document matched the id (and version)
     */
    boolean replace(Session session, String id, Long expectedVersion, Document document);

    boolean deleteById(Session session, String id);
}
