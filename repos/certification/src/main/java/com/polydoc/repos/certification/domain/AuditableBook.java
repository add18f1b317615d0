package com.polydoc.repos.certification.domain;

import java.time.Instant;

public record AuditableBook(String id,
                            String title,
                            String description,
                            String isbn,
                            Long version,
                            Instant createdAt,
                            String createdBy,
                            Instant updatedAt,
                            String updatedBy)
        implements AuditablePublication {

    public AuditableBook(String title, String description, String isbn) {
        this(null, title, description, isbn, null, null, null, null, null);
    }

    public AuditableBook withDescription(String description) {
        return new AuditableBook(id, title, description, isbn, version, createdAt, createdBy, updatedAt, updatedBy);
    }
}
