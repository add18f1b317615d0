package com.polydoc.repos.certification.domain;

import java.time.Instant;

public record AuditablePaperBook(String id,
                                 String title,
                                 String description,
                                 String isbn,
                                 Integer edition,
                                 Long version,
                                 Instant createdAt,
                                 String createdBy,
                                 Instant updatedAt,
                                 String updatedBy)
        implements AuditablePublication {

    public AuditablePaperBook(String title, String description, String isbn, Integer edition) {
        this(null, title, description, isbn, edition, null, null, null, null, null);
    }
}
