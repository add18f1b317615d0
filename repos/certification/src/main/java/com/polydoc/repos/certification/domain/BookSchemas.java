package com.polydoc.repos.certification.domain;

import com.polydoc.core.Schema;

import static com.polydoc.core.Schema.FieldType.ARRAY;
import static com.polydoc.core.Schema.FieldType.BOOLEAN;
import static com.polydoc.core.Schema.FieldType.NUMBER;
import static com.polydoc.core.Schema.FieldType.STRING;

public final class BookSchemas {
    public static final Schema BOOK = Schema.builder()
            .required("title", STRING)
            .required("description", STRING)
            .unique("isbn", STRING)
            .field("deleted", BOOLEAN)
            .build();

    public static final Schema DRAFT_BOOK = Schema.builder()
            .required("title", STRING)
            .field("description", STRING)
            .unique("isbn", STRING)
            .field("deleted", BOOLEAN)
            .build();

    public static final Schema PAPER_BOOK = Schema.builder()
            .required("edition", NUMBER)
            .build();

    public static final Schema AUDIO_BOOK = Schema.builder()
            .required("hostingPlatforms", ARRAY)
            .field("format", STRING)
            .build();

    public static final Schema ELECTRONIC_BOOK = Schema.builder()
            .required("extension", STRING)
            .build();

    public static final Schema AUDITABLE_BOOK = Schema.builder()
            .required("title", STRING)
            .field("description", STRING)
            .unique("isbn", STRING)
            .build();

    public static final Schema AUDITABLE_PAPER_BOOK = Schema.builder()
            .required("edition", NUMBER)
            .build();

    private BookSchemas() {
    }
}
