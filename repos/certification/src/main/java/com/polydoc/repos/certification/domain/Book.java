package com.polydoc.repos.certification.domain;

public record Book(String id, String title, String description, String isbn, boolean deleted)
        implements Publication {

    public Book(String title, String description, String isbn) {
        this(null, title, description, isbn, false);
    }

    public Book withTitle(String title) {
        return new Book(id, title, description, isbn, deleted);
    }
}
