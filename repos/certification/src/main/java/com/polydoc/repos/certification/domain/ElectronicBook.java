package com.polydoc.repos.certification.domain;

/**
 * A publication that {@link BookRepository} is not set up to store.
 */
public record ElectronicBook(String id, String title, String description, String isbn, String extension, boolean deleted)
        implements Publication {

    public ElectronicBook(String title, String description, String isbn, String extension) {
        this(null, title, description, isbn, extension, false);
    }
}
