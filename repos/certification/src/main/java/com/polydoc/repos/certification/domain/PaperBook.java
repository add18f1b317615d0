package com.polydoc.repos.certification.domain;

public record PaperBook(String id, String title, String description, String isbn, Integer edition, boolean deleted)
        implements Publication {

    public PaperBook(String title, String description, String isbn, Integer edition) {
        this(null, title, description, isbn, edition, false);
    }

    public PaperBook withEdition(Integer edition) {
        return new PaperBook(id, title, description, isbn, edition, deleted);
    }
}
