package com.polydoc.repos.certification.domain;

import java.util.List;

public record AudioBook(String id,
                        String title,
                        String description,
                        String isbn,
                        List<String> hostingPlatforms,
                        String format,
                        boolean deleted)
        implements Publication {

    public AudioBook(String title, String description, String isbn, List<String> hostingPlatforms, String format) {
        this(null, title, description, isbn, hostingPlatforms, format, false);
    }
}
