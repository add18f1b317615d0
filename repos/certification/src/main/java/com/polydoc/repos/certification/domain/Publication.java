package com.polydoc.repos.certification.domain;

import com.polydoc.core.Entity;

/**
 * Fields shared by every kind of book stored in the book collection.
 */
public interface Publication extends Entity {
    String title();

    String description();

    String isbn();

    boolean deleted();
}
