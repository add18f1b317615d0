package com.polydoc.core.query;

/**
 * A page request. Page numbers start at 1 and {@code offset} is the page size; a non-positive
 * value in either disables paging.
 */
public record Pageable(int pageNumber, int offset) {

    public static Pageable of(int pageNumber, int offset) {
        return new Pageable(pageNumber, offset);
    }

    public boolean isPaged() {
        return pageNumber > 0 && offset > 0;
    }

    /**
     * Documents before the requested page. Computed as a {@code long} since pages far past the data
     * exceed the {@code int} range.
     */
    public long skip() {
        return isPaged() ? (long) (pageNumber - 1) * offset : 0L;
    }

    public int limit() {
        return isPaged() ? offset : 0;
    }
}
