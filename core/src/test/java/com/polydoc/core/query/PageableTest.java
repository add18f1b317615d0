package com.polydoc.core.query;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PageableTest {

    @Test
    void skipCoversThePagesBeforeTheRequestedOne() {
        assertEquals(20L, Pageable.of(3, 10).skip());
        assertEquals(0L, Pageable.of(1, 10).skip());
    }

    @Test
    void skipDoesNotWrapForHugePages() {
        assertEquals(2L * (Integer.MAX_VALUE - 1), Pageable.of(Integer.MAX_VALUE, 2).skip());
    }

    @Test
    void unpagedRequestsSkipAndLimitNothing() {
        Pageable pageable = Pageable.of(0, 10);

        assertFalse(pageable.isPaged());
        assertEquals(0L, pageable.skip());
        assertEquals(0, pageable.limit());
    }
}
