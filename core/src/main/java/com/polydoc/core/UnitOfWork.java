package com.polydoc.core;

import com.polydoc.core.store.Session;

/**
 * Work run inside a transaction. Every repository call it makes must be given {@code session}.
 */
@FunctionalInterface
public interface UnitOfWork<R> {
    R execute(Session session);
}
