package com.polydoc.core;

import java.time.Instant;

/**
 * An entity whose writes are tracked by the repository.
 * <p>
 * All values are written by the repository: the version starts at 0 on insert and grows by one on
 * every update. Values supplied by callers are ignored.
 */
public interface Auditable extends Entity {
    String VERSION = "version";
    String CREATED_AT = "createdAt";
    String CREATED_BY = "createdBy";
    String UPDATED_AT = "updatedAt";
    String UPDATED_BY = "updatedBy";

    Long version();

    Instant createdAt();

    String createdBy();

    Instant updatedAt();

    String updatedBy();
}
