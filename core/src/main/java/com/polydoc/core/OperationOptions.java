package com.polydoc.core;

import com.polydoc.core.query.Filter;
import com.polydoc.core.query.Pageable;
import com.polydoc.core.query.Sort;
import com.polydoc.core.store.Session;

/**
 * Options accompanying a repository operation. Each operation reads the options that apply to it
 * and ignores the rest.
 *
 * @param session  transaction session to run in, {@code null} to run standalone
 * @param filters  predicate for find and delete operations
 * @param pageable page to return from a find-all
 * @param sortBy   ordering of a find-all
 * @param userId   writer identity stamped onto auditable entities
 */
public record OperationOptions(
        Session session,
        Filter filters,
        Pageable pageable,
        Sort sortBy,
        String userId
) {
    private static final OperationOptions NONE = new OperationOptions(null, null, null, null, null);

    public static OperationOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .session(session)
                .filters(filters)
                .pageable(pageable)
                .sortBy(sortBy)
                .userId(userId);
    }

    public OperationOptions withSession(Session session) {
        return toBuilder().session(session).build();
    }

    public static class Builder {
        private Session session;
        private Filter filters;
        private Pageable pageable;
        private Sort sortBy;
        private String userId;

        public Builder session(Session session) {
            this.session = session;
            return this;
        }

        public Builder filters(Filter filters) {
            this.filters = filters;
            return this;
        }

        public Builder pageable(Pageable pageable) {
            this.pageable = pageable;
            return this;
        }

        public Builder pageable(int pageNumber, int offset) {
            this.pageable = Pageable.of(pageNumber, offset);
            return this;
        }

        public Builder sortBy(Sort sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public OperationOptions build() {
            return new OperationOptions(session, filters, pageable, sortBy, userId);
        }
    }
}
