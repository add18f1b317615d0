package com.polydoc.core;

import java.util.Locale;

/**
 * Optional overrides applied when a repository is built.
 *
 * @param collectionName collection to store documents in; defaults to the pluralised model name
 * @param modelName      model name to use when the supertype has no name of its own
 */
public record RepositoryOptions(String collectionName, String modelName) {
    private static final RepositoryOptions DEFAULTS = new RepositoryOptions(null, null);

    public static RepositoryOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    String collectionNameFor(String resolvedModelName) {
        if (collectionName != null && !collectionName.isBlank()) {
            return collectionName;
        }
        String lower = resolvedModelName.toLowerCase(Locale.ROOT);
        return lower.endsWith("s") ? lower : lower + "s";
    }

    public static class Builder {
        private String collectionName;
        private String modelName;

        public Builder collectionName(String collectionName) {
            this.collectionName = collectionName;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public RepositoryOptions build() {
            return new RepositoryOptions(collectionName, modelName);
        }
    }
}
