package com.libragraph.finder.core.search;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * What to look for and how to traverse. Build with {@link #builder()}.
 *
 * @param names         filename suffixes to look for, duplicates removed, in request order
 * @param matchers      content matchers, tried in order; the first hit wins
 * @param caseSensitive whether suffix comparison respects case
 * @param firstOnly     record only the first member found for each name
 * @param includeEmpty  report requested names that matched nothing, with an empty list
 * @param recursive     search archives found inside archives
 * @param maxDepth      deepest nesting level to open, or null for the configured default
 * @param extractTo     directory receiving content-matched members, or null for no extraction
 */
public record SearchQuery(
        List<String> names,
        List<ContentMatcher<?>> matchers,
        boolean caseSensitive,
        boolean firstOnly,
        boolean includeEmpty,
        boolean recursive,
        Integer maxDepth,
        Path extractTo
) {
    public SearchQuery {
        names = names == null ? List.of() : names;
        matchers = matchers == null ? List.of() : matchers;
        for (String name : names) {
            if (name == null) {
                throw new SearchConfigurationException("File name to search must not be null");
            }
        }
        for (ContentMatcher<?> matcher : matchers) {
            if (matcher == null) {
                throw new SearchConfigurationException("Content matcher must not be null");
            }
        }
        names = List.copyOf(new LinkedHashSet<>(names));
        matchers = List.copyOf(matchers);

        if (names.isEmpty() && matchers.isEmpty()) {
            throw new SearchConfigurationException("Either file names or content matchers must be provided");
        }
        for (String name : names) {
            if (name.isEmpty()) {
                throw new SearchConfigurationException("File names to search must not be empty");
            }
        }
        Set<String> keys = new HashSet<>();
        for (ContentMatcher<?> matcher : matchers) {
            if (!keys.add(matcher.key())) {
                throw new SearchConfigurationException("Duplicate content matcher key: " + matcher.key());
            }
        }
        if (maxDepth != null && maxDepth < 0) {
            throw new SearchConfigurationException("maxDepth must be >= 0, got: " + maxDepth);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shortcut for a case-sensitive, non-recursive name search. */
    public static SearchQuery forNames(String... names) {
        return builder().names(names).build();
    }

    public OptionalInt maxDepthOverride() {
        return maxDepth != null ? OptionalInt.of(maxDepth) : OptionalInt.empty();
    }

    public Optional<Path> extractionDirectory() {
        return Optional.ofNullable(extractTo);
    }

    public static class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<ContentMatcher<?>> matchers = new ArrayList<>();
        private boolean caseSensitive = true;
        private boolean firstOnly;
        private boolean includeEmpty;
        private boolean recursive;
        private Integer maxDepth;
        private Path extractTo;

        private Builder() {
        }

        public Builder name(String name) {
            if (name == null) {
                throw new SearchConfigurationException("File name to search must not be null");
            }
            names.add(name);
            return this;
        }

        public Builder names(String... names) {
            for (String name : names) {
                name(name);
            }
            return this;
        }

        public Builder names(Collection<String> names) {
            names.forEach(this::name);
            return this;
        }

        public Builder matcher(ContentMatcher<?> matcher) {
            if (matcher == null) {
                throw new SearchConfigurationException("Content matcher must not be null");
            }
            matchers.add(matcher);
            return this;
        }

        public Builder matchers(Collection<? extends ContentMatcher<?>> matchers) {
            matchers.forEach(this::matcher);
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder firstOnly(boolean firstOnly) {
            this.firstOnly = firstOnly;
            return this;
        }

        public Builder includeEmpty(boolean includeEmpty) {
            this.includeEmpty = includeEmpty;
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder extractTo(Path directory) {
            this.extractTo = directory;
            return this;
        }

        /**
         * @throws SearchConfigurationException if neither names nor matchers were given,
         *         a name is empty, or two matchers share a key
         */
        public SearchQuery build() {
            return new SearchQuery(names, matchers, caseSensitive, firstOnly, includeEmpty,
                    recursive, maxDepth, extractTo);
        }
    }
}
