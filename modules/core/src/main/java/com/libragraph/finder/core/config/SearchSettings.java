package com.libragraph.finder.core.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Reads search limits from {@code finder.search.*} properties.
 * <pre>
 *   finder.search.max-depth=32
 *   finder.search.max-member-size=268435456
 * </pre>
 */
@ApplicationScoped
public class SearchSettings {

    public static final int DEFAULT_MAX_DEPTH = 32;
    public static final long DEFAULT_MAX_MEMBER_SIZE = 256L * 1024 * 1024;

    private int maxDepth;
    private long maxMemberSize;

    @Inject
    public SearchSettings(
            @ConfigProperty(name = "finder.search.max-depth", defaultValue = "32") int maxDepth,
            @ConfigProperty(name = "finder.search.max-member-size", defaultValue = "268435456") long maxMemberSize) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("finder.search.max-depth must be >= 0, got: " + maxDepth);
        }
        if (maxMemberSize <= 0) {
            throw new IllegalArgumentException("finder.search.max-member-size must be > 0, got: " + maxMemberSize);
        }
        this.maxDepth = maxDepth;
        this.maxMemberSize = maxMemberSize;
    }

    public static SearchSettings defaults() {
        return new SearchSettings(DEFAULT_MAX_DEPTH, DEFAULT_MAX_MEMBER_SIZE);
    }

    /** Deepest nesting level opened when a query sets no depth of its own; the searched archive is level 0. */
    public int maxDepth() {
        return maxDepth;
    }

    /** Members declaring a larger uncompressed size are skipped rather than read into memory. */
    public long maxMemberSize() {
        return maxMemberSize;
    }
}
