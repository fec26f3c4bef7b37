package com.libragraph.finder.core.search;

import java.util.List;

/**
 * Members a content matcher accepted, and the value it returned for the most recent one.
 */
public record MatcherHits(List<MatchRecord> matches, Object lastValue) {

    public MatcherHits {
        matches = List.copyOf(matches);
    }
}
