package com.libragraph.finder.core.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one top-level search.
 *
 * <p>{@link #byName()} maps each requested suffix to the members it matched, in traversal order.
 * Suffixes that matched nothing are absent unless the query asked for empty results.
 * {@link #byMatcher()} only holds matchers that hit at least once.
 */
public final class SearchResult {

    private final Map<String, List<MatchRecord>> byName;
    private final Map<String, MatcherHits> byMatcher;
    private final List<ExtractionFailure> extractionFailures;

    SearchResult(Map<String, List<MatchRecord>> byName,
                 Map<String, MatcherHits> byMatcher,
                 List<ExtractionFailure> extractionFailures) {
        Map<String, List<MatchRecord>> names = new LinkedHashMap<>();
        byName.forEach((name, records) -> names.put(name, List.copyOf(records)));
        this.byName = Collections.unmodifiableMap(names);
        this.byMatcher = Collections.unmodifiableMap(new LinkedHashMap<>(byMatcher));
        this.extractionFailures = List.copyOf(extractionFailures);
    }

    public Map<String, List<MatchRecord>> byName() {
        return byName;
    }

    public Map<String, MatcherHits> byMatcher() {
        return byMatcher;
    }

    public List<ExtractionFailure> extractionFailures() {
        return extractionFailures;
    }

    /** Members matched by a suffix, or an empty list. */
    public List<MatchRecord> matches(String name) {
        return byName.getOrDefault(name, List.of());
    }

    public List<MatchRecord> hits(String matcherKey) {
        MatcherHits hits = byMatcher.get(matcherKey);
        return hits != null ? hits.matches() : List.of();
    }

    public int totalMatches() {
        int total = 0;
        for (List<MatchRecord> records : byName.values()) {
            total += records.size();
        }
        for (MatcherHits hits : byMatcher.values()) {
            total += hits.matches().size();
        }
        return total;
    }

    public boolean isEmpty() {
        return totalMatches() == 0;
    }

    @Override
    public String toString() {
        return "SearchResult[names=" + byName.keySet() + ", matchers=" + byMatcher.keySet()
                + ", total=" + totalMatches() + "]";
    }
}
