package com.libragraph.finder.api;

import com.libragraph.finder.core.search.MatchRecord;
import com.libragraph.finder.core.search.SearchResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SearchReport(
        Map<String, List<MatchSummary>> names,
        Map<String, List<MatchSummary>> matchers,
        int totalMatches
) {
    public static SearchReport from(SearchResult result) {
        Map<String, List<MatchSummary>> names = new LinkedHashMap<>();
        result.byName().forEach((name, records) -> names.put(name, summarize(records)));

        Map<String, List<MatchSummary>> matchers = new LinkedHashMap<>();
        result.byMatcher().forEach((key, hits) -> matchers.put(key, summarize(hits.matches())));

        return new SearchReport(names, matchers, result.totalMatches());
    }

    private static List<MatchSummary> summarize(List<MatchRecord> records) {
        return records.stream().map(MatchSummary::of).toList();
    }
}
