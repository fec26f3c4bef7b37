package com.libragraph.finder.api;

import com.libragraph.finder.core.search.MatchRecord;

import java.time.Instant;

/**
 * A match as reported over HTTP, without the member's bytes.
 */
public record MatchSummary(String name, String location, long size, Instant lastModified) {

    public static MatchSummary of(MatchRecord record) {
        return new MatchSummary(record.name(), record.location(), record.size(), record.lastModified());
    }
}
