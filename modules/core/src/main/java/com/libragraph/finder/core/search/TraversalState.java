package com.libragraph.finder.core.search;

import com.libragraph.finder.util.ContentHash;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates matches for one top-level search, shared by every nested container it descends into.
 *
 * <p>Owned by the thread that created it; any other thread touching it gets an
 * {@link IllegalStateException}.
 */
public final class TraversalState {

    private final SearchQuery query;
    private final Thread owner;

    private final Map<String, List<MatchRecord>> byName = new LinkedHashMap<>();
    private final Map<String, List<MatchRecord>> byMatcher = new LinkedHashMap<>();
    private final Map<String, Object> lastValues = new LinkedHashMap<>();
    private final Set<String> found = new HashSet<>();
    private final Deque<ContentHash> ancestors = new ArrayDeque<>();
    private final List<ExtractionFailure> extractionFailures = new ArrayList<>();

    public TraversalState(SearchQuery query) {
        this.query = query;
        this.owner = Thread.currentThread();
        for (String name : query.names()) {
            byName.put(name, new ArrayList<>());
        }
    }

    /**
     * True once every requested name is satisfied in first-only mode. Content matchers
     * never complete a search.
     */
    public boolean isComplete() {
        checkOwner();
        return !query.names().isEmpty() && found.size() == query.names().size();
    }

    /** Suffixes still worth testing against member names. */
    public List<String> pendingNames() {
        checkOwner();
        if (found.isEmpty()) {
            return query.names();
        }
        List<String> pending = new ArrayList<>();
        for (String name : query.names()) {
            if (!found.contains(name)) {
                pending.add(name);
            }
        }
        return pending;
    }

    public void recordName(String name, MatchRecord record) {
        checkOwner();
        List<MatchRecord> records = byName.get(name);
        if (records == null) {
            throw new IllegalArgumentException("Not a requested name: " + name);
        }
        records.add(record);
        if (query.firstOnly()) {
            found.add(name);
        }
    }

    public void recordMatcherHit(MemberMatcher.Hit hit, MatchRecord record) {
        checkOwner();
        String key = hit.matcher().key();
        byMatcher.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        lastValues.put(key, hit.value());
    }

    public void recordExtractionFailure(ExtractionFailure failure) {
        checkOwner();
        extractionFailures.add(failure);
    }

    /**
     * Pushes a container onto the current descent chain.
     */
    public void enter(ContentHash container) {
        checkOwner();
        ancestors.push(container);
    }

    public void leave() {
        checkOwner();
        ancestors.pop();
    }

    /** Whether a container with this content is already open further up the chain. */
    public boolean isAncestor(ContentHash container) {
        checkOwner();
        return ancestors.contains(container);
    }

    /** Number of containers on the current descent chain. */
    public int depth() {
        checkOwner();
        return ancestors.size();
    }

    /**
     * Builds the result, dropping unmatched names unless the query includes empty results.
     */
    public SearchResult finish() {
        checkOwner();
        Map<String, List<MatchRecord>> names = new LinkedHashMap<>();
        byName.forEach((name, records) -> {
            if (!records.isEmpty() || query.includeEmpty()) {
                names.put(name, records);
            }
        });
        Map<String, MatcherHits> matchers = new LinkedHashMap<>();
        byMatcher.forEach((key, records) -> matchers.put(key, new MatcherHits(records, lastValues.get(key))));
        return new SearchResult(names, matchers, extractionFailures);
    }

    private void checkOwner() {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("TraversalState is owned by " + owner.getName()
                    + ", accessed from " + Thread.currentThread().getName());
        }
    }
}
