package com.libragraph.finder.core.search;

import com.libragraph.finder.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class TraversalStateTest {

    private static MatchRecord record(String name) {
        return new MatchRecord(name.getBytes(StandardCharsets.UTF_8), name, name, name.length(), Instant.EPOCH);
    }

    @Test
    void shouldCompleteOnceEveryNameFoundInFirstOnlyMode() {
        TraversalState state = new TraversalState(SearchQuery.builder()
                .names("a.txt", "b.txt")
                .firstOnly(true)
                .build());

        state.recordName("a.txt", record("a.txt"));
        assertThat(state.isComplete()).isFalse();
        assertThat(state.pendingNames()).containsExactly("b.txt");

        state.recordName("b.txt", record("b.txt"));
        assertThat(state.isComplete()).isTrue();
        assertThat(state.pendingNames()).isEmpty();
    }

    @Test
    void shouldNeverCompleteWithoutFirstOnly() {
        TraversalState state = new TraversalState(SearchQuery.forNames("a.txt"));

        state.recordName("a.txt", record("a.txt"));

        assertThat(state.isComplete()).isFalse();
        assertThat(state.pendingNames()).containsExactly("a.txt");
    }

    @Test
    void shouldNeverCompleteOnMatcherHits() {
        ContentMatcher<Boolean> matcher = ContentMatcher.of("m", content -> true);
        TraversalState state = new TraversalState(SearchQuery.builder().matcher(matcher).firstOnly(true).build());

        state.recordMatcherHit(new MemberMatcher.Hit(matcher, true), record("x"));

        assertThat(state.isComplete()).isFalse();
    }

    @Test
    void shouldKeepLastMatcherValue() {
        ContentMatcher<String> matcher = new ContentMatcher<>("m", content -> Optional.of("v"));
        TraversalState state = new TraversalState(SearchQuery.builder().matcher(matcher).build());

        state.recordMatcherHit(new MemberMatcher.Hit(matcher, "first"), record("one"));
        state.recordMatcherHit(new MemberMatcher.Hit(matcher, "second"), record("two"));
        SearchResult result = state.finish();

        assertThat(result.byMatcher().get("m").lastValue()).isEqualTo("second");
        assertThat(result.hits("m")).extracting(MatchRecord::name).containsExactly("one", "two");
    }

    @Test
    void shouldRejectUnrequestedName() {
        TraversalState state = new TraversalState(SearchQuery.forNames("a.txt"));

        assertThatThrownBy(() -> state.recordName("b.txt", record("b.txt")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldTrackDescentChain() {
        TraversalState state = new TraversalState(SearchQuery.forNames("a"));
        ContentHash outer = ContentHash.of(new byte[]{1});
        ContentHash inner = ContentHash.of(new byte[]{2});

        state.enter(outer);
        state.enter(inner);
        assertThat(state.depth()).isEqualTo(2);
        assertThat(state.isAncestor(ContentHash.of(new byte[]{1}))).isTrue();

        state.leave();
        assertThat(state.isAncestor(inner)).isFalse();
        assertThat(state.depth()).isEqualTo(1);
    }

    @Test
    void shouldRejectAccessFromOtherThread() throws Exception {
        TraversalState state = new TraversalState(SearchQuery.forNames("a"));
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread other = new Thread(() -> {
            try {
                state.isComplete();
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        other.start();
        other.join();

        assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldFilterEmptyNamesOnFinish() {
        TraversalState dropping = new TraversalState(SearchQuery.forNames("a", "b"));
        TraversalState keeping = new TraversalState(SearchQuery.builder().names("a", "b").includeEmpty(true).build());
        dropping.recordName("b", record("b"));
        keeping.recordName("b", record("b"));

        assertThat(dropping.finish().byName()).containsOnlyKeys("b");
        assertThat(keeping.finish().byName()).containsOnlyKeys("a", "b");
    }
}
