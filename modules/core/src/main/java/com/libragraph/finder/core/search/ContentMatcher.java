package com.libragraph.finder.core.search;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A caller-supplied test applied to member contents, registered under an explicit key.
 *
 * <p>Results are grouped by {@link #key()}, so two matchers never collide just because
 * they share an implementation.
 *
 * @param key       identifier the matcher's hits are reported under
 * @param evaluator returns a value for a hit, or empty for a miss
 * @param <T>       type of the value reported for a hit
 */
public record ContentMatcher<T>(String key, Function<byte[], Optional<T>> evaluator) {

    public ContentMatcher {
        if (key == null || key.isBlank()) {
            throw new SearchConfigurationException("Content matcher key must not be blank");
        }
        Objects.requireNonNull(evaluator, "evaluator");
    }

    /**
     * Adapts a yes/no test; hits report {@code Boolean.TRUE}.
     */
    public static ContentMatcher<Boolean> of(String key, Predicate<byte[]> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new ContentMatcher<>(key, content -> predicate.test(content)
                ? Optional.of(Boolean.TRUE)
                : Optional.empty());
    }

    /**
     * Runs the evaluator. An evaluator returning null counts as a miss.
     */
    public Optional<T> evaluate(byte[] content) {
        Optional<T> result = evaluator.apply(content);
        return result != null ? result : Optional.empty();
    }
}
