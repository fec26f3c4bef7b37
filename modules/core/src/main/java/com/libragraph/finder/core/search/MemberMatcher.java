package com.libragraph.finder.core.search;

import java.util.List;
import java.util.Optional;

/**
 * Name and content tests applied to a single member.
 */
public final class MemberMatcher {

    private MemberMatcher() {
    }

    /**
     * A content matcher that accepted a member, with the value it returned.
     */
    public record Hit(ContentMatcher<?> matcher, Object value) {
    }

    /**
     * Suffix test: {@code a/b/file.txt} matches {@code file.txt}, and also {@code .txt}.
     */
    public static boolean matchesName(String memberName, String suffix, boolean caseSensitive) {
        if (caseSensitive) {
            return memberName.endsWith(suffix);
        }
        int offset = memberName.length() - suffix.length();
        return offset >= 0 && memberName.regionMatches(true, offset, suffix, 0, suffix.length());
    }

    /**
     * Evaluates matchers in order and stops at the first hit. Each matcher sees its own
     * copy of the content; writes to it never reach later matchers or the recorded match.
     */
    public static Optional<Hit> firstHit(byte[] content, List<ContentMatcher<?>> matchers) {
        for (ContentMatcher<?> matcher : matchers) {
            Optional<?> value = matcher.evaluate(content.clone());
            if (value.isPresent()) {
                return Optional.of(new Hit(matcher, value.get()));
            }
        }
        return Optional.empty();
    }
}
