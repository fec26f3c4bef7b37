package com.libragraph.finder.formats.handlers;

import com.libragraph.finder.formats.api.ContainerReader;
import com.libragraph.finder.formats.api.Member;
import com.libragraph.finder.formats.api.MemberTooLargeException;
import org.apache.commons.compress.utils.IOUtils;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads member streams without trusting the sizes archives declare.
 */
final class BoundedReads {

    private BoundedReads() {
    }

    /**
     * Reads up to one byte past the limit, so an oversized member is detected
     * without decompressing the rest of it.
     */
    static byte[] readMember(InputStream in, Member member, long maxBytes) throws IOException {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes must be >= 0, got: " + maxBytes);
        }
        // one below the array ceiling, so the extra byte always fits in the window
        long limit = Math.min(maxBytes, ContainerReader.MAX_MEMBER_BYTES - 1);
        byte[] content = IOUtils.readRange(in, (int) limit + 1);
        if (content.length > limit) {
            throw new MemberTooLargeException(member.name(), limit);
        }
        return content;
    }
}
