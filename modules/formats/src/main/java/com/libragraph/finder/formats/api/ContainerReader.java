package com.libragraph.finder.formats.api;

import com.libragraph.finder.types.ArchiveFormat;

import java.io.IOException;
import java.util.List;

/**
 * An open container. Owns the format-specific reader exclusively and
 * must be closed once traversal of its members is complete.
 *
 * <p>Implementations hide format quirks: every {@link #readMember(Member)} call
 * behaves independently of the calls made before it, whatever read position
 * the underlying library keeps.
 */
public interface ContainerReader extends AutoCloseable {

    ArchiveFormat format();

    /**
     * Members in the container's native enumeration order, directories included.
     */
    List<Member> listMembers() throws IOException;

    /** Array ceiling for member reads; members this large or larger cannot be read. */
    long MAX_MEMBER_BYTES = Integer.MAX_VALUE - 8;

    /**
     * Reads the uncompressed bytes of a non-directory member.
     *
     * @throws IllegalArgumentException if the member is a directory or was not listed by this reader
     */
    default byte[] readMember(Member member) throws IOException {
        return readMember(member, MAX_MEMBER_BYTES);
    }

    /**
     * Reads at most {@code maxBytes} uncompressed bytes of a non-directory member. The limit
     * applies to the decompressed stream, whatever size the archive declares.
     *
     * @throws MemberTooLargeException if the member decompresses to more than {@code maxBytes}
     * @throws IllegalArgumentException if the member is a directory or was not listed by this reader
     */
    byte[] readMember(Member member, long maxBytes) throws IOException;

    @Override
    void close() throws IOException;
}
