package com.libragraph.finder.core.search;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One matched member.
 *
 * @param content      the member's uncompressed bytes
 * @param name         member path inside its own container
 * @param location     path from the searched archive, nested containers separated by {@code !}
 * @param size         uncompressed size
 * @param lastModified last-modified time, or null when the container does not record it
 */
public record MatchRecord(
        byte[] content,
        String name,
        String location,
        long size,
        Instant lastModified
) {
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchRecord other)) return false;
        return size == other.size
                && Arrays.equals(content, other.content)
                && Objects.equals(name, other.name)
                && Objects.equals(location, other.location)
                && Objects.equals(lastModified, other.lastModified);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(name, location, size, lastModified) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "MatchRecord[location=" + location + ", size=" + size + ", lastModified=" + lastModified + "]";
    }
}
