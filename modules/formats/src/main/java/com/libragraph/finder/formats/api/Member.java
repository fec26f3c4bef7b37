package com.libragraph.finder.formats.api;

import com.libragraph.finder.types.EntryType;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a container as listed by its {@link ContainerReader}.
 *
 * @param index        position in the reader's listing; only meaningful to the reader that produced it
 * @param name         relative path, forward-slash separated
 * @param size         uncompressed size, or -1 when the format does not record it
 * @param lastModified last-modified time, or null when the format does not record it
 * @param type         file, directory or symlink
 */
public record Member(
        int index,
        String name,
        long size,
        Instant lastModified,
        EntryType type
) {
    public Member {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public boolean isDirectory() {
        return type == EntryType.DIRECTORY;
    }

    /** Last path segment, ignoring a trailing slash. */
    public String baseName() {
        String trimmed = name.endsWith("/") ? name.substring(0, name.length() - 1) : name;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
