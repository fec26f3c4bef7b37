package com.libragraph.finder.core.search;

/**
 * Wraps checked I/O exceptions raised while opening or reading an archive.
 * A search that throws this returns no partial result.
 */
public class ArchiveSearchException extends RuntimeException {

    private final String location;

    public ArchiveSearchException(String location, String message, Throwable cause) {
        super(message + ": " + location, cause);
        this.location = location;
    }

    /**
     * Where the failure happened, nested archives separated by {@code !}
     * (e.g. {@code outer.zip!inner.zip!data.bin}).
     */
    public String location() {
        return location;
    }
}
