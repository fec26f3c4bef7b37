package com.libragraph.finder.types;

/**
 * Container formats the finder can classify.
 * {@link #UNKNOWN} is a verdict, not a format: callers must never try to open it.
 */
public enum ArchiveFormat {
    ZIP("zip", "application/zip"),
    SEVEN_ZIP("7z", "application/x-7z-compressed"),
    UNKNOWN("unknown", "application/octet-stream");

    private final String label;
    private final String mimeType;

    ArchiveFormat(String label, String mimeType) {
        this.label = label;
        this.mimeType = mimeType;
    }

    public String label() {
        return label;
    }

    /** Canonical media type for this format. */
    public String mimeType() {
        return mimeType;
    }

    public boolean isContainer() {
        return this != UNKNOWN;
    }
}
