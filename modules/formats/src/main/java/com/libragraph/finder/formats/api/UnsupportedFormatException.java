package com.libragraph.finder.formats.api;

import com.libragraph.finder.types.ArchiveFormat;

import java.util.HexFormat;

/**
 * Thrown when bytes match no known container signature, or match one for
 * which no reader is registered.
 */
public class UnsupportedFormatException extends RuntimeException {

    private static final int PREVIEW_LENGTH = 10;

    private final ArchiveFormat detected;
    private final String source;

    public UnsupportedFormatException(ArchiveFormat detected, String source, byte[] header) {
        super(buildMessage(detected, source, header));
        this.detected = detected;
        this.source = source;
    }

    public ArchiveFormat detected() {
        return detected;
    }

    public String source() {
        return source;
    }

    private static String buildMessage(ArchiveFormat detected, String source, byte[] header) {
        String preview = "";
        if (header != null) {
            int length = Math.min(PREVIEW_LENGTH, header.length);
            preview = HexFormat.ofDelimiter(" ").formatHex(header, 0, length);
        }
        if (detected == ArchiveFormat.UNKNOWN) {
            return "Not a known archive type: " + source + " (leading bytes: " + preview + ")";
        }
        return "No reader registered for " + detected.label() + " archive: " + source;
    }
}
