package com.libragraph.finder.formats.api;

import com.libragraph.finder.types.ArchiveFormat;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Signature rules identifying one container format.
 *
 * @param format      the format these rules identify
 * @param mimeTypes   media types a hint source may report for this format (advisory only)
 * @param signatures  alternative magic byte sequences at offset 0; any one matching is sufficient
 */
public record DetectionCriteria(
        ArchiveFormat format,
        Set<String> mimeTypes,
        List<byte[]> signatures
) {
    /** Local file header, empty archive (end of central directory), spanned archive marker. */
    public static final DetectionCriteria ZIP = new DetectionCriteria(
            ArchiveFormat.ZIP,
            Set.of("application/zip", "application/x-zip-compressed"),
            List.of(
                    new byte[]{0x50, 0x4B, 0x03, 0x04},
                    new byte[]{0x50, 0x4B, 0x05, 0x06},
                    new byte[]{0x50, 0x4B, 0x07, 0x08}));

    public static final DetectionCriteria SEVEN_ZIP = new DetectionCriteria(
            ArchiveFormat.SEVEN_ZIP,
            Set.of("application/x-7z-compressed"),
            List.of(new byte[]{'7', 'z', (byte) 0xBC, (byte) 0xAF, 0x27, 0x1C}));

    public DetectionCriteria {
        Objects.requireNonNull(format, "format");
        if (signatures == null || signatures.isEmpty()) {
            throw new IllegalArgumentException("At least one signature is required for " + format);
        }
        mimeTypes = Set.copyOf(mimeTypes);
        signatures = signatures.stream().map(byte[]::clone).toList();
    }

    /** All signature rules known to the detector, in evaluation order. */
    public static List<DetectionCriteria> known() {
        return List.of(ZIP, SEVEN_ZIP);
    }

    public static DetectionCriteria forFormat(ArchiveFormat format) {
        return known().stream()
                .filter(c -> c.format() == format)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No signature rules for " + format));
    }

    /**
     * Checks the header against each signature. Media types play no part.
     */
    public boolean matches(byte[] header) {
        if (header == null) {
            return false;
        }
        for (byte[] signature : signatures) {
            if (header.length < signature.length) {
                continue;
            }
            boolean magicMatch = true;
            for (int i = 0; i < signature.length; i++) {
                if (header[i] != signature[i]) {
                    magicMatch = false;
                    break;
                }
            }
            if (magicMatch) {
                return true;
            }
        }
        return false;
    }

    public boolean expectsMimeType(String mimeType) {
        return mimeType != null && mimeTypes.contains(mimeType);
    }
}
