package com.libragraph.finder.formats.tika;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.tika.Tika;

import java.util.Set;

/**
 * Advisory media type for a byte source, derived with Apache Tika.
 *
 * <p>The finder never decides a format from this value. It is compared against
 * signature detection only to flag sources that claim to be archives but are not.
 */
@ApplicationScoped
public class MediaTypeHint {

    /** Media types under which archives are commonly reported, including self-extracting executables. */
    private static final Set<String> ARCHIVE_LIKE = Set.of(
            "application/zip",
            "application/x-zip-compressed",
            "application/x-7z-compressed",
            "application/java-archive",
            "application/x-dosexec",
            "application/vnd.microsoft.portable-executable"
    );

    private final Tika tika = new Tika();

    /**
     * Detects a media type from leading bytes and an optional filename.
     */
    public String detect(byte[] header, String filename) {
        return filename == null ? tika.detect(header) : tika.detect(header, filename);
    }

    public boolean isArchiveLike(String mediaType) {
        return mediaType != null && ARCHIVE_LIKE.contains(mediaType);
    }
}
