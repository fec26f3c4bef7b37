package com.libragraph.finder.formats.registry;

import com.libragraph.finder.formats.api.DetectionCriteria;
import com.libragraph.finder.formats.api.FileContext;
import com.libragraph.finder.formats.tika.MediaTypeHint;
import com.libragraph.finder.types.ArchiveFormat;
import com.libragraph.finder.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Classifies byte sources as ZIP, 7z or unknown from their leading bytes.
 * Media type hints are logged for diagnosis but never change the verdict.
 */
@ApplicationScoped
public class FormatDetector {

    private static final Logger log = Logger.getLogger(FormatDetector.class);

    /** Header size to read for detection. */
    static final int HEADER_SIZE = 512;

    private final MediaTypeHint mediaTypeHint;

    @Inject
    public FormatDetector(MediaTypeHint mediaTypeHint) {
        this.mediaTypeHint = mediaTypeHint;
    }

    /**
     * Classifies raw header bytes.
     */
    public ArchiveFormat detect(byte[] header) {
        for (DetectionCriteria criteria : DetectionCriteria.known()) {
            if (criteria.matches(header)) {
                return criteria.format();
            }
        }
        return ArchiveFormat.UNKNOWN;
    }

    public ArchiveFormat detect(BinaryData data) {
        return detect(data.readHeader(HEADER_SIZE));
    }

    /**
     * Classifies the data and cross-checks the verdict against the context's
     * media type hint, or one derived with Tika when the context carries none.
     */
    public ArchiveFormat detect(BinaryData data, FileContext context) {
        byte[] header = data.readHeader(HEADER_SIZE);
        ArchiveFormat format = detect(header);

        if (log.isDebugEnabled()) {
            String hint = context.mediaTypeHint()
                    .orElseGet(() -> mediaTypeHint.detect(header, context.filename()));
            if (format == ArchiveFormat.UNKNOWN && mediaTypeHint.isArchiveLike(hint)) {
                log.debugf("Ignoring media type hint %s for %s: no archive signature", hint, context.filename());
            } else if (format.isContainer() && !DetectionCriteria.forFormat(format).expectsMimeType(hint)) {
                log.debugf("Detected %s for %s despite media type hint %s", format.label(), context.filename(), hint);
            }
        }
        return format;
    }
}
