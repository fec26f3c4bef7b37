package com.libragraph.finder.formats.api;

import com.libragraph.finder.types.ArchiveFormat;
import com.libragraph.finder.util.buffer.BinaryData;

import java.io.IOException;

/**
 * Opens containers of one format.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface ContainerReaderFactory {

    ArchiveFormat format();

    /**
     * Signature rules for the format this factory opens.
     */
    default DetectionCriteria getDetectionCriteria() {
        return DetectionCriteria.forFormat(format());
    }

    /**
     * Opens the data as a container. The returned reader takes ownership of the
     * data's channel and closes it together with itself.
     *
     * @throws IOException if the data cannot be parsed as this format
     */
    ContainerReader open(BinaryData data, FileContext context) throws IOException;
}
