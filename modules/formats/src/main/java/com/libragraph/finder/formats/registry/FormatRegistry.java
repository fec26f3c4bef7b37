package com.libragraph.finder.formats.registry;

import com.libragraph.finder.formats.api.ContainerReader;
import com.libragraph.finder.formats.api.ContainerReaderFactory;
import com.libragraph.finder.formats.api.FileContext;
import com.libragraph.finder.formats.api.UnsupportedFormatException;
import com.libragraph.finder.formats.handlers.SevenZipReaderFactory;
import com.libragraph.finder.formats.handlers.ZipReaderFactory;
import com.libragraph.finder.formats.tika.MediaTypeHint;
import com.libragraph.finder.types.ArchiveFormat;
import com.libragraph.finder.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Central registry that detects container formats and dispatches to the matching reader.
 * All {@link ContainerReaderFactory} beans are discovered via CDI.
 */
@ApplicationScoped
public class FormatRegistry {

    private static final Logger log = Logger.getLogger(FormatRegistry.class);

    private final FormatDetector detector;
    private final Map<ArchiveFormat, ContainerReaderFactory> factories = new EnumMap<>(ArchiveFormat.class);

    @Inject
    public FormatRegistry(FormatDetector detector, Instance<ContainerReaderFactory> factories) {
        this(detector, factories.stream().toList());
    }

    public FormatRegistry(FormatDetector detector, List<ContainerReaderFactory> factories) {
        this.detector = detector;
        for (ContainerReaderFactory factory : factories) {
            ContainerReaderFactory previous = this.factories.put(factory.format(), factory);
            if (previous != null) {
                throw new IllegalStateException("Two readers registered for " + factory.format().label()
                        + ": " + previous.getClass().getName() + ", " + factory.getClass().getName());
            }
        }
        log.debugf("FormatRegistry initialized with readers for %s", this.factories.keySet());
    }

    /**
     * Registry with the built-in ZIP and 7z readers, for use outside a CDI container.
     */
    public static FormatRegistry defaults() {
        return new FormatRegistry(
                new FormatDetector(new MediaTypeHint()),
                List.of(new ZipReaderFactory(), new SevenZipReaderFactory()));
    }

    public FormatDetector detector() {
        return detector;
    }

    public Set<ArchiveFormat> supportedFormats() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * Detects the format of the data and opens it with the matching reader.
     *
     * @throws UnsupportedFormatException if no signature matches or no reader is registered for the format
     * @throws IOException if the data carries a known signature but cannot be parsed
     */
    public ContainerReader open(BinaryData data, FileContext context) throws IOException {
        return open(detector.detect(data, context), data, context);
    }

    /**
     * Opens the data with the reader for an already detected format.
     */
    public ContainerReader open(ArchiveFormat format, BinaryData data, FileContext context) throws IOException {
        ContainerReaderFactory factory = factories.get(format);
        if (factory == null) {
            throw new UnsupportedFormatException(format, context.filename(),
                    data.readHeader(FormatDetector.HEADER_SIZE));
        }
        return factory.open(data, context);
    }
}
