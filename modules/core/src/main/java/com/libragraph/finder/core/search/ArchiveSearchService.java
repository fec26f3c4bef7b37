package com.libragraph.finder.core.search;

import com.libragraph.finder.core.config.SearchSettings;
import com.libragraph.finder.core.extract.ExtractionSink;
import com.libragraph.finder.formats.api.ContainerReader;
import com.libragraph.finder.formats.api.FileContext;
import com.libragraph.finder.formats.api.Member;
import com.libragraph.finder.formats.api.MemberTooLargeException;
import com.libragraph.finder.formats.api.UnsupportedFormatException;
import com.libragraph.finder.formats.registry.FormatRegistry;
import com.libragraph.finder.types.ArchiveFormat;
import com.libragraph.finder.util.ContentHash;
import com.libragraph.finder.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Searches a ZIP or 7z archive for members by name suffix or by content, depth first,
 * optionally descending into archives stored inside it.
 *
 * <p>Per member, in the archive's own listing order:
 * <ol>
 *   <li>directories are skipped</li>
 *   <li>content matchers run in order; the first hit records the member, extracts it if
 *       an extraction directory is set, and ends processing of that member</li>
 *   <li>otherwise, in recursive mode, a member that is itself an archive is searched
 *       with the same accumulated state</li>
 *   <li>the member's name is tested against every suffix not yet satisfied</li>
 * </ol>
 * Enumeration stops at every level as soon as all names are found in first-only mode.
 */
@ApplicationScoped
public class ArchiveSearchService {

    private static final Logger log = Logger.getLogger(ArchiveSearchService.class);

    static final String NESTED_SEPARATOR = "!";
    static final String IN_MEMORY_NAME = "<memory>";

    private FormatRegistry registry;
    private ExtractionSink extractionSink;
    private SearchSettings settings;

    @Inject
    public ArchiveSearchService(FormatRegistry registry, ExtractionSink extractionSink, SearchSettings settings) {
        this.registry = registry;
        this.extractionSink = extractionSink;
        this.settings = settings;
    }

    /**
     * Service wired with the built-in readers and default limits, for use outside a CDI container.
     */
    public static ArchiveSearchService withDefaults() {
        return new ArchiveSearchService(FormatRegistry.defaults(), new ExtractionSink(), SearchSettings.defaults());
    }

    public SearchResult search(Path archive, SearchQuery query) {
        BinaryData data;
        try {
            data = BinaryData.open(archive);
        } catch (IOException e) {
            throw new ArchiveSearchException(archive.toString(), "Failed to open archive", e);
        }
        return search(data, FileContext.of(archive), query);
    }

    public SearchResult search(byte[] archive, SearchQuery query) {
        return search(BinaryData.of(archive), FileContext.of(IN_MEMORY_NAME), query);
    }

    /**
     * Searches the data, which is consumed and closed.
     *
     * @throws UnsupportedFormatException if the data is not a ZIP or 7z archive, or a nested
     *         archive has no registered reader
     * @throws ArchiveSearchException if the archive or a nested one cannot be read
     */
    public SearchResult search(BinaryData data, FileContext context, SearchQuery query) {
        TraversalState state = new TraversalState(query);
        int maxDepth = query.maxDepthOverride().orElse(settings.maxDepth());
        String source = context.filename();

        log.infof("Searching %s: names=%s, matchers=%d, recursive=%s, firstOnly=%s",
                source, query.names(), query.matchers().size(), query.recursive(), query.firstOnly());

        try (BinaryData archive = data) {
            ArchiveFormat format = registry.detector().detect(archive, context);
            if (format == ArchiveFormat.UNKNOWN) {
                throw new UnsupportedFormatException(format, source, archive.readHeader(16));
            }
            if (query.recursive()) {
                state.enter(archive.hash());
            }
            try (ContainerReader reader = registry.open(format, archive, context)) {
                new Traversal(query, state, source, maxDepth).searchContainer(reader, "");
            }
        } catch (IOException e) {
            throw new ArchiveSearchException(source, "Failed to read archive", e);
        } catch (UncheckedIOException e) {
            throw new ArchiveSearchException(source, "Failed to read archive", e.getCause());
        }

        SearchResult result = state.finish();
        log.infof("Search of %s finished: %d matches, %d extraction failures",
                source, result.totalMatches(), result.extractionFailures().size());
        return result;
    }

    /**
     * One top-level search in progress.
     */
    private final class Traversal {
        private final SearchQuery query;
        private final TraversalState state;
        private final String source;
        private final int maxDepth;

        Traversal(SearchQuery query, TraversalState state, String source, int maxDepth) {
            this.query = query;
            this.state = state;
            this.source = source;
            this.maxDepth = maxDepth;
        }

        void searchContainer(ContainerReader reader, String prefix) {
            List<Member> members;
            try {
                members = reader.listMembers();
            } catch (IOException e) {
                throw new ArchiveSearchException(errorLocation(prefix), "Failed to list members", e);
            }

            for (Member member : members) {
                if (!member.isDirectory()) {
                    searchMember(reader, member, prefix);
                }
                if (state.isComplete()) {
                    log.debugf("All names found, stopping at %s", errorLocation(locationOf(prefix, member)));
                    break;
                }
            }
        }

        private void searchMember(ContainerReader reader, Member member, String prefix) {
            String location = locationOf(prefix, member);
            if (member.size() > settings.maxMemberSize()) {
                log.warnf("Skipping %s: %d bytes exceeds the %d byte member limit",
                        errorLocation(location), member.size(), settings.maxMemberSize());
                return;
            }

            byte[] content;
            try {
                content = reader.readMember(member, settings.maxMemberSize());
            } catch (MemberTooLargeException e) {
                log.warnf("Skipping %s: decompresses to more than the %d byte member limit (declared %d)",
                        errorLocation(location), settings.maxMemberSize(), member.size());
                return;
            } catch (IOException e) {
                throw new ArchiveSearchException(errorLocation(location), "Failed to read member", e);
            }
            MatchRecord record = new MatchRecord(content, member.name(), location,
                    content.length, member.lastModified());

            Optional<MemberMatcher.Hit> hit = MemberMatcher.firstHit(content, query.matchers());
            if (hit.isPresent()) {
                log.debugf("%s matched %s", hit.get().matcher().key(), errorLocation(location));
                state.recordMatcherHit(hit.get(), record);
                query.extractionDirectory().ifPresent(dir -> extract(dir, member, location, content));
                return;
            }

            if (query.recursive()) {
                descend(member, location, content);
            }

            for (String name : state.pendingNames()) {
                if (MemberMatcher.matchesName(member.name(), name, query.caseSensitive())) {
                    state.recordName(name, record);
                }
            }
        }

        private void descend(Member member, String location, byte[] content) {
            ArchiveFormat format = registry.detector().detect(content);
            if (!format.isContainer() || state.isComplete()) {
                return;
            }
            int depth = state.depth();
            if (depth > maxDepth) {
                log.warnf("Not searching nested %s archive %s: depth %d exceeds limit %d",
                        format.label(), errorLocation(location), depth, maxDepth);
                return;
            }
            ContentHash hash = ContentHash.of(content);
            if (state.isAncestor(hash)) {
                log.warnf("Not searching nested %s archive %s: same content as an enclosing archive",
                        format.label(), errorLocation(location));
                return;
            }

            ContainerReader nested;
            try {
                nested = registry.open(format, BinaryData.of(content), FileContext.of(member.baseName()));
            } catch (IOException e) {
                log.warnf("Treating %s as a plain member, cannot open it as %s: %s",
                        errorLocation(location), format.label(), e.getMessage());
                return;
            }

            log.debugf("Descending into %s archive %s at depth %d", format.label(), errorLocation(location), depth);
            state.enter(hash);
            try (ContainerReader reader = nested) {
                searchContainer(reader, location);
            } catch (IOException e) {
                throw new ArchiveSearchException(errorLocation(location), "Failed to close nested archive", e);
            } finally {
                state.leave();
            }
        }

        private void extract(Path directory, Member member, String location, byte[] content) {
            try {
                extractionSink.extract(directory, member.name(), content);
            } catch (IOException e) {
                log.errorf(e, "Failed to extract %s to %s", errorLocation(location), directory);
                state.recordExtractionFailure(
                        new ExtractionFailure(member.name(), location, directory, e.getMessage()));
            }
        }

        private String errorLocation(String location) {
            return location.isEmpty() ? source : source + NESTED_SEPARATOR + location;
        }
    }

    static String locationOf(String prefix, Member member) {
        return prefix.isEmpty() ? member.name() : prefix + NESTED_SEPARATOR + member.name();
    }
}
