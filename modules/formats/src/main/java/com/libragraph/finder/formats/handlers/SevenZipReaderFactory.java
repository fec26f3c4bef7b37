package com.libragraph.finder.formats.handlers;

import com.libragraph.finder.formats.api.ContainerReader;
import com.libragraph.finder.formats.api.ContainerReaderFactory;
import com.libragraph.finder.formats.api.FileContext;
import com.libragraph.finder.formats.api.Member;
import com.libragraph.finder.types.ArchiveFormat;
import com.libragraph.finder.types.EntryType;
import com.libragraph.finder.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Container reader for 7z archives.
 *
 * <p>7z packs many members into one compressed stream, so the library keeps a
 * single decoding position per archive. This reader goes through
 * {@link SevenZFile#getInputStream(SevenZArchiveEntry)}, which repositions the
 * decoder for every requested entry, so members can be read in any order.
 */
@ApplicationScoped
public class SevenZipReaderFactory implements ContainerReaderFactory {

    private static final Logger log = Logger.getLogger(SevenZipReaderFactory.class);

    @Override
    public ArchiveFormat format() {
        return ArchiveFormat.SEVEN_ZIP;
    }

    @Override
    public ContainerReader open(BinaryData data, FileContext context) throws IOException {
        data.position(0);
        SevenZFile sevenZFile = SevenZFile.builder()
                .setSeekableByteChannel(data)
                .get();
        log.debugf("Opened 7z %s (%d bytes)", context.filename(), data.size());
        return new SevenZipReader(sevenZFile);
    }

    private static class SevenZipReader implements ContainerReader {
        private final SevenZFile sevenZFile;
        private final List<SevenZArchiveEntry> entries = new ArrayList<>();
        private List<Member> members;

        SevenZipReader(SevenZFile sevenZFile) {
            this.sevenZFile = sevenZFile;
            for (SevenZArchiveEntry entry : sevenZFile.getEntries()) {
                entries.add(entry);
            }
        }

        @Override
        public ArchiveFormat format() {
            return ArchiveFormat.SEVEN_ZIP;
        }

        @Override
        public List<Member> listMembers() {
            if (members == null) {
                List<Member> listed = new ArrayList<>(entries.size());
                for (int i = 0; i < entries.size(); i++) {
                    listed.add(toMember(i, entries.get(i)));
                }
                members = Collections.unmodifiableList(listed);
            }
            return members;
        }

        @Override
        public byte[] readMember(Member member, long maxBytes) throws IOException {
            SevenZArchiveEntry entry = entryFor(member);
            if (member.isDirectory()) {
                throw new IllegalArgumentException("Cannot read directory member: " + member.name());
            }
            if (!entry.hasStream()) {
                return new byte[0];
            }

            try (InputStream in = sevenZFile.getInputStream(entry)) {
                return BoundedReads.readMember(in, member, maxBytes);
            }
        }

        @Override
        public void close() throws IOException {
            sevenZFile.close();
        }

        private SevenZArchiveEntry entryFor(Member member) {
            int index = member.index();
            if (index < 0 || index >= entries.size()
                    || !normalizeName(entries.get(index).getName()).equals(member.name())) {
                throw new IllegalArgumentException("Member not listed by this reader: " + member.name());
            }
            return entries.get(index);
        }

        private static Member toMember(int index, SevenZArchiveEntry entry) {
            EntryType type = entry.isDirectory() ? EntryType.DIRECTORY : EntryType.FILE;
            Instant mtime = entry.getHasLastModifiedDate()
                    ? entry.getLastModifiedTime().toInstant() : null;
            return new Member(index, normalizeName(entry.getName()), entry.getSize(), mtime, type);
        }

        /** 7z archives written on Windows may carry backslash separators. */
        private static String normalizeName(String name) {
            return name == null ? "" : name.replace('\\', '/');
        }
    }
}
