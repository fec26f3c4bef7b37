package com.libragraph.finder.formats.handlers;

import com.libragraph.finder.formats.api.ContainerReader;
import com.libragraph.finder.formats.api.ContainerReaderFactory;
import com.libragraph.finder.formats.api.FileContext;
import com.libragraph.finder.formats.api.Member;
import com.libragraph.finder.types.ArchiveFormat;
import com.libragraph.finder.types.EntryType;
import com.libragraph.finder.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Container reader for ZIP archives (including JAR, DOCX and other ZIP-based files).
 */
@ApplicationScoped
public class ZipReaderFactory implements ContainerReaderFactory {

    private static final Logger log = Logger.getLogger(ZipReaderFactory.class);

    @Override
    public ArchiveFormat format() {
        return ArchiveFormat.ZIP;
    }

    @Override
    public ContainerReader open(BinaryData data, FileContext context) throws IOException {
        data.position(0);
        ZipFile zipFile = ZipFile.builder()
                .setSeekableByteChannel(data)
                .get();
        log.debugf("Opened ZIP %s (%d bytes)", context.filename(), data.size());
        return new ZipReader(zipFile);
    }

    /**
     * Reader instance for a specific ZIP file.
     */
    private static class ZipReader implements ContainerReader {
        private final ZipFile zipFile;
        private final List<ZipArchiveEntry> entries;
        private List<Member> members;

        ZipReader(ZipFile zipFile) {
            this.zipFile = zipFile;
            // Central directory order
            this.entries = Collections.list(zipFile.getEntries());
        }

        @Override
        public ArchiveFormat format() {
            return ArchiveFormat.ZIP;
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
            ZipArchiveEntry entry = entryFor(member);
            if (member.isDirectory()) {
                throw new IllegalArgumentException("Cannot read directory member: " + member.name());
            }

            // Each stream is positioned independently by ZipFile
            try (InputStream in = zipFile.getInputStream(entry)) {
                return BoundedReads.readMember(in, member, maxBytes);
            }
        }

        @Override
        public void close() throws IOException {
            zipFile.close();
        }

        private ZipArchiveEntry entryFor(Member member) {
            int index = member.index();
            if (index < 0 || index >= entries.size() || !entries.get(index).getName().equals(member.name())) {
                throw new IllegalArgumentException("Member not listed by this reader: " + member.name());
            }
            return entries.get(index);
        }

        private static Member toMember(int index, ZipArchiveEntry entry) {
            EntryType type;
            if (entry.isDirectory()) {
                type = EntryType.DIRECTORY;
            } else if (entry.isUnixSymlink()) {
                type = EntryType.SYMLINK;
            } else {
                type = EntryType.FILE;
            }
            Instant mtime = entry.getLastModifiedTime() != null
                    ? entry.getLastModifiedTime().toInstant() : null;
            return new Member(index, entry.getName(), entry.getSize(), mtime, type);
        }
    }
}
