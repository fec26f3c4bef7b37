package com.libragraph.finder.formats.test;

import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZOutputFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Helper to create in-memory ZIP and 7z archives for testing.
 *
 * <p>ZIP entries are STORED (no compression) with a fixed timestamp so output is deterministic.
 */
public class TestArchiveBuilder {

    /** 2024-01-01 00:00:00 UTC */
    public static final long FIXED_TIME = 1704067200000L;

    private final List<Entry> entries = new ArrayList<>();

    public record Entry(String path, byte[] data, boolean directory) {}

    public TestArchiveBuilder addFile(String path, String content) {
        entries.add(new Entry(path, content.getBytes(StandardCharsets.UTF_8), false));
        return this;
    }

    public TestArchiveBuilder addFile(String path, byte[] data) {
        entries.add(new Entry(path, data, false));
        return this;
    }

    public TestArchiveBuilder addDirectory(String path) {
        String dirPath = path.endsWith("/") ? path : path + "/";
        entries.add(new Entry(dirPath, new byte[0], true));
        return this;
    }

    /**
     * Adds a nested archive as an entry, built as ZIP.
     */
    public TestArchiveBuilder addNestedZip(String path, TestArchiveBuilder inner) {
        return addFile(path, inner.buildZip());
    }

    /**
     * Adds a nested archive as an entry, built as 7z.
     */
    public TestArchiveBuilder addNestedSevenZip(String path, TestArchiveBuilder inner) {
        return addFile(path, inner.buildSevenZip());
    }

    public byte[] buildZip() {
        try {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            try (ZipOutputStream zos = new ZipOutputStream(baos)) {
                zos.setMethod(ZipOutputStream.STORED);
                zos.setLevel(0);

                for (Entry entry : entries) {
                    ZipEntry ze = new ZipEntry(entry.path());
                    ze.setMethod(ZipEntry.STORED);
                    ze.setSize(entry.data().length);
                    ze.setCompressedSize(entry.data().length);

                    CRC32 crc = new CRC32();
                    crc.update(entry.data());
                    ze.setCrc(crc.getValue());
                    ze.setTime(FIXED_TIME);

                    zos.putNextEntry(ze);
                    zos.write(entry.data());
                    zos.closeEntry();
                }
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new RuntimeException("Failed to build test ZIP", e);
        }
    }

    /**
     * Builds a 7z archive with the library's default (LZMA2) compression.
     */
    public byte[] buildSevenZip() {
        SeekableInMemoryByteChannel channel = new SeekableInMemoryByteChannel();
        try (SevenZOutputFile out = new SevenZOutputFile(channel)) {
            for (Entry entry : entries) {
                SevenZArchiveEntry ze = new SevenZArchiveEntry();
                ze.setName(entry.directory()
                        ? entry.path().substring(0, entry.path().length() - 1)
                        : entry.path());
                ze.setDirectory(entry.directory());
                ze.setLastModifiedTime(FileTime.fromMillis(FIXED_TIME));

                out.putArchiveEntry(ze);
                if (!entry.directory()) {
                    out.write(entry.data());
                }
                out.closeArchiveEntry();
            }
            out.finish();
            return Arrays.copyOf(channel.array(), (int) channel.size());
        } catch (IOException e) {
            throw new RuntimeException("Failed to build test 7z", e);
        }
    }
}
