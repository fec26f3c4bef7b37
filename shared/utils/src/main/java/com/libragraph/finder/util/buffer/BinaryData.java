package com.libragraph.finder.util.buffer;

import com.libragraph.finder.util.ContentHash;
import org.apache.commons.codec.digest.Blake3;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Read-only binary data backed by RAM or a disk file.
 *
 * Implements SeekableByteChannel so archive readers can work on it directly.
 * Hash and size are always available, and the first bytes can be inspected
 * without disturbing the read position.
 */
public abstract class BinaryData implements SeekableByteChannel {

    /**
     * Opens a file read-only. The caller owns the returned handle and must close it.
     */
    public static BinaryData open(Path path) throws IOException {
        return new WrappedBinaryData(Files.newByteChannel(path, StandardOpenOption.READ));
    }

    /**
     * Wraps an in-memory byte array without copying it.
     */
    public static BinaryData of(byte[] data) {
        return new RamBuffer(data);
    }

    /**
     * Content hash (BLAKE3-128) of this binary data.
     * May be computed lazily on first call.
     */
    public abstract ContentHash hash();

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Reads the first N bytes as a header (for format detection).
     * Does not advance the buffer position.
     *
     * Hard limit: min(maxBytes, 64KB) to prevent unbounded reads.
     *
     * @param maxBytes maximum bytes to read
     * @return header bytes (may be shorter than maxBytes if file is smaller)
     */
    public byte[] readHeader(int maxBytes) {
        int limit = Math.min(maxBytes, 64 * 1024);
        int toRead = (int) Math.min(limit, size());

        try {
            long originalPos = position();
            position(0);

            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            while (buffer.hasRemaining() && read(buffer) != -1) {
                // a channel may return short reads
            }

            position(originalPos);

            byte[] header = new byte[buffer.position()];
            buffer.flip();
            buffer.get(header);
            return header;

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read header", e);
        }
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        throw new NonWritableChannelException();
    }

    @Override
    public SeekableByteChannel truncate(long size) throws IOException {
        throw new NonWritableChannelException();
    }

    /**
     * Hashes the full channel contents, restoring the position afterwards.
     */
    protected ContentHash computeHash() {
        try {
            long originalPos = position();
            position(0);

            Blake3 hasher = Blake3.initHash();
            ByteBuffer buffer = ByteBuffer.allocate(8192);

            while (read(buffer) != -1) {
                buffer.flip();
                byte[] bytes = new byte[buffer.remaining()];
                buffer.get(bytes);
                hasher.update(bytes);
                buffer.clear();
            }

            position(originalPos);

            return new ContentHash(hasher.doFinalize(16));

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compute hash", e);
        }
    }
}
