package com.libragraph.finder.util.buffer;

import com.libragraph.finder.util.ContentHash;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.Objects;

/**
 * BinaryData backed by an in-memory byte array.
 *
 * Used for archive bytes received from a caller and for nested archives
 * read out of an enclosing container. The array is not copied; callers
 * must not mutate it while the buffer is in use.
 */
public class RamBuffer extends BinaryData {
    private final byte[] data;
    private long position;
    private ContentHash cachedHash;

    public RamBuffer(byte[] data) {
        this.data = Objects.requireNonNull(data, "data cannot be null");
        this.position = 0;
    }

    @Override
    public ContentHash hash() {
        if (cachedHash == null) {
            cachedHash = ContentHash.of(data);
        }
        return cachedHash;
    }

    @Override
    public long size() {
        return data.length;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (position >= data.length) {
            return -1;  // EOF
        }

        int remaining = (int) (data.length - position);
        int toRead = Math.min(remaining, dst.remaining());
        dst.put(data, (int) position, toRead);
        position += toRead;
        return toRead;
    }

    @Override
    public long position() throws IOException {
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        this.position = newPosition;
        return this;
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public void close() throws IOException {
        // No resources to close for RAM buffer
    }
}
