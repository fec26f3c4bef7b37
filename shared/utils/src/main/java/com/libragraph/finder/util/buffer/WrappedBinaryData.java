package com.libragraph.finder.util.buffer;

import com.libragraph.finder.util.ContentHash;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Read-only view of a channel, typically an archive file opened by {@link BinaryData#open}.
 * Closing the view closes the channel.
 */
class WrappedBinaryData extends BinaryData {

    private final SeekableByteChannel delegate;
    private ContentHash hash;

    WrappedBinaryData(SeekableByteChannel delegate) {
        this.delegate = delegate;
    }

    /** Hashes the whole channel on first call. */
    @Override
    public ContentHash hash() {
        if (hash == null) {
            hash = computeHash();
        }
        return hash;
    }

    @Override
    public long size() {
        try {
            return delegate.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot determine channel size", e);
        }
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return delegate.read(dst);
    }

    @Override
    public long position() throws IOException {
        return delegate.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        delegate.position(newPosition);
        return this;
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }
}
