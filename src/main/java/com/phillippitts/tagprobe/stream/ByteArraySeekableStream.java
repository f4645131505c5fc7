package com.phillippitts.tagprobe.stream;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link SeekableByteStream} over an in-memory byte array. The array is not copied.
 */
public final class ByteArraySeekableStream implements SeekableByteStream {

    private final byte[] data;
    private int pos;
    private boolean closed;

    public ByteArraySeekableStream(byte[] data) {
        this.data = Objects.requireNonNull(data, "data must not be null");
    }

    @Override
    public int read(byte[] buf, int off, int len) throws IOException {
        ensureOpen();
        Objects.checkFromIndexSize(off, len, buf.length);
        if (len == 0) {
            return 0;
        }
        if (pos >= data.length) {
            return -1;
        }
        int n = Math.min(len, data.length - pos);
        System.arraycopy(data, pos, buf, off, n);
        pos += n;
        return n;
    }

    @Override
    public long position() throws IOException {
        ensureOpen();
        return pos;
    }

    @Override
    public void seek(long position) throws IOException {
        ensureOpen();
        if (position < 0 || position > data.length) {
            throw new IOException("Seek to " + position + " outside [0, " + data.length + "]");
        }
        pos = (int) position;
    }

    @Override
    public long size() throws IOException {
        ensureOpen();
        return data.length;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }
}
