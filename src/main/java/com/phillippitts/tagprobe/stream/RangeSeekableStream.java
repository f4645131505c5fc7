package com.phillippitts.tagprobe.stream;

import java.io.IOException;
import java.util.Objects;

/**
 * Bounded window {@code [start, start + length)} of a parent stream.
 *
 * <p>Positions are relative to the window start and reads stop at the window end, so a tag
 * decoder handed this view cannot consume bytes beyond its region. The window shares the
 * parent's cursor: callers re-seat the parent after the window has been used. Closing the
 * window does not close the parent.
 */
public final class RangeSeekableStream implements SeekableByteStream {

    private final SeekableByteStream parent;
    private final long start;
    private final long length;
    private long pos;
    private boolean closed;

    /**
     * @throws IOException if the window does not fit inside the parent stream
     */
    public RangeSeekableStream(SeekableByteStream parent, long start, long length) throws IOException {
        this.parent = Objects.requireNonNull(parent, "parent must not be null");
        if (start < 0 || length < 0 || start + length > parent.size()) {
            throw new IOException("Window [" + start + ", " + (start + length) + ") exceeds stream size "
                    + parent.size());
        }
        this.start = start;
        this.length = length;
    }

    @Override
    public int read(byte[] buf, int off, int len) throws IOException {
        ensureOpen();
        Objects.checkFromIndexSize(off, len, buf.length);
        if (len == 0) {
            return 0;
        }
        long left = length - pos;
        if (left <= 0) {
            return -1;
        }
        parent.seek(start + pos);
        int n = parent.read(buf, off, (int) Math.min(len, left));
        if (n > 0) {
            pos += n;
        }
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
        if (position < 0 || position > length) {
            throw new IOException("Seek to " + position + " outside [0, " + length + "]");
        }
        pos = position;
    }

    @Override
    public long size() throws IOException {
        ensureOpen();
        return length;
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
