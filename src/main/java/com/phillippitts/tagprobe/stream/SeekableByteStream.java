package com.phillippitts.tagprobe.stream;

import java.io.Closeable;
import java.io.IOException;

/**
 * Forward-reading byte source with an absolute, repositionable cursor.
 *
 * <p>Every parser reads through this capability; none of them assumes the whole stream is
 * memory-resident. Blocking behaviour belongs to the implementation. After {@link #close()}
 * every call fails with an {@link IOException}.
 */
public interface SeekableByteStream extends Closeable {

    /**
     * Reads up to {@code len} bytes at the cursor and advances it.
     *
     * @return number of bytes read, or -1 at end of stream
     */
    int read(byte[] buf, int off, int len) throws IOException;

    /** @return current cursor offset from the start of the stream */
    long position() throws IOException;

    /**
     * Moves the cursor to an absolute offset. Offsets beyond {@link #size()} are rejected.
     */
    void seek(long position) throws IOException;

    /** @return total length of the stream in bytes */
    long size() throws IOException;
}
