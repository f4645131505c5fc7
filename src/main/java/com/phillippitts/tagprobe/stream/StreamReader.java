package com.phillippitts.tagprobe.stream;

import com.phillippitts.tagprobe.exception.StreamReadException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-size and typed reads on top of a {@link SeekableByteStream}.
 *
 * <p>All multi-byte integers are unsigned. Every failure of the underlying stream, including a
 * short read at end of stream, surfaces as {@link StreamReadException}. Requests above
 * {@code maxUpfrontBytes} are filled in bounded steps so a corrupt length field never causes one
 * huge allocation.
 */
public final class StreamReader {

    /** Default cap for a single up-front allocation: 10 MiB. */
    public static final int DEFAULT_MAX_UPFRONT_BYTES = 10 * 1024 * 1024;

    private final SeekableByteStream stream;
    private final int maxUpfrontBytes;

    public StreamReader(SeekableByteStream stream) {
        this(stream, DEFAULT_MAX_UPFRONT_BYTES);
    }

    public StreamReader(SeekableByteStream stream, int maxUpfrontBytes) {
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        if (maxUpfrontBytes <= 0) {
            throw new IllegalArgumentException("maxUpfrontBytes must be positive, got: " + maxUpfrontBytes);
        }
        this.maxUpfrontBytes = maxUpfrontBytes;
    }

    public SeekableByteStream stream() {
        return stream;
    }

    public int maxUpfrontBytes() {
        return maxUpfrontBytes;
    }

    /**
     * Reads exactly {@code n} bytes.
     *
     * @throws StreamReadException if fewer than {@code n} bytes remain or the stream fails
     */
    public byte[] readBytes(long n) {
        if (n < 0 || n > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Cannot read " + n + " bytes into one buffer");
        }
        long pos = position();
        long left = size() - pos;
        if (n > left) {
            throw new StreamReadException("Unexpected end of stream: need " + n + " bytes, " + left + " remain", pos);
        }
        if (n <= maxUpfrontBytes) {
            byte[] b = new byte[(int) n];
            readFully(b, 0, b.length);
            return b;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(maxUpfrontBytes);
        byte[] chunk = new byte[maxUpfrontBytes];
        long todo = n;
        while (todo > 0) {
            int step = (int) Math.min(chunk.length, todo);
            readFully(chunk, 0, step);
            out.write(chunk, 0, step);
            todo -= step;
        }
        return out.toByteArray();
    }

    /**
     * Reads up to {@code n} bytes without moving the cursor.
     *
     * @return the bytes available, shorter than {@code n} near end of stream
     */
    public byte[] peek(int n) {
        long pos = position();
        byte[] b = new byte[(int) Math.min(n, Math.max(0, size() - pos))];
        readFully(b, 0, b.length);
        seek(pos);
        return b;
    }

    public int readUnsignedByte() {
        return readBytes(1)[0] & 0xFF;
    }

    /**
     * Decodes a little-endian unsigned integer.
     *
     * @param width byte count, 1 to 8
     * @return value; widths of 8 may set the sign bit and should be treated as unsigned
     */
    public long readFixedLE(int width) {
        checkWidth(width);
        byte[] b = readBytes(width);
        long v = 0;
        for (int i = width - 1; i >= 0; i--) {
            v = (v << 8) | (b[i] & 0xFF);
        }
        return v;
    }

    /**
     * Decodes a big-endian unsigned integer.
     *
     * @param width byte count, 1 to 8
     */
    public long readFixedBE(int width) {
        checkWidth(width);
        byte[] b = readBytes(width);
        long v = 0;
        for (int i = 0; i < width; i++) {
            v = (v << 8) | (b[i] & 0xFF);
        }
        return v;
    }

    public int readUInt16LE() {
        return (int) readFixedLE(2);
    }

    public long readUInt32LE() {
        return readFixedLE(4);
    }

    public long readUInt64LE() {
        return readFixedLE(8);
    }

    public long readUInt32BE() {
        return readFixedBE(4);
    }

    /**
     * Reads {@code n} bytes as ISO-8859-1 text, one char per byte, for magic comparison.
     */
    public String readString(int n) {
        return new String(readBytes(n), StandardCharsets.ISO_8859_1);
    }

    /**
     * Moves the cursor forward by {@code n} bytes.
     *
     * @throws StreamReadException if the target lies beyond the end of the stream
     */
    public void skip(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot skip a negative count: " + n);
        }
        long pos = position();
        long target = pos + n;
        if (target < 0 || target > size()) {
            throw new StreamReadException("Cannot skip " + n + " bytes, only " + (size() - pos) + " remain", pos);
        }
        seek(target);
    }

    public void seek(long position) {
        try {
            stream.seek(position);
        } catch (IOException e) {
            throw new StreamReadException("Seek failed: " + e.getMessage(), position, e);
        }
    }

    public long position() {
        try {
            return stream.position();
        } catch (IOException e) {
            throw new StreamReadException("Cannot query position: " + e.getMessage(), -1, e);
        }
    }

    public long size() {
        try {
            return stream.size();
        } catch (IOException e) {
            throw new StreamReadException("Cannot query size: " + e.getMessage(), -1, e);
        }
    }

    public long remaining() {
        return size() - position();
    }

    /**
     * Opens a bounded window starting at the cursor.
     *
     * @param length window length in bytes
     * @return window over {@code [position, position + length)}
     */
    public RangeSeekableStream window(long length) {
        long pos = position();
        try {
            return new RangeSeekableStream(stream, pos, length);
        } catch (IOException e) {
            throw new StreamReadException("Cannot open " + length + " byte window: " + e.getMessage(), pos, e);
        }
    }

    private void readFully(byte[] b, int off, int len) {
        int done = 0;
        while (done < len) {
            int n;
            try {
                n = stream.read(b, off + done, len - done);
            } catch (IOException e) {
                throw new StreamReadException("Read failed: " + e.getMessage(), safePosition(), e);
            }
            if (n < 0) {
                throw new StreamReadException("Unexpected end of stream after " + done + " of " + len + " bytes",
                        safePosition());
            }
            done += n;
        }
    }

    private long safePosition() {
        try {
            return stream.position();
        } catch (IOException e) {
            return -1;
        }
    }

    private static void checkWidth(int width) {
        if (width < 1 || width > 8) {
            throw new IllegalArgumentException("Integer width must be 1..8 bytes, got: " + width);
        }
    }

    @Override
    public String toString() {
        return "StreamReader{stream=" + stream.getClass().getSimpleName()
                + ", maxUpfrontBytes=" + maxUpfrontBytes + "}";
    }

    /**
     * @return true when {@code actual} starts with the bytes of {@code magic} (ISO-8859-1)
     */
    public static boolean startsWith(byte[] actual, int offset, String magic) {
        byte[] m = magic.getBytes(StandardCharsets.ISO_8859_1);
        if (offset + m.length > actual.length) {
            return false;
        }
        return Arrays.equals(actual, offset, offset + m.length, m, 0, m.length);
    }
}
