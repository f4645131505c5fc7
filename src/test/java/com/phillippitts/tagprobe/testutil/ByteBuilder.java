package com.phillippitts.tagprobe.testutil;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Fluent writer for hand-assembled test streams.
 */
public final class ByteBuilder {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public ByteBuilder ascii(String s) {
        byte[] b = s.getBytes(StandardCharsets.ISO_8859_1);
        out.write(b, 0, b.length);
        return this;
    }

    public ByteBuilder u8(int v) {
        out.write(v & 0xFF);
        return this;
    }

    public ByteBuilder le16(int v) {
        return le(v, 2);
    }

    public ByteBuilder le32(long v) {
        return le(v, 4);
    }

    public ByteBuilder le64(long v) {
        return le(v, 8);
    }

    public ByteBuilder be24(int v) {
        out.write((v >>> 16) & 0xFF);
        out.write((v >>> 8) & 0xFF);
        out.write(v & 0xFF);
        return this;
    }

    public ByteBuilder be32(long v) {
        for (int i = 3; i >= 0; i--) {
            out.write((int) (v >>> (8 * i)) & 0xFF);
        }
        return this;
    }

    public ByteBuilder bytes(byte[] b) {
        out.write(b, 0, b.length);
        return this;
    }

    public ByteBuilder zeros(int n) {
        return bytes(new byte[n]);
    }

    public int size() {
        return out.size();
    }

    public byte[] build() {
        return out.toByteArray();
    }

    private ByteBuilder le(long v, int width) {
        for (int i = 0; i < width; i++) {
            out.write((int) (v >>> (8 * i)) & 0xFF);
        }
        return this;
    }

    /** Writes a little-endian int into an existing buffer. */
    public static void putLEInt(byte[] arr, int offset, int value) {
        arr[offset] = (byte) (value & 0xFF);
        arr[offset + 1] = (byte) ((value >> 8) & 0xFF);
        arr[offset + 2] = (byte) ((value >> 16) & 0xFF);
        arr[offset + 3] = (byte) ((value >> 24) & 0xFF);
    }
}
