package com.phillippitts.tagprobe.util;

/**
 * Bit-level field extraction from byte buffers.
 *
 * <p>Bit offsets count from the most significant bit of {@code buf[0]}, matching the
 * big-endian bit order of FLAC stream-info blocks and MPEG frame headers.
 *
 * @since 1.0
 */
public final class Bits {

    /** Widest value {@link #cutBits} can return. */
    public static final int MAX_CUT_WIDTH = 64;

    private Bits() {
        // Utility class - prevent instantiation
    }

    /**
     * Extracts an unsigned value spanning an arbitrary, possibly unaligned, bit range.
     *
     * @param buf       source bytes
     * @param bitOffset first bit to read, 0 being the MSB of {@code buf[0]}
     * @param bitWidth  number of bits, 0 to 64
     * @return the bits as an unsigned value; a 64-bit result may set the sign bit
     * @throws IllegalArgumentException if the width exceeds 64 or the range leaves the buffer
     */
    public static long cutBits(byte[] buf, int bitOffset, int bitWidth) {
        if (bitWidth < 0 || bitWidth > MAX_CUT_WIDTH) {
            throw new IllegalArgumentException("bitWidth must be 0.." + MAX_CUT_WIDTH + ", got: " + bitWidth);
        }
        if (bitOffset < 0 || (long) buf.length * 8 < (long) bitOffset + bitWidth) {
            throw new IllegalArgumentException("Out of bounds read: bits [" + bitOffset + ", "
                    + ((long) bitOffset + bitWidth) + ") of a " + buf.length + " byte buffer");
        }
        long v = 0;
        int bit = bitOffset;
        int left = bitWidth;
        // leading partial byte
        int lead = bit & 7;
        if (lead != 0 && left > 0) {
            int avail = 8 - lead;
            int take = Math.min(avail, left);
            int b = buf[bit >>> 3] & (0xFF >>> lead);
            v = b >>> (avail - take);
            bit += take;
            left -= take;
        }
        while (left >= 8) {
            v = (v << 8) | (buf[bit >>> 3] & 0xFF);
            bit += 8;
            left -= 8;
        }
        if (left > 0) {
            v = (v << left) | ((buf[bit >>> 3] & 0xFF) >>> (8 - left));
        }
        return v;
    }

    /**
     * @param b byte to test
     * @param n bit index, 0 being the least significant bit
     */
    public static boolean getBit(byte b, int n) {
        return (b & (1 << n)) != 0;
    }

    /**
     * Interprets bytes as a big-endian base-128 (synchsafe) integer: only the low seven bits
     * of every byte carry value.
     */
    public static long get7BitChunkedValue(byte[] bytes) {
        long n = 0;
        for (byte b : bytes) {
            n = (n << 7) | (b & 0x7F);
        }
        return n;
    }

    /**
     * Interprets bytes as a big-endian base-256 integer.
     */
    public static long getChunkedValue(byte[] bytes) {
        long n = 0;
        for (byte b : bytes) {
            n = (n << 8) | (b & 0xFF);
        }
        return n;
    }
}
