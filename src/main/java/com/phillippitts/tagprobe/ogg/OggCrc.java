package com.phillippitts.tagprobe.ogg;

/**
 * CRC-32 used by OGG page headers: polynomial 0x04C11DB7, processed most significant bit
 * first, seed 0, no final XOR.
 *
 * <p>This is not the reflected CRC-32 of {@link java.util.zip.CRC32}.
 */
public final class OggCrc {

    public static final int POLYNOMIAL = 0x04C11DB7;

    private static final int[] TABLE = buildTable(POLYNOMIAL);

    private OggCrc() {
        // Utility class - prevent instantiation
    }

    /**
     * Continues a checksum over {@code data}.
     *
     * @param crc  running value, 0 to start
     * @param data bytes to add
     * @return updated running value
     */
    public static int update(int crc, byte[] data) {
        for (byte b : data) {
            crc = (crc << 8) ^ TABLE[((crc >>> 24) ^ b) & 0xFF];
        }
        return crc;
    }

    /**
     * @return checksum of {@code data} as an unsigned 32-bit value
     */
    public static long of(byte[] data) {
        return Integer.toUnsignedLong(update(0, data));
    }

    private static int[] buildTable(int poly) {
        int[] t = new int[256];
        for (int i = 0; i < 256; i++) {
            int crc = i << 24;
            for (int j = 0; j < 8; j++) {
                if ((crc & 0x80000000) != 0) {
                    crc = (crc << 1) ^ poly;
                } else {
                    crc <<= 1;
                }
            }
            t[i] = crc;
        }
        return t;
    }
}
