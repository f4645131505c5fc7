package com.phillippitts.tagprobe.ogg;

import com.phillippitts.tagprobe.exception.FormatMismatchException;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.util.LogSanitizer;

/**
 * Fixed 27-byte OGG page header. Multi-byte fields are little-endian.
 *
 * <pre>
 *  0  capture pattern "OggS"
 *  4  stream structure version
 *  5  header type flags (0x01 continued, 0x02 first page, 0x04 last page)
 *  6  granule position (64 bit)
 * 14  bitstream serial number
 * 18  page sequence number
 * 22  CRC-32 (zeroed while computing)
 * 26  number of segments
 * </pre>
 *
 * @param version          stream structure version, 0 for all known streams
 * @param flags            header type flags
 * @param granulePosition  codec-defined position, -1 when no packet ends on this page
 * @param serialNumber     logical stream id, unsigned 32 bit
 * @param sequenceNumber   page counter within the logical stream, unsigned 32 bit
 * @param crc              stored checksum, unsigned 32 bit
 * @param segmentCount     entries in the segment table
 */
public record OggPageHeader(int version, int flags, long granulePosition, long serialNumber,
                            long sequenceNumber, long crc, int segmentCount) {

    public static final String CAPTURE_PATTERN = "OggS";

    public static final int SIZE = 27;

    public static final int CRC_OFFSET = 22;

    public static final int FLAG_CONTINUED = 0x01;

    public static final int FLAG_FIRST_PAGE = 0x02;

    public static final int FLAG_LAST_PAGE = 0x04;

    /** Granule value marking a page on which no packet completes. */
    public static final long NO_GRANULE = -1L;

    /**
     * @param header the 27 header bytes
     * @throws FormatMismatchException if the capture pattern is missing
     */
    static OggPageHeader parse(byte[] header) {
        if (!StreamReader.startsWith(header, 0, CAPTURE_PATTERN)) {
            throw new FormatMismatchException(CAPTURE_PATTERN, LogSanitizer.printable(header, 4));
        }
        return new OggPageHeader(
                header[4] & 0xFF,
                header[5] & 0xFF,
                le(header, 6, 8),
                le(header, 14, 4),
                le(header, 18, 4),
                le(header, CRC_OFFSET, 4),
                header[26] & 0xFF);
    }

    public boolean isContinued() {
        return (flags & FLAG_CONTINUED) != 0;
    }

    public boolean isFirstPage() {
        return (flags & FLAG_FIRST_PAGE) != 0;
    }

    public boolean isLastPage() {
        return (flags & FLAG_LAST_PAGE) != 0;
    }

    private static long le(byte[] b, int off, int width) {
        long v = 0;
        for (int i = width - 1; i >= 0; i--) {
            v = (v << 8) | (b[off + i] & 0xFF);
        }
        return v;
    }
}
