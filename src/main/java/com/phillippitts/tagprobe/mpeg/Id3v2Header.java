package com.phillippitts.tagprobe.mpeg;

import com.phillippitts.tagprobe.domain.Format;
import com.phillippitts.tagprobe.exception.FormatMismatchException;
import com.phillippitts.tagprobe.exception.UnsupportedVersionException;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.util.Bits;
import com.phillippitts.tagprobe.util.LogSanitizer;

import java.util.Arrays;

/**
 * The 10-byte header opening an ID3v2 tag: "ID3", major version, revision, flags and a
 * 28-bit synchsafe size that excludes the header and the optional 10-byte footer.
 *
 * @param majorVersion 2, 3 or 4
 * @param revision     revision byte
 * @param flags        flag byte
 * @param size         tag size after the header, footer excluded
 */
public record Id3v2Header(int majorVersion, int revision, int flags, long size) {

    public static final String MAGIC = "ID3";

    public static final int HEADER_SIZE = 10;

    public static final int FOOTER_SIZE = 10;

    public static final int FLAG_FOOTER_PRESENT = 0x10;

    /**
     * Reads the header at the cursor.
     *
     * @throws FormatMismatchException if the "ID3" marker is missing
     * @throws UnsupportedVersionException if the major version is not 2, 3 or 4
     */
    public static Id3v2Header read(StreamReader in) {
        byte[] b = in.readBytes(HEADER_SIZE);
        if (!StreamReader.startsWith(b, 0, MAGIC)) {
            throw new FormatMismatchException(MAGIC, LogSanitizer.printable(b, 3));
        }
        int major = b[3] & 0xFF;
        if (Format.ofId3v2MajorVersion(major) == Format.UNKNOWN) {
            throw new UnsupportedVersionException("ID3", major, "2, 3 or 4");
        }
        long size = Bits.get7BitChunkedValue(Arrays.copyOfRange(b, 6, 10));
        return new Id3v2Header(major, b[4] & 0xFF, b[5] & 0xFF, size);
    }

    public boolean footerPresent() {
        return (flags & FLAG_FOOTER_PRESENT) != 0;
    }

    /**
     * @return bytes occupied by the whole tag: header, body and footer if present
     */
    public long totalSize() {
        return HEADER_SIZE + size + (footerPresent() ? FOOTER_SIZE : 0);
    }

    public Format format() {
        return Format.ofId3v2MajorVersion(majorVersion);
    }
}
