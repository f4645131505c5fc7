package com.phillippitts.tagprobe.exception;

/**
 * Thrown when a page checksum stored in the stream does not match the recomputed value.
 */
public class ChecksumMismatchException extends TagProbeException {

    private final long expected;
    private final long actual;

    public ChecksumMismatchException(long expected, long actual) {
        super(String.format("Expected crc %08x but computed %08x", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    /** @return checksum stored in the page header */
    public long getExpected() {
        return expected;
    }

    /** @return checksum recomputed over the page */
    public long getActual() {
        return actual;
    }
}
