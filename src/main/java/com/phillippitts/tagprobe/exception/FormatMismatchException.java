package com.phillippitts.tagprobe.exception;

/**
 * Thrown when an expected magic number or structural marker is absent.
 */
public class FormatMismatchException extends TagProbeException {

    private final String expected;
    private final String actual;

    public FormatMismatchException(String expected, String actual) {
        super("Expected '" + expected + "' but found '" + actual + "'");
        this.expected = expected;
        this.actual = actual;
    }

    public FormatMismatchException(String message) {
        super(message);
        this.expected = "";
        this.actual = "";
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
