package com.phillippitts.tagprobe.exception;

/**
 * Thrown when a recognised structure declares a version this library does not handle,
 * e.g. an ID3v2 major version other than 2, 3 or 4.
 */
public class UnsupportedVersionException extends TagProbeException {

    private final int version;

    public UnsupportedVersionException(String what, int version, String expected) {
        super(what + " version: " + version + ", expected: " + expected);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
