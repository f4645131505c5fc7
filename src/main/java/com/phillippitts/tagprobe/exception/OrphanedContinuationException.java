package com.phillippitts.tagprobe.exception;

/**
 * Thrown when an OGG page is flagged as continuing a packet that was never started
 * for its logical stream.
 */
public class OrphanedContinuationException extends TagProbeException {

    private final long serialNumber;

    public OrphanedContinuationException(long serialNumber) {
        super("Could not find continued packet for stream " + serialNumber);
        this.serialNumber = serialNumber;
    }

    public long getSerialNumber() {
        return serialNumber;
    }
}
