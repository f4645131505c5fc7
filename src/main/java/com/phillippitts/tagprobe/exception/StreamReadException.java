package com.phillippitts.tagprobe.exception;

/**
 * Thrown when the underlying stream cannot deliver the requested bytes or cannot be repositioned.
 * Covers unexpected end of stream as well as I/O failures of the stream implementation.
 */
public class StreamReadException extends TagProbeException {

    private final long position;

    public StreamReadException(String message, long position) {
        super(message + " (position " + position + ")");
        this.position = position;
    }

    public StreamReadException(String message, long position, Throwable cause) {
        super(message + " (position " + position + ")", cause);
        this.position = position;
    }

    /**
     * @return stream offset at which the failure was detected, or -1 when unknown
     */
    public long getPosition() {
        return position;
    }
}
