package com.phillippitts.tagprobe.exception;

/**
 * Base exception for all tagprobe errors.
 * All parser and identification failures extend this class so callers can handle them in one place.
 */
public class TagProbeException extends RuntimeException {

    public TagProbeException(String message) {
        super(message);
    }

    public TagProbeException(String message, Throwable cause) {
        super(message, cause);
    }

    public TagProbeException(Throwable cause) {
        super(cause);
    }
}
