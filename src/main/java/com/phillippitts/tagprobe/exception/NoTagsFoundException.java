package com.phillippitts.tagprobe.exception;

/**
 * Thrown when no recognisable tag region exists in the stream.
 */
public class NoTagsFoundException extends TagProbeException {

    public NoTagsFoundException() {
        super("No tags found");
    }

    public NoTagsFoundException(String message) {
        super(message);
    }
}
