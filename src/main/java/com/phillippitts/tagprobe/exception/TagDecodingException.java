package com.phillippitts.tagprobe.exception;

/**
 * Thrown by tag decoders when a tag region handed to them is malformed.
 */
public class TagDecodingException extends TagProbeException {

    private final String tagType;

    public TagDecodingException(String tagType, String message) {
        super(message + " (tag: " + tagType + ")");
        this.tagType = tagType;
    }

    public TagDecodingException(String tagType, String message, Throwable cause) {
        super(message + " (tag: " + tagType + ")", cause);
        this.tagType = tagType;
    }

    public String getTagType() {
        return tagType;
    }
}
