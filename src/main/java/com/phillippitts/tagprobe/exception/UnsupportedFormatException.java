package com.phillippitts.tagprobe.exception;

/**
 * Thrown when a recognised container holds a variant that cannot be measured,
 * e.g. non-PCM WAV audio or an MPEG header with reserved version/layer bits.
 */
public class UnsupportedFormatException extends TagProbeException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
