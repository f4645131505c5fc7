package com.phillippitts.tagprobe.domain;

/**
 * Container type of a stream.
 *
 * <p>M4A, M4B and M4P are the MP4 family; an MP4 stream with an unrecognised
 * {@code ftyp} subtype is reported as {@link #UNKNOWN} alongside {@link Format#MP4}.
 */
public enum FileType {
    UNKNOWN,
    MP3,
    M4A,
    M4B,
    M4P,
    FLAC,
    OGG,
    WAV,
    DSF;

    public boolean isMp4Family() {
        return this == M4A || this == M4B || this == M4P;
    }
}
