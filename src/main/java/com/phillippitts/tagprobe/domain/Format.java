package com.phillippitts.tagprobe.domain;

/**
 * Tag dialect found in a stream.
 */
public enum Format {
    UNKNOWN,
    ID3V1,
    ID3V2_2,
    ID3V2_3,
    ID3V2_4,
    MP4,
    VORBIS;

    /**
     * Maps an ID3v2 major version byte to its format.
     *
     * @param majorVersion value of the fourth header byte
     * @return matching format, or {@link #UNKNOWN} for versions other than 2, 3 and 4
     */
    public static Format ofId3v2MajorVersion(int majorVersion) {
        switch (majorVersion) {
            case 2:
                return ID3V2_2;
            case 3:
                return ID3V2_3;
            case 4:
                return ID3V2_4;
            default:
                return UNKNOWN;
        }
    }

    public boolean isId3v2() {
        return this == ID3V2_2 || this == ID3V2_3 || this == ID3V2_4;
    }
}
