package com.phillippitts.tagprobe.flac;

/**
 * FLAC metadata block types. Only STREAMINFO, VORBIS_COMMENT and PICTURE are interpreted;
 * the others, and any reserved code, are skipped by length.
 */
public enum FlacBlockType {
    STREAMINFO(0),
    PADDING(1),
    APPLICATION(2),
    SEEKTABLE(3),
    VORBIS_COMMENT(4),
    CUESHEET(5),
    PICTURE(6),
    OTHER(-1);

    private final int code;

    FlacBlockType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @param code low seven bits of the block header byte
     * @return matching type, {@link #OTHER} for reserved codes
     */
    public static FlacBlockType of(int code) {
        for (FlacBlockType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        return OTHER;
    }
}
