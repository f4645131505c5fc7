package com.phillippitts.tagprobe.domain;

import java.util.Objects;

/**
 * Result of format identification: the tag dialect paired with the container type.
 *
 * @param format   tag dialect
 * @param fileType container type
 */
public record Classification(Format format, FileType fileType) {

    public Classification {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(fileType, "fileType must not be null");
    }

    public static Classification of(Format format, FileType fileType) {
        return new Classification(format, fileType);
    }

    /**
     * @param outer container type that wraps this classification
     * @return same format with the container replaced
     */
    public Classification wrappedIn(FileType outer) {
        return new Classification(format, outer);
    }

    /**
     * @return true when the stream is MP4 regardless of the subtype
     */
    public boolean isMp4() {
        return format == Format.MP4 || fileType.isMp4Family();
    }
}
