package com.phillippitts.tagprobe.domain;

import java.util.Map;
import java.util.Objects;

/**
 * MP4 family stream. All values come from the atom decoder.
 *
 * @param fileType M4A, M4B, M4P or UNKNOWN for other {@code ftyp} subtypes
 * @param tags     decoded atom values
 */
public record Mp4Metadata(FileType fileType, TagFields tags) implements TagBackedMetadata {

    public Mp4Metadata {
        Objects.requireNonNull(fileType, "fileType must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
    }

    @Override
    public Format format() {
        return Format.MP4;
    }

    @Override
    public Map<String, Object> raw() {
        return tags.raw();
    }
}
