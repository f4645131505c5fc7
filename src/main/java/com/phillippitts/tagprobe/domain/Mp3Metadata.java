package com.phillippitts.tagprobe.domain;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * MPEG audio stream tagged with ID3v1 or ID3v2.
 *
 * @param format   ID3 dialect of the tag
 * @param tags     decoded tag values
 * @param duration constant-bitrate estimate from the first frame header
 */
public record Mp3Metadata(Format format, TagFields tags, Duration duration) implements TagBackedMetadata {

    public Mp3Metadata {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
    }

    @Override
    public FileType fileType() {
        return FileType.MP3;
    }

    @Override
    public Map<String, Object> raw() {
        return tags.raw();
    }
}
