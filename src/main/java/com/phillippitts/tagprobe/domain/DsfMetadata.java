package com.phillippitts.tagprobe.domain;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * DSD stream file with an optional embedded ID3v2 tag.
 *
 * @param format      ID3v2 dialect of the embedded tag, {@link Format#UNKNOWN} when absent
 * @param tags        decoded tag values
 * @param sampleRate  sampling frequency
 * @param sampleCount samples per channel
 * @param duration    sampleCount / sampleRate, truncated to whole seconds
 */
public record DsfMetadata(Format format, TagFields tags, long sampleRate, long sampleCount, Duration duration)
        implements TagBackedMetadata {

    public DsfMetadata {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
    }

    @Override
    public FileType fileType() {
        return FileType.DSF;
    }

    @Override
    public Map<String, Object> raw() {
        return RawMaps.merge(tags.raw(),
                "sample_rate", sampleRate,
                "sample_count", sampleCount);
    }
}
