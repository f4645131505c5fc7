package com.phillippitts.tagprobe.domain;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Vorbis or Opus stream in an OGG container.
 *
 * @param tags             decoded comment packet values
 * @param sampleRate       sample rate from the identification packet, 48000 for Opus
 * @param granulePosition  last granule position seen before end of stream
 * @param duration         granulePosition / sampleRate
 */
public record OggMetadata(TagFields tags, long sampleRate, long granulePosition, Duration duration)
        implements TagBackedMetadata {

    public OggMetadata {
        Objects.requireNonNull(tags, "tags must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
    }

    @Override
    public Format format() {
        return Format.VORBIS;
    }

    @Override
    public FileType fileType() {
        return FileType.OGG;
    }

    @Override
    public Map<String, Object> raw() {
        return RawMaps.merge(tags.raw(),
                "sample_rate", sampleRate,
                "granule_position", granulePosition);
    }
}
