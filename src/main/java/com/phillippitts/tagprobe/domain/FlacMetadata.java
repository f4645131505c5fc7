package com.phillippitts.tagprobe.domain;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * FLAC stream-info fields plus the decoded Vorbis comment and picture blocks.
 *
 * @param tags          decoded comment block values, with the picture block merged in
 * @param sampleRate    sample rate from the stream-info block
 * @param channels      channel count from the stream-info block
 * @param bitsPerSample bit depth from the stream-info block
 * @param totalSamples  total inter-channel samples, 0 when unknown
 * @param duration      totalSamples / sampleRate
 */
public record FlacMetadata(TagFields tags, long sampleRate, int channels, int bitsPerSample,
                           long totalSamples, Duration duration) implements TagBackedMetadata {

    public FlacMetadata {
        Objects.requireNonNull(tags, "tags must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
    }

    @Override
    public Format format() {
        return Format.VORBIS;
    }

    @Override
    public FileType fileType() {
        return FileType.FLAC;
    }

    @Override
    public Map<String, Object> raw() {
        return RawMaps.merge(tags.raw(),
                "sample_rate", sampleRate,
                "channels", channels,
                "bits_per_sample", bitsPerSample,
                "total_samples", totalSamples);
    }
}
