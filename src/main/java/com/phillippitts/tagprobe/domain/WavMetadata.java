package com.phillippitts.tagprobe.domain;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Technical fields of a PCM WAV stream, plus the tag some encoders append after the audio.
 *
 * @param format        dialect of the tag following the audio, {@link Format#UNKNOWN} when absent
 * @param tags          decoded tag values
 * @param sampleRate    samples per second per channel
 * @param bitsPerSample bit depth
 * @param channels      channel count
 * @param dataSize      size of the data chunk payload in bytes
 * @param duration      playback duration derived from the data size
 */
public record WavMetadata(Format format, TagFields tags, long sampleRate, int bitsPerSample, int channels,
                          long dataSize, Duration duration) implements TagBackedMetadata {

    public WavMetadata {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
    }

    /**
     * Untagged WAV stream.
     */
    public WavMetadata(long sampleRate, int bitsPerSample, int channels, long dataSize, Duration duration) {
        this(Format.UNKNOWN, TagFields.empty(), sampleRate, bitsPerSample, channels, dataSize, duration);
    }

    @Override
    public FileType fileType() {
        return FileType.WAV;
    }

    @Override
    public Map<String, Object> raw() {
        return RawMaps.merge(tags.raw(),
                "sample_rate", sampleRate,
                "bits_per_sample", bitsPerSample,
                "channels", channels,
                "data_size", dataSize);
    }
}
