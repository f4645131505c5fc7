package com.phillippitts.tagprobe.config;

import com.phillippitts.tagprobe.stream.SeekableByteStream;
import com.phillippitts.tagprobe.stream.StreamReader;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

/**
 * Read limits for container parsing.
 * Binds to properties prefixed with "tagprobe.read".
 *
 * <p>Example application.properties:
 * <pre>
 * tagprobe.read.max-upfront-bytes=10485760
 * tagprobe.read.max-wrap-depth=2
 * </pre>
 *
 * @param maxUpfrontBytes largest single allocation for one read; longer spans are read in steps
 * @param maxWrapDepth    container levels the identifier follows, counting the outer RIFF container;
 *                        2 is the least that reaches a tag after the audio
 */
@ConfigurationProperties(prefix = "tagprobe.read")
@Validated
public record TagProbeProperties(
        @DefaultValue("10485760")
        @Positive(message = "Max upfront bytes must be positive")
        int maxUpfrontBytes,

        @DefaultValue("2")
        @Min(value = 2, message = "Max wrap depth must be at least 2 to look past WAV audio data")
        @Max(value = 8, message = "Max wrap depth must not exceed 8")
        int maxWrapDepth
) {

    @ConstructorBinding
    public TagProbeProperties {
    }

    /**
     * Default constructor with standard values: 10 MiB up-front cap, one level of RIFF wrapping.
     */
    public TagProbeProperties() {
        this(StreamReader.DEFAULT_MAX_UPFRONT_BYTES, 2);
    }

    /**
     * @return reader over {@code stream} honouring {@link #maxUpfrontBytes()}
     */
    public StreamReader newReader(SeekableByteStream stream) {
        return new StreamReader(stream, maxUpfrontBytes);
    }
}
