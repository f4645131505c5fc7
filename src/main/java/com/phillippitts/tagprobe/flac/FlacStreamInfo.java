package com.phillippitts.tagprobe.flac;

import com.phillippitts.tagprobe.util.Bits;
import com.phillippitts.tagprobe.util.Durations;

import java.time.Duration;

/**
 * Fields of the STREAMINFO block needed for duration and technical reporting.
 *
 * <p>Bit layout after the block header: min/max block size (16+16), min/max frame size (24+24),
 * sample rate (20 @80), channels - 1 (3 @100), bits per sample - 1 (5 @103),
 * total samples (36 @108), then the MD5 signature.
 *
 * @param sampleRate    Hz, 0 is invalid per format but tolerated
 * @param channels      1..8
 * @param bitsPerSample 4..32
 * @param totalSamples  0 when unknown
 */
public record FlacStreamInfo(long sampleRate, int channels, int bitsPerSample, long totalSamples) {

    /** Number of STREAMINFO bytes needed to reach the end of the total-samples field. */
    static final int MIN_LENGTH = 18;

    /**
     * @param block STREAMINFO payload
     * @throws IllegalArgumentException if the block is too short
     */
    public static FlacStreamInfo parse(byte[] block) {
        long sampleRate = Bits.cutBits(block, 80, 20);
        int channels = (int) Bits.cutBits(block, 100, 3) + 1;
        int bitsPerSample = (int) Bits.cutBits(block, 103, 5) + 1;
        long totalSamples = Bits.cutBits(block, 108, 36);
        return new FlacStreamInfo(sampleRate, channels, bitsPerSample, totalSamples);
    }

    /**
     * @return totalSamples / sampleRate, or zero when the sample rate is 0
     */
    public Duration duration() {
        return Durations.ofFraction(totalSamples, sampleRate);
    }
}
