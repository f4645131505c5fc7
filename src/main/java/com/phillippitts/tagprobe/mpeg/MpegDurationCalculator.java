package com.phillippitts.tagprobe.mpeg;

import com.phillippitts.tagprobe.exception.UnsupportedFormatException;

import java.time.Duration;

/**
 * Estimates MPEG audio duration from the first frame header, assuming a constant bitrate.
 */
public final class MpegDurationCalculator {

    private MpegDurationCalculator() {
        // Utility class - prevent instantiation
    }

    /**
     * Frame size is {@code floor(frameDuration * kbps * 1000 / 8)}, plus one slot when the
     * padding bit is set, plus 2 bytes when the protection bit is set, plus the 4 header bytes.
     * The result is {@code round(strippedBytes / frameSize * frameDuration)} whole seconds.
     *
     * @param header        first 4 bytes of the first audio frame
     * @param strippedBytes stream length without tag bytes
     * @return estimated duration in whole seconds
     * @throws UnsupportedFormatException if the header uses reserved or free-format values
     */
    public static Duration computeDuration(byte[] header, long strippedBytes) {
        if (strippedBytes < 0) {
            throw new IllegalArgumentException("strippedBytes must not be negative, got: " + strippedBytes);
        }
        MpegFrameHeader h = MpegFrameHeader.decode(header);
        double frameDuration = (double) h.samplesPerFrame() / h.sampleRate();
        double frameSize = Math.floor(frameDuration * h.bitrateKbps() * 1000 / 8);
        if (h.padding() == 1) {
            frameSize += h.slotSize();
        }
        if (h.protection() == 1) {
            frameSize += 2;
        }
        frameSize += MpegFrameHeader.SIZE;
        return Duration.ofSeconds(Math.round(strippedBytes / frameSize * frameDuration));
    }
}
