package com.phillippitts.tagprobe.mpeg;

import com.phillippitts.tagprobe.exception.UnsupportedFormatException;
import com.phillippitts.tagprobe.util.Bits;

/**
 * Raw fields of a 32-bit MPEG audio frame header, cut at fixed bit offsets.
 *
 * <p>Offsets: version 11 (2 bits), layer 13 (2), protection 15 (1), bitrate index 16 (4),
 * sample rate index 20 (2), padding 21 (1). The padding offset shares its bit with the low
 * bit of the sample rate index; durations computed by this library have always used it.
 *
 * @param version         version index, see {@link MpegTables}
 * @param layer           layer index, see {@link MpegTables}
 * @param protection      protection bit
 * @param bitrateIndex    bitrate table index
 * @param sampleRateIndex sample rate table index
 * @param padding         padding bit
 */
public record MpegFrameHeader(int version, int layer, int protection, int bitrateIndex,
                              int sampleRateIndex, int padding) {

    public static final int SIZE = 4;

    /**
     * @param header at least 4 bytes starting with the frame header
     * @throws IllegalArgumentException if fewer than 4 bytes are given
     */
    public static MpegFrameHeader decode(byte[] header) {
        return new MpegFrameHeader(
                (int) Bits.cutBits(header, 11, 2),
                (int) Bits.cutBits(header, 13, 2),
                (int) Bits.cutBits(header, 15, 1),
                (int) Bits.cutBits(header, 16, 4),
                (int) Bits.cutBits(header, 20, 2),
                (int) Bits.cutBits(header, 21, 1));
    }

    /**
     * @throws UnsupportedFormatException for the reserved version or layer
     */
    public int samplesPerFrame() {
        if (version == MpegTables.VERSION_RESERVED || layer == MpegTables.LAYER_RESERVED) {
            throw new UnsupportedFormatException("Reserved MPEG version/layer: version=" + version
                    + ", layer=" + layer);
        }
        return MpegTables.samplesPerFrame(version, layer);
    }

    /**
     * @throws UnsupportedFormatException for free-format or invalid bitrate indexes
     */
    public int bitrateKbps() {
        samplesPerFrame();
        int kbps = MpegTables.bitrateKbps(version, layer, bitrateIndex);
        if (kbps == 0) {
            throw new UnsupportedFormatException("Unsupported MPEG bitrate index: " + bitrateIndex);
        }
        return kbps;
    }

    /**
     * @throws UnsupportedFormatException for the reserved version or sample rate index
     */
    public int sampleRate() {
        int rate = MpegTables.sampleRate(version, sampleRateIndex);
        if (rate == 0) {
            throw new UnsupportedFormatException("Unsupported MPEG sample rate index: " + sampleRateIndex
                    + " (version " + version + ")");
        }
        return rate;
    }

    public int slotSize() {
        return MpegTables.slotSize(layer);
    }
}
