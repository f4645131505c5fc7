package com.phillippitts.tagprobe.mpeg;

/**
 * Lookup tables for MPEG audio frame headers, indexed by the raw header bits.
 *
 * <p>Version index: 0 = MPEG 2.5, 1 = reserved, 2 = MPEG 2, 3 = MPEG 1.
 * Layer index: 0 = reserved, 1 = Layer III, 2 = Layer II, 3 = Layer I.
 * Reserved rows are all zero.
 */
final class MpegTables {

    static final int VERSION_MPEG25 = 0;
    static final int VERSION_RESERVED = 1;
    static final int VERSION_MPEG2 = 2;
    static final int VERSION_MPEG1 = 3;

    static final int LAYER_RESERVED = 0;
    static final int LAYER_3 = 1;
    static final int LAYER_2 = 2;
    static final int LAYER_1 = 3;

    /** Bitrates in kbps by [version][layer][bitrate index]; index 15 is invalid and absent. */
    private static final int[][][] BITRATES_KBPS = {
        { // MPEG 2.5
            {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0},
            {0, 8, 16, 24, 32, 40, 48, 56, 64, 80, 96, 112, 128, 144, 160},
            {0, 8, 16, 24, 32, 40, 48, 56, 64, 80, 96, 112, 128, 144, 160},
            {0, 32, 48, 56, 64, 80, 96, 112, 128, 144, 160, 176, 192, 224, 256},
        },
        { // reserved
            {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0},
            {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0},
            {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0},
            {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0},
        },
        { // MPEG 2
            {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0},
            {0, 8, 16, 24, 32, 40, 48, 56, 64, 80, 96, 112, 128, 144, 160},
            {0, 8, 16, 24, 32, 40, 48, 56, 64, 80, 96, 112, 128, 144, 160},
            {0, 32, 48, 56, 64, 80, 96, 112, 128, 144, 160, 176, 192, 224, 256},
        },
        { // MPEG 1
            {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0},
            {0, 32, 40, 48, 56, 64, 80, 96, 112, 128, 160, 192, 224, 256, 320},
            {0, 32, 48, 56, 64, 80, 96, 112, 128, 160, 192, 224, 256, 320, 384},
            {0, 32, 64, 96, 128, 160, 192, 224, 256, 288, 320, 352, 384, 416, 448},
        },
    };

    /** Sample rates in Hz by [version][sample rate index]; index 3 is reserved and absent. */
    private static final int[][] SAMPLE_RATES = {
        {11025, 12000, 8000},
        {0, 0, 0},
        {22050, 24000, 16000},
        {44100, 48000, 32000},
    };

    /** Samples per frame by [version][layer]. */
    private static final int[][] SAMPLES_PER_FRAME = {
        {0, 576, 1152, 384},
        {0, 0, 0, 0},
        {0, 576, 1152, 384},
        {0, 1152, 1152, 384},
    };

    /** Padding slot size in bytes by [layer]. */
    private static final int[] SLOT_SIZE = {0, 1, 1, 4};

    private MpegTables() {
    }

    /** @return kbps, 0 for reserved rows, free format (index 0) or index 15 */
    static int bitrateKbps(int version, int layer, int bitrateIndex) {
        int[] row = BITRATES_KBPS[version][layer];
        return bitrateIndex < row.length ? row[bitrateIndex] : 0;
    }

    /** @return Hz, 0 for the reserved version or sample rate index 3 */
    static int sampleRate(int version, int sampleRateIndex) {
        int[] row = SAMPLE_RATES[version];
        return sampleRateIndex < row.length ? row[sampleRateIndex] : 0;
    }

    static int samplesPerFrame(int version, int layer) {
        return SAMPLES_PER_FRAME[version][layer];
    }

    static int slotSize(int layer) {
        return SLOT_SIZE[layer];
    }
}
