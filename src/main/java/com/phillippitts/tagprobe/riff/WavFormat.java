package com.phillippitts.tagprobe.riff;

/**
 * Constants for the RIFF/WAVE container layout.
 *
 * <p><b>WAV File Structure:</b>
 * <pre>
 * ┌─────────────────────────────────────┐
 * │ RIFF Header (12 bytes)              │  RIFF_HEADER_SIZE
 * ├─────────────────────────────────────┤
 * │ fmt chunk:                          │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - Chunk Data (≥16 bytes)          │  FMT_CHUNK_MIN_SIZE
 * ├─────────────────────────────────────┤
 * │ other chunks (LIST, fact, ...)      │  skipped by declared length
 * ├─────────────────────────────────────┤
 * │ data chunk:                         │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - PCM Audio Data (variable)       │
 * ├─────────────────────────────────────┤
 * │ optional trailing chunks, e.g. an   │
 * │ "id3 " chunk holding an ID3v2 tag   │
 * └─────────────────────────────────────┘
 * </pre>
 *
 * <p>Every chunk with an odd length is followed by one pad byte.
 *
 * @see WavReader
 * @since 1.0
 */
public final class WavFormat {

    public static final String RIFF_MAGIC = "RIFF";

    public static final String WAVE_MAGIC = "WAVE";

    public static final String FMT_CHUNK_ID = "fmt ";

    public static final String DATA_CHUNK_ID = "data";

    /** Chunk some encoders append after the audio to carry an ID3v2 tag. Matched case-insensitively. */
    public static final String ID3_CHUNK_ID = "id3 ";

    /**
     * Size of the RIFF header in bytes.
     *
     * <ul>
     *   <li>Bytes 0-3: "RIFF" chunk ID</li>
     *   <li>Bytes 4-7: File size - 8 (little-endian uint32)</li>
     *   <li>Bytes 8-11: "WAVE" format ID</li>
     * </ul>
     */
    public static final int RIFF_HEADER_SIZE = 12;

    /**
     * Size of a chunk header in bytes: 4-character ID followed by a little-endian uint32 length.
     */
    public static final int CHUNK_HEADER_SIZE = 8;

    /**
     * Minimum size of the fmt chunk data in bytes.
     *
     * <ul>
     *   <li>Bytes 0-1: Audio format (1 = PCM)</li>
     *   <li>Bytes 2-3: Number of channels</li>
     *   <li>Bytes 4-7: Sample rate (Hz)</li>
     *   <li>Bytes 8-11: Byte rate (bytes/sec)</li>
     *   <li>Bytes 12-13: Block align (bytes per sample frame)</li>
     *   <li>Bytes 14-15: Bits per sample</li>
     * </ul>
     */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** Audio format code for uncompressed PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
