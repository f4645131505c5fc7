package com.phillippitts.tagprobe.riff;

import com.phillippitts.tagprobe.domain.Format;
import com.phillippitts.tagprobe.domain.TagFields;
import com.phillippitts.tagprobe.domain.WavMetadata;
import com.phillippitts.tagprobe.exception.FormatMismatchException;
import com.phillippitts.tagprobe.exception.StreamReadException;
import com.phillippitts.tagprobe.exception.UnsupportedFormatException;
import com.phillippitts.tagprobe.exception.UnsupportedVersionException;
import com.phillippitts.tagprobe.mpeg.Id3v2Header;
import com.phillippitts.tagprobe.mpeg.Mp3Reader;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.tag.TagDecoders;
import com.phillippitts.tagprobe.util.Durations;
import com.phillippitts.tagprobe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Walks the chunks of a RIFF/WAVE stream.
 *
 * <p>The {@code fmt } chunk supplies sample rate, channel count and bit depth; the {@code data}
 * chunk size yields the duration. All other chunks are skipped by their declared length. Chunks
 * with an odd length are followed by one pad byte, which is skipped so the cursor always lands
 * on the next chunk header.
 *
 * <p>A tag directly after the audio payload is handed to {@link TagDecoders}: an ID3v2 tag in an
 * {@code id3 } chunk or written without a chunk header, otherwise an ID3v1 trailer in the last
 * 128 bytes.
 */
@Component
public class WavReader {

    private static final Logger LOG = LogManager.getLogger(WavReader.class);

    private final TagDecoders tagDecoders;

    public WavReader(TagDecoders tagDecoders) {
        this.tagDecoders = Objects.requireNonNull(tagDecoders, "tagDecoders must not be null");
    }

    /**
     * Reads the technical fields of a PCM WAV stream positioned at its "RIFF" header, and the tag
     * following the audio if there is one.
     *
     * @param in reader positioned at the start of the RIFF container
     * @return sample rate, bit depth, channels, data size, duration and decoded tag
     * @throws FormatMismatchException if the RIFF or WAVE magic is missing or the fmt chunk is too small
     * @throws UnsupportedFormatException if the audio format is not PCM
     * @throws UnsupportedVersionException if the tag after the audio has an unknown ID3v2 version
     * @throws StreamReadException if a chunk declares more bytes than the stream holds
     */
    public WavMetadata readWav(StreamReader in) {
        readRiffHeader(in);

        FmtChunk fmt = null;
        long dataSize = -1;
        long audioEnd = -1;
        long walkEnd = in.size();
        FoundTag tag = FoundTag.NONE;
        while (hasNextChunk(in, walkEnd)) {
            long chunkStart = in.position();
            if (chunkStart == audioEnd && startsWithBareId3v2(in)) {
                // no chunk structure after a tag written without chunk header
                if (walkEnd - chunkStart >= Id3v2Header.HEADER_SIZE) {
                    tag = readId3v2(in, walkEnd - chunkStart);
                } else {
                    LOG.warn("Ignoring truncated ID3v2 header at offset {}", chunkStart);
                }
                break;
            }
            String chunkId = in.readString(4);
            long chunkSize = in.readUInt32LE();
            requireFits(in, chunkId, chunkSize);

            switch (chunkId) {
                case WavFormat.FMT_CHUNK_ID:
                    fmt = readFmtChunk(in, chunkSize);
                    break;
                case WavFormat.DATA_CHUNK_ID:
                    dataSize = chunkSize;
                    in.skip(chunkSize);
                    break;
                default:
                    if (chunkStart == audioEnd && WavFormat.ID3_CHUNK_ID.equalsIgnoreCase(chunkId)) {
                        tag = readId3Chunk(in, chunkSize);
                    } else {
                        LOG.debug("Skipping chunk '{}' ({} bytes)", LogSanitizer.printable(chunkId), chunkSize);
                        in.skip(chunkSize);
                    }
                    break;
            }
            skipPadByte(in, chunkSize);

            if (WavFormat.DATA_CHUNK_ID.equals(chunkId) && audioEnd < 0) {
                audioEnd = in.position();
                if (!startsWithId3v2(in) && hasId3v1Trailer(in, audioEnd)) {
                    walkEnd = in.size() - Mp3Reader.ID3V1_SIZE;
                    tag = readId3v1Trailer(in, walkEnd);
                }
            }
        }
        if (in.position() < in.size()) {
            in.seek(in.size());
        }

        if (fmt == null) {
            LOG.warn("WAV stream has no fmt chunk; duration unknown");
            return new WavMetadata(tag.format(), tag.tags(), 0, 0, 0, Math.max(dataSize, 0), Duration.ZERO);
        }
        if (dataSize < 0) {
            LOG.warn("WAV stream has no data chunk; duration unknown");
            return new WavMetadata(tag.format(), tag.tags(), fmt.sampleRate, fmt.bitsPerSample, fmt.channels, 0,
                    Duration.ZERO);
        }
        long bytesPerSample = (fmt.bitsPerSample + 7) / 8;
        long bytesPerSecond = fmt.sampleRate * fmt.channels * bytesPerSample;
        Duration duration = Durations.ofFraction(dataSize, bytesPerSecond);
        LOG.debug("WAV: sampleRate={} Hz, channels={}, bitsPerSample={}, dataSize={}, duration={}, tag={}",
                fmt.sampleRate, fmt.channels, fmt.bitsPerSample, dataSize, duration, tag.format());
        return new WavMetadata(tag.format(), tag.tags(), fmt.sampleRate, fmt.bitsPerSample, fmt.channels,
                dataSize, duration);
    }

    /**
     * Scans chunks up to and including the data chunk and its pad byte.
     *
     * <p>On return the cursor sits on the first byte after the audio payload, which is where a
     * trailing tag chunk, if any, begins.
     *
     * @param in reader positioned at the start of the RIFF container
     * @return offset of the first byte after the audio payload
     * @throws FormatMismatchException if the magic is missing or no data chunk exists
     */
    public long locateAudioEnd(StreamReader in) {
        readRiffHeader(in);
        while (hasNextChunk(in)) {
            String chunkId = in.readString(4);
            long chunkSize = in.readUInt32LE();
            requireFits(in, chunkId, chunkSize);
            in.skip(chunkSize);
            skipPadByte(in, chunkSize);
            if (WavFormat.DATA_CHUNK_ID.equals(chunkId)) {
                return in.position();
            }
        }
        throw new FormatMismatchException("Missing data chunk in WAV stream");
    }

    private void readRiffHeader(StreamReader in) {
        String riff = in.readString(4);
        if (!WavFormat.RIFF_MAGIC.equals(riff)) {
            throw new FormatMismatchException(WavFormat.RIFF_MAGIC, LogSanitizer.printable(riff));
        }
        in.skip(4); // RIFF size, not needed: chunks are walked until end of stream
        String wave = in.readString(4);
        if (!WavFormat.WAVE_MAGIC.equals(wave)) {
            throw new FormatMismatchException(WavFormat.WAVE_MAGIC, LogSanitizer.printable(wave));
        }
    }

    private boolean hasNextChunk(StreamReader in) {
        return hasNextChunk(in, in.size());
    }

    private boolean hasNextChunk(StreamReader in, long walkEnd) {
        long remaining = walkEnd - in.position();
        if (remaining <= 0) {
            return false;
        }
        if (remaining < WavFormat.CHUNK_HEADER_SIZE) {
            LOG.warn("Ignoring {} trailing bytes after last WAV chunk at offset {}", remaining, in.position());
            in.seek(walkEnd);
            return false;
        }
        return true;
    }

    private FoundTag readId3Chunk(StreamReader in, long chunkSize) {
        long bodyStart = in.position();
        FoundTag tag;
        if (chunkSize >= Id3v2Header.HEADER_SIZE
                && StreamReader.startsWith(in.peek(Id3v2Header.MAGIC.length()), 0, Id3v2Header.MAGIC)) {
            tag = readId3v2(in, chunkSize);
        } else {
            LOG.warn("'{}' chunk at offset {} holds no ID3v2 tag; skipped", WavFormat.ID3_CHUNK_ID,
                    bodyStart - WavFormat.CHUNK_HEADER_SIZE);
            tag = FoundTag.NONE;
        }
        in.seek(bodyStart + chunkSize);
        return tag;
    }

    /**
     * Decodes the ID3v2 tag at the cursor, reading no further than {@code regionSize} bytes.
     * Leaves the cursor after the tag.
     */
    private FoundTag readId3v2(StreamReader in, long regionSize) {
        long tagStart = in.position();
        Id3v2Header header = Id3v2Header.read(in);
        long tagSize = Math.min(header.totalSize(), regionSize);
        if (tagSize < header.totalSize()) {
            LOG.warn("WAV ID3v2 tag declares {} bytes but only {} remain; decoding the remainder",
                    header.totalSize(), tagSize);
        }
        in.seek(tagStart);
        TagFields tags = tagDecoders.decodeId3v2(in.window(tagSize));
        in.seek(tagStart + tagSize);
        LOG.debug("WAV: ID3v2.{} tag at offset {} ({} bytes)", header.majorVersion(), tagStart, tagSize);
        return new FoundTag(header.format(), tags);
    }

    private FoundTag readId3v1Trailer(StreamReader in, long tagStart) {
        long resume = in.position();
        in.seek(tagStart);
        TagFields tags = tagDecoders.decodeId3v1(in.window(Mp3Reader.ID3V1_SIZE));
        in.seek(resume);
        LOG.debug("WAV: ID3v1 trailer at offset {}", tagStart);
        return new FoundTag(Format.ID3V1, tags);
    }

    /**
     * @return true for an {@code id3 } chunk or an ID3v2 tag without chunk header at the cursor
     */
    private static boolean startsWithId3v2(StreamReader in) {
        byte[] b = in.peek(4);
        return b.length == 4
                && (WavFormat.ID3_CHUNK_ID.equalsIgnoreCase(new String(b, StandardCharsets.ISO_8859_1))
                || startsWithBareId3v2(in));
    }

    /**
     * "ID3" followed by a version byte. "ID3 " is a chunk id, not a tag.
     */
    private static boolean startsWithBareId3v2(StreamReader in) {
        byte[] b = in.peek(4);
        return b.length == 4 && StreamReader.startsWith(b, 0, Id3v2Header.MAGIC) && b[3] != ' ';
    }

    private static boolean hasId3v1Trailer(StreamReader in, long audioEnd) {
        long tagStart = in.size() - Mp3Reader.ID3V1_SIZE;
        if (tagStart < audioEnd) {
            return false;
        }
        long resume = in.position();
        in.seek(tagStart);
        boolean found = StreamReader.startsWith(in.peek(3), 0, "TAG");
        in.seek(resume);
        return found;
    }

    private FmtChunk readFmtChunk(StreamReader in, long chunkSize) {
        if (chunkSize < WavFormat.FMT_CHUNK_MIN_SIZE) {
            throw new FormatMismatchException("fmt chunk too small: " + chunkSize + " bytes (expected at least "
                    + WavFormat.FMT_CHUNK_MIN_SIZE + ")");
        }
        int audioFormat = in.readUInt16LE();
        int channels = in.readUInt16LE();
        long sampleRate = in.readUInt32LE();
        in.skip(6); // byte rate (4) + block align (2)
        int bitsPerSample = in.readUInt16LE();
        if (chunkSize > WavFormat.FMT_CHUNK_MIN_SIZE) {
            in.skip(chunkSize - WavFormat.FMT_CHUNK_MIN_SIZE);
        }
        if (audioFormat != WavFormat.AUDIO_FORMAT_PCM) {
            throw new UnsupportedFormatException("Unsupported audio format: " + audioFormat
                    + " (only PCM format " + WavFormat.AUDIO_FORMAT_PCM + " is supported)");
        }
        return new FmtChunk(channels, sampleRate, bitsPerSample);
    }

    private static void requireFits(StreamReader in, String chunkId, long chunkSize) {
        long remaining = in.remaining();
        if (chunkSize > remaining) {
            throw new StreamReadException("Chunk '" + LogSanitizer.printable(chunkId) + "' declares " + chunkSize
                    + " bytes but only " + remaining + " remain", in.position());
        }
    }

    private static void skipPadByte(StreamReader in, long chunkSize) {
        if (chunkSize % 2 == 1 && in.remaining() > 0) {
            in.skip(1);
        }
    }

    /**
     * Tag found after the audio payload.
     */
    private record FoundTag(Format format, TagFields tags) {
        static final FoundTag NONE = new FoundTag(Format.UNKNOWN, TagFields.empty());
    }

    /**
     * Format fields of the fmt chunk.
     */
    private static final class FmtChunk {
        final int channels;
        final long sampleRate;
        final int bitsPerSample;

        FmtChunk(int channels, long sampleRate, int bitsPerSample) {
            this.channels = channels;
            this.sampleRate = sampleRate;
            this.bitsPerSample = bitsPerSample;
        }
    }
}
