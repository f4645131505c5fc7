package com.phillippitts.tagprobe.identify;

import com.phillippitts.tagprobe.config.TagProbeProperties;
import com.phillippitts.tagprobe.domain.Classification;
import com.phillippitts.tagprobe.domain.FileType;
import com.phillippitts.tagprobe.domain.Format;
import com.phillippitts.tagprobe.exception.ContainerIdentificationException;
import com.phillippitts.tagprobe.exception.NoTagsFoundException;
import com.phillippitts.tagprobe.exception.StreamReadException;
import com.phillippitts.tagprobe.exception.TagProbeException;
import com.phillippitts.tagprobe.exception.UnsupportedVersionException;
import com.phillippitts.tagprobe.riff.WavFormat;
import com.phillippitts.tagprobe.riff.WavReader;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Classifies a stream by its leading magic bytes.
 *
 * <p>Checks run in a fixed order and the first match wins: FLAC, OGG, MP4 ({@code ftyp} at
 * offset 4), ID3v2, RIFF/WAVE, DSF, and finally an ID3v1 trailer in the last 128 bytes.
 *
 * <p>RIFF/WAVE streams are looked into: the chunk walk stops after the audio data, an
 * {@code id3 } chunk header is skipped, and the remainder is classified again. The inner tag
 * format is kept and the container type is reported as WAV. The number of nested levels is
 * capped by {@link TagProbeProperties#maxWrapDepth()}.
 */
@Component
public class FormatIdentifier {

    private static final Logger LOG = LogManager.getLogger(FormatIdentifier.class);

    /** Bytes inspected at the start of each level. */
    public static final int PEEK_SIZE = 12;

    static final int ID3V1_SIZE = 128;

    private final WavReader wavReader;
    private final int maxWrapDepth;

    public FormatIdentifier(WavReader wavReader, TagProbeProperties properties) {
        this.wavReader = Objects.requireNonNull(wavReader, "wavReader must not be null");
        this.maxWrapDepth = Objects.requireNonNull(properties, "properties must not be null").maxWrapDepth();
    }

    /**
     * Identifies the stream starting at the current cursor.
     *
     * <p>The cursor is restored before returning normally.
     *
     * @param in reader positioned at the start of the stream
     * @return tag format and container type
     * @throws StreamReadException if fewer than 12 bytes are available
     * @throws UnsupportedVersionException for an ID3v2 major version other than 2, 3 or 4
     * @throws NoTagsFoundException if nothing matches
     * @throws ContainerIdentificationException if a RIFF/WAVE stream cannot be looked into
     */
    public Classification identify(StreamReader in) {
        long saved = in.position();
        Classification result = identifyFrom(in, saved);
        in.seek(saved);
        LOG.debug("Identified stream as {}", result);
        return result;
    }

    private Classification identifyFrom(StreamReader in, long start) {
        int depth = 1;
        long levelStart = start;
        while (true) {
            in.seek(levelStart);
            boolean inner = depth > 1;
            if (inner && in.remaining() < PEEK_SIZE) {
                LOG.debug("Only {} bytes after WAV audio data; no wrapped tag", in.remaining());
                return Classification.of(Format.UNKNOWN, FileType.WAV);
            }

            byte[] b = in.readBytes(PEEK_SIZE);
            Classification direct;
            try {
                direct = classifyMagic(in, b, levelStart);
            } catch (NoTagsFoundException e) {
                if (inner) {
                    return Classification.of(Format.UNKNOWN, FileType.WAV);
                }
                throw e;
            } catch (TagProbeException e) {
                if (inner) {
                    throw new ContainerIdentificationException(FileType.WAV, e);
                }
                throw e;
            }
            if (direct != null) {
                return inner ? direct.wrappedIn(FileType.WAV) : direct;
            }

            // RIFF/WAVE: hop over the audio payload and classify what follows
            if (depth + 1 > maxWrapDepth) {
                throw new ContainerIdentificationException(FileType.WAV, "RIFF container nested deeper than "
                        + maxWrapDepth + " levels at offset " + levelStart);
            }
            levelStart = locateWrappedTag(in, levelStart);
            depth++;
        }
    }

    /**
     * @return the classification, or {@code null} for a RIFF/WAVE header that needs a hop
     */
    private Classification classifyMagic(StreamReader in, byte[] b, long levelStart) {
        if (StreamReader.startsWith(b, 0, "fLaC")) {
            return Classification.of(Format.VORBIS, FileType.FLAC);
        }
        if (StreamReader.startsWith(b, 0, "OggS")) {
            return Classification.of(Format.VORBIS, FileType.OGG);
        }
        if (StreamReader.startsWith(b, 4, "ftyp")) {
            return Classification.of(Format.MP4, mp4Subtype(b));
        }
        if (StreamReader.startsWith(b, 0, "ID3")) {
            int major = b[3] & 0xFF;
            Format format = Format.ofId3v2MajorVersion(major);
            if (format == Format.UNKNOWN) {
                throw new UnsupportedVersionException("ID3", major, "2, 3 or 4");
            }
            return Classification.of(format, FileType.MP3);
        }
        if (StreamReader.startsWith(b, 0, WavFormat.RIFF_MAGIC) && StreamReader.startsWith(b, 8, WavFormat.WAVE_MAGIC)) {
            return null;
        }
        if (StreamReader.startsWith(b, 0, "DSD ")) {
            return Classification.of(Format.UNKNOWN, FileType.DSF);
        }
        return classifyTrailer(in, levelStart);
    }

    private static FileType mp4Subtype(byte[] b) {
        String brand = new String(b, 8, 3, StandardCharsets.ISO_8859_1);
        switch (brand) {
            case "M4A":
                return FileType.M4A;
            case "M4B":
                return FileType.M4B;
            case "M4P":
                return FileType.M4P;
            default:
                LOG.debug("Unrecognised ftyp brand '{}'", LogSanitizer.printable(brand));
                return FileType.UNKNOWN;
        }
    }

    private static Classification classifyTrailer(StreamReader in, long levelStart) {
        long tagStart = in.size() - ID3V1_SIZE;
        if (tagStart < levelStart) {
            throw new NoTagsFoundException("Stream too short for an ID3v1 trailer");
        }
        in.seek(tagStart);
        if (!"TAG".equals(in.readString(3))) {
            throw new NoTagsFoundException();
        }
        return Classification.of(Format.ID3V1, FileType.MP3);
    }

    /**
     * @return offset where the classification of the wrapped content starts
     */
    private long locateWrappedTag(StreamReader in, long riffStart) {
        long audioEnd;
        try {
            in.seek(riffStart);
            audioEnd = wavReader.locateAudioEnd(in);
        } catch (TagProbeException e) {
            throw new ContainerIdentificationException(FileType.WAV, e);
        }
        byte[] next = in.peek(WavFormat.CHUNK_HEADER_SIZE);
        if (next.length == WavFormat.CHUNK_HEADER_SIZE
                && WavFormat.ID3_CHUNK_ID.equalsIgnoreCase(new String(next, 0, 4, StandardCharsets.ISO_8859_1))) {
            LOG.debug("Skipping '{}' chunk header at offset {}", LogSanitizer.printable(next, 4), audioEnd);
            return audioEnd + WavFormat.CHUNK_HEADER_SIZE;
        }
        return audioEnd;
    }
}
