package com.phillippitts.tagprobe.flac;

import com.phillippitts.tagprobe.domain.FlacMetadata;
import com.phillippitts.tagprobe.domain.Picture;
import com.phillippitts.tagprobe.domain.TagFields;
import com.phillippitts.tagprobe.exception.FormatMismatchException;
import com.phillippitts.tagprobe.exception.StreamReadException;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.tag.TagDecoders;
import com.phillippitts.tagprobe.util.Bits;
import com.phillippitts.tagprobe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;

/**
 * Walks the metadata block chain of a native FLAC stream.
 *
 * <p>Each block starts with one byte holding the last-block flag (bit 7) and the block type
 * (bits 0-6), followed by a 24-bit big-endian payload length. The walk stops after the block
 * flagged last, leaving the cursor on the first audio frame.
 */
@Component
public class FlacReader {

    private static final Logger LOG = LogManager.getLogger(FlacReader.class);

    public static final String MAGIC = "fLaC";

    private final TagDecoders tagDecoders;

    public FlacReader(TagDecoders tagDecoders) {
        this.tagDecoders = Objects.requireNonNull(tagDecoders, "tagDecoders must not be null");
    }

    /**
     * @param in reader positioned at the "fLaC" marker
     * @return stream-info fields and decoded comment/picture blocks
     * @throws FormatMismatchException if the marker is missing or STREAMINFO is truncated
     * @throws StreamReadException if a block runs past the end of the stream
     */
    public FlacMetadata readFlac(StreamReader in) {
        String magic = in.readString(4);
        if (!MAGIC.equals(magic)) {
            throw new FormatMismatchException(MAGIC, LogSanitizer.printable(magic));
        }

        FlacStreamInfo streamInfo = null;
        TagFields tags = TagFields.empty();
        Picture picture = null;
        boolean commentSeen = false;
        int blocks = 0;
        boolean last = false;
        while (!last) {
            byte header = (byte) in.readUnsignedByte();
            last = Bits.getBit(header, 7);
            FlacBlockType type = FlacBlockType.of(header & 0x7F);
            long length = in.readFixedBE(3);
            long blockStart = in.position();
            if (length > in.remaining()) {
                throw new StreamReadException("FLAC " + type + " block declares " + length + " bytes but only "
                        + in.remaining() + " remain", blockStart);
            }

            switch (type) {
                case STREAMINFO:
                    streamInfo = readStreamInfo(in, length);
                    break;
                case VORBIS_COMMENT:
                    if (commentSeen) {
                        LOG.warn("Multiple Vorbis comment blocks; keeping the one at offset {}", blockStart);
                    }
                    tags = tagDecoders.decodeVorbisComment(in.window(length));
                    commentSeen = true;
                    break;
                case PICTURE:
                    Picture p = tagDecoders.decodePicture(in.window(length));
                    if (picture == null) {
                        picture = p;
                    }
                    break;
                default:
                    LOG.debug("Skipping FLAC {} block (code {}, {} bytes)", type, header & 0x7F, length);
                    break;
            }
            in.seek(blockStart + length);
            blocks++;
        }

        if (picture != null && tags.picture() == null) {
            tags = tags.toBuilder().picture(picture).build();
        }
        if (streamInfo == null) {
            LOG.warn("FLAC stream has no STREAMINFO block; duration unknown");
            return new FlacMetadata(tags, 0, 0, 0, 0, Duration.ZERO);
        }
        LOG.debug("FLAC: {} metadata blocks, sampleRate={} Hz, totalSamples={}",
                blocks, streamInfo.sampleRate(), streamInfo.totalSamples());
        return new FlacMetadata(tags, streamInfo.sampleRate(), streamInfo.channels(), streamInfo.bitsPerSample(),
                streamInfo.totalSamples(), streamInfo.duration());
    }

    private static FlacStreamInfo readStreamInfo(StreamReader in, long length) {
        if (length < FlacStreamInfo.MIN_LENGTH) {
            throw new FormatMismatchException("STREAMINFO block too small: " + length + " bytes (expected at least "
                    + FlacStreamInfo.MIN_LENGTH + ")");
        }
        return FlacStreamInfo.parse(in.readBytes(length));
    }
}
