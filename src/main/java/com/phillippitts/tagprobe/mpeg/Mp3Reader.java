package com.phillippitts.tagprobe.mpeg;

import com.phillippitts.tagprobe.domain.Format;
import com.phillippitts.tagprobe.domain.Mp3Metadata;
import com.phillippitts.tagprobe.domain.TagFields;
import com.phillippitts.tagprobe.exception.FormatMismatchException;
import com.phillippitts.tagprobe.exception.NoTagsFoundException;
import com.phillippitts.tagprobe.exception.StreamReadException;
import com.phillippitts.tagprobe.exception.UnsupportedFormatException;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.tag.TagDecoders;
import com.phillippitts.tagprobe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;

/**
 * Reads MPEG audio streams carrying an ID3v2 tag at the front or an ID3v1 trailer at the end.
 *
 * <p>The tag region is handed to the decoder; the duration is estimated from the first frame
 * header and the stream length without tag bytes.
 */
@Component
public class Mp3Reader {

    private static final Logger LOG = LogManager.getLogger(Mp3Reader.class);

    public static final int ID3V1_SIZE = 128;

    public static final String ID3V1_MAGIC = "TAG";

    private final TagDecoders tagDecoders;

    public Mp3Reader(TagDecoders tagDecoders) {
        this.tagDecoders = Objects.requireNonNull(tagDecoders, "tagDecoders must not be null");
    }

    /**
     * @param in   reader over a stream starting with "ID3"
     * @param size total stream length in bytes
     * @throws StreamReadException if the tag claims more bytes than the stream holds
     * @throws UnsupportedFormatException if the first frame header uses reserved values
     */
    public Mp3Metadata readWithId3v2(StreamReader in, long size) {
        in.seek(0);
        Id3v2Header header = Id3v2Header.read(in);
        long tagSize = header.totalSize();
        if (tagSize + MpegFrameHeader.SIZE > size) {
            throw new StreamReadException("ID3v2 tag of " + tagSize + " bytes leaves no room for an audio frame in "
                    + size + " bytes", 0);
        }

        in.seek(0);
        TagFields tags = tagDecoders.decodeId3v2(in.window(tagSize));
        in.seek(tagSize);
        byte[] frame = in.readBytes(MpegFrameHeader.SIZE);
        Duration duration = MpegDurationCalculator.computeDuration(frame, size - tagSize);

        LOG.debug("MP3: ID3v2.{} tag of {} bytes (footer={}), duration={}",
                header.majorVersion(), tagSize, header.footerPresent(), duration);
        return new Mp3Metadata(header.format(), tags, duration);
    }

    /**
     * @param in   reader over a stream ending with a 128-byte "TAG" trailer
     * @param size total stream length in bytes
     * @throws NoTagsFoundException if the stream is too short for a trailer
     * @throws FormatMismatchException if the trailer does not start with "TAG"
     * @throws UnsupportedFormatException if the first frame header uses reserved values
     */
    public Mp3Metadata readWithId3v1(StreamReader in, long size) {
        if (size < ID3V1_SIZE) {
            throw new NoTagsFoundException("Stream of " + size + " bytes is too short for an ID3v1 trailer");
        }
        long tagStart = size - ID3V1_SIZE;
        in.seek(tagStart);
        byte[] marker = in.peek(ID3V1_MAGIC.length());
        if (!StreamReader.startsWith(marker, 0, ID3V1_MAGIC)) {
            throw new FormatMismatchException(ID3V1_MAGIC, LogSanitizer.printable(marker, 3));
        }
        TagFields tags = tagDecoders.decodeId3v1(in.window(ID3V1_SIZE));

        in.seek(0);
        byte[] frame = in.readBytes(MpegFrameHeader.SIZE);
        Duration duration = MpegDurationCalculator.computeDuration(frame, tagStart);

        LOG.debug("MP3: ID3v1 trailer at offset {}, duration={}", tagStart, duration);
        return new Mp3Metadata(Format.ID3V1, tags, duration);
    }
}
