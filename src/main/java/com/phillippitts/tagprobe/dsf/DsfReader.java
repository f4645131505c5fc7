package com.phillippitts.tagprobe.dsf;

import com.phillippitts.tagprobe.domain.DsfMetadata;
import com.phillippitts.tagprobe.domain.Format;
import com.phillippitts.tagprobe.domain.TagFields;
import com.phillippitts.tagprobe.exception.FormatMismatchException;
import com.phillippitts.tagprobe.exception.StreamReadException;
import com.phillippitts.tagprobe.mpeg.Id3v2Header;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.tag.TagDecoders;
import com.phillippitts.tagprobe.util.Durations;
import com.phillippitts.tagprobe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;

/**
 * Reads the DSD and fmt chunks of a DSF stream and the ID3v2 tag its metadata pointer refers to.
 *
 * <p>Layout from the start of the stream: "DSD " (4), chunk size (8), total file size (8),
 * metadata pointer (8, LE), "fmt " chunk header (12), format version (4), format id (4),
 * channel type (4), channel count (4), sample rate (4, LE), bits per sample (4), sample count
 * (8, LE).
 *
 * @see <a href="https://dsd-guide.com/sites/default/files/white-papers/DSFFileFormatSpec_E.pdf">DSF file format</a>
 */
@Component
public class DsfReader {

    private static final Logger LOG = LogManager.getLogger(DsfReader.class);

    public static final String MAGIC = "DSD ";

    private final TagDecoders tagDecoders;

    public DsfReader(TagDecoders tagDecoders) {
        this.tagDecoders = Objects.requireNonNull(tagDecoders, "tagDecoders must not be null");
    }

    /**
     * @param in reader positioned at the "DSD " marker
     * @return sample rate, sample count, duration in whole seconds and the embedded tag
     * @throws FormatMismatchException if the marker is missing
     * @throws StreamReadException if the metadata pointer lies beyond the end of the stream
     */
    public DsfMetadata readDsf(StreamReader in) {
        String magic = in.readString(4);
        if (!MAGIC.equals(magic)) {
            throw new FormatMismatchException(MAGIC, LogSanitizer.printable(magic));
        }
        in.skip(16); // chunk size + total file size
        long tagPointer = in.readUInt64LE();
        in.skip(28); // fmt chunk header, format version, format id, channel type, channel count
        long sampleRate = in.readUInt32LE();
        in.skip(4); // bits per sample
        long sampleCount = in.readUInt64LE();
        Duration duration = Durations.ofTruncatedSeconds(sampleCount, sampleRate);

        if (tagPointer == 0) {
            LOG.debug("DSF: no metadata chunk, sampleRate={} Hz, sampleCount={}", sampleRate,
                    Long.toUnsignedString(sampleCount));
            return new DsfMetadata(Format.UNKNOWN, TagFields.empty(), sampleRate, sampleCount, duration);
        }
        if (tagPointer < 0 || tagPointer >= in.size()) {
            throw new StreamReadException("DSF metadata pointer " + Long.toUnsignedString(tagPointer)
                    + " lies beyond the end of the stream (" + in.size() + " bytes)", in.position());
        }

        in.seek(tagPointer);
        Id3v2Header header = Id3v2Header.read(in);
        long tagSize = Math.min(header.totalSize(), in.size() - tagPointer);
        if (tagSize < header.totalSize()) {
            LOG.warn("DSF ID3v2 tag declares {} bytes but only {} remain; decoding the remainder",
                    header.totalSize(), tagSize);
        }
        in.seek(tagPointer);
        TagFields tags = tagDecoders.decodeId3v2(in.window(tagSize));

        LOG.debug("DSF: sampleRate={} Hz, sampleCount={}, ID3v2.{} tag at offset {}",
                sampleRate, Long.toUnsignedString(sampleCount), header.majorVersion(), tagPointer);
        return new DsfMetadata(header.format(), tags, sampleRate, sampleCount, duration);
    }
}
