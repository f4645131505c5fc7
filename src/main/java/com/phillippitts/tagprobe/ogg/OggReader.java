package com.phillippitts.tagprobe.ogg;

import com.phillippitts.tagprobe.domain.OggMetadata;
import com.phillippitts.tagprobe.domain.TagFields;
import com.phillippitts.tagprobe.exception.NoTagsFoundException;
import com.phillippitts.tagprobe.stream.ByteArraySeekableStream;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.tag.TagDecoders;
import com.phillippitts.tagprobe.util.Durations;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads Vorbis and Opus header packets from an OGG stream.
 *
 * <p>Demuxes every page to the end of the stream. The identification packet supplies the
 * sample rate (Opus is always 48 kHz), the comment packet goes to the tag decoder, and the
 * last granule position divided by the sample rate gives the duration.
 *
 * @see <a href="https://www.xiph.org/ogg/doc/framing.html">OGG framing</a>
 * @see <a href="https://tools.ietf.org/html/rfc7845">RFC 7845, Ogg encapsulation for Opus</a>
 */
@Component
public class OggReader {

    private static final Logger LOG = LogManager.getLogger(OggReader.class);

    static final String VORBIS_IDENTIFICATION_PREFIX = "\u0001vorbis";
    static final String VORBIS_COMMENT_PREFIX = "\u0003vorbis";
    static final String OPUS_TAGS_PREFIX = "OpusTags";

    /** Opus always decodes at 48 kHz, whatever the input rate stored in OpusHead. */
    public static final long OPUS_SAMPLE_RATE = 48_000;

    private final TagDecoders tagDecoders;

    public OggReader(TagDecoders tagDecoders) {
        this.tagDecoders = Objects.requireNonNull(tagDecoders, "tagDecoders must not be null");
    }

    /**
     * @param in reader positioned at the first page
     * @return decoded comment values, sample rate and duration
     * @throws NoTagsFoundException if no Vorbis comment or OpusTags packet was found
     */
    public OggMetadata readOgg(StreamReader in) {
        OggDemuxer demuxer = new OggDemuxer();
        TagFields tags = TagFields.empty();
        boolean tagsFound = false;
        long sampleRate = 0;
        long position = 0;
        int pages = 0;

        Optional<OggPage> next;
        while ((next = demuxer.readPage(in)).isPresent()) {
            OggPage page = next.get();
            pages++;
            if (page.granulePosition() != OggPageHeader.NO_GRANULE) {
                position = page.granulePosition();
            }
            for (byte[] packet : page.packets()) {
                if (StreamReader.startsWith(packet, 0, VORBIS_COMMENT_PREFIX)) {
                    tags = decodeComment(packet, VORBIS_COMMENT_PREFIX.length());
                    tagsFound = true;
                } else if (StreamReader.startsWith(packet, 0, OPUS_TAGS_PREFIX)) {
                    tags = decodeComment(packet, OPUS_TAGS_PREFIX.length());
                    tagsFound = true;
                    sampleRate = OPUS_SAMPLE_RATE;
                } else if (StreamReader.startsWith(packet, 0, VORBIS_IDENTIFICATION_PREFIX)) {
                    sampleRate = readIdentificationSampleRate(packet);
                }
            }
        }

        if (!tagsFound) {
            throw new NoTagsFoundException("No Vorbis comment or OpusTags packet in " + pages + " OGG pages");
        }
        Duration duration = Durations.ofFraction(position, sampleRate);
        LOG.debug("OGG: {} pages, sampleRate={} Hz, granule={}, duration={}", pages, sampleRate, position, duration);
        return new OggMetadata(tags, sampleRate, position, duration);
    }

    private TagFields decodeComment(byte[] packet, int prefixLength) {
        byte[] comment = Arrays.copyOfRange(packet, prefixLength, packet.length);
        return tagDecoders.decodeVorbisComment(new ByteArraySeekableStream(comment));
    }

    /**
     * Vorbis identification header after the prefix: version (4), channels (1), sample rate (4, LE).
     */
    private static long readIdentificationSampleRate(byte[] packet) {
        StreamReader ident = new StreamReader(new ByteArraySeekableStream(packet));
        ident.seek(VORBIS_IDENTIFICATION_PREFIX.length());
        ident.skip(5);
        return ident.readUInt32LE();
    }
}
