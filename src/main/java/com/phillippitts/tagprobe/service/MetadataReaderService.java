package com.phillippitts.tagprobe.service;

import com.phillippitts.tagprobe.config.TagProbeProperties;
import com.phillippitts.tagprobe.domain.Classification;
import com.phillippitts.tagprobe.domain.FileType;
import com.phillippitts.tagprobe.domain.Metadata;
import com.phillippitts.tagprobe.domain.Mp4Metadata;
import com.phillippitts.tagprobe.dsf.DsfReader;
import com.phillippitts.tagprobe.exception.StreamReadException;
import com.phillippitts.tagprobe.exception.TagProbeException;
import com.phillippitts.tagprobe.flac.FlacReader;
import com.phillippitts.tagprobe.identify.FormatIdentifier;
import com.phillippitts.tagprobe.mpeg.Mp3Reader;
import com.phillippitts.tagprobe.ogg.OggReader;
import com.phillippitts.tagprobe.riff.WavReader;
import com.phillippitts.tagprobe.stream.ChannelSeekableStream;
import com.phillippitts.tagprobe.stream.SeekableByteStream;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.tag.TagDecoders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point for metadata extraction: identifies the container, then hands the stream to
 * exactly one container reader.
 *
 * <p>Each call is synchronous and self-contained. The container type is placed in the Log4j2
 * {@link ThreadContext} under {@value #CONTAINER_KEY} while the call runs, and the previous
 * value is restored afterwards.
 */
@Service
public class MetadataReaderService {

    private static final Logger LOG = LogManager.getLogger(MetadataReaderService.class);

    public static final String CONTAINER_KEY = "container";

    private final FormatIdentifier identifier;
    private final WavReader wavReader;
    private final FlacReader flacReader;
    private final OggReader oggReader;
    private final Mp3Reader mp3Reader;
    private final DsfReader dsfReader;
    private final TagDecoders tagDecoders;
    private final TagProbeProperties properties;

    public MetadataReaderService(FormatIdentifier identifier,
                                 WavReader wavReader,
                                 FlacReader flacReader,
                                 OggReader oggReader,
                                 Mp3Reader mp3Reader,
                                 DsfReader dsfReader,
                                 TagDecoders tagDecoders,
                                 TagProbeProperties properties) {
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
        this.wavReader = Objects.requireNonNull(wavReader, "wavReader must not be null");
        this.flacReader = Objects.requireNonNull(flacReader, "flacReader must not be null");
        this.oggReader = Objects.requireNonNull(oggReader, "oggReader must not be null");
        this.mp3Reader = Objects.requireNonNull(mp3Reader, "mp3Reader must not be null");
        this.dsfReader = Objects.requireNonNull(dsfReader, "dsfReader must not be null");
        this.tagDecoders = Objects.requireNonNull(tagDecoders, "tagDecoders must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Reads the metadata of a whole stream. The stream is not closed.
     *
     * @param stream stream to read, any cursor position
     * @return container-specific metadata
     * @throws TagProbeException subclass describing the first failure
     */
    public Metadata read(SeekableByteStream stream) {
        Objects.requireNonNull(stream, "stream must not be null");
        StreamReader in = properties.newReader(stream);
        in.seek(0);

        String previous = ThreadContext.get(CONTAINER_KEY);
        try {
            Classification classification = identifier.identify(in);
            ThreadContext.put(CONTAINER_KEY, classification.fileType().name());
            LOG.debug("Classified {} byte stream as {}", in.size(), classification);

            in.seek(0);
            Metadata metadata = route(classification, in);
            LOG.info("Read {} metadata: format={}, duration={}", metadata.fileType(), metadata.format(),
                    metadata.duration());
            return metadata;
        } finally {
            if (previous == null) {
                ThreadContext.remove(CONTAINER_KEY);
            } else {
                ThreadContext.put(CONTAINER_KEY, previous);
            }
        }
    }

    /**
     * Opens, reads and closes a file.
     *
     * @throws StreamReadException if the file cannot be opened
     */
    public Metadata read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (ChannelSeekableStream stream = ChannelSeekableStream.open(path)) {
            return read(stream);
        } catch (IOException e) {
            throw new StreamReadException("Cannot read " + path.getFileName() + ": " + e.getMessage(), 0, e);
        }
    }

    private Metadata route(Classification classification, StreamReader in) {
        FileType fileType = classification.fileType();
        switch (fileType) {
            case FLAC:
                return flacReader.readFlac(in);
            case OGG:
                return oggReader.readOgg(in);
            case WAV:
                return wavReader.readWav(in);
            case DSF:
                return dsfReader.readDsf(in);
            case MP3:
                return classification.format().isId3v2()
                        ? mp3Reader.readWithId3v2(in, in.size())
                        : mp3Reader.readWithId3v1(in, in.size());
            default:
                if (classification.isMp4()) {
                    return new Mp4Metadata(fileType, tagDecoders.decodeMp4(in.stream()));
                }
                throw new IllegalStateException("No reader for " + classification);
        }
    }
}
