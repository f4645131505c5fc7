package com.phillippitts.tagprobe.tag;

import com.phillippitts.tagprobe.domain.Picture;
import com.phillippitts.tagprobe.domain.TagFields;
import com.phillippitts.tagprobe.stream.SeekableByteStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Default {@link TagDecoders} used when the application provides none.
 *
 * <p>Records the size of each tag region and returns empty tag values, so results carry
 * technical container fields only.
 */
public class TechnicalOnlyTagDecoders implements TagDecoders {

    private static final Logger LOG = LogManager.getLogger(TechnicalOnlyTagDecoders.class);

    @Override
    public TagFields decodeId3v2(SeekableByteStream tag) {
        return regionOnly("id3v2", tag);
    }

    @Override
    public TagFields decodeId3v1(SeekableByteStream tag) {
        return regionOnly("id3v1", tag);
    }

    @Override
    public TagFields decodeVorbisComment(SeekableByteStream comment) {
        return regionOnly("vorbis_comment", comment);
    }

    @Override
    public Picture decodePicture(SeekableByteStream block) {
        LOG.debug("Skipping picture block of {} bytes", sizeOf(block));
        return null;
    }

    @Override
    public TagFields decodeMp4(SeekableByteStream stream) {
        return regionOnly("mp4", stream);
    }

    private static TagFields regionOnly(String kind, SeekableByteStream region) {
        long size = sizeOf(region);
        LOG.debug("No decoder configured for {} tag ({} bytes)", kind, size);
        return TagFields.builder()
                .raw(kind + "_size", size)
                .build();
    }

    private static long sizeOf(SeekableByteStream region) {
        try {
            return region.size();
        } catch (IOException e) {
            LOG.warn("Cannot determine tag region size: {}", e.getMessage());
            return -1;
        }
    }
}
