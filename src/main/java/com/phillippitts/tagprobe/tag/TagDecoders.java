package com.phillippitts.tagprobe.tag;

import com.phillippitts.tagprobe.domain.Picture;
import com.phillippitts.tagprobe.domain.TagFields;
import com.phillippitts.tagprobe.stream.SeekableByteStream;

/**
 * Semantic tag decoders the container readers delegate to.
 *
 * <p>Container readers locate a tag region and pass it as a stream bounded to exactly that
 * region, positioned at its first byte. Implementations report malformed regions with
 * {@link com.phillippitts.tagprobe.exception.TagDecodingException}; they must not close the
 * stream they are given.
 */
public interface TagDecoders {

    /**
     * Decodes an ID3v2 tag, header included.
     *
     * @param tag region starting with "ID3"
     */
    TagFields decodeId3v2(SeekableByteStream tag);

    /**
     * Decodes the fixed 128-byte ID3v1 trailer.
     *
     * @param tag region starting with "TAG"
     */
    TagFields decodeId3v1(SeekableByteStream tag);

    /**
     * Decodes a Vorbis comment structure (vendor string followed by key=value comments),
     * without the packet type prefix.
     */
    TagFields decodeVorbisComment(SeekableByteStream comment);

    /**
     * Decodes a FLAC picture block payload.
     *
     * @return the picture, or {@code null} if the block holds none
     */
    Picture decodePicture(SeekableByteStream block);

    /**
     * Decodes the atom tree of an MP4 family stream.
     *
     * @param stream the whole stream, positioned at 0
     */
    TagFields decodeMp4(SeekableByteStream stream);
}
