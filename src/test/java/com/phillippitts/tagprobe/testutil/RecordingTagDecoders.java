package com.phillippitts.tagprobe.testutil;

import com.phillippitts.tagprobe.domain.Picture;
import com.phillippitts.tagprobe.domain.TagFields;
import com.phillippitts.tagprobe.stream.SeekableByteStream;
import com.phillippitts.tagprobe.tag.TagDecoders;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for TagDecoders that records every region it is handed.
 *
 * <p>Each decode reads the whole region and returns tags titled with the decoder kind, so
 * tests can check both what was passed in and that the result came back.
 */
public class RecordingTagDecoders implements TagDecoders {

    /** One decoder invocation. */
    public record Call(String kind, byte[] region) {
    }

    public final List<Call> calls = new CopyOnWriteArrayList<>();

    private Picture picture;

    /** Picture returned by {@link #decodePicture}; null by default. */
    public RecordingTagDecoders withPicture(Picture picture) {
        this.picture = picture;
        return this;
    }

    @Override
    public TagFields decodeId3v2(SeekableByteStream tag) {
        return record("id3v2", tag);
    }

    @Override
    public TagFields decodeId3v1(SeekableByteStream tag) {
        return record("id3v1", tag);
    }

    @Override
    public TagFields decodeVorbisComment(SeekableByteStream comment) {
        return record("vorbis", comment);
    }

    @Override
    public Picture decodePicture(SeekableByteStream block) {
        calls.add(new Call("picture", readAll(block)));
        return picture;
    }

    @Override
    public TagFields decodeMp4(SeekableByteStream stream) {
        return record("mp4", stream);
    }

    public Call only(String kind) {
        List<Call> matching = calls.stream().filter(c -> c.kind().equals(kind)).toList();
        if (matching.size() != 1) {
            throw new AssertionError("Expected one " + kind + " call, got " + matching.size());
        }
        return matching.get(0);
    }

    private TagFields record(String kind, SeekableByteStream region) {
        byte[] bytes = readAll(region);
        calls.add(new Call(kind, bytes));
        return TagFields.builder().title(kind).raw(kind + "_size", (long) bytes.length).build();
    }

    private static byte[] readAll(SeekableByteStream region) {
        try {
            byte[] b = new byte[(int) region.size()];
            int done = 0;
            while (done < b.length) {
                int n = region.read(b, done, b.length - done);
                if (n < 0) {
                    break;
                }
                done += n;
            }
            return b;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
