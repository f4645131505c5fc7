package com.phillippitts.tagprobe.ogg;

import com.phillippitts.tagprobe.domain.FileType;
import com.phillippitts.tagprobe.domain.Format;
import com.phillippitts.tagprobe.domain.OggMetadata;
import com.phillippitts.tagprobe.exception.ChecksumMismatchException;
import com.phillippitts.tagprobe.exception.NoTagsFoundException;
import com.phillippitts.tagprobe.stream.ByteArraySeekableStream;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.testutil.ByteBuilder;
import com.phillippitts.tagprobe.testutil.OggPageBuilder;
import com.phillippitts.tagprobe.testutil.RecordingTagDecoders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OggReaderTest {

    private RecordingTagDecoders decoders;
    private OggReader reader;

    @BeforeEach
    void setup() {
        decoders = new RecordingTagDecoders();
        reader = new OggReader(decoders);
    }

    @Test
    void vorbisCommentSpanningTwoPagesReachesDecoderWhole() {
        byte[] commentBody = filled(600, 'c');
        byte[] comment = new ByteBuilder().u8(3).ascii("vorbis").bytes(commentBody).build();
        byte[] firstPart = Arrays.copyOf(comment, 510);
        byte[] secondPart = Arrays.copyOfRange(comment, 510, comment.length);
        byte[] stream = new ByteBuilder()
                .bytes(OggPageBuilder.page(1, 0).flags(OggPageHeader.FLAG_FIRST_PAGE)
                        .packet(vorbisIdentification(48_000)).build())
                .bytes(OggPageBuilder.page(1, 1).granule(OggPageHeader.NO_GRANULE).openPacket(firstPart).build())
                .bytes(OggPageBuilder.page(1, 2).flags(OggPageHeader.FLAG_CONTINUED).packet(secondPart).build())
                .bytes(OggPageBuilder.page(1, 3).granule(96_000).packet(new byte[40]).build())
                .bytes(OggPageBuilder.page(1, 4).flags(OggPageHeader.FLAG_LAST_PAGE).granule(120_000)
                        .packet(new byte[40]).build())
                .build();

        OggMetadata meta = reader.readOgg(new StreamReader(new ByteArraySeekableStream(stream)));

        assertThat(decoders.only("vorbis").region()).isEqualTo(commentBody);
        assertThat(meta.sampleRate()).isEqualTo(48_000);
        assertThat(meta.granulePosition()).isEqualTo(120_000);
        assertThat(meta.duration()).isEqualTo(Duration.ofMillis(2500));
        assertThat(meta.format()).isEqualTo(Format.VORBIS);
        assertThat(meta.fileType()).isEqualTo(FileType.OGG);
        assertThat(meta.title()).isEqualTo("vorbis");
        assertThat(meta.raw()).containsEntry("sample_rate", 48_000L);
    }

    @Test
    void opusAlwaysUses48k() {
        byte[] head = new ByteBuilder().ascii("OpusHead").u8(1).u8(2).le16(312).le32(44_100).build();
        byte[] tags = new ByteBuilder().ascii("OpusTags").ascii("vendor").build();
        byte[] stream = new ByteBuilder()
                .bytes(OggPageBuilder.page(9, 0).flags(OggPageHeader.FLAG_FIRST_PAGE).packet(head).build())
                .bytes(OggPageBuilder.page(9, 1).packet(tags).build())
                .bytes(OggPageBuilder.page(9, 2).granule(480_000).packet(new byte[10]).build())
                .build();

        OggMetadata meta = reader.readOgg(new StreamReader(new ByteArraySeekableStream(stream)));

        assertThat(meta.sampleRate()).isEqualTo(OggReader.OPUS_SAMPLE_RATE);
        assertThat(meta.duration()).isEqualTo(Duration.ofSeconds(10));
        assertThat(decoders.only("vorbis").region()).isEqualTo("vendor".getBytes());
    }

    @Test
    void noCommentPacketMeansNoTags() {
        byte[] stream = OggPageBuilder.page(1, 0).packet(vorbisIdentification(44_100)).build();

        assertThatThrownBy(() -> reader.readOgg(new StreamReader(new ByteArraySeekableStream(stream))))
                .isInstanceOf(NoTagsFoundException.class);
    }

    @Test
    void corruptPageAbortsRead() {
        byte[] stream = OggPageBuilder.page(1, 0).packet(vorbisIdentification(44_100)).build();
        stream[stream.length - 1] ^= 0x40;

        assertThatThrownBy(() -> reader.readOgg(new StreamReader(new ByteArraySeekableStream(stream))))
                .isInstanceOf(ChecksumMismatchException.class);
    }

    private static byte[] vorbisIdentification(long sampleRate) {
        return new ByteBuilder()
                .u8(1).ascii("vorbis")
                .le32(0)          // version
                .u8(2)            // channels
                .le32(sampleRate)
                .le32(0).le32(128_000).le32(0)
                .u8(0xB8)
                .u8(1)
                .build();
    }

    private static byte[] filled(int n, char c) {
        byte[] b = new byte[n];
        Arrays.fill(b, (byte) c);
        return b;
    }
}
