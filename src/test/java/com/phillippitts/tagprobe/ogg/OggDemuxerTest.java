package com.phillippitts.tagprobe.ogg;

import com.phillippitts.tagprobe.exception.ChecksumMismatchException;
import com.phillippitts.tagprobe.exception.FormatMismatchException;
import com.phillippitts.tagprobe.exception.OrphanedContinuationException;
import com.phillippitts.tagprobe.exception.StreamReadException;
import com.phillippitts.tagprobe.stream.ByteArraySeekableStream;
import com.phillippitts.tagprobe.stream.StreamReader;
import com.phillippitts.tagprobe.testutil.ByteBuilder;
import com.phillippitts.tagprobe.testutil.OggPageBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OggDemuxerTest {

    private OggDemuxer demuxer;

    @BeforeEach
    void setup() {
        demuxer = new OggDemuxer();
    }

    private static StreamReader in(byte[]... pages) {
        ByteBuilder b = new ByteBuilder();
        for (byte[] p : pages) {
            b.bytes(p);
        }
        return new StreamReader(new ByteArraySeekableStream(b.build()));
    }

    @Test
    void reassemblesPacketSpanningTwoPages() {
        byte[] ident = filled(30, 1);
        byte[] first = filled(510, 2);
        byte[] second = filled(40, 3);
        StreamReader in = in(
                OggPageBuilder.page(7, 0).flags(OggPageHeader.FLAG_FIRST_PAGE).packet(ident).build(),
                OggPageBuilder.page(7, 1).granule(OggPageHeader.NO_GRANULE).openPacket(first).build(),
                OggPageBuilder.page(7, 2).flags(OggPageHeader.FLAG_CONTINUED).packet(second).build());

        OggPage p0 = demuxer.readPage(in).orElseThrow();
        OggPage p1 = demuxer.readPage(in).orElseThrow();
        assertThat(demuxer.pendingBytes(7)).isEqualTo(510);
        OggPage p2 = demuxer.readPage(in).orElseThrow();

        assertThat(p0.packets()).containsExactly(ident);
        assertThat(p0.header().isFirstPage()).isTrue();
        assertThat(p1.packets()).isEmpty();
        assertThat(p1.granulePosition()).isEqualTo(OggPageHeader.NO_GRANULE);
        assertThat(p2.packets()).hasSize(1);
        assertThat(p2.packets().get(0)).isEqualTo(concat(first, second));
        assertThat(demuxer.pendingBytes(7)).isZero();
        assertThat(demuxer.readPage(in)).isEmpty();
    }

    @Test
    void packetOfExactly255BytesEndsWithZeroSegment() {
        byte[] packet = filled(255, 9);
        StreamReader in = in(OggPageBuilder.page(1, 0).packet(packet).packet(new byte[]{5}).build());

        OggPage page = demuxer.readPage(in).orElseThrow();

        assertThat(page.header().segmentCount()).isEqualTo(3);
        assertThat(page.packets()).hasSize(2);
        assertThat(page.packets().get(0)).isEqualTo(packet);
        assertThat(page.packets().get(1)).containsExactly(5);
    }

    @Test
    void keepsMultiplexedStreamsApart() {
        byte[] a1 = filled(255, 1);
        byte[] b1 = filled(255, 2);
        StreamReader in = in(
                OggPageBuilder.page(100, 0).openPacket(a1).build(),
                OggPageBuilder.page(200, 0).openPacket(b1).build(),
                OggPageBuilder.page(100, 1).flags(OggPageHeader.FLAG_CONTINUED).packet(new byte[]{10}).build(),
                OggPageBuilder.page(200, 1).flags(OggPageHeader.FLAG_CONTINUED).packet(new byte[]{20}).build());

        demuxer.readPage(in);
        demuxer.readPage(in);
        OggPage a = demuxer.readPage(in).orElseThrow();
        OggPage b = demuxer.readPage(in).orElseThrow();

        assertThat(a.serialNumber()).isEqualTo(100);
        assertThat(a.packets().get(0)).isEqualTo(concat(a1, new byte[]{10}));
        assertThat(b.serialNumber()).isEqualTo(200);
        assertThat(b.packets().get(0)).isEqualTo(concat(b1, new byte[]{20}));
    }

    @Test
    void rejectsContinuationWithoutPendingPacket() {
        StreamReader in = in(OggPageBuilder.page(42, 3).flags(OggPageHeader.FLAG_CONTINUED)
                .packet(new byte[]{1}).build());

        assertThatThrownBy(() -> demuxer.readPage(in))
                .isInstanceOf(OrphanedContinuationException.class)
                .hasMessageContaining("stream 42");
    }

    @Test
    void anySingleByteFlipIsDetected() {
        byte[] page = OggPageBuilder.page(5, 0).granule(1234).packet(filled(20, 4)).build();

        for (int i = 4; i < page.length; i++) {
            byte[] corrupt = page.clone();
            corrupt[i] ^= 0x01;
            if (i == 26 || i == 27) {
                // segment count or lacing value: the page layout itself changes
                assertThatThrownBy(() -> new OggDemuxer().readPage(in(corrupt)))
                        .isInstanceOfAny(ChecksumMismatchException.class, StreamReadException.class);
                continue;
            }
            int at = i;
            assertThatThrownBy(() -> new OggDemuxer().readPage(in(corrupt)))
                    .as("flip at byte %d", at)
                    .isInstanceOf(ChecksumMismatchException.class);
        }
    }

    @Test
    void acceptsUntouchedPage() {
        byte[] page = OggPageBuilder.page(5, 0).granule(1234).packet(filled(20, 4)).build();

        Optional<OggPage> read = demuxer.readPage(in(page));

        assertThat(read).isPresent();
        assertThat(read.get().granulePosition()).isEqualTo(1234);
        assertThat(read.get().header().sequenceNumber()).isZero();
    }

    @Test
    void rejectsMissingCapturePattern() {
        byte[] page = OggPageBuilder.page(5, 0).packet(new byte[]{1}).build();
        page[0] = 'X';

        assertThatThrownBy(() -> demuxer.readPage(in(page)))
                .isInstanceOf(FormatMismatchException.class)
                .hasMessageContaining("OggS");
    }

    @Test
    void truncatedPageFails() {
        byte[] page = OggPageBuilder.page(5, 0).packet(filled(50, 1)).build();

        assertThatThrownBy(() -> demuxer.readPage(in(Arrays.copyOf(page, page.length - 10))))
                .isInstanceOf(StreamReadException.class);
    }

    private static byte[] filled(int n, int value) {
        byte[] b = new byte[n];
        Arrays.fill(b, (byte) value);
        return b;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        return new ByteBuilder().bytes(a).bytes(b).build();
    }
}
