package com.phillippitts.tagprobe.mpeg;

import com.phillippitts.tagprobe.exception.UnsupportedFormatException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MpegDurationCalculatorTest {

    /** MPEG 1, Layer III, protection bit 0, 128 kbps, 44.1 kHz, no padding. */
    static final byte[] MPEG1_L3_128K_44K = {(byte) 0xFF, (byte) 0xFA, (byte) 0x90, 0x00};

    @Test
    void decodesHeaderFieldsAtFixedOffsets() {
        MpegFrameHeader h = MpegFrameHeader.decode(MPEG1_L3_128K_44K);

        assertThat(h.version()).isEqualTo(MpegTables.VERSION_MPEG1);
        assertThat(h.layer()).isEqualTo(MpegTables.LAYER_3);
        assertThat(h.protection()).isZero();
        assertThat(h.bitrateIndex()).isEqualTo(9);
        assertThat(h.sampleRateIndex()).isZero();
        assertThat(h.padding()).isZero();
        assertThat(h.bitrateKbps()).isEqualTo(128);
        assertThat(h.sampleRate()).isEqualTo(44_100);
        assertThat(h.samplesPerFrame()).isEqualTo(1152);
    }

    @Test
    void hundredFramesRoundToThreeSeconds() {
        // frame size floor(1152 / 44100 * 128000 / 8) + 4 = 421 bytes
        Duration d = MpegDurationCalculator.computeDuration(MPEG1_L3_128K_44K, 100 * 421);

        // 100 * 1152 / 44100 = 2.61 s
        assertThat(d).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void protectionBitAddsTwoBytesPerFrame() {
        byte[] protectedHeader = {(byte) 0xFF, (byte) 0xFB, (byte) 0x90, 0x00};
        long stripped = 10_000L * 421;

        assertThat(MpegDurationCalculator.computeDuration(MPEG1_L3_128K_44K, stripped))
                .isEqualTo(Duration.ofSeconds(261));
        assertThat(MpegDurationCalculator.computeDuration(protectedHeader, stripped))
                .isEqualTo(Duration.ofSeconds(260));
    }

    @Test
    void paddingAddsOneSlot() {
        // 48 kHz (index 1) shares its low bit with the padding flag
        byte[] padded = {(byte) 0xFF, (byte) 0xFA, (byte) 0x94, 0x00};
        MpegFrameHeader h = MpegFrameHeader.decode(padded);
        assertThat(h.sampleRate()).isEqualTo(48_000);
        assertThat(h.padding()).isEqualTo(1);

        // 384 + 1 + 4 = 389 bytes per 24 ms frame
        assertThat(MpegDurationCalculator.computeDuration(padded, 1000L * 389)).isEqualTo(Duration.ofSeconds(24));
    }

    @Test
    void mpeg2Layer3Uses576SamplesPerFrame() {
        // version bits 10, layer 01, 64 kbps (index 8), 22.05 kHz
        byte[] mpeg2 = {(byte) 0xFF, (byte) 0xF2, (byte) 0x80, 0x00};
        MpegFrameHeader h = MpegFrameHeader.decode(mpeg2);

        assertThat(h.samplesPerFrame()).isEqualTo(576);
        assertThat(h.sampleRate()).isEqualTo(22_050);
        assertThat(h.bitrateKbps()).isEqualTo(64);
    }

    @Test
    void reservedVersionIsUnsupported() {
        byte[] header = {(byte) 0xFF, (byte) 0xEA, (byte) 0x90, 0x00};

        assertThatThrownBy(() -> MpegDurationCalculator.computeDuration(header, 1000))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("Reserved");
    }

    @Test
    void reservedLayerIsUnsupported() {
        byte[] header = {(byte) 0xFF, (byte) 0xF8, (byte) 0x90, 0x00};

        assertThatThrownBy(() -> MpegDurationCalculator.computeDuration(header, 1000))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void freeFormatAndBadBitrateAreUnsupported() {
        byte[] free = {(byte) 0xFF, (byte) 0xFA, (byte) 0x00, 0x00};
        byte[] bad = {(byte) 0xFF, (byte) 0xFA, (byte) 0xF0, 0x00};

        assertThatThrownBy(() -> MpegDurationCalculator.computeDuration(free, 1000))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("bitrate index: 0");
        assertThatThrownBy(() -> MpegDurationCalculator.computeDuration(bad, 1000))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("bitrate index: 15");
    }

    @Test
    void reservedSampleRateIsUnsupported() {
        byte[] header = {(byte) 0xFF, (byte) 0xFA, (byte) 0x9C, 0x00};

        assertThatThrownBy(() -> MpegDurationCalculator.computeDuration(header, 1000))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageContaining("sample rate index: 3");
    }

    @Test
    void rejectsNegativeByteCount() {
        assertThatThrownBy(() -> MpegDurationCalculator.computeDuration(MPEG1_L3_128K_44K, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
