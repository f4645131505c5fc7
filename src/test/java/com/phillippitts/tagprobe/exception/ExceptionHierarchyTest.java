package com.phillippitts.tagprobe.exception;

import com.phillippitts.tagprobe.domain.FileType;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void tagProbeExceptionShouldIncludeMessage() {
        TagProbeException ex = new TagProbeException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void tagProbeExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        TagProbeException ex = new TagProbeException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void streamReadExceptionShouldIncludePosition() {
        IOException cause = new IOException("disk gone");
        StreamReadException ex = new StreamReadException("Read failed", 4096, cause);

        assertThat(ex.getMessage()).contains("Read failed").contains("position 4096");
        assertThat(ex.getPosition()).isEqualTo(4096);
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void formatMismatchShouldIncludeExpectedAndActual() {
        FormatMismatchException ex = new FormatMismatchException("RIFF", "RIFX");

        assertThat(ex.getMessage()).isEqualTo("Expected 'RIFF' but found 'RIFX'");
        assertThat(ex.getExpected()).isEqualTo("RIFF");
        assertThat(ex.getActual()).isEqualTo("RIFX");
    }

    @Test
    void checksumMismatchShouldFormatAsHex() {
        ChecksumMismatchException ex = new ChecksumMismatchException(0x89A1897FL, 0x1L);

        assertThat(ex.getMessage()).isEqualTo("Expected crc 89a1897f but computed 00000001");
        assertThat(ex.getExpected()).isEqualTo(0x89A1897FL);
        assertThat(ex.getActual()).isEqualTo(1L);
    }

    @Test
    void orphanedContinuationShouldIncludeSerial() {
        OrphanedContinuationException ex = new OrphanedContinuationException(0xFFFFFFFFL);

        assertThat(ex.getSerialNumber()).isEqualTo(0xFFFFFFFFL);
        assertThat(ex.getMessage()).contains("4294967295");
    }

    @Test
    void containerIdentificationShouldCarryBestGuessAndCause() {
        UnsupportedVersionException cause = new UnsupportedVersionException("ID3", 7, "2, 3 or 4");
        ContainerIdentificationException ex = new ContainerIdentificationException(FileType.WAV, cause);

        assertThat(ex.getBestGuess()).isEqualTo(FileType.WAV);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getMessage()).contains("WAV").contains("ID3 version: 7");
    }

    @Test
    void tagDecodingExceptionShouldIncludeTagType() {
        TagDecodingException ex = new TagDecodingException("id3v2", "frame size overflow");

        assertThat(ex.getTagType()).isEqualTo("id3v2");
        assertThat(ex.getMessage()).contains("frame size overflow").contains("id3v2");
    }

    @Test
    void allExceptionsShareTheRoot() {
        assertThat(new NoTagsFoundException()).isInstanceOf(TagProbeException.class);
        assertThat(new UnsupportedFormatException("x")).isInstanceOf(TagProbeException.class);
        assertThat(new UnsupportedVersionException("ID3", 1, "2")).isInstanceOf(TagProbeException.class);
        assertThat(new TagProbeException("x")).isInstanceOf(RuntimeException.class);
    }
}
