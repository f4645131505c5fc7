package com.phillippitts.tagprobe.domain;

import java.time.Duration;
import java.util.Map;

/**
 * Metadata extracted from one audio stream.
 *
 * <p>Each container has its own implementation. Fields a container cannot express keep the
 * defaults declared here: empty strings, zero numbers, a {@code null} picture and
 * {@link Duration#ZERO}.
 */
public interface Metadata {

    /** @return tag dialect, {@link Format#UNKNOWN} when the container carries none */
    Format format();

    /** @return container type */
    FileType fileType();

    default String title() {
        return "";
    }

    default String album() {
        return "";
    }

    default String artist() {
        return "";
    }

    default String albumArtist() {
        return "";
    }

    default String composer() {
        return "";
    }

    default String genre() {
        return "";
    }

    default String comment() {
        return "";
    }

    default String lyrics() {
        return "";
    }

    default int year() {
        return 0;
    }

    default int track() {
        return 0;
    }

    default int trackTotal() {
        return 0;
    }

    default int disc() {
        return 0;
    }

    default int discTotal() {
        return 0;
    }

    /** @return embedded picture, or {@code null} when absent */
    default Picture picture() {
        return null;
    }

    /** @return playback duration, {@link Duration#ZERO} when unknown */
    default Duration duration() {
        return Duration.ZERO;
    }

    /**
     * Container-specific technical fields (sample rate, bit depth, sizes) for machine inspection.
     *
     * @return unmodifiable map, never null
     */
    default Map<String, Object> raw() {
        return Map.of();
    }
}
