package com.phillippitts.tagprobe.domain;

/**
 * {@link Metadata} whose tag accessors are answered by decoded {@link TagFields}.
 */
public interface TagBackedMetadata extends Metadata {

    /** @return decoded tag values, never null */
    TagFields tags();

    @Override
    default String title() {
        return tags().title();
    }

    @Override
    default String album() {
        return tags().album();
    }

    @Override
    default String artist() {
        return tags().artist();
    }

    @Override
    default String albumArtist() {
        return tags().albumArtist();
    }

    @Override
    default String composer() {
        return tags().composer();
    }

    @Override
    default String genre() {
        return tags().genre();
    }

    @Override
    default String comment() {
        return tags().comment();
    }

    @Override
    default String lyrics() {
        return tags().lyrics();
    }

    @Override
    default int year() {
        return tags().year();
    }

    @Override
    default int track() {
        return tags().track();
    }

    @Override
    default int trackTotal() {
        return tags().trackTotal();
    }

    @Override
    default int disc() {
        return tags().disc();
    }

    @Override
    default int discTotal() {
        return tags().discTotal();
    }

    @Override
    default Picture picture() {
        return tags().picture();
    }
}
