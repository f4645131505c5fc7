package com.phillippitts.tagprobe.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable tag values produced by a tag decoder.
 *
 * <p>Absent strings are empty, absent numbers are zero and an absent picture is {@code null}.
 *
 * <pre>
 * TagFields tags = TagFields.builder()
 *         .title("Song")
 *         .artist("Band")
 *         .track(3, 12)
 *         .raw("TIT2", "Song")
 *         .build();
 * </pre>
 */
public final class TagFields {

    private static final TagFields EMPTY = builder().build();

    private final String title;
    private final String album;
    private final String artist;
    private final String albumArtist;
    private final String composer;
    private final String genre;
    private final String comment;
    private final String lyrics;
    private final int year;
    private final int track;
    private final int trackTotal;
    private final int disc;
    private final int discTotal;
    private final Picture picture;
    private final Map<String, Object> raw;

    private TagFields(Builder b) {
        this.title = b.title;
        this.album = b.album;
        this.artist = b.artist;
        this.albumArtist = b.albumArtist;
        this.composer = b.composer;
        this.genre = b.genre;
        this.comment = b.comment;
        this.lyrics = b.lyrics;
        this.year = b.year;
        this.track = b.track;
        this.trackTotal = b.trackTotal;
        this.disc = b.disc;
        this.discTotal = b.discTotal;
        this.picture = b.picture;
        this.raw = Collections.unmodifiableMap(new LinkedHashMap<>(b.raw));
    }

    public static TagFields empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return builder pre-populated with this instance's values
     */
    public Builder toBuilder() {
        Builder b = new Builder()
                .title(title)
                .album(album)
                .artist(artist)
                .albumArtist(albumArtist)
                .composer(composer)
                .genre(genre)
                .comment(comment)
                .lyrics(lyrics)
                .year(year)
                .track(track, trackTotal)
                .disc(disc, discTotal)
                .picture(picture);
        raw.forEach(b::raw);
        return b;
    }

    public String title() {
        return title;
    }

    public String album() {
        return album;
    }

    public String artist() {
        return artist;
    }

    public String albumArtist() {
        return albumArtist;
    }

    public String composer() {
        return composer;
    }

    public String genre() {
        return genre;
    }

    public String comment() {
        return comment;
    }

    public String lyrics() {
        return lyrics;
    }

    public int year() {
        return year;
    }

    public int track() {
        return track;
    }

    public int trackTotal() {
        return trackTotal;
    }

    public int disc() {
        return disc;
    }

    public int discTotal() {
        return discTotal;
    }

    public Picture picture() {
        return picture;
    }

    public Map<String, Object> raw() {
        return raw;
    }

    @Override
    public String toString() {
        return "TagFields{title=" + title + ", artist=" + artist + ", album=" + album
                + ", year=" + year + ", track=" + track + "/" + trackTotal + ", raw=" + raw.size() + " keys}";
    }

    /**
     * Fluent builder for {@link TagFields}. Null strings are stored as empty strings.
     */
    public static final class Builder {
        private String title = "";
        private String album = "";
        private String artist = "";
        private String albumArtist = "";
        private String composer = "";
        private String genre = "";
        private String comment = "";
        private String lyrics = "";
        private int year;
        private int track;
        private int trackTotal;
        private int disc;
        private int discTotal;
        private Picture picture;
        private final Map<String, Object> raw = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder title(String title) {
            this.title = nonNull(title);
            return this;
        }

        public Builder album(String album) {
            this.album = nonNull(album);
            return this;
        }

        public Builder artist(String artist) {
            this.artist = nonNull(artist);
            return this;
        }

        public Builder albumArtist(String albumArtist) {
            this.albumArtist = nonNull(albumArtist);
            return this;
        }

        public Builder composer(String composer) {
            this.composer = nonNull(composer);
            return this;
        }

        public Builder genre(String genre) {
            this.genre = nonNull(genre);
            return this;
        }

        public Builder comment(String comment) {
            this.comment = nonNull(comment);
            return this;
        }

        public Builder lyrics(String lyrics) {
            this.lyrics = nonNull(lyrics);
            return this;
        }

        public Builder year(int year) {
            this.year = year;
            return this;
        }

        public Builder track(int track, int total) {
            this.track = track;
            this.trackTotal = total;
            return this;
        }

        public Builder disc(int disc, int total) {
            this.disc = disc;
            this.discTotal = total;
            return this;
        }

        public Builder picture(Picture picture) {
            this.picture = picture;
            return this;
        }

        /**
         * Adds a raw key/value pair. Null keys or values are ignored.
         */
        public Builder raw(String key, Object value) {
            if (key != null && value != null) {
                this.raw.put(key, value);
            }
            return this;
        }

        public TagFields build() {
            return new TagFields(this);
        }

        private static String nonNull(String s) {
            return s == null ? "" : s;
        }
    }
}
