package com.phillippitts.tagprobe.domain;

import java.util.Objects;

/**
 * Embedded cover art as reported by a tag decoder.
 *
 * @param ext         file extension hint (e.g. "jpg"), empty when unknown
 * @param mimeType    MIME type (e.g. "image/jpeg")
 * @param type        picture role (e.g. "Cover (front)")
 * @param description free text description
 * @param data        raw image bytes
 */
public record Picture(String ext, String mimeType, String type, String description, byte[] data) {

    public Picture {
        Objects.requireNonNull(mimeType, "mimeType must not be null");
        Objects.requireNonNull(data, "data must not be null");
        ext = ext == null ? "" : ext;
        type = type == null ? "" : type;
        description = description == null ? "" : description;
    }

    @Override
    public String toString() {
        return "Picture{type=" + type + ", mimeType=" + mimeType + ", bytes=" + data.length + "}";
    }
}
