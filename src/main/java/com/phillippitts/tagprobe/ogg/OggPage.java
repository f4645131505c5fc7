package com.phillippitts.tagprobe.ogg;

import java.util.List;
import java.util.Objects;

/**
 * One demuxed OGG page.
 *
 * @param header  parsed page header
 * @param packets packets completed on this page, in order; empty when the page only carries a
 *                fragment of a packet that continues on a later page
 */
public record OggPage(OggPageHeader header, List<byte[]> packets) {

    public OggPage {
        Objects.requireNonNull(header, "header must not be null");
        packets = List.copyOf(packets);
    }

    public long granulePosition() {
        return header.granulePosition();
    }

    public long serialNumber() {
        return header.serialNumber();
    }
}
