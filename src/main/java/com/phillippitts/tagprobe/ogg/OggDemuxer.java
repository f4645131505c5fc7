package com.phillippitts.tagprobe.ogg;

import com.phillippitts.tagprobe.exception.ChecksumMismatchException;
import com.phillippitts.tagprobe.exception.FormatMismatchException;
import com.phillippitts.tagprobe.exception.OrphanedContinuationException;
import com.phillippitts.tagprobe.exception.StreamReadException;
import com.phillippitts.tagprobe.stream.StreamReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Demuxing session for one physical OGG stream.
 *
 * <p>Splits pages into packets by walking the segment table: a segment of 255 bytes means the
 * packet goes on, a shorter one ends it. Unfinished packets are kept per logical stream
 * (serial number) until a page flagged as continued completes them, so multiplexed streams
 * are reassembled independently.
 *
 * <p>A session holds state across {@link #readPage} calls. Create one per physical stream and
 * do not share it between streams or threads.
 */
public final class OggDemuxer {

    private static final Logger LOG = LogManager.getLogger(OggDemuxer.class);

    private static final int MAX_SEGMENT_SIZE = 255;

    private final Map<Long, ByteArrayOutputStream> pending = new HashMap<>();

    /**
     * Reads and verifies the page at the cursor.
     *
     * @param in reader positioned at a page boundary
     * @return the page with its completed packets, or empty at a clean end of stream
     * @throws FormatMismatchException if the capture pattern is missing
     * @throws ChecksumMismatchException if the stored CRC does not match the page
     * @throws OrphanedContinuationException if a continued page has no pending packet
     * @throws StreamReadException if the page is truncated
     */
    public Optional<OggPage> readPage(StreamReader in) {
        if (in.remaining() == 0) {
            return Optional.empty();
        }
        long pageStart = in.position();
        byte[] headerBytes = in.readBytes(OggPageHeader.SIZE);
        OggPageHeader header = OggPageHeader.parse(headerBytes);
        byte[] segmentTable = in.readBytes(header.segmentCount());
        int bodySize = 0;
        for (byte s : segmentTable) {
            bodySize += s & 0xFF;
        }
        byte[] body = in.readBytes(bodySize);

        verifyChecksum(header, headerBytes, segmentTable, body);

        long serial = header.serialNumber();
        ByteArrayOutputStream packet;
        if (header.isContinued()) {
            packet = pending.get(serial);
            if (packet == null) {
                throw new OrphanedContinuationException(serial);
            }
        } else {
            packet = pending.get(serial);
            if (packet != null && packet.size() > 0) {
                LOG.warn("Dropping {} byte unfinished packet of stream {} at page {}",
                        packet.size(), serial, header.sequenceNumber());
            }
            packet = new ByteArrayOutputStream();
        }

        List<byte[]> packets = new ArrayList<>();
        int p = 0;
        for (byte s : segmentTable) {
            int len = s & 0xFF;
            packet.write(body, p, len);
            p += len;
            if (len < MAX_SEGMENT_SIZE) {
                packets.add(packet.toByteArray());
                packet = new ByteArrayOutputStream();
            }
        }
        pending.put(serial, packet);

        LOG.debug("OGG page at {}: stream {}, seq {}, {}{}{}granule {}, {} segments, {} packets",
                pageStart, serial, header.sequenceNumber(),
                header.isContinued() ? "cont " : "",
                header.isFirstPage() ? "bos " : "",
                header.isLastPage() ? "eos " : "",
                header.granulePosition(), header.segmentCount(), packets.size());
        return Optional.of(new OggPage(header, packets));
    }

    /**
     * @return bytes buffered for an unfinished packet of {@code serialNumber}, 0 if none
     */
    public int pendingBytes(long serialNumber) {
        ByteArrayOutputStream b = pending.get(serialNumber);
        return b == null ? 0 : b.size();
    }

    private static void verifyChecksum(OggPageHeader header, byte[] headerBytes, byte[] segmentTable, byte[] body) {
        byte[] zeroed = headerBytes.clone();
        for (int i = 0; i < 4; i++) {
            zeroed[OggPageHeader.CRC_OFFSET + i] = 0;
        }
        int crc = OggCrc.update(0, zeroed);
        crc = OggCrc.update(crc, segmentTable);
        crc = OggCrc.update(crc, body);
        long actual = Integer.toUnsignedLong(crc);
        if (actual != header.crc()) {
            throw new ChecksumMismatchException(header.crc(), actual);
        }
    }
}
