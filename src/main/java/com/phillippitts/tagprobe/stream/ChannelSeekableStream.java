package com.phillippitts.tagprobe.stream;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link SeekableByteStream} backed by a {@link SeekableByteChannel}, typically a file.
 *
 * <p>Closing this stream closes the channel; later reads fail with
 * {@link java.nio.channels.ClosedChannelException}.
 */
public final class ChannelSeekableStream implements SeekableByteStream {

    private final SeekableByteChannel channel;

    public ChannelSeekableStream(SeekableByteChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
    }

    /**
     * Opens a file for reading.
     *
     * @param path file to open
     * @return stream owning the opened channel
     * @throws IOException if the file cannot be opened
     */
    public static ChannelSeekableStream open(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        return new ChannelSeekableStream(Files.newByteChannel(path, StandardOpenOption.READ));
    }

    @Override
    public int read(byte[] buf, int off, int len) throws IOException {
        return channel.read(ByteBuffer.wrap(buf, off, len));
    }

    @Override
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public void seek(long position) throws IOException {
        long size = channel.size();
        if (position < 0 || position > size) {
            throw new IOException("Seek to " + position + " outside [0, " + size + "]");
        }
        channel.position(position);
    }

    @Override
    public long size() throws IOException {
        return channel.size();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
