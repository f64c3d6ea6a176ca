package com.p14n.eventsource.encoder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Destination for encoded event bytes, usually a client connection.
 *
 * <p>
 * Every sink supports the byte path. Transports that can accept text more
 * cheaply override {@link #writeString(String)}; the observable output must be
 * the same UTF-8 bytes either way.
 * </p>
 */
public interface EventSink {

    /**
     * Writes raw bytes.
     *
     * @param bytes  the buffer
     * @param offset start offset in the buffer
     * @param length number of bytes to write
     * @throws IOException if the underlying transport fails, e.g. the client has
     *                     gone away
     */
    void write(byte[] bytes, int offset, int length) throws IOException;

    /**
     * Writes text as UTF-8.
     *
     * @param text the text to write
     * @throws IOException if the underlying transport fails
     */
    default void writeString(String text) throws IOException {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        write(bytes, 0, bytes.length);
    }

    /**
     * Pushes anything buffered by the sink to the transport.
     *
     * @throws IOException if the underlying transport fails
     */
    void flush() throws IOException;

    /**
     * Whether arbitrary (e.g. compressed) bytes can pass through this sink.
     * Character-only transports return false and can only carry uncompressed
     * streams.
     *
     * @return true if {@link #write(byte[], int, int)} accepts non-text bytes
     */
    default boolean supportsBinary() {
        return true;
    }
}
