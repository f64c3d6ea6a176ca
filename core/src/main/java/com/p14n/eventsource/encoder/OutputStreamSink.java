package com.p14n.eventsource.encoder;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Sink over a byte stream. Only the byte path is implemented.
 */
public final class OutputStreamSink implements EventSink {

    private final OutputStream out;

    public OutputStreamSink(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
        out.write(bytes, offset, length);
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }
}
