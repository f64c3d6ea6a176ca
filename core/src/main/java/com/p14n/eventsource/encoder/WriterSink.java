package com.p14n.eventsource.encoder;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Sink over a character stream. Text goes straight to the writer; the writer
 * is expected to encode as UTF-8.
 *
 * <p>
 * {@link PrintWriter} hides write failures, so they are surfaced on
 * {@link #flush()} through {@link PrintWriter#checkError()}.
 * </p>
 */
public final class WriterSink implements EventSink {

    private final Writer writer;

    public WriterSink(Writer writer) {
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
        writer.write(new String(bytes, offset, length, StandardCharsets.UTF_8));
    }

    @Override
    public void writeString(String text) throws IOException {
        writer.write(text);
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
        if (writer instanceof PrintWriter printWriter && printWriter.checkError()) {
            throw new IOException("Write to client failed");
        }
    }

    @Override
    public boolean supportsBinary() {
        return false;
    }
}
