package com.p14n.eventsource.encoder;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.zip.GZIPOutputStream;

import com.p14n.eventsource.data.Comment;
import com.p14n.eventsource.data.Event;
import com.p14n.eventsource.data.Publication;

/**
 * Serializes events into the {@code text/event-stream} wire format.
 *
 * <p>
 * A publication becomes
 * </p>
 *
 * <pre>
 * id: &lt;id&gt;          (only when the id is not empty)
 * event: &lt;event&gt;    (only when the event name is not empty)
 * data: &lt;line&gt;      (one per newline-separated segment of the data)
 *                   (blank line terminating the record)
 * </pre>
 *
 * <p>
 * A trailing newline in the data yields a final empty {@code data: } line, and
 * empty data still produces a single {@code data: } line. A comment becomes a
 * single {@code :value} line without a terminating blank line.
 * </p>
 *
 * <p>
 * With compression enabled the bytes pass through a gzip stream that is
 * sync-flushed after every event, so each event reaches the client as soon as
 * it is encoded. The gzip header is written together with the first event.
 * </p>
 *
 * <p>
 * Not thread safe; one encoder serves one connection.
 * </p>
 */
public final class EventEncoder {

    private final EventSink sink;
    private final boolean compress;
    private GZIPOutputStream gzip;

    /**
     * @param sink     where encoded bytes go
     * @param compress whether to gzip the stream
     * @throws IllegalArgumentException if compression is requested on a sink
     *                                  that cannot carry binary data
     */
    public EventEncoder(EventSink sink, boolean compress) {
        this.sink = Objects.requireNonNull(sink, "sink");
        if (compress && !sink.supportsBinary()) {
            throw new IllegalArgumentException("Compressed streams need a binary sink");
        }
        this.compress = compress;
    }

    /**
     * Writes one event and flushes it to the sink. Failures are reported, never
     * retried.
     *
     * @param event the event to write
     * @throws IOException if the sink fails
     */
    public void encode(Event event) throws IOException {
        String text = render(event);
        if (compress) {
            GZIPOutputStream out = gzipStream();
            out.write(text.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } else {
            sink.writeString(text);
        }
        sink.flush();
    }

    /**
     * Renders an event exactly as it appears on the wire, before compression.
     *
     * @param event the event to render
     * @return the wire text
     */
    public static String render(Event event) {
        Objects.requireNonNull(event, "event");
        StringBuilder sb = new StringBuilder();
        if (event instanceof Comment comment) {
            sb.append(':').append(comment.value()).append('\n');
        } else if (event instanceof Publication publication) {
            if (!publication.id().isEmpty()) {
                sb.append("id: ").append(publication.id()).append('\n');
            }
            if (!publication.event().isEmpty()) {
                sb.append("event: ").append(publication.event()).append('\n');
            }
            for (String line : publication.data().split("\n", -1)) {
                sb.append("data: ").append(line).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private GZIPOutputStream gzipStream() throws IOException {
        if (gzip == null) {
            gzip = new GZIPOutputStream(new SinkOutputStream(sink), true);
        }
        return gzip;
    }

    /**
     * Byte stream view of a sink for the compressor. Flushing is left to the
     * encoder so the sink sees exactly one flush per event.
     */
    private static final class SinkOutputStream extends OutputStream {
        private final EventSink sink;

        SinkOutputStream(EventSink sink) {
            this.sink = sink;
        }

        @Override
        public void write(int b) throws IOException {
            sink.write(new byte[] { (byte) b }, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            sink.write(b, off, len);
        }
    }
}
