package com.p14n.eventsource.servlet;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventsource.encoder.EventSink;
import com.p14n.eventsource.encoder.OutputStreamSink;
import com.p14n.eventsource.encoder.WriterSink;

import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.http.HttpServletResponse;

/**
 * {@link StreamingTransport} over a Servlet async context.
 *
 * <p>
 * Compressed streams write to the response output stream. Plain streams use the
 * response writer, which takes text without a byte round trip.
 * </p>
 */
public class ServletStreamingTransport implements StreamingTransport {
    private static final Logger logger = LoggerFactory.getLogger(ServletStreamingTransport.class);

    private final AsyncContext async;
    private final HttpServletResponse response;
    private final boolean binary;
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private EventSink sink;

    /**
     * @param async    the started async context
     * @param response the response being streamed
     * @param binary   true to write bytes, needed for compressed streams
     */
    public ServletStreamingTransport(AsyncContext async, HttpServletResponse response, boolean binary) {
        this.async = Objects.requireNonNull(async, "async");
        this.response = Objects.requireNonNull(response, "response");
        this.binary = binary;
    }

    @Override
    public synchronized EventSink sink() throws IOException {
        if (sink == null) {
            sink = binary
                    ? new OutputStreamSink(response.getOutputStream())
                    : new WriterSink(response.getWriter());
        }
        return sink;
    }

    @Override
    public void onDisconnect(Runnable callback) {
        AtomicBoolean fired = new AtomicBoolean(false);
        Runnable once = () -> {
            if (fired.compareAndSet(false, true)) {
                callback.run();
            }
        };
        async.addListener(new AsyncListener() {
            @Override
            public void onComplete(AsyncEvent event) {
                once.run();
            }

            @Override
            public void onTimeout(AsyncEvent event) {
                once.run();
            }

            @Override
            public void onError(AsyncEvent event) {
                logger.atDebug().setCause(event.getThrowable()).log("Async stream error");
                once.run();
            }

            @Override
            public void onStartAsync(AsyncEvent event) {
                // listener is re-registered by the caller if async is restarted
            }
        });
    }

    @Override
    public void complete() {
        if (!completed.compareAndSet(false, true)) {
            return;
        }
        try {
            async.complete();
        } catch (IllegalStateException e) {
            logger.atDebug().setCause(e).log("Async context already completed by the container");
        }
    }
}
