package com.p14n.eventsource.servlet;

import java.io.IOException;

import com.p14n.eventsource.encoder.EventSink;

/**
 * The connection-level capabilities {@link EventStreamHandler} needs: somewhere
 * to write, a way to hear that the client went away, and a way to end the
 * response.
 */
public interface StreamingTransport {

    /**
     * @return the sink for this connection; the same instance on every call
     * @throws IOException if the response body cannot be opened
     */
    EventSink sink() throws IOException;

    /**
     * Registers a callback run once when the client disconnects or the
     * connection errors. May be invoked from any thread.
     *
     * @param callback the callback
     */
    void onDisconnect(Runnable callback);

    /**
     * Ends the response. Safe to call more than once.
     */
    void complete();
}
