package com.p14n.eventsource.servlet;

import com.p14n.eventsource.data.Event;

/**
 * Produces an event written to each new connection before live events, for
 * example a snapshot of current state. A failure is logged and the stream
 * carries on without it.
 */
@FunctionalInterface
public interface InitialEventSupplier {

    /**
     * @return the event to send, or null to send nothing
     * @throws Exception if the event cannot be produced
     */
    Event get() throws Exception;
}
