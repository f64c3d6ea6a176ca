package com.p14n.eventsource.data;

/**
 * A value that can be written to a server-sent event stream.
 *
 * <p>
 * There are exactly two kinds of event:
 * </p>
 * <ul>
 * <li>{@link Publication}: a data record with optional id and event name</li>
 * <li>{@link Comment}: a single meta line, typically a heartbeat</li>
 * </ul>
 *
 * <p>
 * The encoder dispatches on the concrete type, so new variants cannot be added
 * outside this package.
 * </p>
 */
public sealed interface Event permits Publication, Comment {

    /**
     * Identifier used by clients as their {@code Last-Event-ID} cursor.
     *
     * @return the identifier, or an empty string when the event carries none
     */
    String id();
}
