package com.p14n.eventsource.data;

import java.util.Objects;

/**
 * A data event. Once serialized it always carries a {@code data} field, even
 * when the payload is empty.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * broker.publish("prices", Publication.of("42", "tick", "{\"price\":10}"));
 * }</pre>
 *
 * @param id    optional identifier; null is treated as empty and omitted on the
 *              wire
 * @param event optional event name; null is treated as empty and omitted on
 *              the wire
 * @param data  the payload, may be empty or contain newlines
 */
public record Publication(String id, String event, String data) implements Event {

    public Publication {
        id = id == null ? "" : id;
        event = event == null ? "" : event;
        data = Objects.requireNonNull(data, "data");
    }

    /**
     * Creates an anonymous, unnamed data event.
     *
     * @param data the payload
     * @return a new publication
     */
    public static Publication of(String data) {
        return new Publication("", "", data);
    }

    /**
     * Creates a data event with all fields.
     *
     * @param id    the identifier, may be empty
     * @param event the event name, may be empty
     * @param data  the payload
     * @return a new publication
     */
    public static Publication of(String id, String event, String data) {
        return new Publication(id, event, data);
    }
}
