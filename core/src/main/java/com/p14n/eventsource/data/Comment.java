package com.p14n.eventsource.data;

import java.util.Objects;

/**
 * A comment line. Written as {@code :value} without a record terminator so
 * clients never treat it as a data event boundary.
 *
 * @param value the comment text
 */
public record Comment(String value) implements Event {

    public Comment {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String id() {
        return "";
    }
}
