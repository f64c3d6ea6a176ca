package com.p14n.eventsource.replay;

import java.util.stream.Stream;

import com.p14n.eventsource.data.Event;

/**
 * Source of historical events for reconnecting clients.
 *
 * <p>
 * Implementations are external to the broker: a database, a log, or the
 * bundled {@link InMemoryRepository}. The broker drains the returned stream
 * once, in order, into the subscriber's queue and then closes it.
 * </p>
 */
@FunctionalInterface
public interface Repository {

    /**
     * Produces the events that follow {@code lastEventId} on {@code channel}.
     *
     * @param channel     the channel being joined
     * @param lastEventId the client's cursor; empty means everything available
     * @return a finite, ordered, one-shot stream of events
     */
    Stream<Event> replay(String channel, String lastEventId);
}
