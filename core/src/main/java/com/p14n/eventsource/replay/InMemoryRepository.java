package com.p14n.eventsource.replay;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import com.p14n.eventsource.data.Comment;
import com.p14n.eventsource.data.Event;

/**
 * Keeps the most recent events of each channel in memory.
 *
 * <p>
 * A replay returns the events recorded after the one whose id equals the
 * cursor. An empty cursor, or one that has already been trimmed from history,
 * replays everything retained. Comments are never recorded.
 * </p>
 *
 * <pre>{@code
 * var history = new InMemoryRepository(500);
 * broker.registerRepository("prices", history);
 * history.add("prices", event);
 * broker.publish("prices", event);
 * }</pre>
 */
public class InMemoryRepository implements Repository {

    private final int capacityPerChannel;
    private final Map<String, Deque<Event>> history = new ConcurrentHashMap<>();

    /**
     * @param capacityPerChannel how many events to retain per channel
     * @throws IllegalArgumentException if capacityPerChannel is less than 1
     */
    public InMemoryRepository(int capacityPerChannel) {
        if (capacityPerChannel < 1) {
            throw new IllegalArgumentException("capacityPerChannel must be at least 1, was " + capacityPerChannel);
        }
        this.capacityPerChannel = capacityPerChannel;
    }

    /**
     * Records an event, dropping the oldest one when the channel is at capacity.
     *
     * @param channel the channel
     * @param event   the event
     */
    public void add(String channel, Event event) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(event, "event");
        if (event instanceof Comment) {
            return;
        }
        Deque<Event> events = history.computeIfAbsent(channel, k -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            while (events.size() > capacityPerChannel) {
                events.removeFirst();
            }
        }
    }

    @Override
    public Stream<Event> replay(String channel, String lastEventId) {
        Deque<Event> events = history.get(channel);
        if (events == null) {
            return Stream.empty();
        }
        List<Event> snapshot;
        synchronized (events) {
            snapshot = new ArrayList<>(events);
        }
        if (lastEventId == null || lastEventId.isEmpty()) {
            return snapshot.stream();
        }
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            if (lastEventId.equals(snapshot.get(i).id())) {
                return snapshot.subList(i + 1, snapshot.size()).stream();
            }
        }
        return snapshot.stream();
    }

    /**
     * @param channel the channel
     * @return number of events currently retained for the channel
     */
    public int size(String channel) {
        Deque<Event> events = history.get(channel);
        if (events == null) {
            return 0;
        }
        synchronized (events) {
            return events.size();
        }
    }
}
