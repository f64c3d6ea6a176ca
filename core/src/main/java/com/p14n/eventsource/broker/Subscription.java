package com.p14n.eventsource.broker;

import java.util.Objects;

/**
 * One connected client on one channel: its replay cursor and its delivery
 * queue.
 *
 * <p>
 * Subscriptions compare by identity. Membership is owned by the broker; the
 * queue is the only part shared between the broker, replay tasks and the
 * connection.
 * </p>
 */
public final class Subscription {

    private final String channel;
    private final String lastEventId;
    private final SubscriptionQueue queue;

    /**
     * @param channel     the channel to join
     * @param lastEventId the client's {@code Last-Event-ID}; null is treated as
     *                    empty
     * @param bufferSize  queue capacity
     */
    public Subscription(String channel, String lastEventId, int bufferSize) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.lastEventId = lastEventId == null ? "" : lastEventId;
        this.queue = new SubscriptionQueue(bufferSize);
    }

    public String channel() {
        return channel;
    }

    public String lastEventId() {
        return lastEventId;
    }

    public SubscriptionQueue queue() {
        return queue;
    }

    /**
     * @param replayAll whether history is replayed to clients without a cursor
     * @return true if history should be replayed to this subscription
     */
    public boolean wantsReplay(boolean replayAll) {
        return replayAll || !lastEventId.isEmpty();
    }

    @Override
    public String toString() {
        return "Subscription[channel=" + channel + ", lastEventId=" + lastEventId + "]";
    }
}
