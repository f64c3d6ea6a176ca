package com.p14n.eventsource.broker;

import java.util.Collection;
import java.util.List;

import com.p14n.eventsource.data.BrokerConfig;
import com.p14n.eventsource.data.Event;
import com.p14n.eventsource.replay.Repository;

/**
 * Fans events out to channel subscribers and replays history to reconnecting
 * clients.
 *
 * <p>
 * None of these operations fail at the call site. Once the broker is shut down
 * they return without effect.
 * </p>
 */
public interface EventBroker extends AutoCloseable {

    /**
     * Publishes an event to every current subscriber of the given channels.
     * Subscribers whose queue is full are disconnected.
     *
     * @param channels the target channels
     * @param event    the event
     */
    void publish(Collection<String> channels, Event event);

    /**
     * Publishes an event to every current subscriber of one channel.
     *
     * @param channel the target channel
     * @param event   the event
     */
    default void publish(String channel, Event event) {
        publish(List.of(channel), event);
    }

    /**
     * Binds a history repository to a channel, replacing any earlier binding.
     * A null repository is ignored.
     *
     * @param channel    the channel
     * @param repository the repository
     */
    void registerRepository(String channel, Repository repository);

    /**
     * Sets the repository used for channels without their own binding.
     *
     * @param repository the fallback repository, or null for none
     */
    void registerDefaultRepository(Repository repository);

    /**
     * Adds a subscription to its channel, starting a replay if the subscription
     * has a cursor or {@link BrokerConfig#replayAll()} is set. Returns once the
     * broker has accepted the subscription. If the broker is shut down the
     * subscription's queue is closed instead.
     *
     * @param subscription the subscription
     */
    void subscribe(Subscription subscription);

    /**
     * Removes a subscription and closes its queue. Removing an unknown
     * subscription does nothing.
     *
     * @param subscription the subscription
     */
    void unsubscribe(Subscription subscription);

    /**
     * @param channel the channel
     * @return the number of subscriptions on the channel, 0 after shutdown
     */
    int subscriberCount(String channel);

    /**
     * @return the configuration this broker and its handlers use
     */
    BrokerConfig config();

    /**
     * @return the executor running the broker's background work, which
     *         streaming connections also run on
     */
    AsyncExecutor executor();

    /**
     * Closes every subscription's queue and stops the broker. Safe to call more
     * than once.
     */
    void shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
