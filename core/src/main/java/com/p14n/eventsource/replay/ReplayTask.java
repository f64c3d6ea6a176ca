package com.p14n.eventsource.replay;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventsource.broker.Subscription;
import com.p14n.eventsource.data.Event;
import com.p14n.eventsource.telemetry.BrokerMetrics;

import io.opentelemetry.api.trace.Tracer;

import static com.p14n.eventsource.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Copies a repository's history into one subscription's queue.
 *
 * <p>
 * Writes use the same discipline as live publishing: when the queue is full the
 * subscription is evicted (its queue closed and {@code onOverflow} told so the
 * broker can drop it). When the queue is already closed the task just stops.
 * A repository that throws ends the replay early; live delivery continues.
 * </p>
 */
public class ReplayTask implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ReplayTask.class);

    private final Repository repository;
    private final Subscription subscription;
    private final Consumer<Subscription> onOverflow;
    private final BrokerMetrics metrics;
    private final Tracer tracer;

    /**
     * @param repository   where history comes from
     * @param subscription the subscription to fill
     * @param onOverflow   called once if this task evicts the subscription
     * @param metrics      broker metrics
     * @param tracer       tracer for the replay span
     */
    public ReplayTask(Repository repository, Subscription subscription, Consumer<Subscription> onOverflow,
            BrokerMetrics metrics, Tracer tracer) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.subscription = Objects.requireNonNull(subscription, "subscription");
        this.onOverflow = Objects.requireNonNull(onOverflow, "onOverflow");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    /**
     * Runs the replay.
     *
     * @return the number of events queued
     */
    @Override
    public Integer call() {
        String channel = subscription.channel();
        int replayed = processWithTelemetry(tracer, "replay_events", channel, this::drain);
        metrics.recordReplayed(channel, replayed);
        logger.atDebug()
                .addArgument(replayed)
                .addArgument(subscription)
                .log("Replayed {} events to {}");
        return replayed;
    }

    private int drain() {
        int count = 0;
        try (Stream<Event> history = repository.replay(subscription.channel(), subscription.lastEventId())) {
            if (history == null) {
                return 0;
            }
            Iterator<Event> events = history.iterator();
            while (events.hasNext()) {
                if (!subscription.queue().offer(events.next())) {
                    if (subscription.queue().close()) {
                        metrics.recordEvicted(subscription.channel());
                        logger.atDebug().addArgument(subscription).log("Queue full during replay, evicting {}");
                        onOverflow.accept(subscription);
                    }
                    return count;
                }
                count++;
            }
        } catch (RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(subscription)
                    .log("Replay source failed for {}, continuing with live events");
        }
        return count;
    }
}
