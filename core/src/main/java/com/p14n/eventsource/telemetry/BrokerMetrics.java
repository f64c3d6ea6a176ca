package com.p14n.eventsource.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for broker operations. Every instrument is
 * tagged with the channel.
 *
 * <ul>
 * <li>events_published: events fanned out on a channel</li>
 * <li>events_delivered: events accepted by a subscriber queue</li>
 * <li>events_replayed: historical events accepted during replay</li>
 * <li>subscribers_evicted: subscribers disconnected because their queue was
 * full</li>
 * <li>active_subscribers: current number of subscribers</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");

        private final LongCounter publishedEvents;
        private final LongCounter deliveredEvents;
        private final LongCounter replayedEvents;
        private final LongCounter evictedSubscribers;
        private final LongUpDownCounter activeSubscribers;

        /**
         * Creates a new BrokerMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedEvents = meter.counterBuilder("events_published")
                                .setDescription("Number of events published to a channel")
                                .build();

                deliveredEvents = meter.counterBuilder("events_delivered")
                                .setDescription("Number of events queued for subscribers")
                                .build();

                replayedEvents = meter.counterBuilder("events_replayed")
                                .setDescription("Number of historical events queued during replay")
                                .build();

                evictedSubscribers = meter.counterBuilder("subscribers_evicted")
                                .setDescription("Number of subscribers disconnected for falling behind")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of active subscribers")
                                .build();
        }

        public void recordPublished(String channel) {
                publishedEvents.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordDelivered(String channel) {
                deliveredEvents.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordReplayed(String channel, long count) {
                if (count > 0) {
                        replayedEvents.add(count, Attributes.of(CHANNEL, channel));
                }
        }

        public void recordEvicted(String channel) {
                evictedSubscribers.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordSubscriberAdded(String channel) {
                activeSubscribers.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordSubscriberRemoved(String channel) {
                activeSubscribers.add(-1, Attributes.of(CHANNEL, channel));
        }
}
