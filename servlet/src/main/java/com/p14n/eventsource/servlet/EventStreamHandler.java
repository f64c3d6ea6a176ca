package com.p14n.eventsource.servlet;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventsource.broker.EventBroker;
import com.p14n.eventsource.broker.Subscription;
import com.p14n.eventsource.broker.SubscriptionQueue;
import com.p14n.eventsource.data.Comment;
import com.p14n.eventsource.data.Event;
import com.p14n.eventsource.encoder.EventEncoder;
import com.p14n.eventsource.encoder.EventSink;

/**
 * Runs one client connection: registers the subscription, writes the optional
 * initial event, then writes queued events until the queue is closed or a write
 * fails.
 *
 * <p>
 * The queue closes when the client disconnects, when the broker evicts the
 * subscription or when the broker shuts down. In every case the subscription is
 * removed and the transport completed before {@link #stream} returns.
 * </p>
 */
public class EventStreamHandler {
    private static final Logger logger = LoggerFactory.getLogger(EventStreamHandler.class);
    private static final long IDLE_POLL_MILLIS = 1000;
    private static final Comment HEARTBEAT = new Comment("");

    private final EventBroker broker;

    public EventStreamHandler(EventBroker broker) {
        this.broker = Objects.requireNonNull(broker, "broker");
    }

    /**
     * Streams events to one client. Blocks until the stream ends.
     *
     * @param subscription the client's subscription, not yet registered
     * @param transport    the client connection
     * @param gzip         whether to compress the stream
     * @param initialEvent written before live events, may be null
     */
    public void stream(Subscription subscription, StreamingTransport transport, boolean gzip,
            InitialEventSupplier initialEvent) {
        broker.subscribe(subscription);
        transport.onDisconnect(() -> broker.unsubscribe(subscription));
        try {
            EventSink sink = transport.sink();
            EventEncoder encoder = new EventEncoder(sink, gzip);
            sink.flush();
            if (initialEvent != null) {
                writeInitialEvent(encoder, initialEvent, subscription);
            }
            writeLoop(encoder, subscription.queue());
        } catch (IOException e) {
            logger.atDebug()
                    .setCause(e)
                    .addArgument(subscription)
                    .log("Client gone, ending stream for {}");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.atDebug().addArgument(subscription).log("Stream interrupted for {}");
        } finally {
            broker.unsubscribe(subscription);
            transport.complete();
        }
    }

    private void writeLoop(EventEncoder encoder, SubscriptionQueue queue) throws IOException, InterruptedException {
        Duration heartbeat = broker.config().heartbeatInterval();
        boolean heartbeats = !heartbeat.isZero();
        long pollMillis = heartbeats ? Math.max(1, heartbeat.toMillis()) : IDLE_POLL_MILLIS;
        while (true) {
            Event event = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
            if (event != null) {
                encoder.encode(event);
            } else if (queue.isClosed()) {
                return;
            } else if (heartbeats) {
                encoder.encode(HEARTBEAT);
            }
        }
    }

    private void writeInitialEvent(EventEncoder encoder, InitialEventSupplier initialEvent,
            Subscription subscription) throws IOException {
        Event event;
        try {
            event = initialEvent.get();
        } catch (Exception e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(subscription)
                    .log("Initial event failed for {}, continuing with live events");
            return;
        }
        if (event != null) {
            encoder.encode(event);
        }
    }
}
