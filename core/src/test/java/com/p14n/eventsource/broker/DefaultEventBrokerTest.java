package com.p14n.eventsource.broker;

import com.p14n.eventsource.data.BrokerConfig;
import com.p14n.eventsource.data.Event;
import com.p14n.eventsource.data.Publication;
import com.p14n.eventsource.replay.InMemoryRepository;
import com.p14n.eventsource.replay.Repository;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class DefaultEventBrokerTest {

    private static final String CHANNEL = "prices";

    private volatile DefaultEventBroker broker;

    @AfterEach
    void tearDown() {
        if (broker != null) {
            broker.shutdown();
            broker = null;
        }
    }

    private DefaultEventBroker start(BrokerConfig config) {
        broker = new DefaultEventBroker(config, OpenTelemetry.noop());
        return broker;
    }

    private static Event next(Subscription subscription) throws InterruptedException {
        return subscription.queue().poll(1, TimeUnit.SECONDS);
    }

    private static void awaitCount(EventBroker broker, String channel, int expected) throws InterruptedException {
        while (broker.subscriberCount(channel) != expected) {
            Thread.sleep(10);
        }
    }

    @Test
    void shouldDeliverToEverySubscriberOfChannel() throws InterruptedException {
        start(BrokerConfig.defaults());
        Subscription first = new Subscription(CHANNEL, "", 8);
        Subscription second = new Subscription(CHANNEL, "", 8);
        Subscription other = new Subscription("other", "", 8);
        broker.subscribe(first);
        broker.subscribe(second);
        broker.subscribe(other);

        Publication event = Publication.of("1", "tick", "10.5");
        broker.publish(CHANNEL, event);

        assertEquals(event, next(first));
        assertEquals(event, next(second));
        assertEquals(2, broker.subscriberCount(CHANNEL));
        assertEquals(0, other.queue().size());
    }

    @Test
    void shouldDeliverToEveryTargetChannel() throws InterruptedException {
        start(BrokerConfig.defaults());
        Subscription a = new Subscription("a", "", 8);
        Subscription b = new Subscription("b", "", 8);
        broker.subscribe(a);
        broker.subscribe(b);

        broker.publish(List.of("a", "b", "nobody"), Publication.of("x"));

        assertEquals(Publication.of("x"), next(a));
        assertEquals(Publication.of("x"), next(b));
    }

    @Test
    void shouldPreservePublishOrderPerSubscriber() throws InterruptedException {
        start(BrokerConfig.defaults());
        Subscription subscription = new Subscription(CHANNEL, "", 100);
        broker.subscribe(subscription);

        for (int i = 0; i < 50; i++) {
            broker.publish(CHANNEL, Publication.of(String.valueOf(i), "", "v"));
        }

        for (int i = 0; i < 50; i++) {
            assertEquals(String.valueOf(i), next(subscription).id());
        }
    }

    @Test
    void shouldEvictSubscriberWhoseQueueIsFull() throws InterruptedException {
        start(BrokerConfig.defaults());
        Subscription slow = new Subscription(CHANNEL, "", 1);
        Subscription fast = new Subscription(CHANNEL, "", 8);
        broker.subscribe(slow);
        broker.subscribe(fast);

        broker.publish(CHANNEL, Publication.of("1"));
        broker.publish(CHANNEL, Publication.of("2"));
        broker.publish(CHANNEL, Publication.of("3"));

        assertTrue(slow.queue().isClosed());
        assertNull(next(slow));
        assertEquals(1, broker.subscriberCount(CHANNEL));
        assertEquals(Publication.of("1"), next(fast));
        assertEquals(Publication.of("2"), next(fast));
        assertEquals(Publication.of("3"), next(fast));
    }

    @Test
    void shouldEvictManySubscribersInOnePublish() {
        start(BrokerConfig.defaults());
        List<Subscription> subscriptions = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Subscription subscription = new Subscription(CHANNEL, "", 1);
            subscriptions.add(subscription);
            broker.subscribe(subscription);
        }
        broker.publish(CHANNEL, Publication.of("fills every queue"));

        broker.publish(CHANNEL, Publication.of("overflows every queue"));
        broker.publish(CHANNEL, Publication.of("after eviction"));

        assertEquals(0, broker.subscriberCount(CHANNEL));
        subscriptions.forEach(s -> assertTrue(s.queue().isClosed()));
    }

    @Test
    void shouldRemoveSubscriptionIdempotently() {
        start(BrokerConfig.defaults());
        Subscription subscription = new Subscription(CHANNEL, "", 8);
        broker.subscribe(subscription);

        broker.unsubscribe(subscription);
        broker.unsubscribe(subscription);
        broker.unsubscribe(new Subscription(CHANNEL, "", 8));

        assertEquals(0, broker.subscriberCount(CHANNEL));
        assertTrue(subscription.queue().isClosed());
    }

    @Test
    void shouldReplayEventsAfterCursor() throws InterruptedException {
        start(BrokerConfig.defaults());
        InMemoryRepository history = new InMemoryRepository(10);
        history.add(CHANNEL, Publication.of("1", "", "a"));
        history.add(CHANNEL, Publication.of("2", "", "b"));
        history.add(CHANNEL, Publication.of("3", "", "c"));
        broker.registerRepository(CHANNEL, history);

        Subscription subscription = new Subscription(CHANNEL, "1", 8);
        broker.subscribe(subscription);

        assertEquals("2", next(subscription).id());
        assertEquals("3", next(subscription).id());
    }

    @Test
    void shouldNotReplayWithoutCursorUnlessReplayAll() {
        start(BrokerConfig.defaults());
        Repository repository = mock(Repository.class);
        broker.registerRepository(CHANNEL, repository);

        broker.subscribe(new Subscription(CHANNEL, "", 8));
        broker.subscriberCount(CHANNEL);

        verify(repository, never()).replay(anyString(), anyString());
    }

    @Test
    void shouldReplayFromDefaultRepositoryWhenReplayAll() {
        start(BrokerConfig.defaults().withReplayAll(true));
        Repository fallback = mock(Repository.class);
        when(fallback.replay(anyString(), anyString())).thenReturn(Stream.empty());
        broker.registerDefaultRepository(fallback);

        broker.subscribe(new Subscription(CHANNEL, "", 8));

        verify(fallback, timeout(1000)).replay(CHANNEL, "");
    }

    @Test
    void shouldPreferChannelRepositoryOverDefault() throws InterruptedException {
        start(BrokerConfig.defaults());
        Repository fallback = mock(Repository.class);
        Repository bound = mock(Repository.class);
        when(bound.replay(CHANNEL, "5")).thenReturn(Stream.of(Publication.of("6", "", "x")));
        broker.registerDefaultRepository(fallback);
        broker.registerRepository(CHANNEL, bound);

        Subscription subscription = new Subscription(CHANNEL, "5", 8);
        broker.subscribe(subscription);

        assertEquals("6", next(subscription).id());
        verify(fallback, never()).replay(anyString(), anyString());
    }

    @Test
    void shouldIgnoreNullRepositoryRegistration() throws InterruptedException {
        start(BrokerConfig.defaults());
        Repository bound = mock(Repository.class);
        when(bound.replay(CHANNEL, "1")).thenReturn(Stream.of(Publication.of("2", "", "x")));
        broker.registerRepository(CHANNEL, bound);
        broker.registerRepository(CHANNEL, null);

        Subscription subscription = new Subscription(CHANNEL, "1", 8);
        broker.subscribe(subscription);

        assertEquals("2", next(subscription).id());
    }

    @Test
    void shouldSkipReplayWhenNoRepositoryIsBound() {
        start(BrokerConfig.defaults().withReplayAll(true));
        Subscription subscription = new Subscription(CHANNEL, "3", 8);

        broker.subscribe(subscription);

        assertEquals(1, broker.subscriberCount(CHANNEL));
        assertEquals(0, subscription.queue().size());
    }

    @Test
    void shouldEvictSubscriberWhenReplayOverflows() throws InterruptedException {
        start(BrokerConfig.defaults());
        InMemoryRepository history = new InMemoryRepository(10);
        for (int i = 1; i <= 5; i++) {
            history.add(CHANNEL, Publication.of(String.valueOf(i), "", "v"));
        }
        broker.registerRepository(CHANNEL, history);

        Subscription subscription = new Subscription(CHANNEL, "1", 2);
        broker.subscribe(subscription);

        awaitCount(broker, CHANNEL, 0);
        assertTrue(subscription.queue().isClosed());
    }

    @Test
    void shouldCloseEveryQueueOnShutdown() {
        start(BrokerConfig.defaults());
        Subscription a = new Subscription("a", "", 8);
        Subscription b = new Subscription("b", "", 8);
        broker.subscribe(a);
        broker.subscribe(b);

        broker.shutdown();

        assertTrue(a.queue().isClosed());
        assertTrue(b.queue().isClosed());
        assertFalse(broker.isRunning());
    }

    @Test
    void shouldIgnoreCommandsAfterShutdown() {
        start(BrokerConfig.defaults());
        broker.shutdown();
        broker.shutdown();

        Subscription late = new Subscription(CHANNEL, "", 8);
        broker.subscribe(late);
        broker.publish(CHANNEL, Publication.of("x"));
        broker.registerRepository(CHANNEL, new InMemoryRepository(1));
        broker.unsubscribe(late);

        assertTrue(late.queue().isClosed());
        assertEquals(0, broker.subscriberCount(CHANNEL));
    }

    @Test
    void shouldLeaveCallerExecutorRunning() throws Exception {
        DefaultExecutor executor = new DefaultExecutor(2);
        try {
            broker = new DefaultEventBroker(BrokerConfig.defaults(), executor, OpenTelemetry.noop());
            broker.shutdown();

            Future<String> result = executor.submit(() -> "still running");
            assertEquals("still running", result.get(1, TimeUnit.SECONDS));
        } finally {
            executor.close();
        }
    }
}
