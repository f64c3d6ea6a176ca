package com.p14n.eventsource.broker;

import com.p14n.eventsource.data.Publication;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class SubscriptionQueueTest {

    @Test
    void shouldRejectOfferWhenFull() {
        SubscriptionQueue queue = new SubscriptionQueue(2);

        assertTrue(queue.offer(Publication.of("a")));
        assertTrue(queue.offer(Publication.of("b")));
        assertFalse(queue.offer(Publication.of("c")));
        assertEquals(2, queue.size());
    }

    @Test
    void shouldReturnEventsInOrder() throws InterruptedException {
        SubscriptionQueue queue = new SubscriptionQueue(4);
        queue.offer(Publication.of("a"));
        queue.offer(Publication.of("b"));

        assertEquals(Publication.of("a"), queue.poll(10, TimeUnit.MILLISECONDS));
        assertEquals(Publication.of("b"), queue.poll(10, TimeUnit.MILLISECONDS));
        assertNull(queue.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldDropBufferedEventsAndRejectOffersOnceClosed() throws InterruptedException {
        SubscriptionQueue queue = new SubscriptionQueue(4);
        queue.offer(Publication.of("a"));

        assertTrue(queue.close());
        assertFalse(queue.close());
        assertTrue(queue.isClosed());
        assertFalse(queue.offer(Publication.of("b")));
        assertNull(queue.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldWakeWaitingReaderOnClose() throws InterruptedException {
        SubscriptionQueue queue = new SubscriptionQueue(1);
        CountDownLatch waiting = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<Object> result = new AtomicReference<>("unset");

        Thread reader = new Thread(() -> {
            try {
                waiting.countDown();
                result.set(queue.poll(1, TimeUnit.MINUTES));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        reader.start();
        assertTrue(waiting.await(1, TimeUnit.SECONDS));
        Thread.sleep(50);

        queue.close();

        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertNull(result.get());
    }

    @Test
    void shouldRejectCapacityBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> new SubscriptionQueue(0));
    }
}
