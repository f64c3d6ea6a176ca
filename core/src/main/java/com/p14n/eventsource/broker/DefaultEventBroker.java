package com.p14n.eventsource.broker;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventsource.data.BrokerConfig;
import com.p14n.eventsource.data.Event;
import com.p14n.eventsource.replay.ReplayTask;
import com.p14n.eventsource.replay.Repository;
import com.p14n.eventsource.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.eventsource.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Broker whose state is owned by a single coordinator task.
 *
 * <p>
 * Subscriber sets and repository bindings are only ever touched by the
 * coordinator, which takes commands one at a time from a
 * {@link SynchronousQueue}. Callers therefore block until the coordinator has
 * accepted their command, and no locks are needed on broker state.
 * </p>
 *
 * <p>
 * Publishing never blocks on a subscriber. A subscriber whose queue is full is
 * evicted: its queue is closed at once and it is put on a deferred list that
 * the coordinator drains before taking its next command. The coordinator never
 * hands a command to itself.
 * </p>
 *
 * <p>
 * Replays run on the {@link AsyncExecutor} and write into the same queue as
 * live events. No ordering between the two is guaranteed beyond the replay
 * being started when the subscription is registered.
 * </p>
 *
 * <pre>{@code
 * var broker = new DefaultEventBroker(BrokerConfig.defaults(), OpenTelemetry.noop());
 * broker.registerRepository("prices", history);
 * broker.publish(List.of("prices"), Publication.of("1", "tick", "10.5"));
 * broker.shutdown();
 * }</pre>
 */
public final class DefaultEventBroker implements EventBroker {
    private static final Logger logger = LoggerFactory.getLogger(DefaultEventBroker.class);
    private static final String SCOPE_NAME = "eventsource_broker";
    private static final long HANDOFF_POLL_MILLIS = 50;

    private final SynchronousQueue<BrokerCommand> inbox = new SynchronousQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final BrokerConfig config;
    private final AsyncExecutor asyncExecutor;
    private final boolean ownsExecutor;
    private final BrokerMetrics metrics;
    private final Tracer tracer;

    // Coordinator-owned state
    private final Map<String, Set<Subscription>> subscribers = new HashMap<>();
    private final Map<String, Repository> repositories = new HashMap<>();
    private final Deque<Subscription> evicted = new ArrayDeque<>();
    private Repository defaultRepository;

    /**
     * Creates and starts a broker with its own executor, released on
     * {@link #shutdown()}.
     *
     * @param config the broker configuration
     * @param ot     the OpenTelemetry instance for metrics and tracing
     */
    public DefaultEventBroker(BrokerConfig config, OpenTelemetry ot) {
        this(config, new DefaultExecutor(), true, ot);
    }

    /**
     * Creates and starts a broker on a caller-managed executor. The coordinator
     * holds one of the executor's threads until shutdown, and each streaming
     * connection holds another while it is open.
     *
     * @param config        the broker configuration
     * @param asyncExecutor executor for the coordinator and replay tasks
     * @param ot            the OpenTelemetry instance for metrics and tracing
     */
    public DefaultEventBroker(BrokerConfig config, AsyncExecutor asyncExecutor, OpenTelemetry ot) {
        this(config, asyncExecutor, false, ot);
    }

    private DefaultEventBroker(BrokerConfig config, AsyncExecutor asyncExecutor, boolean ownsExecutor,
            OpenTelemetry ot) {
        this.config = Objects.requireNonNull(config, "config");
        this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor");
        this.ownsExecutor = ownsExecutor;
        this.metrics = new BrokerMetrics(ot.getMeter(SCOPE_NAME));
        this.tracer = ot.getTracer(SCOPE_NAME);
        asyncExecutor.submit(this::run);
    }

    @Override
    public BrokerConfig config() {
        return config;
    }

    @Override
    public AsyncExecutor executor() {
        return asyncExecutor;
    }

    @Override
    public void publish(Collection<String> channels, Event event) {
        Objects.requireNonNull(event, "event");
        submit(new BrokerCommand.Publish(List.copyOf(channels), event));
    }

    @Override
    public void registerRepository(String channel, Repository repository) {
        Objects.requireNonNull(channel, "channel");
        submit(new BrokerCommand.RegisterRepository(channel, repository));
    }

    @Override
    public void registerDefaultRepository(Repository repository) {
        submit(new BrokerCommand.RegisterDefaultRepository(repository));
    }

    @Override
    public void subscribe(Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        if (!submit(new BrokerCommand.Subscribe(subscription))) {
            subscription.queue().close();
        }
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        if (!submit(new BrokerCommand.Unsubscribe(subscription))) {
            subscription.queue().close();
        }
    }

    @Override
    public int subscriberCount(String channel) {
        Objects.requireNonNull(channel, "channel");
        CompletableFuture<Integer> result = new CompletableFuture<>();
        if (!submit(new BrokerCommand.CountSubscribers(channel, result))) {
            return 0;
        }
        return result.join();
    }

    @Override
    public void shutdown() {
        if (submit(new BrokerCommand.Shutdown())) {
            logger.atInfo().log("Event broker shutting down");
        }
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (ownsExecutor) {
            asyncExecutor.shutdownNow();
        }
    }

    /**
     * @return false once the coordinator has stopped
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Hands a command to the coordinator, waiting until it is taken.
     *
     * @return false if the broker stopped before accepting the command
     */
    private boolean submit(BrokerCommand command) {
        try {
            while (running.get()) {
                if (inbox.offer(command, HANDOFF_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.atDebug()
                .addArgument(command.getClass().getSimpleName())
                .log("Event broker is not running, dropping {} command");
        return false;
    }

    private Void run() {
        logger.atInfo().log("Event broker started");
        try {
            while (true) {
                removeEvicted();
                BrokerCommand command = inbox.take();
                if (command instanceof BrokerCommand.Shutdown) {
                    break;
                }
                handle(command);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.atWarn().log("Event broker interrupted");
        } finally {
            running.set(false);
            closeAll();
            stopped.countDown();
            logger.atInfo().log("Event broker stopped");
        }
        return null;
    }

    private void handle(BrokerCommand command) {
        try {
            if (command instanceof BrokerCommand.Publish publish) {
                publish(publish.channels(), publish.event());
            } else if (command instanceof BrokerCommand.Subscribe subscribe) {
                add(subscribe.subscription());
            } else if (command instanceof BrokerCommand.Unsubscribe unsubscribe) {
                remove(unsubscribe.subscription());
                unsubscribe.subscription().queue().close();
            } else if (command instanceof BrokerCommand.RegisterRepository registration) {
                if (registration.repository() != null) {
                    repositories.put(registration.channel(), registration.repository());
                }
            } else if (command instanceof BrokerCommand.RegisterDefaultRepository registration) {
                defaultRepository = registration.repository();
            } else if (command instanceof BrokerCommand.CountSubscribers count) {
                Set<Subscription> subs = subscribers.get(count.channel());
                count.result().complete(subs == null ? 0 : subs.size());
            }
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .addArgument(command.getClass().getSimpleName())
                    .log("Failed to process {} command");
        }
    }

    private void publish(List<String> channels, Event event) {
        processWithTelemetry(tracer, "publish_event", String.join(",", channels), () -> {
            for (String channel : channels) {
                metrics.recordPublished(channel);
                Set<Subscription> subs = subscribers.get(channel);
                if (subs == null) {
                    continue;
                }
                for (Subscription subscription : subs) {
                    if (subscription.queue().offer(event)) {
                        metrics.recordDelivered(channel);
                    } else {
                        evict(subscription);
                    }
                }
            }
            return null;
        });
    }

    private void evict(Subscription subscription) {
        if (subscription.queue().close()) {
            metrics.recordEvicted(subscription.channel());
            logger.atDebug().addArgument(subscription).log("Queue full, evicting {}");
        }
        evicted.addLast(subscription);
    }

    private void removeEvicted() {
        Subscription subscription;
        while ((subscription = evicted.pollFirst()) != null) {
            remove(subscription);
        }
    }

    private void add(Subscription subscription) {
        String channel = subscription.channel();
        if (subscribers.computeIfAbsent(channel, k -> new LinkedHashSet<>()).add(subscription)) {
            metrics.recordSubscriberAdded(channel);
        }
        if (!subscription.wantsReplay(config.replayAll())) {
            return;
        }
        Repository repository = repositories.getOrDefault(channel, defaultRepository);
        if (repository == null) {
            return;
        }
        try {
            asyncExecutor.submit(new ReplayTask(repository, subscription, this::unsubscribe, metrics, tracer));
        } catch (RejectedExecutionException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(subscription)
                    .log("Could not start replay for {}");
        }
    }

    private void remove(Subscription subscription) {
        String channel = subscription.channel();
        Set<Subscription> subs = subscribers.get(channel);
        if (subs != null && subs.remove(subscription)) {
            metrics.recordSubscriberRemoved(channel);
            if (subs.isEmpty()) {
                subscribers.remove(channel);
            }
        }
    }

    private void closeAll() {
        for (Map.Entry<String, Set<Subscription>> entry : subscribers.entrySet()) {
            for (Subscription subscription : entry.getValue()) {
                subscription.queue().close();
                metrics.recordSubscriberRemoved(entry.getKey());
            }
        }
        subscribers.clear();
        evicted.clear();
    }
}
