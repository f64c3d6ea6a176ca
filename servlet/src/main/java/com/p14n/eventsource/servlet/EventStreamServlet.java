package com.p14n.eventsource.servlet;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventsource.broker.EventBroker;
import com.p14n.eventsource.broker.Subscription;
import com.p14n.eventsource.data.BrokerConfig;

import jakarta.servlet.AsyncContext;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Streams one channel to every client that issues a GET. The client's
 * {@code Last-Event-ID} header is used as the replay cursor.
 *
 * <p>
 * The servlet must be registered with async support enabled.
 * </p>
 */
public class EventStreamServlet extends HttpServlet {
    private static final Logger logger = LoggerFactory.getLogger(EventStreamServlet.class);

    private final transient EventBroker broker;
    private final transient EventStreamHandler handler;
    private final transient InitialEventSupplier initialEvent;
    private final String channel;

    public EventStreamServlet(EventBroker broker, String channel) {
        this(broker, channel, null);
    }

    /**
     * @param broker       the broker to subscribe to
     * @param channel      the channel served by this servlet
     * @param initialEvent written to each new client before live events, may be
     *                     null
     */
    public EventStreamServlet(EventBroker broker, String channel, InitialEventSupplier initialEvent) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.handler = new EventStreamHandler(broker);
        this.initialEvent = initialEvent;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        startStream(req, resp, broker, handler, channel, initialEvent);
    }

    /**
     * Sends the streaming headers and hands the connection to the handler on the
     * broker's executor, leaving the container thread free.
     *
     * @throws IllegalStateException if the request does not support async
     *                               processing
     */
    static void startStream(HttpServletRequest req, HttpServletResponse resp, EventBroker broker,
            EventStreamHandler handler, String channel, InitialEventSupplier initialEvent) throws IOException {
        if (!req.isAsyncSupported()) {
            throw new IllegalStateException(
                    "Event streams need async support; register the servlet with asyncSupported=true");
        }
        BrokerConfig config = broker.config();
        boolean gzip = config.gzip() && SseHeaders.acceptsGzip(req.getHeader(SseHeaders.ACCEPT_ENCODING));
        SseHeaders.apply(resp, config, gzip);
        resp.setStatus(HttpServletResponse.SC_OK);
        resp.flushBuffer();

        Subscription subscription = new Subscription(channel, req.getHeader(SseHeaders.LAST_EVENT_ID),
                config.bufferSize());
        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        ServletStreamingTransport transport = new ServletStreamingTransport(async, resp, gzip);
        try {
            broker.executor().submit(() -> {
                handler.stream(subscription, transport, gzip, initialEvent);
                return null;
            });
        } catch (RejectedExecutionException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(subscription)
                    .log("Broker executor rejected stream for {}");
            transport.complete();
        }
    }
}
