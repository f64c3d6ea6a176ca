package com.p14n.eventsource.servlet;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventsource.broker.EventBroker;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Reverse proxy that lets a backend turn a request into an event stream.
 *
 * <p>
 * Each request is forwarded to the target. If the backend's response carries a
 * {@value #GRIP_CHANNEL} header the client is held open and streamed events
 * from that channel; the backend's body is discarded. Any other response is
 * relayed unchanged, copied to the client as it arrives. When the backend
 * cannot be reached the client receives 502.
 * </p>
 */
public class HoldingProxyServlet extends HttpServlet {
    private static final Logger logger = LoggerFactory.getLogger(HoldingProxyServlet.class);

    public static final String GRIP_CHANNEL = "Grip-Channel";

    // Includes the headers java.net.http refuses to set
    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization", "proxy-connection",
            "te", "trailer", "transfer-encoding", "upgrade", "host", "content-length", "expect");

    private static final Set<String> HELD_RESPONSE_SKIPPED = Set.of(
            "content-length", "content-type", "content-encoding");

    private static final int COPY_BUFFER_SIZE = 8192;

    private final URI target;
    private final transient EventBroker broker;
    private final transient EventStreamHandler handler;
    private final transient HttpClient http;

    public HoldingProxyServlet(URI target, EventBroker broker) {
        this(target, broker, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    /**
     * @param target base URI of the backend; the request path and query are
     *               appended
     * @param broker the broker held connections subscribe to
     * @param http   client used for upstream requests
     */
    public HoldingProxyServlet(URI target, EventBroker broker, HttpClient http) {
        this.target = Objects.requireNonNull(target, "target");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.http = Objects.requireNonNull(http, "http");
        this.handler = new EventStreamHandler(broker);
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        HttpResponse<InputStream> upstream;
        try {
            upstream = http.send(buildRequest(req), HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(target)
                    .log("Upstream request to {} failed");
            resp.sendError(HttpServletResponse.SC_BAD_GATEWAY);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            resp.sendError(HttpServletResponse.SC_BAD_GATEWAY);
            return;
        }

        Optional<String> channel = upstream.headers().firstValue(GRIP_CHANNEL);
        if (channel.isEmpty()) {
            passThrough(upstream, resp);
            return;
        }
        logger.atDebug()
                .addArgument(req.getRequestURI())
                .addArgument(channel.get())
                .log("Holding {} on channel {}");
        upstream.body().close();
        copyHeaders(upstream.headers(), resp, true);
        EventStreamServlet.startStream(req, resp, broker, handler, channel.get(), null);
    }

    private HttpRequest buildRequest(HttpServletRequest req) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(upstreamUri(req))
                .method(req.getMethod(), bodyPublisher(req));

        Enumeration<String> names = req.getHeaderNames();
        if (names != null) {
            for (String name : Collections.list(names)) {
                if (HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                for (String value : Collections.list(req.getHeaders(name))) {
                    builder.header(name, value);
                }
            }
        }
        return builder.build();
    }

    /**
     * Streams the client's body upstream as it is read, with a known length
     * when the client declared one.
     */
    private static HttpRequest.BodyPublisher bodyPublisher(HttpServletRequest req) throws IOException {
        long length = req.getContentLengthLong();
        boolean chunked = length < 0 && req.getHeader("Transfer-Encoding") != null;
        if (length == 0 || (length < 0 && !chunked)) {
            return HttpRequest.BodyPublishers.noBody();
        }
        InputStream in = req.getInputStream();
        HttpRequest.BodyPublisher stream = HttpRequest.BodyPublishers.ofInputStream(() -> in);
        return chunked ? stream : HttpRequest.BodyPublishers.fromPublisher(stream, length);
    }

    URI upstreamUri(HttpServletRequest req) {
        String base = target.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String path = req.getRequestURI() == null ? "" : req.getRequestURI();
        String query = req.getQueryString() == null ? "" : "?" + req.getQueryString();
        return URI.create(base + path + query);
    }

    private static void passThrough(HttpResponse<InputStream> upstream, HttpServletResponse resp)
            throws IOException {
        resp.setStatus(upstream.statusCode());
        copyHeaders(upstream.headers(), resp, false);
        OutputStream out = resp.getOutputStream();
        try (InputStream body = upstream.body()) {
            byte[] buffer = new byte[COPY_BUFFER_SIZE];
            int read;
            while ((read = body.read(buffer)) >= 0) {
                out.write(buffer, 0, read);
                out.flush();
            }
        }
        resp.flushBuffer();
    }

    private static void copyHeaders(HttpHeaders headers, HttpServletResponse resp, boolean held) {
        for (Map.Entry<String, List<String>> entry : headers.map().entrySet()) {
            String name = entry.getKey();
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith(":") || HOP_BY_HOP.contains(lower)) {
                continue;
            }
            if (held && (lower.startsWith("grip-") || HELD_RESPONSE_SKIPPED.contains(lower))) {
                continue;
            }
            for (String value : entry.getValue()) {
                resp.addHeader(name, value);
            }
        }
    }
}
