package com.p14n.eventsource.data;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration shared by the broker and the streaming handlers.
 *
 * <p>
 * Properties understood by {@link #fromProperties(Properties)}:
 * </p>
 * <ul>
 * <li>{@code eventsource.allowCors} (default false)</li>
 * <li>{@code eventsource.replayAll} (default false)</li>
 * <li>{@code eventsource.bufferSize} (default 128)</li>
 * <li>{@code eventsource.gzip} (default false)</li>
 * <li>{@code eventsource.heartbeatMillis} (default 0, disabled)</li>
 * </ul>
 *
 * @param allowCors         add {@code Access-Control-Allow-Origin: *} to
 *                          stream responses
 * @param replayAll         replay history even when the client sent no
 *                          {@code Last-Event-ID}
 * @param bufferSize        per-subscription queue capacity; a subscriber that
 *                          falls this far behind is disconnected
 * @param gzip              compress streams for clients that accept gzip
 * @param heartbeatInterval idle time after which a comment line is written;
 *                          zero disables heartbeats
 */
public record BrokerConfig(boolean allowCors,
        boolean replayAll,
        int bufferSize,
        boolean gzip,
        Duration heartbeatInterval) {

    public static final int DEFAULT_BUFFER_SIZE = 128;

    private static final String PREFIX = "eventsource.";

    public BrokerConfig {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be at least 1, was " + bufferSize);
        }
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        if (heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval cannot be negative");
        }
    }

    /**
     * @return configuration with every option off and a buffer of
     *         {@value #DEFAULT_BUFFER_SIZE}
     */
    public static BrokerConfig defaults() {
        return new BrokerConfig(false, false, DEFAULT_BUFFER_SIZE, false, Duration.ZERO);
    }

    /**
     * Reads configuration from {@code eventsource.*} properties, falling back to
     * {@link #defaults()} for anything missing.
     *
     * @param props the properties to read
     * @return the resulting configuration
     * @throws IllegalArgumentException if a numeric property cannot be parsed
     */
    public static BrokerConfig fromProperties(Properties props) {
        BrokerConfig d = defaults();
        return new BrokerConfig(
                bool(props, "allowCors", d.allowCors()),
                bool(props, "replayAll", d.replayAll()),
                integer(props, "bufferSize", d.bufferSize()),
                bool(props, "gzip", d.gzip()),
                Duration.ofMillis(integer(props, "heartbeatMillis", (int) d.heartbeatInterval().toMillis())));
    }

    public BrokerConfig withAllowCors(boolean allowCors) {
        return new BrokerConfig(allowCors, replayAll, bufferSize, gzip, heartbeatInterval);
    }

    public BrokerConfig withReplayAll(boolean replayAll) {
        return new BrokerConfig(allowCors, replayAll, bufferSize, gzip, heartbeatInterval);
    }

    public BrokerConfig withBufferSize(int bufferSize) {
        return new BrokerConfig(allowCors, replayAll, bufferSize, gzip, heartbeatInterval);
    }

    public BrokerConfig withGzip(boolean gzip) {
        return new BrokerConfig(allowCors, replayAll, bufferSize, gzip, heartbeatInterval);
    }

    public BrokerConfig withHeartbeatInterval(Duration heartbeatInterval) {
        return new BrokerConfig(allowCors, replayAll, bufferSize, gzip, heartbeatInterval);
    }

    private static boolean bool(Properties props, String key, boolean fallback) {
        String value = props.getProperty(PREFIX + key);
        return value == null ? fallback : Boolean.parseBoolean(value.trim());
    }

    private static int integer(Properties props, String key, int fallback) {
        String value = props.getProperty(PREFIX + key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }
}
