package com.p14n.eventsource.servlet;

import java.util.Locale;

import com.p14n.eventsource.data.BrokerConfig;

import jakarta.servlet.http.HttpServletResponse;

/**
 * Header names and values for {@code text/event-stream} responses.
 */
public final class SseHeaders {

    public static final String LAST_EVENT_ID = "Last-Event-ID";
    public static final String ACCEPT_ENCODING = "Accept-Encoding";
    public static final String CONTENT_TYPE = "text/event-stream; charset=utf-8";
    public static final String CACHE_CONTROL = "no-cache, no-store, must-revalidate";

    private SseHeaders() {
    }

    /**
     * @param acceptEncoding the request's {@code Accept-Encoding} header, may be
     *                       null
     * @return true if the client listed gzip
     */
    public static boolean acceptsGzip(String acceptEncoding) {
        return acceptEncoding != null && acceptEncoding.toLowerCase(Locale.ROOT).contains("gzip");
    }

    /**
     * Sets the streaming response headers, replacing any already present.
     *
     * @param response the response
     * @param config   broker configuration, for CORS
     * @param gzip     whether the body will be gzip-encoded
     */
    public static void apply(HttpServletResponse response, BrokerConfig config, boolean gzip) {
        response.setCharacterEncoding("UTF-8");
        response.setContentType(CONTENT_TYPE);
        response.setHeader("Cache-Control", CACHE_CONTROL);
        response.setHeader("Connection", "keep-alive");
        if (config.allowCors()) {
            response.setHeader("Access-Control-Allow-Origin", "*");
        }
        if (gzip) {
            response.setHeader("Content-Encoding", "gzip");
        }
    }
}
