package com.p14n.eventsource.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Span helpers for broker work.
 */
public class OpenTelemetryFunctions {

        /** Private constructor to prevent instantiation of utility class */
        private OpenTelemetryFunctions() {
        }

        /**
         * Executes an action within a new span tagged with the channel.
         *
         * @param <T>      Return type of the action
         * @param tracer   Tracer to create spans
         * @param spanName Name of the span to create
         * @param channel  Channel attribute for the span
         * @param action   Action to execute within the span
         * @return Result of the action execution
         * @throws RuntimeException if the action throws an exception
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String channel,
                        Supplier<T> action) {
                Span span = tracer.spanBuilder(spanName)
                                .setAttribute("channel", channel)
                                .startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (Exception e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
