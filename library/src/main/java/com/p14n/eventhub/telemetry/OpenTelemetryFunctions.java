package com.p14n.eventhub.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String eventType,
                                                 String subscriberId, Supplier<T> action) {

                SpanBuilder sb = tracer.spanBuilder(spanName)
                        .setAttribute("event_type", eventType);
                if (subscriberId != null) {
                        sb.setAttribute("subscriber.id", subscriberId);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String eventType,
                                                 Supplier<T> action) {
                return processWithTelemetry(tracer, spanName, eventType, null, action);
        }
}
