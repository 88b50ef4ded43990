package com.civics.ingest.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}. Ingest spans are internal spans;
 * the HTTP calls a connector makes are left to whatever instruments the client.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public Span start(String name, Map<String, ?> attributes) {
        SpanBuilder builder = tracer.spanBuilder(name);
        builder.setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (value instanceof Number number) {
                    builder.setAttribute(key, number.longValue());
                } else if (value != null) {
                    builder.setAttribute(key, value.toString());
                }
            });
        }
        return new IngestSpan(builder.startSpan());
    }

    private static final class IngestSpan implements Span {

        private final io.opentelemetry.api.trace.Span span;

        IngestSpan(io.opentelemetry.api.trace.Span span) {
            this.span = span;
        }

        @Override
        public Span tag(String key, Object value) {
            if (value instanceof Number number) {
                span.setAttribute(key, number.longValue());
            } else if (value != null) {
                span.setAttribute(key, value.toString());
            }
            return this;
        }

        @Override
        public void succeeded() {
            span.setStatus(StatusCode.OK);
        }

        @Override
        public void failed(String description) {
            span.setStatus(StatusCode.ERROR, description);
        }

        @Override
        public void failed(Throwable error) {
            span.recordException(error);
            span.setStatus(StatusCode.ERROR, Objects.toString(error.getMessage(), error.getClass().getSimpleName()));
        }

        @Override
        public void close() {
            span.end();
        }
    }
}
