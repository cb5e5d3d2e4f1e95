package com.property.reconciliation.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * OpenTelemetry-backed {@link TracingService}. Spans end with status OK unless
 * {@link Span#markFailed(Throwable)} was called.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpan(builder.startSpan());
    }

    private static final class OTelSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;
        private boolean failed;

        OTelSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void addEvent(String name) {
            delegate.addEvent(name);
        }

        @Override
        public void markFailed(Throwable cause) {
            failed = true;
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, cause.getMessage() != null ? cause.getMessage() : "");
        }

        @Override
        public void close() {
            if (!failed) {
                delegate.setStatus(StatusCode.OK);
            }
            delegate.end();
        }
    }
}
