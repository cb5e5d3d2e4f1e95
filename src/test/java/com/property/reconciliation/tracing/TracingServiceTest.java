package com.property.reconciliation.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("reconciliation.batch", Map.of("target", "bookings"))) {
                    span.setAttribute("rows", 12L);
                    span.addEvent("rows.processed");
                    span.markFailed(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("op1"), noOp.startSpan("op2"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer mockTracer;
        private SpanBuilder mockBuilder;
        private io.opentelemetry.api.trace.Span mockOtelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            mockTracer = mock(Tracer.class);
            mockBuilder = mock(SpanBuilder.class);
            mockOtelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(mockTracer.spanBuilder(anyString())).thenReturn(mockBuilder);
            when(mockBuilder.startSpan()).thenReturn(mockOtelSpan);
            service = new OpenTelemetryTracingService(mockTracer);
        }

        @Test
        @DisplayName("Should pass the name and start attributes to the builder")
        void createSpan() {
            service.startSpan("reconciliation.batch", Map.of("target", "bookings"));

            verify(mockTracer).spanBuilder("reconciliation.batch");
            verify(mockBuilder).setAttribute("target", "bookings");
            verify(mockBuilder).startSpan();
        }

        @Test
        @DisplayName("Should forward attributes and events")
        void attributesAndEvents() {
            Span span = service.startSpan("reconciliation.chunk");
            span.setAttribute("chunk", "1");
            span.setAttribute("rows", 10L);
            span.addEvent("rows.processed");

            verify(mockOtelSpan).setAttribute("chunk", "1");
            verify(mockOtelSpan).setAttribute("rows", 10L);
            verify(mockOtelSpan).addEvent("rows.processed");
        }

        @Test
        @DisplayName("Should end with OK status when nothing failed")
        void closeOk() {
            service.startSpan("reconciliation.batch").close();

            verify(mockOtelSpan).setStatus(StatusCode.OK);
            verify(mockOtelSpan).end();
        }

        @Test
        @DisplayName("Should keep the error status of a failed span")
        void closeFailed() {
            Span span = service.startSpan("reconciliation.batch");
            RuntimeException error = new RuntimeException("store down");

            span.markFailed(error);
            span.close();

            verify(mockOtelSpan).recordException(error);
            verify(mockOtelSpan).setStatus(StatusCode.ERROR, "store down");
            verify(mockOtelSpan, never()).setStatus(StatusCode.OK);
            verify(mockOtelSpan).end();
        }
    }
}
