package com.property.reconciliation.tracing;

import java.util.Map;

/**
 * Entry point for tracing integration. {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
