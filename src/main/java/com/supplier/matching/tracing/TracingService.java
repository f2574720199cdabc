package com.supplier.matching.tracing;

import java.util.Map;

/**
 * Interface for distributed tracing integration.
 * The default {@link NoOpTracingService} does nothing, ensuring the library works
 * without any tracing dependencies on the classpath.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts the span of one phase of a run, named {@code matching.<phase>}.
     */
    default Span startPhase(String runId, String phase) {
        return startSpan("matching." + phase, Map.of("runId", runId));
    }
}
