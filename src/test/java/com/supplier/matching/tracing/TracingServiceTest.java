package com.supplier.matching.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

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
                try (Span span = noOp.startPhase("run-1", "score")) {
                    span.setAttribute("key", "value");
                    span.setAttribute("pairs", 42L);
                    span.setAttribute("ratio", 0.5);
                    span.fail(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("op1"), noOp.startSpan("op2", Map.of("k", "v")));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    @ExtendWith(MockitoExtension.class)
    class OTelTests {

        @Mock
        private Tracer tracer;
        @Mock
        private SpanBuilder builder;
        @Mock
        private io.opentelemetry.api.trace.Span otelSpan;

        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            lenient().when(builder.setAttribute(anyString(), anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Phase spans are named after the phase and carry the run id")
        void phaseSpan() {
            Span span = service.startPhase("run-1", "cluster");

            assertNotNull(span);
            verify(tracer).spanBuilder("matching.cluster");
            verify(builder).setAttribute("runId", "run-1");
        }

        @Test
        @DisplayName("Should set attributes on span")
        void setAttributes() {
            Span span = service.startSpan("matching.run");
            span.setAttribute("mode", "TEXT");
            span.setAttribute("groups", 3L);
            span.setAttribute("confidence", 0.75);

            verify(otelSpan).setAttribute("mode", "TEXT");
            verify(otelSpan).setAttribute("groups", 3L);
            verify(otelSpan).setAttribute("confidence", 0.75);
        }

        @Test
        @DisplayName("fail() records the exception and sets ERROR status")
        void fail() {
            Span span = service.startSpan("matching.run");
            RuntimeException ex = new RuntimeException("boom");

            span.fail(ex);

            verify(otelSpan).recordException(ex);
            verify(otelSpan).setStatus(StatusCode.ERROR);
        }

        @Test
        @DisplayName("Should set OK status and end span on close")
        void okAndClose() {
            Span span = service.startSpan("matching.run");
            span.setStatus(Span.SpanStatus.OK);
            span.close();

            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }
    }
}
