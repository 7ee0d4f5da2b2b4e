package com.platform.releasecontroller.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

final class TracingConfigTest {

    @Test
    void disabledTracingIsNoop() {
        TracingConfig config = configure(false);

        OpenTelemetry openTelemetry = config.openTelemetry();

        Assertions.assertFalse(openTelemetry instanceof OpenTelemetrySdk);
        Assertions.assertFalse(config.tracer(openTelemetry).spanBuilder("release.reconcile")
            .startSpan().getSpanContext().isValid());
        Assertions.assertDoesNotThrow(config::closeTracerProvider);
    }

    @Test
    void enabledTracingRecordsSpansAndClosesProvider() {
        TracingConfig config = configure(true);

        OpenTelemetry openTelemetry = config.openTelemetry();

        Assertions.assertTrue(openTelemetry instanceof OpenTelemetrySdk);
        Assertions.assertTrue(config.tracer(openTelemetry).spanBuilder("release.reconcile")
            .startSpan().getSpanContext().isValid());
        config.closeTracerProvider();
        Assertions.assertFalse(config.tracer(openTelemetry).spanBuilder("release.reconcile")
            .startSpan().isRecording());
    }

    private static TracingConfig configure(boolean enabled) {
        TracingConfig config = new TracingConfig();
        ReflectionTestUtils.setField(config, "serviceName", "release-controller");
        ReflectionTestUtils.setField(config, "otlpEndpoint", "http://localhost:4317");
        ReflectionTestUtils.setField(config, "tracingEnabled", enabled);
        return config;
    }
}
