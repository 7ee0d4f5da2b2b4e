package com.platform.releasecontroller.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenTelemetry tracing for reconcile spans. Exports over OTLP/gRPC when enabled,
 * otherwise every span is a no-op.
 */
@Slf4j
@Configuration
public class TracingConfig {
    
    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    
    @Value("${spring.application.name:release-controller}")
    private String serviceName;
    
    @Value("${otel.exporter.otlp.endpoint:http://localhost:4317}")
    private String otlpEndpoint;
    
    @Value("${otel.traces.enabled:false}")
    private boolean tracingEnabled;
    
    private SdkTracerProvider tracerProvider;
    
    @Bean
    public OpenTelemetry openTelemetry() {
        if (!tracingEnabled) {
            log.info("OpenTelemetry tracing is disabled");
            return OpenTelemetry.noop();
        }
        
        Resource resource = Resource.getDefault()
            .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));
        
        OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(otlpEndpoint)
            .build();
        
        tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
            .setResource(resource)
            .build();
        
        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
        
        log.info("OpenTelemetry tracing exporting to {}", otlpEndpoint);
        return openTelemetry;
    }
    
    /**
     * Flush pending reconcile spans before the context goes away.
     */
    @PreDestroy
    public void closeTracerProvider() {
        if (tracerProvider != null) {
            tracerProvider.close();
            log.info("OpenTelemetry tracer provider closed");
        }
    }
    
    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(serviceName, "1.0.0");
    }
}
