package com.platform.driftdetector.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenTelemetry tracing for drift runs. Off unless {@code otel.traces.enabled} is set, in which
 * case one {@code drift.run} span per run is exported over OTLP/gRPC.
 */
@Slf4j
@Configuration
public class TracingConfig {
    
    static final String INSTRUMENTATION_NAME = "com.platform.driftdetector";
    
    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");
    
    @Value("${spring.application.name:iac-drift-detector}")
    private String serviceName;
    
    @Value("${drift.environment:development}")
    private String environment;
    
    @Value("${otel.exporter.otlp.endpoint:http://localhost:4317}")
    private String otlpEndpoint;
    
    @Value("${otel.traces.enabled:false}")
    private boolean tracingEnabled;
    
    @Value("${otel.traces.sampler-ratio:1.0}")
    private double samplerRatio;
    
    @Bean
    public OpenTelemetry openTelemetry() {
        if (!tracingEnabled) {
            log.info("Drift run tracing is disabled");
            return OpenTelemetry.noop();
        }
        
        Resource resource = Resource.getDefault()
            .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName, DEPLOYMENT_ENVIRONMENT, environment)));
        
        OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(otlpEndpoint)
            .build();
        
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
            .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(samplerRatio)))
            .setResource(resource)
            .build();
        
        Runtime.getRuntime().addShutdownHook(new Thread(tracerProvider::close));
        
        log.info("Drift run tracing exports to {} (sampling ratio {})", otlpEndpoint, samplerRatio);
        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.noop())
            .build();
    }
    
    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME, "1.0.0");
    }
}
