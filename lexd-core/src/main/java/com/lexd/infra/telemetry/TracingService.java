package com.lexd.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Supplies the OpenTelemetry tracer used by compilations.
 *
 * <p>Compilation is a short batch job, so spans are exported synchronously and the
 * SDK is not registered globally. Tracing is off unless enabled.
 *
 * <p>Configuration (environment variable, then system property):
 * <ul>
 *   <li>{@code LEXD_TRACING_ENABLED}: true|false (default: false)</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: logging|otlp (default: logging)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: OTLP endpoint (default: http://localhost:4317)</li>
 *   <li>{@code OTEL_SERVICE_NAME}: service name (default: lexd)</li>
 * </ul>
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.lexd.compiler";
    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(Tracer tracer, SdkTracerProvider tracerProvider) {
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
    }

    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * A service that records nothing; used by tests and when tracing is disabled.
     */
    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME), null);
    }

    private static TracingService initialize() {
        if (!Boolean.parseBoolean(getEnvOrProperty("LEXD_TRACING_ENABLED", "false"))) {
            logger.fine("Tracing disabled");
            return noop();
        }
        try {
            Resource resource = Resource.getDefault().merge(Resource.create(
                    Attributes.of(SERVICE_NAME, getEnvOrProperty("OTEL_SERVICE_NAME", "lexd"))));
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .addSpanProcessor(SimpleSpanProcessor.create(configureExporter()))
                    .build();
            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .build();
            logger.info("Tracing enabled for " + INSTRUMENTATION_NAME);
            return new TracingService(sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase();
        return switch (exporterType) {
            case "otlp" -> {
                String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
                logger.info("Using OTLP exporter: " + endpoint);
                yield OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(10, TimeUnit.SECONDS)
                        .build();
            }
            case "logging" -> LoggingSpanExporter.create();
            default -> {
                logger.warning("Unknown exporter type: " + exporterType + ", using logging");
                yield LoggingSpanExporter.create();
            }
        };
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    /**
     * Flushes and closes the exporter; a no-op when tracing is disabled.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    public static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
