package com.pulse.observability.core;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.config.OtlpExportConfig;
import com.pulse.observability.config.TelemetryConfig;
import com.pulse.observability.spi.TelemetryCore;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link TelemetryCore} backed by the OpenTelemetry SDK for spans and a Micrometer composite
 * registry for meters.
 * <p>
 * Nothing is registered globally: the SDK and the registry are owned by this instance and
 * released by {@link #shutdown()}. Spans and metrics leave the process only when OTLP export is
 * enabled; otherwise meters are kept in a {@link SimpleMeterRegistry} and spans go to whatever
 * exporters the caller supplied.
 */
public final class OpenTelemetryCore implements TelemetryCore {

    private static final Logger log = LoggerFactory.getLogger(OpenTelemetryCore.class);

    public static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    public static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    public static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT =
            AttributeKey.stringKey("deployment.environment");

    /** Tag key for the deployment environment, common to every meter. */
    public static final String TAG_ENVIRONMENT = "environment";

    private final ServiceIdentity identity;
    private final TelemetryConfig config;
    private final Resource resource;
    private final OpenTelemetrySdk sdk;
    private final CompositeMeterRegistry meterRegistry;

    private OpenTelemetryCore(ServiceIdentity identity, TelemetryConfig config, Resource resource,
                              OpenTelemetrySdk sdk, CompositeMeterRegistry meterRegistry) {
        this.identity = identity;
        this.config = config;
        this.resource = resource;
        this.sdk = sdk;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Builds a core that exports only through OTLP, if enabled.
     */
    public static OpenTelemetryCore create(ServiceIdentity identity, TelemetryConfig config) {
        return create(identity, config, List.of());
    }

    /**
     * Builds a core that additionally sends every finished span to the given exporters.
     *
     * @param spanExporters exporters attached with a simple (synchronous) processor
     */
    public static OpenTelemetryCore create(ServiceIdentity identity, TelemetryConfig config,
                                           List<SpanExporter> spanExporters) {
        return create(identity, config, spanExporters, otlpConfig -> new OtlpMeterRegistry(otlpConfig, Clock.SYSTEM));
    }

    /**
     * Builds a core with the given OTLP meter registry factory. If anything after the SDK fails to
     * build, the SDK and any registry already built are shut down before the failure propagates.
     */
    static OpenTelemetryCore create(ServiceIdentity identity, TelemetryConfig config,
                                    List<SpanExporter> spanExporters,
                                    Function<OtlpConfig, MeterRegistry> otlpRegistryFactory) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        Resource resource = Resource.getDefault().merge(Resource.create(resourceAttributes(identity)));

        OpenTelemetrySdk sdk = config.tracingEnabled()
                ? buildSdk(resource, config, spanExporters)
                : null;

        CompositeMeterRegistry meterRegistry = new CompositeMeterRegistry();
        try {
            meterRegistry.config().commonTags(TAG_ENVIRONMENT, identity.environment().value());
            if (config.metricsEnabled()) {
                meterRegistry.add(new SimpleMeterRegistry());
                if (config.otlp().enabled()) {
                    meterRegistry.add(otlpRegistryFactory.apply(otlpMeterConfig(identity, config)));
                }
            }
        } catch (RuntimeException e) {
            releaseAfterFailedStart(sdk, meterRegistry, config, e);
            throw e;
        }

        log.info("Telemetry core started for {} (logging={}, metrics={}, tracing={}, otlp={})",
                identity.name(), config.loggingEnabled(), config.metricsEnabled(),
                config.tracingEnabled(), config.otlp().enabled() ? config.otlp().spanEndpoint() : "off");
        return new OpenTelemetryCore(identity, config, resource, sdk, meterRegistry);
    }

    private static void releaseAfterFailedStart(OpenTelemetrySdk sdk, CompositeMeterRegistry meterRegistry,
                                                TelemetryConfig config, RuntimeException failure) {
        log.warn("Telemetry core failed to start, releasing what was built", failure);
        if (sdk != null) {
            sdk.shutdown().join(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        for (MeterRegistry registry : new ArrayList<>(meterRegistry.getRegistries())) {
            try {
                registry.close();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
        meterRegistry.close();
    }

    @Override
    public ServiceIdentity identity() {
        return identity;
    }

    @Override
    public TelemetryConfig config() {
        return config;
    }

    @Override
    public OpenTelemetry openTelemetry() {
        return sdk != null ? sdk : OpenTelemetry.noop();
    }

    @Override
    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    /**
     * Returns the resource describing this service on every span.
     */
    public Resource resource() {
        return resource;
    }

    /**
     * Flushes pending spans, shuts the SDK down and closes every meter registry. All steps are
     * attempted; the first failure is rethrown.
     *
     * @throws IllegalStateException if spans could not be flushed or exporters did not shut down
     *                               within the configured timeout
     */
    @Override
    public void shutdown() {
        long timeoutMs = config.shutdownTimeout().toMillis();
        RuntimeException failure = null;

        if (sdk != null) {
            CompletableResultCode flushed = sdk.getSdkTracerProvider().forceFlush()
                    .join(timeoutMs, TimeUnit.MILLISECONDS);
            if (!flushed.isSuccess()) {
                failure = new IllegalStateException(
                        "Pending spans were not flushed within %d ms".formatted(timeoutMs));
            }
            CompletableResultCode stopped = sdk.shutdown().join(timeoutMs, TimeUnit.MILLISECONDS);
            if (!stopped.isSuccess() && failure == null) {
                failure = new IllegalStateException(
                        "OpenTelemetry SDK did not shut down within %d ms".formatted(timeoutMs));
            }
        }

        for (MeterRegistry registry : new ArrayList<>(meterRegistry.getRegistries())) {
            try {
                registry.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                }
            }
        }
        meterRegistry.close();

        if (failure != null) {
            throw failure;
        }
        log.info("Telemetry core for {} shut down", identity.name());
    }

    private static Attributes resourceAttributes(ServiceIdentity identity) {
        AttributesBuilder attributes = Attributes.builder();
        identity.attributes().forEach(attributes::put);
        attributes.put(SERVICE_NAME, identity.name());
        attributes.put(SERVICE_VERSION, identity.version());
        attributes.put(DEPLOYMENT_ENVIRONMENT, identity.environment().value());
        return attributes.build();
    }

    private static OpenTelemetrySdk buildSdk(Resource resource, TelemetryConfig config,
                                             List<SpanExporter> spanExporters) {
        SdkTracerProviderBuilder tracerProvider = SdkTracerProvider.builder()
                .setResource(resource)
                .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(config.traceSampleRate())));

        if (config.otlp().enabled()) {
            tracerProvider.addSpanProcessor(BatchSpanProcessor.builder(otlpSpanExporter(config.otlp())).build());
        }
        for (SpanExporter exporter : spanExporters) {
            tracerProvider.addSpanProcessor(SimpleSpanProcessor.create(exporter));
        }

        return OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider.build())
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
    }

    private static SpanExporter otlpSpanExporter(OtlpExportConfig otlp) {
        if (otlp.protocol() == OtlpExportConfig.Protocol.HTTP) {
            var builder = OtlpHttpSpanExporter.builder()
                    .setEndpoint(otlp.spanEndpoint() + "/v1/traces")
                    .setTimeout(otlp.timeout());
            otlp.headers().forEach(builder::addHeader);
            return builder.build();
        }
        var builder = OtlpGrpcSpanExporter.builder()
                .setEndpoint(otlp.spanEndpoint())
                .setTimeout(otlp.timeout());
        otlp.headers().forEach(builder::addHeader);
        return builder.build();
    }

    private static OtlpConfig otlpMeterConfig(ServiceIdentity identity, TelemetryConfig config) {
        OtlpExportConfig otlp = config.otlp();
        String resourceAttributes = "%s=%s,%s=%s,%s=%s".formatted(
                SERVICE_NAME.getKey(), identity.name(),
                SERVICE_VERSION.getKey(), identity.version(),
                DEPLOYMENT_ENVIRONMENT.getKey(), identity.environment().value());
        String headers = joinPairs(otlp.headers());
        return key -> switch (key) {
            case "otlp.url" -> otlp.metricsEndpoint();
            case "otlp.step" -> config.metricsStep().toMillis() + "ms";
            case "otlp.resourceAttributes" -> resourceAttributes;
            case "otlp.headers" -> headers.isEmpty() ? null : headers;
            default -> null;
        };
    }

    private static String joinPairs(Map<String, String> pairs) {
        return pairs.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(","));
    }
}
