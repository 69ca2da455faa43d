package com.pulse.observability.config;

import java.time.Duration;
import java.util.Map;

/**
 * Where and how telemetry is exported to an OTLP collector.
 * <p>
 * Spans use the port matching {@link #protocol()}; metrics are always published over HTTP.
 *
 * @param enabled  export to a collector at all (default false: data stays in-process)
 * @param host     collector host (default "localhost")
 * @param grpcPort collector gRPC port (default 4317)
 * @param httpPort collector HTTP port (default 4318)
 * @param protocol transport used for spans (default GRPC)
 * @param headers  extra request headers, e.g. for authentication
 * @param timeout  per-export timeout (default 10s)
 */
public record OtlpExportConfig(
        boolean enabled,
        String host,
        int grpcPort,
        int httpPort,
        Protocol protocol,
        Map<String, String> headers,
        Duration timeout
) {

    /** OTLP transport. */
    public enum Protocol {
        GRPC,
        HTTP
    }

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_GRPC_PORT = 4317;
    public static final int DEFAULT_HTTP_PORT = 4318;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public OtlpExportConfig {
        if (host == null || host.isBlank()) {
            host = DEFAULT_HOST;
        }
        if (protocol == null) {
            protocol = Protocol.GRPC;
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
    }

    public static OtlpExportConfig defaults() {
        return new OtlpExportConfig(false, null, DEFAULT_GRPC_PORT, DEFAULT_HTTP_PORT, null, null, null);
    }

    /**
     * Returns the base URL spans are sent to, e.g. {@code http://localhost:4317}.
     */
    public String spanEndpoint() {
        int port = protocol == Protocol.GRPC ? grpcPort : httpPort;
        return "http://%s:%d".formatted(host, port);
    }

    /**
     * Returns the full URL metrics are published to.
     */
    public String metricsEndpoint() {
        return "http://%s:%d/v1/metrics".formatted(host, httpPort);
    }

    public OtlpExportConfig withEnabled(boolean enabled) {
        return new OtlpExportConfig(enabled, host, grpcPort, httpPort, protocol, headers, timeout);
    }

    public OtlpExportConfig withHost(String host) {
        return new OtlpExportConfig(enabled, host, grpcPort, httpPort, protocol, headers, timeout);
    }

    public OtlpExportConfig withGrpcPort(int grpcPort) {
        return new OtlpExportConfig(enabled, host, grpcPort, httpPort, protocol, headers, timeout);
    }

    public OtlpExportConfig withProtocol(Protocol protocol) {
        return new OtlpExportConfig(enabled, host, grpcPort, httpPort, protocol, headers, timeout);
    }
}
