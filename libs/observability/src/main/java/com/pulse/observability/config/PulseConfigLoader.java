package com.pulse.observability.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds a {@link PulseConfig} from a JSON file and environment variables.
 * <p>
 * A file only needs the keys it changes: it is merged over the defaults before binding.
 * <pre>{@code
 * {
 *   "telemetry": { "otlp": { "enabled": true, "host": "collector" } },
 *   "profiling": { "enabled": true, "samplingInterval": "PT0.01S" }
 * }
 * }</pre>
 * Environment variables are applied last and win over the file. Recording follows
 * {@value #ENV_RECORDING_ENABLED} and {@value #ENV_RECORDING_PATH}, with the {@code PULSE_RECORDING_*}
 * names accepted as aliases.
 */
public final class PulseConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PulseConfigLoader.class);

    public static final String ENV_OTLP_ENABLED = "OTEL_EXPORTER_OTLP_ENABLED";
    public static final String ENV_OTLP_HOST = "OTEL_EXPORTER_OTLP_HOST";
    public static final String ENV_OTLP_PORT = "OTEL_EXPORTER_OTLP_PORT";
    public static final String ENV_PROFILING_ENABLED = "PULSE_PROFILING_ENABLED";
    public static final String ENV_PROFILING_OUTPUT_DIR = "PULSE_PROFILING_OUTPUT_DIR";
    public static final String ENV_RECORDING_ENABLED = "FOXGLOVE_MCAP_ENABLED";
    public static final String ENV_RECORDING_PATH = "FOXGLOVE_MCAP_PATH";
    /** Alias of {@link #ENV_RECORDING_ENABLED}, consulted only when that is unset. */
    public static final String ENV_RECORDING_ENABLED_ALIAS = "PULSE_RECORDING_ENABLED";
    /** Alias of {@link #ENV_RECORDING_PATH}, consulted only when that is unset. */
    public static final String ENV_RECORDING_PATH_ALIAS = "PULSE_RECORDING_PATH";

    private static final ObjectMapper MAPPER = createMapper();

    private PulseConfigLoader() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Returns the defaults overlaid with the current process environment.
     */
    public static PulseConfig loadDefault() {
        return fromEnvironment(PulseConfig.defaults(), System.getenv());
    }

    /**
     * Reads a JSON file and merges it over {@link PulseConfig#defaults()}.
     *
     * @throws ConfigurationException if the file cannot be read or does not bind
     */
    public static PulseConfig load(Path file) {
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file " + file, e);
        }
    }

    /**
     * Merges a JSON document over {@link PulseConfig#defaults()}.
     *
     * @throws ConfigurationException if the document is malformed or does not bind
     */
    public static PulseConfig parse(String json) {
        try {
            JsonNode overlay = MAPPER.readTree(json);
            ObjectNode merged = MAPPER.valueToTree(PulseConfig.defaults());
            if (overlay != null && overlay.isObject()) {
                merge(merged, overlay);
            } else if (overlay != null && !overlay.isMissingNode() && !overlay.isNull()) {
                throw new ConfigurationException("Configuration root must be a JSON object", null);
            }
            return MAPPER.treeToValue(merged, PulseConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to parse configuration: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Overlays the supported environment variables on a base configuration. Values that do not
     * parse are ignored with a warning and the base value is kept.
     *
     * @param base the configuration to start from
     * @param env  environment variables (typically {@link System#getenv()})
     */
    public static PulseConfig fromEnvironment(PulseConfig base, Map<String, String> env) {
        Function<String, String> lookup = key -> {
            String value = env.get(key);
            return value == null || value.isBlank() ? null : value.trim();
        };

        TelemetryConfig telemetry = base.telemetry();
        OtlpExportConfig otlp = telemetry.otlp();
        otlp = otlp.withEnabled(parseBoolean(ENV_OTLP_ENABLED, lookup.apply(ENV_OTLP_ENABLED), otlp.enabled()));
        if (lookup.apply(ENV_OTLP_HOST) != null) {
            otlp = otlp.withHost(lookup.apply(ENV_OTLP_HOST));
        }
        otlp = otlp.withGrpcPort(parseInt(ENV_OTLP_PORT, lookup.apply(ENV_OTLP_PORT), otlp.grpcPort()));

        ProfilingConfig profiling = base.profiling();
        profiling = profiling.withEnabled(
                parseBoolean(ENV_PROFILING_ENABLED, lookup.apply(ENV_PROFILING_ENABLED), profiling.enabled()));
        if (lookup.apply(ENV_PROFILING_OUTPUT_DIR) != null) {
            profiling = profiling.withOutputDirectory(Path.of(lookup.apply(ENV_PROFILING_OUTPUT_DIR)));
        }

        RecordingConfig recording = base.recording();
        String recordingEnabledKey = firstSet(lookup, ENV_RECORDING_ENABLED, ENV_RECORDING_ENABLED_ALIAS);
        recording = recording.withEnabled(
                parseBoolean(recordingEnabledKey, lookup.apply(recordingEnabledKey), recording.enabled()));
        String recordingPathKey = firstSet(lookup, ENV_RECORDING_PATH, ENV_RECORDING_PATH_ALIAS);
        if (lookup.apply(recordingPathKey) != null) {
            recording = recording.withPath(Path.of(lookup.apply(recordingPathKey)));
        }

        return new PulseConfig(telemetry.withOtlp(otlp), profiling, recording);
    }

    /**
     * Returns the primary key if it is set, otherwise the alias.
     */
    private static String firstSet(Function<String, String> lookup, String primary, String alias) {
        return lookup.apply(primary) != null ? primary : alias;
    }

    private static void merge(ObjectNode target, JsonNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue().isObject()) {
                merge(existingObject, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    private static boolean parseBoolean(String key, String value, boolean fallback) {
        if (value == null) {
            return fallback;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "t", "yes" -> {
                return true;
            }
            case "false", "0", "f", "no" -> {
                return false;
            }
            default -> {
                log.warn("Ignoring {}={}: not a boolean", key, value);
                return fallback;
            }
        }
    }

    private static int parseInt(String key, String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer", key, value);
            return fallback;
        }
    }
}
