package com.pulse.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.pulse.observability.config.ProfilingConfig;
import com.pulse.observability.config.PulseConfig;
import com.pulse.observability.config.RecordingConfig;
import com.pulse.observability.core.DefaultSubsystemProvider;
import com.pulse.observability.core.JfrProfiler;
import com.pulse.observability.core.RecordingReader;
import com.pulse.observability.spi.Recorder;
import com.pulse.observability.spi.Subsystem;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Runs a handle over the production collaborators end to end.
 */
@DisplayName("Pulse with default subsystems")
class PulseIntegrationTest {

    private static final ServiceIdentity IDENTITY =
            new ServiceIdentity("mission-control", "0.9.0", Environment.DEVELOPMENT, Map.of("site", "lab"));

    @TempDir
    Path dir;

    @Test
    @DisplayName("should trace, count, record and profile until shutdown")
    void shouldRunEveryEnabledSubsystem() throws Exception {
        InMemorySpanExporter spans = InMemorySpanExporter.create();
        Path recording = dir.resolve("mission.rec");
        PulseConfig config = PulseConfig.defaults()
                .withProfiling(ProfilingConfig.defaults().withEnabled(true).withOutputDirectory(dir))
                .withRecording(RecordingConfig.defaults().withEnabled(true).withPath(recording));

        Pulse pulse = Pulse.create(IDENTITY, config, new DefaultSubsystemProvider(List.of(spans)));
        JfrProfiler profiler = (JfrProfiler) pulse.profiler().orElseThrow();
        Recorder recorder = pulse.recorder().orElseThrow();

        int planned = pulse.tracer().withSpan("plan-mission", () -> {
            pulse.logger().info("planning", Map.of("legs", 3));
            pulse.metrics().counter("missions.planned", "Missions planned").increment();
            recorder.recordJson("mission", Map.of("legs", 3));
            return 3;
        });
        double counted = pulse.metrics().registry().get("missions.planned").counter().count();

        pulse.shutdown();

        assertThat(planned).isEqualTo(3);
        assertThat(counted).isEqualTo(1.0);
        assertThat(spans.getFinishedSpanItems()).extracting(SpanData::getName).containsExactly("plan-mission");
        assertThat(RecordingReader.readAll(recording))
                .extracting(RecordingReader.Entry::channel)
                .containsExactly("mission");
        assertThat(profiler.isRunning()).isFalse();
        assertThat(profiler.destination()).exists();
        assertThat(pulse.isShutdown()).isTrue();
    }

    @Test
    @DisplayName("should fail startup and release the core when recording has no path")
    void shouldRollBackWhenRecorderCannotOpen() {
        PulseConfig config = PulseConfig.defaults()
                .withRecording(RecordingConfig.defaults().withEnabled(true));

        StartupException failure = catchThrowableOfType(
                () -> Pulse.create(IDENTITY, config), StartupException.class);

        assertThat(failure).isNotNull();
        assertThat(failure.subsystem()).isEqualTo(Subsystem.RECORDER);
        assertThat(failure).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(failure.getSuppressed()).isEmpty();
    }

    @Test
    @DisplayName("should run a session over the default subsystems")
    void shouldRunSession() throws Exception {
        String name = PulseSession.withSession(IDENTITY, PulseConfig.defaults(), pulse -> {
            pulse.logger().debug("session running");
            return pulse.identity().name();
        });

        assertThat(name).isEqualTo("mission-control");
    }
}
