package com.pulse.observability.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pulse.observability.Environment;
import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.config.ProfilingConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import jdk.jfr.FlightRecorder;
import jdk.jfr.Recording;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("JfrProfiler")
class JfrProfilerTest {

    private static final ServiceIdentity IDENTITY = ServiceIdentity.of("lidar-driver", Environment.EMBEDDED);

    @TempDir
    Path dir;

    @Test
    @DisplayName("should write a recording named after the service on stop")
    void shouldWriteRecording() throws Exception {
        JfrProfiler profiler = JfrProfiler.start(IDENTITY,
                ProfilingConfig.defaults().withEnabled(true).withOutputDirectory(dir));

        assertThat(profiler.isRunning()).isTrue();
        assertThat(profiler.destination().getFileName().toString()).startsWith("lidar-driver-").endsWith(".jfr");

        profiler.stop();

        assertThat(profiler.isRunning()).isFalse();
        assertThat(profiler.destination()).exists();
        assertThat(Files.size(profiler.destination())).isPositive();
    }

    @Test
    @DisplayName("should prefer the configured application name")
    void shouldUseApplicationName() throws Exception {
        ProfilingConfig config = new ProfilingConfig(true, "fleet-lidar", "default", dir, Duration.ofMillis(50));

        JfrProfiler profiler = JfrProfiler.start(IDENTITY, config);
        try {
            assertThat(profiler.destination().getFileName().toString()).startsWith("fleet-lidar-");
            assertThat(profiler.destination().getParent()).isEqualTo(dir);
        } finally {
            profiler.stop();
        }
    }

    @Test
    @DisplayName("should treat a second stop as a no-op")
    void shouldStopOnce() throws Exception {
        JfrProfiler profiler = JfrProfiler.start(IDENTITY,
                ProfilingConfig.defaults().withEnabled(true).withOutputDirectory(dir));

        profiler.stop();
        profiler.stop();

        assertThat(profiler.isRunning()).isFalse();
    }

    @Test
    @DisplayName("should close the recording when the output directory cannot be created")
    void shouldCloseRecordingWhenStartFails() throws IOException {
        Path blocker = Files.writeString(dir.resolve("not-a-directory"), "x");
        ProfilingConfig config = new ProfilingConfig(true, "blocked-lidar", "default", blocker.resolve("profiles"),
                Duration.ofMillis(50));

        assertThatThrownBy(() -> JfrProfiler.start(IDENTITY, config))
                .isInstanceOf(IOException.class);

        assertThat(FlightRecorder.getFlightRecorder().getRecordings())
                .extracting(Recording::getName)
                .doesNotContain("pulse-blocked-lidar");
    }

    @Test
    @DisplayName("should fail to start with unknown JFR settings")
    void shouldRejectUnknownSettings() {
        ProfilingConfig config = new ProfilingConfig(true, null, "no-such-settings", dir, null);

        assertThatThrownBy(() -> JfrProfiler.start(IDENTITY, config))
                .isInstanceOf(IOException.class);
    }
}
