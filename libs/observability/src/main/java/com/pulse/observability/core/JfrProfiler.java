package com.pulse.observability.core;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.config.ProfilingConfig;
import com.pulse.observability.spi.Profiler;
import jdk.jfr.Configuration;
import jdk.jfr.Recording;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;

/**
 * Continuous profiler built on a JDK Flight Recorder {@link Recording}.
 * <p>
 * The recording runs from {@link #start} until {@link #stop()}, sampling executing threads at
 * the configured interval on top of the named JFR settings. On stop the recording is dumped to
 * {@code <outputDirectory>/<applicationName>-<epochMillis>.jfr}.
 */
public final class JfrProfiler implements Profiler {

    private static final Logger log = LoggerFactory.getLogger(JfrProfiler.class);

    private static final String EXECUTION_SAMPLE_EVENT = "jdk.ExecutionSample";

    private final Recording recording;
    private final Path destination;
    private boolean running;

    private JfrProfiler(Recording recording, Path destination) {
        this.recording = recording;
        this.destination = destination;
        this.running = true;
    }

    /**
     * Starts a recording for the service. A recording that fails to start is closed before the
     * failure propagates.
     *
     * @throws IOException    if the JFR settings or the output directory cannot be read or created
     * @throws ParseException if the JFR settings are malformed
     */
    public static JfrProfiler start(ServiceIdentity identity, ProfilingConfig config)
            throws IOException, ParseException {
        String applicationName = config.applicationName().isBlank()
                ? identity.name()
                : config.applicationName();
        Path directory = config.outputDirectory() != null
                ? config.outputDirectory()
                : Path.of(System.getProperty("java.io.tmpdir"));
        Path destination = directory.resolve(applicationName + "-" + System.currentTimeMillis() + ".jfr");

        Recording recording = new Recording(Configuration.getConfiguration(config.settings()));
        try {
            recording.setName("pulse-" + applicationName);
            recording.setToDisk(true);
            recording.enable(EXECUTION_SAMPLE_EVENT).withPeriod(config.samplingInterval());
            Files.createDirectories(directory);
            recording.start();
        } catch (IOException | RuntimeException e) {
            recording.close();
            throw e;
        }

        log.info("Profiling {} with JFR settings '{}' every {} ms",
                applicationName, config.settings(), config.samplingInterval().toMillis());
        return new JfrProfiler(recording, destination);
    }

    @Override
    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Stops the recording, writes it to {@link #destination()} and releases it. Does nothing if
     * already stopped.
     *
     * @throws IOException if the recording cannot be written
     */
    @Override
    public synchronized void stop() throws IOException {
        if (!running) {
            return;
        }
        running = false;
        try {
            recording.stop();
            recording.dump(destination);
            log.info("Profile written to {}", destination);
        } finally {
            recording.close();
        }
    }

    /**
     * Returns the file the profile is written to on stop.
     */
    public Path destination() {
        return destination;
    }
}
