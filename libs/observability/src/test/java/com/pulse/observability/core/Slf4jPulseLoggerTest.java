package com.pulse.observability.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.pulse.observability.Environment;
import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.config.TelemetryConfig;
import com.pulse.observability.testing.FakeTelemetryCore;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.KeyValuePair;
import org.slf4j.event.Level;
import org.slf4j.helpers.NOPLogger;

/**
 * Tests for {@link Slf4jPulseLogger} against a Logback list appender.
 */
@DisplayName("Slf4jPulseLogger")
class Slf4jPulseLoggerTest {

    private static final String SERVICE = "logger-test-svc";

    private ch.qos.logback.classic.Logger logbackLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logbackLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(SERVICE);
        appender = new ListAppender<>();
        appender.start();
        logbackLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logbackLogger.detachAppender(appender);
        appender.stop();
    }

    private Slf4jPulseLogger loggerFor(Environment environment, TelemetryConfig config) {
        ServiceIdentity identity = new ServiceIdentity(SERVICE, "1.4.0", environment, Map.of());
        return new Slf4jPulseLogger(identity, new FakeTelemetryCore(identity, config, () -> { }));
    }

    private static Map<String, Object> keyValues(ILoggingEvent event) {
        Map<String, Object> pairs = new LinkedHashMap<>();
        for (KeyValuePair pair : event.getKeyValuePairs()) {
            pairs.put(pair.key, pair.value);
        }
        return pairs;
    }

    @Nested
    @DisplayName("Events")
    class Events {

        @Test
        @DisplayName("should write to the service-named logger with identity key-values")
        void shouldAttachIdentity() {
            Slf4jPulseLogger logger = loggerFor(Environment.DEVELOPMENT, TelemetryConfig.defaults());

            logger.info("route planned", Map.of("waypoints", 12));

            assertThat(appender.list).hasSize(1);
            ILoggingEvent event = appender.list.get(0);
            assertThat(event.getLoggerName()).isEqualTo(SERVICE);
            assertThat(event.getLevel()).isEqualTo(ch.qos.logback.classic.Level.INFO);
            assertThat(event.getFormattedMessage()).isEqualTo("route planned");
            assertThat(keyValues(event))
                    .containsEntry(Slf4jPulseLogger.KEY_SERVICE_NAME, SERVICE)
                    .containsEntry(Slf4jPulseLogger.KEY_SERVICE_VERSION, "1.4.0")
                    .containsEntry(Slf4jPulseLogger.KEY_ENVIRONMENT, "development")
                    .containsEntry("waypoints", 12);
        }

        @Test
        @DisplayName("should attach the cause to error events")
        void shouldAttachCause() {
            Slf4jPulseLogger logger = loggerFor(Environment.PRODUCTION, TelemetryConfig.defaults());

            logger.error("motor fault", new IllegalStateException("overcurrent"), Map.of());

            ILoggingEvent event = appender.list.get(0);
            assertThat(event.getLevel()).isEqualTo(ch.qos.logback.classic.Level.ERROR);
            assertThat(event.getThrowableProxy().getMessage()).isEqualTo("overcurrent");
        }

        @Test
        @DisplayName("should accept messages without attributes")
        void shouldLogWithoutAttributes() {
            Slf4jPulseLogger logger = loggerFor(Environment.DEVELOPMENT, TelemetryConfig.defaults());

            logger.debug("tick");
            logger.warn("slow tick");

            assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("tick", "slow tick");
        }
    }

    @Nested
    @DisplayName("Thresholds")
    class Thresholds {

        @Test
        @DisplayName("should drop events below the environment's default level")
        void shouldDropBelowThreshold() {
            Slf4jPulseLogger logger = loggerFor(Environment.STAGING, TelemetryConfig.defaults());

            logger.debug("hidden");
            logger.info("hidden too");
            logger.warn("shown");

            assertThat(logger.minimumLevel()).isEqualTo(Level.WARN);
            assertThat(logger.isEnabled(Level.INFO)).isFalse();
            assertThat(logger.isEnabled(Level.ERROR)).isTrue();
            assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage).containsExactly("shown");
        }

        @Test
        @DisplayName("should use the NOP logger when logging is disabled")
        void shouldBeSilentWhenDisabled() {
            Slf4jPulseLogger logger = loggerFor(Environment.DEVELOPMENT,
                    TelemetryConfig.defaults().withLoggingEnabled(false));

            logger.error("never written");

            assertThat(logger.delegate()).isSameAs(NOPLogger.NOP_LOGGER);
            assertThat(logger.isEnabled(Level.ERROR)).isFalse();
            assertThat(appender.list).isEmpty();
        }
    }

    @Test
    @DisplayName("should reject missing collaborators")
    void shouldRejectNulls() {
        ServiceIdentity identity = ServiceIdentity.of(SERVICE, Environment.DEVELOPMENT);

        assertThatThrownBy(() -> new Slf4jPulseLogger(identity, null, Level.INFO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("delegate");
        assertThatThrownBy(() -> new Slf4jPulseLogger(identity, logbackLogger, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minimumLevel");
    }
}
