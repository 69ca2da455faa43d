package com.pulse.observability.spi;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;

/**
 * Writes telemetry records to a binary log for offline replay.
 */
public interface Recorder extends Closeable {

    /**
     * Appends one record.
     *
     * @param channel   logical stream the record belongs to (e.g., "/logs", "/metrics/cpu")
     * @param timestamp when the record was produced
     * @param payload   opaque record bytes
     * @throws IOException if the record cannot be written
     */
    void record(String channel, Instant timestamp, byte[] payload) throws IOException;

    /**
     * Appends a record whose payload is the JSON form of {@code value}, stamped now.
     */
    void recordJson(String channel, Object value) throws IOException;

    /**
     * Flushes buffered records and closes the recording.
     */
    @Override
    void close() throws IOException;
}
