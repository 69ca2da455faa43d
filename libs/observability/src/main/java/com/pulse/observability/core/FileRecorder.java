package com.pulse.observability.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pulse.observability.config.RecordingConfig;
import com.pulse.observability.spi.Recorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.zip.CRC32;

/**
 * {@link Recorder} writing a chunked binary log to a single file.
 * <p>
 * Layout (big-endian):
 * <pre>
 * file   := magic "PULSEREC" (8 bytes), version (1 byte), chunk*
 * chunk  := codec id (1 byte: 0 none, 1 LZ4, 2 Zstandard, 3 deflate), recordCount (int),
 *           rawLength (int), storedLength (int), crc32 of raw bytes (int), stored bytes
 * record := channel (modified UTF-8, as DataOutput#writeUTF), epochNanos (long),
 *           payloadLength (int), payload
 * </pre>
 * Records are buffered until the raw chunk reaches the configured chunk size, then written in one
 * piece. Read files back with {@link RecordingReader}.
 */
public final class FileRecorder implements Recorder {

    private static final Logger log = LoggerFactory.getLogger(FileRecorder.class);

    static final byte[] MAGIC = {'P', 'U', 'L', 'S', 'E', 'R', 'E', 'C'};
    static final int FORMAT_VERSION = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path path;
    private final int chunkSize;
    private final ChunkCodec codec;
    private final DataOutputStream out;

    private ByteArrayOutputStream chunk = new ByteArrayOutputStream();
    private DataOutputStream chunkData = new DataOutputStream(chunk);
    private int chunkRecords;
    private long totalRecords;
    private boolean closed;

    private FileRecorder(Path path, int chunkSize, ChunkCodec codec, DataOutputStream out) {
        this.path = path;
        this.chunkSize = chunkSize;
        this.codec = codec;
        this.out = out;
    }

    /**
     * Creates the recording file (and its parent directories), replacing any existing file.
     *
     * @throws IllegalArgumentException if the configuration has no path
     * @throws IOException              if the file cannot be created
     */
    public static FileRecorder open(RecordingConfig config) throws IOException {
        if (config.path() == null) {
            throw new IllegalArgumentException("recording path must be set when recording is enabled");
        }
        Path path = config.path();
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        OutputStream file = Files.newOutputStream(path,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        DataOutputStream out = new DataOutputStream(new BufferedOutputStream(file));
        try {
            out.write(MAGIC);
            out.writeByte(FORMAT_VERSION);
        } catch (IOException e) {
            out.close();
            throw e;
        }
        log.info("Recording telemetry to {} (chunkSize={}, compression={})",
                path, config.chunkSize(), config.compression());
        return new FileRecorder(path, config.chunkSize(), ChunkCodec.forCompression(config.compression()), out);
    }

    @Override
    public synchronized void record(String channel, Instant timestamp, byte[] payload) throws IOException {
        if (closed) {
            throw new IllegalStateException("Recorder for " + path + " is closed");
        }
        chunkData.writeUTF(channel);
        chunkData.writeLong(toEpochNanos(timestamp));
        chunkData.writeInt(payload.length);
        chunkData.write(payload);
        chunkRecords++;
        totalRecords++;
        if (chunk.size() >= chunkSize) {
            writeChunk();
        }
    }

    @Override
    public void recordJson(String channel, Object value) throws IOException {
        record(channel, Instant.now(), MAPPER.writeValueAsBytes(value));
    }

    /**
     * Writes any buffered records and closes the file. Does nothing if already closed.
     */
    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (chunkRecords > 0) {
                writeChunk();
            }
            out.flush();
        } finally {
            out.close();
        }
        log.info("Recording {} closed after {} records", path, totalRecords);
    }

    public Path path() {
        return path;
    }

    /**
     * Returns the number of records accepted so far.
     */
    public synchronized long recordCount() {
        return totalRecords;
    }

    private void writeChunk() throws IOException {
        byte[] raw = chunk.toByteArray();
        CRC32 crc = new CRC32();
        crc.update(raw);
        byte[] stored = codec.compress(raw);

        out.writeByte(codec.id());
        out.writeInt(chunkRecords);
        out.writeInt(raw.length);
        out.writeInt(stored.length);
        out.writeInt((int) crc.getValue());
        out.write(stored);

        chunk = new ByteArrayOutputStream();
        chunkData = new DataOutputStream(chunk);
        chunkRecords = 0;
    }

    private static long toEpochNanos(Instant timestamp) {
        return Math.addExact(Math.multiplyExact(timestamp.getEpochSecond(), 1_000_000_000L), timestamp.getNano());
    }
}
