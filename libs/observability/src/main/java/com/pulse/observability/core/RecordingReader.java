package com.pulse.observability.core;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Reads files written by {@link FileRecorder}.
 * <p>
 * Every length field is checked against the bytes that actually remain before anything is
 * allocated, so a damaged file fails with an {@link IOException} rather than a runtime error.
 */
public final class RecordingReader {

    /** Size of the fixed chunk header that follows the codec id. */
    private static final int CHUNK_HEADER_LENGTH = 4 * Integer.BYTES;

    /** Smallest possible record: empty channel, timestamp, payload length. */
    private static final int MIN_RECORD_LENGTH = Short.BYTES + Long.BYTES + Integer.BYTES;

    /**
     * One recorded entry.
     *
     * @param channel   logical stream name
     * @param timestamp when the record was produced
     * @param payload   record bytes
     */
    public record Entry(String channel, Instant timestamp, byte[] payload) {

        public String payloadAsString() {
            return new String(payload, StandardCharsets.UTF_8);
        }
    }

    private RecordingReader() {
        // utility class
    }

    /**
     * Reads every record in file order.
     *
     * @param file a recording written by {@link FileRecorder}
     * @return the records, in the order they were written
     * @throws IOException if the file is not a recording, is truncated, or a chunk is corrupt
     */
    public static List<Entry> readAll(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        ByteArrayInputStream source = new ByteArrayInputStream(bytes);
        try (DataInputStream in = new DataInputStream(source)) {
            byte[] magic = new byte[FileRecorder.MAGIC.length];
            in.readFully(magic);
            if (!Arrays.equals(magic, FileRecorder.MAGIC)) {
                throw new IOException(file + " is not a telemetry recording");
            }
            int version = in.readUnsignedByte();
            if (version != FileRecorder.FORMAT_VERSION) {
                throw new IOException("Unsupported recording format version " + version);
            }

            List<Entry> entries = new ArrayList<>();
            int codecId;
            while ((codecId = in.read()) != -1) {
                readChunk(in, source, ChunkCodec.fromId(codecId), entries);
            }
            return entries;
        } catch (EOFException e) {
            throw new IOException("Recording " + file + " is truncated", e);
        }
    }

    private static void readChunk(DataInputStream in, ByteArrayInputStream source, ChunkCodec codec,
                                  List<Entry> entries) throws IOException {
        if (source.available() < CHUNK_HEADER_LENGTH) {
            throw new EOFException();
        }
        int recordCount = in.readInt();
        int rawLength = in.readInt();
        int storedLength = in.readInt();
        int expectedCrc = in.readInt();

        if (recordCount < 0 || rawLength < 0 || storedLength < 0) {
            throw new IOException("Chunk header corrupt: recordCount=%d rawLength=%d storedLength=%d"
                    .formatted(recordCount, rawLength, storedLength));
        }
        if (storedLength > source.available()) {
            throw new EOFException("%d stored bytes declared, %d left in file"
                    .formatted(storedLength, source.available()));
        }
        if (!codec.acceptsLengths(storedLength, rawLength)) {
            throw new IOException("Chunk corrupt: %d stored bytes cannot hold %d raw bytes with %s"
                    .formatted(storedLength, rawLength, codec));
        }
        if ((long) recordCount * MIN_RECORD_LENGTH > rawLength) {
            throw new IOException("Chunk corrupt: %d records cannot fit in %d bytes"
                    .formatted(recordCount, rawLength));
        }

        byte[] stored = new byte[storedLength];
        in.readFully(stored);
        byte[] raw = codec.decompress(stored, rawLength);
        CRC32 crc = new CRC32();
        crc.update(raw);
        if ((int) crc.getValue() != expectedCrc) {
            throw new IOException("Chunk CRC mismatch");
        }

        ByteArrayInputStream recordSource = new ByteArrayInputStream(raw);
        DataInputStream records = new DataInputStream(recordSource);
        try {
            for (int i = 0; i < recordCount; i++) {
                String channel = records.readUTF();
                long epochNanos = records.readLong();
                int payloadLength = records.readInt();
                if (payloadLength < 0 || payloadLength > recordSource.available()) {
                    throw new IOException("Chunk corrupt: record payload length " + payloadLength);
                }
                byte[] payload = new byte[payloadLength];
                records.readFully(payload);
                Instant timestamp = Instant.ofEpochSecond(
                        Math.floorDiv(epochNanos, 1_000_000_000L), Math.floorMod(epochNanos, 1_000_000_000L));
                entries.add(new Entry(channel, timestamp, payload));
            }
        } catch (EOFException e) {
            throw new IOException("Chunk corrupt: records overrun the chunk", e);
        }
    }
}
