package com.pulse.observability.config;

import java.nio.file.Path;

/**
 * Binary telemetry-log recording settings.
 *
 * @param enabled     construct a recorder at all (default false)
 * @param path        file the recording is written to; required once enabled
 * @param chunkSize   uncompressed bytes buffered before a chunk is written (default 1 MiB)
 * @param compression chunk compression: NONE, LZ4, ZSTD or DEFLATE (default NONE)
 */
public record RecordingConfig(
        boolean enabled,
        Path path,
        int chunkSize,
        Compression compression
) {

    /** Chunk compression mode. */
    public enum Compression {
        NONE,
        LZ4,
        ZSTD,
        DEFLATE
    }

    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;

    public RecordingConfig {
        if (compression == null) {
            compression = Compression.NONE;
        }
    }

    public static RecordingConfig defaults() {
        return new RecordingConfig(false, null, DEFAULT_CHUNK_SIZE, Compression.NONE);
    }

    public RecordingConfig withEnabled(boolean enabled) {
        return new RecordingConfig(enabled, path, chunkSize, compression);
    }

    public RecordingConfig withPath(Path path) {
        return new RecordingConfig(enabled, path, chunkSize, compression);
    }

    public RecordingConfig withChunkSize(int chunkSize) {
        return new RecordingConfig(enabled, path, chunkSize, compression);
    }

    public RecordingConfig withCompression(Compression compression) {
        return new RecordingConfig(enabled, path, chunkSize, compression);
    }
}
