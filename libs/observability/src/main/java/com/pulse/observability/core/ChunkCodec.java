package com.pulse.observability.core;

import com.pulse.observability.config.RecordingConfig.Compression;
import io.airlift.compress.Compressor;
import io.airlift.compress.Decompressor;
import io.airlift.compress.MalformedInputException;
import io.airlift.compress.lz4.Lz4Compressor;
import io.airlift.compress.lz4.Lz4Decompressor;
import io.airlift.compress.zstd.ZstdCompressor;
import io.airlift.compress.zstd.ZstdDecompressor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Chunk compression codecs of the recording format, keyed by the id byte written before each chunk.
 * <p>
 * Ids are part of the file format and never change; new codecs take new ids.
 */
enum ChunkCodec {

    NONE(0, Compression.NONE, 1) {
        @Override
        byte[] compress(byte[] raw) {
            return raw;
        }

        @Override
        byte[] decompress(byte[] stored, int rawLength) {
            return stored;
        }
    },

    LZ4(1, Compression.LZ4, 255) {
        @Override
        byte[] compress(byte[] raw) {
            return compressBlock(new Lz4Compressor(), raw);
        }

        @Override
        byte[] decompress(byte[] stored, int rawLength) throws IOException {
            return decompressBlock(new Lz4Decompressor(), stored, rawLength);
        }
    },

    ZSTD(2, Compression.ZSTD, 32_768) {
        @Override
        byte[] compress(byte[] raw) {
            return compressBlock(new ZstdCompressor(), raw);
        }

        @Override
        byte[] decompress(byte[] stored, int rawLength) throws IOException {
            long frameSize;
            try {
                frameSize = ZstdDecompressor.getDecompressedSize(stored, 0, stored.length);
            } catch (MalformedInputException e) {
                throw new IOException("Chunk corrupt: " + e.getMessage(), e);
            }
            if (frameSize >= 0 && frameSize != rawLength) {
                throw new IOException("Chunk corrupt: zstd frame holds %d bytes, header says %d"
                        .formatted(frameSize, rawLength));
            }
            return decompressBlock(new ZstdDecompressor(), stored, rawLength);
        }
    },

    DEFLATE(3, Compression.DEFLATE, 1032) {
        @Override
        byte[] compress(byte[] raw) throws IOException {
            ByteArrayOutputStream compressed = new ByteArrayOutputStream(raw.length / 2 + 16);
            try (DeflaterOutputStream deflater =
                         new DeflaterOutputStream(compressed, new Deflater(Deflater.BEST_SPEED))) {
                deflater.write(raw);
            }
            return compressed.toByteArray();
        }

        @Override
        byte[] decompress(byte[] stored, int rawLength) throws IOException {
            try (InputStream inflater = new InflaterInputStream(new ByteArrayInputStream(stored))) {
                byte[] raw = inflater.readNBytes(rawLength);
                if (raw.length != rawLength || inflater.read() != -1) {
                    throw new IOException("Chunk corrupt: inflated size differs from %d".formatted(rawLength));
                }
                return raw;
            }
        }
    };

    private final int id;
    private final Compression compression;
    private final int maxExpansion;

    ChunkCodec(int id, Compression compression, int maxExpansion) {
        this.id = id;
        this.compression = compression;
        this.maxExpansion = maxExpansion;
    }

    /**
     * Compresses a raw chunk.
     *
     * @param raw the serialized records
     * @return the bytes to store, possibly {@code raw} itself
     * @throws IOException if the codec fails
     */
    abstract byte[] compress(byte[] raw) throws IOException;

    /**
     * Restores a raw chunk of exactly {@code rawLength} bytes.
     *
     * @param stored    the bytes read from the file
     * @param rawLength the raw length recorded in the chunk header
     * @return the serialized records
     * @throws IOException if the stored bytes do not decode to {@code rawLength} bytes
     */
    abstract byte[] decompress(byte[] stored, int rawLength) throws IOException;

    /**
     * Returns the id byte written to the file.
     */
    int id() {
        return id;
    }

    /**
     * Returns whether a chunk header's lengths are possible for this codec, given the codec's
     * worst-case expansion (run-length blocks for Zstandard).
     */
    boolean acceptsLengths(int storedLength, int rawLength) {
        if (this == NONE) {
            return storedLength == rawLength;
        }
        return rawLength <= (long) storedLength * maxExpansion + 64;
    }

    static ChunkCodec forCompression(Compression compression) {
        for (ChunkCodec codec : values()) {
            if (codec.compression == compression) {
                return codec;
            }
        }
        throw new IllegalArgumentException("No codec for " + compression);
    }

    /**
     * Resolves an id byte read from a file.
     *
     * @throws IOException if the id is not a known codec
     */
    static ChunkCodec fromId(int id) throws IOException {
        for (ChunkCodec codec : values()) {
            if (codec.id == id) {
                return codec;
            }
        }
        throw new IOException("Unknown chunk compression " + id);
    }

    private static byte[] compressBlock(Compressor compressor, byte[] raw) {
        byte[] output = new byte[compressor.maxCompressedLength(raw.length)];
        int written = compressor.compress(raw, 0, raw.length, output, 0, output.length);
        return Arrays.copyOf(output, written);
    }

    private static byte[] decompressBlock(Decompressor decompressor, byte[] stored, int rawLength)
            throws IOException {
        byte[] raw = new byte[rawLength];
        try {
            int written = decompressor.decompress(stored, 0, stored.length, raw, 0, rawLength);
            if (written != rawLength) {
                throw new IOException("Chunk corrupt: decoded %d bytes, expected %d".formatted(written, rawLength));
            }
            return raw;
        } catch (MalformedInputException e) {
            throw new IOException("Chunk corrupt: " + e.getMessage(), e);
        }
    }
}
