package com.pulse.observability.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pulse.observability.config.RecordingConfig.Compression;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("ChunkCodec")
class ChunkCodecTest {

    private static final byte[] RAW = "telemetry ".repeat(64).getBytes(StandardCharsets.UTF_8);

    @ParameterizedTest
    @EnumSource(Compression.class)
    @DisplayName("should map every compression setting to a codec with a stable id")
    void shouldResolveEveryCompression(Compression compression) throws IOException {
        ChunkCodec codec = ChunkCodec.forCompression(compression);

        assertThat(codec.name()).isEqualTo(compression.name());
        assertThat(ChunkCodec.fromId(codec.id())).isSameAs(codec);
    }

    @Test
    @DisplayName("should reject ids no codec owns")
    void shouldRejectUnknownId() {
        assertThatThrownBy(() -> ChunkCodec.fromId(42))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Unknown chunk compression 42");
    }

    @ParameterizedTest
    @EnumSource(value = ChunkCodec.class, names = {"LZ4", "ZSTD", "DEFLATE"})
    @DisplayName("should fail when the stored bytes decode to a different length")
    void shouldRejectLengthMismatch(ChunkCodec codec) throws IOException {
        byte[] stored = codec.compress(RAW);

        assertThatThrownBy(() -> codec.decompress(stored, RAW.length + 1))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Chunk corrupt");
    }

    @Test
    @DisplayName("should require uncompressed chunks to store exactly their raw length")
    void shouldCheckUncompressedLengths() {
        assertThat(ChunkCodec.NONE.acceptsLengths(10, 10)).isTrue();
        assertThat(ChunkCodec.NONE.acceptsLengths(10, 11)).isFalse();
        assertThat(ChunkCodec.DEFLATE.acceptsLengths(10, Integer.MAX_VALUE)).isFalse();
    }
}
