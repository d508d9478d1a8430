package org.alphacheck.png.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.alphacheck.png.DecompressionException;
import org.alphacheck.png.PngTestImages;
import org.alphacheck.png.StructuralException;
import org.alphacheck.png.chunk.Chunk;
import org.alphacheck.png.chunk.ChunkReader;
import org.alphacheck.png.chunk.ChunkSequence;
import org.alphacheck.png.filter.FilterType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link StreamReassembler}. The decompressor is mocked so the tests see exactly
 * which bytes are handed to it.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class StreamReassemblerTest {

    @Mock
    private Decompressor decompressor;

    private static ChunkSequence sequence(Chunk... chunks) {
        return new ChunkSequence(List.of(chunks), -1);
    }

    @Test
    void reassemble_concatenatesIdatPayloadsInOrder() throws Exception {
        when(decompressor.inflate(any())).thenReturn(new byte[]{42});
        ChunkSequence chunks = sequence(
            new Chunk(Chunk.IHDR, new byte[13], 8),
            new Chunk(Chunk.IDAT, new byte[]{1, 2}, 33),
            new Chunk("tEXt", new byte[]{99}, 47),
            new Chunk(Chunk.IDAT, new byte[]{}, 60),
            new Chunk(Chunk.IDAT, new byte[]{3, 4, 5}, 72),
            new Chunk(Chunk.IEND, new byte[0], 87));

        byte[] inflated = new StreamReassembler(decompressor).reassemble(chunks);

        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(decompressor).inflate(captor.capture());
        assertThat(captor.getValue()).containsExactly(1, 2, 3, 4, 5);
        assertThat(inflated).containsExactly(42);
    }

    @Test
    void reassemble_noIdat_throwsStructuralWithoutInflating() throws Exception {
        ChunkSequence chunks = sequence(new Chunk(Chunk.IHDR, new byte[13], 8));

        assertThatThrownBy(() -> new StreamReassembler(decompressor).reassemble(chunks))
            .isInstanceOf(StructuralException.class)
            .hasMessageContaining("missing IDAT");
        verify(decompressor, never()).inflate(any());
    }

    @Test
    void reassemble_decompressionFailure_propagates() throws Exception {
        DecompressionException failure = new DecompressionException("boom");
        when(decompressor.inflate(any())).thenThrow(failure);
        ChunkSequence chunks = sequence(new Chunk(Chunk.IDAT, new byte[]{1}, 8));

        assertThatThrownBy(() -> new StreamReassembler(decompressor).reassemble(chunks))
            .isSameAs(failure);
    }

    @Test
    void reassemble_streamSplitAtArbitraryPoints_inflatesToOriginal() throws Exception {
        byte[] raster = new byte[64 * 4];
        for (int i = 0; i < raster.length; i++) {
            raster[i] = (byte) (i * 7);
        }
        byte[] png = PngTestImages.builder(8, 8, 6).raster(raster).idatChunks(7).build();
        ChunkSequence chunks = new ChunkReader().read(png);
        assertThat(chunks.all(Chunk.IDAT)).hasSize(7);

        byte[] inflated = new StreamReassembler(new ZlibDecompressor()).reassemble(chunks);

        assertThat(inflated).hasSize(8 * (1 + 8 * 4));
        assertThat(inflated).isEqualTo(PngTestImages.filter(raster, 32, 4, FilterType.NONE));
    }
}
