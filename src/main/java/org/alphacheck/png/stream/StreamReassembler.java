package org.alphacheck.png.stream;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Objects;

import org.alphacheck.png.DecompressionException;
import org.alphacheck.png.StructuralException;
import org.alphacheck.png.chunk.Chunk;
import org.alphacheck.png.chunk.ChunkSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins the {@code IDAT} fragments of a container into one zlib stream and inflates it.
 * <p>
 * A PNG encoder may split its single compressed stream across any number of {@code IDAT}
 * chunks at arbitrary byte positions, so fragments are concatenated in encounter order
 * before anything is handed to the {@link Decompressor}.
 */
public class StreamReassembler {

    private static final Logger log = LoggerFactory.getLogger(StreamReassembler.class);

    private final Decompressor decompressor;

    public StreamReassembler(Decompressor decompressor) {
        this.decompressor = Objects.requireNonNull(decompressor, "decompressor");
    }

    /**
     * Concatenates all {@code IDAT} payloads in order.
     *
     * @throws StructuralException if the container has no {@code IDAT} chunk
     */
    public byte[] concatenate(ChunkSequence chunks) throws StructuralException {
        List<Chunk> fragments = chunks.all(Chunk.IDAT);
        if (fragments.isEmpty()) {
            throw new StructuralException("missing IDAT");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Chunk fragment : fragments) {
            out.write(fragment.data(), 0, fragment.length());
        }
        return out.toByteArray();
    }

    /**
     * Reassembles and inflates the image data stream.
     *
     * @return the filtered scanline bytes
     * @throws StructuralException if the container has no {@code IDAT} chunk
     * @throws DecompressionException if the reassembled stream cannot be inflated
     */
    public byte[] reassemble(ChunkSequence chunks) throws StructuralException, DecompressionException {
        byte[] compressed = concatenate(chunks);
        byte[] inflated = decompressor.inflate(compressed);
        log.debug("Inflated {} IDAT bytes to {} bytes", compressed.length, inflated.length);
        return inflated;
    }
}
