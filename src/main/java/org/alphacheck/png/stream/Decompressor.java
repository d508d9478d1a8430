package org.alphacheck.png.stream;

import org.alphacheck.png.DecompressionException;

/**
 * Generic decompression collaborator used by {@link StreamReassembler}.
 * <p>
 * The decoder never does its own entropy decoding; implementations inflate a complete
 * zlib stream and report malformed input as a {@link DecompressionException}.
 */
@FunctionalInterface
public interface Decompressor {

    /**
     * Inflates a complete compressed stream.
     *
     * @param compressed the compressed bytes
     * @return the inflated bytes
     * @throws DecompressionException if the stream is malformed or incomplete
     */
    byte[] inflate(byte[] compressed) throws DecompressionException;
}
