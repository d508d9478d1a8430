package org.alphacheck.png.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Result of {@link ChunkReader#read(byte[])}: the chunks of one container in file order.
 *
 * @param chunks         chunks up to and including {@code IEND}
 * @param terminalOffset offset of the {@code IEND} chunk, or {@code -1} if the data ended without one
 */
public record ChunkSequence(List<Chunk> chunks, int terminalOffset) {

    public ChunkSequence {
        chunks = List.copyOf(chunks);
    }

    public boolean isTerminated() {
        return terminalOffset >= 0;
    }

    /**
     * @return the first chunk, if any
     */
    public Optional<Chunk> first() {
        return chunks.isEmpty() ? Optional.empty() : Optional.of(chunks.get(0));
    }

    /**
     * Returns the last chunk of the given type. When a chunk type appears more than once
     * (e.g. a repeated {@code tRNS}) the later occurrence wins.
     */
    public Optional<Chunk> last(String type) {
        for (int i = chunks.size() - 1; i >= 0; i--) {
            if (chunks.get(i).is(type)) {
                return Optional.of(chunks.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * @return all chunks of the given type, in encounter order
     */
    public List<Chunk> all(String type) {
        List<Chunk> result = new ArrayList<>();
        for (Chunk chunk : chunks) {
            if (chunk.is(type)) {
                result.add(chunk);
            }
        }
        return result;
    }
}
