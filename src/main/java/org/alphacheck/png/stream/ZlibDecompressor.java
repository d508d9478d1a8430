package org.alphacheck.png.stream;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import org.alphacheck.png.DecompressionException;

/**
 * {@link Decompressor} backed by the JDK's {@link Inflater} (zlib wrapper, as used by PNG).
 * <p>
 * Output is capped at {@code maxInflatedBytes} so a small, highly compressed input cannot
 * exhaust the heap.
 */
public class ZlibDecompressor implements Decompressor {

    /** Default output cap (256 MiB). */
    public static final long DEFAULT_MAX_INFLATED_BYTES = 256L * 1024 * 1024;

    private static final int BUFFER_SIZE = 16 * 1024;

    private final long maxInflatedBytes;

    public ZlibDecompressor() {
        this(DEFAULT_MAX_INFLATED_BYTES);
    }

    /**
     * @param maxInflatedBytes maximum number of bytes to produce (must be &gt; 0)
     * @throws IllegalArgumentException if {@code maxInflatedBytes} is not positive
     */
    public ZlibDecompressor(long maxInflatedBytes) {
        if (maxInflatedBytes <= 0) {
            throw new IllegalArgumentException("maxInflatedBytes must be > 0, got: " + maxInflatedBytes);
        }
        this.maxInflatedBytes = Math.min(maxInflatedBytes, Integer.MAX_VALUE - 8);
    }

    @Override
    public byte[] inflate(byte[] compressed) throws DecompressionException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(initialCapacity(compressed.length));
            byte[] buffer = new byte[BUFFER_SIZE];

            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && !inflater.finished()) {
                    if (inflater.needsDictionary()) {
                        throw new DecompressionException("zlib stream requires a preset dictionary");
                    }
                    throw new DecompressionException("zlib stream is incomplete");
                }
                if (out.size() + (long) n > maxInflatedBytes) {
                    throw new DecompressionException("inflated data exceeds " + maxInflatedBytes + " bytes");
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new DecompressionException("malformed zlib stream: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    /**
     * @return output buffer size to start with: a guess from the input size, never above the cap
     */
    int initialCapacity(int compressedLength) {
        long guess = Math.max(compressedLength * 4L, BUFFER_SIZE);
        return (int) Math.min(maxInflatedBytes, guess);
    }
}
