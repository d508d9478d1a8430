package org.alphacheck.png.chunk;

import java.util.Objects;

/**
 * One length-prefixed, typed record of a PNG container.
 * <p>
 * The CRC trailer is not retained; this decoder never verifies it.
 *
 * @param type   four-character chunk type, e.g. {@code "IHDR"}
 * @param data   chunk payload (owned by this record, not copied on access)
 * @param offset byte offset of the chunk's length field within the container
 */
public record Chunk(String type, byte[] data, int offset) {

    public static final String IHDR = "IHDR";
    public static final String PLTE = "PLTE";
    public static final String TRNS = "tRNS";
    public static final String IDAT = "IDAT";
    public static final String IEND = "IEND";

    public Chunk {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
    }

    /**
     * @return payload length in bytes
     */
    public int length() {
        return data.length;
    }

    public boolean is(String chunkType) {
        return type.equals(chunkType);
    }

    /**
     * Critical chunks have an uppercase first letter (ancillary bit clear).
     */
    public boolean isCritical() {
        return (type.charAt(0) & 0x20) == 0;
    }

    @Override
    public String toString() {
        return type + "@" + offset + "[" + data.length + "]";
    }
}
