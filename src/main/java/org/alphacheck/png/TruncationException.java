package org.alphacheck.png;

/**
 * Thrown when a chunk (or its header) extends past the end of the container.
 * <p>
 * The message always names the chunk type being read, or {@code "<header>"} when the
 * 8-byte length/type prefix itself does not fit.
 */
public class TruncationException extends PngDecodeException {

    private final String chunkType;

    /**
     * @param chunkType type of the chunk that could not be read completely
     * @param message the detail message
     */
    public TruncationException(String chunkType, String message) {
        super(ErrorKind.TRUNCATION, message);
        this.chunkType = chunkType;
    }

    /**
     * @return type of the offending chunk
     */
    public String getChunkType() {
        return chunkType;
    }
}
