package org.alphacheck.png;

/**
 * Thrown when the reassembled {@code IDAT} stream cannot be inflated.
 * <p>
 * Wraps the failure reported by the {@link org.alphacheck.png.stream.Decompressor}
 * collaborator (typically a {@link java.util.zip.DataFormatException}).
 */
public class DecompressionException extends PngDecodeException {

    /**
     * @param message the detail message
     */
    public DecompressionException(String message) {
        super(ErrorKind.DECOMPRESSION, message);
    }

    /**
     * @param message the detail message
     * @param cause the underlying decompression failure
     */
    public DecompressionException(String message, Throwable cause) {
        super(ErrorKind.DECOMPRESSION, message, cause);
    }
}
