package org.alphacheck.png;

/**
 * Thrown when the container is well framed but structurally wrong: missing {@code IHDR},
 * missing {@code IDAT}, or a decompressed stream whose size does not match the header.
 */
public class StructuralException extends PngDecodeException {

    /**
     * @param message the detail message
     */
    public StructuralException(String message) {
        super(ErrorKind.STRUCTURAL, message);
    }

    /**
     * @param message the detail message
     * @param cause the underlying failure
     */
    public StructuralException(String message, Throwable cause) {
        super(ErrorKind.STRUCTURAL, message, cause);
    }
}
