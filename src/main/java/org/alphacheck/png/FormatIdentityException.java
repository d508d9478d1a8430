package org.alphacheck.png;

/**
 * Thrown when the input does not start with the PNG signature, i.e. it is not a PNG file at all.
 */
public class FormatIdentityException extends PngDecodeException {

    /**
     * @param message the detail message
     */
    public FormatIdentityException(String message) {
        super(ErrorKind.FORMAT_IDENTITY, message);
    }

    /**
     * @param message the detail message
     * @param cause the underlying failure
     */
    public FormatIdentityException(String message, Throwable cause) {
        super(ErrorKind.FORMAT_IDENTITY, message, cause);
    }
}
