package org.alphacheck.png;

/**
 * Thrown for valid PNG features this decoder deliberately does not handle: bit depths other
 * than 8, unknown colour types, interlacing and unknown filter types.
 */
public class UnsupportedFeatureException extends PngDecodeException {

    /**
     * @param message the detail message
     */
    public UnsupportedFeatureException(String message) {
        super(ErrorKind.UNSUPPORTED_FEATURE, message);
    }

    /**
     * @param message the detail message
     * @param cause the underlying failure
     */
    public UnsupportedFeatureException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_FEATURE, message, cause);
    }
}
