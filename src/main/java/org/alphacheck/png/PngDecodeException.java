package org.alphacheck.png;

/**
 * Base class for all failures raised while decoding a PNG container.
 * <p>
 * This is a checked exception: callers that evaluate several assets catch it per asset,
 * report it and continue with the remaining assets.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * try {
 *     boolean transparent = decoder.hasTransparency(bytes);
 * } catch (PngDecodeException e) {
 *     log.warn("Skipping {} ({}): {}", path, e.getKind(), e.getMessage());
 * }
 * }</pre>
 */
public abstract class PngDecodeException extends Exception {

    private final ErrorKind kind;

    protected PngDecodeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PngDecodeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * @return the category of this failure
     */
    public ErrorKind getKind() {
        return kind;
    }
}
