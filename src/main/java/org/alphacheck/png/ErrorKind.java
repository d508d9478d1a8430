package org.alphacheck.png;

/**
 * Categories of decode failure.
 * <p>
 * Every kind is terminal for the asset being decoded. Malformed input does not become
 * well-formed on a retry, so callers report the failure and move on to the next asset.
 */
public enum ErrorKind {
    /** The bytes do not start with the PNG signature. */
    FORMAT_IDENTITY,
    /** A chunk claims more bytes than the container holds. */
    TRUNCATION,
    /** A required chunk is missing or the decompressed stream has the wrong size. */
    STRUCTURAL,
    /** Valid PNG, but outside what this decoder handles (bit depth, colour type, filter). */
    UNSUPPORTED_FEATURE,
    /** The zlib stream could not be inflated. */
    DECOMPRESSION
}
