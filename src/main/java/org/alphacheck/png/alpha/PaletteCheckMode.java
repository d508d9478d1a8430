package org.alphacheck.png.alpha;

/**
 * How transparency is decided for indexed (palette) images.
 */
public enum PaletteCheckMode {
    /**
     * Transparent if any {@code tRNS} entry is below 255, whether or not a pixel uses it.
     * Answers "could this palette produce transparency".
     */
    TABLE,
    /**
     * Transparent if at least one pixel's palette index maps to a {@code tRNS} entry below 255.
     * Indices past the end of the table are opaque.
     */
    PIXELS
}
