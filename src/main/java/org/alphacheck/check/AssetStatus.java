package org.alphacheck.check;

/**
 * Outcome of checking one required asset.
 */
public enum AssetStatus {
    /** Decoded and contains at least one non-opaque pixel. */
    TRANSPARENT,
    /** Decoded, but every pixel is opaque. */
    OPAQUE,
    /** No file at the asset path. */
    MISSING,
    /** The file could not be read or decoded. */
    FAILED;

    /**
     * @return {@code true} only for {@link #TRANSPARENT}
     */
    public boolean passed() {
        return this == TRANSPARENT;
    }
}
