package org.alphacheck.png.chunk;

import org.alphacheck.png.UnsupportedFeatureException;

/**
 * PNG colour types recognised by the decoder, with their 8-bit sample layout.
 * <p>
 * The set is closed: any other colour type value is rejected with an
 * {@link UnsupportedFeatureException} rather than ignored.
 */
public enum ColorModel {
    GREYSCALE(0, 1),
    TRUECOLOR(2, 3),
    INDEXED(3, 1),
    GREYSCALE_ALPHA(4, 2),
    TRUECOLOR_ALPHA(6, 4);

    private final int code;
    private final int bytesPerPixel;

    ColorModel(int code, int bytesPerPixel) {
        this.code = code;
        this.bytesPerPixel = bytesPerPixel;
    }

    /**
     * @return the colour type byte as stored in {@code IHDR}
     */
    public int code() {
        return code;
    }

    /**
     * @return bytes per pixel at bit depth 8
     */
    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    /**
     * Maps an {@code IHDR} colour type byte to its model.
     *
     * @throws UnsupportedFeatureException for values outside the enumeration
     */
    public static ColorModel fromCode(int code) throws UnsupportedFeatureException {
        for (ColorModel model : values()) {
            if (model.code == code) {
                return model;
            }
        }
        throw new UnsupportedFeatureException("unsupported color type: " + code);
    }
}
