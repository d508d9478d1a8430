package org.alphacheck.png.alpha;

import java.util.Objects;

import org.alphacheck.png.chunk.ColorModel;
import org.alphacheck.png.filter.Raster;

/**
 * Decides whether a reconstructed raster contains at least one non-opaque pixel.
 * <p>
 * Rules per colour model:
 * <ul>
 *   <li>{@link ColorModel#TRUECOLOR_ALPHA}: any alpha sample (every 4th byte, offset 3) below 255</li>
 *   <li>{@link ColorModel#INDEXED}: no {@code tRNS} means fully opaque; otherwise see
 *       {@link PaletteCheckMode}</li>
 *   <li>{@link ColorModel#GREYSCALE}, {@link ColorModel#TRUECOLOR},
 *       {@link ColorModel#GREYSCALE_ALPHA}: never transparent for this check</li>
 * </ul>
 */
public class TransparencyEvaluator {

    private static final int OPAQUE = 0xFF;

    private final PaletteCheckMode paletteMode;

    public TransparencyEvaluator() {
        this(PaletteCheckMode.TABLE);
    }

    public TransparencyEvaluator(PaletteCheckMode paletteMode) {
        this.paletteMode = Objects.requireNonNull(paletteMode, "paletteMode");
    }

    /**
     * @return {@code false} for models whose pixels are never judged transparent, so callers can
     *         answer without reconstructing the raster
     */
    public static boolean canBeTransparent(ColorModel colorModel) {
        return switch (colorModel) {
            case TRUECOLOR_ALPHA, INDEXED -> true;
            case GREYSCALE, TRUECOLOR, GREYSCALE_ALPHA -> false;
        };
    }

    /**
     * @param colorModel        the image's declared colour model
     * @param raster            reconstructed samples
     * @param transparencyTable raw {@code tRNS} payload, or {@code null} if the image has none
     * @return {@code true} if at least one sample indicates partial or full transparency
     */
    public boolean hasTransparency(ColorModel colorModel, Raster raster, byte[] transparencyTable) {
        return switch (colorModel) {
            case TRUECOLOR_ALPHA -> anyAlphaBelowOpaque(raster.samples());
            case INDEXED -> paletteHasTransparency(raster, transparencyTable);
            case GREYSCALE, TRUECOLOR, GREYSCALE_ALPHA -> false;
        };
    }

    private boolean paletteHasTransparency(Raster raster, byte[] transparencyTable) {
        if (transparencyTable == null) {
            return false;
        }
        return switch (paletteMode) {
            case TABLE -> anyBelowOpaque(transparencyTable);
            case PIXELS -> anyPixelTransparent(raster.samples(), transparencyTable);
        };
    }

    private static boolean anyAlphaBelowOpaque(byte[] rgba) {
        for (int i = 3; i < rgba.length; i += 4) {
            if ((rgba[i] & 0xFF) < OPAQUE) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyBelowOpaque(byte[] table) {
        for (byte alpha : table) {
            if ((alpha & 0xFF) < OPAQUE) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyPixelTransparent(byte[] indices, byte[] table) {
        boolean[] transparent = new boolean[table.length];
        boolean anyEntry = false;
        for (int i = 0; i < table.length; i++) {
            transparent[i] = (table[i] & 0xFF) < OPAQUE;
            anyEntry |= transparent[i];
        }
        if (!anyEntry) {
            return false;
        }
        for (byte index : indices) {
            int i = index & 0xFF;
            if (i < transparent.length && transparent[i]) {
                return true;
            }
        }
        return false;
    }
}
