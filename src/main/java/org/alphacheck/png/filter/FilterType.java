package org.alphacheck.png.filter;

import org.alphacheck.png.UnsupportedFeatureException;

/**
 * The five PNG scanline filter types (filter method 0).
 * <p>
 * Each constant knows how to undo its own transform for one byte. Values outside 0-4
 * are rejected, since a row cannot be reconstructed without knowing its transform.
 */
public enum FilterType {
    NONE {
        @Override
        int predict(int left, int up, int upLeft) {
            return 0;
        }
    },
    SUB {
        @Override
        int predict(int left, int up, int upLeft) {
            return left;
        }
    },
    UP {
        @Override
        int predict(int left, int up, int upLeft) {
            return up;
        }
    },
    AVERAGE {
        @Override
        int predict(int left, int up, int upLeft) {
            return (left + up) >>> 1;
        }
    },
    PAETH {
        @Override
        int predict(int left, int up, int upLeft) {
            return paeth(left, up, upLeft);
        }
    };

    private static final FilterType[] BY_CODE = values();

    /**
     * Predicts a byte from its reconstructed neighbours. All arguments are unsigned (0-255).
     *
     * @param left   byte {@code bpp} positions to the left in the current row, or 0
     * @param up     byte at the same position in the previous row, or 0 on the first row
     * @param upLeft byte {@code bpp} positions to the left in the previous row, or 0
     * @return the predictor, 0-255
     */
    abstract int predict(int left, int up, int upLeft);

    /**
     * @return the filter type byte as it appears in the stream
     */
    public int code() {
        return ordinal();
    }

    /**
     * Maps a filter type byte to its constant.
     *
     * @param code unsigned filter type byte
     * @throws UnsupportedFeatureException if {@code code} is not 0-4
     */
    public static FilterType fromCode(int code) throws UnsupportedFeatureException {
        if (code < 0 || code >= BY_CODE.length) {
            throw new UnsupportedFeatureException("unknown PNG filter type: " + code);
        }
        return BY_CODE[code];
    }

    /**
     * The Paeth predictor: returns whichever of {@code a} (left), {@code b} (up) and
     * {@code c} (up-left) is closest to {@code a + b - c}. Ties go to {@code a}, then {@code b}.
     */
    public static int paeth(int a, int b, int c) {
        int p = a + b - c;
        int pa = Math.abs(p - a);
        int pb = Math.abs(p - b);
        int pc = Math.abs(p - c);
        if (pa <= pb && pa <= pc) {
            return a;
        }
        if (pb <= pc) {
            return b;
        }
        return c;
    }
}
