package org.alphacheck.png.filter;

import org.alphacheck.png.StructuralException;
import org.alphacheck.png.UnsupportedFeatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undoes PNG scanline filtering.
 * <p>
 * The inflated image stream is a sequence of rows, each prefixed by a filter type byte:
 * <pre>
 *   [type][rowLength bytes][type][rowLength bytes]...
 * </pre>
 * Rows are reconstructed strictly top to bottom and each row strictly left to right, because
 * Sub, Up, Average and Paeth predict from bytes that must already be reconstructed. The row
 * above the first one is a virtual all-zero row, and neighbours left of the first pixel
 * ({@code x < bpp}) read as 0.
 * <p>
 * <strong>Thread Safety:</strong> Stateless. All iteration state lives in a {@link Cursor}
 * created per call, so one instance can serve concurrent decodes.
 */
public class ScanlineReconstructor {

    private static final Logger log = LoggerFactory.getLogger(ScanlineReconstructor.class);

    /**
     * Reconstructs the raw samples of an image.
     *
     * @param filtered      inflated stream, filter byte plus row data for every row
     * @param width         pixels per row
     * @param height        number of rows
     * @param bytesPerPixel bytes per complete pixel (the Sub/Average/Paeth left offset)
     * @return the reconstructed raster
     * @throws StructuralException if {@code filtered.length != height * (1 + width * bytesPerPixel)}
     * @throws UnsupportedFeatureException on a filter type byte outside 0-4, or if the raster
     *                                     would not fit in a Java array
     */
    public Raster reconstruct(byte[] filtered, int width, int height, int bytesPerPixel)
            throws StructuralException, UnsupportedFeatureException {
        if (width <= 0 || height <= 0 || bytesPerPixel <= 0) {
            throw new IllegalArgumentException("invalid geometry " + width + "x" + height + "x" + bytesPerPixel);
        }

        long rowLength = (long) width * bytesPerPixel;
        long rasterSize = rowLength * height;
        long expected = (rowLength + 1) * height;
        if (expected > Integer.MAX_VALUE) {
            throw new UnsupportedFeatureException("image too large: " + width + "x" + height);
        }
        if (filtered.length != expected) {
            throw new StructuralException("unexpected decompressed size: expected " + expected
                + " bytes, got " + filtered.length);
        }

        byte[] out = new byte[(int) rasterSize];
        Cursor cursor = new Cursor((int) rowLength, bytesPerPixel);
        while (cursor.row < height) {
            reconstructRow(filtered, out, cursor);
        }

        log.debug("Reconstructed {}x{} raster ({} bytes per pixel)", width, height, bytesPerPixel);
        return new Raster(width, height, bytesPerPixel, out);
    }

    /**
     * Reconstructs the row at the cursor and advances the cursor to the next row.
     */
    private void reconstructRow(byte[] filtered, byte[] out, Cursor cursor) throws UnsupportedFeatureException {
        FilterType type = FilterType.fromCode(filtered[cursor.input] & 0xFF);
        int rowLength = cursor.rowLength;
        int bpp = cursor.bytesPerPixel;
        int src = cursor.input + 1;
        int dst = cursor.row * rowLength;
        // previous row start, or -1 on the first row (virtual zero row)
        int prev = cursor.row == 0 ? -1 : dst - rowLength;

        System.arraycopy(filtered, src, out, dst, rowLength);

        if (type != FilterType.NONE) {
            for (int x = 0; x < rowLength; x++) {
                int left = x >= bpp ? out[dst + x - bpp] & 0xFF : 0;
                int up = prev >= 0 ? out[prev + x] & 0xFF : 0;
                int upLeft = prev >= 0 && x >= bpp ? out[prev + x - bpp] & 0xFF : 0;
                out[dst + x] = (byte) (out[dst + x] + type.predict(left, up, upLeft));
            }
        }

        cursor.input = src + rowLength;
        cursor.row++;
    }

    /**
     * Position of one reconstruction pass: the next row to produce and the offset of its
     * filter type byte in the input.
     */
    private static final class Cursor {
        final int rowLength;
        final int bytesPerPixel;
        int row;
        int input;

        Cursor(int rowLength, int bytesPerPixel) {
            this.rowLength = rowLength;
            this.bytesPerPixel = bytesPerPixel;
        }
    }
}
