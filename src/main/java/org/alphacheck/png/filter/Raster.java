package org.alphacheck.png.filter;

/**
 * Reconstructed 8-bit samples of an image, rows stored top to bottom without filter bytes.
 *
 * @param width         pixels per row
 * @param height        number of rows
 * @param bytesPerPixel samples per pixel
 * @param samples       {@code height * width * bytesPerPixel} bytes
 */
public record Raster(int width, int height, int bytesPerPixel, byte[] samples) {

    public Raster {
        if ((long) width * height * bytesPerPixel != samples.length) {
            throw new IllegalArgumentException("samples length " + samples.length + " does not match "
                + width + "x" + height + "x" + bytesPerPixel);
        }
    }

    public int rowLength() {
        return width * bytesPerPixel;
    }

    /**
     * @return the unsigned sample at the given pixel and channel
     */
    public int sample(int x, int y, int channel) {
        return samples[y * rowLength() + x * bytesPerPixel + channel] & 0xFF;
    }
}
