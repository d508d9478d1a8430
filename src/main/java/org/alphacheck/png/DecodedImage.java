package org.alphacheck.png;

import org.alphacheck.png.chunk.ChunkSequence;
import org.alphacheck.png.chunk.ImageHeader;
import org.alphacheck.png.filter.Raster;

/**
 * Everything the decoder learned about one container.
 *
 * @param header          the validated {@code IHDR}
 * @param chunks          all chunks read, in file order
 * @param raster          reconstructed samples
 * @param hasTransparency whether at least one pixel is not fully opaque
 */
public record DecodedImage(ImageHeader header, ChunkSequence chunks, Raster raster, boolean hasTransparency) {
}
