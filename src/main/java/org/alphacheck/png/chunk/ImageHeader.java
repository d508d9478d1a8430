package org.alphacheck.png.chunk;

import org.alphacheck.png.StructuralException;
import org.alphacheck.png.UnsupportedFeatureException;

/**
 * Decoded {@code IHDR} chunk.
 * <p>
 * Layout (13 bytes): width u32, height u32, bit depth u8, colour type u8, then compression,
 * filter and interlace method bytes. The compression and filter methods are carried for
 * reporting only; interlacing is accepted here and rejected by the decoder once it needs pixels.
 *
 * @param width             image width in pixels, &gt; 0
 * @param height            image height in pixels, &gt; 0
 * @param bitDepth          bits per sample; always 8 once validated
 * @param colorModel        declared colour type
 * @param compressionMethod compression method byte (0 for zlib)
 * @param filterMethod      filter method byte (0 for adaptive filtering)
 * @param interlaceMethod   interlace method byte (0 none, 1 Adam7)
 */
public record ImageHeader(int width, int height, int bitDepth, ColorModel colorModel,
                          int compressionMethod, int filterMethod, int interlaceMethod) {

    /** Payload size of a well-formed {@code IHDR}. */
    public static final int LENGTH = 13;

    /** The only bit depth this decoder supports. */
    public static final int SUPPORTED_BIT_DEPTH = 8;

    /**
     * Interprets the first chunk of a container as the image header.
     *
     * @param chunks the container's chunks; the header must be chunk index 0
     * @return the validated header
     * @throws StructuralException if the first chunk is not a 13-byte {@code IHDR},
     *                             or width/height is zero
     * @throws UnsupportedFeatureException for bit depth != 8 or an unknown colour type
     */
    public static ImageHeader fromChunks(ChunkSequence chunks)
            throws StructuralException, UnsupportedFeatureException {
        Chunk first = chunks.first()
            .filter(chunk -> chunk.is(Chunk.IHDR))
            .orElseThrow(() -> new StructuralException("missing IHDR"));
        return fromChunk(first);
    }

    /**
     * Decodes an {@code IHDR} chunk.
     *
     * @see #fromChunks(ChunkSequence)
     */
    public static ImageHeader fromChunk(Chunk chunk) throws StructuralException, UnsupportedFeatureException {
        if (!chunk.is(Chunk.IHDR) || chunk.length() != LENGTH) {
            throw new StructuralException("missing IHDR (found " + chunk.type() + " with "
                + chunk.length() + " bytes)");
        }

        byte[] data = chunk.data();
        int width = ChunkReader.readInt(data, 0);
        int height = ChunkReader.readInt(data, 4);
        int bitDepth = data[8] & 0xFF;
        int colorType = data[9] & 0xFF;
        int compression = data[10] & 0xFF;
        int filter = data[11] & 0xFF;
        int interlace = data[12] & 0xFF;

        // u32 values above 2^31 - 1 show up negative here
        if (width == 0 || height == 0) {
            throw new StructuralException("invalid image size " + Integer.toUnsignedString(width)
                + "x" + Integer.toUnsignedString(height));
        }
        if (width < 0 || height < 0) {
            throw new UnsupportedFeatureException("image too large: " + Integer.toUnsignedString(width)
                + "x" + Integer.toUnsignedString(height));
        }
        if (bitDepth != SUPPORTED_BIT_DEPTH) {
            throw new UnsupportedFeatureException("unsupported bit depth: " + bitDepth);
        }
        ColorModel colorModel = ColorModel.fromCode(colorType);

        return new ImageHeader(width, height, bitDepth, colorModel, compression, filter, interlace);
    }

    public boolean isInterlaced() {
        return interlaceMethod != 0;
    }

    /**
     * @return bytes per reconstructed scanline, excluding the filter-type byte
     * @throws UnsupportedFeatureException if the row does not fit in an {@code int}
     */
    public int rowLength() throws UnsupportedFeatureException {
        long rowLength = (long) width * colorModel.bytesPerPixel();
        if (rowLength > Integer.MAX_VALUE) {
            throw new UnsupportedFeatureException("image too wide: " + width);
        }
        return (int) rowLength;
    }
}
