package org.alphacheck.png;

import java.util.Objects;

import org.alphacheck.png.alpha.PaletteCheckMode;
import org.alphacheck.png.alpha.TransparencyEvaluator;
import org.alphacheck.png.chunk.Chunk;
import org.alphacheck.png.chunk.ChunkReader;
import org.alphacheck.png.chunk.ChunkSequence;
import org.alphacheck.png.chunk.ImageHeader;
import org.alphacheck.png.filter.Raster;
import org.alphacheck.png.filter.ScanlineReconstructor;
import org.alphacheck.png.stream.Decompressor;
import org.alphacheck.png.stream.StreamReassembler;
import org.alphacheck.png.stream.ZlibDecompressor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers one question about a PNG file: does it contain at least one non-opaque pixel?
 * <p>
 * Pipeline:
 * <pre>
 *   bytes -> ChunkReader -> ImageHeader / tRNS / IDAT
 *         -> StreamReassembler (inflate) -> ScanlineReconstructor -> TransparencyEvaluator
 * </pre>
 * <strong>Usage:</strong>
 * <pre>{@code
 * PngTransparencyDecoder decoder = new PngTransparencyDecoder();
 * boolean transparent = decoder.hasTransparency(Files.readAllBytes(path));
 * }</pre>
 * <p>
 * <strong>Thread Safety:</strong> Immutable; every call owns its own buffers, so one instance
 * can decode several assets concurrently.
 */
public class PngTransparencyDecoder {

    private static final Logger log = LoggerFactory.getLogger(PngTransparencyDecoder.class);

    private final ChunkReader chunkReader = new ChunkReader();
    private final ScanlineReconstructor reconstructor = new ScanlineReconstructor();
    private final StreamReassembler reassembler;
    private final TransparencyEvaluator evaluator;

    public PngTransparencyDecoder() {
        this(new ZlibDecompressor(), PaletteCheckMode.TABLE);
    }

    /**
     * @param decompressor zlib collaborator used to inflate the {@code IDAT} stream
     * @param paletteMode  how indexed images are judged
     */
    public PngTransparencyDecoder(Decompressor decompressor, PaletteCheckMode paletteMode) {
        this.reassembler = new StreamReassembler(Objects.requireNonNull(decompressor, "decompressor"));
        this.evaluator = new TransparencyEvaluator(paletteMode);
    }

    /**
     * Greyscale and truecolour images without an alpha channel are answered from the header
     * alone; their pixel data is neither inflated nor checked.
     *
     * @param data complete PNG file contents
     * @return {@code true} if at least one pixel is partially or fully transparent
     * @throws PngDecodeException if the data cannot be decoded
     */
    public boolean hasTransparency(byte[] data) throws PngDecodeException {
        ChunkSequence chunks = chunkReader.read(data);
        ImageHeader header = ImageHeader.fromChunks(chunks);
        if (!TransparencyEvaluator.canBeTransparent(header.colorModel())) {
            log.debug("{} image without alpha, skipping pixel data", header.colorModel());
            return false;
        }
        return evaluate(chunks, header).hasTransparency();
    }

    /**
     * Decodes a PNG file and evaluates its transparency.
     *
     * @param data complete PNG file contents
     * @return header, chunks, raster and the transparency answer
     * @throws FormatIdentityException if the data is not a PNG file
     * @throws TruncationException if a chunk runs past the end of the data
     * @throws StructuralException if {@code IHDR} or {@code IDAT} is missing, or the inflated
     *                             size does not match the header
     * @throws UnsupportedFeatureException for bit depth != 8, unknown colour or filter types,
     *                                     or interlacing
     * @throws DecompressionException if the {@code IDAT} stream cannot be inflated
     */
    public DecodedImage decode(byte[] data) throws PngDecodeException {
        ChunkSequence chunks = chunkReader.read(data);
        return evaluate(chunks, ImageHeader.fromChunks(chunks));
    }

    private DecodedImage evaluate(ChunkSequence chunks, ImageHeader header) throws PngDecodeException {
        if (header.isInterlaced()) {
            throw new UnsupportedFeatureException("interlaced images are not supported");
        }

        byte[] filtered = reassembler.reassemble(chunks);
        Raster raster = reconstructor.reconstruct(filtered, header.width(), header.height(),
            header.colorModel().bytesPerPixel());

        byte[] transparencyTable = chunks.last(Chunk.TRNS).map(Chunk::data).orElse(null);
        boolean transparent = evaluator.hasTransparency(header.colorModel(), raster, transparencyTable);
        return new DecodedImage(header, chunks, raster, transparent);
    }
}
