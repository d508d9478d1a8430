package org.alphacheck.png.chunk;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.alphacheck.png.FormatIdentityException;
import org.alphacheck.png.TruncationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the chunk sequence of a PNG container held fully in memory.
 * <p>
 * Layout of each chunk:
 * <pre>
 *   length : u32 big-endian
 *   type   : 4 ASCII bytes
 *   data   : length bytes
 *   crc    : 4 bytes (read and discarded)
 * </pre>
 * Reading stops at the first {@code IEND}; any trailing bytes after it are ignored.
 * <p>
 * <strong>Thread Safety:</strong> Stateless, safe to share.
 */
public final class ChunkReader {

    private static final Logger log = LoggerFactory.getLogger(ChunkReader.class);

    /** The fixed 8-byte PNG signature. */
    static final byte[] SIGNATURE = {
        (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'
    };

    private static final int LENGTH_AND_TYPE = 8;
    private static final int CRC = 4;

    /**
     * Parses all chunks of the given container.
     *
     * @param data complete container bytes
     * @return the chunks in file order, up to and including {@code IEND}
     * @throws FormatIdentityException if {@code data} does not start with the PNG signature
     * @throws TruncationException if a chunk extends past the end of {@code data}
     */
    public ChunkSequence read(byte[] data) throws FormatIdentityException, TruncationException {
        if (!hasSignature(data)) {
            throw new FormatIdentityException("not a PNG file (signature mismatch)");
        }

        List<Chunk> chunks = new ArrayList<>();
        int position = SIGNATURE.length;
        int terminalOffset = -1;

        while (position < data.length) {
            if (position + LENGTH_AND_TYPE > data.length) {
                throw new TruncationException("<header>",
                    "truncated chunk header at offset " + position);
            }

            int length = readInt(data, position);
            String type = new String(data, position + 4, 4, StandardCharsets.ISO_8859_1);

            // length is unsigned; anything above Integer.MAX_VALUE cannot be present in a byte[]
            long end = (long) position + LENGTH_AND_TYPE + Integer.toUnsignedLong(length) + CRC;
            if (length < 0 || end > data.length) {
                throw new TruncationException(type, "truncated " + type + " chunk at offset " + position
                    + ": declares " + Integer.toUnsignedLong(length) + " bytes, "
                    + (data.length - position - LENGTH_AND_TYPE) + " available");
            }

            int start = position + LENGTH_AND_TYPE;
            chunks.add(new Chunk(type, Arrays.copyOfRange(data, start, start + length), position));

            if (Chunk.IEND.equals(type)) {
                terminalOffset = position;
                break;
            }
            position = (int) end;
        }

        if (log.isDebugEnabled()) {
            log.debug("Read {} chunks ({} bytes, terminated={})", chunks.size(), data.length, terminalOffset >= 0);
        }
        return new ChunkSequence(chunks, terminalOffset);
    }

    /**
     * Checks whether the data begins with the PNG signature.
     */
    public static boolean hasSignature(byte[] data) {
        if (data == null || data.length < SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < SIGNATURE.length; i++) {
            if (data[i] != SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    static int readInt(byte[] data, int offset) {
        return (data[offset] & 0xFF) << 24
            | (data[offset + 1] & 0xFF) << 16
            | (data[offset + 2] & 0xFF) << 8
            | (data[offset + 3] & 0xFF);
    }
}
