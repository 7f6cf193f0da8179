package io.feydor.inspo.midi;

import io.feydor.inspo.midi.exceptions.MidiTruncatedException;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Decodes the generic chunk framing shared by the header and every track:
 * <pre>
 *   &lt;Chunk&gt; = &lt;id:4B&gt; &lt;chunklen:4B&gt; &lt;data:chunklen B&gt;
 * </pre>
 */
public final class ChunkReader {
    /** id + length */
    public static final int FRAME_BYTES = 8;

    private ChunkReader() {}

    /**
     * Reads the next chunk
     * @param cursor positioned at the start of a chunk frame
     * @return the chunk, or empty when fewer than 8 bytes remain (the normal end of the file)
     * @throws MidiTruncatedException When the frame is complete but its data is short
     */
    public static Optional<MidiChunk> nextChunk(ByteCursor cursor) {
        if (cursor.remaining() < FRAME_BYTES) {
            return Optional.empty();
        }

        int frameStart = cursor.position();
        byte[] id = cursor.readBytes(4);
        long len = cursor.readU32BE();
        if (len > cursor.remaining()) {
            var chunk = new String(id, StandardCharsets.US_ASCII);
            throw new MidiTruncatedException(String.format("Chunk '%s' at offset %d declares %d bytes but only %d remain",
                    chunk, frameStart, len, cursor.remaining()));
        }

        return Optional.of(new MidiChunk(id, len, cursor.readBytes((int) len)));
    }
}
