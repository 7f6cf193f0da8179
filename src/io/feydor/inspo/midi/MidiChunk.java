package io.feydor.inspo.midi;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A MidiChunk has:
 * <ul>
 *     <li>an 8-byte frame: &lt;id - bytes 0-3&gt;&lt;chunklen - bytes 4-7, big-endian&gt;</li>
 *     <li>exactly chunklen bytes of data</li>
 * </ul>
 *
 * @param id   The four bytes identifying the chunk, e.g. "MTrk"
 * @param len  The declared length, an unsigned 32-bit value
 * @param data The payload, always {@code len} bytes long
 */
public record MidiChunk(byte[] id, long len, byte[] data) {
    public MidiChunk {
        if (id.length != 4) {
            throw new IllegalArgumentException("A chunk id is 4 bytes. Given: " + Arrays.toString(id));
        }
        if (data.length != len) {
            throw new IllegalArgumentException("A chunk's data must match its declared length: len=" + len
                    + ", data.length=" + data.length);
        }
    }

    public boolean is(MidiIdentifier identifier) {
        return identifier.matches(id);
    }

    /** The id as text, non-ASCII bytes replaced */
    public String idString() {
        return new String(id, StandardCharsets.US_ASCII);
    }

    @Override
    public String toString() {
        return "MidiChunk{" +
                "id=" + idString() +
                ", len=" + len +
                '}';
    }
}
