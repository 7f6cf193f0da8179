package io.feydor.inspo.midi;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The 2 types of MIDI Chunks the parser understands. Any other tag is an extension chunk and gets skipped.
 */
public enum MidiIdentifier {
    MThd("MThd".getBytes(StandardCharsets.US_ASCII)),
    MTrk("MTrk".getBytes(StandardCharsets.US_ASCII));

    private final byte[] id;

    MidiIdentifier(byte[] id) {
        this.id = id;
    }

    /** True if the given 4-byte chunk tag is this identifier */
    public boolean matches(byte[] tag) {
        return Arrays.equals(id, tag);
    }
}
