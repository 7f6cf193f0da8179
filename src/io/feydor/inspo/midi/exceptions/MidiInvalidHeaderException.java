package io.feydor.inspo.midi.exceptions;

/**
 * Throws when the bytes at the start of a file are not a valid MIDI Header
 */
public final class MidiInvalidHeaderException extends MidiFeatureException {
    public MidiInvalidHeaderException(String message) {
        super(message);
    }

    @Override
    public Kind kind() {
        return Kind.INVALID_HEADER;
    }
}
