package io.feydor.inspo.midi.exceptions;

/**
 * Thrown when the MIDI file to analyze does not exist
 */
public final class MidiNotFoundException extends MidiFeatureException {
    public MidiNotFoundException(String message) {
        super(message);
    }

    @Override
    public Kind kind() {
        return Kind.NOT_FOUND;
    }
}
