package io.feydor.inspo.midi.exceptions;

/**
 * This exception is thrown when a read runs past the end of the available bytes
 */
public final class MidiTruncatedException extends MidiFeatureException {
    public MidiTruncatedException(String msg) {
        super(msg);
    }

    @Override
    public Kind kind() {
        return Kind.TRUNCATED;
    }
}
