package io.feydor.inspo.midi.exceptions;

/**
 * Thrown when feature extraction cannot be completed. There are exactly three kinds of failure,
 * see {@link Kind}; callers can switch on {@link #kind()} instead of matching messages.
 */
public abstract sealed class MidiFeatureException extends RuntimeException
        permits MidiNotFoundException, MidiInvalidHeaderException, MidiTruncatedException {

    public enum Kind {
        /** The input path does not reference an existing file */
        NOT_FOUND,
        /** The file does not start with a complete MThd header */
        INVALID_HEADER,
        /** A chunk declares more payload than the file holds */
        TRUNCATED
    }

    protected MidiFeatureException(String message) {
        super(message);
    }

    public abstract Kind kind();
}
