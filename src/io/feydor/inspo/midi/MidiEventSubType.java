package io.feydor.inspo.midi;

/** The channel voice messages, identified by the upper nibble of their status byte */
public enum MidiEventSubType {
    NOTE_OFF(0x8, 2),
    NOTE_ON(0x9, 2),
    POLYPHONIC_PRESSURE(0xA, 2),
    CONTROLLER(0xB, 2),
    PROGRAM_CHANGE(0xC, 1),
    CHANNEL_PRESSURE(0xD, 1),
    PITCH_BEND(0xE, 2);

    /** The upper nibble of the status byte */
    public final int nibble;

    /** The number of data bytes following the status byte */
    public final int dataLength;

    MidiEventSubType(int nibble, int dataLength) {
        this.nibble = nibble;
        this.dataLength = dataLength;
    }

    /**
     * @param status a channel voice status byte, 0x80 to 0xEF
     * @throws IllegalArgumentException When the status is not a channel voice message
     */
    public static MidiEventSubType fromStatusByte(int status) {
        return switch ((status >> 4) & 0xF) {
            case 0x8 -> NOTE_OFF;
            case 0x9 -> NOTE_ON;
            case 0xA -> POLYPHONIC_PRESSURE;
            case 0xB -> CONTROLLER;
            case 0xC -> PROGRAM_CHANGE;
            case 0xD -> CHANNEL_PRESSURE;
            case 0xE -> PITCH_BEND;
            default -> throw new IllegalArgumentException(String.format("Not a channel voice status: %02x", status));
        };
    }

    /** The zero-based channel (0-15) encoded in the lower nibble of a channel voice status byte */
    public static int channelOf(int status) {
        return status & 0xF;
    }
}
