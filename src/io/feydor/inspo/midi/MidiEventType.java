package io.feydor.inspo.midi;

/**
 * The families of events a track can hold, identified by an explicit (high bit set) status byte
 */
public enum MidiEventType {
    /** 0x80 to 0xEF: channel voice messages */
    MIDI,
    /** 0xFF */
    META,
    /** 0xF0 and the 0xF7 escape */
    SYSEX,
    /** 0xF1 to 0xFE: system common and real-time messages */
    SYSTEM;

    /**
     * Returns the event's type. The status must already be resolved, i.e. running status has been applied.
     *
     * @param status an unsigned status byte, 0x80 to 0xFF
     * @throws IllegalArgumentException When the byte is a data byte (below 0x80)
     */
    public static MidiEventType fromStatusByte(int status) {
        if (status < 0x80 || status > 0xFF) {
            throw new IllegalArgumentException(String.format("Not a status byte: %02x", status));
        }
        return switch (status) {
            case 0xFF -> META;
            case 0xF0, 0xF7 -> SYSEX;
            default -> status >= 0xF0 ? SYSTEM : MIDI;
        };
    }

    /**
     * The standard number of data bytes that follow a system common/real-time status. Song position pointer carries
     * two, MTC quarter frame and song select carry one, the rest none.
     */
    public static int systemDataLength(int status) {
        return switch (status) {
            case 0xF2 -> 2;
            case 0xF1, 0xF3 -> 1;
            default -> 0;
        };
    }
}
