package io.feydor.inspo.midi;

import java.util.Arrays;
import java.util.Optional;

/**
 * There are three types of MIDI File formats:
 * <ul>
 *     <li>0: a single multi-channel track</li>
 *     <li>1: two or more tracks all played simultaneously</li>
 *     <li>2: one or more tracks played independently</li>
 * </ul>
 */
public enum MidiFileFormat {
    FORMAT_0(0, "a single multi-channel track"),

    /**
     * The most common format in MIDI. The first track is usually the tempo track, the rest hold the note data.
     */
    FORMAT_1(1, "simultaneous tracks"),

    FORMAT_2(2, "independent tracks");

    public final int word;
    public final String description;

    MidiFileFormat(int word, String description) {
        this.word = word;
        this.description = description;
    }

    /** Empty for anything but 0, 1 or 2. The header does not reject other values. */
    public static Optional<MidiFileFormat> fromWord(int word) {
        return Arrays.stream(values()).filter(f -> f.word == word).findFirst();
    }
}
