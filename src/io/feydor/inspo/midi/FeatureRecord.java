package io.feydor.inspo.midi;

import java.util.List;

/**
 * The statistics extracted from one MIDI file. Immutable and free of references back into the parser.
 *
 * @param formatType          The header's format word
 * @param tracksDeclared      The number of tracks the header claims
 * @param division            The header's raw time division
 * @param trackLengths        Payload length of every observed MTrk chunk, in file order
 * @param noteOnEvents        Note-on count of every observed MTrk chunk, in file order
 * @param distinctStatusBytes Every status byte seen in any track, ascending, no duplicates
 * @param fileSize            The size of the file in bytes
 * @param tracksObserved      The number of MTrk chunks that were framed, whether or not their events decoded
 * @param trackConsistency    Whether tracksObserved equals tracksDeclared
 * @param density             Average note-ons per observed track, 0 when there are none
 */
public record FeatureRecord(int formatType,
                            int tracksDeclared,
                            int division,
                            List<Integer> trackLengths,
                            List<Integer> noteOnEvents,
                            List<Integer> distinctStatusBytes,
                            long fileSize,
                            int tracksObserved,
                            boolean trackConsistency,
                            double density) {
    public FeatureRecord {
        trackLengths = List.copyOf(trackLengths);
        noteOnEvents = List.copyOf(noteOnEvents);
        distinctStatusBytes = List.copyOf(distinctStatusBytes);
        if (trackLengths.size() != noteOnEvents.size()) {
            throw new IllegalArgumentException("Every track needs a length and a note-on count: trackLengths="
                    + trackLengths.size() + ", noteOnEvents=" + noteOnEvents.size());
        }
    }

    /** Sum of every track's note-on count */
    public int totalNoteOns() {
        return noteOnEvents.stream().mapToInt(Integer::intValue).sum();
    }
}
