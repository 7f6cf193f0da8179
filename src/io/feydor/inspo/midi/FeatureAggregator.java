package io.feydor.inspo.midi;

import java.util.List;
import java.util.TreeSet;

/**
 * Combines the header and the per-track statistics into a {@link FeatureRecord}
 */
public final class FeatureAggregator {
    private FeatureAggregator() {}

    /**
     * @param header   the decoded MThd chunk
     * @param tracks   one entry per MTrk chunk, in file order
     * @param fileSize the size of the file in bytes
     */
    public static FeatureRecord aggregate(MidiHeader header, List<TrackStats> tracks, long fileSize) {
        var distinct = new TreeSet<Integer>();
        for (var track : tracks) {
            distinct.addAll(track.statusBytesSeen());
        }

        List<Integer> trackLengths = tracks.stream().map(TrackStats::byteLength).toList();
        List<Integer> noteOnEvents = tracks.stream().map(TrackStats::noteOnCount).toList();
        int tracksObserved = tracks.size();
        int totalNoteOns = noteOnEvents.stream().mapToInt(Integer::intValue).sum();
        double density = tracksObserved == 0 ? 0.0 : totalNoteOns / (double) tracksObserved;

        return new FeatureRecord(
                header.format(),
                header.ntracks(),
                header.tickdiv(),
                trackLengths,
                noteOnEvents,
                List.copyOf(distinct),
                fileSize,
                tracksObserved,
                tracksObserved == header.ntracks(),
                density);
    }
}
