package io.feydor.inspo.midi;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * What one MTrk chunk contributed
 *
 * @param byteLength      The length of the track's payload, whether or not every event in it decoded
 * @param noteOnCount     Note-on events with a non-zero velocity
 * @param statusBytesSeen Every effective status byte, explicit or inherited through running status
 */
public record TrackStats(int byteLength, int noteOnCount, SortedSet<Integer> statusBytesSeen) {
    public TrackStats {
        if (byteLength < 0 || noteOnCount < 0) {
            throw new IllegalArgumentException("Counts must not be negative: byteLength=" + byteLength
                    + ", noteOnCount=" + noteOnCount);
        }
        statusBytesSeen = Collections.unmodifiableSortedSet(new TreeSet<>(statusBytesSeen));
    }
}
