package io.feydor.inspo.ideas;

import io.feydor.inspo.midi.FeatureRecord;
import io.feydor.inspo.midi.MidiFileFormat;
import io.feydor.inspo.util.ByteFns;

import java.util.Locale;

/**
 * A human-readable dump of a {@link FeatureRecord}
 */
public final class FeatureSummary {
    private FeatureSummary() {}

    public static String format(FeatureRecord features) {
        var sb = new StringBuilder();
        String formatName = MidiFileFormat.fromWord(features.formatType())
                .map(f -> " (" + f.description + ")")
                .orElse(" (non-standard)");
        sb.append(String.format("format: %d%s\n", features.formatType(), formatName));
        sb.append(String.format("tracks: %d observed, %d declared%s\n", features.tracksObserved(),
                features.tracksDeclared(), features.trackConsistency() ? "" : " (mismatch)"));
        sb.append(String.format("division: %d\n", features.division()));
        sb.append(String.format("file size: %d bytes\n", features.fileSize()));
        sb.append(String.format(Locale.ROOT, "note-ons: %d total, %.2f per track\n", features.totalNoteOns(), features.density()));
        sb.append(String.format("status bytes: %s\n", ByteFns.toHexList(features.distinctStatusBytes())));

        sb.append("Track|Bytes|NoteOns\n");
        for (int i = 0; i < features.tracksObserved(); i++) {
            sb.append(String.format("%02d|%05d|%05d\n", i, features.trackLengths().get(i), features.noteOnEvents().get(i)));
        }
        return sb.toString().strip();
    }
}
