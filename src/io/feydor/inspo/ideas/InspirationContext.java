package io.feydor.inspo.ideas;

import io.feydor.inspo.midi.FeatureRecord;
import io.feydor.inspo.midi.MidiEventSubType;

import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * The fixed, feature-driven parts of the inspiration text
 */
public class InspirationContext {
    /** General MIDI reserves channel 10 (9 zero-based) for percussion */
    static final int GM_PERCUSSION_CHANNEL = 9;
    static final double SPARSE_DENSITY = 4;
    static final double BUSY_DENSITY = 16;

    private final FeatureRecord features;

    public InspirationContext(FeatureRecord features) {
        this.features = Objects.requireNonNull(features, "features");
    }

    public FeatureRecord features() {
        return features;
    }

    public String describeStructure() {
        int tracks = features.tracksObserved();
        var sb = new StringBuilder();
        sb.append(String.format("Format %d with %d track%s", features.formatType(), tracks, tracks == 1 ? "" : "s"));
        sb.append("; Timing division: ").append(features.division());
        sb.append(String.format(Locale.ROOT, "; Average note density: %.2f", features.density()));
        if (!features.trackConsistency()) {
            sb.append("; Declared track count does not match observed data");
        }
        return sb.toString();
    }

    public String suggestedFocus() {
        double density = features.density();
        if (density < SPARSE_DENSITY) {
            return "Consider adding rhythmic ostinatos to increase energy.";
        }
        if (density > BUSY_DENSITY) {
            return "Try introducing sparse breakdowns for contrast.";
        }
        return "Balance momentum with space by alternating busy and calm sections.";
    }

    /**
     * Looks for note events on the percussion channel. Channels are shown 1-based, as musicians number them.
     */
    public String grooveTip() {
        var percussionChannels = new TreeSet<Integer>();
        for (int status : features.distinctStatusBytes()) {
            if (status < 0x80 || status >= 0xF0) {
                continue;
            }
            var subType = MidiEventSubType.fromStatusByte(status);
            boolean isNote = subType == MidiEventSubType.NOTE_ON || subType == MidiEventSubType.NOTE_OFF;
            if (isNote && MidiEventSubType.channelOf(status) == GM_PERCUSSION_CHANNEL) {
                percussionChannels.add(MidiEventSubType.channelOf(status) + 1);
            }
        }

        if (!percussionChannels.isEmpty()) {
            var channels = percussionChannels.stream().map(String::valueOf).toList();
            return "Highlight the percussion on channel(s) " + String.join(", ", channels) + " with subtle dynamics.";
        }
        return "Experiment with layering tuned percussion or found sounds for unique grooves.";
    }
}
