package io.feydor.inspo.ideas;

import io.feydor.inspo.json.JsonFeatures;
import io.feydor.inspo.midi.FeatureRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Converts MIDI features into natural-language inspiration.
 * <p>
 * The only non-deterministic part is the choice among fixed phrasings, which uses the {@link Random} passed in.
 * Give it a seeded Random to get repeatable output.
 */
public class InspirationGenerator {
    static final List<String> CREATIVE_DIRECTIONS = List.of(
            "Transform the harmonic rhythm by extending progressions over multiple bars.",
            "Use call-and-response motifs between melodic voices for dialogue.",
            "Swap a track's instrumentation with an unexpected timbre to spark a new vibe."
    );

    private final InspirationContext context;
    private final Random rng;

    public InspirationGenerator(FeatureRecord features, Random rng) {
        this.context = new InspirationContext(features);
        this.rng = Objects.requireNonNull(rng, "rng");
    }

    public InspirationGenerator(FeatureRecord features) {
        this(features, new Random());
    }

    public InspirationContext context() {
        return context;
    }

    /**
     * @param showFeatures append a human-readable feature summary
     * @param showJson     append the feature JSON. Only used when showFeatures is false.
     */
    public String generateIdeas(boolean showFeatures, boolean showJson) {
        List<String> outline = new ArrayList<>(List.of(
                "🎼 MIDI Snapshot",
                context.describeStructure(),
                "",
                "✨ Creative Directions",
                choice(CREATIVE_DIRECTIONS),
                context.suggestedFocus(),
                context.grooveTip()
        ));

        if (showFeatures) {
            outline.addAll(List.of("", "📊 Feature Summary", FeatureSummary.format(context.features())));
        } else if (showJson) {
            outline.addAll(List.of("", "📊 Feature JSON", JsonFeatures.toJson(context.features())));
        }

        return String.join("\n", outline).strip();
    }

    private String choice(List<String> options) {
        return options.get(rng.nextInt(options.size()));
    }
}
