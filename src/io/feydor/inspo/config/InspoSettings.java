package io.feydor.inspo.config;

import io.feydor.inspo.midi.SysexHandling;

import java.util.Objects;

/**
 * Options shared by the command line and the GUI.
 *
 * @param sysexHandling How the track scanner steps over SysEx and system common messages
 * @param seed          Seed for the phrasing choices, or null for a fresh random source
 * @param showFeatures  Append a human-readable feature summary to the ideas
 * @param showJson      Append the feature JSON to the ideas (ignored when showFeatures is set)
 * @param verbose       Print the parser's debug logs
 */
public record InspoSettings(SysexHandling sysexHandling,
                            Long seed,
                            boolean showFeatures,
                            boolean showJson,
                            boolean verbose) {
    public static final InspoSettings DEFAULTS = new InspoSettings(SysexHandling.SKIP_PAYLOAD, null, false, false, false);

    public InspoSettings {
        Objects.requireNonNull(sysexHandling, "sysexHandling");
    }

    public InspoSettings withSysexHandling(SysexHandling sysexHandling) {
        return new InspoSettings(sysexHandling, seed, showFeatures, showJson, verbose);
    }

    public InspoSettings withSeed(Long seed) {
        return new InspoSettings(sysexHandling, seed, showFeatures, showJson, verbose);
    }

    public InspoSettings withShowFeatures(boolean showFeatures) {
        return new InspoSettings(sysexHandling, seed, showFeatures, showJson, verbose);
    }

    public InspoSettings withShowJson(boolean showJson) {
        return new InspoSettings(sysexHandling, seed, showFeatures, showJson, verbose);
    }

    public InspoSettings withVerbose(boolean verbose) {
        return new InspoSettings(sysexHandling, seed, showFeatures, showJson, verbose);
    }
}
