package io.feydor.inspo;

import io.feydor.inspo.config.InspoSettings;
import io.feydor.inspo.config.SettingsException;
import io.feydor.inspo.config.SettingsLoader;
import io.feydor.inspo.ideas.InspirationGenerator;
import io.feydor.inspo.midi.FeatureRecord;
import io.feydor.inspo.midi.MidiFeatureExtractor;
import io.feydor.inspo.midi.SysexHandling;
import io.feydor.inspo.midi.exceptions.MidiFeatureException;
import io.feydor.inspo.ui.InspirationApp;
import io.feydor.inspo.ui.impl.MidiInspoGui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Analyzes a MIDI file and prints ideas for working with it.
 *
 * <p>Usage: java MidiInspo [options] file.mid</p>
 */
public final class MidiInspo {
    private static final Logger LOGGER = Logger.getLogger(MidiInspo.class.getName());
    /** Kept so the configured level is not lost when the logger is garbage collected */
    private static final Logger APP_LOGGER = Logger.getLogger("io.feydor.inspo");

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final Consumer<InspoSettings> uiLauncher;

    public static void main(String[] args) {
        var cli = new MidiInspo(System.out, System.err, MidiInspo::launchGui);
        int exitCode = cli.run(args);
        // On success with --ui the Swing thread keeps the JVM alive
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    MidiInspo(PrintStream out, PrintStream err, Consumer<InspoSettings> uiLauncher) {
        this.out = out;
        this.err = err;
        this.uiLauncher = uiLauncher;
    }

    int run(String[] args) {
        InspoSettings settings = InspoSettings.DEFAULTS;
        File configFile = null;
        String midiFile = null;
        boolean ui = false;

        // flags are collected first so that they win over the settings file
        List<UnaryOperator<InspoSettings>> flags = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-V", "--version" -> {
                    printVersion();
                    return EXIT_OK;
                }
                case "-h", "-H", "--help" -> {
                    printOptions();
                    return EXIT_OK;
                }
                case "-v", "--verbose" -> flags.add(s -> s.withVerbose(true));
                case "--show-features" -> flags.add(s -> s.withShowFeatures(true));
                case "--show-json" -> flags.add(s -> s.withShowJson(true));
                case "--legacy-sysex" -> flags.add(s -> s.withSysexHandling(SysexHandling.LEGACY));
                case "--ui" -> ui = true;
                case "--seed", "--config" -> {
                    if (i + 1 >= args.length) {
                        err.println("error: " + arg + " needs a value");
                        printOptions();
                        return EXIT_USAGE;
                    }
                    String value = args[++i];
                    if (arg.equals("--config")) {
                        configFile = new File(value);
                    } else {
                        long seed;
                        try {
                            seed = Long.parseLong(value);
                        } catch (NumberFormatException e) {
                            err.println("error: --seed must be a whole number. Given: " + value);
                            return EXIT_USAGE;
                        }
                        flags.add(s -> s.withSeed(seed));
                    }
                }
                default -> {
                    if (arg.startsWith("-")) {
                        err.println("error: unknown option: " + arg);
                        printOptions();
                        return EXIT_USAGE;
                    }
                    if (midiFile != null) {
                        err.println("error: only one MIDI file can be analyzed at a time");
                        return EXIT_USAGE;
                    }
                    midiFile = arg;
                }
            }
        }

        try {
            settings = configFile != null ? SettingsLoader.load(configFile, settings)
                                          : SettingsLoader.loadDefaultFile(settings);
        } catch (SettingsException e) {
            err.println("Error loading settings: " + e.getMessage());
            return EXIT_FAILURE;
        }
        for (var flag : flags) {
            settings = flag.apply(settings);
        }

        if (settings.verbose()) {
            enableVerboseLogging();
        }

        if (ui) {
            try {
                uiLauncher.accept(settings);
            } catch (IllegalStateException e) {
                err.println(e.getMessage());
                return EXIT_FAILURE;
            }
            return EXIT_OK;
        }

        if (midiFile == null) {
            err.println("error: midi_file is required unless --ui is specified");
            printOptions();
            return EXIT_USAGE;
        }

        FeatureRecord features;
        try {
            features = new MidiFeatureExtractor(settings.sysexHandling()).extractFeatures(midiFile);
        } catch (MidiFeatureException | IOException e) {
            LOGGER.log(Level.FINE, "Extraction failed", e);
            err.println("Error extracting features: " + e.getMessage());
            return EXIT_FAILURE;
        }

        var generator = new InspirationGenerator(features, randomFor(settings));
        out.println(generator.generateIdeas(settings.showFeatures(), settings.showJson()));
        return EXIT_OK;
    }

    static Random randomFor(InspoSettings settings) {
        return settings.seed() == null ? new Random() : new Random(settings.seed());
    }

    private static void launchGui(InspoSettings settings) {
        var extractor = new MidiFeatureExtractor(settings.sysexHandling());
        MidiInspoGui.launch(toolkit -> {
            var app = new InspirationApp(toolkit, extractor,
                    features -> new InspirationGenerator(features, randomFor(settings)));
            app.setShowFeatures(settings.showFeatures());
            app.setShowJson(settings.showJson() && !settings.showFeatures());
            return app;
        });
    }

    private static synchronized void enableVerboseLogging() {
        if (Level.FINE.equals(APP_LOGGER.getLevel())) {
            return;
        }
        APP_LOGGER.setLevel(Level.FINE);
        var handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        APP_LOGGER.addHandler(handler);
        // the root logger's console handler would print every INFO and above a second time
        APP_LOGGER.setUseParentHandlers(false);
    }

    private void printOptions() {
        String msg = "\nMIDI Inspo\n\nUsage: midi-inspo [options] [MIDI File]\n\n";
        msg += "Options:\n";
        msg += "\n  --show-features   Include a human-readable feature dump in the output";
        msg += "\n  --show-json       Include the raw feature JSON in the output";
        msg += "\n  --ui              Launch the graphical user interface instead of using the CLI";
        msg += "\n  --seed N          Seed the phrasing choices for repeatable output";
        msg += "\n  --legacy-sysex    Treat SysEx and system messages as having no data bytes";
        msg += "\n  --config FILE     Read settings from FILE (default: ./" + SettingsLoader.DEFAULT_SETTINGS_FILE + ")";
        msg += "\n  -V,--version      Print version information";
        msg += "\n  -h,--help         Print this message";
        msg += "\n  -v,--verbose      Print extra logs";
        out.println(msg);
    }

    private void printVersion() {
        out.println("MIDI Inspo 0.1.0\nCopyright (C) 2023 feydor\n");
    }
}
