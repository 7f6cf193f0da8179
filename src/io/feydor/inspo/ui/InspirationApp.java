package io.feydor.inspo.ui;

import io.feydor.inspo.ideas.InspirationGenerator;
import io.feydor.inspo.midi.FeatureRecord;
import io.feydor.inspo.midi.MidiFeatureExtractor;
import io.feydor.inspo.midi.exceptions.MidiFeatureException;

import java.io.File;
import java.io.IOException;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The state and actions behind the inspiration window: a selected file, two output toggles, a browse action and a
 * generate action. All user-facing output goes through the {@link UiToolkit}.
 */
public class InspirationApp {
    private static final Logger LOGGER = Logger.getLogger(InspirationApp.class.getName());

    private final UiToolkit toolkit;
    private final MidiFeatureExtractor extractor;
    private final Function<FeatureRecord, InspirationGenerator> generatorFactory;
    private String selectedFile = "";
    private boolean showFeatures;
    private boolean showJson;

    public InspirationApp(UiToolkit toolkit,
                          MidiFeatureExtractor extractor,
                          Function<FeatureRecord, InspirationGenerator> generatorFactory) {
        this.toolkit = Objects.requireNonNull(toolkit, "toolkit");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.generatorFactory = Objects.requireNonNull(generatorFactory, "generatorFactory");
    }

    public String getSelectedFile() {
        return selectedFile;
    }

    public void setSelectedFile(String selectedFile) {
        this.selectedFile = selectedFile == null ? "" : selectedFile.strip();
    }

    public boolean isShowFeatures() {
        return showFeatures;
    }

    /** Turning the feature summary on turns the JSON output off, only one of them is shown */
    public void setShowFeatures(boolean showFeatures) {
        this.showFeatures = showFeatures;
        if (showFeatures) {
            this.showJson = false;
        }
    }

    public boolean isShowJson() {
        return showJson;
    }

    public void setShowJson(boolean showJson) {
        this.showJson = showJson;
    }

    public void openFileDialog() {
        toolkit.chooseMidiFile().ifPresentOrElse(
                file -> setSelectedFile(file.getAbsolutePath()),
                () -> LOGGER.log(Level.FINE, "Open command cancelled by user"));
    }

    public void generateIdeas() {
        if (selectedFile.isEmpty()) {
            toolkit.showInfo("No file selected", "Choose a MIDI file to analyze.");
            return;
        }

        FeatureRecord features;
        try {
            features = extractor.extractFeatures(new File(selectedFile).toPath());
        } catch (MidiFeatureException | IOException e) {
            LOGGER.log(Level.WARNING, "Failed to extract features from {0}: {1}", new Object[]{selectedFile, e.getMessage()});
            toolkit.showError("Feature extraction failed", e.getMessage());
            return;
        }

        var generator = generatorFactory.apply(features);
        toolkit.displayText(generator.generateIdeas(showFeatures, showJson));
    }
}
