package io.feydor.inspo.ui.impl;

import io.feydor.inspo.ideas.InspirationGenerator;
import io.feydor.inspo.midi.MidiFeatureExtractor;
import io.feydor.inspo.ui.InspirationApp;
import io.feydor.inspo.ui.UiToolkit;
import org.junit.jupiter.api.Test;

import javax.swing.*;
import java.awt.*;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class MidiInspoGuiTest {
    private static InspirationApp newApp(UiToolkit gui) {
        return new InspirationApp(gui, new MidiFeatureExtractor(), InspirationGenerator::new);
    }

    private static JCheckBox checkBox(JPanel panel, String label) {
        return Arrays.stream(panel.getComponents())
                .filter(JCheckBox.class::isInstance)
                .map(JCheckBox.class::cast)
                .filter(box -> box.getText().equals(label))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void checkBoxesStartFromTheAppState() {
        var gui = new MidiInspoGui();
        var app = newApp(gui);
        app.setShowFeatures(true);

        JPanel panel = gui.createOptionsPanel(app);
        assertTrue(checkBox(panel, "Show features").isSelected());
        assertFalse(checkBox(panel, "Show JSON").isSelected());

        var jsonApp = newApp(gui);
        jsonApp.setShowJson(true);
        panel = gui.createOptionsPanel(jsonApp);
        assertFalse(checkBox(panel, "Show features").isSelected());
        assertTrue(checkBox(panel, "Show JSON").isSelected());
    }

    @Test
    void launchFailsWithoutADisplay() {
        if (!GraphicsEnvironment.isHeadless()) {
            return;
        }
        assertThrows(IllegalStateException.class, () -> MidiInspoGui.launch(MidiInspoGuiTest::newApp));
    }
}
