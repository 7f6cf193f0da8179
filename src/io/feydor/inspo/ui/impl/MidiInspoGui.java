package io.feydor.inspo.ui.impl;

import io.feydor.inspo.ui.InspirationApp;
import io.feydor.inspo.ui.UiToolkit;

import javax.swing.*;
import javax.swing.border.EtchedBorder;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;
import java.io.File;
import java.util.Optional;
import java.util.function.Function;

/**
 * A Swing window for the inspiration app: a file bar at the top, the output toggles and generate button in the
 * middle and a read-only text area for the ideas.
 */
public class MidiInspoGui implements UiToolkit {
    private JFrame frame;
    private JTextField fileField;
    private JTextArea outputArea;
    private JFileChooser fileChooser;

    /**
     * Builds and shows the window on the event dispatch thread
     * @param appFactory creates the app once the window, i.e. its toolkit, exists
     * @throws IllegalStateException When there is no display to show a window on
     */
    public static void launch(Function<UiToolkit, InspirationApp> appFactory) {
        if (GraphicsEnvironment.isHeadless()) {
            throw new IllegalStateException("Unable to start the GUI: no display is available.");
        }

        SwingUtilities.invokeLater(() -> {
            var gui = new MidiInspoGui();
            gui.show(appFactory.apply(gui));
        });
    }

    private void show(InspirationApp app) {
        frame = new JFrame("MIDI Inspiration");
        frame.setSize(640, 480);
        frame.setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);

        JPanel mainPanel = new JPanel(new BorderLayout(0, 8));
        mainPanel.setBorder(BorderFactory.createEmptyBorder(12, 12, 12, 12));

        // top panel, file controls and options
        var topPanel = new JPanel();
        topPanel.setLayout(new BoxLayout(topPanel, BoxLayout.Y_AXIS));
        topPanel.add(createFilePanel(app));
        topPanel.add(createOptionsPanel(app));
        mainPanel.add(topPanel, BorderLayout.NORTH);

        // bottom panel, the ideas
        outputArea = new JTextArea(20, 60);
        outputArea.setLineWrap(true);
        outputArea.setWrapStyleWord(true);
        outputArea.setEditable(false);
        mainPanel.add(new JScrollPane(outputArea), BorderLayout.CENTER);

        frame.add(mainPanel);
        frame.setLocationRelativeTo(null);
        frame.setVisible(true);
    }

    private JPanel createFilePanel(InspirationApp app) {
        fileChooser = new JFileChooser();
        fileChooser.setDialogTitle("Select MIDI file");
        fileChooser.setFileFilter(new FileNameExtensionFilter("MIDI files", "mid", "midi"));

        var filePanel = new JPanel(new BorderLayout(8, 0));
        filePanel.add(new JLabel("Selected MIDI file:"), BorderLayout.WEST);
        fileField = new JTextField();
        filePanel.add(fileField, BorderLayout.CENTER);
        var browseButton = new JButton("Browse…");
        browseButton.addActionListener(e -> {
            app.openFileDialog();
            fileField.setText(app.getSelectedFile());
        });
        filePanel.add(browseButton, BorderLayout.EAST);
        filePanel.setBorder(BorderFactory.createEmptyBorder(0, 0, 8, 0));
        return filePanel;
    }

    JPanel createOptionsPanel(InspirationApp app) {
        var featuresBox = new JCheckBox("Show features");
        var jsonBox = new JCheckBox("Show JSON");
        featuresBox.setSelected(app.isShowFeatures());
        jsonBox.setSelected(app.isShowJson());
        featuresBox.addActionListener(e -> {
            app.setShowFeatures(featuresBox.isSelected());
            jsonBox.setSelected(app.isShowJson());
        });
        jsonBox.addActionListener(e -> app.setShowJson(jsonBox.isSelected()));

        var generateButton = new JButton("Generate Inspiration");
        generateButton.addActionListener(e -> {
            app.setSelectedFile(fileField.getText());
            app.generateIdeas();
        });

        var optionsPanel = new JPanel(new FlowLayout(FlowLayout.LEFT));
        optionsPanel.setBorder(new EtchedBorder());
        optionsPanel.add(featuresBox);
        optionsPanel.add(jsonBox);
        optionsPanel.add(generateButton);
        return optionsPanel;
    }

    @Override
    public Optional<File> chooseMidiFile() {
        int returnVal = fileChooser.showOpenDialog(frame);
        if (returnVal == JFileChooser.APPROVE_OPTION) {
            return Optional.of(fileChooser.getSelectedFile());
        }
        return Optional.empty();
    }

    @Override
    public void showInfo(String title, String message) {
        JOptionPane.showMessageDialog(frame, message, title, JOptionPane.INFORMATION_MESSAGE);
    }

    @Override
    public void showError(String title, String message) {
        JOptionPane.showMessageDialog(frame, message, title, JOptionPane.ERROR_MESSAGE);
    }

    @Override
    public void displayText(String text) {
        outputArea.setText(text);
        outputArea.setCaretPosition(0);
    }
}
