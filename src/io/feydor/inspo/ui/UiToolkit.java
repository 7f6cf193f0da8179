package io.feydor.inspo.ui;

import java.io.File;
import java.util.Optional;

/**
 * The presentation capabilities the inspiration app needs. Keeps {@link InspirationApp} free of any particular
 * widget toolkit, so it can be driven by Swing or by a test double.
 */
public interface UiToolkit {
    /**
     * Asks the user for a MIDI file
     * @return the chosen file, or empty if the user cancelled
     */
    Optional<File> chooseMidiFile();

    void showInfo(String title, String message);

    void showError(String title, String message);

    /** Replaces the contents of the output area */
    void displayText(String text);
}
