package io.feydor.inspo.midi;

import io.feydor.inspo.midi.exceptions.MidiFeatureException;
import io.feydor.inspo.midi.exceptions.MidiInvalidHeaderException;
import io.feydor.inspo.midi.exceptions.MidiNotFoundException;
import io.feydor.inspo.midi.exceptions.MidiTruncatedException;
import io.feydor.inspo.util.ByteFns;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static io.feydor.inspo.midi.SmfFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MidiFeatureExtractorTest {
    @TempDir
    Path tempDir;

    private final MidiFeatureExtractor extractor = new MidiFeatureExtractor();

    private Path write(String name, byte[] bytes) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, bytes);
        return file;
    }

    @Test
    void singleTrackFile() throws IOException {
        byte[] bytes = concat(header(1, 1, 480), track("00 90 3C 40 60 80 3C 40"));
        var features = extractor.extractFeatures(write("one.mid", bytes));

        assertEquals(1, features.formatType());
        assertEquals(1, features.tracksDeclared());
        assertEquals(480, features.division());
        assertEquals(1, features.tracksObserved());
        assertEquals(List.of(8), features.trackLengths());
        assertEquals(List.of(1), features.noteOnEvents());
        assertTrue(features.trackConsistency());
        assertEquals(1.0, features.density());
        assertEquals(List.of(0x80, 0x90), features.distinctStatusBytes());
        assertEquals(30, features.fileSize());
    }

    @Test
    void emptyMidi() throws IOException {
        // Empty midi file has a header and 1 track with the End of Track event
        byte[] bytes = concat(header(0, 1, 0x60), track("00 FF 2F 00"));
        var features = extractor.extractFeatures(write("empty.mid", bytes).toString());

        assertEquals(0, features.formatType());
        assertEquals(List.of(4), features.trackLengths());
        assertEquals(List.of(0), features.noteOnEvents());
        assertEquals(List.of(0xFF), features.distinctStatusBytes());
        assertEquals(0.0, features.density());
    }

    @Test
    void multiTrackFile_withTempoTrackAndRunningStatus() throws IOException {
        byte[] tempoTrack = track("00 FF 51 03 07 A1 20 00 FF 58 04 04 02 18 08 00 FF 2F 00");
        byte[] melody = chunk("MTrk", concat(
                event(0, "C0 13"),
                event(0, "90 51 64"),
                event(12, "45 64"),
                event(0x23C, "80 51 50"),
                event(0, "90 54 64"),
                event(0, "FF 2F 00")));
        byte[] drums = chunk("MTrk", concat(
                event(0, "99 24 64"),
                event(96, "24 00"),
                event(0, "FF 2F 00")));
        byte[] bytes = concat(header(1, 3, 480), tempoTrack, melody, drums);

        var features = extractor.extractFeatures(bytes);

        assertEquals(3, features.tracksObserved());
        assertTrue(features.trackConsistency());
        assertEquals(List.of(0, 3, 1), features.noteOnEvents());
        assertEquals(List.of(0x80, 0x90, 0x99, 0xC0, 0xFF), features.distinctStatusBytes());
        assertEquals(4.0 / 3.0, features.density(), 1e-9);
        assertEquals(bytes.length, features.fileSize());
    }

    @Test
    void nonTrackChunksAreSkipped() throws IOException {
        byte[] bytes = concat(header(1, 1, 480),
                chunk("XFIH", ByteFns.fromHex("90 3C 40 90 3C 40")),
                track("00 90 3C 40"));
        var features = extractor.extractFeatures(bytes);
        assertEquals(1, features.tracksObserved());
        assertEquals(List.of(1), features.noteOnEvents());
        assertEquals(List.of(0x90), features.distinctStatusBytes());
    }

    @Test
    void declaredTrackCountIsNotTrusted() {
        var more = extractor.extractFeatures(concat(header(1, 1, 96), track("00 90 3C 40"), track("00 90 3C 40")));
        assertEquals(2, more.tracksObserved());
        assertFalse(more.trackConsistency());

        var none = extractor.extractFeatures(header(1, 2, 96));
        assertEquals(0, none.tracksObserved());
        assertFalse(none.trackConsistency());
        assertEquals(0.0, none.density());
    }

    @Test
    void headerOnly_withZeroDeclaredTracks_isConsistent() {
        var features = extractor.extractFeatures(header(0, 0, 96));
        assertTrue(features.trackConsistency());
        assertEquals(0.0, features.density());
    }

    @Test
    void malformedTrack_doesNotStopTheOtherTracks() {
        byte[] bytes = concat(header(1, 3, 96),
                track("00 3C 40 00 90 3C 40"),
                track("00 90 3C 40 00 90"),
                track("00 90 3C 40 10 3E 40"));
        var features = extractor.extractFeatures(bytes);
        assertEquals(3, features.tracksObserved());
        assertEquals(List.of(7, 6, 7), features.trackLengths());
        assertEquals(List.of(0, 1, 2), features.noteOnEvents());
    }

    @Test
    void headerWithVendorExtension() {
        byte[] bytes = concat(header(8, 1, 1, 480, new byte[]{0x12, 0x34}), track("00 90 3C 40"));
        var features = extractor.extractFeatures(bytes);
        assertEquals(1, features.tracksObserved());
        assertEquals(List.of(1), features.noteOnEvents());
    }

    @Test
    void trailingBytesAfterTheLastChunkAreIgnored() {
        byte[] bytes = concat(header(0, 1, 96), track("00 90 3C 40"), new byte[]{1, 2, 3});
        var features = extractor.extractFeatures(bytes);
        assertEquals(1, features.tracksObserved());
        assertEquals(bytes.length, features.fileSize());
    }

    @Test
    void whenGivenWrongFilename_thenThrowsNotFound() {
        var e = assertThrows(MidiNotFoundException.class, () -> extractor.extractFeatures(tempDir.resolve("idk.mid")));
        assertEquals(MidiFeatureException.Kind.NOT_FOUND, e.kind());
        assertThrows(MidiNotFoundException.class, () -> extractor.extractFeatures(tempDir));
    }

    @Test
    void whenTheFileIsNotAMidiFile_thenThrowsInvalidHeader() throws IOException {
        Path file = write("notes.txt", "This is not a MIDI file at all".getBytes());
        assertThrows(MidiInvalidHeaderException.class, () -> extractor.extractFeatures(file));
    }

    @Test
    void buffersShorterThan14Bytes_neverGetPastTheHeader() {
        byte[] full = concat(header(1, 1, 480), track("00 90 3C 40"));
        for (int len = 0; len < 14; len++) {
            byte[] bytes = Arrays.copyOf(full, len);
            var e = assertThrows(MidiFeatureException.class, () -> extractor.extractFeatures(bytes), "len=" + len);
            assertTrue(e.kind() == MidiFeatureException.Kind.INVALID_HEADER || e.kind() == MidiFeatureException.Kind.TRUNCATED);
        }
    }

    @Test
    void whenATrackIsTruncated_thenThrowsTruncated() throws IOException {
        byte[] full = concat(header(1, 2, 480), track("00 90 3C 40"), track("00 90 3C 40 60 80 3C 40"));
        byte[] cut = Arrays.copyOf(full, full.length - 3);
        Path file = write("cut.mid", cut);
        var e = assertThrows(MidiTruncatedException.class, () -> extractor.extractFeatures(file));
        assertEquals(MidiFeatureException.Kind.TRUNCATED, e.kind());
    }

    @Test
    void legacySysexHandling_isPassedToTheScanner() {
        byte[] bytes = concat(header(0, 1, 96), track("00 F0 02 91 3C 00 90 3C 40"));
        assertEquals(List.of(1), new MidiFeatureExtractor(SysexHandling.SKIP_PAYLOAD).extractFeatures(bytes).noteOnEvents());
        assertEquals(List.of(0), new MidiFeatureExtractor(SysexHandling.LEGACY).extractFeatures(bytes).noteOnEvents());
    }
}
