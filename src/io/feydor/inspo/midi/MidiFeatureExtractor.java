package io.feydor.inspo.midi;

import io.feydor.inspo.midi.exceptions.MidiInvalidHeaderException;
import io.feydor.inspo.midi.exceptions.MidiNotFoundException;
import io.feydor.inspo.midi.exceptions.MidiTruncatedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extracts a {@link FeatureRecord} from a Standard MIDI File.
 * <p>
 * A Midi file is a series of chunks:
 * <ul>
 *     <li>MThd: a Header chunk containing the file's meta-data</li>
 *     <li>MTrk: 0 or more Track chunks containing MIDI events</li>
 *     <li>anything else: extension chunks, which are skipped</li>
 * </ul>
 * The whole file is read into memory, then decoded. Every call works on its own buffer and accumulators, so an
 * extractor can be shared between threads.
 */
public class MidiFeatureExtractor {
    private static final Logger LOGGER = Logger.getLogger(MidiFeatureExtractor.class.getName());

    private final TrackScanner trackScanner;

    public MidiFeatureExtractor(SysexHandling sysexHandling) {
        this.trackScanner = new TrackScanner(Objects.requireNonNull(sysexHandling, "sysexHandling"));
    }

    public MidiFeatureExtractor() {
        this(SysexHandling.SKIP_PAYLOAD);
    }

    public FeatureRecord extractFeatures(String filename) throws IOException {
        return extractFeatures(Path.of(filename));
    }

    /**
     * Parses the Midi file
     * @param path The file to parse
     * @throws MidiNotFoundException When the path is not an existing file
     * @throws MidiInvalidHeaderException When the file does not start with a complete MThd header
     * @throws MidiTruncatedException When a chunk declares more bytes than the file holds
     * @throws IOException When the file exists but cannot be read
     */
    public FeatureRecord extractFeatures(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new MidiNotFoundException("MIDI file not found: " + path);
        }

        LOGGER.log(Level.FINE, "Starting to parse {0}...", path);
        byte[] file = Files.readAllBytes(path);
        var features = extractFeatures(file);
        LOGGER.log(Level.FINE, "Finished parsing {0}", path);
        return features;
    }

    /**
     * Extracts the features of a MIDI file that is already in memory. The file size is the buffer's length.
     */
    public FeatureRecord extractFeatures(byte[] file) {
        var cursor = new ByteCursor(file);
        var header = MidiHeader.readFrom(cursor);
        LOGGER.log(Level.FINE, "Parsed the MIDI header: {0}", header);

        List<TrackStats> tracks = new ArrayList<>();
        while (true) {
            var chunk = ChunkReader.nextChunk(cursor);
            if (chunk.isEmpty()) {
                break;
            }

            if (!chunk.get().is(MidiIdentifier.MTrk)) {
                LOGGER.log(Level.FINE, "Skipping non-track chunk: {0}", chunk.get());
                continue;
            }

            var stats = trackScanner.scan(chunk.get().data());
            LOGGER.log(Level.FINE, "track#{0}: {1}", new Object[]{tracks.size(), stats});
            tracks.add(stats);
        }

        if (!cursor.atEnd()) {
            LOGGER.log(Level.FINE, "Ignoring {0} trailing bytes after the last chunk", cursor.remaining());
        }

        return FeatureAggregator.aggregate(header, tracks, file.length);
    }
}
