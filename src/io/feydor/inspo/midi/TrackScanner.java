package io.feydor.inspo.midi;

import io.feydor.inspo.midi.exceptions.MidiTruncatedException;

import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks the events of one MTrk payload and counts what it finds.
 * <p>
 * Format: {@code <MTrk data> = (<delta-time:VarLen><event>)*}. An event starts with a status byte, unless running
 * status is in effect: then the status byte of the previous event is reused and the first byte read is already data.
 * <p>
 * Decoding problems inside a track (the payload ends mid-event, running status with nothing to inherit) end the
 * scan of that track only. Whatever was counted up to that point is kept.
 */
public class TrackScanner {
    private static final Logger LOGGER = Logger.getLogger(TrackScanner.class.getName());
    private static final int NO_STATUS = -1;

    private final SysexHandling sysexHandling;

    public TrackScanner(SysexHandling sysexHandling) {
        this.sysexHandling = Objects.requireNonNull(sysexHandling, "sysexHandling");
    }

    public TrackScanner() {
        this(SysexHandling.SKIP_PAYLOAD);
    }

    /**
     * Scans a track's payload. Never throws on malformed event data.
     * @param payload the data of an MTrk chunk
     * @return the statistics of the events decoded before the payload ended or a decode fault occurred
     */
    public TrackStats scan(byte[] payload) {
        var cursor = new ByteCursor(payload);
        var counts = new Counts();
        try {
            while (!cursor.atEnd()) {
                if (!scanEvent(cursor, counts)) {
                    break;
                }
            }
        } catch (MidiTruncatedException e) {
            LOGGER.log(Level.FINE, "Track ended mid-event, keeping {0} note-ons: {1}",
                    new Object[]{counts.noteOns, e.getMessage()});
        }
        return new TrackStats(payload.length, counts.noteOns, counts.statuses);
    }

    /**
     * Decodes one {@code <delta-time><event>} pair
     * @return false when the scan of this track has to stop
     */
    private boolean scanEvent(ByteCursor cursor, Counts counts) {
        // The delta-time only orders events, none of the statistics need it
        VarLenQuant.decode(cursor);
        if (cursor.atEnd()) {
            return false;
        }

        int status = cursor.peekU8();
        if (status < 0x80) {
            // Running status: this is the first data byte, leave it for the event's data
            if (counts.runningStatus == NO_STATUS) {
                LOGGER.log(Level.FINE, "Running status at offset {0} without a previous status byte, stopping track scan",
                        cursor.position());
                return false;
            }
            status = counts.runningStatus;
        } else {
            cursor.readU8();
            counts.runningStatus = status;
        }
        counts.statuses.add(status);

        switch (MidiEventType.fromStatusByte(status)) {
            case MIDI -> {
                var subType = MidiEventSubType.fromStatusByte(status);
                byte[] data = cursor.readBytes(subType.dataLength);
                // A note-on with velocity 0 is a note-off
                if (subType == MidiEventSubType.NOTE_ON && (data[1] & 0xFF) != 0) {
                    counts.noteOns++;
                }
            }
            case META -> {
                // Meta-Event: <FF:1B> <type:1B> <len:VarLen> <data:len B>
                cursor.readU8();
                skipPayload(cursor);
            }
            case SYSEX -> {
                // SysEx event: <F0|F7> <len:VarLen> <message:len B>
                if (sysexHandling == SysexHandling.SKIP_PAYLOAD) {
                    skipPayload(cursor);
                }
            }
            case SYSTEM -> {
                if (sysexHandling == SysexHandling.SKIP_PAYLOAD) {
                    cursor.skip(MidiEventType.systemDataLength(status));
                }
            }
        }
        return true;
    }

    /** Skips a {@code <len:VarLen><data:len B>} payload */
    private static void skipPayload(ByteCursor cursor) {
        var length = VarLenQuant.decode(cursor);
        // over-long quantities can wrap negative
        if (length.value() < 0 || length.value() > cursor.remaining()) {
            throw new MidiTruncatedException(String.format("Payload of %d bytes at offset %d runs past the end of the track",
                    length.value(), cursor.position()));
        }
        cursor.skip(length.value());
    }

    /** Accumulators for a single scan */
    private static final class Counts {
        private final SortedSet<Integer> statuses = new TreeSet<>();
        private int noteOns;
        private int runningStatus = NO_STATUS;
    }
}
