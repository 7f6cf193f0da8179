package io.feydor.inspo.midi;

import io.feydor.inspo.midi.exceptions.MidiInvalidHeaderException;
import io.feydor.inspo.midi.exceptions.MidiTruncatedException;
import io.feydor.inspo.util.ByteFns;

/**
 * The header chunk of a MIDI file:
 * <pre>
 *   &lt;Header&gt; = &lt;ident:4B "MThd"&gt; &lt;len:4B&gt; &lt;format:2B&gt; &lt;ntracks:2B&gt; &lt;tickdiv:2B&gt;
 * </pre>
 * Header chunks longer than 6 bytes carry vendor extensions after the fixed fields; those bytes are skipped.
 *
 * @param len      The declared chunk length (excludes the id and length bytes), canonically 6
 * @param format   The file format word: 0, 1 or 2 in well formed files
 * @param ntracks  The number of track chunks the file claims to contain
 * @param tickdiv  The raw 2-byte time division
 */
public record MidiHeader(long len, int format, int ntracks, int tickdiv) {
    /** ident + len + format + ntracks + tickdiv */
    public static final int MIN_HEADER_BYTES = 14;
    /** The bytes in a canonical MThd payload */
    public static final int BYTES_IN_MTHD = 6;

    /**
     * Reads the header from the start of a file and leaves the cursor at the first byte after the header chunk
     *
     * @throws MidiInvalidHeaderException When fewer than 14 bytes are available or the ident is not "MThd"
     * @throws MidiTruncatedException When the declared header length runs past the end of the file
     */
    public static MidiHeader readFrom(ByteCursor cursor) {
        if (cursor.remaining() < MIN_HEADER_BYTES) {
            throw new MidiInvalidHeaderException("File too small to be a valid MIDI file: " + cursor.remaining()
                    + " bytes, a MIDI header needs " + MIN_HEADER_BYTES);
        }

        byte[] chunkId = cursor.readBytes(4);
        if (!MidiIdentifier.MThd.matches(chunkId)) {
            throw new MidiInvalidHeaderException("Not a MIDI File: A Midi Header chunk's identifier must be the ASCII characters 'MThd'! Given: "
                    + ByteFns.toHex(chunkId));
        }

        long chunklen = cursor.readU32BE();
        int format = cursor.readU16BE();
        int ntracks = cursor.readU16BE();
        int tickdiv = cursor.readU16BE();

        if (chunklen > BYTES_IN_MTHD) {
            long extra = chunklen - BYTES_IN_MTHD;
            if (extra > cursor.remaining()) {
                throw new MidiTruncatedException(String.format("The MThd chunk declares %d bytes but only %d follow the fixed fields",
                        chunklen, BYTES_IN_MTHD + cursor.remaining()));
            }
            cursor.skip(extra);
        }

        return new MidiHeader(chunklen, format, ntracks, tickdiv);
    }

    /** Decodes the header at the start of a whole file buffer */
    public static MidiHeader decode(byte[] file) {
        return readFrom(new ByteCursor(file));
    }

    /**
     * The MSB of tickdiv determines the time division method. When clear, the remaining 15 bits are the
     * ticks per quarter-note ("metrical timing"), otherwise they hold an SMPTE frame rate and ticks per frame.
     */
    public boolean useTicksPerBeatTimeDiv() {
        return (tickdiv & 0x8000) == 0;
    }

    /**
     * @return the number of ticks in a quarter-note, the low 15 bits of tickdiv
     * @throws IllegalStateException When the division is SMPTE based
     */
    public int ticksPerQuarterNote() {
        if (!useTicksPerBeatTimeDiv()) {
            throw new IllegalStateException(String.format("The time division %04x is SMPTE based, it has no ticks per quarter-note", tickdiv));
        }
        return tickdiv & 0x7FFF;
    }

    @Override
    public String toString() {
        return "Header{" +
                "len=" + len +
                ", format=" + format +
                ", ntracks=" + ntracks +
                ", tickdiv=" + tickdiv +
                ", useMetricalTiming=" + useTicksPerBeatTimeDiv() +
                '}';
    }
}
