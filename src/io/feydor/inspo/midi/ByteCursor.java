package io.feydor.inspo.midi;

import io.feydor.inspo.midi.exceptions.MidiTruncatedException;
import io.feydor.inspo.util.ByteFns;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * A forward-only reader over a fixed byte buffer. Every read is bounds-checked: asking for more bytes than remain
 * throws a {@link MidiTruncatedException} and leaves the position untouched.
 * <p>
 * Multi-byte integers are big-endian, as everywhere in a Standard MIDI File.
 */
public class ByteCursor {
    private final byte[] buf;
    private final int limit;
    private int pos;

    public ByteCursor(byte[] buf) {
        this.buf = buf;
        this.pos = 0;
        this.limit = buf.length;
    }

    /**
     * Reads exactly n bytes and advances past them
     * @throws MidiTruncatedException When fewer than n bytes remain
     */
    public byte[] readBytes(int n) {
        require(n);
        byte[] out = Arrays.copyOfRange(buf, pos, pos + n);
        pos += n;
        return out;
    }

    /** Reads one unsigned byte */
    public int readU8() {
        require(1);
        return buf[pos++] & 0xFF;
    }

    /** Returns the next unsigned byte without consuming it */
    public int peekU8() {
        require(1);
        return buf[pos] & 0xFF;
    }

    /** Reads a 2-byte big-endian unsigned integer */
    public int readU16BE() {
        return ByteBuffer.wrap(ByteFns.widenWithZeros(readBytes(2), 4)).getInt();
    }

    /**
     * Reads a 4-byte big-endian unsigned integer. Widened to a long so values above Integer.MAX_VALUE stay positive.
     */
    public long readU32BE() {
        return ByteBuffer.wrap(ByteFns.widenWithZeros(readBytes(4), 8)).getLong();
    }

    /**
     * Advances n bytes
     * @throws MidiTruncatedException When fewer than n bytes remain
     */
    public void skip(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot skip a negative number of bytes: " + n);
        }
        if (n > remaining()) {
            throw new MidiTruncatedException(String.format("Attempted to skip %d bytes at offset %d but only %d remain",
                    n, pos, remaining()));
        }
        pos += (int) n;
    }

    public int position() {
        return pos;
    }

    public int remaining() {
        return limit - pos;
    }

    public boolean atEnd() {
        return pos >= limit;
    }

    private void require(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot read a negative number of bytes: " + n);
        }
        if (n > remaining()) {
            throw new MidiTruncatedException(String.format("Attempted to read %d bytes at offset %d but only %d remain",
                    n, pos, remaining()));
        }
    }

    @Override
    public String toString() {
        return "ByteCursor{" +
                "pos=" + pos +
                ", limit=" + limit +
                '}';
    }
}
