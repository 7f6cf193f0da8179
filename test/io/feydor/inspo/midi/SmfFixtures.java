package io.feydor.inspo.midi;

import io.feydor.inspo.util.ByteFns;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Builds Standard MIDI File bytes for tests
 */
public final class SmfFixtures {
    private SmfFixtures() {}

    /** MThd, length 6 */
    public static byte[] header(int format, int ntracks, int division) {
        return header(6, format, ntracks, division, new byte[0]);
    }

    public static byte[] header(long len, int format, int ntracks, int division, byte[] extension) {
        var buf = ByteBuffer.allocate(14 + extension.length);
        buf.put("MThd".getBytes(StandardCharsets.US_ASCII));
        buf.putInt((int) len);
        buf.putShort((short) format);
        buf.putShort((short) ntracks);
        buf.putShort((short) division);
        buf.put(extension);
        return buf.array();
    }

    public static byte[] chunk(String id, byte[] data) {
        var buf = ByteBuffer.allocate(8 + data.length);
        buf.put(id.getBytes(StandardCharsets.US_ASCII));
        buf.putInt(data.length);
        buf.put(data);
        return buf.array();
    }

    public static byte[] track(String hexEvents) {
        return chunk("MTrk", ByteFns.fromHex(hexEvents));
    }

    /** A delta-time followed by the event bytes */
    public static byte[] event(long delta, String hexEvent) {
        return concat(VarLenQuant.encode(delta), ByteFns.fromHex(hexEvent));
    }

    public static byte[] concat(byte[]... parts) {
        var out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}
