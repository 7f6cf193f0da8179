package io.feydor.inspo.midi;

import java.io.ByteArrayOutputStream;

/**
 * A variable length quantity.
 * <pre>
 *   Most numbers are 7 bits per byte, most significant bits first.
 *   All bytes except the last have bit 7 set, and the last has bit 7 clear.
 *   If the number is between 0 and 127, it is represented as 1 byte.
 *   Some examples:
 *   Number            Variable Length Quantity
 *   ------------------------------------------
 *   00000000          00
 *   00000040          40
 *   0000007F          7F
 *   00000080 (128)    81 00
 *   00002000 (8192)   C0 00
 *   00003FFF (16383)  FF 7F
 *   00004000 (16384)  81 80 00
 * </pre>
 *
 * @param value  The quantity itself
 * @param nbytes The number of bytes used to store the quantity
 */
public record VarLenQuant(long value, int nbytes) {

    /**
     * src: <a href="https://en.wikipedia.org/wiki/Variable-length_quantity">Variable-length quantity</a>
     * <p>
     * Reads bytes until one with a clear high bit has been consumed. There is no upper bound on the number of
     * bytes; over-long quantities just wrap.
     *
     * @param cursor positioned at the MSB chunk of the quantity
     * @return the decoded value and the number of bytes it took up
     * @throws io.feydor.inspo.midi.exceptions.MidiTruncatedException When the cursor runs out mid-quantity
     */
    public static VarLenQuant decode(ByteCursor cursor) {
        long val = 0;
        int nbytes = 0;
        while (true) {
            int b = cursor.readU8();

            val = (val << 7) | (b & 0x7f); // concat the 7 least significant bits
            nbytes++;

            if ((b & 0x80) == 0) {
                break;
            }
        }
        return new VarLenQuant(val, nbytes);
    }

    /**
     * Converts a number into VLQ bytes. Reverse of decode.
     */
    public static byte[] encode(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("Only non-negative values can be encoded: " + n);
        }

        // groups come out least significant first
        byte[] reversed = new byte[10];
        int i = 0;
        reversed[i++] = (byte) (n & 0x7f);
        n >>>= 7;
        while (n > 0) {
            reversed[i++] = (byte) ((n & 0x7f) | 0x80);
            n >>>= 7;
        }

        var out = new ByteArrayOutputStream(i);
        while (i > 0) {
            out.write(reversed[--i]);
        }
        return out.toByteArray();
    }
}
