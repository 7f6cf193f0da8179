package io.feydor.inspo.util;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Static functions for working with bytes and their hexadecimal form
 */
public class ByteFns {
    private ByteFns() {}

    /**
     * Converts a byte array into 2-digit hexadecimal representation.
     * For example, {0xF, 0xF, 0xFF, 0x5} => 0f0fff05
     *
     * @param buf the buffer to convert
     * @return a hexadecimal representation of the buffer
     */
    public static String toHex(byte[] buf) {
        var sb = new StringBuilder();
        for (byte b : buf) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    public static String toHex(byte n) {
        return String.format("%02x", (0xFF & n));
    }

    /**
     * Parses a hex string into bytes. Whitespace between byte pairs is ignored, so "00 90 3C 40" works too.
     *
     * @throws IllegalArgumentException When the string does not hold an even number of hex digits
     */
    public static byte[] fromHex(String hexString) {
        String hex = hexString.replaceAll("\\s+", "");
        if (hex.length() % 2 != 0) {
            throw new IllegalArgumentException("Hexstring must be a valid hexadecimal number (it's length must be even). " + hexString);
        }

        byte[] buf = new byte[hex.length() / 2];
        int bp = 0;
        for (int i = 0; i <= hex.length() - 2; i += 2) {
            short b = (short) Integer.parseUnsignedInt(hex.substring(i, i + 2), 16);
            buf[bp++] = (byte) b;
        }
        return buf;
    }

    /**
     * Formats unsigned byte values as "0x80, 0x90, ..."
     */
    public static String toHexList(Collection<Integer> values) {
        return values.stream()
                .map(v -> String.format("0x%02X", v & 0xFF))
                .collect(Collectors.joining(", "));
    }

    /**
     * Widens a buffer to a target length and zero-extends the most significant bytes.
     * Example: widenWithZeros([0xFF, 0xFF], 4) => [0, 0, 0xFF, 0xFF]
     *
     * @param buf       The buffer to widen
     * @param targetLen The length of the widened buffer
     * @return The buffer widened to targetLength and zero-extended
     */
    public static byte[] widenWithZeros(byte[] buf, int targetLen) {
        if (buf.length >= targetLen) {
            return buf;
        }

        byte[] widened = new byte[targetLen];
        int offset = targetLen - buf.length;
        System.arraycopy(buf, 0, widened, offset, buf.length);
        return widened;
    }
}
