package site.gmsm.sm2.util;

import java.math.BigInteger;
import java.util.Arrays;

/** Byte, hex and integer conversions shared by the SM2 code. */
public final class ConvertUtil {

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private ConvertUtil() {
    }

    /**
     * Big-endian unsigned encoding of {@code value} in exactly {@code length} bytes.
     *
     * @throws IllegalArgumentException if the value is negative or does not fit
     */
    public static byte[] asUnsignedByteArray(int length, BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Value cannot be negative");
        }
        byte[] bytes = value.toByteArray();
        if (bytes.length == length) {
            return bytes;
        }
        int start = (bytes[0] == 0 && bytes.length != 1) ? 1 : 0;
        int count = bytes.length - start;
        if (count > length) {
            throw new IllegalArgumentException("Value too large for " + length + " bytes");
        }
        byte[] tmp = new byte[length];
        System.arraycopy(bytes, start, tmp, tmp.length - count, count);
        return tmp;
    }

    public static byte[] bigIntegerTo32Bytes(BigInteger value) {
        return asUnsignedByteArray(32, value);
    }

    public static BigInteger fromUnsignedByteArray(byte[] buf) {
        return new BigInteger(1, buf);
    }

    public static BigInteger fromUnsignedByteArray(byte[] buf, int off, int length) {
        byte[] mag = buf;
        if (off != 0 || length != buf.length) {
            mag = new byte[length];
            System.arraycopy(buf, off, mag, 0, length);
        }
        return new BigInteger(1, mag);
    }

    public static void intToBigEndian(int n, byte[] bs, int off) {
        bs[off] = (byte) (n >>> 24);
        bs[++off] = (byte) (n >>> 16);
        bs[++off] = (byte) (n >>> 8);
        bs[++off] = (byte) (n);
    }

    public static String byteToHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[2 * i] = HEX_DIGITS[v >>> 4];
            out[2 * i + 1] = HEX_DIGITS[v & 0x0F];
        }
        return new String(out);
    }

    public static byte[] hexToByte(String hex) {
        if (hex == null || (hex.length() & 1) != 0) {
            throw new IllegalArgumentException("Hex string must have an even length");
        }
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(hex.charAt(2 * i), 16);
            int lo = Character.digit(hex.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Invalid hex character at " + (2 * i));
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    /** Equality whose running time depends only on the lengths of the inputs. */
    public static boolean constantTimeAreEqual(byte[] a, byte[] b) {
        if (a == null || b == null) {
            return false;
        }
        if (a.length != b.length) {
            return false;
        }
        int diff = 0;
        for (int i = 0; i < a.length; i++) {
            diff |= a[i] ^ b[i];
        }
        return diff == 0;
    }

    public static byte[] concatenate(byte[]... parts) {
        int total = 0;
        for (byte[] part : parts) {
            total += part.length;
        }
        byte[] out = new byte[total];
        int off = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, out, off, part.length);
            off += part.length;
        }
        return out;
    }

    public static byte[] copyOf(byte[] data) {
        return data == null ? null : data.clone();
    }

    public static void fill(byte[] data, byte value) {
        if (data != null) {
            Arrays.fill(data, value);
        }
    }
}
