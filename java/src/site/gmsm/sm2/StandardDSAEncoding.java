package site.gmsm.sm2;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;

/**
 * DER encoding of SEQUENCE { INTEGER r, INTEGER s }. Decoding is strict: non-minimal
 * lengths or integers, negative values, trailing bytes and values outside [1, n - 1] are
 * all rejected.
 */
public class StandardDSAEncoding implements DSAEncoding {

    public static final StandardDSAEncoding INSTANCE = new StandardDSAEncoding();

    private static final int TAG_INTEGER = 0x02;
    private static final int TAG_SEQUENCE = 0x30;

    protected StandardDSAEncoding() {
    }

    @Override
    public BigInteger[] decode(BigInteger n, byte[] encoding) throws IOException {
        if (encoding == null) {
            throw new IOException("Missing signature");
        }
        int[] pos = new int[1];
        if (readTag(encoding, pos) != TAG_SEQUENCE) {
            throw new IOException("Expected a DER SEQUENCE");
        }
        int length = readLength(encoding, pos);
        if (pos[0] + length != encoding.length) {
            throw new IOException("Malformed signature: sequence length does not match the encoding");
        }
        BigInteger r = decodeValue(n, readInteger(encoding, pos));
        BigInteger s = decodeValue(n, readInteger(encoding, pos));
        if (pos[0] != encoding.length) {
            throw new IOException("Malformed signature: trailing data");
        }
        return new BigInteger[] { r, s };
    }

    @Override
    public byte[] encode(BigInteger n, BigInteger r, BigInteger s) throws IOException {
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        writeInteger(content, checkValue(n, r));
        writeInteger(content, checkValue(n, s));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(TAG_SEQUENCE);
        writeLength(out, content.size());
        content.writeTo(out);
        return out.toByteArray();
    }

    protected BigInteger checkValue(BigInteger n, BigInteger x) {
        if (x == null || x.signum() < 1 || (n != null && x.compareTo(n) >= 0)) {
            throw new IllegalArgumentException("Value out of range");
        }
        return x;
    }

    protected BigInteger decodeValue(BigInteger n, BigInteger x) throws IOException {
        if (x.signum() < 1 || (n != null && x.compareTo(n) >= 0)) {
            throw new IOException("Value out of range");
        }
        return x;
    }

    private static int readTag(byte[] buf, int[] pos) throws IOException {
        if (pos[0] >= buf.length) {
            throw new IOException("Unexpected end of encoding");
        }
        return buf[pos[0]++] & 0xFF;
    }

    private static int readLength(byte[] buf, int[] pos) throws IOException {
        int first = readTag(buf, pos);
        if (first < 0x80) {
            return first;
        }
        int count = first & 0x7F;
        if (count == 0 || count > 3) {
            throw new IOException("Unsupported DER length encoding");
        }
        int length = 0;
        for (int i = 0; i < count; i++) {
            length = (length << 8) | readTag(buf, pos);
        }
        // DER: long form only when needed, with no leading zero octet
        if (length < 0x80 || (length >>> (8 * (count - 1))) == 0) {
            throw new IOException("Non-minimal DER length");
        }
        return length;
    }

    private static BigInteger readInteger(byte[] buf, int[] pos) throws IOException {
        if (readTag(buf, pos) != TAG_INTEGER) {
            throw new IOException("Expected a DER INTEGER");
        }
        int length = readLength(buf, pos);
        if (length == 0 || pos[0] + length > buf.length) {
            throw new IOException("Malformed INTEGER");
        }
        int start = pos[0];
        if (length > 1) {
            int b0 = buf[start], b1 = buf[start + 1];
            if ((b0 == 0 && (b1 & 0x80) == 0) || (b0 == -1 && (b1 & 0x80) != 0)) {
                throw new IOException("Non-minimal INTEGER");
            }
        }
        byte[] value = new byte[length];
        System.arraycopy(buf, start, value, 0, length);
        pos[0] += length;
        return new BigInteger(value);
    }

    private static void writeInteger(ByteArrayOutputStream out, BigInteger x) {
        byte[] bytes = x.toByteArray();
        out.write(TAG_INTEGER);
        writeLength(out, bytes.length);
        out.write(bytes, 0, bytes.length);
    }

    private static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 0x80) {
            out.write(length);
            return;
        }
        int count = 0;
        for (int v = length; v != 0; v >>>= 8) {
            count++;
        }
        out.write(0x80 | count);
        for (int i = count - 1; i >= 0; i--) {
            out.write(length >>> (8 * i));
        }
    }
}
