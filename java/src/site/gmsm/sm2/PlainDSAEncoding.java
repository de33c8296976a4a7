package site.gmsm.sm2;

import java.io.IOException;
import java.math.BigInteger;

import site.gmsm.sm2.util.ConvertUtil;

/** r || s, each as a fixed-width big-endian integer as wide as the order n. */
public class PlainDSAEncoding implements DSAEncoding {

    public static final PlainDSAEncoding INSTANCE = new PlainDSAEncoding();

    @Override
    public byte[] encode(BigInteger n, BigInteger r, BigInteger s) {
        int valueLength = getValueLength(n);
        byte[] result = new byte[valueLength * 2];
        encodeValue(n, r, result, 0, valueLength);
        encodeValue(n, s, result, valueLength, valueLength);
        return result;
    }

    @Override
    public BigInteger[] decode(BigInteger n, byte[] encoding) throws IOException {
        int valueLength = getValueLength(n);
        if (encoding == null || encoding.length != valueLength * 2) {
            throw new IOException("Encoding has incorrect length");
        }
        return new BigInteger[] {
                decodeValue(n, encoding, 0, valueLength),
                decodeValue(n, encoding, valueLength, valueLength) };
    }

    protected BigInteger checkValue(BigInteger n, BigInteger x) {
        if (x == null || x.signum() < 1 || x.compareTo(n) >= 0) {
            throw new IllegalArgumentException("Value out of range");
        }
        return x;
    }

    protected BigInteger decodeValue(BigInteger n, byte[] buf, int off, int len) throws IOException {
        BigInteger x = ConvertUtil.fromUnsignedByteArray(buf, off, len);
        if (x.signum() < 1 || x.compareTo(n) >= 0) {
            throw new IOException("Value out of range");
        }
        return x;
    }

    private void encodeValue(BigInteger n, BigInteger x, byte[] buf, int off, int len) {
        byte[] bs = ConvertUtil.asUnsignedByteArray(len, checkValue(n, x));
        System.arraycopy(bs, 0, buf, off, len);
    }

    private static int getValueLength(BigInteger n) {
        return (n.bitLength() + 7) / 8;
    }
}
