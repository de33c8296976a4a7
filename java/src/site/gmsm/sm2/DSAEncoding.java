package site.gmsm.sm2;

import java.io.IOException;
import java.math.BigInteger;

/** Wire encoding of an (r, s) signature pair. */
public interface DSAEncoding {

    /**
     * @return {r, s}
     * @throws IOException if the encoding is malformed or a value is outside [1, n - 1]
     */
    BigInteger[] decode(BigInteger n, byte[] encoding) throws IOException;

    /**
     * @throws IllegalArgumentException if r or s is outside [1, n - 1]
     */
    byte[] encode(BigInteger n, BigInteger r, BigInteger s) throws IOException;
}
