package site.gmsm.sm2;

import java.math.BigInteger;
import java.security.SecureRandom;

/** Uniform k in [1, n - 1] by rejection sampling; out-of-range draws are discarded. */
public class RandomDSAKCalculator implements DSAKCalculator {

    private BigInteger q;
    private SecureRandom random;

    @Override
    public boolean isDeterministic() {
        return false;
    }

    @Override
    public void init(BigInteger n, SecureRandom random) {
        if (n == null || n.compareTo(BigInteger.ONE) <= 0) {
            throw new IllegalArgumentException("Order must be greater than one");
        }
        this.q = n;
        this.random = random == null ? new SecureRandom() : random;
    }

    @Override
    public BigInteger nextK() {
        if (q == null) {
            throw new IllegalStateException("K calculator not initialised");
        }
        int qBitLength = q.bitLength();
        BigInteger k;
        do {
            k = new BigInteger(qBitLength, random);
        } while (k.signum() < 1 || k.compareTo(q) >= 0);
        return k;
    }
}
