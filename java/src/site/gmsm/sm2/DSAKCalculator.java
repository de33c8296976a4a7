package site.gmsm.sm2;

import java.math.BigInteger;
import java.security.SecureRandom;

/** Source of the per-signature secret k. */
public interface DSAKCalculator {

    boolean isDeterministic();

    void init(BigInteger n, SecureRandom random);

    /** A fresh k in [1, n - 1]. */
    BigInteger nextK();
}
