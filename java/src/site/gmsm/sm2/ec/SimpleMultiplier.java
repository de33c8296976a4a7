package site.gmsm.sm2.ec;

import java.math.BigInteger;

/** Left-to-right binary double-and-add, for arbitrary (non-fixed) points. */
public class SimpleMultiplier extends AbstractECMultiplier {

    @Override
    protected FpPoint multiplyPositive(FpPoint p, BigInteger k) {
        FpPoint q = p.getCurve().getInfinity();
        for (int i = k.bitLength() - 1; i >= 0; --i) {
            q = q.twice();
            if (k.testBit(i)) {
                q = q.add(p);
            }
        }
        return q;
    }
}
