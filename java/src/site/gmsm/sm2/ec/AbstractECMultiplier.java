package site.gmsm.sm2.ec;

import java.math.BigInteger;

/** Abstract base class for EC point multiplication algorithms. */
public abstract class AbstractECMultiplier {

    /**
     * Computes [k]P for k &gt;= 0. The result is always normalized.
     *
     * @throws IllegalArgumentException if k is negative
     */
    public FpPoint multiply(FpPoint p, BigInteger k) {
        if (p == null || k == null) {
            throw new IllegalArgumentException("Point and scalar cannot be null");
        }
        int sign = k.signum();
        if (sign < 0) {
            throw new IllegalArgumentException("Scalar cannot be negative");
        }
        if (sign == 0 || p.isInfinity()) {
            return p.getCurve().getInfinity();
        }
        if (k.equals(BigInteger.ONE)) {
            return p.normalize();
        }
        return validatePoint(multiplyPositive(p, k).normalize());
    }

    private static FpPoint validatePoint(FpPoint p) {
        if (!p.isValid()) {
            throw new IllegalStateException("Invalid point from multiplication");
        }
        return p;
    }

    protected abstract FpPoint multiplyPositive(FpPoint p, BigInteger k);
}
