package site.gmsm.sm2.ec;

import java.math.BigInteger;

/** Point algorithms that work across multipliers. */
public final class ECAlgorithms {

    private ECAlgorithms() {
    }

    /**
     * Checks a point belongs to the given curve and satisfies its equation, returning the
     * normalized form.
     *
     * @throws InvalidPointException if the point is from another curve or not valid
     */
    public static FpPoint importPoint(FpCurve curve, FpPoint p) {
        if (p == null) {
            throw new InvalidPointException("Point cannot be null");
        }
        if (!curve.equals(p.getCurve())) {
            throw new InvalidPointException("Point must be on the same curve");
        }
        if (!p.isValid()) {
            throw new InvalidPointException("Invalid point");
        }
        return p.normalize();
    }

    /** [a]P + [b]Q by Shamir's trick: one shared chain of doublings. */
    public static FpPoint sumOfTwoMultiplies(FpPoint P, BigInteger a, FpPoint Q, BigInteger b) {
        FpCurve c = P.getCurve();
        if (!c.equals(Q.getCurve())) {
            throw new IllegalArgumentException("Points must be on the same curve");
        }
        if (a.signum() < 0 || b.signum() < 0) {
            throw new IllegalArgumentException("Scalars cannot be negative");
        }
        FpPoint PQ = P.add(Q);
        FpPoint R = c.getInfinity();
        int bits = Math.max(a.bitLength(), b.bitLength());
        for (int i = bits - 1; i >= 0; --i) {
            R = R.twice();
            boolean ai = a.testBit(i), bi = b.testBit(i);
            if (ai && bi) {
                R = R.add(PQ);
            } else if (ai) {
                R = R.add(P);
            } else if (bi) {
                R = R.add(Q);
            }
        }
        R = R.normalize();
        if (!R.isValid()) {
            throw new IllegalStateException("Invalid point from multiplication");
        }
        return R;
    }
}
