package site.gmsm.sm2.ec;

import java.math.BigInteger;

/**
 * Point on an {@link FpCurve}, held in Jacobian coordinates (X, Y, Z) with affine
 * x = X/Z^2, y = Y/Z^3. The point at infinity has no coordinates.
 * <p>
 * Instances are immutable; {@link #normalize()} yields the affine form (Z = 1).
 */
public final class FpPoint {

    private final FpCurve curve;
    private final FpElement x, y, z;

    FpPoint(FpCurve curve, FpElement x, FpElement y, FpElement z) {
        this.curve = curve;
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public FpCurve getCurve() {
        return curve;
    }

    public boolean isInfinity() {
        return x == null || y == null;
    }

    public boolean isNormalized() {
        return isInfinity() || z.isOne();
    }

    /** Raw Jacobian X coordinate; equals the affine x only once normalized. */
    public FpElement getXCoord() {
        return x;
    }

    /** Raw Jacobian Y coordinate; equals the affine y only once normalized. */
    public FpElement getYCoord() {
        return y;
    }

    public FpElement getZCoord() {
        return z;
    }

    public FpElement getAffineXCoord() {
        checkFinite();
        return normalize().x;
    }

    public FpElement getAffineYCoord() {
        checkFinite();
        return normalize().y;
    }

    /**
     * Affine form of this point. A zero Z coordinate maps to the curve's infinity.
     */
    public FpPoint normalize() {
        if (isNormalized()) {
            return this;
        }
        if (z.isZero()) {
            return curve.getInfinity();
        }
        return normalize(z.invert());
    }

    FpPoint normalize(FpElement zInv) {
        FpElement zInv2 = zInv.square();
        FpElement zInv3 = zInv2.multiply(zInv);
        return curve.createRawPoint(x.multiply(zInv2), y.multiply(zInv3));
    }

    /**
     * Curve membership, plus the subgroup check [n]P = infinity when the curve's
     * cofactor is not one.
     */
    public boolean isValid() {
        if (isInfinity()) {
            return true;
        }
        if (z.isZero()) {
            return false;
        }
        if (!satisfiesCurveEquation()) {
            return false;
        }
        BigInteger h = curve.getCofactor();
        BigInteger n = curve.getOrder();
        if (h != null && n != null && !h.equals(BigInteger.ONE)) {
            return timesOrder(n).isInfinity();
        }
        return true;
    }

    public FpPoint add(FpPoint b) {
        checkCurve(b);
        if (this.isInfinity()) {
            return b;
        }
        if (b.isInfinity()) {
            return this;
        }
        if (this == b) {
            return twice();
        }

        FpElement Z1 = this.z, Z2 = b.z;
        FpElement Z1Sq = Z1.square(), Z2Sq = Z2.square();
        FpElement U1 = this.x.multiply(Z2Sq);
        FpElement U2 = b.x.multiply(Z1Sq);
        FpElement S1 = this.y.multiply(Z2Sq).multiply(Z2);
        FpElement S2 = b.y.multiply(Z1Sq).multiply(Z1);

        FpElement H = U2.subtract(U1);
        FpElement R = S2.subtract(S1);
        if (H.isZero()) {
            if (R.isZero()) {
                return twice();
            }
            // b == -this
            return curve.getInfinity();
        }

        FpElement HSq = H.square();
        FpElement G = HSq.multiply(H);
        FpElement V = U1.multiply(HSq);
        FpElement X3 = R.square().subtract(G).subtract(V.multiply(2));
        FpElement Y3 = R.multiply(V.subtract(X3)).subtract(S1.multiply(G));
        FpElement Z3 = H.multiply(Z1).multiply(Z2);
        return new FpPoint(curve, X3, Y3, Z3);
    }

    public FpPoint twice() {
        if (isInfinity()) {
            return this;
        }
        if (y.isZero()) {
            return curve.getInfinity();
        }
        FpElement XX = x.square();
        FpElement YY = y.square();
        FpElement ZZ = z.square();
        FpElement S = x.multiply(YY).multiply(4);
        FpElement M = XX.multiply(3).add(curve.getA().multiply(ZZ.square()));
        FpElement X3 = M.square().subtract(S.multiply(2));
        FpElement Y3 = M.multiply(S.subtract(X3)).subtract(YY.square().multiply(8));
        FpElement Z3 = y.multiply(z).multiply(2);
        return new FpPoint(curve, X3, Y3, Z3);
    }

    public FpPoint negate() {
        if (isInfinity()) {
            return this;
        }
        return new FpPoint(curve, x, y.negate(), z);
    }

    public FpPoint subtract(FpPoint b) {
        if (b.isInfinity()) {
            return this;
        }
        return add(b.negate());
    }

    /** 2P + b. */
    public FpPoint twicePlus(FpPoint b) {
        return twice().add(b);
    }

    public FpPoint threeTimes() {
        return twicePlus(this);
    }

    /** [2^e]P by repeated doubling. */
    public FpPoint timesPow2(int e) {
        if (e < 0) {
            throw new IllegalArgumentException("'e' cannot be negative");
        }
        FpPoint p = this;
        while (--e >= 0) {
            p = p.twice();
        }
        return p;
    }

    /** [k]P using the curve's configured multiplier. */
    public FpPoint multiply(BigInteger k) {
        return curve.getMultiplier().multiply(this, k);
    }

    /**
     * Infinity as 0x00, otherwise 0x04||X||Y or 0x02/0x03||X with fixed-width big-endian
     * coordinates.
     */
    public byte[] getEncoded(boolean compressed) {
        if (isInfinity()) {
            return new byte[1];
        }
        FpPoint normed = normalize();
        byte[] X = normed.x.getEncoded();
        if (compressed) {
            byte[] PO = new byte[X.length + 1];
            PO[0] = (byte) (normed.y.testBitZero() ? 0x03 : 0x02);
            System.arraycopy(X, 0, PO, 1, X.length);
            return PO;
        }
        byte[] Y = normed.y.getEncoded();
        byte[] PO = new byte[X.length + Y.length + 1];
        PO[0] = 0x04;
        System.arraycopy(X, 0, PO, 1, X.length);
        System.arraycopy(Y, 0, PO, X.length + 1, Y.length);
        return PO;
    }

    public byte[] getEncoded() {
        return getEncoded(false);
    }

    private boolean satisfiesCurveEquation() {
        // Y^2 = X^3 + aXZ^4 + bZ^6
        FpElement lhs = y.square();
        FpElement Z2 = z.square();
        FpElement Z4 = Z2.square();
        FpElement Z6 = Z4.multiply(Z2);
        FpElement rhs = x.square().multiply(x)
                .add(curve.getA().multiply(x).multiply(Z4))
                .add(curve.getB().multiply(Z6));
        return lhs.equals(rhs);
    }

    private FpPoint timesOrder(BigInteger n) {
        FpPoint r = curve.getInfinity();
        for (int i = n.bitLength() - 1; i >= 0; --i) {
            r = r.twice();
            if (n.testBit(i)) {
                r = r.add(this);
            }
        }
        return r;
    }

    private void checkFinite() {
        if (isInfinity()) {
            throw new IllegalStateException("Point at infinity has no affine coordinates");
        }
    }

    private void checkCurve(FpPoint b) {
        if (b == null) {
            throw new IllegalArgumentException("Point cannot be null");
        }
        if (this.curve != b.curve && !this.curve.equals(b.curve)) {
            throw new IllegalArgumentException("Points are on different curves");
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FpPoint)) {
            return false;
        }
        FpPoint o = (FpPoint) other;
        boolean i1 = this.isInfinity(), i2 = o.isInfinity();
        if (i1 || i2) {
            return i1 && i2 && curve.equals(o.curve);
        }
        if (!curve.equals(o.curve)) {
            return false;
        }
        FpElement Z1Sq = this.z.square(), Z2Sq = o.z.square();
        return this.x.multiply(Z2Sq).equals(o.x.multiply(Z1Sq))
                && this.y.multiply(Z2Sq).multiply(o.z).equals(o.y.multiply(Z1Sq).multiply(this.z));
    }

    @Override
    public int hashCode() {
        if (isInfinity()) {
            return ~curve.hashCode();
        }
        FpPoint normed = normalize();
        return curve.hashCode() ^ 17 * normed.x.hashCode() ^ 257 * normed.y.hashCode();
    }

    @Override
    public String toString() {
        if (isInfinity()) {
            return "INF";
        }
        return "(" + x + "," + y + "," + z + ")";
    }
}
