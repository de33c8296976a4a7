package site.gmsm.sm2.ec;

import java.math.BigInteger;

import site.gmsm.sm2.util.ConvertUtil;

/**
 * Element of the prime field Fp.
 * <p>
 * Values are always canonical, i.e. in {@code [0, q)}; every operation returns a new element.
 */
public final class FpElement {

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private final BigInteger q;
    private final BigInteger x;

    public FpElement(BigInteger q, BigInteger x) {
        if (q == null || q.signum() <= 0) {
            throw new MathDomainException("Field modulus must be positive");
        }
        if (x == null || x.signum() < 0 || x.compareTo(q) >= 0) {
            throw new IllegalArgumentException("Value invalid for Fp field element");
        }
        this.q = q;
        this.x = x;
    }

    private FpElement(BigInteger q, BigInteger x, boolean reduce) {
        this.q = q;
        this.x = reduce ? x.mod(q) : x;
    }

    public BigInteger toBigInteger() {
        return x;
    }

    public BigInteger getQ() {
        return q;
    }

    public int getFieldSize() {
        return q.bitLength();
    }

    public int bitLength() {
        return x.bitLength();
    }

    public boolean isZero() {
        return x.signum() == 0;
    }

    public boolean isOne() {
        return x.equals(BigInteger.ONE);
    }

    public boolean testBitZero() {
        return x.testBit(0);
    }

    public FpElement add(FpElement b) {
        checkField(b);
        BigInteger sum = x.add(b.x);
        if (sum.compareTo(q) >= 0) {
            sum = sum.subtract(q);
        }
        return new FpElement(q, sum, false);
    }

    public FpElement subtract(FpElement b) {
        checkField(b);
        BigInteger diff = x.subtract(b.x);
        if (diff.signum() < 0) {
            diff = diff.add(q);
        }
        return new FpElement(q, diff, false);
    }

    public FpElement multiply(FpElement b) {
        checkField(b);
        return new FpElement(q, x.multiply(b.x), true);
    }

    /** Multiplies by a small non-negative integer constant. */
    public FpElement multiply(int k) {
        return new FpElement(q, x.multiply(BigInteger.valueOf(k)), true);
    }

    public FpElement divide(FpElement b) {
        return multiply(b.invert());
    }

    public FpElement negate() {
        return x.signum() == 0 ? this : new FpElement(q, q.subtract(x), false);
    }

    public FpElement square() {
        return new FpElement(q, x.multiply(x), true);
    }

    public FpElement invert() {
        if (isZero()) {
            throw new MathDomainException("Zero has no inverse in Fp");
        }
        return new FpElement(q, x.modInverse(q), false);
    }

    /**
     * Square root in Fp.
     *
     * @return a root, or {@code null} when this element is a non-residue
     */
    public FpElement sqrt() {
        if (isZero() || isOne()) {
            return this;
        }
        if (!q.testBit(0)) {
            throw new UnsupportedOperationException("Square root requires an odd prime modulus");
        }
        if (!isQuadraticResidue(x)) {
            return null;
        }
        if (q.testBit(1)) {
            // q == 3 (mod 4)
            BigInteger e = q.shiftRight(2).add(BigInteger.ONE);
            return checkSqrt(new FpElement(q, x.modPow(e, q), false));
        }
        return checkSqrt(tonelliShanks());
    }

    /** Fixed-width big-endian encoding, {@code ceil(fieldSize / 8)} bytes. */
    public byte[] getEncoded() {
        return ConvertUtil.asUnsignedByteArray((getFieldSize() + 7) / 8, x);
    }

    private FpElement tonelliShanks() {
        BigInteger qMinusOne = q.subtract(BigInteger.ONE);
        int s = qMinusOne.getLowestSetBit();
        BigInteger t = qMinusOne.shiftRight(s);

        BigInteger z = TWO;
        while (isQuadraticResidue(z)) {
            z = z.add(BigInteger.ONE);
        }

        BigInteger c = z.modPow(t, q);
        BigInteger r = x.modPow(t.add(BigInteger.ONE).shiftRight(1), q);
        BigInteger u = x.modPow(t, q);
        int m = s;
        while (!u.equals(BigInteger.ONE)) {
            int i = 0;
            BigInteger u2 = u;
            while (!u2.equals(BigInteger.ONE)) {
                u2 = u2.multiply(u2).mod(q);
                i++;
            }
            BigInteger b = c;
            for (int j = 0; j < m - i - 1; j++) {
                b = b.multiply(b).mod(q);
            }
            r = r.multiply(b).mod(q);
            c = b.multiply(b).mod(q);
            u = u.multiply(c).mod(q);
            m = i;
        }
        return new FpElement(q, r, false);
    }

    private boolean isQuadraticResidue(BigInteger v) {
        return v.modPow(q.shiftRight(1), q).equals(BigInteger.ONE);
    }

    private FpElement checkSqrt(FpElement z) {
        return z.square().equals(this) ? z : null;
    }

    private void checkField(FpElement b) {
        if (!q.equals(b.q)) {
            throw new IllegalArgumentException("Field elements are not in the same field");
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FpElement)) {
            return false;
        }
        FpElement o = (FpElement) other;
        return q.equals(o.q) && x.equals(o.x);
    }

    @Override
    public int hashCode() {
        return q.hashCode() ^ x.hashCode();
    }

    @Override
    public String toString() {
        return x.toString(16);
    }
}
