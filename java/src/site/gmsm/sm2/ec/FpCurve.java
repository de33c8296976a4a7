package site.gmsm.sm2.ec;

import java.math.BigInteger;
import java.util.Objects;

import site.gmsm.sm2.util.ConvertUtil;

/** Short Weierstrass curve y^2 = x^3 + ax + b over the prime field Fp. */
public final class FpCurve {

    private final BigInteger q;
    private final FpElement a, b;
    private final BigInteger order, cofactor;
    private final AbstractECMultiplier multiplier;
    private final FpPoint infinity;

    public FpCurve(BigInteger q, BigInteger a, BigInteger b) {
        this(q, a, b, null, null);
    }

    public FpCurve(BigInteger q, BigInteger a, BigInteger b, BigInteger order, BigInteger cofactor) {
        this(new SimpleMultiplier(), q, a, b, order, cofactor);
    }

    public FpCurve(AbstractECMultiplier multiplier, BigInteger q, BigInteger a, BigInteger b, BigInteger order, BigInteger cofactor) {
        if (multiplier == null) {
            throw new IllegalArgumentException("Multiplier cannot be null");
        }
        if (q == null || q.signum() <= 0 || !q.testBit(0)) {
            throw new MathDomainException("Curve modulus must be an odd positive prime");
        }
        this.multiplier = multiplier;
        this.q = q;
        this.a = fromBigInteger(a);
        this.b = fromBigInteger(b);
        this.order = order;
        this.cofactor = cofactor;
        this.infinity = new FpPoint(this, null, null, null);
        checkNonSingular();
    }

    public int getFieldSize() {
        return q.bitLength();
    }

    public BigInteger getQ() {
        return q;
    }

    public FpElement getA() {
        return a;
    }

    public FpElement getB() {
        return b;
    }

    public BigInteger getOrder() {
        return order;
    }

    public BigInteger getCofactor() {
        return cofactor;
    }

    public AbstractECMultiplier getMultiplier() {
        return multiplier;
    }

    public FpPoint getInfinity() {
        return infinity;
    }

    public int getFieldElementEncodingLength() {
        return (getFieldSize() + 7) / 8;
    }

    public int getAffinePointEncodingLength(boolean compressed) {
        int fieldLength = getFieldElementEncodingLength();
        return compressed ? 1 + fieldLength : 1 + 2 * fieldLength;
    }

    public FpElement fromBigInteger(BigInteger x) {
        if (x == null || x.signum() < 0 || x.compareTo(q) >= 0) {
            throw new IllegalArgumentException("Value invalid for field element of this curve");
        }
        return new FpElement(q, x);
    }

    /**
     * Creates an affine point, checking it satisfies the curve equation.
     *
     * @throws InvalidPointException if the point is not on the curve
     */
    public FpPoint createPoint(BigInteger x, BigInteger y) {
        FpElement ex, ey;
        try {
            ex = fromBigInteger(x);
            ey = fromBigInteger(y);
        } catch (IllegalArgumentException e) {
            throw new InvalidPointException("Point coordinates out of range", e);
        }
        FpPoint p = createRawPoint(ex, ey);
        if (!p.isValid()) {
            throw new InvalidPointException("Point is not on the curve");
        }
        return p;
    }

    /** Trusted construction for points already known to be on the curve. */
    FpPoint createRawPoint(FpElement x, FpElement y) {
        return new FpPoint(this, x, y, fromBigInteger(BigInteger.ONE));
    }

    /**
     * Decodes 0x00 (infinity), 0x04||X||Y (uncompressed) or 0x02/0x03||X (compressed).
     *
     * @throws InvalidPointException on any malformed encoding or off-curve point
     */
    public FpPoint decodePoint(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new InvalidPointException("Empty point encoding");
        }
        int expectedLength = getFieldElementEncodingLength();
        byte type = encoded[0];
        switch (type) {
        case 0x00: {
            if (encoded.length != 1) {
                throw new InvalidPointException("Incorrect length for infinity encoding");
            }
            return infinity;
        }
        case 0x02:
        case 0x03: {
            if (encoded.length != (expectedLength + 1)) {
                throw new InvalidPointException("Incorrect length for compressed encoding");
            }
            BigInteger X = ConvertUtil.fromUnsignedByteArray(encoded, 1, expectedLength);
            return decompressPoint(type == 0x03, X);
        }
        case 0x04: {
            if (encoded.length != (2 * expectedLength + 1)) {
                throw new InvalidPointException("Incorrect length for uncompressed encoding");
            }
            BigInteger X = ConvertUtil.fromUnsignedByteArray(encoded, 1, expectedLength);
            BigInteger Y = ConvertUtil.fromUnsignedByteArray(encoded, 1 + expectedLength, expectedLength);
            return createPoint(X, Y);
        }
        default:
            throw new InvalidPointException("Invalid point encoding 0x" + Integer.toString(type & 0xFF, 16));
        }
    }

    /**
     * Brings every point to affine form using one shared field inversion.
     * Entries may be {@code null}; points at infinity are left as they are.
     */
    public void normalizeAll(FpPoint[] points) {
        checkPoints(points, 0, points.length);
        int count = 0;
        int[] indices = new int[points.length];
        for (int i = 0; i < points.length; ++i) {
            FpPoint p = points[i];
            if (p != null && !p.isNormalized()) {
                indices[count++] = i;
            }
        }
        if (count == 0) {
            return;
        }
        FpElement[] zs = new FpElement[count];
        for (int j = 0; j < count; ++j) {
            zs[j] = points[indices[j]].getZCoord();
        }
        // Montgomery's trick: prefix products, one inversion, then walk back
        FpElement[] prefix = new FpElement[count];
        prefix[0] = zs[0];
        for (int j = 1; j < count; ++j) {
            prefix[j] = prefix[j - 1].multiply(zs[j]);
        }
        FpElement inv = prefix[count - 1].invert();
        for (int j = count - 1; j > 0; --j) {
            FpElement zInv = inv.multiply(prefix[j - 1]);
            inv = inv.multiply(zs[j]);
            points[indices[j]] = points[indices[j]].normalize(zInv);
        }
        points[indices[0]] = points[indices[0]].normalize(inv);
    }

    void checkPoints(FpPoint[] points, int off, int len) {
        if (points == null) {
            throw new IllegalArgumentException("Points cannot be null");
        }
        if (off < 0 || len < 0 || (off > (points.length - len))) {
            throw new IllegalArgumentException("Points out of range");
        }
        for (int i = 0; i < len; ++i) {
            FpPoint point = points[off + i];
            if (null != point && !this.equals(point.getCurve())) {
                throw new IllegalArgumentException("Point is not on this curve");
            }
        }
    }

    private FpPoint decompressPoint(boolean yOdd, BigInteger X) {
        if (X.compareTo(q) >= 0) {
            throw new InvalidPointException("Compressed X coordinate out of range");
        }
        FpElement x = fromBigInteger(X);
        FpElement rhs = x.square().add(a).multiply(x).add(b);
        FpElement y = rhs.sqrt();
        if (y == null) {
            throw new InvalidPointException("Invalid point compression");
        }
        if (y.testBitZero() != yOdd) {
            if (y.isZero()) {
                throw new InvalidPointException("Invalid point compression");
            }
            y = y.negate();
        }
        return createRawPoint(x, y);
    }

    private void checkNonSingular() {
        // 4a^3 + 27b^2 != 0 (mod q)
        FpElement discriminant = a.square().multiply(a).multiply(4).add(b.square().multiply(27));
        if (discriminant.isZero()) {
            throw new MathDomainException("Curve parameters describe a singular curve");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FpCurve)) {
            return false;
        }
        FpCurve other = (FpCurve) obj;
        return q.equals(other.q) && a.equals(other.a) && b.equals(other.b)
                && Objects.equals(order, other.order) && Objects.equals(cofactor, other.cofactor);
    }

    @Override
    public int hashCode() {
        return q.hashCode() ^ Integer.rotateLeft(a.hashCode(), 8) ^ Integer.rotateLeft(b.hashCode(), 16);
    }
}
