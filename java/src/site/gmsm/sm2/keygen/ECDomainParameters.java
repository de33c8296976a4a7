package site.gmsm.sm2.keygen;

import java.math.BigInteger;

import site.gmsm.sm2.ec.ECAlgorithms;
import site.gmsm.sm2.ec.FixedPointCombMultiplier;
import site.gmsm.sm2.ec.FpCurve;
import site.gmsm.sm2.ec.FpPoint;
import site.gmsm.sm2.ec.InvalidPointException;

/**
 * Curve instance shared by every key and protocol object: curve, base point G, order n and
 * cofactor h. Immutable; build once and pass the same instance around.
 * <p>
 * Also owns the comb multiplier for G so that its table is computed once per domain.
 */
public final class ECDomainParameters {

    private final FpCurve curve;
    private final FpPoint G;
    private final BigInteger n;
    private final BigInteger h;
    private final FixedPointCombMultiplier baseMultiplier = new FixedPointCombMultiplier();

    public ECDomainParameters(FpCurve curve, FpPoint G, BigInteger n) {
        this(curve, G, n, BigInteger.ONE);
    }

    public ECDomainParameters(FpCurve curve, FpPoint G, BigInteger n, BigInteger h) {
        if (curve == null) {
            throw new IllegalArgumentException("Curve cannot be null");
        }
        if (n == null || n.signum() <= 0) {
            throw new IllegalArgumentException("Order must be positive");
        }
        if (h == null || h.signum() <= 0) {
            throw new IllegalArgumentException("Cofactor must be positive");
        }
        FpPoint g = ECAlgorithms.importPoint(curve, G);
        if (g.isInfinity()) {
            throw new InvalidPointException("Base point cannot be infinity");
        }
        this.curve = curve;
        this.G = g;
        this.n = n;
        this.h = h;
    }

    public FpCurve getCurve() {
        return curve;
    }

    public FpPoint getG() {
        return G;
    }

    public BigInteger getN() {
        return n;
    }

    public BigInteger getH() {
        return h;
    }

    /** Multiplier to use for [k]G. */
    public FixedPointCombMultiplier getBaseMultiplier() {
        return baseMultiplier;
    }

    /**
     * @throws InvalidKeyParameterException unless 1 &lt;= d &lt; n
     */
    public BigInteger validatePrivateScalar(BigInteger d) {
        if (d == null) {
            throw new InvalidKeyParameterException("Scalar cannot be null");
        }
        if (d.compareTo(BigInteger.ONE) < 0 || d.compareTo(n) >= 0) {
            throw new InvalidKeyParameterException("Scalar is not in the interval [1, n - 1]");
        }
        return d;
    }

    /**
     * Checks Q is finite, on this curve and in the subgroup of order n.
     *
     * @return the normalized point
     * @throws InvalidKeyParameterException otherwise
     */
    public FpPoint validatePublicPoint(FpPoint q) {
        if (q == null) {
            throw new InvalidKeyParameterException("Point cannot be null");
        }
        FpPoint normed;
        try {
            normed = ECAlgorithms.importPoint(curve, q);
        } catch (InvalidPointException e) {
            throw new InvalidKeyParameterException("Point is not valid for these domain parameters", e);
        }
        if (normed.isInfinity()) {
            throw new InvalidKeyParameterException("Point at infinity");
        }
        if (!curve.getMultiplier().multiply(normed, n).isInfinity()) {
            throw new InvalidKeyParameterException("Point is not in the subgroup of order n");
        }
        return normed;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ECDomainParameters)) {
            return false;
        }
        ECDomainParameters other = (ECDomainParameters) obj;
        return curve.equals(other.curve) && G.equals(other.G) && n.equals(other.n) && h.equals(other.h);
    }

    @Override
    public int hashCode() {
        int hc = curve.hashCode();
        hc = 37 * hc + G.hashCode();
        hc = 37 * hc + n.hashCode();
        hc = 37 * hc + h.hashCode();
        return hc;
    }
}
