package site.gmsm.sm2.keygen;

import java.math.BigInteger;

import site.gmsm.sm2.util.ConvertUtil;

/**
 * SM2 private key d. The constructor enforces 1 &lt;= d &lt; n, so every instance is usable as
 * it stands.
 */
public class ECPrivateKeyParameters extends ECKeyParameters {

    private final BigInteger d;

    public ECPrivateKeyParameters(BigInteger d, ECDomainParameters parameters) {
        super(true, parameters);
        this.d = parameters.validatePrivateScalar(d);
    }

    public BigInteger getD() {
        return d;
    }

    /** Q = [d]G. */
    public ECPublicKeyParameters derivePublicKey() {
        ECDomainParameters params = getParameters();
        return new ECPublicKeyParameters(params.getBaseMultiplier().multiply(params.getG(), d), params);
    }

    /** d as a fixed-width big-endian integer, as wide as the order n. */
    public byte[] getEncoded() {
        return ConvertUtil.asUnsignedByteArray((getParameters().getN().bitLength() + 7) / 8, d);
    }
}
