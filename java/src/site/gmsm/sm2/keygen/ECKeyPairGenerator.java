package site.gmsm.sm2.keygen;

import java.math.BigInteger;
import java.security.SecureRandom;

import site.gmsm.sm2.ec.FpPoint;

/** SM2 key pair generator. */
public class ECKeyPairGenerator {

    private final ECDomainParameters params;
    private final SecureRandom random;

    public ECKeyPairGenerator(ECDomainParameters params, SecureRandom random) {
        if (params == null) {
            throw new IllegalArgumentException("Domain parameters cannot be null");
        }
        this.params = params;
        this.random = random == null ? new SecureRandom() : random;
    }

    /**
     * Draws d uniformly from [1, n - 1] by rejection, skipping scalars whose NAF weight is
     * too low, and returns (Q = [d]G, d).
     */
    public ECKeyPair generateKeyPair() {
        BigInteger n = params.getN();
        int nBitLength = n.bitLength();
        int minWeight = nBitLength >>> 2;
        BigInteger d;
        do {
            d = new BigInteger(nBitLength, random);
        } while (d.signum() == 0 || d.compareTo(n) >= 0 || getNafWeight(d) < minWeight);
        FpPoint Q = params.getBaseMultiplier().multiply(params.getG(), d);
        return new ECKeyPair(new ECPublicKeyParameters(Q, params), new ECPrivateKeyParameters(d, params));
    }

    private static int getNafWeight(BigInteger k) {
        return k.signum() == 0 ? 0 : k.shiftLeft(1).add(k).xor(k).bitCount();
    }
}
