package site.gmsm.sm2;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import site.gmsm.crypto.Digest;
import site.gmsm.sm2.ec.AbstractECMultiplier;
import site.gmsm.sm2.ec.FpCurve;
import site.gmsm.sm2.ec.FpElement;
import site.gmsm.sm2.ec.FpPoint;
import site.gmsm.sm2.ec.SimpleMultiplier;
import site.gmsm.sm2.keygen.ECDomainParameters;
import site.gmsm.sm2.keygen.ECKeyPair;
import site.gmsm.sm2.keygen.ECKeyPairGenerator;
import site.gmsm.sm2.keygen.ECPrivateKeyParameters;
import site.gmsm.sm2.keygen.ECPublicKeyParameters;

/**
 * SM2 initializer: sets up the elliptic curve and domain parameters from hex parameters.
 * The domain is built once in the constructor; hand the same initializer (or its
 * {@link #getDomainParameters()}) to every signer, cipher and key exchange.
 */
public class SM2Initializer {

    /** p, a, b, n, Gx, Gy of the recommended curve sm2p256v1. */
    public static final String[] SM2_PARAMS = new String[] {
            "FFFFFFFEFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF00000000FFFFFFFFFFFFFFFF",
            "FFFFFFFEFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF00000000FFFFFFFFFFFFFFFC",
            "28E9FA9E9D9F5E344D5A9E4BCF6509A7F39789F515AB8F92DDBCBD414D940E93",
            "FFFFFFFEFFFFFFFFFFFFFFFFFFFFFFFF7203DF6B21C6052B53BBF40939D54123",
            "32C4AE2C1F1981195F9904466A39C9948FE30BBFF2660BE1715A4589334C74C7",
            "BC3736A2F4F6779C59BDCEE36B692153D0A9877CC62A474002DF32E52139F0A0"
    };

    /** Identity used when a signer or key exchange party supplies none. */
    public static final byte[] DEFAULT_USER_ID = "1234567812345678".getBytes(StandardCharsets.US_ASCII);

    private final ECDomainParameters domain;

    public SM2Initializer() {
        this(SM2_PARAMS, new SimpleMultiplier());
    }

    public SM2Initializer(String[] params, AbstractECMultiplier multiplier) {
        this(params, BigInteger.ONE, multiplier);
    }

    /**
     * @param params p, a, b, n, Gx, Gy as hex strings
     */
    public SM2Initializer(String[] params, BigInteger h, AbstractECMultiplier multiplier) {
        if (params == null || params.length != 6) {
            throw new IllegalArgumentException("Expected p, a, b, n, Gx and Gy");
        }
        BigInteger p = new BigInteger(params[0], 16);
        BigInteger a = new BigInteger(params[1], 16);
        BigInteger b = new BigInteger(params[2], 16);
        BigInteger n = new BigInteger(params[3], 16);
        BigInteger gx = new BigInteger(params[4], 16);
        BigInteger gy = new BigInteger(params[5], 16);
        FpCurve curve = new FpCurve(multiplier, p, a, b, n, h);
        this.domain = new ECDomainParameters(curve, curve.createPoint(gx, gy), n, h);
    }

    public ECDomainParameters getDomainParameters() {
        return domain;
    }

    public FpCurve getCurve() {
        return domain.getCurve();
    }

    public ECKeyPair genKeyPair() {
        return genKeyPair(new SecureRandom());
    }

    public ECKeyPair genKeyPair(SecureRandom random) {
        return new ECKeyPairGenerator(domain, random).generateKeyPair();
    }

    public FpPoint decodePoint(byte[] point) {
        return domain.getCurve().decodePoint(point);
    }

    public ECPrivateKeyParameters privateKey(BigInteger d) {
        return new ECPrivateKeyParameters(d, domain);
    }

    public ECPublicKeyParameters publicKey(byte[] encodedPoint) {
        return new ECPublicKeyParameters(decodePoint(encodedPoint), domain);
    }

    public ECPublicKeyParameters getPublicKey(BigInteger privateKey) {
        return privateKey(privateKey).derivePublicKey();
    }

    /**
     * Z = H(ENTL || ID || a || b || Gx || Gy || Qx || Qy), ENTL being the bit length of ID as
     * two big-endian bytes. Leaves {@code digest} reset.
     *
     * @throws IllegalArgumentException if ID is longer than 8191 bytes
     */
    public static byte[] calculateZ(Digest digest, ECDomainParameters params, byte[] userId, FpPoint Q) {
        if (userId.length > 0x1FFF) {
            throw new IllegalArgumentException("User ID too long: " + userId.length + " bytes");
        }
        digest.reset();
        int len = userId.length * 8;
        digest.update((byte) (len >> 8 & 0xFF));
        digest.update((byte) (len & 0xFF));
        digest.update(userId, 0, userId.length);

        FpCurve curve = params.getCurve();
        addFieldElement(digest, curve.getA());
        addFieldElement(digest, curve.getB());
        addFieldElement(digest, params.getG().getAffineXCoord());
        addFieldElement(digest, params.getG().getAffineYCoord());
        addFieldElement(digest, Q.getAffineXCoord());
        addFieldElement(digest, Q.getAffineYCoord());

        byte[] z = new byte[digest.getDigestSize()];
        digest.doFinal(z, 0);
        return z;
    }

    static void addFieldElement(Digest digest, FpElement v) {
        byte[] p = v.getEncoded();
        digest.update(p, 0, p.length);
    }
}
