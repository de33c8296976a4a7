package site.gmsm.sm2;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import site.gmsm.crypto.Digest;
import site.gmsm.sm2.ec.ECAlgorithms;
import site.gmsm.sm2.ec.FpPoint;
import site.gmsm.sm2.keygen.ECDomainParameters;
import site.gmsm.sm2.keygen.ECKeyParameters;
import site.gmsm.sm2.keygen.ECPrivateKeyParameters;
import site.gmsm.sm2.keygen.ECPublicKeyParameters;
import site.gmsm.sm2.keygen.InvalidKeyParameterException;
import site.gmsm.sm3.SM3;

/**
 * SM2 digital signature (GM/T 0003.2).
 * <p>
 * After {@code init} the digest holds Z, the hash of the signer's identity and public key.
 * Message bytes are then fed through {@code update}; {@link #generateSignature()} and
 * {@link #verifySignature(byte[])} finish the hash over Z || M and put the signer back to
 * the state right after {@code init}, so the same key can sign or verify again.
 * <p>
 * Not thread safe.
 */
public class SM2Signer {

    private static final Logger log = LoggerFactory.getLogger(SM2Signer.class);

    private enum State {
        UNINITIALIZED, SIGNING, VERIFYING
    }

    private final DSAKCalculator kCalculator;
    private final Digest digest;
    private final DSAEncoding encoding;

    private State state = State.UNINITIALIZED;
    private ECDomainParameters ecParams;
    private ECPrivateKeyParameters privateKey;
    private ECPublicKeyParameters publicKey;
    private Digest zState;

    public SM2Signer() {
        this(StandardDSAEncoding.INSTANCE, new SM3());
    }

    public SM2Signer(Digest digest) {
        this(StandardDSAEncoding.INSTANCE, digest);
    }

    public SM2Signer(DSAEncoding encoding) {
        this(encoding, new SM3());
    }

    public SM2Signer(DSAEncoding encoding, Digest digest) {
        this(encoding, digest, new RandomDSAKCalculator());
    }

    public SM2Signer(DSAEncoding encoding, Digest digest, DSAKCalculator kCalculator) {
        if (encoding == null || digest == null || kCalculator == null) {
            throw new IllegalArgumentException("Encoding, digest and K calculator are required");
        }
        this.encoding = encoding;
        this.digest = digest;
        this.kCalculator = kCalculator;
    }

    public String getAlgorithmName() {
        return "SM2";
    }

    public void initSign(ECPrivateKeyParameters key) {
        init(true, key, null, null);
    }

    public void initSign(ECPrivateKeyParameters key, byte[] userId) {
        init(true, key, userId, null);
    }

    public void initSign(ECPrivateKeyParameters key, byte[] userId, SecureRandom random) {
        init(true, key, userId, random);
    }

    public void initVerify(ECPublicKeyParameters key) {
        init(false, key, null, null);
    }

    public void initVerify(ECPublicKeyParameters key, byte[] userId) {
        init(false, key, userId, null);
    }

    /**
     * @param forSigning {@code true} with a private key, {@code false} with a public key
     * @param userId signer identity; {@code null} selects {@link SM2Initializer#DEFAULT_USER_ID}
     * @param random source for k; {@code null} selects a new {@link SecureRandom}
     * @throws IllegalStateException if the key type does not match the direction
     * @throws InvalidKeyParameterException if the private key is n - 1 (for which 1 + d has
     *             no inverse)
     */
    public void init(boolean forSigning, ECKeyParameters key, byte[] userId, SecureRandom random) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        byte[] id = userId == null ? SM2Initializer.DEFAULT_USER_ID : userId;
        ECPrivateKeyParameters priv = null;
        ECPublicKeyParameters pub = null;
        ECDomainParameters params;
        FpPoint Q;
        if (forSigning) {
            if (!(key instanceof ECPrivateKeyParameters)) {
                throw new IllegalStateException("Signing requires a private key");
            }
            priv = (ECPrivateKeyParameters) key;
            params = priv.getParameters();
            if (priv.getD().equals(params.getN().subtract(BigInteger.ONE))) {
                throw new InvalidKeyParameterException("Private key n - 1 cannot be used for signing");
            }
            Q = priv.derivePublicKey().getQ();
        } else {
            if (!(key instanceof ECPublicKeyParameters)) {
                throw new IllegalStateException("Verification requires a public key");
            }
            pub = (ECPublicKeyParameters) key;
            params = pub.getParameters();
            Q = pub.getQ();
        }

        // Fields stay untouched until Z is known
        byte[] z = SM2Initializer.calculateZ(digest, params, id, Q);
        digest.update(z, 0, z.length);
        if (forSigning) {
            kCalculator.init(params.getN(), random);
        }
        this.privateKey = priv;
        this.publicKey = pub;
        this.ecParams = params;
        this.zState = digest.copy();
        this.state = forSigning ? State.SIGNING : State.VERIFYING;
    }

    public void update(byte b) {
        checkInitialized();
        digest.update(b);
    }

    public void update(byte[] in, int off, int len) {
        checkInitialized();
        digest.update(in, off, len);
    }

    public void update(byte[] in) {
        update(in, 0, in.length);
    }

    /**
     * Signs Z || M for the bytes passed to {@code update} since the last init or reset.
     *
     * @throws IllegalStateException if not initialised for signing
     * @throws CryptoException if the signature cannot be encoded
     */
    public byte[] generateSignature() throws CryptoException {
        if (state != State.SIGNING) {
            throw new IllegalStateException("SM2Signer not initialised for signature generation");
        }
        try {
            BigInteger n = ecParams.getN();
            BigInteger e = calculateE(n, digestResult());
            BigInteger d = privateKey.getD();
            BigInteger dPlus1Inv = d.add(BigInteger.ONE).modInverse(n);
            FpPoint G = ecParams.getG();

            BigInteger r, s;
            do {
                BigInteger k;
                for (;;) {
                    k = kCalculator.nextK();
                    FpPoint p = ecParams.getBaseMultiplier().multiply(G, k);
                    r = e.add(p.getAffineXCoord().toBigInteger()).mod(n);
                    if (r.signum() != 0 && !r.add(k).equals(n)) {
                        break;
                    }
                    log.debug("Discarding k: r = 0 or r + k = n");
                }
                s = dPlus1Inv.multiply(k.subtract(r.multiply(d))).mod(n);
                if (s.signum() == 0) {
                    log.debug("Discarding k: s = 0");
                }
            } while (s.signum() == 0);

            try {
                return encoding.encode(n, r, s);
            } catch (IOException ex) {
                throw new CryptoException("Unable to encode signature: " + ex.getMessage(), ex);
            }
        } finally {
            reset();
        }
    }

    /**
     * Checks a signature over Z || M. Malformed or out-of-range signatures give {@code false}.
     *
     * @throws IllegalStateException if not initialised for verification
     */
    public boolean verifySignature(byte[] signature) {
        if (state != State.VERIFYING) {
            throw new IllegalStateException("SM2Signer not initialised for signature verification");
        }
        try {
            BigInteger n = ecParams.getN();
            BigInteger[] rs;
            try {
                rs = encoding.decode(n, signature);
            } catch (IOException | IllegalArgumentException ex) {
                log.debug("Rejecting malformed signature: {}", ex.getMessage());
                return false;
            }
            return verifySignature(n, rs[0], rs[1]);
        } finally {
            reset();
        }
    }

    /** Puts the digest back to Z, discarding any message bytes fed so far. */
    public void reset() {
        if (zState != null) {
            digest.reset(zState);
        } else {
            digest.reset();
        }
    }

    private boolean verifySignature(BigInteger n, BigInteger r, BigInteger s) {
        // r in [1, n-1]
        if (r.compareTo(BigInteger.ONE) < 0 || r.compareTo(n) >= 0) {
            return false;
        }
        // s in [1, n-1]
        if (s.compareTo(BigInteger.ONE) < 0 || s.compareTo(n) >= 0) {
            return false;
        }
        BigInteger e = calculateE(n, digestResult());
        BigInteger t = r.add(s).mod(n);
        if (t.signum() == 0) {
            return false;
        }
        FpPoint x1y1 = ECAlgorithms.sumOfTwoMultiplies(ecParams.getG(), s, publicKey.getQ(), t);
        if (x1y1.isInfinity()) {
            return false;
        }
        BigInteger expectedR = e.add(x1y1.getAffineXCoord().toBigInteger()).mod(n);
        return expectedR.equals(r);
    }

    private byte[] digestResult() {
        byte[] result = new byte[digest.getDigestSize()];
        digest.doFinal(result, 0);
        return result;
    }

    private static BigInteger calculateE(BigInteger n, byte[] message) {
        return new BigInteger(1, message).mod(n);
    }

    private void checkInitialized() {
        if (state == State.UNINITIALIZED) {
            throw new IllegalStateException("SM2Signer not initialised");
        }
    }
}
