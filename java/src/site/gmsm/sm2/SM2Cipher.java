package site.gmsm.sm2;

import java.math.BigInteger;
import java.security.SecureRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import site.gmsm.crypto.Digest;
import site.gmsm.sm2.ec.FpCurve;
import site.gmsm.sm2.ec.FpPoint;
import site.gmsm.sm2.ec.InvalidPointException;
import site.gmsm.sm2.keygen.ECDomainParameters;
import site.gmsm.sm2.keygen.ECKeyParameters;
import site.gmsm.sm2.keygen.ECPrivateKeyParameters;
import site.gmsm.sm2.keygen.ECPublicKeyParameters;
import site.gmsm.sm2.keygen.InvalidKeyParameterException;
import site.gmsm.sm2.util.ConvertUtil;
import site.gmsm.sm3.SM3;

/**
 * SM2 public key encryption (GM/T 0003.4).
 * <p>
 * C1 is the uncompressed point [k]G, C2 the message XORed with KDF(x2 || y2) and C3 the
 * hash H(x2 || M || y2), where (x2, y2) = [k]Q. The components are laid out as
 * C1 || C2 || C3 or C1 || C3 || C2 depending on {@link Mode}.
 */
public class SM2Cipher {

    private static final Logger log = LoggerFactory.getLogger(SM2Cipher.class);

    public enum Mode {
        C1C2C3, C1C3C2
    }

    private final Digest digest;
    private final Mode mode;
    private final RandomDSAKCalculator kCalculator = new RandomDSAKCalculator();

    private boolean initialized;
    private boolean forEncryption;
    private ECKeyParameters ecKey;
    private ECDomainParameters ecParams;
    private int curveLength;

    public SM2Cipher() {
        this(new SM3());
    }

    public SM2Cipher(Mode mode) {
        this(new SM3(), mode);
    }

    public SM2Cipher(Digest digest) {
        this(digest, Mode.C1C2C3);
    }

    public SM2Cipher(Digest digest, Mode mode) {
        if (digest == null || mode == null) {
            throw new IllegalArgumentException("Digest and mode are required");
        }
        this.digest = digest;
        this.mode = mode;
    }

    public Mode getMode() {
        return mode;
    }

    public void initEncrypt(ECPublicKeyParameters key, SecureRandom random) {
        init(true, key, random);
    }

    public void initDecrypt(ECPrivateKeyParameters key) {
        init(false, key, null);
    }

    /**
     * @param forEncryption {@code true} with a public key, {@code false} with a private key
     * @param random source for k; ignored for decryption, {@code null} selects a new
     *            {@link SecureRandom}
     * @throws IllegalStateException if the key type does not match the direction
     * @throws InvalidKeyParameterException if [h]Q is the point at infinity
     */
    public void init(boolean forEncryption, ECKeyParameters key, SecureRandom random) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        if (forEncryption) {
            if (!(key instanceof ECPublicKeyParameters)) {
                throw new IllegalStateException("Encryption requires a public key");
            }
            ECPublicKeyParameters pub = (ECPublicKeyParameters) key;
            if (pub.getQ().multiply(pub.getParameters().getH()).isInfinity()) {
                throw new InvalidKeyParameterException("Invalid key: [h]Q at infinity");
            }
            kCalculator.init(pub.getParameters().getN(), random);
        } else if (!(key instanceof ECPrivateKeyParameters)) {
            throw new IllegalStateException("Decryption requires a private key");
        }
        this.forEncryption = forEncryption;
        this.ecKey = key;
        this.ecParams = key.getParameters();
        this.curveLength = ecParams.getCurve().getFieldElementEncodingLength();
        this.initialized = true;
    }

    public byte[] processBlock(byte[] in) throws InvalidCipherTextException {
        return processBlock(in, 0, in == null ? 0 : in.length);
    }

    /**
     * Encrypts or decrypts {@code in[inOff, inOff + inLen)}.
     *
     * @throws InputTooShortException if the range is empty or outside the buffer
     * @throws InvalidCipherTextException if decryption fails for any reason
     */
    public byte[] processBlock(byte[] in, int inOff, int inLen) throws InvalidCipherTextException {
        if (!initialized) {
            throw new IllegalStateException("SM2Cipher not initialised");
        }
        if (in == null || inLen <= 0 || inOff < 0 || inOff + inLen > in.length) {
            throw new InputTooShortException("Input buffer too short");
        }
        if (forEncryption) {
            return encrypt(in, inOff, inLen);
        }
        return decrypt(in, inOff, inLen);
    }

    /**
     * Exact ciphertext length for a plaintext of {@code inputLen} bytes under the key given to
     * {@code init}.
     *
     * @throws IllegalStateException if the cipher has not been initialised
     */
    public int getOutputSize(int inputLen) {
        if (!initialized) {
            throw new IllegalStateException("SM2Cipher not initialised");
        }
        return (1 + 2 * curveLength) + inputLen + digest.getDigestSize();
    }

    /** Exact ciphertext length for a plaintext of {@code inputLen} bytes over {@code params}. */
    public int getOutputSize(ECDomainParameters params, int inputLen) {
        int fieldLength = params.getCurve().getFieldElementEncodingLength();
        return (1 + 2 * fieldLength) + inputLen + digest.getDigestSize();
    }

    private byte[] encrypt(byte[] in, int inOff, int inLen) {
        FpPoint Q = ((ECPublicKeyParameters) ecKey).getQ();
        byte[] c1;
        byte[] x2, y2;
        byte[] t;
        for (;;) {
            BigInteger k = kCalculator.nextK();
            c1 = ecParams.getBaseMultiplier().multiply(ecParams.getG(), k).getEncoded(false);
            FpPoint kPB = Q.multiply(k);
            x2 = kPB.getAffineXCoord().getEncoded();
            y2 = kPB.getAffineYCoord().getEncoded();
            t = SM2KdfUtil.kdf(digest, inLen, x2, y2);
            if (!SM2KdfUtil.isAllZero(t)) {
                break;
            }
            log.debug("KDF produced an all-zero key stream, drawing a new k");
        }

        byte[] c2 = new byte[inLen];
        for (int i = 0; i < inLen; i++) {
            c2[i] = (byte) (in[inOff + i] ^ t[i]);
        }
        ConvertUtil.fill(t, (byte) 0);

        byte[] c3 = new byte[digest.getDigestSize()];
        digest.reset();
        digest.update(x2, 0, x2.length);
        digest.update(in, inOff, inLen);
        digest.update(y2, 0, y2.length);
        digest.doFinal(c3, 0);

        switch (mode) {
        case C1C3C2:
            return ConvertUtil.concatenate(c1, c3, c2);
        default:
            return ConvertUtil.concatenate(c1, c2, c3);
        }
    }

    private byte[] decrypt(byte[] in, int inOff, int inLen) throws InvalidCipherTextException {
        int c1Length = 1 + 2 * curveLength;
        int digestSize = digest.getDigestSize();
        if (inLen <= c1Length + digestSize) {
            throw new InvalidCipherTextException("Ciphertext too short");
        }
        byte[] c1 = new byte[c1Length];
        System.arraycopy(in, inOff, c1, 0, c1Length);

        FpCurve curve = ecParams.getCurve();
        FpPoint c1P;
        try {
            c1P = curve.decodePoint(c1);
        } catch (InvalidPointException e) {
            throw new InvalidCipherTextException("Invalid C1 point", e);
        }
        if (c1P.isInfinity() || c1P.multiply(ecParams.getH()).isInfinity()) {
            throw new InvalidCipherTextException("[h]C1 at infinity");
        }

        FpPoint x2y2 = c1P.multiply(((ECPrivateKeyParameters) ecKey).getD());
        byte[] x2 = x2y2.getAffineXCoord().getEncoded();
        byte[] y2 = x2y2.getAffineYCoord().getEncoded();

        int c2Length = inLen - c1Length - digestSize;
        int c2Off, c3Off;
        if (mode == Mode.C1C3C2) {
            c3Off = inOff + c1Length;
            c2Off = c3Off + digestSize;
        } else {
            c2Off = inOff + c1Length;
            c3Off = c2Off + c2Length;
        }

        byte[] t = SM2KdfUtil.kdf(digest, c2Length, x2, y2);
        if (SM2KdfUtil.isAllZero(t)) {
            throw new InvalidCipherTextException("KDF produced an all-zero key stream");
        }
        byte[] m = new byte[c2Length];
        for (int i = 0; i < c2Length; i++) {
            m[i] = (byte) (in[c2Off + i] ^ t[i]);
        }
        ConvertUtil.fill(t, (byte) 0);

        byte[] c3 = new byte[digestSize];
        digest.reset();
        digest.update(x2, 0, x2.length);
        digest.update(m, 0, m.length);
        digest.update(y2, 0, y2.length);
        digest.doFinal(c3, 0);

        byte[] received = new byte[digestSize];
        System.arraycopy(in, c3Off, received, 0, digestSize);
        if (!ConvertUtil.constantTimeAreEqual(c3, received)) {
            ConvertUtil.fill(m, (byte) 0);
            log.warn("SM2 decryption failed: C3 mismatch");
            throw new InvalidCipherTextException("Invalid cipher text");
        }
        return m;
    }
}
