package site.gmsm.sm2;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import site.gmsm.sm2.ec.FpPoint;
import site.gmsm.sm2.keygen.ECKeyPair;
import site.gmsm.sm2.keygen.ECPrivateKeyParameters;
import site.gmsm.sm2.keygen.ECPublicKeyParameters;
import site.gmsm.sm2.util.ConvertUtil;

/**
 * SM2 elliptic curve public key cryptographic algorithm over hex strings.
 * <p>
 * Keys are hex: private keys as 32-byte d, public keys as 04||X||Y (the 04 may be left out).
 * Ciphertexts use {@link SM2Cipher.Mode#C1C3C2} unless another mode is given; signatures
 * are DER.
 */
public class SM2 {

    private final SM2Initializer init;
    private final SM2Cipher.Mode mode;
    private final SecureRandom random;

    public SM2() {
        this(new SM2Initializer(), SM2Cipher.Mode.C1C3C2, new SecureRandom());
    }

    public SM2(SM2Initializer init, SM2Cipher.Mode mode, SecureRandom random) {
        if (init == null || mode == null || random == null) {
            throw new IllegalArgumentException("Initializer, mode and random are required");
        }
        this.init = init;
        this.mode = mode;
        this.random = random;
    }

    public SM2Initializer getInitializer() {
        return init;
    }

    public ECKeyPair genKeyPair() {
        return init.genKeyPair(random);
    }

    public FpPoint decodePoint(String publicKey) {
        return decodePublicKey(publicKey).getQ();
    }

    /** Hex public key 04||X||Y for a hex private key. */
    public String getPublicKey(String privateKey) {
        ECPrivateKeyParameters priv = decodePrivateKey(privateKey);
        return ConvertUtil.byteToHex(priv.derivePublicKey().getEncoded(false));
    }

    public String encrypt(String content, String publicKey) {
        SM2Cipher cipher = new SM2Cipher(mode);
        cipher.initEncrypt(decodePublicKey(publicKey), random);
        try {
            return ConvertUtil.byteToHex(cipher.processBlock(content.getBytes(StandardCharsets.UTF_8)));
        } catch (InvalidCipherTextException e) {
            throw new IllegalStateException("Encryption cannot fail on ciphertext", e);
        }
    }

    public String decrypt(String content, String privateKey) throws InvalidCipherTextException {
        SM2Cipher cipher = new SM2Cipher(mode);
        cipher.initDecrypt(decodePrivateKey(privateKey));
        byte[] decrypted = cipher.processBlock(ConvertUtil.hexToByte(content));
        return new String(decrypted, StandardCharsets.UTF_8);
    }

    /** A {@code null} userId selects {@link SM2Initializer#DEFAULT_USER_ID}. */
    public String sign(String userId, String content, String privateKey) throws CryptoException {
        SM2Signer signer = new SM2Signer();
        signer.initSign(decodePrivateKey(privateKey), userIdBytes(userId), random);
        signer.update(content.getBytes(StandardCharsets.UTF_8));
        return ConvertUtil.byteToHex(signer.generateSignature());
    }

    /**
     * {@code false} for any malformed signature, public key, content or user ID as well as a
     * bad signature. A {@code null} userId selects {@link SM2Initializer#DEFAULT_USER_ID}.
     */
    public boolean verify(String userId, String signature, String content, String publicKey) {
        if (content == null) {
            return false;
        }
        SM2Signer signer = new SM2Signer();
        byte[] sig;
        try {
            sig = ConvertUtil.hexToByte(signature);
            signer.initVerify(decodePublicKey(publicKey), userIdBytes(userId));
        } catch (IllegalArgumentException e) {
            return false;
        }
        signer.update(content.getBytes(StandardCharsets.UTF_8));
        return signer.verifySignature(sig);
    }

    private static byte[] userIdBytes(String userId) {
        return userId == null ? null : userId.getBytes(StandardCharsets.UTF_8);
    }

    private ECPublicKeyParameters decodePublicKey(String publicKey) {
        byte[] encoded = ConvertUtil.hexToByte(publicKey);
        if (encoded.length == 2 * init.getCurve().getFieldElementEncodingLength()) {
            encoded = ConvertUtil.concatenate(new byte[] { 0x04 }, encoded);
        }
        return init.publicKey(encoded);
    }

    private ECPrivateKeyParameters decodePrivateKey(String privateKey) {
        return init.privateKey(new BigInteger(1, ConvertUtil.hexToByte(privateKey)));
    }
}
