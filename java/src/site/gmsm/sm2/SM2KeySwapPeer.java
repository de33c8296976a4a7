package site.gmsm.sm2;

import java.util.Arrays;

import site.gmsm.sm2.ec.InvalidPointException;
import site.gmsm.sm2.keygen.ECDomainParameters;
import site.gmsm.sm2.keygen.ECPublicKeyParameters;
import site.gmsm.sm2.keygen.InvalidKeyParameterException;
import site.gmsm.sm2.util.ConvertUtil;

/**
 * The other side of an SM2 key exchange as seen locally: its static and ephemeral public
 * keys and its identity.
 * <p>
 * On the wire this is {@code P || R || ENTL || ID}, with P and R uncompressed points and ENTL
 * the bit length of ID in two big-endian bytes.
 */
public class SM2KeySwapPeer {

    private final ECPublicKeyParameters staticPublicKey;
    private final ECPublicKeyParameters ephemeralPublicKey;
    private final byte[] userId;

    public SM2KeySwapPeer(ECPublicKeyParameters staticPublicKey, ECPublicKeyParameters ephemeralPublicKey) {
        this(staticPublicKey, ephemeralPublicKey, null);
    }

    /**
     * @param userId identity bytes; {@code null} selects {@link SM2Initializer#DEFAULT_USER_ID}
     */
    public SM2KeySwapPeer(ECPublicKeyParameters staticPublicKey, ECPublicKeyParameters ephemeralPublicKey, byte[] userId) {
        if (staticPublicKey == null || ephemeralPublicKey == null) {
            throw new IllegalArgumentException("Static and ephemeral public keys are required");
        }
        if (!staticPublicKey.getParameters().equals(ephemeralPublicKey.getParameters())) {
            throw new InvalidKeyParameterException("Static and ephemeral keys have different domain parameters");
        }
        this.staticPublicKey = staticPublicKey;
        this.ephemeralPublicKey = ephemeralPublicKey;
        this.userId = checkUserId(userId);
    }

    /**
     * Parses {@code P || R || ENTL || ID}.
     *
     * @throws IllegalArgumentException if the message is truncated or ENTL disagrees with
     *             the remaining length
     * @throws InvalidKeyParameterException if either point is not a valid public key
     */
    public static SM2KeySwapPeer decode(ECDomainParameters params, byte[] message) {
        int pointLength = params.getCurve().getAffinePointEncodingLength(false);
        int headerLength = 2 * pointLength + 2;
        if (message == null || message.length < headerLength) {
            throw new IllegalArgumentException("Key exchange message too short");
        }
        int idBits = ((message[2 * pointLength] & 0xFF) << 8) | (message[2 * pointLength + 1] & 0xFF);
        if ((idBits & 7) != 0 || message.length - headerLength != idBits / 8) {
            throw new IllegalArgumentException("Key exchange message has an inconsistent identity length");
        }
        ECPublicKeyParameters p = decodeKey(params, Arrays.copyOfRange(message, 0, pointLength));
        ECPublicKeyParameters r = decodeKey(params, Arrays.copyOfRange(message, pointLength, 2 * pointLength));
        return new SM2KeySwapPeer(p, r, Arrays.copyOfRange(message, headerLength, message.length));
    }

    private static ECPublicKeyParameters decodeKey(ECDomainParameters params, byte[] encoded) {
        try {
            return new ECPublicKeyParameters(params.getCurve().decodePoint(encoded), params);
        } catch (InvalidPointException e) {
            throw new InvalidKeyParameterException("Invalid public point in key exchange message", e);
        }
    }

    static byte[] checkUserId(byte[] userId) {
        if (userId == null) {
            return SM2Initializer.DEFAULT_USER_ID.clone();
        }
        if (userId.length > 0x1FFF) {
            throw new IllegalArgumentException("User ID too long: " + userId.length + " bytes");
        }
        return userId.clone();
    }

    public byte[] getEncoded() {
        int bits = userId.length * 8;
        byte[] entl = new byte[] { (byte) (bits >> 8 & 0xFF), (byte) (bits & 0xFF) };
        return ConvertUtil.concatenate(staticPublicKey.getEncoded(false), ephemeralPublicKey.getEncoded(false), entl, userId);
    }

    public ECDomainParameters getParameters() {
        return staticPublicKey.getParameters();
    }

    public ECPublicKeyParameters getStaticPublicKey() {
        return staticPublicKey;
    }

    public ECPublicKeyParameters getEphemeralPublicKey() {
        return ephemeralPublicKey;
    }

    public byte[] getUserId() {
        return ConvertUtil.copyOf(userId);
    }
}
