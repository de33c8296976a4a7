package site.gmsm.sm2;

import site.gmsm.sm2.keygen.ECDomainParameters;
import site.gmsm.sm2.keygen.ECPrivateKeyParameters;
import site.gmsm.sm2.keygen.ECPublicKeyParameters;
import site.gmsm.sm2.keygen.InvalidKeyParameterException;
import site.gmsm.sm2.util.ConvertUtil;

/**
 * One side of an SM2 key exchange: its role, static key d, ephemeral key r and identity.
 * The matching public points are derived once here.
 */
public class SM2KeySwapParams {

    private final boolean initiator;
    private final ECPrivateKeyParameters staticPrivateKey;
    private final ECPublicKeyParameters staticPublicKey;
    private final ECPrivateKeyParameters ephemeralPrivateKey;
    private final ECPublicKeyParameters ephemeralPublicKey;
    private final byte[] userId;

    public SM2KeySwapParams(boolean initiator, ECPrivateKeyParameters staticPrivateKey, ECPrivateKeyParameters ephemeralPrivateKey) {
        this(initiator, staticPrivateKey, ephemeralPrivateKey, null);
    }

    /**
     * @param userId identity bytes; {@code null} selects {@link SM2Initializer#DEFAULT_USER_ID}
     */
    public SM2KeySwapParams(boolean initiator, ECPrivateKeyParameters staticPrivateKey, ECPrivateKeyParameters ephemeralPrivateKey,
            byte[] userId) {
        if (staticPrivateKey == null || ephemeralPrivateKey == null) {
            throw new IllegalArgumentException("Static and ephemeral private keys are required");
        }
        if (!staticPrivateKey.getParameters().equals(ephemeralPrivateKey.getParameters())) {
            throw new InvalidKeyParameterException("Static and ephemeral keys have different domain parameters");
        }
        this.initiator = initiator;
        this.staticPrivateKey = staticPrivateKey;
        this.staticPublicKey = staticPrivateKey.derivePublicKey();
        this.ephemeralPrivateKey = ephemeralPrivateKey;
        this.ephemeralPublicKey = ephemeralPrivateKey.derivePublicKey();
        this.userId = SM2KeySwapPeer.checkUserId(userId);
    }

    public boolean isInitiator() {
        return initiator;
    }

    public ECDomainParameters getParameters() {
        return staticPrivateKey.getParameters();
    }

    public ECPrivateKeyParameters getStaticPrivateKey() {
        return staticPrivateKey;
    }

    public ECPublicKeyParameters getStaticPublicKey() {
        return staticPublicKey;
    }

    public ECPrivateKeyParameters getEphemeralPrivateKey() {
        return ephemeralPrivateKey;
    }

    public ECPublicKeyParameters getEphemeralPublicKey() {
        return ephemeralPublicKey;
    }

    public byte[] getUserId() {
        return ConvertUtil.copyOf(userId);
    }

    /** What this side sends to the other: its public points and identity. */
    public SM2KeySwapPeer toPeer() {
        return new SM2KeySwapPeer(staticPublicKey, ephemeralPublicKey, userId);
    }
}
