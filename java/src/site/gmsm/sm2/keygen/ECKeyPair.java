package site.gmsm.sm2.keygen;

import site.gmsm.sm2.util.ConvertUtil;

/** SM2 key pair (public + private). */
public class ECKeyPair {
    private final ECPublicKeyParameters publicKey;
    private final ECPrivateKeyParameters privateKey;

    public ECKeyPair(ECPublicKeyParameters publicKey, ECPrivateKeyParameters privateKey) {
        if (!publicKey.getParameters().equals(privateKey.getParameters())) {
            throw new InvalidKeyParameterException("Public and private key have different domain parameters");
        }
        this.publicKey = publicKey;
        this.privateKey = privateKey;
    }

    public ECPublicKeyParameters getPublic() {
        return publicKey;
    }

    public ECPrivateKeyParameters getPrivate() {
        return privateKey;
    }

    /** Uncompressed public point, 04||X||Y. */
    public String getHexPubKey() {
        return ConvertUtil.byteToHex(publicKey.getEncoded(false));
    }

    public String getHexPriKey() {
        return ConvertUtil.byteToHex(privateKey.getEncoded());
    }
}
