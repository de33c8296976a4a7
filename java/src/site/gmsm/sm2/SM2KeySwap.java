package site.gmsm.sm2;

import java.math.BigInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import site.gmsm.crypto.Digest;
import site.gmsm.sm2.ec.ECAlgorithms;
import site.gmsm.sm2.ec.FpPoint;
import site.gmsm.sm2.keygen.ECDomainParameters;
import site.gmsm.sm2.keygen.InvalidKeyParameterException;
import site.gmsm.sm2.util.ConvertUtil;
import site.gmsm.sm3.SM3;

/**
 * SM2 key exchange protocol (GM/T 0003.3).
 * <p>
 * Each side holds a static key pair and a fresh ephemeral pair. Both compute the shared point
 * U = [h * t](P + [x~]R) from their own private values and the peer's public ones, and derive
 * the key from U and both identity hashes. The optional confirmation step exchanges S1
 * (responder to initiator) and S2 (initiator to responder).
 */
public class SM2KeySwap {

    private static final Logger log = LoggerFactory.getLogger(SM2KeySwap.class);

    private final Digest digest;

    private SM2KeySwapParams self;
    private ECDomainParameters ecParams;
    private int w;

    public SM2KeySwap() {
        this(new SM3());
    }

    public SM2KeySwap(Digest digest) {
        if (digest == null) {
            throw new IllegalArgumentException("Digest cannot be null");
        }
        this.digest = digest;
    }

    public void init(SM2KeySwapParams self) {
        if (self == null) {
            throw new IllegalArgumentException("Key exchange parameters cannot be null");
        }
        this.self = self;
        this.ecParams = self.getParameters();
        this.w = (ecParams.getCurve().getFieldSize() - 1) / 2;
        log.debug("SM2 key exchange initialised as {}", role());
    }

    /**
     * Derives a {@code kLen}-bit key without confirmation.
     *
     * @throws CryptoException if the shared point is at infinity
     */
    public byte[] calculateKey(int kLen, SM2KeySwapPeer peer) throws CryptoException {
        checkKeyLength(kLen);
        Agreement a = agree(peer);
        log.debug("Deriving {}-bit key as {} without confirmation", kLen, role());
        return a.key(kLen);
    }

    /**
     * Derives a {@code kLen}-bit key with confirmation.
     * <p>
     * Responder: {@code confirmationTag} must be {@code null}; the result holds S1 to send and
     * waits for S2 in {@link SM2KeySwapResult#confirm(byte[])}. Initiator:
     * {@code confirmationTag} is the responder's S1, checked before any key is released; the
     * result holds S2 to send.
     *
     * @throws KeyConfirmationException if the responder's S1 does not match
     * @throws CryptoException if the shared point is at infinity
     */
    public SM2KeySwapResult calculateKeyWithConfirmation(int kLen, byte[] confirmationTag, SM2KeySwapPeer peer) throws CryptoException {
        checkKeyLength(kLen);
        if (self != null && self.isInitiator() && confirmationTag == null) {
            throw new IllegalArgumentException("Initiator requires the responder's confirmation tag");
        }
        if (self != null && !self.isInitiator() && confirmationTag != null) {
            throw new IllegalArgumentException("Responder computes its own confirmation tag");
        }
        Agreement a = agree(peer);
        log.debug("Deriving {}-bit key as {} with confirmation", kLen, role());
        byte[] inner = a.innerHash();
        byte[] s1 = a.tag((byte) 0x02, inner);
        byte[] s2 = a.tag((byte) 0x03, inner);
        if (!self.isInitiator()) {
            return new SM2KeySwapResult(a.key(kLen), s1, s2);
        }
        if (!ConvertUtil.constantTimeAreEqual(s1, confirmationTag)) {
            log.warn("Key confirmation from responder does not match, aborting key exchange");
            throw new KeyConfirmationException("Confirmation tag from responder does not match");
        }
        return new SM2KeySwapResult(a.key(kLen), s2, null);
    }

    private String role() {
        return self.isInitiator() ? "initiator" : "responder";
    }

    private Agreement agree(SM2KeySwapPeer peer) throws CryptoException {
        if (self == null) {
            throw new IllegalStateException("SM2KeySwap not initialised");
        }
        if (peer == null) {
            throw new IllegalArgumentException("Peer cannot be null");
        }
        if (!ecParams.equals(peer.getParameters())) {
            throw new InvalidKeyParameterException("Peer keys use different domain parameters");
        }
        BigInteger n = ecParams.getN();
        FpPoint ownR = self.getEphemeralPublicKey().getQ();
        FpPoint peerR = peer.getEphemeralPublicKey().getQ();

        BigInteger x1 = reduce(ownR.getAffineXCoord().toBigInteger());
        BigInteger t = self.getStaticPrivateKey().getD()
                .add(x1.multiply(self.getEphemeralPrivateKey().getD())).mod(n);
        BigInteger x2 = reduce(peerR.getAffineXCoord().toBigInteger());
        BigInteger k1 = ecParams.getH().multiply(t).mod(n);
        BigInteger k2 = k1.multiply(x2).mod(n);

        FpPoint U = ECAlgorithms.sumOfTwoMultiplies(peer.getStaticPublicKey().getQ(), k1, peerR, k2);
        if (U.isInfinity()) {
            log.warn("SM2 key exchange failed: shared point at infinity");
            throw new CryptoException("Key exchange failed: U is at infinity");
        }

        byte[] ownZ = SM2Initializer.calculateZ(digest, ecParams, self.getUserId(), self.getStaticPublicKey().getQ());
        byte[] peerZ = SM2Initializer.calculateZ(digest, ecParams, peer.getUserId(), peer.getStaticPublicKey().getQ());
        if (self.isInitiator()) {
            return new Agreement(U, ownZ, peerZ, ownR, peerR);
        }
        return new Agreement(U, peerZ, ownZ, peerR, ownR);
    }

    /** x~ = 2^w + (x mod 2^w). */
    private BigInteger reduce(BigInteger x) {
        return x.and(BigInteger.ONE.shiftLeft(w).subtract(BigInteger.ONE)).setBit(w);
    }

    private static void checkKeyLength(int kLen) {
        if (kLen <= 0) {
            throw new IllegalArgumentException("Key length must be positive");
        }
    }

    /** Shared point and transcript, ordered initiator first. */
    private final class Agreement {
        private final byte[] ux, uy;
        private final byte[] zInit, zResp;
        private final FpPoint rInit, rResp;

        Agreement(FpPoint U, byte[] zInit, byte[] zResp, FpPoint rInit, FpPoint rResp) {
            this.ux = U.getAffineXCoord().getEncoded();
            this.uy = U.getAffineYCoord().getEncoded();
            this.zInit = zInit;
            this.zResp = zResp;
            this.rInit = rInit;
            this.rResp = rResp;
        }

        byte[] key(int kLen) {
            return SM2KdfUtil.kdf(digest, (kLen + 7) / 8, ux, uy, zInit, zResp);
        }

        /** H(xU || Z_init || Z_resp || x1 || y1 || x2 || y2). */
        byte[] innerHash() {
            digest.reset();
            update(ux);
            update(zInit);
            update(zResp);
            SM2Initializer.addFieldElement(digest, rInit.getAffineXCoord());
            SM2Initializer.addFieldElement(digest, rInit.getAffineYCoord());
            SM2Initializer.addFieldElement(digest, rResp.getAffineXCoord());
            SM2Initializer.addFieldElement(digest, rResp.getAffineYCoord());
            return doFinal();
        }

        /** H(prefix || yU || inner). */
        byte[] tag(byte prefix, byte[] inner) {
            digest.reset();
            digest.update(prefix);
            update(uy);
            update(inner);
            return doFinal();
        }

        private void update(byte[] data) {
            digest.update(data, 0, data.length);
        }

        private byte[] doFinal() {
            byte[] out = new byte[digest.getDigestSize()];
            digest.doFinal(out, 0);
            return out;
        }
    }
}
