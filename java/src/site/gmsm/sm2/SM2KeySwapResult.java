package site.gmsm.sm2;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import site.gmsm.sm2.util.ConvertUtil;

/**
 * Outcome of a key exchange with confirmation.
 * <p>
 * The initiator's result is final: the responder's tag has already been checked and
 * {@link #getConfirmationTag()} is S2, to be sent back. The responder's result carries S1
 * to send, and keeps the key until the initiator's S2 passes {@link #confirm(byte[])}.
 */
public class SM2KeySwapResult {

    private static final Logger log = LoggerFactory.getLogger(SM2KeySwapResult.class);

    private final byte[] key;
    private final byte[] confirmationTag;
    private final byte[] expectedTag;
    private boolean confirmed;
    private boolean discarded;

    SM2KeySwapResult(byte[] key, byte[] confirmationTag, byte[] expectedTag) {
        this.key = key;
        this.confirmationTag = confirmationTag;
        this.expectedTag = expectedTag;
        this.confirmed = expectedTag == null;
    }

    /** Tag for the other side: S1 from the responder, S2 from the initiator. */
    public byte[] getConfirmationTag() {
        return ConvertUtil.copyOf(confirmationTag);
    }

    public boolean isConfirmed() {
        return confirmed;
    }

    /**
     * @throws IllegalStateException if the peer's tag has not been confirmed yet, or failed
     */
    public byte[] getKey() {
        if (discarded) {
            throw new IllegalStateException("Key was discarded after a failed confirmation");
        }
        if (!confirmed) {
            throw new IllegalStateException("Key not confirmed by the initiator yet");
        }
        return ConvertUtil.copyOf(key);
    }

    /**
     * Responder side: checks the initiator's S2. On mismatch the key is wiped.
     *
     * @throws KeyConfirmationException if the tag does not match
     */
    public void confirm(byte[] peerTag) throws KeyConfirmationException {
        if (discarded) {
            throw new IllegalStateException("Key was discarded after a failed confirmation");
        }
        if (confirmed) {
            return;
        }
        if (!ConvertUtil.constantTimeAreEqual(expectedTag, peerTag)) {
            ConvertUtil.fill(key, (byte) 0);
            discarded = true;
            log.warn("Key confirmation from initiator does not match, discarding key");
            throw new KeyConfirmationException("Confirmation tag from initiator does not match");
        }
        confirmed = true;
    }
}
