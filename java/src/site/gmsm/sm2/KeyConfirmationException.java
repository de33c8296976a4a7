package site.gmsm.sm2;

/** Key exchange confirmation tag from the peer does not match; the derived key is discarded. */
public class KeyConfirmationException extends CryptoException {

    private static final long serialVersionUID = 1L;

    public KeyConfirmationException(String message) {
        super(message);
    }
}
