package site.gmsm.sm2;

/** Ciphertext is malformed or its C3 check value does not match. */
public class InvalidCipherTextException extends CryptoException {

    private static final long serialVersionUID = 1L;

    public InvalidCipherTextException(String message) {
        super(message);
    }

    public InvalidCipherTextException(String message, Throwable cause) {
        super(message, cause);
    }
}
