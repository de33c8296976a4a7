package site.gmsm.sm2.keygen;

/** Key material outside its valid range, or keys from mismatched domain parameters. */
public class InvalidKeyParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidKeyParameterException(String message) {
        super(message);
    }

    public InvalidKeyParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
