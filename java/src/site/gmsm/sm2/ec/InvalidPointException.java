package site.gmsm.sm2.ec;

/** A point that is not on the curve, not in the prime-order subgroup, or badly encoded. */
public class InvalidPointException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidPointException(String message) {
        super(message);
    }

    public InvalidPointException(String message, Throwable cause) {
        super(message, cause);
    }
}
