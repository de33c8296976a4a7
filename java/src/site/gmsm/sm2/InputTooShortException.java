package site.gmsm.sm2;

/** Input range is empty or does not fit inside its buffer. */
public class InputTooShortException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InputTooShortException(String message) {
        super(message);
    }
}
