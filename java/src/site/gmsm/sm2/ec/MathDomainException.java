package site.gmsm.sm2.ec;

/** Arithmetic with no defined result in the field or on the curve, e.g. inverting zero. */
public class MathDomainException extends ArithmeticException {

    private static final long serialVersionUID = 1L;

    public MathDomainException(String message) {
        super(message);
    }
}
