package site.gmsm.sm2.keygen;

import site.gmsm.sm2.ec.FpPoint;

/** SM2 public key Q, checked to be finite, on the curve and of order n. */
public class ECPublicKeyParameters extends ECKeyParameters {

    private final FpPoint Q;

    public ECPublicKeyParameters(FpPoint Q, ECDomainParameters parameters) {
        super(false, parameters);
        this.Q = parameters.validatePublicPoint(Q);
    }

    public FpPoint getQ() {
        return Q;
    }

    public byte[] getEncoded(boolean compressed) {
        return Q.getEncoded(compressed);
    }
}
