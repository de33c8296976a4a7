package site.gmsm.sm2.keygen;

/** SM2 key base class. */
public abstract class ECKeyParameters {
    private final boolean privateKey;
    private final ECDomainParameters parameters;

    protected ECKeyParameters(boolean isPrivate, ECDomainParameters parameters) {
        if (parameters == null) {
            throw new IllegalArgumentException("Domain parameters cannot be null");
        }
        this.privateKey = isPrivate;
        this.parameters = parameters;
    }

    public boolean isPrivateKey() {
        return privateKey;
    }

    public ECDomainParameters getParameters() {
        return parameters;
    }
}
