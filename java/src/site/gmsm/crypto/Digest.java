package site.gmsm.crypto;

/**
 * Message digest capability used for Z-values, KDF and MAC computations.
 * <p>
 * Implementations keep a running state that can be saved with {@link #copy()} and
 * restored with {@link #reset(Digest)}, so loops can re-seed from a common prefix.
 */
public interface Digest {

    String getAlgorithmName();

    int getDigestSize();

    void update(byte in);

    void update(byte[] in, int inOff, int len);

    /**
     * Writes the digest to {@code out} and resets to the initial state.
     *
     * @return the number of bytes written
     */
    int doFinal(byte[] out, int outOff);

    void reset();

    /** Independent copy of the current running state. */
    Digest copy();

    /**
     * Restores the running state from a copy made by {@link #copy()}.
     *
     * @throws IllegalArgumentException if {@code other} is a different algorithm
     */
    void reset(Digest other);
}
