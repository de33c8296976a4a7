package site.gmsm.sm2;

import java.util.Arrays;

import site.gmsm.crypto.Digest;
import site.gmsm.sm2.util.ConvertUtil;

/** KDF of GM/T 0003 shared by the SM2 cipher and key exchange. */
final class SM2KdfUtil {

    private SM2KdfUtil() {
    }

    /**
     * H(Z || ct) for ct = 1, 2, ... concatenated and cut to {@code keyLen} bytes, where Z is
     * the concatenation of {@code seeds}.
     */
    static byte[] kdf(Digest digest, int keyLen, byte[]... seeds) {
        if (keyLen < 0) {
            throw new IllegalArgumentException("Key length cannot be negative");
        }
        digest.reset();
        for (byte[] seed : seeds) {
            digest.update(seed, 0, seed.length);
        }
        Digest prefix = digest.copy();

        int digestSize = digest.getDigestSize();
        byte[] result = new byte[keyLen];
        byte[] buf = new byte[digestSize];
        byte[] ctBytes = new byte[4];
        int ct = 0;
        int off = 0;
        while (off < keyLen) {
            digest.reset(prefix);
            ConvertUtil.intToBigEndian(++ct, ctBytes, 0);
            digest.update(ctBytes, 0, 4);
            digest.doFinal(buf, 0);
            int len = Math.min(digestSize, keyLen - off);
            System.arraycopy(buf, 0, result, off, len);
            off += len;
        }
        Arrays.fill(buf, (byte) 0);
        digest.reset();
        return result;
    }

    static boolean isAllZero(byte[] data) {
        int bits = 0;
        for (byte b : data) {
            bits |= b;
        }
        return bits == 0;
    }
}
