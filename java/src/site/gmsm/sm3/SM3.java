package site.gmsm.sm3;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import site.gmsm.crypto.Digest;
import site.gmsm.sm2.util.ConvertUtil;

/** SM3 cryptographic hash algorithm (GB/T 32905). */
public class SM3 implements Digest {
    private static final int DIGEST_LENGTH = 32;
    private static final int BLOCK_LENGTH = 64;
    private static final int[] IV = new int[] { 0x7380166F, 0x4914B2B9, 0x172442D7, 0xDA8A0600, 0xA96F30BC, 0x163138AA, 0xE38DEE4D, 0xB0FB0E4E };

    private final int[] V = new int[8];
    private final byte[] blockBuffer = new byte[BLOCK_LENGTH];
    private int bufferOffset;
    private long byteCount;

    private byte[] hashBytes;

    public SM3() {
        reset();
    }

    private SM3(SM3 other) {
        copyIn(other);
    }

    @Override
    public String getAlgorithmName() {
        return "SM3";
    }

    @Override
    public int getDigestSize() {
        return DIGEST_LENGTH;
    }

    @Override
    public void update(byte data) {
        blockBuffer[bufferOffset++] = data;
        byteCount++;
        if (bufferOffset == BLOCK_LENGTH) {
            compressBlock(blockBuffer, 0);
            bufferOffset = 0;
        }
    }

    @Override
    public void update(byte[] data, int inOffset, int length) {
        int i = 0;
        // fill the partial block first, then take whole blocks straight from the input
        while (bufferOffset != 0 && i < length) {
            update(data[inOffset + i++]);
        }
        while (length - i >= BLOCK_LENGTH) {
            compressBlock(data, inOffset + i);
            i += BLOCK_LENGTH;
            byteCount += BLOCK_LENGTH;
        }
        while (i < length) {
            update(data[inOffset + i++]);
        }
    }

    public SM3 update(String data) {
        byte[] bytes = data.getBytes(StandardCharsets.UTF_8);
        update(bytes, 0, bytes.length);
        return this;
    }

    @Override
    public int doFinal(byte[] out, int outOff) {
        long bitLength = byteCount << 3;
        update((byte) 0x80);
        while (bufferOffset != BLOCK_LENGTH - 8) {
            update((byte) 0);
        }
        for (int i = 7; i >= 0; i--) {
            blockBuffer[bufferOffset++] = (byte) (bitLength >>> (i * 8));
        }
        compressBlock(blockBuffer, 0);
        for (int i = 0; i < V.length; i++) {
            ConvertUtil.intToBigEndian(V[i], out, outOff + 4 * i);
        }
        reset();
        return DIGEST_LENGTH;
    }

    /** Completes the hash, keeping the result for {@link #getHashBytes()} and {@link #getHashCode()}. */
    public SM3 finish() {
        hashBytes = new byte[DIGEST_LENGTH];
        doFinal(hashBytes, 0);
        return this;
    }

    public byte[] getHashBytes() {
        return hashBytes;
    }

    public String getHashCode() {
        return hashBytes == null ? null : ConvertUtil.byteToHex(hashBytes);
    }

    @Override
    public void reset() {
        System.arraycopy(IV, 0, V, 0, IV.length);
        Arrays.fill(blockBuffer, (byte) 0);
        bufferOffset = 0;
        byteCount = 0;
    }

    @Override
    public Digest copy() {
        return new SM3(this);
    }

    @Override
    public void reset(Digest other) {
        if (!(other instanceof SM3)) {
            throw new IllegalArgumentException("Cannot restore SM3 state from " + other.getAlgorithmName());
        }
        copyIn((SM3) other);
    }

    private void copyIn(SM3 other) {
        System.arraycopy(other.V, 0, V, 0, V.length);
        System.arraycopy(other.blockBuffer, 0, blockBuffer, 0, blockBuffer.length);
        bufferOffset = other.bufferOffset;
        byteCount = other.byteCount;
    }

    private void compressBlock(byte[] block, int offset) {
        int[] w = new int[68];
        for (int j = 0; j < 16; j++) {
            int h1 = (block[offset] & 0xff) << 24;
            int h2 = (block[++offset] & 0xff) << 16;
            int h3 = (block[++offset] & 0xff) << 8;
            int h4 = (block[++offset] & 0xff);
            w[j] = (h1 | h2 | h3 | h4);
            offset++;
        }
        for (int j = 16; j < 68; j++) {
            int wj3 = w[j - 3];
            int r15 = ((wj3 << 15) | (wj3 >>> (32 - 15)));
            int wj13 = w[j - 13];
            int r7 = ((wj13 << 7) | (wj13 >>> (32 - 7)));
            w[j] = P1(w[j - 16] ^ w[j - 9] ^ r15) ^ r7 ^ w[j - 6];
        }
        int[] wPrime = new int[64];
        for (int j = 0; j < wPrime.length; j++) {
            wPrime[j] = w[j] ^ w[j + 4];
        }

        int A = V[0];
        int B = V[1];
        int C = V[2];
        int D = V[3];
        int E = V[4];
        int F = V[5];
        int G = V[6];
        int H = V[7];
        for (int j = 0; j < 64; j++) {
            int A12 = ((A << 12) | (A >>> (32 - 12)));
            int roundConstant = j < 16 ? Integer.rotateLeft(0x79CC4519, j) : Integer.rotateLeft(0x7A879D8A, j % 32);
            int rotatedSum = A12 + E + roundConstant;
            int SS1 = ((rotatedSum << 7) | (rotatedSum >>> (32 - 7)));
            int SS2 = SS1 ^ A12;
            int TT1 = j < 16 ? ((A ^ B ^ C) + D + SS2 + wPrime[j]) : (FF1(A, B, C) + D + SS2 + wPrime[j]);
            int TT2 = j < 16 ? ((E ^ F ^ G) + H + SS1 + w[j]) : (GG1(E, F, G) + H + SS1 + w[j]);
            D = C;
            C = ((B << 9) | (B >>> (32 - 9)));
            B = A;
            A = TT1;
            H = G;
            G = ((F << 19) | (F >>> (32 - 19)));
            F = E;
            E = P0(TT2);
        }
        V[0] ^= A;
        V[1] ^= B;
        V[2] ^= C;
        V[3] ^= D;
        V[4] ^= E;
        V[5] ^= F;
        V[6] ^= G;
        V[7] ^= H;
    }

    private static int FF1(int X, int Y, int Z) {
        return (X & Y) | (X & Z) | (Y & Z);
    }

    private static int GG1(int x, int y, int z) {
        return (x & y) | ((~x) & z);
    }

    private static int P0(int x) {
        int x9 = (x << 9) | (x >>> (32 - 9));
        int x17 = (x << 17) | (x >>> (32 - 17));
        return x ^ x9 ^ x17;
    }

    private static int P1(int x) {
        int x15 = (x << 15) | (x >>> (32 - 15));
        int x23 = (x << 23) | (x >>> (32 - 23));
        return x ^ x15 ^ x23;
    }
}
