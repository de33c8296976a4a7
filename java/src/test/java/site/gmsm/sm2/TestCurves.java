package site.gmsm.sm2;

import java.math.BigInteger;
import java.security.SecureRandom;

import site.gmsm.sm2.ec.SimpleMultiplier;

/** Curves shared by the SM2 tests. */
public final class TestCurves {

    /** 256-bit Fp curve of the GM/T 0003 worked examples. */
    public static final String[] GM_TEST_PARAMS = new String[] {
            "8542D69E4C044F18E8B92435BF6FF7DE457283915C45517D722EDB8B08F1DFC3",
            "787968B4FA32C3FD2417842E73BBFEFF2F3C848B6831D7E0EC65228B3937E498",
            "63E4C6D3B23B0C849CF84241484BFE48F61D59A5B16BA06E6E12D1DA27C5249A",
            "8542D69E4C044F18E8B92435BF6FF7DD297720630485628D5AE74EE7C32E79B7",
            "421DEBD61B62EAB6746434EBC3CC315E32220B3BADD50BDC4C4E6C147FEDD43D",
            "0680512BCBB42C07D47349D2153B70C4E5D7FDFCBFA36EA1A85841B9E46E09A2"
    };

    private TestCurves() {
    }

    public static SM2Initializer sm2() {
        return new SM2Initializer();
    }

    public static SM2Initializer gmTest() {
        return new SM2Initializer(GM_TEST_PARAMS, new SimpleMultiplier());
    }

    /** Hands out the given k values in order. */
    public static final class FixedKCalculator implements DSAKCalculator {
        private final BigInteger[] values;
        private int next;

        public FixedKCalculator(String... hexValues) {
            values = new BigInteger[hexValues.length];
            for (int i = 0; i < hexValues.length; i++) {
                values[i] = new BigInteger(hexValues[i], 16);
            }
        }

        @Override
        public boolean isDeterministic() {
            return true;
        }

        @Override
        public void init(BigInteger n, SecureRandom random) {
            next = 0;
        }

        @Override
        public BigInteger nextK() {
            return values[next++ % values.length];
        }
    }
}
