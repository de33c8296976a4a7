package site.gmsm.sm2.ec;

import java.math.BigInteger;
import java.security.SecureRandom;

import org.junit.Assert;
import org.junit.Test;

public class MultiplierTest {

    private static final BigInteger P = new BigInteger("FFFFFFFEFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF00000000FFFFFFFFFFFFFFFF", 16);
    private static final BigInteger A = new BigInteger("FFFFFFFEFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF00000000FFFFFFFFFFFFFFFC", 16);
    private static final BigInteger B = new BigInteger("28E9FA9E9D9F5E344D5A9E4BCF6509A7F39789F515AB8F92DDBCBD414D940E93", 16);
    private static final BigInteger N = new BigInteger("FFFFFFFEFFFFFFFFFFFFFFFFFFFFFFFF7203DF6B21C6052B53BBF40939D54123", 16);
    private static final BigInteger GX = new BigInteger("32C4AE2C1F1981195F9904466A39C9948FE30BBFF2660BE1715A4589334C74C7", 16);
    private static final BigInteger GY = new BigInteger("BC3736A2F4F6779C59BDCEE36B692153D0A9877CC62A474002DF32E52139F0A0", 16);

    private final FpCurve curve = new FpCurve(P, A, B, N, BigInteger.ONE);
    private final FpPoint g = curve.createPoint(GX, GY);
    private final SimpleMultiplier simple = new SimpleMultiplier();
    private final FixedPointCombMultiplier comb = new FixedPointCombMultiplier();
    private final SecureRandom random = new SecureRandom();

    @Test
    public void testZeroAndOne() {
        Assert.assertTrue(simple.multiply(g, BigInteger.ZERO).isInfinity());
        Assert.assertTrue(comb.multiply(g, BigInteger.ZERO).isInfinity());
        Assert.assertEquals(g, simple.multiply(g, BigInteger.ONE));
        Assert.assertEquals(g, comb.multiply(g, BigInteger.ONE));
        Assert.assertTrue(simple.multiply(curve.getInfinity(), BigInteger.TEN).isInfinity());
    }

    @Test
    public void testOrderGivesInfinity() {
        Assert.assertTrue(simple.multiply(g, N).isInfinity());
        Assert.assertTrue(comb.multiply(g, N).isInfinity());
        Assert.assertEquals(g.negate(), simple.multiply(g, N.subtract(BigInteger.ONE)));
        Assert.assertEquals(g.negate(), comb.multiply(g, N.subtract(BigInteger.ONE)));
    }

    @Test
    public void testSmallMultiples() {
        Assert.assertEquals(g.twice(), simple.multiply(g, BigInteger.valueOf(2)));
        Assert.assertEquals(g.threeTimes(), comb.multiply(g, BigInteger.valueOf(3)));
        Assert.assertEquals(g.timesPow2(10), comb.multiply(g, BigInteger.ONE.shiftLeft(10)));
    }

    @Test
    public void testStrategiesAgree() {
        for (int i = 0; i < 10; i++) {
            BigInteger k = new BigInteger(N.bitLength(), random).mod(N);
            FpPoint a = simple.multiply(g, k);
            FpPoint b = comb.multiply(g, k);
            Assert.assertEquals(a, b);
            Assert.assertTrue(b.isNormalized());
            Assert.assertTrue(b.isValid());
        }
    }

    @Test
    public void testCombWithChangingBasePoint() {
        FpPoint other = simple.multiply(g, BigInteger.valueOf(12345));
        BigInteger k = new BigInteger("1F2E3D4C5B6A79880123456789ABCDEF", 16);
        Assert.assertEquals(simple.multiply(g, k), comb.multiply(g, k));
        Assert.assertEquals(simple.multiply(other, k), comb.multiply(other, k));
        Assert.assertEquals(simple.multiply(g, k), comb.multiply(g, k));
    }

    @Test
    public void testScalarMultiplicationIsLinear() {
        BigInteger a = new BigInteger(200, random);
        BigInteger b = new BigInteger(200, random);
        FpPoint lhs = comb.multiply(g, a.add(b).mod(N));
        FpPoint rhs = comb.multiply(g, a).add(comb.multiply(g, b));
        Assert.assertEquals(lhs, rhs);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeScalar() {
        simple.multiply(g, BigInteger.ONE.negate());
    }

    @Test
    public void testCombMatchesSimpleForWideScalars() {
        BigInteger[] scalars = {
                BigInteger.ONE.shiftLeft(N.bitLength()),
                BigInteger.ONE.shiftLeft(256).add(BigInteger.valueOf(5)),
                N.add(BigInteger.ONE),
                N.multiply(BigInteger.valueOf(3)).add(BigInteger.TEN),
                new BigInteger(512, random) };
        for (BigInteger k : scalars) {
            Assert.assertEquals(simple.multiply(g, k), comb.multiply(g, k));
        }
        Assert.assertEquals(g, comb.multiply(g, N.add(BigInteger.ONE)));
    }

    @Test
    public void testSumOfTwoMultiplies() {
        FpPoint q = simple.multiply(g, BigInteger.valueOf(987654321L));
        BigInteger a = new BigInteger(256, random).mod(N);
        BigInteger b = new BigInteger(256, random).mod(N);
        FpPoint expected = simple.multiply(g, a).add(simple.multiply(q, b));
        Assert.assertEquals(expected, ECAlgorithms.sumOfTwoMultiplies(g, a, q, b));
        Assert.assertTrue(ECAlgorithms.sumOfTwoMultiplies(g, N, q, BigInteger.ZERO).isInfinity());
    }

    @Test(expected = InvalidPointException.class)
    public void testImportPointFromOtherCurve() {
        FpCurve other = new FpCurve(P, A, BigInteger.ONE, N, BigInteger.ONE);
        ECAlgorithms.importPoint(other, g);
    }
}
