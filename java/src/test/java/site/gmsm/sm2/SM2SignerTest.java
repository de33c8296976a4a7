package site.gmsm.sm2;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import org.junit.Assert;
import org.junit.Test;

import site.gmsm.sm2.keygen.ECKeyPair;
import site.gmsm.sm2.keygen.ECPrivateKeyParameters;
import site.gmsm.sm2.keygen.ECPublicKeyParameters;
import site.gmsm.sm2.keygen.InvalidKeyParameterException;
import site.gmsm.sm3.SM3;

public class SM2SignerTest {

    private static final byte[] ALICE = "ALICE123@YAHOO.COM".getBytes(StandardCharsets.US_ASCII);

    private final SM2Initializer sm2 = TestCurves.sm2();

    @Test
    public void testKnownAnswerOnTestCurve() throws Exception {
        SM2Initializer gm = TestCurves.gmTest();
        ECPrivateKeyParameters priv = gm.privateKey(
                new BigInteger("128B2FA8BD433C6C068C8D803DFF79792A519A55171B1B650C23661D15897263", 16));
        SM2Signer signer = new SM2Signer(PlainDSAEncoding.INSTANCE, new SM3(),
                new TestCurves.FixedKCalculator("6CB28D99385C175C94F94E934817663FC176D925DD72B727260DBAAE1FB2F96F"));
        signer.initSign(priv, ALICE);
        byte[] msg = "message digest".getBytes(StandardCharsets.US_ASCII);
        signer.update(msg, 0, msg.length);
        byte[] sig = signer.generateSignature();

        BigInteger[] rs = PlainDSAEncoding.INSTANCE.decode(gm.getDomainParameters().getN(), sig);
        Assert.assertEquals(new BigInteger("40F1EC59F793D9F49E09DCEF49130D4194F79FB1EED2CAA55BACDB49C4E755D1", 16), rs[0]);
        Assert.assertEquals(new BigInteger("6FC6DAC32C5D5CF10C77DFB20F7C2EB667A457872FB09EC56327A67EC7DEEBE7", 16), rs[1]);

        SM2Signer verifier = new SM2Signer(PlainDSAEncoding.INSTANCE);
        verifier.initVerify(priv.derivePublicKey(), ALICE);
        verifier.update(msg, 0, msg.length);
        Assert.assertTrue(verifier.verifySignature(sig));
    }

    @Test
    public void testSignVerifyRecommendedCurve() throws CryptoException {
        ECPrivateKeyParameters priv = sm2.privateKey(
                new BigInteger("128B2FA8BD433C6C068C8D803DFF79792A519A55171B1B650C23661D15897263", 16));
        ECPublicKeyParameters pub = priv.derivePublicKey();
        byte[] msg = "abc".getBytes(StandardCharsets.US_ASCII);

        SM2Signer signer = new SM2Signer();
        signer.initSign(priv, null, new SecureRandom());
        signer.update(msg);
        byte[] sig = signer.generateSignature();

        SM2Signer verifier = new SM2Signer();
        verifier.initVerify(pub);
        verifier.update(msg);
        Assert.assertTrue(verifier.verifySignature(sig));

        byte[] tampered = sig.clone();
        tampered[tampered.length - 1] ^= 1;
        verifier.update(msg);
        Assert.assertFalse(verifier.verifySignature(tampered));
    }

    @Test
    public void testSignerIsReusable() throws CryptoException {
        ECKeyPair kp = sm2.genKeyPair();
        SM2Signer signer = new SM2Signer();
        signer.initSign(kp.getPrivate(), ALICE);
        SM2Signer verifier = new SM2Signer();
        verifier.initVerify(kp.getPublic(), ALICE);

        for (int i = 0; i < 3; i++) {
            byte[] msg = ("message " + i).getBytes(StandardCharsets.UTF_8);
            signer.update(msg);
            byte[] sig = signer.generateSignature();
            verifier.update(msg);
            Assert.assertTrue(verifier.verifySignature(sig));
        }
    }

    @Test
    public void testIdentityIsBound() throws CryptoException {
        ECKeyPair kp = sm2.genKeyPair();
        byte[] msg = "hello".getBytes(StandardCharsets.UTF_8);
        SM2Signer signer = new SM2Signer();
        signer.initSign(kp.getPrivate(), ALICE);
        signer.update(msg);
        byte[] sig = signer.generateSignature();

        SM2Signer verifier = new SM2Signer();
        verifier.initVerify(kp.getPublic());
        verifier.update(msg);
        Assert.assertFalse(verifier.verifySignature(sig));
    }

    @Test
    public void testWrongMessageOrKey() throws CryptoException {
        ECKeyPair kp = sm2.genKeyPair();
        SM2Signer signer = new SM2Signer();
        signer.initSign(kp.getPrivate());
        signer.update("one".getBytes(StandardCharsets.UTF_8));
        byte[] sig = signer.generateSignature();

        SM2Signer verifier = new SM2Signer();
        verifier.initVerify(kp.getPublic());
        verifier.update("two".getBytes(StandardCharsets.UTF_8));
        Assert.assertFalse(verifier.verifySignature(sig));

        verifier.initVerify(sm2.genKeyPair().getPublic());
        verifier.update("one".getBytes(StandardCharsets.UTF_8));
        Assert.assertFalse(verifier.verifySignature(sig));
    }

    @Test
    public void testResetDiscardsMessage() throws CryptoException {
        ECKeyPair kp = sm2.genKeyPair();
        SM2Signer signer = new SM2Signer();
        signer.initSign(kp.getPrivate());
        signer.update("noise".getBytes(StandardCharsets.UTF_8));
        signer.reset();
        signer.update("real".getBytes(StandardCharsets.UTF_8));
        byte[] sig = signer.generateSignature();

        SM2Signer verifier = new SM2Signer();
        verifier.initVerify(kp.getPublic());
        verifier.update("real".getBytes(StandardCharsets.UTF_8));
        Assert.assertTrue(verifier.verifySignature(sig));
    }

    @Test
    public void testMalformedSignaturesAreRejected() throws IOException {
        ECKeyPair kp = sm2.genKeyPair();
        SM2Signer verifier = new SM2Signer();
        verifier.initVerify(kp.getPublic());
        Assert.assertFalse(verifier.verifySignature(new byte[0]));
        Assert.assertFalse(verifier.verifySignature(new byte[] { 0x30, 0x00 }));
        BigInteger n = kp.getPublic().getParameters().getN();
        Assert.assertFalse(verifier.verifySignature(StandardDSAEncoding.INSTANCE.encode(null, n, BigInteger.ONE)));
    }

    @Test
    public void testEveryFlippedSignatureByteIsRejected() throws CryptoException {
        ECKeyPair kp = sm2.genKeyPair();
        byte[] msg = "abc".getBytes(StandardCharsets.US_ASCII);
        SM2Signer signer = new SM2Signer();
        signer.initSign(kp.getPrivate());
        signer.update(msg);
        byte[] sig = signer.generateSignature();

        SM2Signer verifier = new SM2Signer();
        verifier.initVerify(kp.getPublic());
        for (int i = 0; i < sig.length; i++) {
            byte[] bad = sig.clone();
            bad[i] ^= 0x01;
            verifier.update(msg);
            Assert.assertFalse("flipped byte " + i + " accepted", verifier.verifySignature(bad));
        }
        verifier.update(msg);
        Assert.assertTrue(verifier.verifySignature(sig));
    }

    @Test
    public void testRejectedInitKeepsPreviousSetup() throws CryptoException {
        ECKeyPair kp = sm2.genKeyPair();
        byte[] msg = "abc".getBytes(StandardCharsets.US_ASCII);
        SM2Signer signer = new SM2Signer();
        signer.initSign(kp.getPrivate());
        signer.update(msg);
        byte[] sig = signer.generateSignature();

        SM2Signer verifier = new SM2Signer();
        verifier.initVerify(kp.getPublic());
        try {
            verifier.initSign(kp.getPrivate(), new byte[0x2000]);
            Assert.fail("over-long user ID accepted");
        } catch (IllegalArgumentException expected) {
        }
        verifier.update(msg);
        Assert.assertTrue(verifier.verifySignature(sig));

        try {
            verifier.init(true, kp.getPublic(), null, null);
            Assert.fail("public key accepted for signing");
        } catch (IllegalStateException expected) {
        }
        verifier.update(msg);
        Assert.assertTrue(verifier.verifySignature(sig));
    }

    @Test
    public void testFixedKGivesSameSignature() throws CryptoException {
        ECKeyPair kp = sm2.genKeyPair();
        SM2Signer signer = new SM2Signer(StandardDSAEncoding.INSTANCE, new SM3(),
                new TestCurves.FixedKCalculator("2A"));
        signer.initSign(kp.getPrivate());
        signer.update((byte) 'x');
        byte[] first = signer.generateSignature();
        signer.initSign(kp.getPrivate());
        signer.update((byte) 'x');
        Assert.assertArrayEquals(first, signer.generateSignature());

        SM2Signer verifier = new SM2Signer();
        verifier.initVerify(kp.getPublic());
        verifier.update((byte) 'x');
        Assert.assertTrue(verifier.verifySignature(first));
    }

    @Test(expected = IllegalStateException.class)
    public void testUpdateBeforeInit() {
        new SM2Signer().update((byte) 1);
    }

    @Test(expected = IllegalStateException.class)
    public void testSignInVerifyMode() throws CryptoException {
        SM2Signer signer = new SM2Signer();
        signer.initVerify(sm2.genKeyPair().getPublic());
        signer.generateSignature();
    }

    @Test(expected = IllegalStateException.class)
    public void testVerifyInSignMode() {
        SM2Signer signer = new SM2Signer();
        signer.initSign(sm2.genKeyPair().getPrivate());
        signer.verifySignature(new byte[64]);
    }

    @Test(expected = IllegalStateException.class)
    public void testSignWithPublicKey() {
        new SM2Signer().init(true, sm2.genKeyPair().getPublic(), null, null);
    }

    @Test(expected = InvalidKeyParameterException.class)
    public void testPrivateKeyNMinusOneCannotSign() {
        BigInteger n = sm2.getDomainParameters().getN();
        new SM2Signer().initSign(sm2.privateKey(n.subtract(BigInteger.ONE)));
    }

    @Test
    public void testAlgorithmName() {
        Assert.assertEquals("SM2", new SM2Signer().getAlgorithmName());
    }
}
