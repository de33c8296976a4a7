package site.gmsm.sm2;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import site.gmsm.sm2.keygen.ECKeyPair;
import site.gmsm.sm2.keygen.InvalidKeyParameterException;
import site.gmsm.sm2.util.ConvertUtil;

public class SM2KeySwapTest {

    private static final byte[] ID_A = "ALICE123@YAHOO.COM".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] ID_B = "BILL456@YAHOO.COM".getBytes(StandardCharsets.US_ASCII);

    private static final String D_A = "6FCBA2EF9AE0AB902BC3BDE3FF915D44BA4CC78F88E2F8E7F8996D3B8CCEEDEE";
    private static final String R_A = "83A2C9C8B96E5AF70BD480B472409A9A327257F1EBB73F5B073354B248668563";
    private static final String D_B = "5E35D7D3F3C54DBAC72E61819E730B019A84208CA3A35E4C2E353DFCCB2A3B53";
    private static final String R_B = "33FE21940342161C55619C4A0C060293D543C80AF19748CE176D83477DE71C80";

    private final SM2Initializer sm2 = TestCurves.sm2();

    private static SM2KeySwapParams party(SM2Initializer init, boolean initiator, String d, String r, byte[] id) {
        return new SM2KeySwapParams(initiator, init.privateKey(new BigInteger(d, 16)), init.privateKey(new BigInteger(r, 16)), id);
    }

    private SM2KeySwapParams randomParty(boolean initiator, byte[] id) {
        ECKeyPair s = sm2.genKeyPair();
        ECKeyPair e = sm2.genKeyPair();
        return new SM2KeySwapParams(initiator, s.getPrivate(), e.getPrivate(), id);
    }

    @Test
    public void testKnownAnswerOnTestCurve() throws CryptoException {
        SM2Initializer gm = TestCurves.gmTest();
        SM2KeySwapParams a = party(gm, true, D_A, R_A, ID_A);
        SM2KeySwapParams b = party(gm, false, D_B, R_B, ID_B);

        SM2KeySwap initiator = new SM2KeySwap();
        initiator.init(a);
        byte[] ka = initiator.calculateKey(128, b.toPeer());

        SM2KeySwap responder = new SM2KeySwap();
        responder.init(b);
        byte[] kb = responder.calculateKey(128, a.toPeer());

        Assert.assertEquals("55B0AC62A6B927BA23703832C853DED4", ConvertUtil.byteToHex(ka));
        Assert.assertArrayEquals(ka, kb);
    }

    @Test
    public void testBothSidesAgreeForManyLengths() throws CryptoException {
        SM2KeySwapParams a = randomParty(true, ID_A);
        SM2KeySwapParams b = randomParty(false, ID_B);
        SM2KeySwap initiator = new SM2KeySwap();
        initiator.init(a);
        SM2KeySwap responder = new SM2KeySwap();
        responder.init(b);

        for (int bits : new int[] { 1, 8, 127, 128, 256, 257, 1024 }) {
            byte[] ka = initiator.calculateKey(bits, b.toPeer());
            byte[] kb = responder.calculateKey(bits, a.toPeer());
            Assert.assertEquals((bits + 7) / 8, ka.length);
            Assert.assertArrayEquals(ka, kb);
        }
    }

    @Test
    public void testConfirmationFlow() throws CryptoException {
        SM2KeySwapParams a = randomParty(true, ID_A);
        SM2KeySwapParams b = randomParty(false, ID_B);

        SM2KeySwap responder = new SM2KeySwap();
        responder.init(b);
        SM2KeySwapResult rb = responder.calculateKeyWithConfirmation(128, null, a.toPeer());
        Assert.assertFalse(rb.isConfirmed());

        SM2KeySwap initiator = new SM2KeySwap();
        initiator.init(a);
        SM2KeySwapResult ra = initiator.calculateKeyWithConfirmation(128, rb.getConfirmationTag(), b.toPeer());
        Assert.assertTrue(ra.isConfirmed());

        rb.confirm(ra.getConfirmationTag());
        Assert.assertTrue(rb.isConfirmed());
        Assert.assertArrayEquals(ra.getKey(), rb.getKey());
        Assert.assertArrayEquals(ra.getKey(), initiator.calculateKey(128, b.toPeer()));
    }

    @Test
    public void testInitiatorRejectsWrongTag() throws CryptoException {
        SM2KeySwapParams a = randomParty(true, ID_A);
        SM2KeySwapParams b = randomParty(false, ID_B);
        SM2KeySwap responder = new SM2KeySwap();
        responder.init(b);
        SM2KeySwapResult rb = responder.calculateKeyWithConfirmation(128, null, a.toPeer());

        byte[] tag = rb.getConfirmationTag();
        tag[0] ^= 1;
        SM2KeySwap initiator = new SM2KeySwap();
        initiator.init(a);
        try {
            initiator.calculateKeyWithConfirmation(128, tag, b.toPeer());
            Assert.fail("wrong S1 accepted");
        } catch (KeyConfirmationException expected) {
        }
    }

    @Test
    public void testResponderRejectsSwappedTag() throws CryptoException {
        SM2KeySwapParams a = randomParty(true, ID_A);
        SM2KeySwapParams b = randomParty(false, ID_B);
        SM2KeySwap responder = new SM2KeySwap();
        responder.init(b);
        SM2KeySwapResult rb = responder.calculateKeyWithConfirmation(128, null, a.toPeer());

        // echoing S1 back instead of S2
        try {
            rb.confirm(rb.getConfirmationTag());
            Assert.fail("S1 accepted as S2");
        } catch (KeyConfirmationException expected) {
        }
        try {
            rb.getKey();
            Assert.fail("key released after failed confirmation");
        } catch (IllegalStateException expected) {
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testResponderKeyHeldUntilConfirmed() throws CryptoException {
        SM2KeySwap responder = new SM2KeySwap();
        responder.init(randomParty(false, ID_B));
        responder.calculateKeyWithConfirmation(128, null, randomParty(true, ID_A).toPeer()).getKey();
    }

    @Test
    public void testDifferentIdentitiesGiveDifferentKeys() throws CryptoException {
        SM2KeySwapParams a = randomParty(true, ID_A);
        SM2KeySwapParams b = randomParty(false, ID_B);
        SM2KeySwap initiator = new SM2KeySwap();
        initiator.init(a);
        byte[] k1 = initiator.calculateKey(128, b.toPeer());
        SM2KeySwapPeer wrongId = new SM2KeySwapPeer(b.getStaticPublicKey(), b.getEphemeralPublicKey(), ID_A);
        byte[] k2 = initiator.calculateKey(128, wrongId);
        Assert.assertFalse(Arrays.equals(k1, k2));
    }

    @Test
    public void testPeerMessageEncoding() {
        SM2KeySwapParams b = randomParty(false, ID_B);
        SM2KeySwapPeer peer = b.toPeer();
        byte[] msg = peer.getEncoded();
        Assert.assertEquals(65 + 65 + 2 + ID_B.length, msg.length);

        SM2KeySwapPeer decoded = SM2KeySwapPeer.decode(sm2.getDomainParameters(), msg);
        Assert.assertEquals(peer.getStaticPublicKey().getQ(), decoded.getStaticPublicKey().getQ());
        Assert.assertEquals(peer.getEphemeralPublicKey().getQ(), decoded.getEphemeralPublicKey().getQ());
        Assert.assertArrayEquals(ID_B, decoded.getUserId());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPeerMessageWithBadLength() {
        byte[] msg = randomParty(false, ID_B).toPeer().getEncoded();
        SM2KeySwapPeer.decode(sm2.getDomainParameters(), Arrays.copyOf(msg, msg.length - 1));
    }

    @Test(expected = InvalidKeyParameterException.class)
    public void testPeerMessageWithBadPoint() {
        byte[] msg = randomParty(false, ID_B).toPeer().getEncoded();
        msg[64] ^= 1;
        SM2KeySwapPeer.decode(sm2.getDomainParameters(), msg);
    }

    @Test(expected = InvalidKeyParameterException.class)
    public void testPeerOnOtherDomain() throws CryptoException {
        SM2KeySwap initiator = new SM2KeySwap();
        initiator.init(randomParty(true, ID_A));
        initiator.calculateKey(128, party(TestCurves.gmTest(), false, D_B, R_B, ID_B).toPeer());
    }

    @Test(expected = IllegalStateException.class)
    public void testUseBeforeInit() throws CryptoException {
        new SM2KeySwap().calculateKey(128, randomParty(false, ID_B).toPeer());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInitiatorNeedsTag() throws CryptoException {
        SM2KeySwap initiator = new SM2KeySwap();
        initiator.init(randomParty(true, ID_A));
        initiator.calculateKeyWithConfirmation(128, null, randomParty(false, ID_B).toPeer());
    }

    @Test
    public void testRequestedLengthIsLogged() throws CryptoException {
        SM2KeySwapParams a = randomParty(true, ID_A);
        SM2KeySwapParams b = randomParty(false, ID_B);
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        PrintStream err = System.err;
        System.setErr(new PrintStream(captured, true));
        try {
            SM2KeySwap responder = new SM2KeySwap();
            responder.init(b);
            SM2KeySwapResult rb = responder.calculateKeyWithConfirmation(200, null, a.toPeer());
            SM2KeySwap initiator = new SM2KeySwap();
            initiator.init(a);
            initiator.calculateKey(72, b.toPeer());
            Assert.assertEquals(32, rb.getConfirmationTag().length);
        } finally {
            System.setErr(err);
        }
        String log = new String(captured.toByteArray(), StandardCharsets.UTF_8);
        Assert.assertTrue(log, log.contains("Deriving 200-bit key as responder with confirmation"));
        Assert.assertTrue(log, log.contains("Deriving 72-bit key as initiator without confirmation"));
    }
}
