package org.twostack.neo3j.transaction;

import org.junit.Test;
import org.twostack.neo3j.PrivateKey;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.exception.TransactionConfigurationException;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.script.VerificationScript;
import org.twostack.neo3j.types.ContractParameter;
import org.twostack.neo3j.utils.TestKeys;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class WitnessTest {

    private final byte[] message = Utils.HEX.decode("4e454f33355f122e698f5398f99c3915899789709d48102f162e7f846103f068ec8010c2");

    private final VerificationScript multiSig = new VerificationScript(Utils.HEX.decode(TestKeys.MULTISIG_2_OF_3));

    @Test
    public void singleSigWitnessVerifies() {
        PrivateKey key = TestKeys.privateKey(TestKeys.PRIV_1);

        Witness witness = Witness.create(message, key);

        assertEquals(TestKeys.VSCRIPT_1, Utils.HEX.encode(witness.getVerificationScript().getScript()));
        byte[] invocation = witness.getInvocationScript().getScript();
        assertEquals(66, invocation.length);
        assertEquals("0c40", Utils.HEX.encode(Arrays.copyOf(invocation, 2)));

        byte[] signature = witness.getInvocationScript().getSignatures().get(0);
        assertTrue(key.getPublicKey().verify(message, signature));
    }

    @Test
    public void witnessSerializesBothScripts() {
        Witness witness = Witness.create(message, TestKeys.privateKey(TestKeys.PRIV_1));

        byte[] bytes = witness.serialize();

        assertEquals(1 + 66 + 1 + 40, bytes.length);
        assertEquals(bytes.length, witness.getSize());
        assertEquals(witness, Witness.fromReader(new ReadUtils(bytes)));
    }

    @Test
    public void multiSigWitnessUsesFirstThresholdSignatures() throws TransactionConfigurationException {
        List<PublicKey> keys = multiSig.getPublicKeys();
        // signatures ordered like the keys in the script: PUB_3, PUB_2, PUB_1
        byte[] sig3 = TestKeys.privateKey(TestKeys.PRIV_3).sign(message);
        byte[] sig2 = TestKeys.privateKey(TestKeys.PRIV_2).sign(message);
        byte[] sig1 = TestKeys.privateKey(TestKeys.PRIV_1).sign(message);

        Witness witness = Witness.createMultiSigWitness(Arrays.asList(sig3, sig2, sig1), multiSig);

        List<byte[]> used = witness.getInvocationScript().getSignatures();
        assertEquals(2, used.size());
        assertArrayEquals(sig3, used.get(0));
        assertArrayEquals(sig2, used.get(1));
        assertTrue(keys.get(0).verify(message, used.get(0)));
        assertEquals(multiSig, witness.getVerificationScript());
    }

    @Test
    public void multiSigWitnessNeedsThresholdSignatures() {
        byte[] sig = TestKeys.privateKey(TestKeys.PRIV_3).sign(message);

        assertThrows(TransactionConfigurationException.class,
                () -> Witness.createMultiSigWitness(Collections.singletonList(sig), multiSig));
    }

    @Test
    public void multiSigWitnessNeedsMultiSigScript() {
        byte[] sig = TestKeys.privateKey(TestKeys.PRIV_1).sign(message);
        VerificationScript single = new VerificationScript(Utils.HEX.decode(TestKeys.VSCRIPT_1));

        assertThrows(IllegalArgumentException.class,
                () -> Witness.createMultiSigWitness(Arrays.asList(sig, sig), single));
    }

    @Test
    public void contractWitnessPushesParametersWithEmptyVerification() {
        Witness witness = Witness.createContractWitness(Arrays.asList(
                ContractParameter.integer(1), ContractParameter.string("a")));

        assertEquals("11" + "0c0161", Utils.HEX.encode(witness.getInvocationScript().getScript()));
        assertTrue(witness.getVerificationScript().isEmpty());
        assertEquals("04" + "110c0161" + "00",Utils.HEX.encode(witness.serialize()));
    }
}
