package org.twostack.neo3j.script;

import at.favre.lib.bytes.Bytes;
import org.junit.Test;
import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.exception.ScriptException;
import org.twostack.neo3j.types.ContractParameter;
import org.twostack.neo3j.utils.TestKeys;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.*;

public class ScriptBuilderTest {

    private static String pushInteger(BigInteger value) {
        return Utils.HEX.encode(new ScriptBuilder().pushInteger(value).toArray());
    }

    private static String pushInteger(long value) {
        return pushInteger(BigInteger.valueOf(value));
    }

    @Test
    public void smallIntegersUseSingleOpcodes() {
        assertEquals("0f", pushInteger(-1));
        assertEquals("10", pushInteger(0));
        assertEquals("11", pushInteger(1));
        assertEquals("20", pushInteger(16));
    }

    @Test
    public void largerIntegersUseSmallestPushInt() {
        assertEquals("0011", pushInteger(17));
        assertEquals("00fe", pushInteger(-2));
        assertEquals("018000", pushInteger(128));
        assertEquals("01ff00", pushInteger(255));
        assertEquals("0200000100", pushInteger(65536));
        assertEquals("026079feff", pushInteger(-100000));
        assertEquals("03ffffffffffffff7f", pushInteger(Long.MAX_VALUE));
        assertEquals("030000000000000080", pushInteger(Long.MIN_VALUE));
        assertEquals("04" + "00000000000000000100000000000000", pushInteger(BigInteger.ONE.shiftLeft(64)));
    }

    @Test
    public void integersBeyond256BitsFail() {
        BigInteger maxInt256 = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);
        assertThat(pushInteger(maxInt256)).startsWith("05").hasSize(66);

        assertThrows(ScriptException.class, () -> new ScriptBuilder().pushInteger(BigInteger.ONE.shiftLeft(255)));
    }

    @Test
    public void pushDataPicksPrefixBySize() {
        assertEquals("0c01ff", Utils.HEX.encode(new ScriptBuilder().pushData(new byte[]{(byte) 0xff}).toArray()));

        byte[] script255 = new ScriptBuilder().pushData(new byte[255]).toArray();
        assertThat(Utils.HEX.encode(script255)).startsWith("0cff");
        assertEquals(257, script255.length);

        byte[] script256 = new ScriptBuilder().pushData(new byte[256]).toArray();
        assertThat(Utils.HEX.encode(script256)).startsWith("0d0001");
        assertEquals(259, script256.length);

        byte[] script65536 = new ScriptBuilder().pushData(new byte[65536]).toArray();
        assertThat(Utils.HEX.encode(Arrays.copyOf(script65536, 5))).isEqualTo("0e00000100");
        assertEquals(65541, script65536.length);
    }

    @Test
    public void pushStringIsUtf8() {
        assertEquals("0c03616263", Utils.HEX.encode(new ScriptBuilder().pushData("abc").toArray()));
    }

    @Test
    public void pushBooleans() {
        assertEquals("0809", Utils.HEX.encode(new ScriptBuilder().pushBoolean(true).pushBoolean(false).toArray()));
    }

    @Test
    public void contractCallWithParameters() {
        List<ContractParameter> params = Arrays.asList(
                ContractParameter.hash160(new Hash160(TestKeys.HASH_1)),
                ContractParameter.hash160(new Hash160(TestKeys.HASH_2)),
                ContractParameter.integer(5),
                ContractParameter.any());

        byte[] script = new ScriptBuilder().contractCall(TestKeys.NEO_TOKEN, "transfer", params).toArray();

        String expected = "0b15"
                + "0c14" + "4b7ac4b2811e5e73fd48cb5d465708d2b625ab04"
                + "0c14" + "0d165c9899c38bbf5991c5e47b04937258caec69"
                + "14c0"
                + "1f"
                + "0c08" + "7472616e73666572"
                + "0c14" + "f563ea40bc283d4d0e05c48ea305b3f2a07340ef"
                + "41627d5b52";
        assertEquals(expected, Utils.HEX.encode(script));
    }

    @Test
    public void contractCallWithoutParametersPushesEmptyArray() {
        byte[] script = new ScriptBuilder()
                .contractCall(TestKeys.NEO_TOKEN, "symbol", Collections.<ContractParameter>emptyList())
                .toArray();

        assertEquals("c21f0c0673796d626f6c0c14f563ea40bc283d4d0e05c48ea305b3f2a07340ef41627d5b52",
                Utils.HEX.encode(script));
    }

    @Test
    public void contractCallWithReadOnlyFlags() {
        byte[] script = new ScriptBuilder()
                .contractCall(TestKeys.NEO_TOKEN, "symbol", null, CallFlags.READ_ONLY)
                .toArray();

        assertEquals("c2", Utils.HEX.encode(Arrays.copyOf(script, 1)));
        assertEquals(OpCode.PUSH5.byteValue(), script[1]);
    }

    @Test
    public void emptyMethodNameIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ScriptBuilder().contractCall(TestKeys.NEO_TOKEN, "", null, CallFlags.ALL));
    }

    @Test
    public void nullParameterPushesNull() {
        assertEquals("0b", Utils.HEX.encode(new ScriptBuilder().pushParam(null).toArray()));
    }

    @Test
    public void nestedArraysAndEmptyArrays() {
        ContractParameter nested = ContractParameter.array(
                ContractParameter.bool(true),
                ContractParameter.array(Collections.<ContractParameter>emptyList()));

        byte[] script = new ScriptBuilder().pushParam(nested).toArray();

        // inner empty array, then true, then count and PACK
        assertEquals("c2" + "08" + "12c0", Utils.HEX.encode(script));
    }

    @Test
    public void mapPushesValueBeforeKey() {
        Map<ContractParameter, ContractParameter> map = new LinkedHashMap<>();
        map.put(ContractParameter.string("a"), ContractParameter.integer(1));
        map.put(ContractParameter.string("b"), ContractParameter.integer(2));

        byte[] script = new ScriptBuilder().pushParam(ContractParameter.map(map)).toArray();

        assertEquals("12" + "0c0162" + "11" + "0c0161" + "12be", Utils.HEX.encode(script));
    }

    @Test
    public void verificationScriptOfSingleKey() {
        byte[] script = ScriptBuilder.buildVerificationScript(Utils.HEX.decode(TestKeys.PUB_1));

        assertEquals(TestKeys.VSCRIPT_1, Utils.HEX.encode(script));
        assertEquals(40, script.length);
    }

    @Test
    public void multiSigScriptIsIndependentOfKeyOrder() {
        PublicKey one = TestKeys.publicKey(TestKeys.PUB_1);
        PublicKey two = TestKeys.publicKey(TestKeys.PUB_2);
        PublicKey three = TestKeys.publicKey(TestKeys.PUB_3);

        byte[] a = ScriptBuilder.buildMultiSigScript(Arrays.asList(one, two, three), 2);
        byte[] b = ScriptBuilder.buildMultiSigScript(Arrays.asList(three, one, two), 2);

        assertEquals(TestKeys.MULTISIG_2_OF_3, Utils.HEX.encode(a));
        assertTrue(Bytes.wrap(a).equals(b));
        assertEquals(TestKeys.MULTISIG_2_OF_3_HASH, Hash160.fromScript(a).toString());
    }

    @Test
    public void multiSigThresholdMustFitKeyCount() {
        List<PublicKey> keys = Arrays.asList(TestKeys.publicKey(TestKeys.PUB_1), TestKeys.publicKey(TestKeys.PUB_2));

        assertThrows(IllegalArgumentException.class, () -> ScriptBuilder.buildMultiSigScript(keys, 0));
        assertThrows(IllegalArgumentException.class, () -> ScriptBuilder.buildMultiSigScript(keys, 3));
        assertThrows(IllegalArgumentException.class,
                () -> ScriptBuilder.buildMultiSigScript(Collections.<PublicKey>emptyList(), 1));
    }

    @Test
    public void contractCallUnwrappingIterator() {
        byte[] script = ScriptBuilder.buildContractCallAndUnwrapIterator(TestKeys.NEO_TOKEN, "tokensOf",
                Collections.singletonList(ContractParameter.hash160(new Hash160(TestKeys.HASH_1))));

        String expected = "0064"
                + "0c140d165c9899c38bbf5991c5e47b04937258caec6911c01f"
                + "0c08746f6b656e734f66"
                + "0c14f563ea40bc283d4d0e05c48ea305b3f2a07340ef41627d5b52"
                + "c2"
                + "4b419c08ed9c"
                + "2614"
                + "4a124d41f354bf1d"
                + "cf4aca134db8"
                + "2404"
                + "22e8"
                + "4646";
        assertEquals(expected, Utils.HEX.encode(script));
    }

    @Test
    public void sysCallTagsAreHashPrefixes() {
        assertEquals("56e7b327", InteropService.SYSTEM_CRYPTO_CHECKSIG.getHashHex());
        assertEquals("9ed0dc3a", InteropService.SYSTEM_CRYPTO_CHECKMULTISIG.getHashHex());
        assertEquals("627d5b52", InteropService.SYSTEM_CONTRACT_CALL.getHashHex());
        assertSame(InteropService.SYSTEM_CONTRACT_CALL, InteropService.fromHash(Utils.HEX.decode("627d5b52")));
        assertNull(InteropService.fromHash(Utils.HEX.decode("00000000")));
    }

    @Test
    public void paramsArePushedInReverseForPack() {
        byte[] script = new ScriptBuilder().pushParams(ContractParameter.integer(1), ContractParameter.integer(2),
                ContractParameter.integer(3)).toArray();

        // PACK pops 1 first, so the array reads [1, 2, 3]
        assertEquals("13" + "12" + "11" + "13" + "c0", Utils.HEX.encode(script));
    }
}
