package org.twostack.neo3j.transaction;

import org.junit.Test;
import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.Hash256;
import org.twostack.neo3j.PrivateKey;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.exception.ProviderException;
import org.twostack.neo3j.exception.TransactionConfigurationException;
import org.twostack.neo3j.exception.TransactionException;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.params.NetworkParameters;
import org.twostack.neo3j.script.ScriptBuilder;
import org.twostack.neo3j.transaction.TransactionAttribute.ConflictsAttribute;
import org.twostack.neo3j.transaction.TransactionAttribute.HighPriorityAttribute;
import org.twostack.neo3j.transaction.TransactionAttribute.NotValidBeforeAttribute;
import org.twostack.neo3j.transaction.TransactionAttribute.OracleResponseAttribute;
import org.twostack.neo3j.transaction.signers.AccountSigner;
import org.twostack.neo3j.transaction.signers.Signer;
import org.twostack.neo3j.types.ContractParameter;
import org.twostack.neo3j.utils.TestKeys;
import org.twostack.neo3j.utils.TestNeoProvider;
import org.twostack.neo3j.wallet.Account;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.*;

public class TransactionTest {

    private static final String TRANSFER_SCRIPT = "0b150c144b7ac4b2811e5e73fd48cb5d465708d2b625ab040c140d165c9899c38b"
            + "bf5991c5e47b04937258caec6914c01f0c087472616e736665720c14f563ea40bc283d4d0e05c48ea305b3f2a07340ef"
            + "41627d5b52";

    private static final String UNSIGNED_TRANSFER = "00" + "d2029649" + "40420f0000000000" + "12c7120000000000"
            + "99232000"
            + "01" + "0d165c9899c38bbf5991c5e47b04937258caec69" + "01"
            + "00"
            + "56" + TRANSFER_SCRIPT;

    private static final String TRANSFER_TX_ID = "c21080ec68f00361847f2e162f10489d7089978915399cf998538f692e125f35";

    private final Account account = Account.fromPrivateKey(TestKeys.privateKey(TestKeys.PRIV_1));

    private final List<Witness> noWitnesses = Collections.emptyList();

    private Transaction transfer() {
        byte[] script = new ScriptBuilder().contractCall(TestKeys.NEO_TOKEN, "transfer", Arrays.asList(
                ContractParameter.hash160(account.getScriptHash()),
                ContractParameter.hash160(new Hash160(TestKeys.HASH_2)),
                ContractParameter.integer(5),
                ContractParameter.any())).toArray();
        return new Transaction((byte) 0, 1234567890L, 2106265L,
                Collections.<Signer>singletonList(AccountSigner.calledByEntry(account)),
                1000000L, 1230610L, Collections.<TransactionAttribute>emptyList(), script, noWitnesses);
    }

    private Transaction withScript(List<Signer> signers, List<TransactionAttribute> attributes, byte[] script) {
        return new Transaction((byte) 0, 7L, 100L, signers, 0L, 0L, attributes, script, noWitnesses);
    }

    @Test
    public void serializesUnsignedTransfer() {
        Transaction tx = transfer();

        assertEquals(TRANSFER_SCRIPT, Utils.HEX.encode(tx.getScript()));
        assertEquals(UNSIGNED_TRANSFER, Utils.HEX.encode(tx.serializeUnsigned()));
        // no witnesses: an empty witness list follows
        assertEquals(UNSIGNED_TRANSFER + "00", Utils.HEX.encode(tx.serialize()));
        assertEquals(tx.serialize().length, tx.getSize());
    }

    @Test
    public void txIdIsReversedHashOfUnsignedBytes() {
        assertEquals(new Hash256(TRANSFER_TX_ID), transfer().getTxId());
    }

    @Test
    public void hashDataStartsWithNetworkMagic() {
        byte[] hashData = transfer().getHashData(NetworkParameters.MAGIC_MAIN);

        assertEquals("4e454f33" + "355f122e698f5398f99c3915899789709d48102f162e7f846103f068ec8010c2",
                Utils.HEX.encode(hashData));

        byte[] testnet = transfer().getHashData(NetworkParameters.MAGIC_TEST);
        assertEquals("4e335435", Utils.HEX.encode(Arrays.copyOf(testnet, 4)));
    }

    @Test
    public void unsignedTransactionReadsBack() {
        Transaction decoded = Transaction.fromHex(UNSIGNED_TRANSFER);

        assertEquals(transfer(), decoded);
        assertEquals(1234567890L, decoded.getNonce());
        assertEquals(2106265L, decoded.getValidUntilBlock());
        assertEquals(1000000L, decoded.getSystemFee());
        assertEquals(1230610L, decoded.getNetworkFee());
        assertFalse(decoded.isSigned());
        assertEquals(account.getScriptHash(), decoded.getSender().getScriptHash());
        assertThat(decoded.getSender().getScopes()).containsExactly(WitnessScope.CALLED_BY_ENTRY);
    }

    @Test
    public void signedTransactionReadsBack() throws TransactionConfigurationException {
        Transaction unsigned = transfer();
        PrivateKey key = TestKeys.privateKey(TestKeys.PRIV_1);
        byte[] hashData = unsigned.getHashData(NetworkParameters.MAGIC_MAIN);

        Transaction signed = unsigned.withWitnesses(Collections.singletonList(Witness.create(hashData, key)));
        byte[] bytes = signed.serialize();
        Transaction decoded = Transaction.fromBytes(bytes);

        assertTrue(decoded.isSigned());
        assertEquals(signed, decoded);
        assertEquals(unsigned.getTxId(), decoded.getTxId());
        assertEquals(bytes.length, signed.getSize());

        Witness witness = decoded.getWitnesses().get(0);
        assertEquals(account.getScriptHash(), witness.getVerificationScript().getScriptHash());
        assertTrue(key.getPublicKey().verify(hashData, witness.getInvocationScript().getSignatures().get(0)));
    }

    @Test
    public void serializesAttributesAndCustomContracts() throws Exception {
        Signer second = AccountSigner.calledByEntry(new Hash160(TestKeys.HASH_2))
                .setAllowedContracts(TestKeys.NEO_TOKEN);
        Transaction tx = withScript(Arrays.asList(AccountSigner.calledByEntry(account), second),
                Collections.<TransactionAttribute>singletonList(new HighPriorityAttribute()),
                Utils.HEX.decode("1140"));

        String expected = "00" + "07000000" + "0000000000000000" + "0000000000000000" + "64000000"
                + "02"
                + "0d165c9899c38bbf5991c5e47b04937258caec69" + "01"
                + "4b7ac4b2811e5e73fd48cb5d465708d2b625ab04" + "11" + "01" + "f563ea40bc283d4d0e05c48ea305b3f2a07340ef"
                + "01" + "01"
                + "02" + "1140";
        assertEquals(expected, Utils.HEX.encode(tx.serializeUnsigned()));
        assertEquals(tx, Transaction.fromHex(expected));
    }

    @Test
    public void attributesReadBack() {
        byte[] script = Utils.HEX.decode("40");
        List<TransactionAttribute> attributes = Arrays.asList(
                new NotValidBeforeAttribute(12345L),
                new ConflictsAttribute(new Hash256(TRANSFER_TX_ID)),
                new ConflictsAttribute(Hash256.ZERO),
                new OracleResponseAttribute(3L, OracleResponseCode.SUCCESS, new byte[]{1, 2, 3}));
        Transaction tx = withScript(Collections.<Signer>singletonList(AccountSigner.none(account)), attributes, script);

        Transaction decoded = Transaction.fromBytes(tx.serialize());

        assertEquals(attributes, decoded.getAttributes());
        assertEquals(tx.getSize(), tx.serialize().length);
    }

    @Test
    public void failedOracleResponseCannotCarryResult() {
        // type, id, code Timeout, one byte of result
        String attribute = "11" + "0300000000000000" + "16" + "01" + "aa";
        assertThrows(ProtocolException.class, () -> TransactionAttribute.fromReader(
                new ReadUtils(Utils.HEX.decode(attribute))));
    }

    @Test
    public void decodingRejectsUnsupportedVersion() {
        assertThrows(ProtocolException.class, () -> Transaction.fromHex("01" + UNSIGNED_TRANSFER.substring(2)));
    }

    @Test
    public void decodingRejectsTrailingBytes() {
        assertThrows(ProtocolException.class, () -> Transaction.fromHex(UNSIGNED_TRANSFER + "0000"));
    }

    @Test
    public void decodingRejectsTruncatedTransaction() {
        assertThrows(ProtocolException.class,
                () -> Transaction.fromHex(UNSIGNED_TRANSFER.substring(0, UNSIGNED_TRANSFER.length() - 2)));
    }

    @Test
    public void decodingRejectsStructuralErrors() {
        byte[] script = Utils.HEX.decode("40");
        Signer signer = AccountSigner.calledByEntry(account);

        Transaction noSigners = withScript(Collections.<Signer>emptyList(),
                Collections.<TransactionAttribute>emptyList(), script);
        assertThrows(ProtocolException.class, () -> Transaction.fromBytes(noSigners.serialize()));

        Transaction duplicateSigners = withScript(Arrays.asList(signer, AccountSigner.global(account)),
                Collections.<TransactionAttribute>emptyList(), script);
        assertThrows(ProtocolException.class, () -> Transaction.fromBytes(duplicateSigners.serialize()));

        Transaction noScript = withScript(Collections.singletonList(signer),
                Collections.<TransactionAttribute>emptyList(), new byte[0]);
        assertThrows(ProtocolException.class, () -> Transaction.fromBytes(noScript.serialize()));

        Transaction twoHighPriority = withScript(Collections.singletonList(signer),
                Arrays.<TransactionAttribute>asList(new HighPriorityAttribute(), new HighPriorityAttribute()), script);
        assertThrows(ProtocolException.class, () -> Transaction.fromBytes(twoHighPriority.serialize()));
    }

    @Test
    public void decodingRejectsWitnessCountMismatch() throws TransactionConfigurationException {
        Transaction unsigned = withScript(Arrays.asList(AccountSigner.calledByEntry(account),
                AccountSigner.none(new Hash160(TestKeys.HASH_2))), Collections.<TransactionAttribute>emptyList(),
                Utils.HEX.decode("40"));
        Witness witness = Witness.create(unsigned.getHashData(NetworkParameters.MAGIC_MAIN),
                TestKeys.privateKey(TestKeys.PRIV_1));

        String hex = Utils.HEX.encode(unsigned.serializeUnsigned()) + "01" + Utils.HEX.encode(witness.serialize());

        assertThrows(ProtocolException.class, () -> Transaction.fromHex(hex));
    }

    @Test
    public void witnessesMustMatchSigners() {
        Transaction unsigned = transfer();
        byte[] hashData = unsigned.getHashData(NetworkParameters.MAGIC_MAIN);
        Witness wrongKey = Witness.create(hashData, TestKeys.privateKey(TestKeys.PRIV_2));
        Witness rightKey = Witness.create(hashData, TestKeys.privateKey(TestKeys.PRIV_1));

        assertThrows(TransactionConfigurationException.class,
                () -> unsigned.withWitnesses(Collections.singletonList(wrongKey)));
        assertThrows(TransactionConfigurationException.class,
                () -> unsigned.withWitnesses(Arrays.asList(rightKey, rightKey)));
        assertThrows(TransactionConfigurationException.class,
                () -> unsigned.withWitnesses(Collections.<Witness>emptyList()));
    }

    @Test
    public void sendRequiresSignedTransaction() {
        TestNeoProvider provider = new TestNeoProvider();

        assertThrows(TransactionException.class, () -> transfer().send(provider));
        assertNull(provider.lastSentTransaction);
    }

    @Test
    public void sendRecordsBlockCount() throws TransactionException, ProviderException {
        TestNeoProvider provider = new TestNeoProvider();
        provider.blockCount = 4242;
        Transaction unsigned = transfer();
        Transaction signed = unsigned.withWitnesses(Collections.singletonList(
                Witness.create(unsigned.getHashData(provider.networkMagic), TestKeys.privateKey(TestKeys.PRIV_1))));

        assertNull(signed.getBlockCountWhenSent());
        signed.send(provider);

        assertEquals(Long.valueOf(4242), signed.getBlockCountWhenSent());
        assertArrayEquals(signed.serialize(), provider.lastSentTransaction);
    }
}
