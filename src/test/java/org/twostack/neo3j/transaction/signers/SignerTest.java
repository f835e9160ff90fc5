package org.twostack.neo3j.transaction.signers;

import org.junit.Test;
import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.exception.SignerConfigurationException;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.transaction.WitnessScope;
import org.twostack.neo3j.transaction.witnessrule.WitnessAction;
import org.twostack.neo3j.transaction.witnessrule.WitnessCondition;
import org.twostack.neo3j.transaction.witnessrule.WitnessRule;
import org.twostack.neo3j.types.ContractParameter;
import org.twostack.neo3j.utils.TestKeys;
import org.twostack.neo3j.wallet.Account;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.*;

public class SignerTest {

    private final Account account = Account.fromPrivateKey(TestKeys.privateKey(TestKeys.PRIV_1));
    private final Hash160 contract = TestKeys.NEO_TOKEN;

    private static List<Hash160> contracts(int count) {
        List<Hash160> hashes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            byte[] hash = new byte[20];
            hash[19] = (byte) i;
            hashes.add(new Hash160(hash));
        }
        return hashes;
    }

    @Test
    public void calledByEntrySigner() {
        AccountSigner signer = AccountSigner.calledByEntry(account);

        assertEquals(account.getScriptHash(), signer.getScriptHash());
        assertThat(signer.getScopes()).containsExactly(WitnessScope.CALLED_BY_ENTRY);
        assertEquals("0d165c9899c38bbf5991c5e47b04937258caec69" + "01", Utils.HEX.encode(signer.serialize()));
        assertEquals(21, signer.getSize());
    }

    @Test
    public void allowedContractsAddCustomContractsScope() throws SignerConfigurationException {
        Signer signer = AccountSigner.calledByEntry(account).setAllowedContracts(contract);

        assertThat(signer.getScopes()).containsExactly(WitnessScope.CALLED_BY_ENTRY, WitnessScope.CUSTOM_CONTRACTS);
        assertThat(signer.getAllowedContracts()).containsExactly(contract);
        assertEquals("0d165c9899c38bbf5991c5e47b04937258caec69" + "11"
                + "01" + "f563ea40bc283d4d0e05c48ea305b3f2a07340ef", Utils.HEX.encode(signer.serialize()));
        assertEquals(signer.serialize().length, signer.getSize());
    }

    @Test
    public void customScopeReplacesNone() throws SignerConfigurationException {
        Signer signer = AccountSigner.none(account).setAllowedGroups(TestKeys.publicKey(TestKeys.PUB_2));

        assertThat(signer.getScopes()).containsExactly(WitnessScope.CUSTOM_GROUPS);
    }

    @Test
    public void addingTwiceKeepsOneScopeFlag() throws SignerConfigurationException {
        Signer signer = AccountSigner.calledByEntry(account)
                .setAllowedContracts(contract)
                .setAllowedContracts(new Hash160(TestKeys.HASH_2));

        assertThat(signer.getScopes()).containsExactly(WitnessScope.CALLED_BY_ENTRY, WitnessScope.CUSTOM_CONTRACTS);
        assertEquals(2, signer.getAllowedContracts().size());
    }

    @Test
    public void emptyListChangesNothing() throws SignerConfigurationException {
        Signer signer = AccountSigner.calledByEntry(account).setAllowedContracts(Collections.<Hash160>emptyList());

        assertThat(signer.getScopes()).containsExactly(WitnessScope.CALLED_BY_ENTRY);
    }

    @Test
    public void globalSignerRejectsAllowLists() {
        Signer signer = AccountSigner.global(account);

        assertThrows(SignerConfigurationException.class, () -> signer.setAllowedContracts(contract));
        assertThrows(SignerConfigurationException.class,
                () -> signer.setAllowedGroups(TestKeys.publicKey(TestKeys.PUB_2)));
        assertThrows(SignerConfigurationException.class, () -> signer.setRules(
                new WitnessRule(WitnessAction.ALLOW, new WitnessCondition.CalledByEntryCondition())));
        assertThat(signer.getScopes()).containsExactly(WitnessScope.GLOBAL);
    }

    @Test
    public void globalSignerRejectsEmptyAllowLists() {
        Signer signer = AccountSigner.global(account);

        assertThrows(SignerConfigurationException.class,
                () -> signer.setAllowedContracts(Collections.<Hash160>emptyList()));
        assertThrows(SignerConfigurationException.class,
                () -> signer.setAllowedGroups(Collections.<PublicKey>emptyList()));
        assertThrows(SignerConfigurationException.class,
                () -> signer.setRules(Collections.<WitnessRule>emptyList()));
        assertThat(signer.getScopes()).containsExactly(WitnessScope.GLOBAL);
    }

    @Test
    public void emptyAllowListLeavesScopeUnchanged() throws SignerConfigurationException {
        Signer signer = AccountSigner.calledByEntry(account).setAllowedContracts(Collections.<Hash160>emptyList());

        assertThat(signer.getScopes()).containsExactly(WitnessScope.CALLED_BY_ENTRY);
        assertThat(signer.getAllowedContracts()).isEmpty();
    }

    @Test
    public void sixteenContractsAreAllowed() throws SignerConfigurationException {
        Signer signer = AccountSigner.calledByEntry(account).setAllowedContracts(contracts(16));

        assertEquals(16, signer.getAllowedContracts().size());
    }

    @Test
    public void seventeenthContractFailsWithoutPartialChange() throws SignerConfigurationException {
        Signer full = AccountSigner.calledByEntry(account).setAllowedContracts(contracts(16));
        assertThrows(SignerConfigurationException.class, () -> full.setAllowedContracts(contract));
        assertEquals(16, full.getAllowedContracts().size());

        Signer fresh = AccountSigner.calledByEntry(account);
        assertThrows(SignerConfigurationException.class, () -> fresh.setAllowedContracts(contracts(17)));
        assertTrue(fresh.getAllowedContracts().isEmpty());
        assertThat(fresh.getScopes()).containsExactly(WitnessScope.CALLED_BY_ENTRY);
    }

    @Test
    public void rulesNestedTooDeepAreRejected() {
        WitnessCondition tooDeep = new WitnessCondition.NotCondition(new WitnessCondition.NotCondition(
                new WitnessCondition.NotCondition(new WitnessCondition.BooleanCondition(true))));
        Signer signer = AccountSigner.calledByEntry(account);

        assertThrows(SignerConfigurationException.class,
                () -> signer.setRules(new WitnessRule(WitnessAction.ALLOW, tooDeep)));
        assertTrue(signer.getRules().isEmpty());
        assertThat(signer.getScopes()).containsExactly(WitnessScope.CALLED_BY_ENTRY);
    }

    @Test
    public void rulesAddWitnessRulesScope() throws SignerConfigurationException {
        WitnessRule rule = new WitnessRule(WitnessAction.ALLOW, new WitnessCondition.NotCondition(
                new WitnessCondition.CalledByContractCondition(contract)));

        Signer signer = AccountSigner.none(account).setRules(rule);

        assertThat(signer.getScopes()).containsExactly(WitnessScope.WITNESS_RULES);
        assertEquals((byte) 0x40, WitnessScope.combineScopes(signer.getScopes()));
    }

    @Test
    public void decodedSignerEqualsBuiltSigner() throws SignerConfigurationException {
        Signer signer = AccountSigner.calledByEntry(account)
                .setAllowedContracts(contract)
                .setAllowedGroups(TestKeys.publicKey(TestKeys.PUB_3))
                .setRules(new WitnessRule(WitnessAction.DENY, new WitnessCondition.CalledByEntryCondition()));

        TransactionSigner decoded = Signer.fromReader(new ReadUtils(signer.serialize()));

        assertEquals(signer, decoded);
        assertEquals(decoded, signer);
        assertEquals(signer.hashCode(), decoded.hashCode());
        assertThat(decoded.getScopes()).containsExactlyInAnyOrder(WitnessScope.CALLED_BY_ENTRY,
                WitnessScope.CUSTOM_CONTRACTS, WitnessScope.CUSTOM_GROUPS, WitnessScope.WITNESS_RULES);
    }

    @Test
    public void decodingRejectsGlobalCombinedWithOtherScopes() {
        String hex = TestKeys.HASH_1 + "81";
        assertThrows(ProtocolException.class, () -> Signer.fromReader(new ReadUtils(Utils.HEX.decode(hex))));
    }

    @Test
    public void decodingRejectsOverlongContractList() {
        StringBuilder hex = new StringBuilder(TestKeys.HASH_1).append("10").append("11");
        for (int i = 0; i < 17; i++) {
            hex.append(TestKeys.HASH_2);
        }
        assertThrows(ProtocolException.class,
                () -> Signer.fromReader(new ReadUtils(Utils.HEX.decode(hex.toString()))));
    }

    @Test
    public void globalCannotBeCombinedOnConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new TransactionSigner(account.getScriptHash(),
                Arrays.asList(WitnessScope.GLOBAL, WitnessScope.CALLED_BY_ENTRY)));
        assertThat(new TransactionSigner(account.getScriptHash(), Collections.<WitnessScope>emptyList()).getScopes())
                .containsExactly(WitnessScope.NONE);
    }

    @Test
    public void scopeByteRoundTrip() {
        List<WitnessScope> scopes = WitnessScope.extractCombinedScopes((byte) 0x31);

        assertThat(scopes).containsExactlyInAnyOrder(WitnessScope.CALLED_BY_ENTRY, WitnessScope.CUSTOM_CONTRACTS,
                WitnessScope.CUSTOM_GROUPS);
        assertEquals((byte) 0x31, WitnessScope.combineScopes(scopes));
        assertThat(WitnessScope.extractCombinedScopes((byte) 0)).containsExactly(WitnessScope.NONE);
        assertThrows(ProtocolException.class, () -> WitnessScope.extractCombinedScopes((byte) 0x02));
    }

    @Test
    public void contractSignerKeepsVerifyParameters() {
        ContractSigner signer = ContractSigner.calledByEntry(contract, ContractParameter.integer(1),
                ContractParameter.string("x"));

        assertEquals(contract, signer.getScriptHash());
        assertEquals(2, signer.getVerifyParameters().size());
        assertThat(signer.getScopes()).containsExactly(WitnessScope.CALLED_BY_ENTRY);
    }

    @Test
    public void signerKindsDispatchToVisitor() {
        Signer.Visitor<String, RuntimeException> namer = new Signer.Visitor<String, RuntimeException>() {
            @Override
            public String visitAccountSigner(AccountSigner signer) {
                return "account";
            }

            @Override
            public String visitContractSigner(ContractSigner signer) {
                return "contract";
            }

            @Override
            public String visitTransactionSigner(TransactionSigner signer) {
                return "transaction";
            }
        };

        assertEquals("account", AccountSigner.none(account).accept(namer));
        assertEquals("contract", ContractSigner.global(contract).accept(namer));
        assertEquals("transaction", new TransactionSigner(contract,
                Collections.singletonList(WitnessScope.GLOBAL)).accept(namer));
    }
}
