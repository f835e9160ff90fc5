package org.twostack.neo3j.wallet;

import org.junit.Test;
import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.crypto.ScryptParams;
import org.twostack.neo3j.exception.InvalidKeyException;
import org.twostack.neo3j.exception.NEP2Exception;
import org.twostack.neo3j.utils.TestKeys;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class AccountTest {

    private static final ScryptParams LIGHT = new ScryptParams(256, 1, 1);
    private static final String NEP2_1_LIGHT = "6PYM7jHL3uwhP8uuHP9fMGMfJxfyQbanUZPQEh1772iyb7vRnUkbkZmdRT";

    @Test
    public void accountFromWif() throws InvalidKeyException {
        Account account = Account.fromWIF(TestKeys.WIF_1);

        assertEquals(TestKeys.ADDRESS_1, account.getAddress());
        assertEquals(new Hash160(TestKeys.HASH_1), account.getScriptHash());
        assertEquals(TestKeys.VSCRIPT_1, Utils.HEX.encode(account.getVerificationScript().getScript()));
        assertEquals(TestKeys.PRIV_1, Utils.HEX.encode(account.getPrivateKey().getBytes()));
        assertFalse(account.isMultiSig());
        assertEquals(Integer.valueOf(1), account.getSigningThreshold());
        assertEquals(TestKeys.ADDRESS_1, account.getLabel());
    }

    @Test
    public void watchOnlyAccountFromAddress() {
        Account account = Account.fromAddress(TestKeys.ADDRESS_2);

        assertEquals(new Hash160(TestKeys.HASH_2), account.getScriptHash());
        assertNull(account.getPrivateKey());
        assertNull(account.getVerificationScript());
        assertNull(account.getSigningThreshold());
        assertFalse(account.isMultiSig());
    }

    @Test
    public void publicKeyAccountCannotSign() {
        Account account = Account.fromPublicKey(TestKeys.publicKey(TestKeys.PUB_1));

        assertEquals(TestKeys.ADDRESS_1, account.getAddress());
        assertNull(account.getPrivateKey());
        assertEquals(Account.fromPrivateKey(TestKeys.privateKey(TestKeys.PRIV_1)), account);
    }

    @Test
    public void multiSigAccount() {
        List<PublicKey> keys = Arrays.asList(TestKeys.publicKey(TestKeys.PUB_1),
                TestKeys.publicKey(TestKeys.PUB_2), TestKeys.publicKey(TestKeys.PUB_3));

        Account account = Account.createMultiSigAccount(keys, 2);

        assertTrue(account.isMultiSig());
        assertEquals(Integer.valueOf(2), account.getSigningThreshold());
        assertEquals(Integer.valueOf(3), account.getNrOfParticipants());
        assertEquals(TestKeys.MULTISIG_2_OF_3_ADDRESS, account.getAddress());
        assertEquals(new Hash160(TestKeys.MULTISIG_2_OF_3_HASH), account.getScriptHash());
        assertEquals(TestKeys.MULTISIG_2_OF_3, Utils.HEX.encode(account.getVerificationScript().getScript()));
    }

    @Test
    public void multiSigAddressIgnoresKeyOrder() {
        Account ordered = Account.createMultiSigAccount(Arrays.asList(TestKeys.publicKey(TestKeys.PUB_1),
                TestKeys.publicKey(TestKeys.PUB_2), TestKeys.publicKey(TestKeys.PUB_3)), 2);
        Account shuffled = Account.createMultiSigAccount(Arrays.asList(TestKeys.publicKey(TestKeys.PUB_3),
                TestKeys.publicKey(TestKeys.PUB_1), TestKeys.publicKey(TestKeys.PUB_2)), 2);

        assertEquals(ordered.getAddress(), shuffled.getAddress());
    }

    @Test
    public void encryptAndDecryptPrivateKey() throws NEP2Exception {
        Account account = Account.fromPrivateKey(TestKeys.privateKey(TestKeys.PRIV_1));

        account.encryptPrivateKey("neo", LIGHT);

        assertNull(account.getPrivateKey());
        assertEquals(NEP2_1_LIGHT, account.getEncryptedPrivateKey());

        account.decryptPrivateKey("neo", LIGHT);
        assertEquals(TestKeys.PRIV_1, Utils.HEX.encode(account.getPrivateKey().getBytes()));
    }

    @Test
    public void decryptWithWrongPasswordKeepsKeyLocked() {
        Account account = Account.fromPrivateKey(TestKeys.privateKey(TestKeys.PRIV_1)).encryptPrivateKey("neo", LIGHT);

        assertThrows(NEP2Exception.InvalidPassphrase.class, () -> account.decryptPrivateKey("wrong", LIGHT));
        assertNull(account.getPrivateKey());
    }

    @Test
    public void encryptWithoutKeyFails() {
        Account account = Account.fromAddress(TestKeys.ADDRESS_1);

        assertThrows(IllegalStateException.class, () -> account.encryptPrivateKey("neo", LIGHT));
    }

    @Test
    public void decryptWithoutEncryptedKeyFails() {
        Account account = Account.fromAddress(TestKeys.ADDRESS_1);

        assertThrows(IllegalStateException.class, () -> account.decryptPrivateKey("neo", LIGHT));
    }

    @Test
    public void accountFromNep2KeepsEncryptedKey() throws NEP2Exception {
        Account account = Account.fromNEP2(NEP2_1_LIGHT, "neo", LIGHT);

        assertEquals(TestKeys.ADDRESS_1, account.getAddress());
        assertEquals(NEP2_1_LIGHT, account.getEncryptedPrivateKey());
        assertNotNull(account.getPrivateKey());
    }

    @Test
    public void labelCanBeChanged() {
        Account account = Account.fromAddress(TestKeys.ADDRESS_2).setLabel("savings");

        assertEquals("savings", account.getLabel());
    }
}
