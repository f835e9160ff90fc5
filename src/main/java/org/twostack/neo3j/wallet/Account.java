
/*
 * Copyright 2021 Stephan M. February
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.twostack.neo3j.wallet;

import org.twostack.neo3j.Address;
import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.PrivateKey;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.crypto.NEP2;
import org.twostack.neo3j.crypto.ScryptParams;
import org.twostack.neo3j.exception.InvalidKeyException;
import org.twostack.neo3j.exception.NEP2Exception;
import org.twostack.neo3j.script.VerificationScript;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * <p>An account is identified by its script hash. Depending on how it was created it also knows its verification
 * script, and for single key accounts the private key that signs for it.</p>
 *
 * <p>The private key can be swapped for its NEP-2 encrypted form with {@link #encryptPrivateKey(String)} and
 * recovered with {@link #decryptPrivateKey(String)}.</p>
 */
public class Account {

    @Nullable
    private PrivateKey privateKey;

    private final Hash160 scriptHash;

    @Nullable
    private final VerificationScript verificationScript;

    @Nullable
    private String encryptedPrivateKey;

    @Nullable
    private final Integer signingThreshold;

    @Nullable
    private final Integer nrOfParticipants;

    private String label;

    private Account(@Nullable PrivateKey privateKey, Hash160 scriptHash,
                    @Nullable VerificationScript verificationScript, @Nullable Integer signingThreshold,
                    @Nullable Integer nrOfParticipants) {
        this.privateKey = privateKey;
        this.scriptHash = Objects.requireNonNull(scriptHash);
        this.verificationScript = verificationScript;
        this.signingThreshold = signingThreshold;
        this.nrOfParticipants = nrOfParticipants;
        this.label = scriptHash.toAddress();
    }

    /** Creates an account with a freshly generated key. */
    public static Account create() {
        return fromPrivateKey(PrivateKey.createNew());
    }

    public static Account fromPrivateKey(PrivateKey privateKey) {
        VerificationScript script = VerificationScript.fromPublicKey(privateKey.getPublicKey());
        return new Account(privateKey, script.getScriptHash(), script, 1, 1);
    }

    public static Account fromWIF(String wif) throws InvalidKeyException {
        return fromPrivateKey(PrivateKey.fromWIF(wif));
    }

    /** A single key account that cannot sign. */
    public static Account fromPublicKey(PublicKey publicKey) {
        return fromVerificationScript(VerificationScript.fromPublicKey(publicKey));
    }

    /**
     * Creates an account for the given verification script. Threshold and participant count are read from the
     * script when it is a single key or multi-sig script.
     */
    public static Account fromVerificationScript(VerificationScript script) {
        Integer threshold = null;
        Integer participants = null;
        if (script.isSingleSigScript() || script.isMultiSigScript()) {
            threshold = script.getSigningThreshold();
            participants = script.getNrOfAccounts();
        }
        return new Account(null, script.getScriptHash(), script, threshold, participants);
    }

    /**
     * Creates an m-of-n multi-sig account. Key order does not matter; the verification script sorts the keys.
     */
    public static Account createMultiSigAccount(List<PublicKey> publicKeys, int signingThreshold) {
        return fromVerificationScript(VerificationScript.fromMultiSig(publicKeys, signingThreshold));
    }

    /** A watch-only account known only by its script hash. */
    public static Account fromScriptHash(Hash160 scriptHash) {
        return new Account(null, scriptHash, null, null, null);
    }

    public static Account fromAddress(String address) {
        return fromScriptHash(Address.toScriptHash(address));
    }

    /**
     * Decrypts a NEP-2 key and creates the account for it. The encrypted form is kept on the account.
     */
    public static Account fromNEP2(String nep2, String password) throws NEP2Exception {
        return fromNEP2(nep2, password, ScryptParams.STANDARD);
    }

    public static Account fromNEP2(String nep2, String password, ScryptParams scryptParams) throws NEP2Exception {
        Account account = fromPrivateKey(NEP2.decrypt(password, nep2, scryptParams));
        account.encryptedPrivateKey = nep2;
        return account;
    }

    public Account encryptPrivateKey(String password) {
        return encryptPrivateKey(password, ScryptParams.STANDARD);
    }

    /**
     * Encrypts the private key and drops the plain key from this account.
     *
     * @throws IllegalStateException if the account holds no private key
     */
    public Account encryptPrivateKey(String password, ScryptParams scryptParams) {
        if (privateKey == null) {
            throw new IllegalStateException("The account does not hold a private key");
        }
        encryptedPrivateKey = NEP2.encrypt(password, privateKey, scryptParams);
        privateKey = null;
        return this;
    }

    public Account decryptPrivateKey(String password) throws NEP2Exception {
        return decryptPrivateKey(password, ScryptParams.STANDARD);
    }

    /**
     * Restores the private key from its encrypted form.
     *
     * @throws IllegalStateException if the account holds no encrypted key
     */
    public Account decryptPrivateKey(String password, ScryptParams scryptParams) throws NEP2Exception {
        if (privateKey != null) {
            return this;
        }
        if (encryptedPrivateKey == null) {
            throw new IllegalStateException("The account does not hold an encrypted private key");
        }
        PrivateKey decrypted = NEP2.decrypt(password, encryptedPrivateKey, scryptParams);
        if (!Hash160.fromPublicKey(decrypted.getPublicKey()).equals(scriptHash)) {
            throw new NEP2Exception.InvalidPassphrase("Decrypted key does not belong to this account");
        }
        privateKey = decrypted;
        return this;
    }

    public Hash160 getScriptHash() {
        return scriptHash;
    }

    public String getAddress() {
        return scriptHash.toAddress();
    }

    @Nullable
    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    @Nullable
    public VerificationScript getVerificationScript() {
        return verificationScript;
    }

    @Nullable
    public String getEncryptedPrivateKey() {
        return encryptedPrivateKey;
    }

    public boolean isMultiSig() {
        return verificationScript != null && verificationScript.isMultiSigScript();
    }

    @Nullable
    public Integer getSigningThreshold() {
        return signingThreshold;
    }

    @Nullable
    public Integer getNrOfParticipants() {
        return nrOfParticipants;
    }

    public String getLabel() {
        return label;
    }

    public Account setLabel(String label) {
        this.label = label;
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return scriptHash.equals(((Account) o).scriptHash);
    }

    @Override
    public int hashCode() {
        return scriptHash.hashCode();
    }

    @Override
    public String toString() {
        return "Account{" + getAddress() + "}";
    }
}
