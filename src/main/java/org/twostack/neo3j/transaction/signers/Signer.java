
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
package org.twostack.neo3j.transaction.signers;

import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.VarInt;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.exception.SignerConfigurationException;
import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;
import org.twostack.neo3j.transaction.WitnessScope;
import org.twostack.neo3j.transaction.witnessrule.WitnessRule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <p>A signer of a transaction: the script hash whose witness authorizes the transaction, and the scope in which
 * that witness may be used.</p>
 *
 * <p>A signer starts out with a single scope. The allow-list setters widen it by adding the matching scope flag.
 * They fail on a {@link WitnessScope#GLOBAL} signer and when a list would grow beyond
 * {@value NeoConstants#MAX_SIGNER_SUBITEMS} entries; a failed call leaves the signer unchanged.</p>
 *
 * <p>There are three kinds of signers, dispatched with a {@link Visitor}: {@link AccountSigner},
 * {@link ContractSigner} and {@link TransactionSigner}. Equality only considers the fields that go on the wire,
 * so a signer decoded from a transaction equals the one the transaction was built with.</p>
 */
public abstract class Signer implements NeoSerializable {

    private final Hash160 signerHash;
    private final List<WitnessScope> scopes = new ArrayList<>();
    private final List<Hash160> allowedContracts = new ArrayList<>();
    private final List<PublicKey> allowedGroups = new ArrayList<>();
    private final List<WitnessRule> rules = new ArrayList<>();

    Signer(Hash160 signerHash, WitnessScope scope) {
        this.signerHash = Objects.requireNonNull(signerHash);
        this.scopes.add(Objects.requireNonNull(scope));
    }

    Signer(Hash160 signerHash, List<WitnessScope> scopes) {
        this.signerHash = Objects.requireNonNull(signerHash);
        if (scopes.isEmpty()) {
            this.scopes.add(WitnessScope.NONE);
        } else {
            if (scopes.contains(WitnessScope.GLOBAL) && scopes.size() > 1) {
                throw new IllegalArgumentException("The global witness scope cannot be combined with other scopes");
            }
            this.scopes.addAll(scopes);
        }
    }

    public interface Visitor<R, X extends Exception> {
        R visitAccountSigner(AccountSigner signer) throws X;

        R visitContractSigner(ContractSigner signer) throws X;

        R visitTransactionSigner(TransactionSigner signer) throws X;
    }

    public abstract <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X;

    public Hash160 getScriptHash() {
        return signerHash;
    }

    public List<WitnessScope> getScopes() {
        return Collections.unmodifiableList(scopes);
    }

    public List<Hash160> getAllowedContracts() {
        return Collections.unmodifiableList(allowedContracts);
    }

    public List<PublicKey> getAllowedGroups() {
        return Collections.unmodifiableList(allowedGroups);
    }

    public List<WitnessRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public Signer setAllowedContracts(Hash160... allowedContracts) throws SignerConfigurationException {
        return setAllowedContracts(Arrays.asList(allowedContracts));
    }

    /**
     * Adds contracts to the allow-list and the {@link WitnessScope#CUSTOM_CONTRACTS} flag to the scope.
     *
     * @throws SignerConfigurationException if the signer is global or the list would exceed its cap
     */
    public Signer setAllowedContracts(List<Hash160> contracts) throws SignerConfigurationException {
        checkNotGlobal("allowed contracts");
        if (contracts.isEmpty()) {
            return this;
        }
        checkSubitemCap("allowed contracts", allowedContracts.size() + contracts.size());
        addScope(WitnessScope.CUSTOM_CONTRACTS);
        allowedContracts.addAll(contracts);
        return this;
    }

    public Signer setAllowedGroups(PublicKey... allowedGroups) throws SignerConfigurationException {
        return setAllowedGroups(Arrays.asList(allowedGroups));
    }

    /**
     * Adds contract groups to the allow-list and the {@link WitnessScope#CUSTOM_GROUPS} flag to the scope.
     *
     * @throws SignerConfigurationException if the signer is global or the list would exceed its cap
     */
    public Signer setAllowedGroups(List<PublicKey> groups) throws SignerConfigurationException {
        checkNotGlobal("allowed groups");
        if (groups.isEmpty()) {
            return this;
        }
        checkSubitemCap("allowed groups", allowedGroups.size() + groups.size());
        addScope(WitnessScope.CUSTOM_GROUPS);
        allowedGroups.addAll(groups);
        return this;
    }

    public Signer setRules(WitnessRule... rules) throws SignerConfigurationException {
        return setRules(Arrays.asList(rules));
    }

    /**
     * Adds witness rules and the {@link WitnessScope#WITNESS_RULES} flag to the scope.
     *
     * @throws SignerConfigurationException if the signer is global, the list would exceed its cap, or a rule's
     *                                      condition nests deeper than {@value NeoConstants#MAX_NESTING_DEPTH}
     */
    public Signer setRules(List<WitnessRule> newRules) throws SignerConfigurationException {
        checkNotGlobal("witness rules");
        if (newRules.isEmpty()) {
            return this;
        }
        checkSubitemCap("witness rules", rules.size() + newRules.size());
        for (WitnessRule rule : newRules) {
            if (!rule.getCondition().isWithinDepth(NeoConstants.MAX_NESTING_DEPTH)) {
                throw new SignerConfigurationException("A witness rule's condition exceeds the maximum nesting "
                        + "depth of " + NeoConstants.MAX_NESTING_DEPTH);
            }
        }
        addScope(WitnessScope.WITNESS_RULES);
        rules.addAll(newRules);
        return this;
    }

    private void checkNotGlobal(String what) throws SignerConfigurationException {
        if (scopes.contains(WitnessScope.GLOBAL)) {
            throw new SignerConfigurationException("Trying to set " + what + " on a signer with global scope");
        }
    }

    private static void checkSubitemCap(String what, int size) throws SignerConfigurationException {
        if (size > NeoConstants.MAX_SIGNER_SUBITEMS) {
            throw new SignerConfigurationException("A signer's " + what + " are limited to "
                    + NeoConstants.MAX_SIGNER_SUBITEMS + " entries");
        }
    }

    private void addScope(WitnessScope scope) {
        scopes.remove(WitnessScope.NONE);
        if (!scopes.contains(scope)) {
            scopes.add(scope);
        }
    }

    @Override
    public void serialize(WriteUtils writer) {
        signerHash.serialize(writer);
        writer.writeByte(WitnessScope.combineScopes(scopes));
        if (scopes.contains(WitnessScope.CUSTOM_CONTRACTS)) {
            writer.writeSerializableVariable(allowedContracts);
        }
        if (scopes.contains(WitnessScope.CUSTOM_GROUPS)) {
            writer.writeVarInt(allowedGroups.size());
            for (PublicKey group : allowedGroups) {
                writer.writeBytes(group.getEncoded());
            }
        }
        if (scopes.contains(WitnessScope.WITNESS_RULES)) {
            writer.writeSerializableVariable(rules);
        }
    }

    @Override
    public int getSize() {
        int size = NeoConstants.HASH160_SIZE + 1;
        if (scopes.contains(WitnessScope.CUSTOM_CONTRACTS)) {
            size += NeoSerializable.getVarSize(allowedContracts);
        }
        if (scopes.contains(WitnessScope.CUSTOM_GROUPS)) {
            size += VarInt.sizeOf(allowedGroups.size())
                    + allowedGroups.size() * NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED;
        }
        if (scopes.contains(WitnessScope.WITNESS_RULES)) {
            size += NeoSerializable.getVarSize(rules);
        }
        return size;
    }

    /**
     * Reads a signer from the wire. Decoded signers carry no account or contract information, so they are
     * {@link TransactionSigner}s.
     */
    public static TransactionSigner fromReader(ReadUtils reader) throws ProtocolException {
        Hash160 signerHash = Hash160.fromReader(reader);
        List<WitnessScope> scopes = WitnessScope.extractCombinedScopes(reader.readByte());
        TransactionSigner transactionSigner = new TransactionSigner(signerHash, scopes);
        Signer signer = transactionSigner;
        if (scopes.contains(WitnessScope.CUSTOM_CONTRACTS)) {
            signer.allowedContracts.addAll(
                    reader.readSerializableList(Hash160::fromReader, NeoConstants.MAX_SIGNER_SUBITEMS));
        }
        if (scopes.contains(WitnessScope.CUSTOM_GROUPS)) {
            signer.allowedGroups.addAll(reader.readSerializableList(r -> PublicKey.fromBytes(r.readEncodedECPoint()),
                    NeoConstants.MAX_SIGNER_SUBITEMS));
        }
        if (scopes.contains(WitnessScope.WITNESS_RULES)) {
            signer.rules.addAll(
                    reader.readSerializableList(WitnessRule::fromReader, NeoConstants.MAX_SIGNER_SUBITEMS));
        }
        return transactionSigner;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signer)) return false;
        Signer that = (Signer) o;
        return signerHash.equals(that.signerHash)
                && WitnessScope.combineScopes(scopes) == WitnessScope.combineScopes(that.scopes)
                && allowedContracts.equals(that.allowedContracts)
                && allowedGroups.equals(that.allowedGroups)
                && rules.equals(that.rules);
    }

    @Override
    public final int hashCode() {
        return Objects.hash(signerHash, WitnessScope.combineScopes(scopes), allowedContracts, allowedGroups, rules);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + signerHash + ", " + scopes + "}";
    }
}
