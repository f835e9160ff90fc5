
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
package org.twostack.neo3j.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.exception.ProviderException;
import org.twostack.neo3j.exception.TransactionConfigurationException;
import org.twostack.neo3j.exception.TransactionException;
import org.twostack.neo3j.protocol.NeoProvider;
import org.twostack.neo3j.script.InvocationScript;
import org.twostack.neo3j.script.VerificationScript;
import org.twostack.neo3j.transaction.signers.AccountSigner;
import org.twostack.neo3j.transaction.signers.ContractSigner;
import org.twostack.neo3j.transaction.signers.Signer;
import org.twostack.neo3j.transaction.signers.TransactionSigner;
import org.twostack.neo3j.wallet.Account;

import javax.annotation.Nullable;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * <p>Assembles transactions. The builder collects a script, signers and attributes, asks the {@link NeoProvider}
 * for everything that depends on chain state (fees, block count, committee, network magic) and produces either
 * an unsigned transaction or one signed by the signers' accounts.</p>
 *
 * <pre>{@code
 * Transaction tx = new TransactionBuilder(provider)
 *         .script(script)
 *         .signers(AccountSigner.calledByEntry(account))
 *         .sign();
 * tx.send(provider);
 * }</pre>
 *
 * <p>A builder must not be shared between threads.</p>
 */
public class TransactionBuilder {

    private static final Logger log = LoggerFactory.getLogger(TransactionBuilder.class);

    private static final SecureRandom random = new SecureRandom();

    // any signature has the same size, which is all that fee calculation needs
    private static final byte[] DUMMY_SIGNATURE = new byte[NeoConstants.SIGNATURE_SIZE];

    private final NeoProvider provider;

    private byte version;
    private long nonce;

    @Nullable
    private Long validUntilBlock;

    private List<Signer> signers = new ArrayList<>();
    private long additionalNetworkFee;
    private long additionalSystemFee;
    private List<TransactionAttribute> attributes = new ArrayList<>();

    @Nullable
    private byte[] script;

    @Nullable
    private BiConsumer<Long, Long> feeConsumer;

    public TransactionBuilder(NeoProvider provider) {
        this.provider = Objects.requireNonNull(provider);
        this.version = NeoConstants.CURRENT_TX_VERSION;
        // nonce is an unsigned 32 bit value
        this.nonce = random.nextInt() & 0xFFFFFFFFL;
    }

    public TransactionBuilder version(byte version) {
        this.version = version;
        return this;
    }

    /**
     * @throws TransactionConfigurationException if the nonce does not fit in 32 unsigned bits
     */
    public TransactionBuilder nonce(long nonce) throws TransactionConfigurationException {
        if (nonce < 0 || nonce > 0xFFFFFFFFL) {
            throw new TransactionConfigurationException("The nonce must be between 0 and 2^32-1 but was " + nonce);
        }
        this.nonce = nonce;
        return this;
    }

    /**
     * Sets the height up to which the transaction is valid. Without it, the transaction is valid for as long as
     * the protocol allows from the current block count.
     *
     * @throws TransactionConfigurationException if the height does not fit in 32 unsigned bits
     */
    public TransactionBuilder validUntilBlock(long blockNr) throws TransactionConfigurationException {
        if (blockNr < 0 || blockNr > 0xFFFFFFFFL) {
            throw new TransactionConfigurationException("The block number must be between 0 and 2^32-1 but was "
                    + blockNr);
        }
        this.validUntilBlock = blockNr;
        return this;
    }

    /**
     * Replaces the signers. The first signer is the sender, which pays the fees.
     */
    public TransactionBuilder signers(Signer... signers) {
        return signers(Arrays.asList(signers));
    }

    public TransactionBuilder signers(List<? extends Signer> signers) {
        this.signers = new ArrayList<>(signers);
        return this;
    }

    public TransactionBuilder firstSigner(Account account) throws TransactionConfigurationException {
        return firstSigner(account.getScriptHash());
    }

    /**
     * Moves the signer with the given script hash to the front, making it the sender.
     *
     * @throws TransactionConfigurationException if no signer has that script hash
     */
    public TransactionBuilder firstSigner(Hash160 sender) throws TransactionConfigurationException {
        for (int i = 0; i < signers.size(); i++) {
            if (signers.get(i).getScriptHash().equals(sender)) {
                Signer signer = signers.remove(i);
                signers.add(0, signer);
                return this;
            }
        }
        throw new TransactionConfigurationException("Could not find a signer with script hash " + sender
                + ". Make sure to add the signer before setting it as the first signer");
    }

    public TransactionBuilder attributes(TransactionAttribute... attributes) {
        this.attributes.addAll(Arrays.asList(attributes));
        return this;
    }

    public TransactionBuilder script(byte[] script) {
        this.script = Arrays.copyOf(script, script.length);
        return this;
    }

    /** Appends to the script set so far. */
    public TransactionBuilder extendScript(byte[] script) {
        if (this.script == null) {
            return script(script);
        }
        byte[] extended = Arrays.copyOf(this.script, this.script.length + script.length);
        System.arraycopy(script, 0, extended, this.script.length, script.length);
        this.script = extended;
        return this;
    }

    /** GAS fractions added on top of the network fee the node calculates. */
    public TransactionBuilder additionalNetworkFee(long fee) {
        this.additionalNetworkFee = fee;
        return this;
    }

    /** GAS fractions added on top of the system fee the node calculates. */
    public TransactionBuilder additionalSystemFee(long fee) {
        this.additionalSystemFee = fee;
        return this;
    }

    /**
     * Registers a callback that is told when the sender's GAS balance does not cover the fees. It receives the
     * required fee and the balance, both in GAS fractions. Building goes on regardless.
     */
    public TransactionBuilder doIfSenderCannotCoverFees(BiConsumer<Long, Long> consumer) {
        this.feeConsumer = consumer;
        return this;
    }

    /**
     * Builds the transaction without witnesses.
     *
     * @throws TransactionConfigurationException if the builder state is invalid: no script, no signers, duplicate
     *                                           signers, too many signers and attributes, a high priority attribute
     *                                           without a committee signer, or a transaction that would be too large
     * @throws ProviderException                 if a call to the node fails
     */
    public Transaction getUnsignedTransaction() throws TransactionConfigurationException, ProviderException {
        validate();

        long validUntil = validUntilBlock != null
                ? validUntilBlock
                : provider.getBlockCount() + NeoConstants.MAX_VALID_UNTIL_BLOCK_INCREMENT - 1;

        if (containsHighPriorityAttribute() && !isAllowedForHighPriority()) {
            throw new TransactionConfigurationException("This transaction does not have a committee member as "
                    + "signer. Only committee members can send transactions with high priority");
        }

        long systemFee = provider.invokeScriptForGas(script, signers) + additionalSystemFee;

        Transaction withFakeWitnesses = new Transaction(version, nonce, validUntil, signers, systemFee, 0,
                attributes, script, createFakeWitnesses());
        int size = withFakeWitnesses.getSize();
        if (size > NeoConstants.MAX_TRANSACTION_SIZE) {
            throw new TransactionConfigurationException("The transaction would be " + size
                    + " bytes, more than the maximum of " + NeoConstants.MAX_TRANSACTION_SIZE);
        }
        long networkFee = provider.calculateNetworkFee(withFakeWitnesses.serialize()) + additionalNetworkFee;
        log.debug("Fees for transaction: system fee {}, network fee {}", systemFee, networkFee);

        if (feeConsumer != null) {
            checkSenderBalance(systemFee + networkFee);
        }

        return new Transaction(version, nonce, validUntil, signers, systemFee, networkFee, attributes, script,
                Collections.<Witness>emptyList());
    }

    /**
     * Builds the transaction and signs it with the signers' accounts. Contract signers get a witness made of their
     * verify parameters.
     *
     * @throws TransactionConfigurationException if the builder state is invalid, a signer is a multi-sig account
     *                                           (build its witness with {@link Witness#createMultiSigWitness}),
     *                                           or an account holds no private key
     * @throws ProviderException                 if a call to the node fails
     */
    public Transaction sign() throws TransactionException, ProviderException {
        Transaction unsigned = getUnsignedTransaction();
        byte[] hashData = unsigned.getHashData(provider.getNetworkMagic());

        WitnessCreator witnessCreator = new WitnessCreator(hashData);
        List<Witness> witnesses = new ArrayList<>();
        for (Signer signer : unsigned.getSigners()) {
            witnesses.add(signer.accept(witnessCreator));
        }
        return unsigned.withWitnesses(witnesses);
    }

    private void validate() throws TransactionConfigurationException {
        if (script == null || script.length == 0) {
            throw new TransactionConfigurationException("Cannot build a transaction without a script");
        }
        if (script.length > Transaction.MAX_SCRIPT_SIZE) {
            throw new TransactionConfigurationException("The script is larger than " + Transaction.MAX_SCRIPT_SIZE
                    + " bytes");
        }
        if (signers.isEmpty()) {
            throw new TransactionConfigurationException("Cannot build a transaction without signers. At least "
                    + "one signer is required for paying the fees");
        }
        if (Transaction.hasDuplicateSigners(signers)) {
            throw new TransactionConfigurationException("Cannot add the same signer more than once");
        }
        if (signers.size() + attributes.size() > NeoConstants.MAX_TRANSACTION_ATTRIBUTES) {
            throw new TransactionConfigurationException("A transaction cannot have more than "
                    + NeoConstants.MAX_TRANSACTION_ATTRIBUTES + " signers and attributes together");
        }
        if (Transaction.hasDuplicateUniqueAttributes(attributes)) {
            throw new TransactionConfigurationException("Only conflicts attributes can be added more than once");
        }
    }

    private boolean containsHighPriorityAttribute() {
        for (TransactionAttribute attribute : attributes) {
            if (attribute.getType() == TransactionAttributeType.HIGH_PRIORITY) {
                return true;
            }
        }
        return false;
    }

    // a committee member signs, either directly or as part of a multi-sig account
    private boolean isAllowedForHighPriority() throws ProviderException {
        List<PublicKey> committee = provider.getCommittee();
        Set<Hash160> committeeHashes = new HashSet<>();
        for (PublicKey member : committee) {
            committeeHashes.add(Hash160.fromPublicKey(member));
        }
        for (Signer signer : signers) {
            if (committeeHashes.contains(signer.getScriptHash())) {
                return true;
            }
            if (signer instanceof AccountSigner) {
                Account account = ((AccountSigner) signer).getAccount();
                if (account.isMultiSig()) {
                    for (PublicKey key : account.getVerificationScript().getPublicKeys()) {
                        if (committee.contains(key)) {
                            return true;
                        }
                    }
                }
            }
        }
        return false;
    }

    private void checkSenderBalance(long requiredFee) throws ProviderException {
        Hash160 sender = signers.get(0).getScriptHash();
        long balance = provider.getGasBalance(sender);
        if (balance < requiredFee) {
            log.warn("Sender {} cannot cover fees of {} with a balance of {}", sender.toAddress(), requiredFee,
                    balance);
            feeConsumer.accept(requiredFee, balance);
        }
    }

    private List<Witness> createFakeWitnesses() throws TransactionConfigurationException {
        List<Witness> witnesses = new ArrayList<>();
        for (Signer signer : signers) {
            witnesses.add(signer.accept(FAKE_WITNESS_CREATOR));
        }
        return witnesses;
    }

    /** Witnesses of the right shape for fee calculation, holding zeroed signatures. */
    private static final Signer.Visitor<Witness, TransactionConfigurationException> FAKE_WITNESS_CREATOR =
            new Signer.Visitor<Witness, TransactionConfigurationException>() {
                @Override
                public Witness visitAccountSigner(AccountSigner signer) throws TransactionConfigurationException {
                    VerificationScript verificationScript = signer.getAccount().getVerificationScript();
                    if (verificationScript == null) {
                        throw new TransactionConfigurationException("The account " + signer.getScriptHash()
                                + " has no verification script, so the network fee cannot be calculated");
                    }
                    List<byte[]> signatures = new ArrayList<>();
                    int threshold = verificationScript.isMultiSigScript()
                            ? verificationScript.getSigningThreshold() : 1;
                    for (int i = 0; i < threshold; i++) {
                        signatures.add(DUMMY_SIGNATURE);
                    }
                    return new Witness(InvocationScript.fromSignatures(signatures), verificationScript);
                }

                @Override
                public Witness visitContractSigner(ContractSigner signer) {
                    return Witness.createContractWitness(signer.getVerifyParameters());
                }

                @Override
                public Witness visitTransactionSigner(TransactionSigner signer)
                        throws TransactionConfigurationException {
                    throw new TransactionConfigurationException("Signer " + signer.getScriptHash()
                            + " carries no account or contract, so its witness cannot be built");
                }
            };

    private static class WitnessCreator implements Signer.Visitor<Witness, TransactionConfigurationException> {
        private final byte[] hashData;

        WitnessCreator(byte[] hashData) {
            this.hashData = hashData;
        }

        @Override
        public Witness visitAccountSigner(AccountSigner signer) throws TransactionConfigurationException {
            Account account = signer.getAccount();
            if (account.isMultiSig()) {
                throw new TransactionConfigurationException("Transactions with multi-sig signers cannot be signed "
                        + "automatically. Create the witness of " + account.getAddress()
                        + " with Witness.createMultiSigWitness and attach it with Transaction.withWitnesses");
            }
            if (account.getPrivateKey() == null) {
                throw new TransactionConfigurationException("Cannot sign for " + account.getAddress()
                        + " because the account holds no private key. Decrypt its key first");
            }
            log.debug("Signing transaction for {}", account.getAddress());
            return Witness.create(hashData, account.getPrivateKey());
        }

        @Override
        public Witness visitContractSigner(ContractSigner signer) {
            return Witness.createContractWitness(signer.getVerifyParameters());
        }

        @Override
        public Witness visitTransactionSigner(TransactionSigner signer) throws TransactionConfigurationException {
            throw new TransactionConfigurationException("Signer " + signer.getScriptHash()
                    + " carries no account or contract, so it cannot be signed for");
        }
    }
}
