
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
import org.twostack.neo3j.Hash256;
import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.Sha256Hash;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.exception.ProviderException;
import org.twostack.neo3j.exception.TransactionConfigurationException;
import org.twostack.neo3j.exception.TransactionException;
import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;
import org.twostack.neo3j.params.NetworkParameters;
import org.twostack.neo3j.protocol.NeoProvider;
import org.twostack.neo3j.transaction.signers.Signer;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <p>A Neo N3 transaction.</p>
 *
 * <p>The unsigned part is laid out as
 * {@code version | nonce | system fee | network fee | valid until block | signers | attributes | script}.
 * A signed transaction follows it with one witness per signer, in the order of the signers.</p>
 *
 * <p>Instances are immutable, except for the block count recorded by {@link #send(NeoProvider)}. Use
 * {@link TransactionBuilder} to assemble and sign transactions, or {@link #withWitnesses(List)} to attach witnesses
 * that were made elsewhere, e.g. for multi-sig accounts.</p>
 */
public class Transaction implements NeoSerializable {

    private static final Logger log = LoggerFactory.getLogger(Transaction.class);

    /** Size of the fixed width fields: version, nonce, both fees and valid-until-block. */
    public static final int HEADER_SIZE = 1 + 4 + 8 + 8 + 4;

    /** Scripts are var-bytes with a two byte length at most. */
    public static final int MAX_SCRIPT_SIZE = 0xFFFF;

    private final byte version;
    private final long nonce;
    private final long validUntilBlock;
    private final List<Signer> signers;
    private final long systemFee;
    private final long networkFee;
    private final List<TransactionAttribute> attributes;
    private final byte[] script;
    private final List<Witness> witnesses;

    @Nullable
    private Long blockCountWhenSent;

    public Transaction(byte version, long nonce, long validUntilBlock, List<Signer> signers, long systemFee,
                       long networkFee, List<TransactionAttribute> attributes, byte[] script,
                       List<Witness> witnesses) {
        this.version = version;
        this.nonce = nonce;
        this.validUntilBlock = validUntilBlock;
        this.signers = Collections.unmodifiableList(new ArrayList<>(signers));
        this.systemFee = systemFee;
        this.networkFee = networkFee;
        this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
        this.script = Arrays.copyOf(script, script.length);
        this.witnesses = Collections.unmodifiableList(new ArrayList<>(witnesses));
    }

    public static Transaction fromHex(String txHex) throws ProtocolException {
        return fromBytes(Utils.HEX.decode(txHex.toLowerCase()));
    }

    /**
     * Reads a transaction, with or without its witnesses. Trailing bytes are an error.
     */
    public static Transaction fromBytes(byte[] bytes) throws ProtocolException {
        ReadUtils reader = new ReadUtils(bytes);
        Transaction tx = fromReader(reader);
        if (reader.hasMoreBytes()) {
            throw new ProtocolException(reader.available() + " unexpected bytes after the transaction");
        }
        return tx;
    }

    public static Transaction fromReader(ReadUtils reader) throws ProtocolException {
        byte version = reader.readByte();
        if (version != NeoConstants.CURRENT_TX_VERSION) {
            throw new ProtocolException("Unsupported transaction version: " + version);
        }
        long nonce = reader.readUint32();
        long systemFee = reader.readInt64();
        if (systemFee < 0) {
            throw new ProtocolException("System fee cannot be negative");
        }
        long networkFee = reader.readInt64();
        if (networkFee < 0) {
            throw new ProtocolException("Network fee cannot be negative");
        }
        long validUntilBlock = reader.readUint32();

        List<Signer> signers = reader.readSerializableList(Signer::fromReader, NeoConstants.MAX_TRANSACTION_ATTRIBUTES);
        if (signers.isEmpty()) {
            throw new ProtocolException("A transaction needs at least one signer");
        }
        if (hasDuplicateSigners(signers)) {
            throw new ProtocolException("A transaction cannot list the same signer twice");
        }

        List<TransactionAttribute> attributes = reader.readSerializableList(TransactionAttribute::fromReader,
                NeoConstants.MAX_TRANSACTION_ATTRIBUTES - signers.size());
        if (hasDuplicateUniqueAttributes(attributes)) {
            throw new ProtocolException("Only conflicts attributes may appear more than once");
        }

        byte[] script = reader.readVarBytes(MAX_SCRIPT_SIZE);
        if (script.length == 0) {
            throw new ProtocolException("A transaction needs a script");
        }

        List<Witness> witnesses = new ArrayList<>();
        if (reader.hasMoreBytes()) {
            witnesses = reader.readSerializableList(Witness::fromReader, signers.size());
            if (!witnesses.isEmpty() && witnesses.size() != signers.size()) {
                throw new ProtocolException("Transaction has " + signers.size() + " signers but "
                        + witnesses.size() + " witnesses");
            }
        }
        return new Transaction(version, nonce, validUntilBlock, signers, systemFee, networkFee, attributes, script,
                witnesses);
    }

    static boolean hasDuplicateSigners(List<? extends Signer> signers) {
        Set<Hash160> hashes = new HashSet<>();
        for (Signer signer : signers) {
            if (!hashes.add(signer.getScriptHash())) {
                return true;
            }
        }
        return false;
    }

    static boolean hasDuplicateUniqueAttributes(List<TransactionAttribute> attributes) {
        Set<TransactionAttributeType> seen = EnumSet.noneOf(TransactionAttributeType.class);
        for (TransactionAttribute attribute : attributes) {
            TransactionAttributeType type = attribute.getType();
            if (type != TransactionAttributeType.CONFLICTS && !seen.add(type)) {
                return true;
            }
        }
        return false;
    }

    public byte getVersion() {
        return version;
    }

    public long getNonce() {
        return nonce;
    }

    public long getValidUntilBlock() {
        return validUntilBlock;
    }

    public List<Signer> getSigners() {
        return signers;
    }

    /** The first signer pays the fees. */
    public Signer getSender() {
        return signers.get(0);
    }

    public long getSystemFee() {
        return systemFee;
    }

    public long getNetworkFee() {
        return networkFee;
    }

    public List<TransactionAttribute> getAttributes() {
        return attributes;
    }

    public byte[] getScript() {
        return Arrays.copyOf(script, script.length);
    }

    public List<Witness> getWitnesses() {
        return witnesses;
    }

    public boolean isSigned() {
        return !witnesses.isEmpty() && witnesses.size() == signers.size();
    }

    /**
     * Attaches witnesses, one per signer in signer order.
     *
     * @throws TransactionConfigurationException if the number of witnesses differs from the number of signers, or a
     *                                           witness's verification script belongs to a different account than
     *                                           its signer
     */
    public Transaction withWitnesses(List<Witness> witnesses) throws TransactionConfigurationException {
        if (witnesses.size() != signers.size()) {
            throw new TransactionConfigurationException("The transaction has " + signers.size()
                    + " signers but " + witnesses.size() + " witnesses were given");
        }
        for (int i = 0; i < witnesses.size(); i++) {
            Witness witness = witnesses.get(i);
            if (!witness.getVerificationScript().isEmpty()
                    && !witness.getVerificationScript().getScriptHash().equals(signers.get(i).getScriptHash())) {
                throw new TransactionConfigurationException("Witness " + i + " does not belong to signer "
                        + signers.get(i).getScriptHash());
            }
        }
        return new Transaction(version, nonce, validUntilBlock, signers, systemFee, networkFee, attributes, script,
                witnesses);
    }

    /** The transaction bytes without the witnesses, the part that signatures cover. */
    public byte[] serializeUnsigned() {
        WriteUtils writer = new WriteUtils();
        serializeUnsigned(writer);
        return writer.getBytes();
    }

    private void serializeUnsigned(WriteUtils writer) {
        writer.writeByte(version);
        writer.writeUint32LE(nonce);
        writer.writeInt64LE(systemFee);
        writer.writeInt64LE(networkFee);
        writer.writeUint32LE(validUntilBlock);
        writer.writeSerializableVariable(signers);
        writer.writeSerializableVariable(attributes);
        writer.writeVarBytes(script);
    }

    @Override
    public void serialize(WriteUtils writer) {
        serializeUnsigned(writer);
        writer.writeSerializableVariable(witnesses);
    }

    @Override
    public int getSize() {
        return HEADER_SIZE
                + NeoSerializable.getVarSize(signers)
                + NeoSerializable.getVarSize(attributes)
                + NeoSerializable.getVarSize(script)
                + NeoSerializable.getVarSize(witnesses);
    }

    /**
     * The transaction id: the SHA-256 hash of the unsigned bytes, displayed in reverse byte order.
     */
    public Hash256 getTxId() {
        return new Hash256(Utils.reverseBytes(Sha256Hash.hash(serializeUnsigned())));
    }

    /**
     * The message a signer signs: the four byte little-endian network magic followed by the SHA-256 hash of the
     * unsigned bytes.
     */
    public byte[] getHashData(long networkMagic) {
        byte[] magic = NetworkParameters.getNetworkMagicBytes(networkMagic);
        byte[] hash = Sha256Hash.hash(serializeUnsigned());
        byte[] data = new byte[magic.length + hash.length];
        System.arraycopy(magic, 0, data, 0, magic.length);
        System.arraycopy(hash, 0, data, magic.length, hash.length);
        return data;
    }

    /**
     * Broadcasts the signed transaction and records the block count at the time of sending.
     *
     * @return the transaction hash reported by the node
     * @throws TransactionException if the transaction is not signed or is too large
     * @throws ProviderException    if the node could not be reached or rejected the transaction
     */
    public Hash256 send(NeoProvider provider) throws TransactionException, ProviderException {
        if (!isSigned()) {
            throw new TransactionException("The transaction is not signed");
        }
        int size = getSize();
        if (size > NeoConstants.MAX_TRANSACTION_SIZE) {
            throw new TransactionException("The transaction is " + size + " bytes, more than the maximum of "
                    + NeoConstants.MAX_TRANSACTION_SIZE);
        }
        long blockCount = provider.getBlockCount();
        Hash256 hash = provider.sendRawTransaction(serialize());
        blockCountWhenSent = blockCount;
        log.info("Sent transaction {} at block count {}", hash, blockCount);
        return hash;
    }

    /** The block count recorded when the transaction was sent, or null if it was not sent. */
    @Nullable
    public Long getBlockCountWhenSent() {
        return blockCountWhenSent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transaction that = (Transaction) o;
        return version == that.version
                && nonce == that.nonce
                && validUntilBlock == that.validUntilBlock
                && systemFee == that.systemFee
                && networkFee == that.networkFee
                && signers.equals(that.signers)
                && attributes.equals(that.attributes)
                && Arrays.equals(script, that.script)
                && witnesses.equals(that.witnesses);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(version, nonce, validUntilBlock, signers, systemFee, networkFee, attributes,
                witnesses);
        return 31 * result + Arrays.hashCode(script);
    }

    @Override
    public String toString() {
        return "Transaction{" + getTxId() + "}";
    }
}
