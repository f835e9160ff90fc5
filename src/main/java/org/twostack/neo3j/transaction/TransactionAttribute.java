
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

import org.twostack.neo3j.Hash256;
import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;

import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Attributes attached to a transaction. On the wire each one is a type byte followed by its fields.
 */
public abstract class TransactionAttribute implements NeoSerializable {

    private TransactionAttribute() {
    }

    public abstract TransactionAttributeType getType();

    @Override
    public void serialize(WriteUtils writer) {
        writer.writeByte(getType().byteValue());
        serializeWithoutType(writer);
    }

    protected abstract void serializeWithoutType(WriteUtils writer);

    @Override
    public int getSize() {
        return 1;
    }

    public static TransactionAttribute fromReader(ReadUtils reader) throws ProtocolException {
        TransactionAttributeType type = TransactionAttributeType.valueOf(reader.readByte());
        switch (type) {
            case HIGH_PRIORITY:
                return new HighPriorityAttribute();
            case ORACLE_RESPONSE: {
                long id = reader.readInt64();
                OracleResponseCode code = OracleResponseCode.valueOf(reader.readByte());
                byte[] result = reader.readVarBytes(NeoConstants.MAX_ORACLE_RESULT_SIZE);
                if (code != OracleResponseCode.SUCCESS && result.length > 0) {
                    throw new ProtocolException("Oracle responses that failed cannot carry a result");
                }
                return new OracleResponseAttribute(id, code, result);
            }
            case NOT_VALID_BEFORE:
                return new NotValidBeforeAttribute(reader.readUint32());
            case CONFLICTS:
                return new ConflictsAttribute(Hash256.fromReader(reader));
            default:
                throw new ProtocolException("Unsupported transaction attribute type: " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(serialize(), ((TransactionAttribute) o).serialize());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(serialize());
    }

    /**
     * Lets the transaction into a block ahead of others. Only committee members may send such transactions.
     */
    public static final class HighPriorityAttribute extends TransactionAttribute {

        @Override
        public TransactionAttributeType getType() {
            return TransactionAttributeType.HIGH_PRIORITY;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
        }

        @Override
        public String toString() {
            return getType().jsonValue();
        }
    }

    /** The answer of the oracle nodes to an oracle request. */
    public static final class OracleResponseAttribute extends TransactionAttribute {
        private final long id;
        private final OracleResponseCode code;
        private final byte[] result;

        public OracleResponseAttribute(long id, OracleResponseCode code, byte[] result) {
            checkArgument(result.length <= NeoConstants.MAX_ORACLE_RESULT_SIZE,
                    "Oracle results are limited to %s bytes", NeoConstants.MAX_ORACLE_RESULT_SIZE);
            this.id = id;
            this.code = Objects.requireNonNull(code);
            this.result = Arrays.copyOf(result, result.length);
        }

        public long getId() {
            return id;
        }

        public OracleResponseCode getCode() {
            return code;
        }

        public byte[] getResult() {
            return Arrays.copyOf(result, result.length);
        }

        @Override
        public TransactionAttributeType getType() {
            return TransactionAttributeType.ORACLE_RESPONSE;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
            writer.writeInt64LE(id);
            writer.writeByte(code.byteValue());
            writer.writeVarBytes(result);
        }

        @Override
        public int getSize() {
            return super.getSize() + 8 + 1 + NeoSerializable.getVarSize(result);
        }

        @Override
        public String toString() {
            return getType().jsonValue() + "{id=" + id + ", code=" + code.jsonValue() + "}";
        }
    }

    /** Makes the transaction invalid before the given block height. */
    public static final class NotValidBeforeAttribute extends TransactionAttribute {
        private final long height;

        public NotValidBeforeAttribute(long height) {
            checkArgument(height >= 0 && height <= 0xFFFFFFFFL, "Block height must fit in 32 unsigned bits");
            this.height = height;
        }

        public long getHeight() {
            return height;
        }

        @Override
        public TransactionAttributeType getType() {
            return TransactionAttributeType.NOT_VALID_BEFORE;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
            writer.writeUint32LE(height);
        }

        @Override
        public int getSize() {
            return super.getSize() + 4;
        }

        @Override
        public String toString() {
            return getType().jsonValue() + "{height=" + height + "}";
        }
    }

    /** Declares that this transaction conflicts with the one with the given hash. */
    public static final class ConflictsAttribute extends TransactionAttribute {
        private final Hash256 hash;

        public ConflictsAttribute(Hash256 hash) {
            this.hash = Objects.requireNonNull(hash);
        }

        public Hash256 getHash() {
            return hash;
        }

        @Override
        public TransactionAttributeType getType() {
            return TransactionAttributeType.CONFLICTS;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
            hash.serialize(writer);
        }

        @Override
        public int getSize() {
            return super.getSize() + NeoConstants.HASH256_SIZE;
        }

        @Override
        public String toString() {
            return getType().jsonValue() + "{hash=" + hash + "}";
        }
    }
}
