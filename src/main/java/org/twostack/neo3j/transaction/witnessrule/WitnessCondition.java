
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
package org.twostack.neo3j.transaction.witnessrule;

import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>A boolean expression evaluated by the node when it checks a witness with the {@code WitnessRules} scope.</p>
 *
 * <p>{@code Not}, {@code And} and {@code Or} nest other conditions. Each of them uses up one level of the allowed
 * nesting depth, see {@link #isWithinDepth(int)}, and {@code And}/{@code Or} hold between 1 and
 * {@value NeoConstants#MAX_SIGNER_SUBITEMS} conditions.</p>
 */
public abstract class WitnessCondition implements NeoSerializable {

    private WitnessCondition() {
    }

    public abstract WitnessConditionType getType();

    /** Conditions nested directly in this one. Leaves have none. */
    public List<WitnessCondition> getSubConditions() {
        return Collections.emptyList();
    }

    protected boolean isCompound() {
        return false;
    }

    /**
     * Checks that no chain of nested {@code Not}, {@code And} and {@code Or} conditions is deeper than
     * {@code maxDepth}.
     */
    public boolean isWithinDepth(int maxDepth) {
        if (!isCompound()) {
            return true;
        }
        if (maxDepth <= 0) {
            return false;
        }
        for (WitnessCondition condition : getSubConditions()) {
            if (!condition.isWithinDepth(maxDepth - 1)) {
                return false;
            }
        }
        return true;
    }

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

    public static WitnessCondition fromReader(ReadUtils reader) throws ProtocolException {
        return fromReader(reader, NeoConstants.MAX_NESTING_DEPTH);
    }

    /**
     * Reads a condition, rejecting nesting deeper than {@code maxDepth} and lists longer than the sub-item cap.
     */
    public static WitnessCondition fromReader(ReadUtils reader, int maxDepth) throws ProtocolException {
        WitnessConditionType type = WitnessConditionType.valueOf(reader.readByte());
        switch (type) {
            case BOOLEAN:
                return new BooleanCondition(reader.readBoolean());
            case NOT:
                checkReadDepth(type, maxDepth);
                return new NotCondition(fromReader(reader, maxDepth - 1));
            case AND:
                checkReadDepth(type, maxDepth);
                return new AndCondition(readConditions(reader, maxDepth - 1));
            case OR:
                checkReadDepth(type, maxDepth);
                return new OrCondition(readConditions(reader, maxDepth - 1));
            case SCRIPT_HASH:
                return new ScriptHashCondition(Hash160.fromReader(reader));
            case GROUP:
                return new GroupCondition(PublicKey.fromBytes(reader.readEncodedECPoint()));
            case CALLED_BY_ENTRY:
                return new CalledByEntryCondition();
            case CALLED_BY_CONTRACT:
                return new CalledByContractCondition(Hash160.fromReader(reader));
            case CALLED_BY_GROUP:
                return new CalledByGroupCondition(PublicKey.fromBytes(reader.readEncodedECPoint()));
            default:
                throw new ProtocolException("Unsupported witness condition type: " + type);
        }
    }

    private static void checkReadDepth(WitnessConditionType type, int maxDepth) {
        if (maxDepth <= 0) {
            throw new ProtocolException("Witness condition " + type.jsonValue() + " exceeds the maximum nesting depth");
        }
    }

    private static List<WitnessCondition> readConditions(ReadUtils reader, int maxDepth) {
        List<WitnessCondition> conditions = reader.readSerializableList(r -> fromReader(r, maxDepth),
                NeoConstants.MAX_SIGNER_SUBITEMS);
        if (conditions.isEmpty()) {
            throw new ProtocolException("Compound witness conditions need at least one sub-condition");
        }
        return conditions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(serialize(), ((WitnessCondition) o).serialize());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(serialize());
    }

    public static final class BooleanCondition extends WitnessCondition {
        private final boolean expression;

        public BooleanCondition(boolean expression) {
            this.expression = expression;
        }

        public boolean getExpression() {
            return expression;
        }

        @Override
        public WitnessConditionType getType() {
            return WitnessConditionType.BOOLEAN;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
            writer.writeBoolean(expression);
        }

        @Override
        public int getSize() {
            return super.getSize() + 1;
        }

        @Override
        public String toString() {
            return String.valueOf(expression);
        }
    }

    public static final class NotCondition extends WitnessCondition {
        private final WitnessCondition expression;

        public NotCondition(WitnessCondition expression) {
            this.expression = Objects.requireNonNull(expression);
        }

        public WitnessCondition getExpression() {
            return expression;
        }

        @Override
        public WitnessConditionType getType() {
            return WitnessConditionType.NOT;
        }

        @Override
        public List<WitnessCondition> getSubConditions() {
            return Collections.singletonList(expression);
        }

        @Override
        protected boolean isCompound() {
            return true;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
            expression.serialize(writer);
        }

        @Override
        public int getSize() {
            return super.getSize() + expression.getSize();
        }

        @Override
        public String toString() {
            return "Not(" + expression + ")";
        }
    }

    /** Base of {@code And} and {@code Or}. */
    abstract static class CompositeCondition extends WitnessCondition {
        private final List<WitnessCondition> expressions;

        CompositeCondition(List<WitnessCondition> expressions) {
            checkArgument(!expressions.isEmpty(), "%s conditions need at least one sub-condition",
                    getType().jsonValue());
            checkArgument(expressions.size() <= NeoConstants.MAX_SIGNER_SUBITEMS,
                    "%s conditions hold at most %s sub-conditions but got %s", getType().jsonValue(),
                    NeoConstants.MAX_SIGNER_SUBITEMS, expressions.size());
            this.expressions = Collections.unmodifiableList(new ArrayList<>(expressions));
        }

        public List<WitnessCondition> getExpressions() {
            return expressions;
        }

        @Override
        public List<WitnessCondition> getSubConditions() {
            return expressions;
        }

        @Override
        protected boolean isCompound() {
            return true;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
            writer.writeSerializableVariable(expressions);
        }

        @Override
        public int getSize() {
            return super.getSize() + NeoSerializable.getVarSize(expressions);
        }

        @Override
        public String toString() {
            return getType().jsonValue() + expressions;
        }
    }

    public static final class AndCondition extends CompositeCondition {
        public AndCondition(List<WitnessCondition> expressions) {
            super(expressions);
        }

        public AndCondition(WitnessCondition... expressions) {
            this(Arrays.asList(expressions));
        }

        @Override
        public WitnessConditionType getType() {
            return WitnessConditionType.AND;
        }
    }

    public static final class OrCondition extends CompositeCondition {
        public OrCondition(List<WitnessCondition> expressions) {
            super(expressions);
        }

        public OrCondition(WitnessCondition... expressions) {
            this(Arrays.asList(expressions));
        }

        @Override
        public WitnessConditionType getType() {
            return WitnessConditionType.OR;
        }
    }

    /** Base of the conditions that compare against a script hash. */
    abstract static class HashCondition extends WitnessCondition {
        private final Hash160 hash;

        HashCondition(Hash160 hash) {
            this.hash = Objects.requireNonNull(hash);
        }

        public Hash160 getScriptHash() {
            return hash;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
            hash.serialize(writer);
        }

        @Override
        public int getSize() {
            return super.getSize() + NeoConstants.HASH160_SIZE;
        }

        @Override
        public String toString() {
            return getType().jsonValue() + "(" + hash + ")";
        }
    }

    public static final class ScriptHashCondition extends HashCondition {
        public ScriptHashCondition(Hash160 hash) {
            super(hash);
        }

        @Override
        public WitnessConditionType getType() {
            return WitnessConditionType.SCRIPT_HASH;
        }
    }

    public static final class CalledByContractCondition extends HashCondition {
        public CalledByContractCondition(Hash160 hash) {
            super(hash);
        }

        @Override
        public WitnessConditionType getType() {
            return WitnessConditionType.CALLED_BY_CONTRACT;
        }
    }

    /** Base of the conditions that compare against a contract group key. */
    abstract static class GroupKeyCondition extends WitnessCondition {
        private final PublicKey group;

        GroupKeyCondition(PublicKey group) {
            this.group = Objects.requireNonNull(group);
        }

        public PublicKey getGroup() {
            return group;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
            writer.writeBytes(group.getEncoded());
        }

        @Override
        public int getSize() {
            return super.getSize() + NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED;
        }

        @Override
        public String toString() {
            return getType().jsonValue() + "(" + group.getPubKeyHex() + ")";
        }
    }

    public static final class GroupCondition extends GroupKeyCondition {
        public GroupCondition(PublicKey group) {
            super(group);
        }

        @Override
        public WitnessConditionType getType() {
            return WitnessConditionType.GROUP;
        }
    }

    public static final class CalledByGroupCondition extends GroupKeyCondition {
        public CalledByGroupCondition(PublicKey group) {
            super(group);
        }

        @Override
        public WitnessConditionType getType() {
            return WitnessConditionType.CALLED_BY_GROUP;
        }
    }

    public static final class CalledByEntryCondition extends WitnessCondition {
        @Override
        public WitnessConditionType getType() {
            return WitnessConditionType.CALLED_BY_ENTRY;
        }

        @Override
        protected void serializeWithoutType(WriteUtils writer) {
        }

        @Override
        public String toString() {
            return getType().jsonValue();
        }
    }
}
