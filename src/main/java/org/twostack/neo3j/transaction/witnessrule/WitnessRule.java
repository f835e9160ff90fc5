
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

import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;

import java.util.Objects;

/**
 * Allows or denies the use of a witness wherever its condition holds.
 */
public class WitnessRule implements NeoSerializable {

    private final WitnessAction action;
    private final WitnessCondition condition;

    public WitnessRule(WitnessAction action, WitnessCondition condition) {
        this.action = Objects.requireNonNull(action);
        this.condition = Objects.requireNonNull(condition);
    }

    public static WitnessRule fromReader(ReadUtils reader) throws ProtocolException {
        WitnessAction action = WitnessAction.valueOf(reader.readByte());
        return new WitnessRule(action, WitnessCondition.fromReader(reader, NeoConstants.MAX_NESTING_DEPTH));
    }

    public WitnessAction getAction() {
        return action;
    }

    public WitnessCondition getCondition() {
        return condition;
    }

    @Override
    public void serialize(WriteUtils writer) {
        writer.writeByte(action.byteValue());
        condition.serialize(writer);
    }

    @Override
    public int getSize() {
        return 1 + condition.getSize();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WitnessRule that = (WitnessRule) o;
        return action == that.action && condition.equals(that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, condition);
    }

    @Override
    public String toString() {
        return action.jsonValue() + " " + condition;
    }
}
