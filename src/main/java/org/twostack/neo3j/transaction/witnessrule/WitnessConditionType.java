
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

import org.twostack.neo3j.exception.ProtocolException;

public enum WitnessConditionType {

    BOOLEAN("Boolean", 0x00),
    NOT("Not", 0x01),
    AND("And", 0x02),
    OR("Or", 0x03),
    SCRIPT_HASH("ScriptHash", 0x18),
    GROUP("Group", 0x19),
    CALLED_BY_ENTRY("CalledByEntry", 0x20),
    CALLED_BY_CONTRACT("CalledByContract", 0x28),
    CALLED_BY_GROUP("CalledByGroup", 0x29);

    private final String jsonValue;
    private final byte byteValue;

    WitnessConditionType(String jsonValue, int byteValue) {
        this.jsonValue = jsonValue;
        this.byteValue = (byte) byteValue;
    }

    public String jsonValue() {
        return jsonValue;
    }

    public byte byteValue() {
        return byteValue;
    }

    public static WitnessConditionType valueOf(byte byteValue) throws ProtocolException {
        for (WitnessConditionType type : values()) {
            if (type.byteValue == byteValue) {
                return type;
            }
        }
        throw new ProtocolException("Unknown witness condition type: 0x" + Integer.toHexString(byteValue & 0xFF));
    }
}
