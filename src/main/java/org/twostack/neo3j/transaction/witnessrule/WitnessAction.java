
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

public enum WitnessAction {

    DENY("Deny", 0),
    ALLOW("Allow", 1);

    private final String jsonValue;
    private final byte byteValue;

    WitnessAction(String jsonValue, int byteValue) {
        this.jsonValue = jsonValue;
        this.byteValue = (byte) byteValue;
    }

    public String jsonValue() {
        return jsonValue;
    }

    public byte byteValue() {
        return byteValue;
    }

    public static WitnessAction valueOf(byte byteValue) throws ProtocolException {
        for (WitnessAction action : values()) {
            if (action.byteValue == byteValue) {
                return action;
            }
        }
        throw new ProtocolException("Unknown witness action: " + byteValue);
    }
}
