
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

import org.twostack.neo3j.exception.ProtocolException;

public enum TransactionAttributeType {

    HIGH_PRIORITY("HighPriority", 0x01),
    ORACLE_RESPONSE("OracleResponse", 0x11),
    NOT_VALID_BEFORE("NotValidBefore", 0x20),
    CONFLICTS("Conflicts", 0x21);

    private final String jsonValue;
    private final byte byteValue;

    TransactionAttributeType(String jsonValue, int byteValue) {
        this.jsonValue = jsonValue;
        this.byteValue = (byte) byteValue;
    }

    public String jsonValue() {
        return jsonValue;
    }

    public byte byteValue() {
        return byteValue;
    }

    public static TransactionAttributeType valueOf(byte byteValue) throws ProtocolException {
        for (TransactionAttributeType type : values()) {
            if (type.byteValue == byteValue) {
                return type;
            }
        }
        throw new ProtocolException("Unknown transaction attribute type: 0x" + Integer.toHexString(byteValue & 0xFF));
    }
}
