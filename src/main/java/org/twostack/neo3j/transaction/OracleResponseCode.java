
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

public enum OracleResponseCode {

    SUCCESS("Success", 0x00),
    PROTOCOL_NOT_SUPPORTED("ProtocolNotSupported", 0x10),
    CONSENSUS_UNREACHABLE("ConsensusUnreachable", 0x12),
    NOT_FOUND("NotFound", 0x14),
    TIMEOUT("Timeout", 0x16),
    FORBIDDEN("Forbidden", 0x18),
    RESPONSE_TOO_LARGE("ResponseTooLarge", 0x1A),
    INSUFFICIENT_FUNDS("InsufficientFunds", 0x1C),
    CONTENT_TYPE_NOT_SUPPORTED("ContentTypeNotSupported", 0x1F),
    ERROR("Error", 0xFF);

    private final String jsonValue;
    private final byte byteValue;

    OracleResponseCode(String jsonValue, int byteValue) {
        this.jsonValue = jsonValue;
        this.byteValue = (byte) byteValue;
    }

    public String jsonValue() {
        return jsonValue;
    }

    public byte byteValue() {
        return byteValue;
    }

    public static OracleResponseCode valueOf(byte byteValue) throws ProtocolException {
        for (OracleResponseCode code : values()) {
            if (code.byteValue == byteValue) {
                return code;
            }
        }
        throw new ProtocolException("Unknown oracle response code: 0x" + Integer.toHexString(byteValue & 0xFF));
    }
}
