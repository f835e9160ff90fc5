
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
package org.twostack.neo3j.types;

/**
 * Types of contract parameters, with the byte value used in contract manifests and the name used in JSON.
 */
public enum ContractParameterType {

    ANY("Any", 0x00),
    BOOLEAN("Boolean", 0x10),
    INTEGER("Integer", 0x11),
    BYTE_ARRAY("ByteArray", 0x12),
    STRING("String", 0x13),
    HASH160("Hash160", 0x14),
    HASH256("Hash256", 0x15),
    PUBLIC_KEY("PublicKey", 0x16),
    SIGNATURE("Signature", 0x17),
    ARRAY("Array", 0x20),
    MAP("Map", 0x22),
    INTEROP_INTERFACE("InteropInterface", 0x30),
    VOID("Void", 0xFF);

    private final String jsonValue;
    private final int byteValue;

    ContractParameterType(String jsonValue, int byteValue) {
        this.jsonValue = jsonValue;
        this.byteValue = byteValue;
    }

    public String jsonValue() {
        return jsonValue;
    }

    public byte byteValue() {
        return (byte) byteValue;
    }

    public static ContractParameterType fromJsonValue(String jsonValue) {
        for (ContractParameterType type : values()) {
            if (type.jsonValue.equals(jsonValue)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown contract parameter type: " + jsonValue);
    }

    public static ContractParameterType valueOf(byte byteValue) {
        for (ContractParameterType type : values()) {
            if (type.byteValue() == byteValue) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown contract parameter type byte: " + byteValue);
    }
}
