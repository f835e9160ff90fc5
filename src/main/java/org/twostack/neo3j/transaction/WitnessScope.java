
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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Scope flags of a signer's witness. The scope byte on the wire is the OR of the active flags.
 * {@link #GLOBAL} cannot be combined with any other flag.
 */
public enum WitnessScope {

    /** The witness is only used for paying fees. */
    NONE("None", 0x00),

    /** The witness is valid for the contract called by the entry script. */
    CALLED_BY_ENTRY("CalledByEntry", 0x01),

    /** The witness is valid for the listed contracts. */
    CUSTOM_CONTRACTS("CustomContracts", 0x10),

    /** The witness is valid for contracts in the listed groups. */
    CUSTOM_GROUPS("CustomGroups", 0x20),

    /** The witness is valid wherever the witness rules allow it. */
    WITNESS_RULES("WitnessRules", 0x40),

    /** The witness is valid everywhere. */
    GLOBAL("Global", 0x80);

    private final String jsonValue;
    private final byte byteValue;

    WitnessScope(String jsonValue, int byteValue) {
        this.jsonValue = jsonValue;
        this.byteValue = (byte) byteValue;
    }

    public String jsonValue() {
        return jsonValue;
    }

    public byte byteValue() {
        return byteValue;
    }

    public static WitnessScope fromJsonValue(String jsonValue) {
        for (WitnessScope scope : values()) {
            if (scope.jsonValue.equals(jsonValue)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown witness scope: " + jsonValue);
    }

    /** ORs the flags into a scope byte. */
    public static byte combineScopes(Collection<WitnessScope> scopes) {
        int combined = 0;
        for (WitnessScope scope : scopes) {
            combined |= scope.byteValue & 0xFF;
        }
        return (byte) combined;
    }

    /**
     * Splits a scope byte into its flags. A zero byte yields {@link #NONE}.
     *
     * @throws ProtocolException if the byte has unknown bits set, or combines {@link #GLOBAL} with other flags
     */
    public static List<WitnessScope> extractCombinedScopes(byte combinedScopes) throws ProtocolException {
        int value = combinedScopes & 0xFF;
        List<WitnessScope> scopes = new ArrayList<>();
        if (value == 0) {
            scopes.add(NONE);
            return scopes;
        }
        int known = 0;
        for (WitnessScope scope : values()) {
            int flag = scope.byteValue & 0xFF;
            if (flag != 0 && (value & flag) == flag) {
                scopes.add(scope);
                known |= flag;
            }
        }
        if (known != value) {
            throw new ProtocolException("Unknown witness scope bits: 0x" + Integer.toHexString(value & ~known));
        }
        if (scopes.contains(GLOBAL) && scopes.size() > 1) {
            throw new ProtocolException("The global witness scope cannot be combined with other scopes");
        }
        return scopes;
    }
}
