
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
package org.twostack.neo3j.script;

/**
 * Permissions a called contract is granted, pushed as an integer before {@code System.Contract.Call}.
 */
public enum CallFlags {

    NONE(0x00),
    READ_STATES(0x01),
    WRITE_STATES(0x02),
    ALLOW_CALL(0x04),
    ALLOW_NOTIFY(0x08),
    STATES(0x03),
    READ_ONLY(0x05),
    ALL(0x0F);

    private final int value;

    CallFlags(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static CallFlags fromValue(int value) {
        for (CallFlags flags : values()) {
            if (flags.value == value) {
                return flags;
            }
        }
        throw new IllegalArgumentException("No call flags with value " + value);
    }
}
