
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
package org.twostack.neo3j.io;

import org.twostack.neo3j.VarInt;

import java.util.List;

/**
 * Implemented by everything that has a binary form on the Neo wire. Decoding is done by a static
 * {@code fromReader(ReadUtils)} on each implementing class.
 */
public interface NeoSerializable {

    void serialize(WriteUtils writer);

    /** Size in bytes of the serialized form. */
    int getSize();

    /** The serialized form as a byte array. */
    default byte[] serialize() {
        WriteUtils writer = new WriteUtils();
        serialize(writer);
        return writer.getBytes();
    }

    /** Size of a var-int prefixed list of the given items. */
    static int getVarSize(List<? extends NeoSerializable> items) {
        int size = 0;
        for (NeoSerializable item : items) {
            size += item.getSize();
        }
        return VarInt.sizeOf(items.size()) + size;
    }

    /** Size of a var-int prefixed byte array. */
    static int getVarSize(byte[] bytes) {
        return VarInt.sizeOf(bytes.length) + bytes.length;
    }
}
