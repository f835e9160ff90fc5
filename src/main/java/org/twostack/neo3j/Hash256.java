
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
package org.twostack.neo3j;

import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A 32 byte hash such as a transaction id. Held big-endian, serialized little-endian.
 */
public class Hash256 implements NeoSerializable {

    public static final Hash256 ZERO = new Hash256(new byte[NeoConstants.HASH256_SIZE]);

    private final byte[] hash;

    public Hash256(byte[] hash) {
        checkArgument(hash.length == NeoConstants.HASH256_SIZE,
                "Hash must be %s bytes long but was %s bytes", NeoConstants.HASH256_SIZE, hash.length);
        this.hash = Arrays.copyOf(hash, hash.length);
    }

    public Hash256(String hash) {
        this(Utils.HEX.decode(Hash160.stripPrefix(hash).toLowerCase()));
    }

    public static Hash256 fromReader(ReadUtils reader) {
        return new Hash256(Utils.reverseBytes(reader.readBytes(NeoConstants.HASH256_SIZE)));
    }

    public byte[] toArray() {
        return Arrays.copyOf(hash, hash.length);
    }

    public byte[] toLittleEndianArray() {
        return Utils.reverseBytes(hash);
    }

    @Override
    public void serialize(WriteUtils writer) {
        writer.writeBytes(toLittleEndianArray());
    }

    @Override
    public int getSize() {
        return NeoConstants.HASH256_SIZE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(hash, ((Hash256) o).hash);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(hash);
    }

    @Override
    public String toString() {
        return Utils.HEX.encode(hash);
    }
}
