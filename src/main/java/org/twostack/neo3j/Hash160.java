
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

import com.google.common.primitives.UnsignedBytes;
import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;
import org.twostack.neo3j.script.ScriptBuilder;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A 20 byte script hash, the identity of accounts and contracts.
 *
 * <p>The hash is held in big-endian order, the order in which it is displayed. On the wire and inside scripts
 * it appears little-endian, see {@link #toLittleEndianArray()}.</p>
 */
public class Hash160 implements NeoSerializable, Comparable<Hash160> {

    public static final Hash160 ZERO = new Hash160(new byte[NeoConstants.HASH160_SIZE]);

    private final byte[] hash;

    /**
     * @param hash big-endian hash bytes
     */
    public Hash160(byte[] hash) {
        checkArgument(hash.length == NeoConstants.HASH160_SIZE,
                "Hash must be %s bytes long but was %s bytes", NeoConstants.HASH160_SIZE, hash.length);
        this.hash = Arrays.copyOf(hash, hash.length);
    }

    /**
     * @param hash big-endian hexadecimal string
     */
    public Hash160(String hash) {
        this(Utils.HEX.decode(stripPrefix(hash).toLowerCase()));
    }

    public static Hash160 fromReader(ReadUtils reader) {
        return new Hash160(Utils.reverseBytes(reader.readBytes(NeoConstants.HASH160_SIZE)));
    }

    /**
     * Hashes the given script. The resulting RIPEMD160(SHA256(script)) is little-endian and gets reversed.
     */
    public static Hash160 fromScript(byte[] script) {
        return new Hash160(Utils.reverseBytes(Utils.sha256hash160(script)));
    }

    public static Hash160 fromPublicKey(PublicKey publicKey) {
        return fromScript(ScriptBuilder.buildVerificationScript(publicKey.getEncoded()));
    }

    public static Hash160 fromAddress(String address) {
        return Address.toScriptHash(address);
    }

    /**
     * Calculates the hash of a contract deployed by {@code sender} from a NEF file with the given checksum.
     */
    public static Hash160 fromContract(Hash160 sender, long nefChecksum, String contractName) {
        return fromScript(ScriptBuilder.buildContractHashScript(sender, nefChecksum, contractName));
    }

    public byte[] toArray() {
        return Arrays.copyOf(hash, hash.length);
    }

    public byte[] toLittleEndianArray() {
        return Utils.reverseBytes(hash);
    }

    public String toAddress() {
        return Address.fromScriptHash(this);
    }

    @Override
    public void serialize(WriteUtils writer) {
        writer.writeBytes(toLittleEndianArray());
    }

    @Override
    public int getSize() {
        return NeoConstants.HASH160_SIZE;
    }

    @Override
    public int compareTo(Hash160 o) {
        return UnsignedBytes.lexicographicalComparator().compare(hash, o.hash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(hash, ((Hash160) o).hash);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(hash);
    }

    @Override
    public String toString() {
        return Utils.HEX.encode(hash);
    }

    static String stripPrefix(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }
}
