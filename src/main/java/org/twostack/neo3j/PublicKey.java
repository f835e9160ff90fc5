
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
import org.twostack.neo3j.exception.ProtocolException;

import java.util.Arrays;

/**
 * A secp256r1 public key in the 33 byte compressed encoding used on the Neo wire.
 */
public class PublicKey implements Comparable<PublicKey> {

    private ECKey key;

    private PublicKey(ECKey key) {
        this.key = key;
    }

    public static PublicKey fromHex(String encoded) {
        byte[] pubkeyBytes = Utils.HEX.decode(encoded.toLowerCase());

        return fromBytes(pubkeyBytes);
    }

    public static PublicKey fromBytes(byte[] pubkeyBytes) {
        try {
            return new PublicKey(ECKey.fromPublicOnly(pubkeyBytes));
        } catch (IllegalArgumentException ex) {
            throw new ProtocolException("Invalid encoded public key: " + Utils.HEX.encode(pubkeyBytes), ex);
        }
    }

    /** The compressed 33 byte encoding. */
    public byte[] getEncoded() {
        return key.getPubKey();
    }

    public String getPubKeyHex() {
        return key.getPublicKeyAsHex();
    }

    public ECKey getKey() {
        return key;
    }

    /**
     * Verifies a 64 byte r||s signature over the SHA-256 hash of the given message.
     */
    public boolean verify(byte[] message, byte[] signature) {
        if (signature.length != NeoConstants.SIGNATURE_SIZE) {
            return false;
        }
        return key.verify(Sha256Hash.hash(message), ECKey.ECDSASignature.fromConcatenated(signature));
    }

    /**
     * Orders keys by their raw encoded bytes, compared as unsigned values. This is the order in which keys
     * appear in a multi-signature verification script.
     */
    @Override
    public int compareTo(PublicKey o) {
        return UnsignedBytes.lexicographicalComparator().compare(getEncoded(), o.getEncoded());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(getEncoded(), ((PublicKey) o).getEncoded());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(getEncoded());
    }

    @Override
    public String toString() {
        return getPubKeyHex();
    }
}
