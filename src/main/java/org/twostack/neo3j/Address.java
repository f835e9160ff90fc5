
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

import org.twostack.neo3j.address.Base58;
import org.twostack.neo3j.exception.AddressFormatException;

import java.util.Arrays;

/**
 * <p>A Neo N3 address looks like NZNovmtDSmKX25jnfsDR2xYiB8eRjmL7Dc. It is the base58check encoding of the
 * version byte {@code 0x35} followed by the little-endian script hash of an account's verification script.</p>
 */
public class Address {

    private static final int ADDRESS_PAYLOAD_LENGTH = 1 + NeoConstants.HASH160_SIZE;

    private Address() {
    }

    public static String fromScriptHash(Hash160 scriptHash) {
        byte[] payload = new byte[ADDRESS_PAYLOAD_LENGTH];
        payload[0] = NeoConstants.ADDRESS_VERSION;
        System.arraycopy(scriptHash.toLittleEndianArray(), 0, payload, 1, NeoConstants.HASH160_SIZE);
        return Base58.encodeChecked(payload);
    }

    public static String fromPublicKey(PublicKey key) {
        return fromScriptHash(Hash160.fromPublicKey(key));
    }

    /**
     * Construct the script hash an address stands for.
     *
     * @throws AddressFormatException if the given string doesn't parse, the checksum is invalid or the version
     *                                byte is not the Neo N3 one
     */
    public static Hash160 toScriptHash(String address) throws AddressFormatException {
        byte[] payload = Base58.decodeChecked(address);
        if (payload.length != ADDRESS_PAYLOAD_LENGTH)
            throw new AddressFormatException.InvalidDataLength(
                    "Neo addresses carry 21 bytes, but got: " + payload.length);
        if (payload[0] != NeoConstants.ADDRESS_VERSION)
            throw new AddressFormatException.InvalidPrefix(
                    "Address version byte must be 0x35 but was " + (payload[0] & 0xFF));

        return new Hash160(Utils.reverseBytes(Arrays.copyOfRange(payload, 1, ADDRESS_PAYLOAD_LENGTH)));
    }

    public static boolean isValid(String address) {
        try {
            toScriptHash(address);
            return true;
        } catch (AddressFormatException ex) {
            return false;
        }
    }
}
