
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
import org.twostack.neo3j.exception.InvalidKeyException;
import org.twostack.neo3j.io.ReadUtils;

public class PrivateKey {

    private static final byte WIF_VERSION = (byte) 0x80;
    private static final byte WIF_COMPRESSED_FLAG = 0x01;

    ECKey key;

    public PrivateKey(ECKey key) {
        this.key = key;
    }

    public static PrivateKey createNew() {
        return new PrivateKey(ECKey.createNew());
    }

    public static PrivateKey fromBytes(byte[] privateKeyBytes) throws InvalidKeyException {
        if (privateKeyBytes.length != NeoConstants.PRIVATE_KEY_SIZE) {
            throw new InvalidKeyException("Private keys are " + NeoConstants.PRIVATE_KEY_SIZE
                    + " bytes in length. Yours is [" + privateKeyBytes.length + "]");
        }
        return new PrivateKey(ECKey.fromPrivate(privateKeyBytes));
    }

    /**
     * Signs the SHA-256 hash of the given message and returns the 64 byte r||s signature.
     */
    public byte[] sign(byte[] message) {
        ECKey.ECDSASignature sig = this.key.sign(Sha256Hash.hash(message));
        return sig.encodeToConcatenated();
    }

    public static PrivateKey fromWIF(String wif) throws InvalidKeyException {

        if (wif.length() != 52) {
            throw new InvalidKeyException("Valid WIF keys are 52 characters in length");
        }

        byte[] versionAndDataBytes;
        try {
            versionAndDataBytes = Base58.decodeChecked(wif);
        } catch (AddressFormatException ex) {
            throw new InvalidKeyException("WIF key is not valid base58check", ex);
        }

        if (versionAndDataBytes.length != 34) {
            throw new InvalidKeyException("WIF keys must decode to 34 bytes");
        }

        ReadUtils reader = new ReadUtils(versionAndDataBytes);
        byte version = reader.readByte();
        if (version != WIF_VERSION) {
            throw new InvalidKeyException("WIF keys must start with version byte 0x80. Yours is [" + version + "]");
        }

        byte[] keyBytes = reader.readBytes(NeoConstants.PRIVATE_KEY_SIZE);

        //compressed keys only
        byte flag = reader.readByte();
        if (flag != WIF_COMPRESSED_FLAG) {
            throw new InvalidKeyException("Compressed keys must have last byte set as 0x01. Yours is [" + flag + "]");
        }

        return fromBytes(keyBytes);
    }

    public String toWIF() {
        byte[] payload = new byte[34];
        payload[0] = WIF_VERSION;
        System.arraycopy(key.getPrivKeyBytes(), 0, payload, 1, NeoConstants.PRIVATE_KEY_SIZE);
        payload[33] = WIF_COMPRESSED_FLAG;
        return Base58.encodeChecked(payload);
    }

    public byte[] getBytes() {
        return key.getPrivKeyBytes();
    }

    public ECKey getKey() {
        return key;
    }

    public PublicKey getPublicKey() {
        return PublicKey.fromBytes(key.getPubKey());
    }
}
