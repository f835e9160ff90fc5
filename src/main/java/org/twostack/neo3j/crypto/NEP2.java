
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
package org.twostack.neo3j.crypto;

import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.SCrypt;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twostack.neo3j.Address;
import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.PrivateKey;
import org.twostack.neo3j.Sha256Hash;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.address.Base58;
import org.twostack.neo3j.exception.AddressFormatException;
import org.twostack.neo3j.exception.InvalidKeyException;
import org.twostack.neo3j.exception.NEP2Exception;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Arrays;

/**
 * <p>Password protection of private keys as described in NEP-2.</p>
 *
 * <p>The encrypted key is the base58check encoding of 39 bytes: the prefix {@code 01 42 e0}, a four byte address
 * hash and two AES blocks. The address hash is the start of the double SHA-256 of the key's Neo address. It salts
 * the scrypt derivation and is the only check that the right password was used.</p>
 */
public class NEP2 {

    private static final Logger log = LoggerFactory.getLogger(NEP2.class);

    private static final byte NEP2_PREFIX_1 = (byte) 0x01;
    private static final byte NEP2_PREFIX_2 = (byte) 0x42;
    private static final byte NEP2_FLAGBYTE = (byte) 0xE0;

    private static final int DKLEN = 64;
    private static final int ADDRESS_HASH_SIZE = 4;
    private static final int HALF_SIZE = 32;
    private static final int AES_BLOCK_SIZE = 16;
    private static final int NEP2_ENCRYPTED_KEY_LENGTH = 3 + ADDRESS_HASH_SIZE + NeoConstants.PRIVATE_KEY_SIZE;

    private NEP2() {
    }

    public static String encrypt(String password, PrivateKey privateKey) {
        return encrypt(password, privateKey, ScryptParams.STANDARD);
    }

    /**
     * Encrypts the private key with the password.
     */
    public static String encrypt(String password, PrivateKey privateKey, ScryptParams scryptParams) {
        byte[] addressHash = getAddressHash(privateKey);
        byte[] derivedKey = deriveKey(password, addressHash, scryptParams);
        byte[] half1 = Arrays.copyOfRange(derivedKey, 0, HALF_SIZE);
        byte[] half2 = Arrays.copyOfRange(derivedKey, HALF_SIZE, DKLEN);

        byte[] encrypted = performCipher(Utils.xor(privateKey.getBytes(), half1), half2, true);

        byte[] buffer = new byte[NEP2_ENCRYPTED_KEY_LENGTH];
        buffer[0] = NEP2_PREFIX_1;
        buffer[1] = NEP2_PREFIX_2;
        buffer[2] = NEP2_FLAGBYTE;
        System.arraycopy(addressHash, 0, buffer, 3, ADDRESS_HASH_SIZE);
        System.arraycopy(encrypted, 0, buffer, 3 + ADDRESS_HASH_SIZE, encrypted.length);
        return Base58.encodeChecked(buffer);
    }

    public static PrivateKey decrypt(String password, String nep2) throws NEP2Exception {
        return decrypt(password, nep2, ScryptParams.STANDARD);
    }

    /**
     * Decrypts a NEP-2 encrypted key.
     *
     * @throws NEP2Exception.InvalidFormat     if the string is not a well formed NEP-2 key
     * @throws NEP2Exception.InvalidPassphrase if the recovered key does not match the address hash, which means the
     *                                         password is wrong
     */
    public static PrivateKey decrypt(String password, String nep2, ScryptParams scryptParams) throws NEP2Exception {
        byte[] nep2Data;
        try {
            nep2Data = Base58.decodeChecked(nep2);
        } catch (AddressFormatException ex) {
            throw new NEP2Exception.InvalidFormat("Encrypted key is not valid base58check", ex);
        }
        if (nep2Data.length != NEP2_ENCRYPTED_KEY_LENGTH) {
            throw new NEP2Exception.InvalidFormat("Encrypted key must be " + NEP2_ENCRYPTED_KEY_LENGTH
                    + " bytes long but was " + nep2Data.length);
        }
        if (nep2Data[0] != NEP2_PREFIX_1 || nep2Data[1] != NEP2_PREFIX_2 || nep2Data[2] != NEP2_FLAGBYTE) {
            throw new NEP2Exception.InvalidFormat("Encrypted key does not start with the NEP-2 prefix");
        }

        byte[] addressHash = Arrays.copyOfRange(nep2Data, 3, 3 + ADDRESS_HASH_SIZE);
        byte[] encrypted = Arrays.copyOfRange(nep2Data, 3 + ADDRESS_HASH_SIZE, NEP2_ENCRYPTED_KEY_LENGTH);

        byte[] derivedKey = deriveKey(password, addressHash, scryptParams);
        byte[] half1 = Arrays.copyOfRange(derivedKey, 0, HALF_SIZE);
        byte[] half2 = Arrays.copyOfRange(derivedKey, HALF_SIZE, DKLEN);

        byte[] keyBytes = Utils.xor(performCipher(encrypted, half2, false), half1);

        PrivateKey privateKey;
        try {
            privateKey = PrivateKey.fromBytes(keyBytes);
        } catch (InvalidKeyException | IllegalArgumentException ex) {
            throw new NEP2Exception.InvalidPassphrase("Calculated private key is out of range. Wrong password?");
        }
        if (!Arrays.equals(getAddressHash(privateKey), addressHash)) {
            log.debug("NEP-2 address hash mismatch on decryption");
            throw new NEP2Exception.InvalidPassphrase("Calculated address hash does not match the one in the "
                    + "encrypted key. Wrong password?");
        }
        return privateKey;
    }

    static byte[] getAddressHash(PrivateKey privateKey) {
        String address = Address.fromPublicKey(privateKey.getPublicKey());
        byte[] hash = Sha256Hash.hashTwice(address.getBytes(StandardCharsets.US_ASCII));
        return Arrays.copyOf(hash, ADDRESS_HASH_SIZE);
    }

    private static byte[] deriveKey(String password, byte[] salt, ScryptParams params) {
        String normalized = Normalizer.normalize(password, Normalizer.Form.NFC);
        return SCrypt.generate(normalized.getBytes(StandardCharsets.UTF_8), salt, params.getN(), params.getR(),
                params.getP(), DKLEN);
    }

    // AES-256 in ECB mode, one block at a time
    private static byte[] performCipher(byte[] data, byte[] key, boolean encrypt) {
        AESEngine engine = new AESEngine();
        engine.init(encrypt, new KeyParameter(key));
        byte[] out = new byte[data.length];
        for (int offset = 0; offset < data.length; offset += AES_BLOCK_SIZE) {
            engine.processBlock(data, offset, out, offset);
        }
        return out;
    }
}
