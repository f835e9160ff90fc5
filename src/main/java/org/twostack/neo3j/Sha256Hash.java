
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

import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * SHA-256 helpers. Neo uses a single SHA-256 for transaction ids and interop service tags and a double
 * SHA-256 for base58 checksums and NEP-2 address hashes.
 */
public class Sha256Hash {

    public static final int LENGTH = 32;

    private Sha256Hash() {
    }

    public static byte[] hash(byte[] input) {
        return hash(input, 0, input.length);
    }

    public static byte[] hash(byte[] input, int offset, int length) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, offset, length);
        byte[] out = new byte[LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    /**
     * Calculates the SHA-256 hash of the given bytes, and then hashes the resulting hash again.
     */
    public static byte[] hashTwice(byte[] input) {
        return hash(hash(input));
    }

    public static byte[] hashTwice(byte[] input, int offset, int length) {
        return hash(hash(input, offset, length));
    }
}
