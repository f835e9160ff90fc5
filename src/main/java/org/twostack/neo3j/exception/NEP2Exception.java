
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
package org.twostack.neo3j.exception;

/**
 * Failures while decrypting a NEP-2 key. The two subclasses let callers tell corrupt input
 * apart from a wrong password.
 */
public class NEP2Exception extends Exception {

    public NEP2Exception(String message) {
        super(message);
    }

    public NEP2Exception(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The string is not a well-formed NEP-2 key (bad base58, checksum, length or prefix).
     */
    public static class InvalidFormat extends NEP2Exception {
        public InvalidFormat(String message) {
            super(message);
        }

        public InvalidFormat(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The key decrypted, but the address hash of the recovered key does not match the one stored in the
     * NEP-2 string.
     */
    public static class InvalidPassphrase extends NEP2Exception {
        public InvalidPassphrase(String message) {
            super(message);
        }
    }
}
