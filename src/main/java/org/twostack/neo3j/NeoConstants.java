
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

/**
 * Protocol limits and sizes of the Neo N3 network.
 */
public class NeoConstants {

    private NeoConstants() {
    }

    // Accounts, addresses and keys

    /** Max number of public keys that can take part in a multi-signature address. */
    public static final int MAX_PUBLIC_KEYS_PER_MULTISIG_ACCOUNT = 1024;

    public static final int HASH160_SIZE = 20;
    public static final int HASH256_SIZE = 32;
    public static final int PRIVATE_KEY_SIZE = 32;
    public static final int PUBLIC_KEY_SIZE_COMPRESSED = 33;
    public static final int SIGNATURE_SIZE = 64;

    /** PUSHDATA1 + length byte + 33 key bytes + SYSCALL + 4 byte interop tag. */
    public static final int VERIFICATION_SCRIPT_SIZE = 40;

    public static final byte ADDRESS_VERSION = 0x35;

    // Transactions & Contracts

    /** The current version used for Neo transactions. */
    public static final byte CURRENT_TX_VERSION = 0;

    /** Maximum size in bytes of a serialized transaction. */
    public static final int MAX_TRANSACTION_SIZE = 102400;

    /** Maximum number of signers and attributes together that a transaction can carry. */
    public static final int MAX_TRANSACTION_ATTRIBUTES = 16;

    /** Maximum number of contracts, groups or rules a single signer may list. */
    public static final int MAX_SIGNER_SUBITEMS = 16;

    /** Maximum nesting depth of witness conditions. */
    public static final int MAX_NESTING_DEPTH = 2;

    /** Blocks a transaction stays valid for when the caller does not choose a limit. */
    public static final int MAX_VALID_UNTIL_BLOCK_INCREMENT = 5760;

    /** Maximum size of the result carried by an oracle response attribute. */
    public static final int MAX_ORACLE_RESULT_SIZE = 0xFFFF;

    public static final int MAX_ITERATOR_ITEMS_DEFAULT = 100;
}
