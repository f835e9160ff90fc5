
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
package org.twostack.neo3j.script;

import org.twostack.neo3j.Sha256Hash;
import org.twostack.neo3j.Utils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * System calls of the NeoVM. A SYSCALL instruction is followed by a four byte tag: the first four bytes of the
 * SHA-256 hash of the ASCII service name.
 */
public enum InteropService {

    SYSTEM_CRYPTO_CHECKSIG("System.Crypto.CheckSig"),
    SYSTEM_CRYPTO_CHECKMULTISIG("System.Crypto.CheckMultisig"),

    SYSTEM_CONTRACT_CALL("System.Contract.Call"),
    SYSTEM_CONTRACT_CALLNATIVE("System.Contract.CallNative"),
    SYSTEM_CONTRACT_GETCALLFLAGS("System.Contract.GetCallFlags"),
    SYSTEM_CONTRACT_CREATESTANDARDACCOUNT("System.Contract.CreateStandardAccount"),
    SYSTEM_CONTRACT_CREATEMULTISIGACCOUNT("System.Contract.CreateMultisigAccount"),
    SYSTEM_CONTRACT_NATIVEONPERSIST("System.Contract.NativeOnPersist"),
    SYSTEM_CONTRACT_NATIVEPOSTPERSIST("System.Contract.NativePostPersist"),

    SYSTEM_ITERATOR_NEXT("System.Iterator.Next"),
    SYSTEM_ITERATOR_VALUE("System.Iterator.Value"),

    SYSTEM_RUNTIME_PLATFORM("System.Runtime.Platform"),
    SYSTEM_RUNTIME_GETTRIGGER("System.Runtime.GetTrigger"),
    SYSTEM_RUNTIME_GETTIME("System.Runtime.GetTime"),
    SYSTEM_RUNTIME_GETSCRIPTCONTAINER("System.Runtime.GetScriptContainer"),
    SYSTEM_RUNTIME_GETEXECUTINGSCRIPTHASH("System.Runtime.GetExecutingScriptHash"),
    SYSTEM_RUNTIME_GETCALLINGSCRIPTHASH("System.Runtime.GetCallingScriptHash"),
    SYSTEM_RUNTIME_GETENTRYSCRIPTHASH("System.Runtime.GetEntryScriptHash"),
    SYSTEM_RUNTIME_CHECKWITNESS("System.Runtime.CheckWitness"),
    SYSTEM_RUNTIME_GETINVOCATIONCOUNTER("System.Runtime.GetInvocationCounter"),
    SYSTEM_RUNTIME_LOG("System.Runtime.Log"),
    SYSTEM_RUNTIME_NOTIFY("System.Runtime.Notify"),
    SYSTEM_RUNTIME_GETNOTIFICATIONS("System.Runtime.GetNotifications"),
    SYSTEM_RUNTIME_GASLEFT("System.Runtime.GasLeft"),
    SYSTEM_RUNTIME_BURNGAS("System.Runtime.BurnGas"),
    SYSTEM_RUNTIME_GETNETWORK("System.Runtime.GetNetwork"),
    SYSTEM_RUNTIME_GETRANDOM("System.Runtime.GetRandom"),

    SYSTEM_STORAGE_GETCONTEXT("System.Storage.GetContext"),
    SYSTEM_STORAGE_GETREADONLYCONTEXT("System.Storage.GetReadOnlyContext"),
    SYSTEM_STORAGE_ASREADONLY("System.Storage.AsReadOnly"),
    SYSTEM_STORAGE_GET("System.Storage.Get"),
    SYSTEM_STORAGE_FIND("System.Storage.Find"),
    SYSTEM_STORAGE_PUT("System.Storage.Put"),
    SYSTEM_STORAGE_DELETE("System.Storage.Delete");

    public static final int HASH_SIZE = 4;

    private final String name;
    private final byte[] hash;

    InteropService(String name) {
        this.name = name;
        this.hash = Arrays.copyOf(Sha256Hash.hash(name.getBytes(StandardCharsets.US_ASCII)), HASH_SIZE);
    }

    public String getName() {
        return name;
    }

    /** The four byte tag that follows SYSCALL. */
    public byte[] getHash() {
        return Arrays.copyOf(hash, HASH_SIZE);
    }

    public String getHashHex() {
        return Utils.HEX.encode(hash);
    }

    /**
     * Looks up a service by its four byte tag, or returns null if none matches.
     */
    public static InteropService fromHash(byte[] hash) {
        for (InteropService service : values()) {
            if (Arrays.equals(service.hash, hash)) {
                return service;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
