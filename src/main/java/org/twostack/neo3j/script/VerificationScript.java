
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

import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.exception.ScriptException;
import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <p>The verification half of a witness. For accounts this is either a single key script
 * ({@code PUSHDATA1 33 <key> SYSCALL CheckSig}) or an m-of-n multi-sig script
 * ({@code PUSH m, PUSHDATA1 33 <key> ..., PUSH n, SYSCALL CheckMultisig}).</p>
 *
 * <p>The hash of the script is the script hash of the account it belongs to.</p>
 */
public class VerificationScript implements NeoSerializable {

    private final byte[] script;

    /** An empty script, as used by contract witnesses. */
    public VerificationScript() {
        this.script = new byte[0];
    }

    public VerificationScript(byte[] script) {
        this.script = Arrays.copyOf(script, script.length);
    }

    public static VerificationScript fromPublicKey(PublicKey publicKey) {
        return new VerificationScript(ScriptBuilder.buildVerificationScript(publicKey.getEncoded()));
    }

    public static VerificationScript fromMultiSig(List<PublicKey> publicKeys, int signingThreshold) {
        return new VerificationScript(ScriptBuilder.buildMultiSigScript(publicKeys, signingThreshold));
    }

    public static VerificationScript fromReader(ReadUtils reader) throws ProtocolException {
        return new VerificationScript(reader.readVarBytes(NeoConstants.MAX_TRANSACTION_SIZE));
    }

    public byte[] getScript() {
        return Arrays.copyOf(script, script.length);
    }

    public boolean isEmpty() {
        return script.length == 0;
    }

    public Hash160 getScriptHash() {
        return Hash160.fromScript(script);
    }

    /**
     * Checks for the exact shape of a single key script, 40 bytes long, holding a key that is on the curve.
     */
    public boolean isSingleSigScript() {
        if (script.length != NeoConstants.VERIFICATION_SCRIPT_SIZE) {
            return false;
        }
        byte[] interopHash = Arrays.copyOfRange(script, 36, 40);
        return script[0] == OpCode.PUSHDATA1.byteValue()
                && script[1] == NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED
                && script[35] == OpCode.SYSCALL.byteValue()
                && Arrays.equals(interopHash, InteropService.SYSTEM_CRYPTO_CHECKSIG.getHash())
                && isValidKey(Arrays.copyOfRange(script, 2, 35));
    }

    /**
     * <p>Checks whether this is an m-of-n multi-sig script. The threshold is read first, then keys are consumed for
     * as long as 33 byte pushes follow. The key count that comes next must match the number of keys read and be at
     * least the threshold, and the script must end with the CheckMultisig syscall.</p>
     *
     * <p>Truncated or otherwise malformed scripts are never multi-sig scripts. That includes keys that are not
     * points on the curve and counts that do not fit in an int.</p>
     */
    public boolean isMultiSigScript() {
        if (script.length < 42) {
            return false;
        }
        ReadUtils reader = new ReadUtils(script);
        try {
            int threshold = readCount(reader);
            if (threshold < 1 || threshold > NeoConstants.MAX_PUBLIC_KEYS_PER_MULTISIG_ACCOUNT) {
                return false;
            }
            int keyCount = 0;
            while (true) {
                reader.mark();
                if (reader.readUnsignedByte() != OpCode.PUSHDATA1.getCode()) {
                    reader.reset();
                    break;
                }
                if (reader.readUnsignedByte() != NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED) {
                    return false;
                }
                PublicKey.fromBytes(reader.readEncodedECPoint());
                keyCount++;
            }
            if (keyCount < threshold || keyCount > NeoConstants.MAX_PUBLIC_KEYS_PER_MULTISIG_ACCOUNT) {
                return false;
            }
            if (readCount(reader) != keyCount) {
                return false;
            }
            if (reader.readUnsignedByte() != OpCode.SYSCALL.getCode()) {
                return false;
            }
            byte[] interopHash = reader.readBytes(InteropService.HASH_SIZE);
            return Arrays.equals(interopHash, InteropService.SYSTEM_CRYPTO_CHECKMULTISIG.getHash())
                    && !reader.hasMoreBytes();
        } catch (ProtocolException ex) {
            return false;
        }
    }

    /**
     * @return 1 for a single key script, m for an m-of-n multi-sig script
     * @throws ScriptException if this is neither
     */
    public int getSigningThreshold() {
        if (isSingleSigScript()) {
            return 1;
        } else if (isMultiSigScript()) {
            return readCount(new ReadUtils(script));
        }
        throw new ScriptException("This verification script is neither a single key nor a multi-sig script");
    }

    /**
     * @return the number of keys taking part in this script
     * @throws ScriptException if this is neither a single key nor a multi-sig script
     */
    public int getNrOfAccounts() {
        return getPublicKeys().size();
    }

    /**
     * @return the keys of this script, in script order
     * @throws ScriptException if this is neither a single key nor a multi-sig script
     */
    public List<PublicKey> getPublicKeys() {
        if (isSingleSigScript()) {
            return Collections.singletonList(PublicKey.fromBytes(Arrays.copyOfRange(script, 2, 35)));
        } else if (isMultiSigScript()) {
            ReadUtils reader = new ReadUtils(script);
            reader.readPushInteger();
            List<PublicKey> keys = new ArrayList<>();
            while (true) {
                reader.mark();
                if (reader.readUnsignedByte() != OpCode.PUSHDATA1.getCode()) {
                    break;
                }
                reader.reset();
                keys.add(PublicKey.fromBytes(reader.readPushData()));
            }
            return keys;
        }
        throw new ScriptException("This verification script is neither a single key nor a multi-sig script");
    }

    // threshold and key count are small positive numbers; anything wider is malformed
    private static int readCount(ReadUtils reader) throws ProtocolException {
        BigInteger count = reader.readPushInteger();
        if (count.signum() < 0 || count.bitLength() > 31) {
            throw new ProtocolException("Count out of range: " + count);
        }
        return count.intValue();
    }

    private static boolean isValidKey(byte[] encoded) {
        try {
            PublicKey.fromBytes(encoded);
            return true;
        } catch (ProtocolException ex) {
            return false;
        }
    }

    @Override
    public void serialize(WriteUtils writer) {
        writer.writeVarBytes(script);
    }

    @Override
    public int getSize() {
        return NeoSerializable.getVarSize(script);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(script, ((VerificationScript) o).script);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(script);
    }

    @Override
    public String toString() {
        return Utils.HEX.encode(script);
    }
}
