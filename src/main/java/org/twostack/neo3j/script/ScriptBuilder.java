
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
import org.twostack.neo3j.exception.ScriptException;
import org.twostack.neo3j.io.WriteUtils;
import org.twostack.neo3j.types.ContractParameter;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>Tools for the construction of NeoVM scripts: contract calls, literal pushes and verification scripts.</p>
 *
 * <p>The builder appends bytecode to an internal buffer. Every method returns the builder so calls can be chained,
 * e.g. {@code new ScriptBuilder().pushInteger(1).opCode(OpCode.RET).toArray()}.</p>
 */
public class ScriptBuilder {

    private static final BigInteger MIN_SINGLE_OPCODE_INT = BigInteger.valueOf(-1);
    private static final BigInteger MAX_SINGLE_OPCODE_INT = BigInteger.valueOf(16);

    private final WriteUtils writer;

    /** Creates a fresh ScriptBuilder with an empty program. */
    public ScriptBuilder() {
        writer = new WriteUtils();
    }

    /** Appends the given opcodes to the end of the program. */
    public ScriptBuilder opCode(OpCode... opCodes) {
        for (OpCode opCode : opCodes) {
            writer.writeByte(opCode.getCode());
        }
        return this;
    }

    /** Appends an opcode followed by its raw operand. */
    public ScriptBuilder opCode(OpCode opCode, byte[] argument) {
        writer.writeByte(opCode.getCode());
        writer.writeBytes(argument);
        return this;
    }

    /** Appends a SYSCALL to the given interop service. */
    public ScriptBuilder sysCall(InteropService operation) {
        return opCode(OpCode.SYSCALL, operation.getHash());
    }

    public ScriptBuilder contractCall(Hash160 scriptHash, String method, List<ContractParameter> params) {
        return contractCall(scriptHash, method, params, CallFlags.ALL);
    }

    /**
     * Appends a call to a contract method. The parameters are packed into an array, followed by the call flags,
     * the method name and the little-endian contract hash, and finally a SYSCALL to
     * {@code System.Contract.Call}.
     */
    public ScriptBuilder contractCall(Hash160 scriptHash, String method, @Nullable List<ContractParameter> params,
                                      CallFlags callFlags) {
        checkArgument(method != null && !method.isEmpty(), "The method name must not be empty");
        if (params == null || params.isEmpty()) {
            opCode(OpCode.NEWARRAY0);
        } else {
            pushParams(params);
        }
        return pushInteger(callFlags.getValue())
                .pushData(method)
                .pushData(scriptHash.toLittleEndianArray())
                .sysCall(InteropService.SYSTEM_CONTRACT_CALL);
    }

    /**
     * Pushes the parameters as one packed array. Items are pushed last to first, since PACK takes the topmost
     * stack item as the first array element. The packed array holds the parameters in the order given, so
     * {@code params.get(0)} ends up at index 0.
     */
    public ScriptBuilder pushParams(List<ContractParameter> params) {
        ListIterator<ContractParameter> it = params.listIterator(params.size());
        while (it.hasPrevious()) {
            pushParam(it.previous());
        }
        return pushInteger(params.size()).opCode(OpCode.PACK);
    }

    public ScriptBuilder pushParams(ContractParameter... params) {
        return pushParams(Arrays.asList(params));
    }

    /** Pushes a single parameter. A null parameter pushes null. */
    public ScriptBuilder pushParam(@Nullable ContractParameter param) {
        if (param == null) {
            return opCode(OpCode.PUSHNULL);
        }
        param.accept(new ParamPusher());
        return this;
    }

    public ScriptBuilder pushInteger(int v) {
        return pushInteger(BigInteger.valueOf(v));
    }

    public ScriptBuilder pushInteger(long v) {
        return pushInteger(BigInteger.valueOf(v));
    }

    /**
     * <p>Pushes an integer. Values from -1 to 16 have their own opcode; any other value is written as a
     * little-endian two's complement number in the smallest of 1, 2, 4, 8, 16 or 32 bytes that holds it.</p>
     *
     * @throws ScriptException if the value needs more than 32 bytes
     */
    public ScriptBuilder pushInteger(BigInteger v) {
        if (v.compareTo(MIN_SINGLE_OPCODE_INT) >= 0 && v.compareTo(MAX_SINGLE_OPCODE_INT) <= 0) {
            return opCode(OpCode.get(OpCode.PUSH0.getCode() + v.intValue()));
        }
        byte[] bytes = Utils.reverseBytes(v.toByteArray());
        if (bytes.length == 1) {
            return opCode(OpCode.PUSHINT8, bytes);
        } else if (bytes.length == 2) {
            return opCode(OpCode.PUSHINT16, bytes);
        } else if (bytes.length <= 4) {
            return opCode(OpCode.PUSHINT32, padNumber(v, bytes, 4));
        } else if (bytes.length <= 8) {
            return opCode(OpCode.PUSHINT64, padNumber(v, bytes, 8));
        } else if (bytes.length <= 16) {
            return opCode(OpCode.PUSHINT128, padNumber(v, bytes, 16));
        } else if (bytes.length <= 32) {
            return opCode(OpCode.PUSHINT256, padNumber(v, bytes, 32));
        }
        throw new ScriptException("The number " + v + " is out of range for the VM's integer push opcodes");
    }

    // sign extension of a little-endian value
    private static byte[] padNumber(BigInteger v, byte[] littleEndian, int length) {
        byte[] padded = new byte[length];
        if (v.signum() < 0) {
            Arrays.fill(padded, (byte) 0xFF);
        }
        System.arraycopy(littleEndian, 0, padded, 0, littleEndian.length);
        return padded;
    }

    public ScriptBuilder pushBoolean(boolean bool) {
        return opCode(bool ? OpCode.PUSHT : OpCode.PUSHF);
    }

    /** Pushes the UTF-8 encoding of the given string. */
    public ScriptBuilder pushData(String data) {
        return pushData(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Pushes raw data with the shortest PUSHDATA form: a one byte length below 256, a two byte length below
     * 65536, and a four byte length otherwise.
     */
    public ScriptBuilder pushData(byte[] data) {
        if (data.length < 256) {
            writer.writeByte(OpCode.PUSHDATA1.getCode());
            writer.writeByte(data.length);
        } else if (data.length < 65536) {
            writer.writeByte(OpCode.PUSHDATA2.getCode());
            writer.writeUint16LE(data.length);
        } else {
            writer.writeByte(OpCode.PUSHDATA4.getCode());
            writer.writeUint32LE(data.length);
        }
        writer.writeBytes(data);
        return this;
    }

    /** Pushes the items as an array, or an empty array if there are none. */
    public ScriptBuilder pushArray(@Nullable List<ContractParameter> items) {
        if (items == null || items.isEmpty()) {
            return opCode(OpCode.NEWARRAY0);
        }
        return pushParams(items);
    }

    /**
     * Pushes a map. Entries are pushed last to first, value before key, followed by the entry count and PACKMAP.
     */
    public ScriptBuilder pushMap(Map<ContractParameter, ContractParameter> map) {
        List<Map.Entry<ContractParameter, ContractParameter>> entries = new ArrayList<>(map.entrySet());
        Collections.reverse(entries);
        for (Map.Entry<ContractParameter, ContractParameter> entry : entries) {
            pushParam(entry.getValue());
            pushParam(entry.getKey());
        }
        return pushInteger(map.size()).opCode(OpCode.PACKMAP);
    }

    public ScriptBuilder pack() {
        return opCode(OpCode.PACK);
    }

    /** The bytes written so far. */
    public byte[] toArray() {
        return writer.getBytes();
    }

    public int length() {
        return writer.size();
    }

    /**
     * Builds the verification script of a single key account: push the key, then call
     * {@code System.Crypto.CheckSig}.
     *
     * @param encodedPublicKey the 33 byte compressed public key
     */
    public static byte[] buildVerificationScript(byte[] encodedPublicKey) {
        checkArgument(encodedPublicKey.length == NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED,
                "Public key must be %s bytes but was %s", NeoConstants.PUBLIC_KEY_SIZE_COMPRESSED,
                encodedPublicKey.length);
        return new ScriptBuilder()
                .pushData(encodedPublicKey)
                .sysCall(InteropService.SYSTEM_CRYPTO_CHECKSIG)
                .toArray();
    }

    /**
     * Builds an m-of-n verification script. The keys are sorted by their encoded bytes first, so the same key set
     * always yields the same script, whatever order it is given in.
     */
    public static byte[] buildMultiSigScript(List<PublicKey> pubKeys, int signingThreshold) {
        checkArgument(!pubKeys.isEmpty(), "At least one public key is required for a multi-sig script");
        checkArgument(pubKeys.size() <= NeoConstants.MAX_PUBLIC_KEYS_PER_MULTISIG_ACCOUNT,
                "At most %s public keys can take part in a multi-sig account",
                NeoConstants.MAX_PUBLIC_KEYS_PER_MULTISIG_ACCOUNT);
        checkArgument(signingThreshold >= 1 && signingThreshold <= pubKeys.size(),
                "Signing threshold must be between 1 and %s but was %s", pubKeys.size(), signingThreshold);

        List<PublicKey> sorted = new ArrayList<>(pubKeys);
        Collections.sort(sorted);

        ScriptBuilder builder = new ScriptBuilder().pushInteger(signingThreshold);
        for (PublicKey key : sorted) {
            builder.pushData(key.getEncoded());
        }
        return builder.pushInteger(sorted.size())
                .sysCall(InteropService.SYSTEM_CRYPTO_CHECKMULTISIG)
                .toArray();
    }

    /**
     * Builds the script whose hash is the hash of a contract deployed by {@code sender}.
     */
    public static byte[] buildContractHashScript(Hash160 sender, long nefCheckSum, String contractName) {
        return new ScriptBuilder()
                .opCode(OpCode.ABORT)
                .pushData(sender.toLittleEndianArray())
                .pushInteger(nefCheckSum)
                .pushData(contractName)
                .toArray();
    }

    public static byte[] buildContractCallAndUnwrapIterator(Hash160 contractHash, String method,
                                                            List<ContractParameter> params) {
        return buildContractCallAndUnwrapIterator(contractHash, method, params,
                NeoConstants.MAX_ITERATOR_ITEMS_DEFAULT, CallFlags.ALL);
    }

    /**
     * <p>Builds a script that calls a method returning an iterator and collects up to
     * {@code maxIteratorResultItems} of its values into an array, which is left on the stack.</p>
     *
     * <p>The loop uses short relative jumps. Their targets are only known once the loop body is written, so the
     * forward jumps are emitted with a zero offset and patched afterwards.</p>
     */
    public static byte[] buildContractCallAndUnwrapIterator(Hash160 contractHash, String method,
                                                            List<ContractParameter> params,
                                                            int maxIteratorResultItems, CallFlags callFlags) {
        checkArgument(maxIteratorResultItems > 0, "The maximum number of iterator items must be positive");

        ScriptBuilder b = new ScriptBuilder();
        b.pushInteger(maxIteratorResultItems);
        b.contractCall(contractHash, method, params, callFlags);
        b.opCode(OpCode.NEWARRAY0);

        int cycleStart = b.length();
        b.opCode(OpCode.OVER);
        b.sysCall(InteropService.SYSTEM_ITERATOR_NEXT);

        int jmpIfNotPosition = b.length();
        b.opCode(OpCode.JMPIFNOT, new byte[]{0x00});

        b.opCode(OpCode.DUP, OpCode.PUSH2, OpCode.PICK);
        b.sysCall(InteropService.SYSTEM_ITERATOR_VALUE);
        b.opCode(OpCode.APPEND, OpCode.DUP, OpCode.SIZE, OpCode.PUSH3, OpCode.PICK, OpCode.GE);

        int jmpIfMaxReachedPosition = b.length();
        b.opCode(OpCode.JMPIF, new byte[]{0x00});

        int jmpPosition = b.length();
        b.opCode(OpCode.JMP, new byte[]{(byte) (cycleStart - jmpPosition)});

        int loadResultPosition = b.length();
        b.opCode(OpCode.NIP, OpCode.NIP);

        byte[] script = b.toArray();
        script[jmpIfNotPosition + 1] = (byte) (loadResultPosition - jmpIfNotPosition);
        script[jmpIfMaxReachedPosition + 1] = (byte) (loadResultPosition - jmpIfMaxReachedPosition);
        return script;
    }

    private class ParamPusher implements ContractParameter.Visitor<Void> {

        @Override
        public Void visitBoolean(ContractParameter.BooleanParameter parameter) {
            pushBoolean(parameter.getValue());
            return null;
        }

        @Override
        public Void visitInteger(ContractParameter.IntegerParameter parameter) {
            pushInteger(parameter.getValue());
            return null;
        }

        @Override
        public Void visitByteArray(ContractParameter.ByteArrayParameter parameter) {
            pushData(parameter.getValue());
            return null;
        }

        @Override
        public Void visitString(ContractParameter.StringParameter parameter) {
            pushData(parameter.getValue());
            return null;
        }

        @Override
        public Void visitHash160(ContractParameter.Hash160Parameter parameter) {
            pushData(parameter.getValue().toLittleEndianArray());
            return null;
        }

        @Override
        public Void visitHash256(ContractParameter.Hash256Parameter parameter) {
            pushData(parameter.getValue().toLittleEndianArray());
            return null;
        }

        @Override
        public Void visitPublicKey(ContractParameter.PublicKeyParameter parameter) {
            pushData(parameter.getValue());
            return null;
        }

        @Override
        public Void visitSignature(ContractParameter.SignatureParameter parameter) {
            pushData(parameter.getValue());
            return null;
        }

        @Override
        public Void visitArray(ContractParameter.ArrayParameter parameter) {
            pushArray(parameter.getValue());
            return null;
        }

        @Override
        public Void visitMap(ContractParameter.MapParameter parameter) {
            pushMap(parameter.getValue());
            return null;
        }

        @Override
        public Void visitAny(ContractParameter.AnyParameter parameter) {
            opCode(OpCode.PUSHNULL);
            return null;
        }
    }
}
