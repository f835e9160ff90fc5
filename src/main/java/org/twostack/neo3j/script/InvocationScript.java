
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

import org.twostack.neo3j.NeoConstants;
import org.twostack.neo3j.PrivateKey;
import org.twostack.neo3j.Utils;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The invocation half of a witness. For signature based accounts it pushes the signatures that the verification
 * script checks.
 */
public class InvocationScript implements NeoSerializable {

    private final byte[] script;

    public InvocationScript() {
        this.script = new byte[0];
    }

    public InvocationScript(byte[] script) {
        this.script = Arrays.copyOf(script, script.length);
    }

    /** Wraps a 64 byte signature into a push. */
    public static InvocationScript fromSignature(byte[] signature) {
        checkArgument(signature.length == NeoConstants.SIGNATURE_SIZE,
                "Signature must be %s bytes but was %s", NeoConstants.SIGNATURE_SIZE, signature.length);
        return new InvocationScript(new ScriptBuilder().pushData(signature).toArray());
    }

    /** Signs the message with the key and wraps the signature. */
    public static InvocationScript fromMessageAndPrivateKey(byte[] message, PrivateKey privateKey) {
        return fromSignature(privateKey.sign(message));
    }

    /** Pushes the signatures in the given order. */
    public static InvocationScript fromSignatures(List<byte[]> signatures) {
        ScriptBuilder builder = new ScriptBuilder();
        for (byte[] signature : signatures) {
            checkArgument(signature.length == NeoConstants.SIGNATURE_SIZE,
                    "Signature must be %s bytes but was %s", NeoConstants.SIGNATURE_SIZE, signature.length);
            builder.pushData(signature);
        }
        return new InvocationScript(builder.toArray());
    }

    public static InvocationScript fromReader(ReadUtils reader) throws ProtocolException {
        return new InvocationScript(reader.readVarBytes(NeoConstants.MAX_TRANSACTION_SIZE));
    }

    public byte[] getScript() {
        return Arrays.copyOf(script, script.length);
    }

    /**
     * Reads back the signatures pushed by this script.
     *
     * @throws ProtocolException if the script is anything other than a sequence of 64 byte pushes
     */
    public List<byte[]> getSignatures() throws ProtocolException {
        ReadUtils reader = new ReadUtils(script);
        List<byte[]> signatures = new ArrayList<>();
        while (reader.hasMoreBytes()) {
            byte[] data = reader.readPushData();
            if (data.length != NeoConstants.SIGNATURE_SIZE) {
                throw new ProtocolException("Invocation script pushes " + data.length + " bytes, not a signature");
            }
            signatures.add(data);
        }
        return signatures;
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
        return Arrays.equals(script, ((InvocationScript) o).script);
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
