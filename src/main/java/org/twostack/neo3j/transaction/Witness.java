
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
package org.twostack.neo3j.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twostack.neo3j.PrivateKey;
import org.twostack.neo3j.exception.ProtocolException;
import org.twostack.neo3j.exception.TransactionConfigurationException;
import org.twostack.neo3j.io.NeoSerializable;
import org.twostack.neo3j.io.ReadUtils;
import org.twostack.neo3j.io.WriteUtils;
import org.twostack.neo3j.script.InvocationScript;
import org.twostack.neo3j.script.ScriptBuilder;
import org.twostack.neo3j.script.VerificationScript;
import org.twostack.neo3j.types.ContractParameter;

import java.util.List;
import java.util.Objects;

/**
 * The proof that a signer authorized a transaction: an invocation script that pushes the arguments (usually
 * signatures) and the verification script that checks them.
 */
public class Witness implements NeoSerializable {

    private static final Logger log = LoggerFactory.getLogger(Witness.class);

    private final InvocationScript invocationScript;
    private final VerificationScript verificationScript;

    public Witness() {
        this(new InvocationScript(), new VerificationScript());
    }

    public Witness(byte[] invocationScript, byte[] verificationScript) {
        this(new InvocationScript(invocationScript), new VerificationScript(verificationScript));
    }

    public Witness(InvocationScript invocationScript, VerificationScript verificationScript) {
        this.invocationScript = Objects.requireNonNull(invocationScript);
        this.verificationScript = Objects.requireNonNull(verificationScript);
    }

    /**
     * Signs the message with the key and pairs the signature with the key's single-sig verification script.
     *
     * @param messageToSign the hash data of a transaction, see {@link Transaction#getHashData(long)}
     */
    public static Witness create(byte[] messageToSign, PrivateKey privateKey) {
        InvocationScript invocationScript = InvocationScript.fromMessageAndPrivateKey(messageToSign, privateKey);
        VerificationScript verificationScript = VerificationScript.fromPublicKey(privateKey.getPublicKey());
        return new Witness(invocationScript, verificationScript);
    }

    /**
     * <p>Builds the witness of an m-of-n multi-sig account.</p>
     *
     * <p>The signatures must be in the order of the keys in the verification script. Only the first m of them are
     * used.</p>
     *
     * @throws TransactionConfigurationException if fewer than m signatures are given
     * @throws IllegalArgumentException          if the verification script is not a multi-sig script
     */
    public static Witness createMultiSigWitness(List<byte[]> signatures, VerificationScript verificationScript)
            throws TransactionConfigurationException {
        if (!verificationScript.isMultiSigScript()) {
            throw new IllegalArgumentException("The verification script is not a multi-sig script");
        }
        int threshold = verificationScript.getSigningThreshold();
        if (signatures.size() < threshold) {
            throw new TransactionConfigurationException("A multi-sig witness needs " + threshold
                    + " signatures but only " + signatures.size() + " were given");
        }
        log.debug("Creating {}-of-{} multi-sig witness for {}", threshold, verificationScript.getNrOfAccounts(),
                verificationScript.getScriptHash());
        InvocationScript invocationScript = InvocationScript.fromSignatures(signatures.subList(0, threshold));
        return new Witness(invocationScript, verificationScript);
    }

    /**
     * Builds the witness of a contract signer: the verify parameters pushed in order, with an empty verification
     * script. The node then calls the contract's {@code verify} method.
     */
    public static Witness createContractWitness(List<ContractParameter> verifyParameters) {
        ScriptBuilder builder = new ScriptBuilder();
        for (ContractParameter parameter : verifyParameters) {
            builder.pushParam(parameter);
        }
        return new Witness(new InvocationScript(builder.toArray()), new VerificationScript());
    }

    public static Witness fromReader(ReadUtils reader) throws ProtocolException {
        InvocationScript invocationScript = InvocationScript.fromReader(reader);
        VerificationScript verificationScript = VerificationScript.fromReader(reader);
        return new Witness(invocationScript, verificationScript);
    }

    public InvocationScript getInvocationScript() {
        return invocationScript;
    }

    public VerificationScript getVerificationScript() {
        return verificationScript;
    }

    @Override
    public void serialize(WriteUtils writer) {
        invocationScript.serialize(writer);
        verificationScript.serialize(writer);
    }

    @Override
    public int getSize() {
        return invocationScript.getSize() + verificationScript.getSize();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Witness that = (Witness) o;
        return invocationScript.equals(that.invocationScript) && verificationScript.equals(that.verificationScript);
    }

    @Override
    public int hashCode() {
        return Objects.hash(invocationScript, verificationScript);
    }
}
