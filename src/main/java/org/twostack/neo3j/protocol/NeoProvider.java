
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
package org.twostack.neo3j.protocol;

import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.Hash256;
import org.twostack.neo3j.PublicKey;
import org.twostack.neo3j.exception.ProviderException;
import org.twostack.neo3j.transaction.signers.Signer;

import java.util.List;

/**
 * <p>The node-facing collaborator of the transaction builder. Implementations talk to a Neo node, usually over
 * JSON-RPC; this library only depends on the answers.</p>
 *
 * <p>Every call is synchronous. Transport and node errors are reported as {@link ProviderException}.</p>
 */
public interface NeoProvider {

    /** Number of blocks in the chain, i.e. the index of the next block. */
    long getBlockCount() throws ProviderException;

    /** Public keys of the current committee members. */
    List<PublicKey> getCommittee() throws ProviderException;

    /** Magic number of the network the node belongs to. */
    long getNetworkMagic() throws ProviderException;

    /**
     * Test-invokes the script with the given signers and returns the GAS it consumed, in fractions, which is the
     * system fee the script needs.
     */
    long invokeScriptForGas(byte[] script, List<Signer> signers) throws ProviderException;

    /**
     * Network fee, in GAS fractions, for the given serialized transaction. The witnesses of the transaction only
     * need the right shape; their signatures are not checked.
     */
    long calculateNetworkFee(byte[] transaction) throws ProviderException;

    /** GAS balance of the account, in fractions. */
    long getGasBalance(Hash160 account) throws ProviderException;

    /**
     * Broadcasts a signed transaction.
     *
     * @return the hash the node reports for the transaction
     */
    Hash256 sendRawTransaction(byte[] transaction) throws ProviderException;
}
