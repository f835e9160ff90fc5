
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
package org.twostack.neo3j.transaction.signers;

import org.twostack.neo3j.Hash160;
import org.twostack.neo3j.transaction.WitnessScope;

import java.util.List;

/**
 * A signer as it appears on the wire: a script hash with its scope and allow-lists, and nothing that could
 * produce a witness. Signers read from a serialized transaction are of this kind.
 */
public class TransactionSigner extends Signer {

    public TransactionSigner(Hash160 signerHash, List<WitnessScope> scopes) {
        super(signerHash, scopes);
    }

    @Override
    public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
        return visitor.visitTransactionSigner(this);
    }
}
