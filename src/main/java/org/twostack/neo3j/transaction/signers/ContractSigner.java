
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
import org.twostack.neo3j.types.ContractParameter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A signer backed by a contract. Its witness carries no signature: the node calls the contract's
 * {@code verify} method with the given parameters, which decides.
 */
public class ContractSigner extends Signer {

    private final List<ContractParameter> verifyParams;

    private ContractSigner(Hash160 contractHash, WitnessScope scope, List<ContractParameter> verifyParams) {
        super(contractHash, scope);
        this.verifyParams = new ArrayList<>(verifyParams);
    }

    public static ContractSigner calledByEntry(Hash160 contractHash, ContractParameter... verifyParams) {
        return new ContractSigner(contractHash, WitnessScope.CALLED_BY_ENTRY, Arrays.asList(verifyParams));
    }

    public static ContractSigner global(Hash160 contractHash, ContractParameter... verifyParams) {
        return new ContractSigner(contractHash, WitnessScope.GLOBAL, Arrays.asList(verifyParams));
    }

    public static ContractSigner none(Hash160 contractHash, ContractParameter... verifyParams) {
        return new ContractSigner(contractHash, WitnessScope.NONE, Arrays.asList(verifyParams));
    }

    public List<ContractParameter> getVerifyParameters() {
        return Collections.unmodifiableList(verifyParams);
    }

    @Override
    public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
        return visitor.visitContractSigner(this);
    }
}
