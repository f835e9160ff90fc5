
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
 * Thrown when a {@link org.twostack.neo3j.transaction.TransactionBuilder} is asked to produce a transaction
 * from a state that cannot yield a valid one (no signers, no script, duplicate signers and so on).
 */
public class TransactionConfigurationException extends TransactionException {

    public TransactionConfigurationException(String message) {
        super(message);
    }
}
