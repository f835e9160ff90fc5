
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
import org.twostack.neo3j.wallet.Account;

/**
 * A signer backed by an account. When the transaction is signed, the account's key produces the witness.
 */
public class AccountSigner extends Signer {

    private final Account account;

    private AccountSigner(Account account, WitnessScope scope) {
        super(account.getScriptHash(), scope);
        this.account = account;
    }

    /** A signer that only pays fees; its witness is valid nowhere else. */
    public static AccountSigner none(Account account) {
        return new AccountSigner(account, WitnessScope.NONE);
    }

    public static AccountSigner none(Hash160 account) {
        return none(Account.fromScriptHash(account));
    }

    /** A signer whose witness is valid for the contract called by the entry script. */
    public static AccountSigner calledByEntry(Account account) {
        return new AccountSigner(account, WitnessScope.CALLED_BY_ENTRY);
    }

    public static AccountSigner calledByEntry(Hash160 account) {
        return calledByEntry(Account.fromScriptHash(account));
    }

    /** A signer whose witness is valid everywhere. Use with care. */
    public static AccountSigner global(Account account) {
        return new AccountSigner(account, WitnessScope.GLOBAL);
    }

    public static AccountSigner global(Hash160 account) {
        return global(Account.fromScriptHash(account));
    }

    public Account getAccount() {
        return account;
    }

    @Override
    public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
        return visitor.visitAccountSigner(this);
    }
}
