
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
package org.twostack.neo3j.crypto;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Cost parameters of the scrypt key derivation used by NEP-2.
 */
public class ScryptParams {

    public static final ScryptParams STANDARD = new ScryptParams(16384, 8, 8);

    private final int n;
    private final int r;
    private final int p;

    public ScryptParams(int n, int r, int p) {
        checkArgument(n > 1 && (n & (n - 1)) == 0, "Scrypt cost parameter N must be a power of 2 greater than 1");
        checkArgument(r > 0, "Scrypt block size r must be positive");
        checkArgument(p > 0, "Scrypt parallelization p must be positive");
        this.n = n;
        this.r = r;
        this.p = p;
    }

    public int getN() {
        return n;
    }

    public int getR() {
        return r;
    }

    public int getP() {
        return p;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScryptParams that = (ScryptParams) o;
        return n == that.n && r == that.r && p == that.p;
    }

    @Override
    public int hashCode() {
        return Objects.hash(n, r, p);
    }

    @Override
    public String toString() {
        return "ScryptParams{n=" + n + ", r=" + r + ", p=" + p + '}';
    }
}
