
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
package org.twostack.neo3j.params;

/**
 * Network magic numbers. The magic is prefixed to the transaction hash before signing, so a signature made for
 * one network is never valid on another.
 */
public class NetworkParameters {

    public static final long MAGIC_MAIN = 860833102L;
    public static final long MAGIC_TEST = 894710606L;

    /** Magic of a freshly initialised private network (neo-express and similar). */
    public static final long MAGIC_PRIVATE = 769L;

    public static long getNetworkMagic(NetworkType networkType) {
        switch (networkType) {
            case MAIN:
                return MAGIC_MAIN;
            case TEST:
                return MAGIC_TEST;
            case PRIVATE:
            default:
                return MAGIC_PRIVATE;
        }
    }

    /**
     * Magic numbers that are neither MainNet nor TestNet belong to private networks.
     */
    public static NetworkType getNetworkType(long magic) {
        if (magic == MAGIC_MAIN) {
            return NetworkType.MAIN;
        } else if (magic == MAGIC_TEST) {
            return NetworkType.TEST;
        }
        return NetworkType.PRIVATE;
    }

    /** The four little-endian bytes that prefix the data to sign. */
    public static byte[] getNetworkMagicBytes(long magic) {
        return new byte[]{
                (byte) (0xFF & magic),
                (byte) (0xFF & (magic >> 8)),
                (byte) (0xFF & (magic >> 16)),
                (byte) (0xFF & (magic >> 24))
        };
    }
}
