
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
package org.twostack.neo3j;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.math.ec.FixedPointUtil;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>Represents an elliptic curve public and (optionally) private key on the secp256r1 curve, usable for
 * signing and verifying Neo witnesses.</p>
 *
 * <p>Neo always serializes public keys in compressed form (33 bytes). Signatures are deterministic (RFC 6979)
 * and are exchanged as the 64-byte concatenation of r and s.</p>
 */
public class ECKey {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256r1");

    /** The parameters of the secp256r1 curve that Neo uses. */
    public static final ECDomainParameters CURVE;

    private static final SecureRandom secureRandom;

    static {
        // Tell Bouncy Castle to precompute data that's needed during secp256r1 calculations.
        FixedPointUtil.precompute(CURVE_PARAMS.getG());
        CURVE = new ECDomainParameters(CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(),
                CURVE_PARAMS.getH());
        secureRandom = new SecureRandom();
    }

    @Nullable
    protected final BigInteger priv;
    protected final ECPoint pub;

    protected ECKey(@Nullable BigInteger priv, ECPoint pub) {
        if (priv != null) {
            checkArgument(priv.bitLength() <= 32 * 8, "private key exceeds 32 bytes: %s bits", priv.bitLength());
            checkArgument(!priv.equals(BigInteger.ZERO));
            checkArgument(!priv.equals(BigInteger.ONE));
        }
        this.priv = priv;
        this.pub = Objects.requireNonNull(pub).normalize();
    }

    /** Generates an entirely new keypair. */
    public static ECKey createNew() {
        BigInteger d;
        do {
            d = new BigInteger(256, secureRandom);
        } while (d.compareTo(BigInteger.ONE) <= 0 || d.compareTo(CURVE.getN()) >= 0);
        return fromPrivate(d);
    }

    /**
     * Creates an ECKey given the private key only. The public key is calculated from it.
     */
    public static ECKey fromPrivate(BigInteger privKey) {
        return new ECKey(privKey, publicPointFromPrivate(privKey));
    }

    /**
     * Creates an ECKey given the 32 private key bytes (big-endian).
     */
    public static ECKey fromPrivate(byte[] privKeyBytes) {
        checkArgument(privKeyBytes.length == NeoConstants.PRIVATE_KEY_SIZE,
                "Private keys are %s bytes, got %s", NeoConstants.PRIVATE_KEY_SIZE, privKeyBytes.length);
        return fromPrivate(new BigInteger(1, privKeyBytes));
    }

    /**
     * Creates an ECKey that cannot be used for signing, only verifying signatures, from the given encoded point.
     */
    public static ECKey fromPublicOnly(byte[] pub) {
        return new ECKey(null, CURVE.getCurve().decodePoint(pub));
    }

    /**
     * Returns public key point from the given private key.
     */
    public static ECPoint publicPointFromPrivate(BigInteger privKey) {
        if (privKey.bitLength() > CURVE.getN().bitLength()) {
            privKey = privKey.mod(CURVE.getN());
        }
        return new FixedPointCombMultiplier().multiply(CURVE.getG(), privKey);
    }

    public boolean hasPrivKey() {
        return priv != null;
    }

    /** Gets the compressed encoding of the public key. */
    public byte[] getPubKey() {
        return pub.getEncoded(true);
    }

    public ECPoint getPubKeyPoint() {
        return pub;
    }

    public String getPublicKeyAsHex() {
        return Utils.HEX.encode(getPubKey());
    }

    /**
     * Gets the private key as a 32 byte big-endian array.
     *
     * @throws IllegalStateException if the private key is not available.
     */
    public byte[] getPrivKeyBytes() {
        checkState(priv != null, "Private key is not available");
        return Utils.toBytesPadded(priv, NeoConstants.PRIVATE_KEY_SIZE);
    }

    public BigInteger getPrivKey() {
        checkState(priv != null, "Private key is not available");
        return priv;
    }

    /**
     * Signs the given 32 byte hash. The caller is responsible for hashing the message.
     */
    public ECDSASignature sign(byte[] hash) {
        checkState(priv != null, "Cannot sign without a private key");
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        ECPrivateKeyParameters privKey = new ECPrivateKeyParameters(priv, CURVE);
        signer.init(true, privKey);
        BigInteger[] components = signer.generateSignature(hash);
        return new ECDSASignature(components[0], components[1]);
    }

    /**
     * Verifies the given signature against the given 32 byte hash using the public key.
     */
    public boolean verify(byte[] hash, ECDSASignature signature) {
        ECDSASigner signer = new ECDSASigner();
        ECPublicKeyParameters params = new ECPublicKeyParameters(pub, CURVE);
        signer.init(false, params);
        try {
            return signer.verifySignature(hash, signature.r, signature.s);
        } catch (NullPointerException e) {
            // Bouncy Castle contains a bug that can cause NPEs given specially crafted signatures.
            return false;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || !(o instanceof ECKey)) return false;
        ECKey other = (ECKey) o;
        return Objects.equals(this.priv, other.priv) && Objects.equals(this.pub, other.pub);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(getPubKey());
    }

    /**
     * Groups the two components that make up a signature.
     */
    public static class ECDSASignature {
        /** The two components of the signature. */
        public final BigInteger r, s;

        public ECDSASignature(BigInteger r, BigInteger s) {
            this.r = r;
            this.s = s;
        }

        /**
         * Parses the 64 byte r||s encoding Neo uses on the wire.
         */
        public static ECDSASignature fromConcatenated(byte[] bytes) {
            checkArgument(bytes.length == NeoConstants.SIGNATURE_SIZE,
                    "Signatures are %s bytes, got %s", NeoConstants.SIGNATURE_SIZE, bytes.length);
            BigInteger r = new BigInteger(1, Arrays.copyOfRange(bytes, 0, 32));
            BigInteger s = new BigInteger(1, Arrays.copyOfRange(bytes, 32, 64));
            return new ECDSASignature(r, s);
        }

        /**
         * Returns the 64 byte concatenation of r and s, each left-padded to 32 bytes.
         */
        public byte[] encodeToConcatenated() {
            byte[] out = new byte[NeoConstants.SIGNATURE_SIZE];
            System.arraycopy(Utils.toBytesPadded(r, 32), 0, out, 0, 32);
            System.arraycopy(Utils.toBytesPadded(s, 32), 0, out, 32, 32);
            return out;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ECDSASignature other = (ECDSASignature) o;
            return r.equals(other.r) && s.equals(other.s);
        }

        @Override
        public int hashCode() {
            return Objects.hash(r, s);
        }
    }
}
