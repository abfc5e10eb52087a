/*
 * Copyright 2024 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.sealedfield;

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Locale;

import javax.crypto.SecretKey;

import software.pando.crypto.nacl.Bytes;

/**
 * One half of a {@link KeyMaterial}: a raw secret key whose {@link #destroy()} really zeroes the key bytes, unlike
 * {@link javax.crypto.spec.SecretKeySpec}. Once destroyed the key refuses to release its bytes, so a JCE
 * {@code Cipher} or {@code Mac} initialised with it fails instead of silently running with an all-zero key.
 */
final class DestroyableSecretKey implements SecretKey {

    private volatile boolean destroyed = false;

    private final String algorithm;
    private final byte[] keyBytes;

    /**
     * Copies {@code length} bytes of {@code blob} starting at {@code offset}.
     */
    DestroyableSecretKey(byte[] blob, int offset, int length, String algorithm) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        if (offset < 0 || length <= 0 || offset + length > blob.length) {
            throw new IllegalArgumentException("key slice out of range");
        }
        this.keyBytes = Arrays.copyOfRange(blob, offset, offset + length);
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        return getKeyBytes().clone();
    }

    byte[] getKeyBytes() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
        return keyBytes; // No defensive copy
    }

    @Override
    public void destroy() {
        Arrays.fill(keyBytes, (byte) 0);
        this.destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Constant-time comparison against any other raw secret key of the same algorithm.
     */
    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SecretKey that) || !"RAW".equals(that.getFormat())
                || !algorithm.equalsIgnoreCase(that.getAlgorithm())) {
            return false;
        }
        byte[] otherKeyBytes = that.getEncoded();
        try {
            return otherKeyBytes != null && Bytes.equal(getKeyBytes(), otherKeyBytes);
        } finally {
            if (otherKeyBytes != null) {
                Arrays.fill(otherKeyBytes, (byte) 0);
            }
        }
    }

    @Override
    public int hashCode() {
        // Same value as SecretKeySpec.hashCode(), so the two can share hash-based collections
        int retval = 0;
        for (int i = 1; i < keyBytes.length; i++) {
            retval += keyBytes[i] * i;
        }
        return retval ^ algorithm.toLowerCase(Locale.ENGLISH).hashCode();
    }

    @Override
    public String toString() {
        return "DestroyableSecretKey{algorithm=" + algorithm + ", bits=" + keyBytes.length * 8
                + (destroyed ? ", destroyed" : "") + "}";
    }
}
