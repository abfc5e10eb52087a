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

import java.util.Arrays;

import javax.crypto.SecretKey;
import javax.security.auth.Destroyable;

import software.pando.crypto.nacl.Bytes;

/**
 * A 64-byte secret that packs a 256-bit AES key (the first 32 bytes) and a 256-bit HMAC-SHA256 key (the last 32
 * bytes). The two halves are always created together from a single blob and are never supplied independently.
 * <p>
 * Instances own private copies of the key bytes. Calling {@link #destroy()} (or closing the key in a
 * try-with-resources block) overwrites every copy with zeros, after which the key can no longer be used.
 */
public final class KeyMaterial implements Destroyable, AutoCloseable {
    /**
     * Total size of the packed secret in bytes.
     */
    public static final int KEY_SIZE = 64;
    static final int CIPHER_KEY_SIZE = 32;
    static final int MAC_KEY_SIZE = 32;

    private final DestroyableSecretKey cipherKey;
    private final DestroyableSecretKey macKey;

    private KeyMaterial(byte[] keyBytes) {
        this.cipherKey = new DestroyableSecretKey(keyBytes, 0, CIPHER_KEY_SIZE, AesCtr.ALGORITHM);
        this.macKey = new DestroyableSecretKey(keyBytes, CIPHER_KEY_SIZE, MAC_KEY_SIZE, HmacSha256.ALGORITHM);
    }

    /**
     * Generates fresh key material from a secure random source.
     *
     * @return the new key material.
     */
    public static KeyMaterial generate() {
        var bytes = Bytes.secureRandom(KEY_SIZE);
        try {
            return new KeyMaterial(bytes);
        } finally {
            Utils.wipe(bytes);
        }
    }

    /**
     * Imports existing key material. The blob is copied, so the caller may wipe it afterwards.
     *
     * @param blob the 64-byte secret.
     * @return the key material.
     * @throws InvalidKeySizeException if the blob is not exactly 64 bytes long.
     */
    public static KeyMaterial fromBytes(byte[] blob) {
        return new KeyMaterial(Require.keySize(blob));
    }

    /**
     * The AES-256 half of the key, used for counter mode encryption.
     */
    public SecretKey cipherKey() {
        checkNotDestroyed();
        return cipherKey;
    }

    /**
     * The HMAC-SHA256 half of the key, used to compute authentication tags.
     */
    public SecretKey macKey() {
        checkNotDestroyed();
        return macKey;
    }

    /**
     * Returns a fresh copy of the packed 64-byte secret, for example to hand to a secret store. The caller is
     * responsible for wiping the returned array.
     */
    public byte[] toByteArray() {
        checkNotDestroyed();
        var cipherBytes = cipherKey.getKeyBytes();
        var macBytes = macKey.getKeyBytes();
        return Utils.concat(cipherBytes, macBytes);
    }

    @Override
    public void destroy() {
        Utils.destroy(cipherKey, macKey);
    }

    @Override
    public boolean isDestroyed() {
        return cipherKey.isDestroyed() && macKey.isDestroyed();
    }

    @Override
    public void close() {
        destroy();
    }

    private void checkNotDestroyed() {
        if (cipherKey.isDestroyed() || macKey.isDestroyed()) {
            throw new IllegalStateException("Key has been destroyed");
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof KeyMaterial that)) {
            return false;
        }
        var mine = toByteArray();
        var theirs = that.toByteArray();
        try {
            return Bytes.equal(mine, theirs);
        } finally {
            Utils.wipe(mine, theirs);
        }
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(new int[] { cipherKey.hashCode(), macKey.hashCode() });
    }

    @Override
    public String toString() {
        return "KeyMaterial{destroyed=" + isDestroyed() + "}";
    }
}
