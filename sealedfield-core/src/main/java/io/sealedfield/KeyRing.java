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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import javax.security.auth.Destroyable;

/**
 * An ordered, non-empty list of keys supporting key rotation. The first key is used to encrypt new data, while all
 * keys are tried, in order, when decrypting. To rotate, put a freshly generated key at the front of the ring and keep
 * the retired keys behind it for as long as data written under them may still be read.
 */
public final class KeyRing implements Iterable<KeyMaterial>, Destroyable, AutoCloseable {
    private final List<KeyMaterial> keys;

    private KeyRing(List<KeyMaterial> keys) {
        this.keys = List.copyOf(Require.notEmpty(keys, "No key provided"));
    }

    public static KeyRing of(KeyMaterial first, KeyMaterial... retired) {
        var keys = new ArrayList<KeyMaterial>(retired.length + 1);
        keys.add(first);
        keys.addAll(Arrays.asList(retired));
        return new KeyRing(keys);
    }

    public static KeyRing of(List<KeyMaterial> keys) {
        return new KeyRing(keys);
    }

    /**
     * Imports a list of raw 64-byte keys. Every key is validated independently.
     *
     * @throws InvalidKeySizeException if any key has the wrong size.
     * @throws IllegalArgumentException if the list is empty.
     */
    public static KeyRing fromBytes(List<byte[]> keys) {
        Require.notEmpty(keys, "No key provided");
        keys.forEach(Require::keySize);
        return new KeyRing(keys.stream().map(KeyMaterial::fromBytes).toList());
    }

    /**
     * Imports a blob holding one or more 64-byte keys back to back, first key first.
     *
     * @throws InvalidKeySizeException if the blob length is not a positive multiple of 64.
     */
    public static KeyRing fromConcatenated(byte[] blob) {
        Require.multipleOfKeySize(blob);
        var keys = new ArrayList<KeyMaterial>(blob.length / KeyMaterial.KEY_SIZE);
        for (int offset = 0; offset < blob.length; offset += KeyMaterial.KEY_SIZE) {
            var slice = Arrays.copyOfRange(blob, offset, offset + KeyMaterial.KEY_SIZE);
            try {
                keys.add(KeyMaterial.fromBytes(slice));
            } finally {
                Utils.wipe(slice);
            }
        }
        return new KeyRing(keys);
    }

    /**
     * Parses a configuration value holding a comma-separated list of URL-safe base64-encoded keys. The first entry
     * becomes the encryption key.
     *
     * @throws IllegalArgumentException if the value is blank or an entry is not valid base64.
     * @throws InvalidKeySizeException if any entry does not decode to 64 bytes.
     */
    public static KeyRing parse(String encodedKeys) {
        if (encodedKeys == null || encodedKeys.isBlank()) {
            throw new IllegalArgumentException("No key provided");
        }
        var decoded = Arrays.stream(encodedKeys.split(","))
                .map(String::strip)
                .filter(entry -> !entry.isEmpty())
                .map(Base64url::decode)
                .toList();
        try {
            return fromBytes(decoded);
        } finally {
            Utils.wipe(decoded);
        }
    }

    /**
     * The key used to encrypt new data.
     */
    public KeyMaterial encryptionKey() {
        return keys.get(0);
    }

    /**
     * All keys in the order they should be tried for decryption, first-declared-first.
     */
    public List<KeyMaterial> decryptCandidates() {
        return keys;
    }

    public int size() {
        return keys.size();
    }

    @Override
    public Iterator<KeyMaterial> iterator() {
        return keys.iterator();
    }

    @Override
    public void destroy() {
        Utils.destroy(keys);
    }

    @Override
    public boolean isDestroyed() {
        return keys.stream().allMatch(KeyMaterial::isDestroyed);
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public String toString() {
        return "KeyRing{size=" + keys.size() + "}";
    }
}
