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

package io.sealedfield.field;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealedfield.CiphertextException;
import io.sealedfield.KeyMaterial;
import io.sealedfield.KeyRing;
import io.sealedfield.VersionedCipher;

/**
 * Converts a string attribute to and from its encrypted stored form, for use by a persistence layer when an object is
 * written to or loaded from a document store. Each write uses a fresh IV, so saving the same value twice stores two
 * different blobs.
 * <p>
 * New values are encrypted under the first key of the field's {@link KeyRing}; stored values are decrypted with
 * every key of the ring in turn, which lets keys be rotated without migrating existing data. An absent or empty value
 * is stored as nothing at all, and nothing stored reads back as an absent value.
 */
public final class EncryptedStringField implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EncryptedStringField.class);

    private final KeyRing keys;
    private final VersionedCipher cipher;

    public EncryptedStringField(KeyRing keys) {
        this(keys, new VersionedCipher());
    }

    public EncryptedStringField(KeyMaterial key) {
        this(KeyRing.of(key));
    }

    /**
     * @param key a single raw 64-byte key.
     * @throws io.sealedfield.InvalidKeySizeException if the key is not 64 bytes long.
     */
    public EncryptedStringField(byte[] key) {
        this(KeyRing.fromBytes(List.of(key)));
    }

    /**
     * @param keys raw 64-byte keys, the first of which encrypts new values.
     * @throws IllegalArgumentException if the list is empty.
     * @throws io.sealedfield.InvalidKeySizeException if any key is not 64 bytes long.
     */
    public EncryptedStringField(List<byte[]> keys) {
        this(KeyRing.fromBytes(keys));
    }

    EncryptedStringField(KeyRing keys, VersionedCipher cipher) {
        this.keys = requireNonNull(keys, "keys");
        this.cipher = requireNonNull(cipher, "cipher");
        logger.debug("Encrypted field configured with {} key(s)", keys.size());
    }

    /**
     * Creates a field from a configuration value: a comma-separated list of URL-safe base64 keys, write key first.
     *
     * @see KeyRing#parse(String)
     */
    public static EncryptedStringField fromConfig(String encodedKeys) {
        return new EncryptedStringField(KeyRing.parse(encodedKeys));
    }

    /**
     * Encrypts a text value, encoded as UTF-8, for storage.
     *
     * @return the blob to store, or an empty result if the value is {@code null} or empty.
     */
    public Optional<byte[]> toStorage(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        return toStorage(value.getBytes(UTF_8));
    }

    /**
     * Encrypts a binary value for storage.
     *
     * @return the blob to store, or an empty result if the value is {@code null} or empty.
     */
    public Optional<byte[]> toStorage(byte[] value) {
        if (value == null || value.length == 0) {
            return Optional.empty();
        }
        return Optional.of(cipher.encrypt(keys, value));
    }

    /**
     * Decrypts a stored blob back to text.
     *
     * @return the value, or an empty result if nothing was stored.
     * @throws io.sealedfield.AuthenticationException if no key of the ring authenticates the blob.
     * @throws io.sealedfield.MalformedCiphertextException if the blob is not an envelope at all.
     */
    public Optional<String> fromStorage(byte[] stored) throws CiphertextException {
        return fromStorageBytes(stored).map(plaintext -> new String(plaintext, UTF_8));
    }

    /**
     * Decrypts a stored blob back to its raw bytes.
     *
     * @return the value, or an empty result if nothing was stored.
     * @throws io.sealedfield.AuthenticationException if no key of the ring authenticates the blob.
     * @throws io.sealedfield.MalformedCiphertextException if the blob is not an envelope at all.
     */
    public Optional<byte[]> fromStorageBytes(byte[] stored) throws CiphertextException {
        if (stored == null || stored.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(cipher.decrypt(keys, stored));
        } catch (CiphertextException e) {
            logger.debug("Unable to decrypt stored value with any of {} key(s): {}", keys.size(), e.getMessage());
            throw e;
        }
    }

    KeyRing keys() {
        return keys;
    }

    /**
     * Destroys the field's keys.
     */
    @Override
    public void close() {
        keys.destroy();
    }

    @Override
    public String toString() {
        return "EncryptedStringField{keys=" + keys + "}";
    }
}
