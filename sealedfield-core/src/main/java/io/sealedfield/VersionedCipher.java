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
import java.util.List;
import java.util.Optional;

import software.pando.crypto.nacl.Bytes;

/**
 * Authenticated encryption of opaque byte strings with AES-256-CTR and HMAC-SHA256 (encrypt-then-MAC).
 * <p>
 * Output is self-describing: the format marker and IV travel in the ciphertext, so {@link #decrypt} needs nothing but
 * the key(s) to find out how a value was written. New data is always written in the {@link EnvelopeFormat#CURRENT}
 * format; data written in {@link EnvelopeFormat#LEGACY_A} or {@link EnvelopeFormat#LEGACY_B} remains readable.
 * <p>
 * Instances are stateless and safe for concurrent use. A fresh random IV is drawn for every encryption, and the same
 * key and IV must never be used for two different plaintexts.
 */
public final class VersionedCipher {

    /**
     * Generates a new random 64-byte secret: a 256-bit AES key followed by a 256-bit HMAC key.
     */
    public static byte[] generateKey() {
        try (var key = KeyMaterial.generate()) {
            return key.toByteArray();
        }
    }

    /**
     * Encrypts and authenticates the plaintext in the current format under a fresh random IV.
     *
     * @param key the key material.
     * @param plaintext the data to encrypt, which may be empty.
     * @return the envelope {@code 0x01 || IV || ciphertext || tag}.
     */
    public byte[] encrypt(KeyMaterial key, byte[] plaintext) {
        requireNonNull(key, "key");
        requireNonNull(plaintext, "plaintext");
        return sealWithIv(EnvelopeFormat.CURRENT, key, Bytes.secureRandom(AesCtr.IV_SIZE), plaintext);
    }

    /**
     * Encrypts under the encryption (first) key of the ring.
     */
    public byte[] encrypt(KeyRing keys, byte[] plaintext) {
        return encrypt(keys.encryptionKey(), plaintext);
    }

    /**
     * Encrypts under a raw 64-byte key.
     *
     * @throws InvalidKeySizeException if the key is not 64 bytes long.
     */
    public byte[] encrypt(byte[] key, byte[] plaintext) {
        try (var keyMaterial = KeyMaterial.fromBytes(key)) {
            return encrypt(keyMaterial, plaintext);
        }
    }

    /**
     * Verifies and decrypts an envelope written under the given key.
     *
     * @see #decrypt(KeyRing, byte[])
     */
    public byte[] decrypt(KeyMaterial key, byte[] envelope) throws CiphertextException {
        return decryptWithCandidates(List.of(key), envelope);
    }

    /**
     * Verifies and decrypts an envelope written under any key of the ring. Keys are tried in ring order and the
     * first one whose tag verifies wins.
     *
     * @param keys the candidate keys.
     * @param envelope the envelope.
     * @return the plaintext.
     * @throws MalformedCiphertextException if the envelope is too short for the format its leading byte announces.
     * @throws AuthenticationException if no key authenticates the envelope under any applicable format.
     */
    public byte[] decrypt(KeyRing keys, byte[] envelope) throws CiphertextException {
        return decryptWithCandidates(keys.decryptCandidates(), envelope);
    }

    /**
     * Verifies and decrypts an envelope with a raw key, or with several raw keys concatenated first key first.
     *
     * @throws InvalidKeySizeException if the key blob is not a positive multiple of 64 bytes long.
     */
    public byte[] decrypt(byte[] keyOrKeys, byte[] envelope) throws CiphertextException {
        try (var keys = KeyRing.fromConcatenated(keyOrKeys)) {
            return decrypt(keys, envelope);
        }
    }

    /**
     * Verifies and decrypts an envelope with an ordered list of raw 64-byte keys.
     *
     * @throws InvalidKeySizeException if any key is not 64 bytes long.
     */
    public byte[] decrypt(List<byte[]> keys, byte[] envelope) throws CiphertextException {
        try (var ring = KeyRing.fromBytes(keys)) {
            return decrypt(ring, envelope);
        }
    }

    private byte[] decryptWithCandidates(List<KeyMaterial> candidates, byte[] envelope) throws CiphertextException {
        requireNonNull(envelope, "envelope");
        var format = EnvelopeFormat.sniff(envelope);
        var parsed = Envelope.slice(format, envelope);

        while (true) {
            for (var key : candidates) {
                var plaintext = open(key, parsed, envelope);
                if (plaintext.isPresent()) {
                    return plaintext.get();
                }
            }

            format = format.fallback();
            if (format == null || envelope.length < format.minimumSize()) {
                throw new AuthenticationException();
            }
            parsed = Envelope.slice(format, envelope);
        }
    }

    /**
     * Verifies and decrypts one reading of an envelope under one key.
     *
     * @return the plaintext, or an empty result if the marker does not match the format or the tag does not verify.
     */
    static Optional<byte[]> open(KeyMaterial key, Envelope parsed, byte[] envelope) {
        if (!parsed.format().hasMarker(envelope)) {
            return Optional.empty();
        }
        var computedTag = HmacSha256.calculate(key.macKey(), parsed.authenticated());
        try {
            if (!Bytes.equal(computedTag, parsed.tag())) {
                return Optional.empty();
            }
        } finally {
            Utils.wipe(computedTag);
        }
        return Optional.of(AesCtr.process(key.cipherKey(), parsed.iv(), parsed.ciphertext()));
    }

    /**
     * Encrypts and authenticates with a caller-supplied IV field. Reusing an IV field under the same key destroys the
     * confidentiality of both messages, so outside of fixed test vectors use {@link #encrypt} instead.
     *
     * @param format the envelope format to produce.
     * @param key the key material.
     * @param ivField the IV field, exactly {@code format.ivFieldSize()} bytes; its last 16 bytes are the counter block.
     * @param plaintext the data to encrypt.
     * @return the envelope.
     */
    static byte[] sealWithIv(EnvelopeFormat format, KeyMaterial key, byte[] ivField, byte[] plaintext) {
        if (ivField.length != format.ivFieldSize()) {
            throw new IllegalArgumentException("invalid IV size for " + format);
        }
        var iv = Arrays.copyOfRange(ivField, ivField.length - AesCtr.IV_SIZE, ivField.length);
        var ciphertext = AesCtr.process(key.cipherKey(), iv, plaintext);
        var header = Utils.concat(format.marker(), ivField);
        var authenticated = Utils.concat(
                Arrays.copyOfRange(header, format.authenticatedOffset(), header.length), ciphertext);
        var tag = HmacSha256.calculate(key.macKey(), authenticated);
        return Utils.concat(header, ciphertext, tag);
    }
}
