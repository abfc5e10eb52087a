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

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * The on-disk shapes of an encrypted value. Every shape is laid out as
 * <pre>[marker][IV field][AES-CTR ciphertext][HMAC-SHA256 tag (32 bytes)]</pre>
 * and differs only in the size of the marker and IV field, which part of the envelope the tag covers, and where in
 * the IV field the real 16-byte counter block lives.
 */
public enum EnvelopeFormat {
    /**
     * The oldest format. Its IV field is 32 bytes wide, of which only the last 16 bytes were ever used as the counter
     * block: the library of the day silently truncated the oversized IV. All 32 bytes are covered by the tag.
     */
    LEGACY_A(new byte[] { 0x00 }, 32, 1),

    /**
     * An intermediate format written while migrating from {@link #LEGACY_A}. It starts with the ASCII literal
     * {@code "v2"} followed by 30 more bytes; the whole leading 32-byte field, marker included, is covered by the tag
     * and its last 16 bytes are the counter block. Never written, and only tried once the {@link #CURRENT}
     * reading of an envelope has failed to authenticate.
     */
    LEGACY_B("v2".getBytes(US_ASCII), 30, 0),

    /**
     * The format produced by {@link VersionedCipher#encrypt}: marker {@code 0x01} and a 16-byte IV.
     */
    CURRENT(new byte[] { 0x01 }, 16, 1);

    private final byte[] marker;
    private final int ivFieldSize;
    private final int authenticatedOffset;

    EnvelopeFormat(byte[] marker, int ivFieldSize, int authenticatedOffset) {
        this.marker = marker;
        this.ivFieldSize = ivFieldSize;
        this.authenticatedOffset = authenticatedOffset;
    }

    /**
     * Classifies an envelope by its leading byte. Only {@link #LEGACY_A} has a marker that cannot be confused with
     * anything else; every other envelope is first read as {@link #CURRENT}.
     *
     * @param envelope the envelope.
     * @return the format to try first.
     * @throws MalformedCiphertextException if the envelope is empty.
     */
    public static EnvelopeFormat sniff(byte[] envelope) throws MalformedCiphertextException {
        if (envelope == null || envelope.length == 0) {
            throw new MalformedCiphertextException("empty ciphertext");
        }
        return envelope[0] == LEGACY_A.marker[0] ? LEGACY_A : CURRENT;
    }

    /**
     * The format to re-read an envelope as once every key has failed to authenticate it as this format, if any.
     */
    EnvelopeFormat fallback() {
        return this == CURRENT ? LEGACY_B : null;
    }

    byte[] marker() {
        return marker.clone();
    }

    boolean hasMarker(byte[] envelope) {
        return Utils.startsWith(envelope, marker);
    }

    int markerSize() {
        return marker.length;
    }

    int ivFieldSize() {
        return ivFieldSize;
    }

    /** Offset of the first authenticated byte. */
    int authenticatedOffset() {
        return authenticatedOffset;
    }

    int headerSize() {
        return marker.length + ivFieldSize;
    }

    /** Offset of the 16-byte counter block: always the tail of the IV field. */
    int ivOffset() {
        return headerSize() - AesCtr.IV_SIZE;
    }

    /**
     * The shortest envelope of this format, carrying an empty plaintext.
     */
    public int minimumSize() {
        return headerSize() + HmacSha256.TAG_SIZE;
    }
}
