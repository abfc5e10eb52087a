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

/**
 * An envelope sliced according to one {@link EnvelopeFormat}. Slicing does not check the marker or the tag.
 *
 * @param format the format the envelope was sliced as.
 * @param authenticated the bytes covered by the tag.
 * @param iv the 16-byte counter block.
 * @param ciphertext the encrypted payload.
 * @param tag the trailing authentication tag.
 */
record Envelope(EnvelopeFormat format, byte[] authenticated, byte[] iv, byte[] ciphertext, byte[] tag) {

    static Envelope slice(EnvelopeFormat format, byte[] data) throws MalformedCiphertextException {
        if (data.length < format.minimumSize()) {
            throw new MalformedCiphertextException("ciphertext too short for " + format + " envelope: "
                    + data.length + " < " + format.minimumSize());
        }
        int tagOffset = data.length - HmacSha256.TAG_SIZE;
        return new Envelope(format,
                Arrays.copyOfRange(data, format.authenticatedOffset(), tagOffset),
                Arrays.copyOfRange(data, format.ivOffset(), format.headerSize()),
                Arrays.copyOfRange(data, format.headerSize(), tagOffset),
                Arrays.copyOfRange(data, tagOffset, data.length));
    }
}
