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

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;

import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;

/**
 * AES in counter mode with a full 128-bit initial counter block. Encryption and decryption are the same operation.
 */
final class AesCtr {
    static final String ALGORITHM = "AES";
    static final int IV_SIZE = 16;

    static byte[] process(SecretKey key, byte[] iv, byte[] data) {
        if (iv.length != IV_SIZE) {
            throw new IllegalArgumentException("invalid IV size");
        }
        if (data.length == 0) {
            return Utils.emptyBytes();
        }
        try {
            var cipher = Cipher.getInstance("AES/CTR/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
            var result = cipher.doFinal(data);
            if (result.length != data.length) {
                throw new IllegalStateException("Cipher returned unexpected output length");
            }
            return result;
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new AssertionError("AES-CTR not implemented by JVM", e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException(e);
        }
    }

    private AesCtr() {}
}
