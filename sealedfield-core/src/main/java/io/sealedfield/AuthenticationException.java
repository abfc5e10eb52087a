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

/**
 * Thrown when no candidate key, under any applicable envelope interpretation, verifies the authentication tag of a
 * ciphertext. This is the only outcome for tampered data or data encrypted under an unknown key.
 */
public final class AuthenticationException extends CiphertextException {
    public AuthenticationException() {
        super("message authentication failed");
    }
}
