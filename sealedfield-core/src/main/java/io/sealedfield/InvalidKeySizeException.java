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
 * Thrown when a key blob is not exactly {@value KeyMaterial#KEY_SIZE} bytes long (or, where a list of keys is given
 * as one concatenated blob, not a positive multiple of that size). This is always a programming or configuration
 * error and is raised before any cryptographic operation takes place.
 */
public final class InvalidKeySizeException extends IllegalArgumentException {
    private final int actualSize;

    public InvalidKeySizeException(int actualSize) {
        super("invalid key size: expected " + KeyMaterial.KEY_SIZE + " bytes but got " + actualSize);
        this.actualSize = actualSize;
    }

    public int actualSize() {
        return actualSize;
    }
}
