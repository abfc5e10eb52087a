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

import java.util.Collection;

/**
 * Utilities for checking preconditions.
 */
final class Require {
    static <T extends Iterable<?>> T notEmpty(T items, String msg) {
        var empty = (items instanceof Collection<?> c && c.isEmpty()) || !items.iterator().hasNext();
        if (empty) {
            throw new IllegalArgumentException(msg);
        }
        return items;
    }

    static byte[] keySize(byte[] key) {
        if (key == null || key.length != KeyMaterial.KEY_SIZE) {
            throw new InvalidKeySizeException(key == null ? 0 : key.length);
        }
        return key;
    }

    static byte[] multipleOfKeySize(byte[] keys) {
        if (keys == null || keys.length == 0 || keys.length % KeyMaterial.KEY_SIZE != 0) {
            throw new InvalidKeySizeException(keys == null ? 0 : keys.length);
        }
        return keys;
    }

    private Require() {}
}
