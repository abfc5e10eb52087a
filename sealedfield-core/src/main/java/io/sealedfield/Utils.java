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

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);
    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

    static byte[] emptyBytes() {
        return EMPTY_BYTE_ARRAY;
    }

    static void destroy(Destroyable... toDestroy) {
        destroy(Arrays.asList(toDestroy));
    }

    static void destroy(Iterable<? extends Destroyable> toDestroy) {
        for (var it : toDestroy) {
            if (it == null || it.isDestroyed()) {
                continue;
            }
            try {
                it.destroy();
            } catch (DestroyFailedException e) {
                logger.error("Unable to destroy key material: {}", it, e);
            } catch (RuntimeException e) {
                logger.error("Unexpected runtime exception while destroying key: {}", it, e);
            }
        }
    }

    static void wipe(byte[]... toWipe) {
        wipe(Arrays.asList(toWipe));
    }

    static void wipe(Iterable<byte[]> toWipe) {
        for (var it : toWipe) {
            if (it != null) {
                Arrays.fill(it, (byte) 0);
            }
        }
    }

    static byte[] concat(byte[]... elements) {
        int totalSize = Arrays.stream(elements).mapToInt(x -> x.length).reduce(0, Math::addExact);
        var result = new byte[totalSize];
        int i = 0;
        for (var element : elements) {
            System.arraycopy(element, 0, result, i, element.length);
            i += element.length;
        }
        assert i == totalSize;
        return result;
    }

    static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; ++i) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private Utils() {}
}
