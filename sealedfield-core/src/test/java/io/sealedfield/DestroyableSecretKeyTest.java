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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import javax.crypto.spec.SecretKeySpec;

import org.testng.annotations.Test;

public class DestroyableSecretKeyTest {

    @Test
    public void shouldZeroKeyBytesOnDestroy() {
        var bytes = new byte[] { 1, 2, 3, 4 };
        var key = new DestroyableSecretKey(bytes, 0, 4, "AES");
        var internal = key.getKeyBytes();

        key.destroy();

        assertThat(key.isDestroyed()).isTrue();
        assertThat(internal).containsOnly(0);
        assertThat(bytes).containsExactly(1, 2, 3, 4);
        assertThatIllegalStateException().isThrownBy(key::getEncoded);
        assertThat(key.toString()).endsWith(", destroyed}");
    }

    @Test
    public void shouldBeCompatibleWithSecretKeySpec() {
        var bytes = new byte[] { 9, 8, 7, 6, 5 };
        var key = new DestroyableSecretKey(bytes, 1, 3, "HmacSHA256");
        var spec = new SecretKeySpec(bytes, 1, 3, "HmacSHA256");

        assertThat(key).isEqualTo(spec);
        assertThat(key).isNotEqualTo(new SecretKeySpec(bytes, 1, 3, "AES"));
        assertThat(key.hashCode()).isEqualTo(spec.hashCode());
        assertThat(key.getFormat()).isEqualTo("RAW");
        assertThat(key.toString()).isEqualTo("DestroyableSecretKey{algorithm=HmacSHA256, bits=24}");
    }

    @Test
    public void shouldRejectSliceOutOfRange() {
        assertThatIllegalArgumentException().isThrownBy(() -> new DestroyableSecretKey(new byte[64], 32, 33, "AES"));
        assertThatIllegalArgumentException().isThrownBy(() -> new DestroyableSecretKey(new byte[64], 0, 0, "AES"));
    }
}
