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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.testng.annotations.Test;

public class KeyMaterialTest {

    @Test
    public void shouldGenerateDistinctKeys() {
        try (var key1 = KeyMaterial.generate(); var key2 = KeyMaterial.generate()) {
            assertThat(key1.toByteArray()).hasSize(KeyMaterial.KEY_SIZE);
            assertThat(key1).isNotEqualTo(key2);
        }
    }

    @Test
    public void shouldSplitIntoCipherAndMacKeys() {
        var blob = new byte[64];
        Arrays.fill(blob, 0, 32, (byte) 1);
        Arrays.fill(blob, 32, 64, (byte) 2);

        var key = KeyMaterial.fromBytes(blob);

        assertThat(key.cipherKey().getAlgorithm()).isEqualTo("AES");
        assertThat(key.cipherKey().getEncoded()).hasSize(32).containsOnly(1);
        assertThat(key.macKey().getAlgorithm()).isEqualTo("HmacSHA256");
        assertThat(key.macKey().getEncoded()).hasSize(32).containsOnly(2);
        assertThat(key.toByteArray()).isEqualTo(blob);
    }

    @Test
    public void shouldCopyInputBytes() {
        var blob = VersionedCipher.generateKey();
        var key = KeyMaterial.fromBytes(blob);
        var expected = blob.clone();

        Arrays.fill(blob, (byte) 0);

        assertThat(key.toByteArray()).isEqualTo(expected);
    }

    @Test
    public void shouldRejectWrongSizes() {
        assertThatThrownBy(() -> KeyMaterial.fromBytes(new byte[63]))
                .isInstanceOf(InvalidKeySizeException.class)
                .hasMessageContaining("63");
        assertThatThrownBy(() -> KeyMaterial.fromBytes(new byte[65]))
                .isInstanceOfSatisfying(InvalidKeySizeException.class, e -> assertThat(e.actualSize()).isEqualTo(65));
        assertThatThrownBy(() -> KeyMaterial.fromBytes(null)).isInstanceOf(InvalidKeySizeException.class);
    }

    @Test
    public void shouldWipeKeyOnClose() {
        var key = KeyMaterial.generate();
        var cipherKey = (DestroyableSecretKey) key.cipherKey();
        var macKey = (DestroyableSecretKey) key.macKey();

        key.close();

        assertThat(key.isDestroyed()).isTrue();
        assertThat(cipherKey.isDestroyed()).isTrue();
        assertThat(macKey.isDestroyed()).isTrue();
        assertThatThrownBy(key::toByteArray).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(key::cipherKey).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldNotRevealKeyInToString() {
        var key = KeyMaterial.fromBytes(new byte[64]);
        assertThat(key.toString()).isEqualTo("KeyMaterial{destroyed=false}");
    }
}
