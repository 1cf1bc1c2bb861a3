/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
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

package com.palantir.courier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

public final class DeserializersTest {

    @Test
    public void testRawPassesEverythingThrough() {
        RawResponse response = RawResponse.builder().code(503).body("unavailable").build();
        assertThat(Deserializers.raw().deserialize(response)).isSameAs(response);
    }

    @Test
    public void testUtf8() {
        RawResponse response = RawResponse.builder().body("héllo").build();
        assertThat(Deserializers.utf8().deserialize(response)).isEqualTo("héllo");
    }

    @Test
    public void testUnsuccessfulStatusFails() {
        RawResponse response = RawResponse.builder().code(404).body("missing").build();
        assertThatThrownBy(() -> Deserializers.utf8().deserialize(response))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("404");
    }

    @Test
    public void testDecoderFailureBecomesDecodeException() {
        Deserializer<Integer> number = Deserializers.successful(response -> Integer.parseInt(response.bodyAsString()));
        RawResponse response = RawResponse.builder().body("not a number").build();
        assertThatThrownBy(() -> number.deserialize(response))
                .isInstanceOf(DecodeException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    public void testEmpty() {
        assertThat(Deserializers.empty().deserialize(RawResponse.builder().code(204).build()))
                .isNull();
    }
}
