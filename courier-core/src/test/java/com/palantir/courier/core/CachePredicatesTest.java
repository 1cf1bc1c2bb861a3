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

package com.palantir.courier.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.courier.RawResponse;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;

public final class CachePredicatesTest {

    @Test
    public void testStatusOk() {
        Predicate<RawResponse> predicate = CachePredicates.statusOk();
        assertThat(predicate.test(response(200))).isTrue();
        assertThat(predicate.test(response(204))).isFalse();
        assertThat(predicate.test(response(404))).isFalse();
    }

    @Test
    public void testSuccessful() {
        Predicate<RawResponse> predicate = CachePredicates.successful();
        assertThat(predicate.test(response(204))).isTrue();
        assertThat(predicate.test(response(304))).isFalse();
    }

    @Test
    public void testNever() {
        assertThat(CachePredicates.never().test(response(200))).isFalse();
    }

    @Test
    public void testStatusOkWithContentType() {
        Predicate<RawResponse> predicate = CachePredicates.statusOkWithContentType("application/json");

        assertThat(predicate.test(response(200, "application/json; charset=UTF-8"))).isTrue();
        assertThat(predicate.test(response(200, "text/html"))).isFalse();
        assertThat(predicate.test(response(200, "not a media type"))).isFalse();
        assertThat(predicate.test(response(200))).isFalse();
        assertThat(predicate.test(response(500, "application/json"))).isFalse();
    }

    private static RawResponse response(int code) {
        return RawResponse.builder().code(code).build();
    }

    private static RawResponse response(int code, String contentType) {
        return RawResponse.builder()
                .code(code)
                .putHeaders("Content-Type", contentType)
                .build();
    }
}
