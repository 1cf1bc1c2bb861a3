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

import com.palantir.courier.RawResponse;
import java.time.Instant;
import org.immutables.value.Value;

/** A stored response. Entries are replaced, never mutated. */
@Value.Immutable
interface CacheEntry {

    /** Hex digest of the {@link com.palantir.courier.CallKey} the entry was stored under. */
    String keyDigest();

    String descriptorId();

    RawResponse response();

    Instant storedAt();

    static CacheEntry of(String keyDigest, String descriptorId, RawResponse response, Instant storedAt) {
        return ImmutableCacheEntry.builder()
                .keyDigest(keyDigest)
                .descriptorId(descriptorId)
                .response(response)
                .storedAt(storedAt)
                .build();
    }
}
