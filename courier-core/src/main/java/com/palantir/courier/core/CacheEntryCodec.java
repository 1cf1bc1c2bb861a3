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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multimaps;
import com.palantir.courier.RawResponse;
import com.palantir.logsafe.Preconditions;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** JSON form of a {@link CacheEntry}, shared by the persistent stores. Bodies are written as base64. */
final class CacheEntryCodec {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private CacheEntryCodec() {}

    static byte[] serialize(CacheEntry entry) throws IOException {
        RawResponse response = entry.response();
        ImmutableMap.Builder<String, List<String>> headers = ImmutableMap.builder();
        Multimaps.asMap(response.headers()).forEach((name, values) -> headers.put(name, ImmutableList.copyOf(values)));
        return MAPPER.writeValueAsBytes(new StoredEntry(
                entry.keyDigest(),
                entry.descriptorId(),
                response.code(),
                headers.build(),
                response.body(),
                entry.storedAt().toEpochMilli()));
    }

    static CacheEntry deserialize(byte[] bytes) throws IOException {
        StoredEntry stored = MAPPER.readValue(bytes, StoredEntry.class);
        RawResponse.Builder response = RawResponse.builder().code(stored.code).body(stored.body);
        stored.headers.forEach((name, values) -> values.forEach(value -> response.putHeaders(name, value)));
        return CacheEntry.of(
                stored.keyDigest, stored.descriptorId, response.build(), Instant.ofEpochMilli(stored.storedAtMillis));
    }

    static final class StoredEntry {
        @JsonProperty("keyDigest")
        private final String keyDigest;

        @JsonProperty("descriptorId")
        private final String descriptorId;

        @JsonProperty("code")
        private final int code;

        @JsonProperty("headers")
        private final Map<String, List<String>> headers;

        @JsonProperty("body")
        private final byte[] body;

        @JsonProperty("storedAtMillis")
        private final long storedAtMillis;

        @JsonCreator
        StoredEntry(
                @JsonProperty("keyDigest") String keyDigest,
                @JsonProperty("descriptorId") String descriptorId,
                @JsonProperty("code") int code,
                @JsonProperty("headers") Map<String, List<String>> headers,
                @JsonProperty("body") byte[] body,
                @JsonProperty("storedAtMillis") long storedAtMillis) {
            this.keyDigest = Preconditions.checkNotNull(keyDigest, "keyDigest");
            this.descriptorId = Preconditions.checkNotNull(descriptorId, "descriptorId");
            this.code = code;
            this.headers = headers == null ? ImmutableMap.of() : headers;
            this.body = body == null ? new byte[0] : body;
            this.storedAtMillis = storedAtMillis;
        }
    }
}
