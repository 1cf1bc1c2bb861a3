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

import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Multimaps;
import com.google.common.io.ByteStreams;
import com.google.common.net.HttpHeaders;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A fully buffered HTTP response. This is the unit the cache stores and the batch codec produces; neither inspects
 * the body beyond what is needed to store or split it.
 */
@ThreadSafe
public final class RawResponse {

    private final int code;
    private final ListMultimap<String, String> headers;
    private final byte[] body;

    private RawResponse(int code, ListMultimap<String, String> headers, byte[] body) {
        this.code = code;
        this.headers = headers;
        this.body = body;
    }

    /** Reads the response fully and closes it. */
    public static RawResponse buffer(Response response) throws IOException {
        try (Response closeable = response) {
            return builder()
                    .code(closeable.code())
                    .putAllHeaders(closeable.headers())
                    .body(ByteStreams.toByteArray(closeable.body()))
                    .build();
        }
    }

    public int code() {
        return code;
    }

    /** Case-insensitive view of the response headers. */
    public ListMultimap<String, String> headers() {
        return headers;
    }

    public Optional<String> getFirstHeader(String header) {
        List<String> values = headers.get(header);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public Optional<String> contentType() {
        return getFirstHeader(HttpHeaders.CONTENT_TYPE);
    }

    public boolean isSuccessful() {
        return code / 100 == 2;
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public int contentLength() {
        return body.length;
    }

    public Builder toBuilder() {
        return builder().code(code).putAllHeaders(headers).body(body);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        RawResponse that = (RawResponse) other;
        return code == that.code && headers.equals(that.headers) && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * code + headers.hashCode()) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "RawResponse{code=" + code + ", headerKeys=" + headers.keySet() + ", contentLength=" + body.length
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int code = 200;
        private final ListMultimap<String, String> headers =
                MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER).arrayListValues(1).build();
        private byte[] body = new byte[0];

        private Builder() {}

        @CanIgnoreReturnValue
        public Builder code(int value) {
            Preconditions.checkArgument(value >= 100 && value <= 999, "status code out of range");
            this.code = value;
            return this;
        }

        @CanIgnoreReturnValue
        public Builder putHeaders(String name, String value) {
            headers.put(Preconditions.checkNotNull(name, "name"), Preconditions.checkNotNull(value, "value"));
            return this;
        }

        @CanIgnoreReturnValue
        public Builder putAllHeaders(Multimap<String, String> values) {
            headers.putAll(values);
            return this;
        }

        @CanIgnoreReturnValue
        public Builder body(byte[] value) {
            this.body = Preconditions.checkNotNull(value, "body").clone();
            return this;
        }

        @CanIgnoreReturnValue
        public Builder body(String value) {
            return body(value.getBytes(StandardCharsets.UTF_8));
        }

        public RawResponse build() {
            ListMultimap<String, String> copy =
                    MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER).arrayListValues(1).build();
            copy.putAll(headers);
            return new RawResponse(code, Multimaps.unmodifiableListMultimap(copy), body.clone());
        }
    }
}
