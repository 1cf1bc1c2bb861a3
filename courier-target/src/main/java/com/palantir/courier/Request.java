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
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.net.URL;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;

/** A fully rendered HTTP request, ready to be handed to a {@link Channel}. */
@ThreadSafe
public final class Request {

    private final HttpMethod method;
    private final URL url;
    private final ListMultimap<String, String> headerParams;
    private final Optional<RequestBody> body;
    private final Optional<Duration> timeout;

    private Request(Builder builder) {
        method = builder.method;
        url = builder.url;
        ListMultimap<String, String> headers =
                MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER).arrayListValues(1).build();
        headers.putAll(builder.headerParams);
        headerParams = Multimaps.unmodifiableListMultimap(headers);
        body = builder.body;
        timeout = builder.timeout;
    }

    public HttpMethod method() {
        return method;
    }

    /** The absolute, already encoded URL of this request. */
    public URL url() {
        return url;
    }

    /**
     * The HTTP headers for this request, encoded as a map of {@code header-name: header-value}.
     * Headers names are compared in a case-insensitive fashion as per
     * https://tools.ietf.org/html/rfc7540#section-8.1.2.
     */
    public ListMultimap<String, String> headerParams() {
        return headerParams;
    }

    /** The HTTP request body for this request or empty if this request does not contain a body. */
    public Optional<RequestBody> body() {
        return body;
    }

    /** Upper bound on the time the channel may spend on this exchange, if any. */
    public Optional<Duration> timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "Request{"
                + "method="
                + method
                // Values are excluded to avoid the risk of logging credentials
                + ", headerParamsKeys="
                + headerParams.keySet()
                + ", body="
                + body
                + ", timeout="
                + timeout
                + '}';
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        Request request = (Request) other;
        return method == request.method
                && url.toString().equals(request.url.toString())
                && headerParams.equals(request.headerParams)
                && body.equals(request.body)
                && timeout.equals(request.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, url.toString(), headerParams, body, timeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    @NotThreadSafe
    public static final class Builder {

        @Nullable
        private HttpMethod method;

        @Nullable
        private URL url;

        private final ListMultimap<String, String> headerParams =
                MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER).arrayListValues(1).build();

        private Optional<RequestBody> body = Optional.empty();

        private Optional<Duration> timeout = Optional.empty();

        private Builder() {}

        public Request.Builder from(Request existing) {
            Preconditions.checkNotNull(existing, "Request.builder().from() requires a non-null instance");
            method = existing.method;
            url = existing.url;
            headerParams.clear();
            headerParams.putAll(existing.headerParams);
            body = existing.body;
            timeout = existing.timeout;
            return this;
        }

        public Request.Builder method(HttpMethod value) {
            method = Preconditions.checkNotNull(value, "method");
            return this;
        }

        public Request.Builder url(URL value) {
            url = Preconditions.checkNotNull(value, "url");
            return this;
        }

        public Request.Builder putHeaderParams(String key, String value) {
            Preconditions.checkArgumentNotNull(key, "Header name must not be null");
            Preconditions.checkArgumentNotNull(value, "Header value must not be null");
            headerParams.put(key, value);
            return this;
        }

        public Request.Builder putAllHeaderParams(Multimap<String, ? extends String> entries) {
            entries.forEach(this::putHeaderParams);
            return this;
        }

        public Request.Builder body(RequestBody value) {
            body = Optional.of(Preconditions.checkNotNull(value, "body"));
            return this;
        }

        public Request.Builder body(Optional<RequestBody> value) {
            body = Preconditions.checkNotNull(value, "body");
            return this;
        }

        public Request.Builder timeout(Duration value) {
            Preconditions.checkArgument(
                    !value.isNegative() && !value.isZero(), "timeout must be positive", SafeArg.of("timeout", value));
            timeout = Optional.of(value);
            return this;
        }

        public Request build() {
            Preconditions.checkNotNull(method, "method must be set");
            Preconditions.checkNotNull(url, "url must be set");
            if (body.isPresent() && !method.permitsBody()) {
                throw new SafeIllegalArgumentException(
                        "Request body is not permitted for method", SafeArg.of("method", method));
            }
            return new Request(this);
        }
    }
}
