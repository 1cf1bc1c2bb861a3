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

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Multimaps;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;

/** Concrete argument values supplied when binding a {@link CallDescriptor}. */
@ThreadSafe
public final class CallArgs {

    private static final CallArgs EMPTY = builder().build();

    private final ImmutableMap<String, String> pathParams;
    private final ImmutableListMultimap<String, String> queryParams;
    private final ListMultimap<String, String> headerParams;
    private final Optional<RequestBody> body;

    private CallArgs(Builder builder) {
        this.pathParams = ImmutableMap.copyOf(builder.pathParams);
        this.queryParams = ImmutableListMultimap.copyOf(builder.queryParams);
        ListMultimap<String, String> headers =
                MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER).arrayListValues(1).build();
        headers.putAll(builder.headerParams);
        this.headerParams = Multimaps.unmodifiableListMultimap(headers);
        this.body = builder.body;
    }

    public static CallArgs empty() {
        return EMPTY;
    }

    public Map<String, String> pathParams() {
        return pathParams;
    }

    /** Query parameter values in insertion order. Values are not URL-encoded. */
    public ListMultimap<String, String> queryParams() {
        return queryParams;
    }

    public ListMultimap<String, String> headerParams() {
        return headerParams;
    }

    public Optional<RequestBody> body() {
        return body;
    }

    public Builder toBuilder() {
        return builder().from(this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        CallArgs that = (CallArgs) other;
        return pathParams.equals(that.pathParams)
                && queryParams.equals(that.queryParams)
                && headerParams.equals(that.headerParams)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pathParams, queryParams, headerParams, body);
    }

    @Override
    public String toString() {
        // Values are excluded to avoid the risk of logging credentials
        return "CallArgs{pathParamKeys=" + pathParams.keySet() + ", queryParamKeys=" + queryParams.keySet()
                + ", headerParamKeys=" + headerParams.keySet() + ", body=" + body + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    @NotThreadSafe
    public static final class Builder {

        private final Map<String, String> pathParams = new LinkedHashMap<>();
        private final ListMultimap<String, String> queryParams =
                MultimapBuilder.linkedHashKeys().arrayListValues(1).build();
        private final ListMultimap<String, String> headerParams =
                MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER).arrayListValues(1).build();
        private Optional<RequestBody> body = Optional.empty();

        private Builder() {}

        @CanIgnoreReturnValue
        public Builder from(CallArgs existing) {
            pathParams.clear();
            pathParams.putAll(existing.pathParams);
            queryParams.clear();
            queryParams.putAll(existing.queryParams);
            headerParams.clear();
            headerParams.putAll(existing.headerParams);
            body = existing.body;
            return this;
        }

        @CanIgnoreReturnValue
        public Builder putPathParams(String key, String value) {
            Preconditions.checkArgumentNotNull(key, "Path parameter name must not be null");
            Preconditions.checkArgumentNotNull(value, "Path parameter value must not be null");
            pathParams.put(key, value);
            return this;
        }

        @CanIgnoreReturnValue
        public Builder putAllPathParams(Map<String, String> entries) {
            entries.forEach(this::putPathParams);
            return this;
        }

        @CanIgnoreReturnValue
        public Builder putQueryParams(String key, String value) {
            Preconditions.checkArgumentNotNull(key, "Query parameter name must not be null");
            Preconditions.checkArgumentNotNull(value, "Query parameter value must not be null");
            queryParams.put(key, value);
            return this;
        }

        @CanIgnoreReturnValue
        public Builder putAllQueryParams(Multimap<String, String> entries) {
            entries.forEach(this::putQueryParams);
            return this;
        }

        /** Replaces every value of the named query parameter. */
        @CanIgnoreReturnValue
        public Builder replaceQueryParams(String key, List<String> values) {
            Preconditions.checkArgumentNotNull(key, "Query parameter name must not be null");
            queryParams.removeAll(key);
            values.forEach(value -> putQueryParams(key, value));
            return this;
        }

        @CanIgnoreReturnValue
        public Builder putHeaderParams(String key, String value) {
            Preconditions.checkArgumentNotNull(key, "Header name must not be null");
            Preconditions.checkArgumentNotNull(value, "Header value must not be null");
            Preconditions.checkArgument(
                    !containsLineBreak(key), "Header name must not contain line breaks", SafeArg.of("name", key));
            Preconditions.checkArgument(
                    !containsLineBreak(value), "Header value must not contain line breaks", SafeArg.of("name", key));
            headerParams.put(key, value);
            return this;
        }

        private static boolean containsLineBreak(String value) {
            return value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0;
        }

        @CanIgnoreReturnValue
        public Builder body(RequestBody value) {
            body = Optional.of(Preconditions.checkNotNull(value, "body"));
            return this;
        }

        @CanIgnoreReturnValue
        public Builder body(Optional<RequestBody> value) {
            body = Preconditions.checkNotNull(value, "body");
            return this;
        }

        public CallArgs build() {
            return new CallArgs(this);
        }
    }
}
