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
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Multimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Immutable description of one API operation: its HTTP method, path template, declared query parameters and the
 * deserializer for its responses. Binding concrete values yields a {@link BoundCall}; the descriptor itself never
 * changes.
 *
 * <p>Descriptors are compared by {@link #id()}, which is also the descriptor component of every {@link CallKey}.
 */
@ThreadSafe
public final class CallDescriptor<T> {

    private final String apiFamily;
    private final String name;
    private final HttpMethod method;
    private final UrlTemplate urlTemplate;
    private final ImmutableMap<String, Optional<String>> queryParams;
    private final Deserializer<T> deserializer;
    private final String id;

    private CallDescriptor(
            String apiFamily,
            String name,
            HttpMethod method,
            UrlTemplate urlTemplate,
            ImmutableMap<String, Optional<String>> queryParams,
            Deserializer<T> deserializer) {
        this.apiFamily = apiFamily;
        this.name = name;
        this.method = method;
        this.urlTemplate = urlTemplate;
        this.queryParams = queryParams;
        this.deserializer = deserializer;
        this.id = apiFamily + ':' + name + ':' + method + ':' + urlTemplate;
    }

    /** The API family this operation belongs to. Calls may only be batched with calls of the same family. */
    public String apiFamily() {
        return apiFamily;
    }

    public String name() {
        return name;
    }

    public HttpMethod method() {
        return method;
    }

    public UrlTemplate urlTemplate() {
        return urlTemplate;
    }

    /** Declared query parameters mapped to their default value; empty means the parameter is required. */
    public Map<String, Optional<String>> queryParams() {
        return queryParams;
    }

    public Deserializer<T> deserializer() {
        return deserializer;
    }

    public String id() {
        return id;
    }

    /**
     * The same operation with a deserializer that returns the response untouched. Raw calls share their cache
     * identity with the decoded descriptor.
     */
    public CallDescriptor<RawResponse> raw() {
        return withDeserializer(Deserializers.raw());
    }

    public <U> CallDescriptor<U> withDeserializer(Deserializer<U> value) {
        return new CallDescriptor<>(apiFamily, name, method, urlTemplate, queryParams, value);
    }

    /**
     * Resolves every placeholder and declared query parameter.
     *
     * @throws BindingException if a placeholder or required query parameter has no value, if a path argument does
     *     not match any placeholder, or if a body is supplied for a method that does not permit one
     */
    public BoundCall<T> bind(CallArgs args) {
        for (String supplied : args.pathParams().keySet()) {
            if (!urlTemplate.variables().contains(supplied)) {
                throw new BindingException(
                        "Path argument does not match any placeholder",
                        SafeArg.of("descriptor", id),
                        SafeArg.of("parameter", supplied));
            }
        }
        ImmutableSortedMap.Builder<String, String> path = ImmutableSortedMap.naturalOrder();
        for (String variable : urlTemplate.variables()) {
            String value = args.pathParams().get(variable);
            if (value == null) {
                throw new BindingException(
                        "Missing value for path placeholder",
                        SafeArg.of("descriptor", id),
                        SafeArg.of("placeholder", variable));
            }
            path.put(variable, value);
        }

        ImmutableListMultimap.Builder<String, String> query = ImmutableListMultimap.builder();
        queryParams.forEach((param, defaultValue) -> {
            List<String> values = args.queryParams().get(param);
            if (!values.isEmpty()) {
                query.putAll(param, values);
            } else if (defaultValue.isPresent()) {
                query.put(param, defaultValue.get());
            } else {
                throw new BindingException(
                        "Missing value for required query parameter",
                        SafeArg.of("descriptor", id),
                        SafeArg.of("parameter", param));
            }
        });
        args.queryParams().forEach((param, value) -> {
            if (!queryParams.containsKey(param)) {
                query.put(param, value);
            }
        });

        if (args.body().isPresent() && !method.permitsBody()) {
            throw new BindingException(
                    "Request body is not permitted for method",
                    SafeArg.of("descriptor", id),
                    SafeArg.of("method", method));
        }
        return new BoundCall<>(this, args, path.build(), query.build(), Optional.empty());
    }

    /** Binds from separate argument maps. */
    public BoundCall<T> bind(
            Map<String, String> pathArgs, Multimap<String, String> queryArgs, Optional<RequestBody> body) {
        return bind(CallArgs.builder()
                .putAllPathParams(pathArgs)
                .putAllQueryParams(queryArgs)
                .body(body)
                .build());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        CallDescriptor<?> that = (CallDescriptor<?>) other;
        return id.equals(that.id) && queryParams.equals(that.queryParams) && deserializer.equals(that.deserializer);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "CallDescriptor{" + id + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        @Nullable
        private String apiFamily;

        @Nullable
        private String name;

        private HttpMethod method = HttpMethod.GET;

        @Nullable
        private UrlTemplate urlTemplate;

        private final Map<String, Optional<String>> queryParams = new LinkedHashMap<>();

        private Builder() {}

        @CanIgnoreReturnValue
        public Builder apiFamily(String value) {
            this.apiFamily = Preconditions.checkNotNull(value, "apiFamily");
            return this;
        }

        @CanIgnoreReturnValue
        public Builder name(String value) {
            this.name = Preconditions.checkNotNull(value, "name");
            return this;
        }

        @CanIgnoreReturnValue
        public Builder method(HttpMethod value) {
            this.method = Preconditions.checkNotNull(value, "method");
            return this;
        }

        @CanIgnoreReturnValue
        public Builder path(String template) {
            this.urlTemplate = UrlTemplate.parse(template);
            return this;
        }

        @CanIgnoreReturnValue
        public Builder requiredQueryParam(String param) {
            queryParams.put(Preconditions.checkNotNull(param, "param"), Optional.empty());
            return this;
        }

        @CanIgnoreReturnValue
        public Builder queryParam(String param, String defaultValue) {
            queryParams.put(
                    Preconditions.checkNotNull(param, "param"),
                    Optional.of(Preconditions.checkNotNull(defaultValue, "defaultValue")));
            return this;
        }

        public <T> CallDescriptor<T> build(Deserializer<T> deserializer) {
            Preconditions.checkNotNull(apiFamily, "apiFamily must be set");
            Preconditions.checkNotNull(name, "name must be set");
            Preconditions.checkNotNull(urlTemplate, "path must be set");
            Preconditions.checkNotNull(deserializer, "deserializer");
            for (String param : queryParams.keySet()) {
                Preconditions.checkArgument(
                        !urlTemplate.variables().contains(param),
                        "Query parameter shadows a path placeholder",
                        SafeArg.of("parameter", param));
            }
            return new CallDescriptor<>(
                    apiFamily, name, method, urlTemplate, ImmutableMap.copyOf(queryParams), deserializer);
        }
    }
}
