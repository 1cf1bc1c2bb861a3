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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ListMultimap;
import com.palantir.logsafe.Preconditions;
import java.util.Map;
import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A {@link CallDescriptor} with every parameter resolved, ready to be executed. Instances are produced by
 * {@link CallDescriptor#bind(CallArgs)} and re-binding always yields a new instance.
 */
@ThreadSafe
public final class BoundCall<T> {

    private final CallDescriptor<T> descriptor;
    private final CallArgs args;
    private final ImmutableSortedMap<String, String> pathParams;
    private final ImmutableListMultimap<String, String> queryParams;
    private final Optional<String> urlOverride;
    private final CallKey key;

    BoundCall(
            CallDescriptor<T> descriptor,
            CallArgs args,
            ImmutableSortedMap<String, String> pathParams,
            ImmutableListMultimap<String, String> queryParams,
            Optional<String> urlOverride) {
        this.descriptor = descriptor;
        this.args = args;
        this.pathParams = pathParams;
        this.queryParams = queryParams;
        this.urlOverride = urlOverride;
        this.key = CallKey.of(descriptor, pathParams, queryParams, args.body(), urlOverride);
    }

    public CallDescriptor<T> descriptor() {
        return descriptor;
    }

    /** The arguments this call was bound from. */
    public CallArgs args() {
        return args;
    }

    public Map<String, String> pathParams() {
        return pathParams;
    }

    /** Declared query parameters (with defaults applied) followed by pass-through parameters. */
    public ListMultimap<String, String> queryParams() {
        return queryParams;
    }

    public ListMultimap<String, String> headerParams() {
        return args.headerParams();
    }

    public Optional<RequestBody> body() {
        return args.body();
    }

    /**
     * An absolute URL that replaces the rendered template and query, as handed out by servers for next-page
     * links.
     */
    public Optional<String> urlOverride() {
        return urlOverride;
    }

    /** Identity of this call for caching purposes. */
    public CallKey key() {
        return key;
    }

    /** Renders the path and query of this call. Has no effect on calls with a {@link #urlOverride()}. */
    public void renderPath(UrlBuilder url) {
        descriptor.urlTemplate().fill(pathParams, url);
        queryParams.forEach(url::queryParam);
    }

    /** The same call addressed to an absolute URL. */
    public BoundCall<T> withUrl(String absoluteUrl) {
        Preconditions.checkNotNull(absoluteUrl, "absoluteUrl");
        return new BoundCall<>(descriptor, args, pathParams, queryParams, Optional.of(absoluteUrl));
    }

    /**
     * Re-binds the descriptor with one parameter changed. Names matching a path placeholder replace the path value;
     * any other name replaces every value of that query parameter. Drops any {@link #urlOverride()}.
     */
    public BoundCall<T> withParam(String name, String value) {
        CallArgs.Builder builder = args.toBuilder();
        if (descriptor.urlTemplate().variables().contains(name)) {
            builder.putPathParams(name, value);
        } else {
            builder.replaceQueryParams(name, ImmutableList.of(value));
        }
        return descriptor.bind(builder.build());
    }

    /** The same call decoded with {@link Deserializers#raw()}. */
    public BoundCall<RawResponse> raw() {
        return new BoundCall<>(descriptor.raw(), args, pathParams, queryParams, urlOverride);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        BoundCall<?> that = (BoundCall<?>) other;
        return key.equals(that.key) && args.headerParams().equals(that.args.headerParams());
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return "BoundCall{descriptor=" + descriptor.id() + ", args=" + args + ", hasUrlOverride="
                + urlOverride.isPresent() + '}';
    }
}
