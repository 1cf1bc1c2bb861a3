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
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Maps;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Identity of a {@link BoundCall}: the descriptor id, the bound parameters sorted by name and the SHA-256 of the
 * body. Headers are not part of the identity. Two calls with equal keys are expected to produce equivalent
 * responses.
 */
public final class CallKey {

    private static final Comparator<Map.Entry<String, String>> BY_NAME = Map.Entry.comparingByKey();

    private final String descriptorId;
    private final ImmutableList<Map.Entry<String, String>> params;
    private final Optional<String> bodySha256;
    private final String digest;

    private CallKey(
            String descriptorId, ImmutableList<Map.Entry<String, String>> params, Optional<String> bodySha256) {
        this.descriptorId = descriptorId;
        this.params = params;
        this.bodySha256 = bodySha256;
        Hasher hasher = Hashing.sha256().newHasher();
        putField(hasher, descriptorId);
        hasher.putInt(params.size());
        for (Map.Entry<String, String> param : params) {
            putField(hasher, param.getKey());
            putField(hasher, param.getValue());
        }
        hasher.putBoolean(bodySha256.isPresent());
        bodySha256.ifPresent(hash -> putField(hasher, hash));
        this.digest = hasher.hash().toString();
    }

    /** Fields are length-prefixed so that no value can be mistaken for a field boundary. */
    private static void putField(Hasher hasher, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        hasher.putInt(bytes.length).putBytes(bytes);
    }

    static CallKey of(
            CallDescriptor<?> descriptor,
            Map<String, String> pathParams,
            ListMultimap<String, String> queryParams,
            Optional<RequestBody> body,
            Optional<String> urlOverride) {
        ImmutableList.Builder<Map.Entry<String, String>> entries = ImmutableList.builder();
        pathParams.forEach((name, value) -> entries.add(Maps.immutableEntry("path:" + name, value)));
        if (urlOverride.isPresent()) {
            entries.add(Maps.immutableEntry("url", urlOverride.get()));
        } else {
            queryParams.forEach((name, value) -> entries.add(Maps.immutableEntry("query:" + name, value)));
        }
        // stable sort keeps repeated query values in their original order
        ImmutableList<Map.Entry<String, String>> sorted =
                entries.build().stream().sorted(BY_NAME).collect(ImmutableList.toImmutableList());
        return new CallKey(descriptor.id(), sorted, body.map(value -> value.sha256().toString()));
    }

    public String descriptorId() {
        return descriptorId;
    }

    /** Bound parameters, namespaced as {@code path:name}, {@code query:name} or {@code url}, sorted by name. */
    public ImmutableList<Map.Entry<String, String>> params() {
        return params;
    }

    public Optional<String> bodySha256() {
        return bodySha256;
    }

    /** Hex SHA-256 over the descriptor id, parameters and body hash, suitable as a file name or remote key. */
    public String digest() {
        return digest;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        CallKey that = (CallKey) other;
        return descriptorId.equals(that.descriptorId)
                && params.equals(that.params)
                && bodySha256.equals(that.bodySha256);
    }

    @Override
    public int hashCode() {
        return Objects.hash(descriptorId, params, bodySha256);
    }

    @Override
    public String toString() {
        // Values are excluded to avoid the risk of logging credentials
        return "CallKey{descriptor=" + descriptorId + ", digest=" + digest() + '}';
    }
}
