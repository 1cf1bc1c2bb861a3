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

import com.palantir.courier.Channel;
import com.palantir.courier.CredentialSupplier;
import com.palantir.courier.RawResponse;
import com.palantir.logsafe.DoNotLog;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.tritium.metrics.registry.DefaultTaggedMetricRegistry;
import com.palantir.tritium.metrics.registry.TaggedMetricRegistry;
import java.net.URL;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import org.immutables.value.Value;

/** Everything needed to construct a {@link Courier}. */
@DoNotLog
@Value.Immutable
public interface ClientConfig {

    /** Root that call descriptor templates are resolved against. */
    URL baseUrl();

    Channel channel();

    @Value.Default
    default CredentialSupplier credentials() {
        return CredentialSupplier.none();
    }

    /** Applied to every exchange, including batch envelopes. No timeout when empty. */
    Optional<Duration> requestTimeout();

    /** Batch endpoint per API family. Families without an entry cannot be batched. */
    Map<String, URL> batchEndpoints();

    /** Enables response caching when present. */
    Optional<ResponseStore> cacheStore();

    /** Decides which responses are written to the {@link #cacheStore()}. */
    @Value.Default
    default Predicate<RawResponse> cachePredicate() {
        return CachePredicates.statusOk();
    }

    @Value.Default
    default ChunkDispatch chunkDispatch() {
        return ChunkDispatch.SEQUENTIAL;
    }

    @Value.Default
    default TaggedMetricRegistry taggedMetricRegistry() {
        return new DefaultTaggedMetricRegistry();
    }

    @Value.Check
    default void check() {
        requestTimeout().ifPresent(timeout -> Preconditions.checkArgument(
                !timeout.isNegative() && !timeout.isZero(),
                "requestTimeout must be positive",
                SafeArg.of("requestTimeout", timeout)));
        Preconditions.checkArgument(
                isHttp(baseUrl()), "baseUrl must be http or https", SafeArg.of("protocol", baseUrl().getProtocol()));
        batchEndpoints().forEach((family, endpoint) -> Preconditions.checkArgument(
                isHttp(endpoint),
                "batch endpoint must be http or https",
                SafeArg.of("apiFamily", family),
                SafeArg.of("protocol", endpoint.getProtocol())));
    }

    private static boolean isHttp(URL url) {
        return url.getProtocol().equals("http") || url.getProtocol().equals("https");
    }

    static Builder builder() {
        return new Builder();
    }

    final class Builder extends ImmutableClientConfig.Builder {}
}
