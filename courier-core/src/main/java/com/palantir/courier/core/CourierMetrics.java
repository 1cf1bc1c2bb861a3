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

import com.codahale.metrics.Counter;
import com.palantir.tritium.metrics.registry.MetricName;
import com.palantir.tritium.metrics.registry.TaggedMetricRegistry;

/** Metrics emitted by the cache layer and the batcher. */
final class CourierMetrics {

    private final TaggedMetricRegistry registry;

    CourierMetrics(TaggedMetricRegistry registry) {
        this.registry = registry;
    }

    /** Calls answered from the response store without a network exchange. */
    Counter cacheHit() {
        return registry.counter(name("courier.cache.hit"));
    }

    /** Calls that were not found in the response store. */
    Counter cacheMiss() {
        return registry.counter(name("courier.cache.miss"));
    }

    /** Responses accepted by the cache predicate and written to the store. */
    Counter cacheStore() {
        return registry.counter(name("courier.cache.store"));
    }

    /** Batch envelopes sent, tagged by API family. */
    Counter batchRequests(String apiFamily) {
        return registry.counter(MetricName.builder()
                .safeName("courier.batch.requests")
                .putSafeTags("apiFamily", apiFamily)
                .build());
    }

    /** Individual batch parts, tagged by API family and outcome. */
    Counter batchParts(String apiFamily, String outcome) {
        return registry.counter(MetricName.builder()
                .safeName("courier.batch.parts")
                .putSafeTags("apiFamily", apiFamily)
                .putSafeTags("outcome", outcome)
                .build());
    }

    private static MetricName name(String safeName) {
        return MetricName.builder().safeName(safeName).build();
    }
}
