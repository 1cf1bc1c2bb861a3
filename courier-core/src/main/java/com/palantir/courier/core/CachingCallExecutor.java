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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.palantir.courier.BoundCall;
import com.palantir.courier.CallKey;
import com.palantir.courier.RawResponse;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.tritium.metrics.registry.TaggedMetricRegistry;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Memoizes successful exchanges of a delegate {@link CallExecutor} in a {@link ResponseStore}. A stored response is
 * returned without touching the network; a fresh one is stored when the cache predicate accepts it. Failed futures
 * are never stored.
 */
public final class CachingCallExecutor implements CallExecutor {

    private static final SafeLogger log = SafeLoggerFactory.get(CachingCallExecutor.class);

    private final CallExecutor delegate;
    private final ResponseStore store;
    private final Predicate<RawResponse> predicate;
    private final CourierMetrics metrics;

    private CachingCallExecutor(
            CallExecutor delegate, ResponseStore store, Predicate<RawResponse> predicate, CourierMetrics metrics) {
        this.delegate = delegate;
        this.store = store;
        this.predicate = predicate;
        this.metrics = metrics;
    }

    public static CachingCallExecutor of(
            CallExecutor delegate,
            ResponseStore store,
            Predicate<RawResponse> predicate,
            TaggedMetricRegistry registry) {
        return new CachingCallExecutor(
                Preconditions.checkNotNull(delegate, "delegate"),
                Preconditions.checkNotNull(store, "store"),
                Preconditions.checkNotNull(predicate, "predicate"),
                new CourierMetrics(Preconditions.checkNotNull(registry, "registry")));
    }

    @Override
    public ListenableFuture<RawResponse> executeRaw(BoundCall<?> call) {
        CallKey key = call.key();
        Optional<RawResponse> cached = lookup(key);
        if (cached.isPresent()) {
            return Futures.immediateFuture(cached.get());
        }
        return Futures.transform(
                delegate.executeRaw(call), response -> offer(key, response), MoreExecutors.directExecutor());
    }

    /** Returns the stored response for the key, counting the hit or miss. Store failures count as misses. */
    Optional<RawResponse> lookup(CallKey key) {
        Optional<RawResponse> cached;
        try {
            cached = store.get(key);
        } catch (RuntimeException e) {
            log.warn(
                    "Response store lookup failed, treating as a miss",
                    SafeArg.of("descriptor", key.descriptorId()),
                    e);
            cached = Optional.empty();
        }
        if (cached.isPresent()) {
            metrics.cacheHit().inc();
            log.debug("Cache hit", SafeArg.of("descriptor", key.descriptorId()));
        } else {
            metrics.cacheMiss().inc();
            log.debug("Cache miss", SafeArg.of("descriptor", key.descriptorId()));
        }
        return cached;
    }

    /** Stores the response if the predicate accepts it. Always returns the response unchanged. */
    RawResponse offer(CallKey key, RawResponse response) {
        boolean cacheable;
        try {
            cacheable = predicate.test(response);
        } catch (RuntimeException e) {
            log.warn(
                    "Cache predicate failed, response will not be stored",
                    SafeArg.of("descriptor", key.descriptorId()),
                    SafeArg.of("status", response.code()),
                    e);
            return response;
        }
        if (cacheable) {
            try {
                store.put(key, response);
                metrics.cacheStore().inc();
            } catch (RuntimeException e) {
                log.warn("Response store write failed", SafeArg.of("descriptor", key.descriptorId()), e);
            }
        }
        return response;
    }

    /** Empties the underlying store. */
    public void clear() {
        store.clear();
    }

    ResponseStore store() {
        return store;
    }

    @Override
    public String toString() {
        return "CachingCallExecutor{delegate=" + delegate + ", store=" + store + '}';
    }
}
