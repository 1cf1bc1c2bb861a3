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

import com.google.common.util.concurrent.ListenableFuture;
import com.palantir.courier.BoundCall;
import com.palantir.courier.RawResponse;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.Optional;

/**
 * Entry point wiring the executor, cache, paginator, batcher and walker from one {@link ClientConfig}. Single calls
 * and pages go through the cache when a store is configured; batch envelopes always go to the network, with their
 * parts cached individually.
 */
public final class Courier {

    private static final SafeLogger log = SafeLoggerFactory.get(Courier.class);

    private final ChannelCallExecutor network;
    private final Optional<CachingCallExecutor> cache;
    private final CallExecutor executor;
    private final Paginator paginator;
    private final Batcher batcher;
    private final Walker walker;

    private Courier(
            ChannelCallExecutor network,
            Optional<CachingCallExecutor> cache,
            CallExecutor executor,
            Paginator paginator,
            Batcher batcher,
            Walker walker) {
        this.network = network;
        this.cache = cache;
        this.executor = executor;
        this.paginator = paginator;
        this.batcher = batcher;
        this.walker = walker;
    }

    public static Courier create(ClientConfig config) {
        Preconditions.checkNotNull(config, "config");
        ChannelCallExecutor network = ChannelCallExecutor.create(config);
        Optional<CachingCallExecutor> cache = config.cacheStore()
                .map(store -> CachingCallExecutor.of(
                        network, store, config.cachePredicate(), config.taggedMetricRegistry()));
        CallExecutor executor = cache.<CallExecutor>map(value -> value).orElse(network);
        Batcher batcher =
                new Batcher(network, network.baseUrl(), config.batchEndpoints(), cache, config.taggedMetricRegistry());
        log.debug(
                "Created courier",
                SafeArg.of("caching", cache.isPresent()),
                SafeArg.of("batchFamilies", config.batchEndpoints().keySet()),
                SafeArg.of("chunkDispatch", config.chunkDispatch()));
        return new Courier(
                network,
                cache,
                executor,
                new Paginator(executor),
                batcher,
                new Walker(batcher, config.chunkDispatch()));
    }

    /** The executor for single calls: cached when a store is configured. */
    public CallExecutor executor() {
        return executor;
    }

    /** Bypasses the cache. */
    public CallExecutor networkExecutor() {
        return network;
    }

    public <T> ListenableFuture<T> execute(BoundCall<T> call) {
        return executor.execute(call);
    }

    public ListenableFuture<RawResponse> executeRaw(BoundCall<?> call) {
        return executor.executeRaw(call);
    }

    public Paginator paginator() {
        return paginator;
    }

    public Batcher batcher() {
        return batcher;
    }

    public Walker walker() {
        return walker;
    }

    /** Empties the response store. Does nothing when caching is disabled. */
    public void clearCache() {
        cache.ifPresent(CachingCallExecutor::clear);
    }

    @Override
    public String toString() {
        return "Courier{network=" + network + ", cache=" + cache + '}';
    }
}
