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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.palantir.courier.BatchPartException;
import com.palantir.courier.BindingException;
import com.palantir.courier.BoundCall;
import com.palantir.courier.CallArgs;
import com.palantir.courier.CallDescriptor;
import com.palantir.courier.CallResult;
import com.palantir.courier.ConfigurationException;
import com.palantir.courier.Deserializers;
import com.palantir.courier.HttpMethod;
import com.palantir.courier.RawResponse;
import com.palantir.courier.RequestBody;
import com.palantir.courier.TransportException;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.tritium.metrics.registry.TaggedMetricRegistry;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sends many independent calls as one {@code multipart/mixed} request to their API family's batch endpoint and
 * splits the combined response back into per-call results, in input order.
 *
 * <p>Configuration problems are thrown before anything is sent. Every other failure is reported per item: a failed
 * envelope fails each item with the same {@link TransportException}, and a missing or malformed part fails only its
 * own item with a {@link BatchPartException}.
 */
public final class Batcher {

    private static final SafeLogger log = SafeLoggerFactory.get(Batcher.class);

    private final CallExecutor network;
    private final BaseUrl baseUrl;
    private final ImmutableMap<String, URL> batchEndpoints;
    private final Optional<CachingCallExecutor> cache;
    private final CourierMetrics metrics;

    Batcher(
            CallExecutor network,
            BaseUrl baseUrl,
            Map<String, URL> batchEndpoints,
            Optional<CachingCallExecutor> cache,
            TaggedMetricRegistry registry) {
        this.network = network;
        this.baseUrl = baseUrl;
        this.batchEndpoints = ImmutableMap.copyOf(batchEndpoints);
        this.cache = cache;
        this.metrics = new CourierMetrics(registry);
    }

    /**
     * Executes the calls in a single round trip. The returned list has one entry per call, in input order.
     *
     * @throws ConfigurationException if {@code calls} is empty, spans several API families, or targets a family
     *     without a configured batch endpoint
     */
    public ListenableFuture<List<CallResult<RawResponse>>> batch(List<? extends BoundCall<?>> calls) {
        String apiFamily = checkBatchable(calls);
        URL endpoint = endpoint(apiFamily);

        List<CallResult<RawResponse>> results = new ArrayList<>(Collections.nCopies(calls.size(), null));
        List<MultipartBatchCodec.Part> parts = new ArrayList<>(calls.size());
        for (int index = 0; index < calls.size(); index++) {
            BoundCall<?> call = calls.get(index);
            Optional<RawResponse> cached = cache.flatMap(executor -> executor.lookup(call.key()));
            if (cached.isPresent()) {
                results.set(index, CallResult.success(cached.get()));
                continue;
            }
            try {
                parts.add(new MultipartBatchCodec.Part(index, call, baseUrl.renderRequestTarget(call)));
            } catch (BindingException e) {
                results.set(index, CallResult.failure(e));
            }
        }

        log.debug(
                "Dispatching batch",
                SafeArg.of("apiFamily", apiFamily),
                SafeArg.of("calls", calls.size()),
                SafeArg.of("parts", parts.size()));
        if (parts.isEmpty()) {
            return Futures.immediateFuture(Collections.unmodifiableList(results));
        }

        String boundary = MultipartBatchCodec.newBoundary();
        BoundCall<RawResponse> envelope = envelopeCall(apiFamily, MultipartBatchCodec.encode(parts, boundary))
                .withUrl(endpoint.toString());
        metrics.batchRequests(apiFamily).inc();

        ListenableFuture<CallResult<RawResponse>> succeeded =
                Futures.transform(network.executeRaw(envelope), CallResult::success, MoreExecutors.directExecutor());
        ListenableFuture<CallResult<RawResponse>> outcome =
                Futures.catching(succeeded, Throwable.class, CallResult::failure, MoreExecutors.directExecutor());
        return Futures.transform(
                outcome,
                result -> demultiplex(apiFamily, calls, parts, result, results),
                MoreExecutors.directExecutor());
    }

    /** As {@link #batch(List)}, with each successful part decoded through its call's descriptor. */
    public <T> ListenableFuture<List<CallResult<T>>> batchDecoded(List<BoundCall<T>> calls) {
        return Futures.transform(
                batch(calls),
                results -> {
                    ImmutableList.Builder<CallResult<T>> decoded = ImmutableList.builderWithExpectedSize(calls.size());
                    for (int index = 0; index < results.size(); index++) {
                        CallDescriptor<T> descriptor = calls.get(index).descriptor();
                        decoded.add(results.get(index).map(response -> Calls.decode(descriptor, response)));
                    }
                    return decoded.build();
                },
                MoreExecutors.directExecutor());
    }

    /** Throws {@link ConfigurationException} unless calls of the family can be batched. */
    void checkConfigured(String apiFamily) {
        endpoint(apiFamily);
    }

    private URL endpoint(String apiFamily) {
        URL endpoint = batchEndpoints.get(apiFamily);
        if (endpoint == null) {
            throw new ConfigurationException(
                    "No batch endpoint configured for API family",
                    SafeArg.of("apiFamily", apiFamily),
                    SafeArg.of("configuredFamilies", batchEndpoints.keySet()));
        }
        return endpoint;
    }

    private static String checkBatchable(List<? extends BoundCall<?>> calls) {
        if (calls == null || calls.isEmpty()) {
            throw new ConfigurationException("Cannot batch an empty list of calls");
        }
        String apiFamily = calls.get(0).descriptor().apiFamily();
        for (BoundCall<?> call : calls) {
            if (!call.descriptor().apiFamily().equals(apiFamily)) {
                throw new ConfigurationException(
                        "A batch may only contain calls of a single API family",
                        SafeArg.of("apiFamily", apiFamily),
                        SafeArg.of("otherApiFamily", call.descriptor().apiFamily()));
            }
        }
        return apiFamily;
    }

    private static BoundCall<RawResponse> envelopeCall(String apiFamily, RequestBody body) {
        CallDescriptor<RawResponse> descriptor = CallDescriptor.builder()
                .apiFamily(apiFamily)
                .name("batch")
                .method(HttpMethod.POST)
                .path("/batch")
                .build(Deserializers.raw());
        return descriptor.bind(CallArgs.builder().body(body).build());
    }

    private List<CallResult<RawResponse>> demultiplex(
            String apiFamily,
            List<? extends BoundCall<?>> calls,
            List<MultipartBatchCodec.Part> parts,
            CallResult<RawResponse> envelope,
            List<CallResult<RawResponse>> results) {
        if (!envelope.isSuccess()) {
            TransportException failure = TransportException.from(envelope.failure().get());
            log.debug("Batch envelope failed", SafeArg.of("apiFamily", apiFamily), failure);
            for (MultipartBatchCodec.Part part : parts) {
                results.set(part.index(), CallResult.failure(failure));
            }
            metrics.batchParts(apiFamily, "failure").inc(parts.size());
            return Collections.unmodifiableList(results);
        }

        RawResponse response = envelope.get();
        Optional<String> boundary = MultipartBatchCodec.boundary(response);
        Map<Integer, CallResult<RawResponse>> decoded =
                boundary.map(value -> MultipartBatchCodec.decode(response.body(), value)).orElseGet(Map::of);
        if (boundary.isEmpty()) {
            log.debug(
                    "Batch response was not multipart",
                    SafeArg.of("apiFamily", apiFamily),
                    SafeArg.of("status", response.code()));
        }

        for (MultipartBatchCodec.Part part : parts) {
            int index = part.index();
            CallResult<RawResponse> result = decoded.get(index);
            if (result == null) {
                result = CallResult.failure(boundary.isPresent()
                        ? new BatchPartException(
                                "Batch response is missing a part", index, null, SafeArg.of("status", response.code()))
                        : new BatchPartException(
                                "Batch response was not multipart",
                                index,
                                null,
                                SafeArg.of("status", response.code())));
            }
            if (result.isSuccess()) {
                metrics.batchParts(apiFamily, "success").inc();
                RawResponse partResponse = result.get();
                cache.ifPresent(executor -> executor.offer(calls.get(index).key(), partResponse));
            } else {
                metrics.batchParts(apiFamily, "failure").inc();
            }
            results.set(index, result);
        }
        return Collections.unmodifiableList(results);
    }

    @Override
    public String toString() {
        return "Batcher{batchEndpoints=" + batchEndpoints.keySet() + '}';
    }
}
