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
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.palantir.courier.BindingException;
import com.palantir.courier.BoundCall;
import com.palantir.courier.CallArgs;
import com.palantir.courier.CallDescriptor;
import com.palantir.courier.CallResult;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fans one call descriptor out over a list of values through the {@link Batcher}, one batch per chunk of
 * {@link WalkRequest#batchSize()} values. Results are merged in value order whatever the {@link ChunkDispatch}.
 */
public final class Walker {

    private static final SafeLogger log = SafeLoggerFactory.get(Walker.class);

    private final Batcher batcher;
    private final ChunkDispatch dispatch;

    public Walker(Batcher batcher, ChunkDispatch dispatch) {
        this.batcher = batcher;
        this.dispatch = dispatch;
    }

    /**
     * Walks the request's values. The batch endpoint of the descriptor's API family is checked before any call is
     * made; every other failure is reported against its own value.
     */
    public <T, R> ListenableFuture<List<CallResult<R>>> walk(WalkRequest<T, R> request) {
        batcher.checkConfigured(request.descriptor().apiFamily());
        List<List<String>> chunks = Lists.partition(request.walkValues(), request.batchSize());
        log.debug(
                "Walking descriptor",
                SafeArg.of("descriptor", request.descriptor().id()),
                SafeArg.of("values", request.walkValues().size()),
                SafeArg.of("chunks", chunks.size()),
                SafeArg.of("dispatch", dispatch));
        if (chunks.isEmpty()) {
            return Futures.immediateFuture(ImmutableList.of());
        }
        ListenableFuture<List<List<CallResult<R>>>> chunkResults;
        switch (dispatch) {
            case SEQUENTIAL:
                chunkResults = sequential(request, chunks);
                break;
            case CONCURRENT:
                chunkResults = Futures.allAsList(Lists.transform(chunks, chunk -> runChunk(request, chunk)));
                break;
            default:
                throw new SafeIllegalStateException("Unknown chunk dispatch", SafeArg.of("dispatch", dispatch));
        }
        return Futures.transform(chunkResults, Walker::concat, MoreExecutors.directExecutor());
    }

    private <T, R> ListenableFuture<List<List<CallResult<R>>>> sequential(
            WalkRequest<T, R> request, List<List<String>> chunks) {
        ListenableFuture<List<List<CallResult<R>>>> accumulated = Futures.immediateFuture(new ArrayList<>());
        for (List<String> chunk : chunks) {
            accumulated = Futures.transformAsync(
                    accumulated,
                    done -> Futures.transform(
                            runChunk(request, chunk),
                            results -> {
                                done.add(results);
                                return done;
                            },
                            MoreExecutors.directExecutor()),
                    MoreExecutors.directExecutor());
        }
        return accumulated;
    }

    private <T, R> ListenableFuture<List<CallResult<R>>> runChunk(WalkRequest<T, R> request, List<String> chunk) {
        List<CallResult<R>> results = new ArrayList<>(Collections.nCopies(chunk.size(), null));
        List<BoundCall<T>> calls = new ArrayList<>(chunk.size());
        List<Integer> positions = new ArrayList<>(chunk.size());
        for (int index = 0; index < chunk.size(); index++) {
            try {
                calls.add(bind(request, chunk.get(index)));
                positions.add(index);
            } catch (BindingException e) {
                results.set(index, CallResult.failure(e));
            }
        }
        if (calls.isEmpty()) {
            return Futures.immediateFuture(results);
        }
        return Futures.transform(
                batcher.batchDecoded(calls),
                decoded -> {
                    for (int i = 0; i < decoded.size(); i++) {
                        results.set(positions.get(i), decoded.get(i).map(request.postProcess()));
                    }
                    return results;
                },
                MoreExecutors.directExecutor());
    }

    private static <T> BoundCall<T> bind(WalkRequest<T, ?> request, String value) {
        CallDescriptor<T> descriptor = request.descriptor();
        CallArgs.Builder args = request.fixedArgs().toBuilder();
        if (descriptor.urlTemplate().variables().contains(request.walkParam())) {
            args.putPathParams(request.walkParam(), value);
        } else {
            args.replaceQueryParams(request.walkParam(), ImmutableList.of(value));
        }
        return descriptor.bind(args.build());
    }

    private static <R> List<CallResult<R>> concat(List<List<CallResult<R>>> chunks) {
        ImmutableList.Builder<CallResult<R>> merged = ImmutableList.builder();
        chunks.forEach(merged::addAll);
        return merged.build();
    }

    @Override
    public String toString() {
        return "Walker{dispatch=" + dispatch + '}';
    }
}
