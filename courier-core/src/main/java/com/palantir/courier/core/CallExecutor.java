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
import com.palantir.courier.RawResponse;

/**
 * Issues one call for a {@link BoundCall}.
 *
 * <h4>Behavior</h4>
 * Implementations never throw from {@link #executeRaw(BoundCall)}; failures are reported through the returned
 * future as {@link com.palantir.courier.TransportException}. A response with a non-2xx status is a successful
 * result. Implementations do not retry.
 */
public interface CallExecutor {

    ListenableFuture<RawResponse> executeRaw(BoundCall<?> call);

    /**
     * Executes the call and decodes the response with the call's deserializer. Decoding failures fail the future
     * with {@link com.palantir.courier.DecodeException}.
     */
    default <T> ListenableFuture<T> execute(BoundCall<T> call) {
        return Futures.transform(
                executeRaw(call),
                response -> Calls.decode(call.descriptor(), response),
                MoreExecutors.directExecutor());
    }

    /** Blocking form of {@link #execute(BoundCall)}. */
    default <T> T executeBlocking(BoundCall<T> call) {
        return Calls.getUnchecked(execute(call));
    }
}
