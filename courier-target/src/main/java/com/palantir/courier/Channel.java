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

import com.google.common.util.concurrent.ListenableFuture;

/**
 * A channel is the transport collaborator: it performs exactly one HTTP exchange for a fully rendered
 * {@link Request}.
 *
 * <h4>Threading Model</h4>
 * Implementations of {@link Channel#execute(Request)} must return immediately, and must not perform blocking
 * operations. Channel implementations using blocking constructs must internally leverage an executor to expose only
 * a non-blocking API.
 *
 * <h4>Behavior</h4>
 * Implementations of {@link Channel#execute(Request)} must never throw. A failed {@link ListenableFuture} must be
 * returned instead. Responses with a non-2xx status are successful futures. Cancelling the returned future should
 * abort the exchange.
 */
public interface Channel {
    ListenableFuture<Response> execute(Request request);
}
