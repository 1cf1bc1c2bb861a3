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
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.palantir.logsafe.Preconditions;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A scripted {@link Channel}: every request is recorded and answered by a handler. A handler throwing
 * {@link UncheckedIOException} simulates a network failure with the wrapped {@link java.io.IOException}.
 */
public final class StubChannel implements Channel {

    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile Function<Request, Response> handler = _request -> new TestResponse().code(404);

    @Nullable
    private volatile Throwable failure;

    public static StubChannel respondingWith(Function<Request, Response> handler) {
        StubChannel channel = new StubChannel();
        channel.setHandler(handler);
        return channel;
    }

    /** Answers every request with a fresh 200 response carrying {@code body}. */
    public static StubChannel alwaysOk(String body) {
        return respondingWith(_request -> TestResponse.withBody(body).code(200));
    }

    /** Fails every request with {@code failure}, as a transport that never reaches the server. */
    public static StubChannel failingWith(Throwable failure) {
        StubChannel channel = new StubChannel();
        channel.failure = failure;
        return channel;
    }

    public void setHandler(Function<Request, Response> value) {
        this.handler = Preconditions.checkNotNull(value, "handler");
    }

    @Override
    public ListenableFuture<Response> execute(Request request) {
        calls.incrementAndGet();
        requests.add(request);
        Throwable scriptedFailure = failure;
        if (scriptedFailure != null) {
            return Futures.immediateFailedFuture(scriptedFailure);
        }
        try {
            return Futures.immediateFuture(handler.apply(request));
        } catch (UncheckedIOException e) {
            return Futures.immediateFailedFuture(e.getCause());
        } catch (RuntimeException e) {
            return Futures.immediateFailedFuture(e);
        }
    }

    public int callCount() {
        return calls.get();
    }

    public List<Request> requests() {
        return ImmutableList.copyOf(requests);
    }

    public Request lastRequest() {
        Preconditions.checkState(!requests.isEmpty(), "No requests recorded");
        return requests.get(requests.size() - 1);
    }
}
