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

import com.google.common.net.HttpHeaders;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.palantir.courier.BoundCall;
import com.palantir.courier.Channel;
import com.palantir.courier.CourierException;
import com.palantir.courier.CredentialSupplier;
import com.palantir.courier.RawResponse;
import com.palantir.courier.Request;
import com.palantir.courier.Response;
import com.palantir.courier.TransportException;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The network {@link CallExecutor}: renders a call into a {@link Request}, attaches credentials and performs
 * exactly one exchange on the underlying {@link Channel}. Responses are buffered and closed before they are
 * returned.
 */
final class ChannelCallExecutor implements CallExecutor {

    private static final SafeLogger log = SafeLoggerFactory.get(ChannelCallExecutor.class);

    private final Channel channel;
    private final BaseUrl baseUrl;
    private final CredentialSupplier credentials;
    private final Optional<Duration> timeout;
    private final ScheduledExecutorService scheduler;

    ChannelCallExecutor(
            Channel channel,
            BaseUrl baseUrl,
            CredentialSupplier credentials,
            Optional<Duration> timeout,
            ScheduledExecutorService scheduler) {
        this.channel = channel;
        this.baseUrl = baseUrl;
        this.credentials = credentials;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    static ChannelCallExecutor create(ClientConfig config) {
        return new ChannelCallExecutor(
                config.channel(),
                BaseUrl.of(config.baseUrl()),
                config.credentials(),
                config.requestTimeout(),
                CourierExecutors.timeoutScheduler.get());
    }

    BaseUrl baseUrl() {
        return baseUrl;
    }

    @Override
    public ListenableFuture<RawResponse> executeRaw(BoundCall<?> call) {
        Request request;
        try {
            request = toRequest(call);
        } catch (CourierException e) {
            return Futures.immediateFailedFuture(e);
        } catch (UncheckedIOException e) {
            return Futures.immediateFailedFuture(TransportException.from(e.getCause()));
        } catch (RuntimeException e) {
            return Futures.immediateFailedFuture(TransportException.from(e));
        }

        if (log.isDebugEnabled()) {
            log.debug(
                    "Executing call",
                    SafeArg.of("descriptor", call.descriptor().id()),
                    SafeArg.of("method", request.method()),
                    UnsafeArg.of("url", request.url()));
        }

        ListenableFuture<Response> response;
        try {
            response = channel.execute(request);
        } catch (RuntimeException e) {
            // channels must not throw, but a misbehaving one must not escape either
            return Futures.immediateFailedFuture(TransportException.from(e));
        }
        if (timeout.isPresent()) {
            response = Futures.withTimeout(response, timeout.get(), scheduler);
        }
        ListenableFuture<RawResponse> buffered =
                Futures.transform(response, ChannelCallExecutor::buffer, MoreExecutors.directExecutor());
        return Futures.catchingAsync(
                buffered,
                Throwable.class,
                throwable -> Futures.immediateFailedFuture(TransportException.from(throwable)),
                MoreExecutors.directExecutor());
    }

    private Request toRequest(BoundCall<?> call) {
        Request.Builder builder = Request.builder()
                .method(call.descriptor().method())
                .url(baseUrl.render(call))
                .putAllHeaderParams(call.headerParams())
                .body(call.body());
        credentials
                .bearerToken()
                .ifPresent(token -> builder.putHeaderParams(HttpHeaders.AUTHORIZATION, "Bearer " + token));
        timeout.ifPresent(builder::timeout);
        return builder.build();
    }

    private static RawResponse buffer(Response response) {
        try {
            return RawResponse.buffer(response);
        } catch (IOException e) {
            throw new TransportException("Failed to read response body", true, e);
        }
    }

    @Override
    public String toString() {
        return "ChannelCallExecutor{channel=" + channel + ", baseUrl=" + baseUrl + ", timeout=" + timeout + '}';
    }
}
