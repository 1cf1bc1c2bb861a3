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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.net.HttpHeaders;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.exceptions.SafeRuntimeException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link Channel} over the JDK {@link HttpClient}. */
public final class HttpChannel implements Channel {
    private static final Logger log = LoggerFactory.getLogger(HttpChannel.class);

    /** Headers the JDK client sets itself and refuses from callers. */
    private static final Set<String> RESTRICTED_HEADERS = restricted(ImmutableSet.of(
            HttpHeaders.CONNECTION,
            HttpHeaders.CONTENT_LENGTH,
            HttpHeaders.EXPECT,
            HttpHeaders.HOST,
            HttpHeaders.UPGRADE));

    private final HttpClient client;
    private final Duration defaultTimeout;

    private HttpChannel(HttpClient client, Duration defaultTimeout) {
        this.client = client;
        this.defaultTimeout = defaultTimeout;
    }

    public static HttpChannel of(HttpClient client) {
        return new HttpChannel(client, Duration.ofSeconds(30));
    }

    /** Requests without their own timeout use {@code defaultTimeout}. */
    public static HttpChannel of(HttpClient client, Duration defaultTimeout) {
        Preconditions.checkNotNull(client, "client");
        Preconditions.checkNotNull(defaultTimeout, "defaultTimeout");
        return new HttpChannel(client, defaultTimeout);
    }

    @Override
    public ListenableFuture<Response> execute(Request request) {
        HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request);
        } catch (RuntimeException e) {
            return Futures.immediateFailedFuture(e);
        }

        CompletableFuture<HttpResponse<InputStream>> future =
                client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
        SettableFuture<Response> result = SettableFuture.create();
        future.whenComplete((response, throwable) -> {
            if (throwable != null) {
                result.setException(unwrap(throwable));
            } else if (!result.set(toResponse(response))) {
                // the caller cancelled after the exchange completed
                closeQuietly(response.body());
            }
        });
        result.addListener(
                () -> {
                    if (result.isCancelled()) {
                        future.cancel(true);
                    }
                },
                MoreExecutors.directExecutor());
        return result;
    }

    private HttpRequest toHttpRequest(Request request) {
        // Create base request given the URL
        HttpRequest.Builder httpRequest = newRequestBuilder(request.url());

        // Fill request body and set HTTP method
        httpRequest.method(request.method().name(), toBody(request));

        // Fill headers
        request.headerParams().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name)) {
                httpRequest.header(name, value);
            }
        });
        if (request.body().isPresent() && !request.headerParams().containsKey(HttpHeaders.CONTENT_TYPE)) {
            httpRequest.header(HttpHeaders.CONTENT_TYPE, request.body().get().contentType());
        }
        httpRequest.timeout(request.timeout().orElse(defaultTimeout));
        return httpRequest.build();
    }

    private static HttpRequest.Builder newRequestBuilder(URL url) {
        try {
            return HttpRequest.newBuilder().uri(url.toURI());
        } catch (URISyntaxException e) {
            throw new SafeRuntimeException("Failed to construct URI, this is a bug", e);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        if (throwable instanceof CompletionException && throwable.getCause() != null) {
            return throwable.getCause();
        }
        return throwable;
    }

    private static Response toResponse(HttpResponse<InputStream> response) {
        return new Response() {
            @Override
            public InputStream body() {
                return response.body();
            }

            @Override
            public int code() {
                return response.statusCode();
            }

            @Override
            public ListMultimap<String, String> headers() {
                ListMultimap<String, String> headers = MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER)
                        .arrayListValues()
                        .build();
                response.headers().map().forEach(headers::putAll);
                return headers;
            }

            @Override
            public void close() {
                closeQuietly(body());
            }
        };
    }

    private static void closeQuietly(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.warn("Failed to close response", e);
        }
    }

    private static HttpRequest.BodyPublisher toBody(Request request) {
        if (request.body().isPresent()) {
            return HttpRequest.BodyPublishers.ofByteArray(request.body().get().content());
        } else {
            return HttpRequest.BodyPublishers.noBody();
        }
    }

    private static Set<String> restricted(Set<String> names) {
        Set<String> result = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        result.addAll(names);
        return result;
    }

    @Override
    public String toString() {
        return "HttpChannel{defaultTimeout=" + defaultTimeout + '}';
    }
}
