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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.palantir.courier.BoundCall;
import com.palantir.courier.CallArgs;
import com.palantir.courier.CallDescriptor;
import com.palantir.courier.Channel;
import com.palantir.courier.CredentialSupplier;
import com.palantir.courier.DecodeException;
import com.palantir.courier.Deserializers;
import com.palantir.courier.HttpMethod;
import com.palantir.courier.RawResponse;
import com.palantir.courier.Request;
import com.palantir.courier.RequestBody;
import com.palantir.courier.Response;
import com.palantir.courier.StubChannel;
import com.palantir.courier.TestResponse;
import com.palantir.courier.TransportException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public final class ChannelCallExecutorTest {

    private static final CallDescriptor<String> GET = CallDescriptor.builder()
            .apiFamily("gmail")
            .name("labels.get")
            .path("/gmail/v1/users/{userId}/labels/{id}")
            .build(Deserializers.utf8());

    private static final BoundCall<String> CALL = GET.bind(CallArgs.builder()
            .putPathParams("userId", "me")
            .putPathParams("id", "INBOX")
            .putHeaderParams("X-Goog-User-Project", "project")
            .build());

    @Mock
    private Channel channel;

    @Test
    public void testBuildsRequest() throws Exception {
        StubChannel stub = StubChannel.alwaysOk("\"label\"");
        ChannelCallExecutor executor = executor(stub, CredentialSupplier.of("token"), Optional.empty());

        assertThat(executor.execute(CALL).get()).isEqualTo("\"label\"");
        Request request = stub.lastRequest();
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().toString()).isEqualTo("https://gmail.googleapis.com/gmail/v1/users/me/labels/INBOX");
        assertThat(request.headerParams().get("authorization")).containsExactly("Bearer token");
        assertThat(request.headerParams().get("x-goog-user-project")).containsExactly("project");
        assertThat(request.timeout()).isEmpty();
    }

    @Test
    public void testCallWithHeaderReachesTransport() {
        StubChannel stub = StubChannel.alwaysOk("ok");
        BoundCall<String> call = GET.bind(CallArgs.builder()
                .putPathParams("userId", "me")
                .putPathParams("id", "INBOX")
                .putHeaderParams("X-Goog-User-Project", "p")
                .putHeaderParams("X-Goog-Request-Reason", "audit")
                .build());

        assertThat(Calls.getUnchecked(TestExecutors.network(stub).execute(call)))
                .isEqualTo("ok");
        assertThat(stub.callCount()).isEqualTo(1);
        assertThat(stub.lastRequest().headerParams().get("X-GOOG-USER-PROJECT"))
                .containsExactly("p");
        assertThat(stub.lastRequest().headerParams().get("x-goog-request-reason"))
                .containsExactly("audit");
    }

    @Test
    public void testNoCredentials() throws Exception {
        StubChannel stub = StubChannel.alwaysOk("{}");
        executor(stub, CredentialSupplier.none(), Optional.of(Duration.ofSeconds(5)))
                .executeRaw(CALL)
                .get();
        assertThat(stub.lastRequest().headerParams().containsKey("Authorization")).isFalse();
        assertThat(stub.lastRequest().timeout()).hasValue(Duration.ofSeconds(5));
    }

    @Test
    public void testSendsBody() throws Exception {
        CallDescriptor<RawResponse> post = CallDescriptor.builder()
                .apiFamily("gmail")
                .name("labels.create")
                .method(HttpMethod.POST)
                .path("/gmail/v1/users/{userId}/labels")
                .build(Deserializers.raw());
        StubChannel stub = StubChannel.alwaysOk("{}");
        executor(stub, CredentialSupplier.none(), Optional.empty())
                .executeRaw(post.bind(CallArgs.builder()
                        .putPathParams("userId", "me")
                        .body(RequestBody.ofString("{\"name\":\"x\"}", "application/json"))
                        .build()))
                .get();
        assertThat(stub.lastRequest().body()).hasValueSatisfying(body -> {
            assertThat(body.contentType()).isEqualTo("application/json");
        });
    }

    @Test
    public void testUnsuccessfulResponsesAreReturned() throws Exception {
        TestResponse response = TestResponse.withBody("{\"error\":\"nope\"}").code(403);
        StubChannel stub = StubChannel.respondingWith(_request -> response);
        RawResponse raw = executor(stub, CredentialSupplier.none(), Optional.empty())
                .executeRaw(CALL)
                .get();
        assertThat(raw.code()).isEqualTo(403);
        assertThat(raw.bodyAsString()).isEqualTo("{\"error\":\"nope\"}");
        assertThat(response.isClosed()).isTrue();
        assertThat(response.isBodyClosed()).isTrue();
    }

    @Test
    public void testDecodeFailureForUnsuccessfulResponse() {
        StubChannel stub = StubChannel.respondingWith(_request -> TestResponse.withBody("").code(500));
        ListenableFuture<String> result =
                executor(stub, CredentialSupplier.none(), Optional.empty()).execute(CALL);
        assertThatThrownBy(() -> Calls.getUnchecked(result))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("500");
    }

    @Test
    public void testIoFailureIsRetryable() {
        StubChannel stub = StubChannel.respondingWith(_request -> {
            throw new UncheckedIOException(new IOException("connection reset"));
        });
        ListenableFuture<RawResponse> result =
                executor(stub, CredentialSupplier.none(), Optional.empty()).executeRaw(CALL);
        assertThatThrownBy(result::get)
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOfSatisfying(TransportException.class, exception -> assertThat(exception.isRetryable())
                        .isTrue());
    }

    @Test
    public void testTimeoutIsRetryable() {
        when(channel.execute(any())).thenReturn(SettableFuture.create());
        ListenableFuture<RawResponse> result = executor(
                        channel, CredentialSupplier.none(), Optional.of(Duration.ofMillis(20)))
                .executeRaw(CALL);
        assertThatThrownBy(() -> Calls.getUnchecked(result))
                .isInstanceOfSatisfying(TransportException.class, exception -> assertThat(exception.isRetryable())
                        .isTrue());
    }

    @Test
    public void testCancellationPropagatesToTransport() {
        SettableFuture<Response> transport = SettableFuture.create();
        when(channel.execute(any())).thenReturn(transport);
        ListenableFuture<RawResponse> result =
                executor(channel, CredentialSupplier.none(), Optional.empty()).executeRaw(CALL);
        result.cancel(true);
        assertThat(transport.isCancelled()).isTrue();
        assertThatThrownBy(() -> Calls.getUnchecked(result))
                .isInstanceOfSatisfying(TransportException.class, exception -> {
                    assertThat(exception.isRetryable()).isFalse();
                    assertThat(exception).hasCauseInstanceOf(CancellationException.class);
                });
    }

    @Test
    public void testThrowingChannelFailsFuture() {
        when(channel.execute(any())).thenThrow(new IllegalStateException("bug"));
        ListenableFuture<RawResponse> result =
                executor(channel, CredentialSupplier.none(), Optional.empty()).executeRaw(CALL);
        assertThatThrownBy(() -> Calls.getUnchecked(result)).isInstanceOf(TransportException.class);
    }

    @Test
    public void testExactlyOneExchangePerCall() throws Exception {
        AtomicReference<Request> seen = new AtomicReference<>();
        StubChannel stub = StubChannel.respondingWith(request -> {
            seen.set(request);
            return TestResponse.withBody("ok");
        });
        executor(stub, CredentialSupplier.none(), Optional.empty()).executeRaw(CALL).get();
        assertThat(stub.callCount()).isEqualTo(1);
        assertThat(seen.get()).isNotNull();
    }

    private static ChannelCallExecutor executor(
            Channel channel, CredentialSupplier credentials, Optional<Duration> timeout) {
        try {
            return new ChannelCallExecutor(
                    channel,
                    BaseUrl.of(new URL("https://gmail.googleapis.com")),
                    credentials,
                    timeout,
                    CourierExecutors.timeoutScheduler.get());
        } catch (MalformedURLException e) {
            throw new IllegalStateException(e);
        }
    }
}
