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
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import com.palantir.courier.BoundCall;
import com.palantir.courier.CallArgs;
import com.palantir.courier.CallDescriptor;
import com.palantir.courier.Deserializers;
import com.palantir.courier.RawResponse;
import com.palantir.courier.StubChannel;
import com.palantir.courier.TestResponse;
import com.palantir.courier.TransportException;
import com.palantir.tritium.metrics.registry.DefaultTaggedMetricRegistry;
import com.palantir.tritium.metrics.registry.MetricName;
import com.palantir.tritium.metrics.registry.TaggedMetricRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.function.Predicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public final class CachingCallExecutorTest {

    private static final CallDescriptor<String> GET = CallDescriptor.builder()
            .apiFamily("drive")
            .name("files.get")
            .path("/drive/v3/files/{fileId}")
            .build(Deserializers.utf8());

    @Mock
    private ResponseStore mockStore;

    private TaggedMetricRegistry registry;

    @BeforeEach
    void before() {
        registry = new DefaultTaggedMetricRegistry();
    }

    @Test
    public void testIdempotence() {
        StubChannel channel = StubChannel.alwaysOk("contents");
        CachingCallExecutor executor = caching(channel, InMemoryResponseStore.create(), CachePredicates.statusOk());

        for (int i = 0; i < 5; i++) {
            assertThat(executor.executeBlocking(file("a"))).isEqualTo("contents");
        }
        assertThat(channel.callCount()).isEqualTo(1);
        assertThat(count("courier.cache.hit")).isEqualTo(4);
        assertThat(count("courier.cache.miss")).isEqualTo(1);
        assertThat(count("courier.cache.store")).isEqualTo(1);
    }

    @Test
    public void testDistinctCallsAreDistinctEntries() {
        StubChannel channel = StubChannel.respondingWith(request -> TestResponse.withBody(request.url().getPath()));
        CachingCallExecutor executor = caching(channel, InMemoryResponseStore.create(), CachePredicates.statusOk());

        assertThat(executor.executeBlocking(file("a"))).isEqualTo("/drive/v3/files/a");
        assertThat(executor.executeBlocking(file("b"))).isEqualTo("/drive/v3/files/b");
        assertThat(executor.executeBlocking(file("a"))).isEqualTo("/drive/v3/files/a");
        assertThat(channel.callCount()).isEqualTo(2);
    }

    @Test
    public void testSelectivity() {
        StubChannel channel = StubChannel.respondingWith(_request -> TestResponse.withBody("missing").code(404));
        InMemoryResponseStore store = InMemoryResponseStore.create();
        CachingCallExecutor executor = caching(channel, store, CachePredicates.statusOk());

        for (int i = 0; i < 3; i++) {
            assertThat(executor.executeRaw(file("a").raw()))
                    .succeedsWithin(Duration.ofSeconds(1))
                    .extracting(RawResponse::code)
                    .isEqualTo(404);
        }
        assertThat(channel.callCount()).isEqualTo(3);
        assertThat(store.estimatedSize()).isZero();
    }

    @Test
    public void testPredicateRejectingEverything() {
        StubChannel channel = StubChannel.alwaysOk("contents");
        CachingCallExecutor executor = caching(channel, InMemoryResponseStore.create(), CachePredicates.never());
        executor.executeBlocking(file("a"));
        executor.executeBlocking(file("a"));
        assertThat(channel.callCount()).isEqualTo(2);
    }

    @Test
    public void testFailuresAreNeverCached() {
        StubChannel channel = StubChannel.respondingWith(_request -> {
            throw new UncheckedIOException(new IOException("reset"));
        });
        InMemoryResponseStore store = InMemoryResponseStore.create();
        CachingCallExecutor executor = caching(channel, store, CachePredicates.successful());

        assertThatThrownBy(() -> executor.executeBlocking(file("a"))).isInstanceOf(TransportException.class);
        channel.setHandler(_request -> TestResponse.withBody("recovered"));
        assertThat(executor.executeBlocking(file("a"))).isEqualTo("recovered");
        assertThat(channel.callCount()).isEqualTo(2);
    }

    @Test
    public void testClear() {
        StubChannel channel = StubChannel.alwaysOk("contents");
        CachingCallExecutor executor = caching(channel, InMemoryResponseStore.create(), CachePredicates.statusOk());
        executor.executeBlocking(file("a"));
        executor.clear();
        executor.executeBlocking(file("a"));
        assertThat(channel.callCount()).isEqualTo(2);
    }

    @Test
    public void testRawAndDecodedShareEntries() {
        StubChannel channel = StubChannel.alwaysOk("contents");
        CachingCallExecutor executor = caching(channel, InMemoryResponseStore.create(), CachePredicates.statusOk());
        executor.executeBlocking(file("a"));
        RawResponse raw = executor.executeBlocking(file("a").raw());
        assertThat(raw.bodyAsString()).isEqualTo("contents");
        assertThat(channel.callCount()).isEqualTo(1);
    }

    @Test
    public void testThrowingPredicateReturnsResponse() {
        StubChannel channel = StubChannel.alwaysOk("contents");
        Predicate<RawResponse> broken = _response -> {
            throw new IllegalStateException("broken predicate");
        };
        CachingCallExecutor executor = caching(channel, InMemoryResponseStore.create(), broken);
        assertThat(executor.executeBlocking(file("a"))).isEqualTo("contents");
        assertThat(executor.executeBlocking(file("a"))).isEqualTo("contents");
        assertThat(channel.callCount()).isEqualTo(2);
    }

    @Test
    public void testStoreFailuresDegradeToMisses() {
        when(mockStore.get(any())).thenThrow(new IllegalStateException("store down"));
        doThrow(new IllegalStateException("store down")).when(mockStore).put(any(), any());
        StubChannel channel = StubChannel.alwaysOk("contents");
        CachingCallExecutor executor = caching(channel, mockStore, CachePredicates.statusOk());
        assertThat(executor.executeBlocking(file("a"))).isEqualTo("contents");
        assertThat(channel.callCount()).isEqualTo(1);
        assertThat(count("courier.cache.store")).isZero();
    }

    private CachingCallExecutor caching(StubChannel channel, ResponseStore store, Predicate<RawResponse> predicate) {
        return CachingCallExecutor.of(TestExecutors.network(channel), store, predicate, registry);
    }

    private long count(String name) {
        return registry.counter(MetricName.builder().safeName(name).build()).getCount();
    }

    private static BoundCall<String> file(String id) {
        return GET.bind(CallArgs.builder().putPathParams("fileId", id).build());
    }
}
