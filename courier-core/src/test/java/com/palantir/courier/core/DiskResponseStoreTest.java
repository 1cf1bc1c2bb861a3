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

import com.palantir.courier.CallArgs;
import com.palantir.courier.CallDescriptor;
import com.palantir.courier.CallKey;
import com.palantir.courier.Deserializers;
import com.palantir.courier.RawResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class DiskResponseStoreTest {

    private static final CallDescriptor<String> LIST = CallDescriptor.builder()
            .apiFamily("youtube")
            .name("videos.list")
            .path("/youtube/v3/videos")
            .requiredQueryParam("id")
            .build(Deserializers.utf8());

    @TempDir
    Path directory;

    @Test
    public void testSurvivesNewInstance() {
        RawResponse response = RawResponse.builder()
                .code(200)
                .putHeaders("Content-Type", "application/json")
                .putHeaders("Vary", "Origin")
                .putHeaders("Vary", "X-Origin")
                .body(new byte[] {0, 1, 2, (byte) 0xFF})
                .build();
        DiskResponseStore.create(directory).put(key("a"), response);

        DiskResponseStore reopened = DiskResponseStore.create(directory);
        assertThat(reopened.get(key("a"))).hasValue(response);
        assertThat(reopened.get(key("b"))).isEmpty();
    }

    @Test
    public void testOneFilePerDigest() throws Exception {
        DiskResponseStore store = DiskResponseStore.create(directory);
        store.put(key("a"), RawResponse.builder().body("1").build());
        store.put(key("a"), RawResponse.builder().body("2").build());
        store.put(key("b"), RawResponse.builder().body("3").build());
        try (Stream<Path> files = Files.list(directory)) {
            assertThat(files.map(path -> path.getFileName().toString()))
                    .containsExactlyInAnyOrder(key("a").digest() + ".json", key("b").digest() + ".json");
        }
        assertThat(store.get(key("a")).map(RawResponse::bodyAsString)).hasValue("2");
    }

    @Test
    public void testEntryRecordsKey() throws Exception {
        DiskResponseStore store = DiskResponseStore.create(directory);
        store.put(key("a"), RawResponse.builder().body("1").build());

        CacheEntry entry = CacheEntryCodec.deserialize(Files.readAllBytes(store.fileFor(key("a"))));
        assertThat(entry.keyDigest()).isEqualTo(key("a").digest());
        assertThat(entry.descriptorId()).isEqualTo(key("a").descriptorId());
        assertThat(entry.response().bodyAsString()).isEqualTo("1");
    }

    @Test
    public void testCorruptEntryIsAMiss() throws Exception {
        DiskResponseStore store = DiskResponseStore.create(directory);
        Files.write(store.fileFor(key("a")), "{not json".getBytes(StandardCharsets.UTF_8));
        assertThat(store.get(key("a"))).isEmpty();
    }

    @Test
    public void testClear() throws Exception {
        DiskResponseStore store = DiskResponseStore.create(directory);
        store.put(key("a"), RawResponse.builder().body("1").build());
        store.put(key("b"), RawResponse.builder().body("2").build());
        store.clear();
        assertThat(store.get(key("a"))).isEmpty();
        try (Stream<Path> files = Files.list(directory)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    public void testCreatesDirectory() {
        Path nested = directory.resolve("cache").resolve("responses");
        DiskResponseStore store = DiskResponseStore.create(nested);
        store.put(key("a"), RawResponse.builder().body("1").build());
        assertThat(Files.isDirectory(nested)).isTrue();
        assertThat(store.get(key("a"))).isPresent();
    }

    private static CallKey key(String id) {
        return LIST.bind(CallArgs.builder().putQueryParams("id", id).build()).key();
    }
}
