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

import com.palantir.courier.CallKey;
import com.palantir.courier.RawResponse;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeUncheckedIoException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * A {@link ResponseStore} over a {@link KeyValueClient}. Entries are stored under {@code <namespace>/<digest>} using
 * the same JSON form as {@link DiskResponseStore}. Read and write failures are logged and treated as misses.
 */
public final class KeyValueResponseStore implements ResponseStore {

    private static final SafeLogger log = SafeLoggerFactory.get(KeyValueResponseStore.class);

    private final KeyValueClient client;
    private final String prefix;
    private final Clock clock;

    private KeyValueResponseStore(KeyValueClient client, String namespace, Clock clock) {
        this.client = client;
        this.prefix = namespace + '/';
        this.clock = clock;
    }

    public static KeyValueResponseStore of(KeyValueClient client, String namespace) {
        return of(client, namespace, Clock.systemUTC());
    }

    public static KeyValueResponseStore of(KeyValueClient client, String namespace, Clock clock) {
        Preconditions.checkNotNull(client, "client");
        Preconditions.checkNotNull(clock, "clock");
        Preconditions.checkArgument(
                namespace != null && !namespace.isEmpty() && namespace.indexOf('/') < 0,
                "namespace must be non-empty and must not contain '/'",
                SafeArg.of("namespace", namespace));
        return new KeyValueResponseStore(client, namespace, clock);
    }

    @Override
    public Optional<RawResponse> get(CallKey key) {
        try {
            Optional<byte[]> value = client.get(storageKey(key));
            if (value.isEmpty()) {
                return Optional.empty();
            }
            CacheEntry entry = CacheEntryCodec.deserialize(value.get());
            return Optional.of(entry.response());
        } catch (IOException | RuntimeException e) {
            log.warn(
                    "Failed to read from key/value store, treating as a miss",
                    SafeArg.of("descriptor", key.descriptorId()),
                    SafeArg.of("digest", key.digest()),
                    e);
            return Optional.empty();
        }
    }

    @Override
    public void put(CallKey key, RawResponse response) {
        try {
            client.put(
                    storageKey(key),
                    CacheEntryCodec.serialize(
                            CacheEntry.of(key.digest(), key.descriptorId(), response, clock.instant())));
        } catch (IOException | RuntimeException e) {
            log.warn(
                    "Failed to write to key/value store",
                    SafeArg.of("descriptor", key.descriptorId()),
                    SafeArg.of("digest", key.digest()),
                    e);
        }
    }

    @Override
    public void clear() {
        try {
            client.clear(prefix);
        } catch (IOException e) {
            throw new SafeUncheckedIoException("Failed to clear key/value store", e, SafeArg.of("prefix", prefix));
        }
    }

    String storageKey(CallKey key) {
        return prefix + key.digest();
    }

    @Override
    public String toString() {
        return "KeyValueResponseStore{client=" + client + ", prefix=" + prefix + '}';
    }
}
