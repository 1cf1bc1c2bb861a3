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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.courier.CallKey;
import com.palantir.courier.RawResponse;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import javax.annotation.concurrent.ThreadSafe;

/** A {@link ResponseStore} held on the heap, optionally bounded in size and age. */
@ThreadSafe
public final class InMemoryResponseStore implements ResponseStore {

    private final Cache<CallKey, CacheEntry> entries;
    private final Clock clock;

    private InMemoryResponseStore(Cache<CallKey, CacheEntry> entries, Clock clock) {
        this.entries = entries;
        this.clock = clock;
    }

    /** An unbounded store whose entries live until {@link #clear()}. */
    public static InMemoryResponseStore create() {
        return builder().build();
    }

    @Override
    public Optional<RawResponse> get(CallKey key) {
        return Optional.ofNullable(entries.getIfPresent(key)).map(CacheEntry::response);
    }

    @Override
    public void put(CallKey key, RawResponse response) {
        entries.put(key, CacheEntry.of(key.digest(), key.descriptorId(), response, clock.instant()));
    }

    @Override
    public void clear() {
        entries.invalidateAll();
    }

    /** The stored entry including its timestamp. */
    public Optional<CacheEntry> entry(CallKey key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    public long estimatedSize() {
        return entries.estimatedSize();
    }

    @Override
    public String toString() {
        return "InMemoryResponseStore{estimatedSize=" + entries.estimatedSize() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OptionalLong maximumSize = OptionalLong.empty();
        private Optional<Duration> expireAfterWrite = Optional.empty();
        private Ticker ticker = Ticker.systemTicker();
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        @CanIgnoreReturnValue
        public Builder maximumSize(long value) {
            Preconditions.checkArgument(value > 0, "maximumSize must be positive", SafeArg.of("maximumSize", value));
            this.maximumSize = OptionalLong.of(value);
            return this;
        }

        @CanIgnoreReturnValue
        public Builder expireAfterWrite(Duration value) {
            Preconditions.checkArgument(
                    !value.isNegative() && !value.isZero(),
                    "expireAfterWrite must be positive",
                    SafeArg.of("expireAfterWrite", value));
            this.expireAfterWrite = Optional.of(value);
            return this;
        }

        @CanIgnoreReturnValue
        public Builder ticker(Ticker value) {
            this.ticker = Preconditions.checkNotNull(value, "ticker");
            return this;
        }

        @CanIgnoreReturnValue
        public Builder clock(Clock value) {
            this.clock = Preconditions.checkNotNull(value, "clock");
            return this;
        }

        public InMemoryResponseStore build() {
            Caffeine<Object, Object> caffeine = Caffeine.newBuilder().ticker(ticker);
            maximumSize.ifPresent(caffeine::maximumSize);
            expireAfterWrite.ifPresent(caffeine::expireAfterWrite);
            return new InMemoryResponseStore(caffeine.build(), clock);
        }
    }
}
