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

import com.google.common.collect.ImmutableList;
import com.palantir.courier.BoundCall;
import com.palantir.logsafe.Preconditions;

/**
 * Produces lazy page sequences. Every page is fetched through the configured {@link CallExecutor}, so paging
 * participates in response caching when it is enabled.
 */
public final class Paginator {

    private final CallExecutor executor;

    public Paginator(CallExecutor executor) {
        this.executor = Preconditions.checkNotNull(executor, "executor");
    }

    /**
     * Starts a single-use page sequence. Nothing is requested until the first pull; the first page is always
     * requested and the sequence ends the first time {@code advancer} returns empty.
     */
    public <T> PageIterator<T> page(BoundCall<T> first, PageMethod method, PageAdvancer<? super T> advancer) {
        return new PageIterator<>(
                executor,
                Preconditions.checkNotNull(first, "first"),
                Preconditions.checkNotNull(method, "method"),
                Preconditions.checkNotNull(advancer, "advancer"));
    }

    /** Fetches every page eagerly. The first failure is thrown and the pages read so far are discarded. */
    public <T> ImmutableList<T> all(BoundCall<T> first, PageMethod method, PageAdvancer<? super T> advancer) {
        return ImmutableList.copyOf(page(first, method, advancer));
    }
}
