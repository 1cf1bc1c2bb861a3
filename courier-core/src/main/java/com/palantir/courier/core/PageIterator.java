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

import com.google.common.collect.Streams;
import com.palantir.courier.BoundCall;
import com.palantir.courier.RawResponse;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Stream;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A lazy, single-use sequence of decoded pages. Each call to {@link #next()} performs exactly one exchange; the next
 * page's call is derived from the page just returned, so pages are strictly sequential. The first failure is thrown
 * from {@link #next()} and ends the sequence.
 */
@NotThreadSafe
public final class PageIterator<T> implements Iterator<T> {

    private static final SafeLogger log = SafeLoggerFactory.get(PageIterator.class);

    private final CallExecutor executor;
    private final PageMethod method;
    private final PageAdvancer<? super T> advancer;

    private BoundCall<T> call;
    private Optional<PageCursor> cursor = Optional.empty();
    private State state = State.NOT_STARTED;
    private int pagesFetched;

    PageIterator(CallExecutor executor, BoundCall<T> first, PageMethod method, PageAdvancer<? super T> advancer) {
        this.executor = executor;
        this.call = first;
        this.method = method;
        this.advancer = advancer;
    }

    @Override
    public boolean hasNext() {
        switch (state) {
            case NOT_STARTED:
                return true;
            case ACTIVE:
                return cursor.isPresent();
            case DONE:
            case FAILED:
                return false;
        }
        throw new SafeIllegalStateException("Unknown state", SafeArg.of("state", state));
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        try {
            if (state == State.ACTIVE) {
                PageCursor current = cursor.get();
                call = method.next(call, current);
                log.debug(
                        "Advancing to next page",
                        SafeArg.of("descriptor", call.descriptor().id()),
                        SafeArg.of("pagesFetched", pagesFetched),
                        UnsafeArg.of("cursor", current));
            }
            state = State.ACTIVE;
            RawResponse response = Calls.getUnchecked(executor.executeRaw(call));
            T page = Calls.decode(call.descriptor(), response);
            cursor = advancer.advance(page);
            pagesFetched++;
            if (cursor.isEmpty()) {
                state = State.DONE;
                log.debug(
                        "Pagination complete",
                        SafeArg.of("descriptor", call.descriptor().id()),
                        SafeArg.of("pagesFetched", pagesFetched));
            }
            return page;
        } catch (RuntimeException | Error e) {
            state = State.FAILED;
            cursor = Optional.empty();
            throw e;
        }
    }

    /** Number of pages returned successfully so far. */
    public int pagesFetched() {
        return pagesFetched;
    }

    /** The cursor the next page will be requested with, if any. */
    public Optional<PageCursor> currentCursor() {
        return cursor;
    }

    /** Whether the sequence was ended by a failure rather than by the advancer. */
    public boolean failed() {
        return state == State.FAILED;
    }

    /** A sequential stream over the remaining pages. Shares state with this iterator. */
    public Stream<T> stream() {
        return Streams.stream(this);
    }

    @Override
    public String toString() {
        return "PageIterator{descriptor=" + call.descriptor().id() + ", state=" + state + ", pagesFetched="
                + pagesFetched + '}';
    }

    private enum State {
        NOT_STARTED,
        ACTIVE,
        DONE,
        FAILED
    }
}
