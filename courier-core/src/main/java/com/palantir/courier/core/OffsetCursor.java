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

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.util.Objects;
import java.util.Optional;

/**
 * Position of a page in an offset/limit result set. Start indexes are one-based unless the cursor is created with
 * {@link #zeroBased(long, int, long)}.
 */
public final class OffsetCursor implements PageCursor {

    private final long startIndex;
    private final int pageSize;
    private final long totalCount;
    private final int firstIndex;

    private OffsetCursor(long startIndex, int pageSize, long totalCount, int firstIndex) {
        Preconditions.checkArgument(pageSize > 0, "pageSize must be positive", SafeArg.of("pageSize", pageSize));
        Preconditions.checkArgument(
                totalCount >= 0, "totalCount must not be negative", SafeArg.of("totalCount", totalCount));
        Preconditions.checkArgument(
                startIndex >= firstIndex,
                "startIndex precedes the first index",
                SafeArg.of("startIndex", startIndex),
                SafeArg.of("firstIndex", firstIndex));
        this.startIndex = startIndex;
        this.pageSize = pageSize;
        this.totalCount = totalCount;
        this.firstIndex = firstIndex;
    }

    /** A cursor with one-based start indexes, as used by {@code start-index} style APIs. */
    public static OffsetCursor of(long startIndex, int pageSize, long totalCount) {
        return new OffsetCursor(startIndex, pageSize, totalCount, 1);
    }

    public static OffsetCursor zeroBased(long startIndex, int pageSize, long totalCount) {
        return new OffsetCursor(startIndex, pageSize, totalCount, 0);
    }

    public long startIndex() {
        return startIndex;
    }

    public int pageSize() {
        return pageSize;
    }

    public long totalCount() {
        return totalCount;
    }

    /** The cursor for the following page, or empty once it would start past {@link #totalCount()}. */
    public Optional<OffsetCursor> next() {
        long nextStart = startIndex + pageSize;
        if (nextStart - firstIndex >= totalCount) {
            return Optional.empty();
        }
        return Optional.of(new OffsetCursor(nextStart, pageSize, totalCount, firstIndex));
    }

    @Override
    public String value() {
        return Long.toString(startIndex);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        OffsetCursor that = (OffsetCursor) other;
        return startIndex == that.startIndex
                && pageSize == that.pageSize
                && totalCount == that.totalCount
                && firstIndex == that.firstIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startIndex, pageSize, totalCount, firstIndex);
    }

    @Override
    public String toString() {
        return "OffsetCursor{startIndex=" + startIndex + ", pageSize=" + pageSize + ", totalCount=" + totalCount
                + ", firstIndex=" + firstIndex + '}';
    }
}
