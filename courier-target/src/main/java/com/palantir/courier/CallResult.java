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

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Outcome of one call inside a batch or walk: either a value or the failure that replaced it. Keeping failures per
 * item lets one bad call fail without discarding its neighbours.
 */
public final class CallResult<T> {

    @Nullable
    private final T value;

    @Nullable
    private final Throwable failure;

    private CallResult(@Nullable T value, @Nullable Throwable failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> CallResult<T> success(@Nullable T value) {
        return new CallResult<>(value, null);
    }

    public static <T> CallResult<T> failure(Throwable failure) {
        return new CallResult<>(null, Preconditions.checkNotNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /** Returns the value, or throws the failure if this result is not a success. */
    @Nullable
    public T get() {
        if (failure == null) {
            return value;
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        throw new SafeIllegalStateException("Call failed", failure);
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Transforms a successful value. A throwing {@code function} turns this result into a failure rather than
     * propagating.
     */
    public <U> CallResult<U> map(Function<? super T, ? extends U> function) {
        if (failure != null) {
            return failure(failure);
        }
        try {
            return success(function.apply(value));
        } catch (RuntimeException e) {
            return failure(e);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        CallResult<?> that = (CallResult<?>) other;
        return Objects.equals(value, that.value) && Objects.equals(failure, that.failure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, failure);
    }

    @Override
    public String toString() {
        return failure == null ? "CallResult{success}" : "CallResult{failure=" + failure.getClass().getSimpleName()
                + '}';
    }
}
