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

import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.palantir.courier.CallDescriptor;
import com.palantir.courier.CourierException;
import com.palantir.courier.DecodeException;
import com.palantir.courier.RawResponse;
import com.palantir.courier.TransportException;
import com.palantir.logsafe.SafeArg;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/** Utility functions shared by the blocking and asynchronous call paths. */
public final class Calls {

    private Calls() {}

    /**
     * Similar to {@link com.google.common.util.concurrent.Futures#getUnchecked(Future)}, except it propagates
     * {@link CourierException}s directly rather than wrapping them. Interrupting the waiting thread cancels the
     * call, which surfaces as a non-retryable {@link TransportException}.
     */
    public static <T> T getUnchecked(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for call", false, e);
        } catch (CancellationException e) {
            throw TransportException.from(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw new ExecutionError((Error) cause);
            }
            throw new UncheckedExecutionException(cause);
        }
    }

    /** Runs the descriptor's deserializer, reporting unexpected runtime failures as {@link DecodeException}. */
    public static <T> T decode(CallDescriptor<T> descriptor, RawResponse response) {
        try {
            return descriptor.deserializer().deserialize(response);
        } catch (CourierException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecodeException(
                    "Failed to decode response",
                    e,
                    SafeArg.of("descriptor", descriptor.id()),
                    SafeArg.of("status", response.code()));
        }
    }
}
