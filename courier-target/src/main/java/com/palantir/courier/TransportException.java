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

import com.palantir.logsafe.Arg;
import com.palantir.logsafe.SafeArg;
import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nullable;

/**
 * No response was received for a call. {@link #isRetryable()} tells whether issuing the same call again could
 * reasonably succeed; retrying is left to the caller.
 */
public final class TransportException extends CourierException {

    private final boolean retryable;

    public TransportException(String message, boolean retryable, @Nullable Throwable cause, Arg<?>... args) {
        super(message, cause, withRetryable(retryable, args));
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** Classifies a failure raised by a {@link Channel}. */
    public static TransportException from(Throwable throwable) {
        if (throwable instanceof TransportException) {
            return (TransportException) throwable;
        }
        if (throwable instanceof CancellationException) {
            return new TransportException("Call was cancelled", false, throwable);
        }
        if (throwable instanceof TimeoutException) {
            return new TransportException("Call timed out", true, throwable);
        }
        if (throwable instanceof IOException) {
            return new TransportException("Network transport failure", true, throwable);
        }
        return new TransportException("Transport failed unexpectedly", false, throwable);
    }

    private static Arg<?>[] withRetryable(boolean retryable, Arg<?>... args) {
        Arg<?>[] result = new Arg<?>[args.length + 1];
        System.arraycopy(args, 0, result, 0, args.length);
        result[args.length] = SafeArg.of("retryable", retryable);
        return result;
    }
}
