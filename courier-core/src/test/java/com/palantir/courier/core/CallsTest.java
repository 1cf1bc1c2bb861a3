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

import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.palantir.courier.CallDescriptor;
import com.palantir.courier.DecodeException;
import com.palantir.courier.Deserializers;
import com.palantir.courier.RawResponse;
import com.palantir.courier.TransportException;
import java.io.IOException;
import org.junit.jupiter.api.Test;

public final class CallsTest {

    @Test
    public void testCourierExceptionsAreUnwrapped() {
        TransportException failure = new TransportException("boom", true, null);
        assertThatThrownBy(() -> Calls.getUnchecked(Futures.immediateFailedFuture(failure)))
                .isSameAs(failure);
    }

    @Test
    public void testCheckedFailuresAreWrapped() {
        assertThatThrownBy(() -> Calls.getUnchecked(Futures.immediateFailedFuture(new IOException("io"))))
                .isInstanceOf(UncheckedExecutionException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThatThrownBy(() -> Calls.getUnchecked(Futures.immediateFailedFuture(new AssertionError("error"))))
                .isInstanceOf(ExecutionError.class);
    }

    @Test
    public void testCancellation() {
        assertThatThrownBy(() -> Calls.getUnchecked(Futures.immediateCancelledFuture()))
                .isInstanceOfSatisfying(TransportException.class, exception -> assertThat(exception.isRetryable())
                        .isFalse());
    }

    @Test
    public void testInterruptCancelsTheCall() {
        SettableFuture<String> future = SettableFuture.create();
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> Calls.getUnchecked(future))
                    .isInstanceOfSatisfying(TransportException.class, exception -> assertThat(
                                    exception.isRetryable())
                            .isFalse());
            assertThat(future).isCancelled();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testDecodeWrapsUnexpectedFailures() {
        CallDescriptor<Integer> descriptor = CallDescriptor.builder()
                .apiFamily("drive")
                .name("about.get")
                .path("/drive/v3/about")
                .build(Deserializers.successful(response -> Integer.parseInt(response.bodyAsString())));

        assertThat(Calls.decode(descriptor, RawResponse.builder().body("12").build()))
                .isEqualTo(12);
        assertThatThrownBy(() -> Calls.decode(
                        descriptor, RawResponse.builder().body("twelve").build()))
                .isInstanceOf(DecodeException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> Calls.decode(
                        descriptor, RawResponse.builder().code(500).build()))
                .isInstanceOf(DecodeException.class);
    }
}
