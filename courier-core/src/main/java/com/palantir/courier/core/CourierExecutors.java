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

import com.google.common.base.Suppliers;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/** Internal executors shared by every client in the JVM. */
final class CourierExecutors {

    private static final String TIMEOUT_SCHEDULER_NAME = "courier-timeout-scheduler";
    private static final Duration KEEP_ALIVE = Duration.ofSeconds(10);

    /**
     * Single daemon thread used only to fire call timeouts. Core threads time out so that an idle client does not
     * pin a thread.
     */
    @SuppressWarnings("DangerousThreadPoolExecutorUsage")
    static final Supplier<ScheduledExecutorService> timeoutScheduler = Suppliers.memoize(() -> {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                1,
                new ThreadFactoryBuilder()
                        .setNameFormat(TIMEOUT_SCHEDULER_NAME + "-%d")
                        .setDaemon(true)
                        .build());
        executor.allowCoreThreadTimeOut(true);
        executor.setKeepAliveTime(KEEP_ALIVE.toNanos(), TimeUnit.NANOSECONDS);
        // cancelled timeouts must not linger until their deadline
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    });

    private CourierExecutors() {}
}
