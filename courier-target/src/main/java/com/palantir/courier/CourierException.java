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

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.Arg;
import com.palantir.logsafe.SafeLoggable;
import com.palantir.logsafe.exceptions.SafeExceptions;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Base type of every failure a call can produce. Subtypes are the complete error taxonomy: callers may switch on
 * the concrete type to decide whether to retry, fix their input or give up.
 */
public abstract class CourierException extends RuntimeException implements SafeLoggable {

    private final String logMessage;
    private final List<Arg<?>> args;

    CourierException(String message, @Nullable Throwable cause, Arg<?>... args) {
        super(SafeExceptions.renderMessage(message, args), cause);
        this.logMessage = message;
        this.args = ImmutableList.copyOf(args);
    }

    @Override
    public final String getLogMessage() {
        return logMessage;
    }

    @Override
    public final List<Arg<?>> getArgs() {
        return args;
    }
}
