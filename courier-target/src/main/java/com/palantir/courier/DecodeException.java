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
import javax.annotation.Nullable;

/** A response was received but its body could not be turned into the expected value. */
public final class DecodeException extends CourierException {

    public DecodeException(String message, @Nullable Throwable cause, Arg<?>... args) {
        super(message, cause, args);
    }

    public DecodeException(String message, Arg<?>... args) {
        super(message, null, args);
    }
}
