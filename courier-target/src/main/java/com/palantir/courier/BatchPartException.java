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
import javax.annotation.Nullable;

/** One part of a batch response was missing or could not be parsed. Other parts of the batch are unaffected. */
public final class BatchPartException extends CourierException {

    private final int index;

    public BatchPartException(String message, int index, @Nullable Throwable cause, Arg<?>... args) {
        super(message, cause, withIndex(index, args));
        this.index = index;
    }

    /** Position of the failed call within the submitted batch. */
    public int index() {
        return index;
    }

    private static Arg<?>[] withIndex(int index, Arg<?>... args) {
        Arg<?>[] result = new Arg<?>[args.length + 1];
        result[0] = SafeArg.of("index", index);
        System.arraycopy(args, 0, result, 1, args.length);
        return result;
    }
}
