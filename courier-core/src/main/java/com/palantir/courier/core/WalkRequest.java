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

import com.palantir.courier.CallArgs;
import com.palantir.courier.CallDescriptor;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.util.List;
import java.util.function.Function;
import org.immutables.value.Value;

/**
 * One call per walk value, varying only {@link #walkParam()} over otherwise fixed arguments. Walks over several
 * parameters are expressed by zipping their values into one composite value beforehand.
 */
@Value.Immutable
public interface WalkRequest<T, R> {

    CallDescriptor<T> descriptor();

    /** The query or path parameter that takes each walk value in turn. */
    String walkParam();

    List<String> walkValues();

    @Value.Default
    default CallArgs fixedArgs() {
        return CallArgs.empty();
    }

    /** Calls per batch envelope. */
    int batchSize();

    /** Applied to every decoded success. A throwing function fails only its own item. */
    Function<T, R> postProcess();

    @Value.Check
    default void check() {
        Preconditions.checkArgument(
                batchSize() > 0, "batchSize must be positive", SafeArg.of("batchSize", batchSize()));
        Preconditions.checkArgument(!walkParam().isEmpty(), "walkParam must not be empty");
    }

    static <T, R> ImmutableWalkRequest.Builder<T, R> builder() {
        return ImmutableWalkRequest.builder();
    }
}
