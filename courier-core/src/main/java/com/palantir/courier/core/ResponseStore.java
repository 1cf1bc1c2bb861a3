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

import com.palantir.courier.CallKey;
import com.palantir.courier.RawResponse;
import java.util.Optional;

/**
 * Storage capability behind the cache layer. Implementations must tolerate concurrent {@code get} and {@code put}
 * from independent sessions; concurrent writes to the same key are last-writer-wins. Expiry, if any, is the
 * store's own business.
 */
public interface ResponseStore {

    Optional<RawResponse> get(CallKey key);

    void put(CallKey key, RawResponse response);

    /** Removes every entry. */
    void clear();
}
