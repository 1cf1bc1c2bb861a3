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

import java.io.IOException;
import java.util.Optional;

/**
 * Minimal remote key/value capability a {@link KeyValueResponseStore} is layered on, for example a shared cache
 * service. Implementations must be safe for concurrent use.
 */
public interface KeyValueClient {

    Optional<byte[]> get(String key) throws IOException;

    void put(String key, byte[] value) throws IOException;

    /** Removes every key starting with the prefix. */
    void clear(String prefix) throws IOException;
}
