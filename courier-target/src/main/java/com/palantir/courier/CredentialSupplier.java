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

import java.util.Optional;

/**
 * The auth collaborator. Called once per network exchange; implementations are expected to cache and refresh
 * tokens themselves. Throwing fails the call as a transport failure.
 */
@FunctionalInterface
public interface CredentialSupplier {

    /** The bearer token to attach to the next call, or empty for unauthenticated calls. */
    Optional<String> bearerToken();

    static CredentialSupplier none() {
        return Optional::empty;
    }

    static CredentialSupplier of(String token) {
        Optional<String> value = Optional.of(token);
        return () -> value;
    }
}
