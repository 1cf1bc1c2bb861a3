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

/**
 * The decode collaborator of a {@link CallDescriptor}: turns a raw response into the descriptor's value type.
 * Interpreting status codes as domain errors is the deserializer's job; failures should be reported as
 * {@link DecodeException}.
 */
@FunctionalInterface
public interface Deserializer<T> {

    T deserialize(RawResponse response);
}
