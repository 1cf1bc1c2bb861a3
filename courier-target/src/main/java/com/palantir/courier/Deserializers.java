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

import com.palantir.logsafe.SafeArg;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/** Deserializers that do not need a serialization library. */
public final class Deserializers {

    private Deserializers() {}

    /** Passes the response through untouched, whatever its status. */
    public static Deserializer<RawResponse> raw() {
        return RawDeserializer.INSTANCE;
    }

    /** Returns the body of a successful response as UTF-8 text. */
    public static Deserializer<String> utf8() {
        return successful(response -> new String(response.body(), StandardCharsets.UTF_8));
    }

    /** Returns the body of a successful response verbatim. */
    public static Deserializer<byte[]> bytes() {
        return successful(RawResponse::body);
    }

    /** Discards the body of a successful response. */
    public static Deserializer<Void> empty() {
        return successful(_response -> null);
    }

    /**
     * Applies {@code decoder} to 2xx responses and fails any other status with a {@link DecodeException}. Runtime
     * failures of {@code decoder} are reported as {@link DecodeException} as well.
     */
    public static <T> Deserializer<T> successful(Function<RawResponse, T> decoder) {
        return response -> {
            if (!response.isSuccessful()) {
                throw new DecodeException(
                        "Received unsuccessful response",
                        SafeArg.of("status", response.code()),
                        SafeArg.of("contentLength", response.contentLength()));
            }
            try {
                return decoder.apply(response);
            } catch (CourierException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new DecodeException("Failed to decode response", e, SafeArg.of("status", response.code()));
            }
        };
    }

    private enum RawDeserializer implements Deserializer<RawResponse> {
        INSTANCE;

        @Override
        public RawResponse deserialize(RawResponse response) {
            return response;
        }

        @Override
        public String toString() {
            return "RawDeserializer";
        }
    }
}
