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

import com.google.common.net.MediaType;
import com.palantir.courier.RawResponse;
import java.util.function.Predicate;

/** Common cache invalidation predicates. A predicate returning {@code true} makes a response eligible for storage. */
public final class CachePredicates {

    private CachePredicates() {}

    /** Stores only {@code 200 OK} responses. This is the default. */
    public static Predicate<RawResponse> statusOk() {
        return response -> response.code() == 200;
    }

    /** Stores any 2xx response. */
    public static Predicate<RawResponse> successful() {
        return RawResponse::isSuccessful;
    }

    /** Stores nothing; every call reaches the network. */
    public static Predicate<RawResponse> never() {
        return _response -> false;
    }

    /**
     * Stores {@code 200 OK} responses whose content type has the given type and subtype, ignoring parameters.
     * Useful to keep error pages served with a success status out of the cache.
     */
    public static Predicate<RawResponse> statusOkWithContentType(String mediaType) {
        MediaType expected = MediaType.parse(mediaType).withoutParameters();
        return response -> response.code() == 200
                && response.contentType()
                        .map(value -> matches(expected, value))
                        .orElse(false);
    }

    private static boolean matches(MediaType expected, String actual) {
        try {
            return MediaType.parse(actual).withoutParameters().is(expected);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
