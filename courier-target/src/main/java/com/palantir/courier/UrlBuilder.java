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

import java.util.Collection;

/** Receives the rendered pieces of a call's URL. Implementations take care of encoding. */
public interface UrlBuilder {

    /** URL-encodes the given path segment and adds it to the list of segments. */
    UrlBuilder pathSegment(String thePath);

    default UrlBuilder pathSegments(Collection<String> paths) {
        paths.forEach(this::pathSegment);
        return this;
    }

    /** URL-encodes the given query parameter name and value and appends them, preserving insertion order. */
    UrlBuilder queryParam(String name, String value);
}
