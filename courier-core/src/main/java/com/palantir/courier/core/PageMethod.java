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

import com.palantir.courier.BoundCall;
import com.palantir.logsafe.Preconditions;

/** How the next page's call is derived from the previous call and a {@link PageCursor}. */
public interface PageMethod {

    <T> BoundCall<T> next(BoundCall<T> previous, PageCursor cursor);

    /** The cursor value is an absolute URL which replaces the previous call's URL. */
    static PageMethod url() {
        return UrlPageMethod.INSTANCE;
    }

    /** The cursor value is re-bound to the named query or path parameter. */
    static PageMethod param(String name) {
        Preconditions.checkNotNull(name, "name");
        return new ParamPageMethod(name);
    }

    enum UrlPageMethod implements PageMethod {
        INSTANCE;

        @Override
        public <T> BoundCall<T> next(BoundCall<T> previous, PageCursor cursor) {
            return previous.withUrl(cursor.value());
        }

        @Override
        public String toString() {
            return "PageMethod.url()";
        }
    }

    final class ParamPageMethod implements PageMethod {
        private final String name;

        private ParamPageMethod(String name) {
            this.name = name;
        }

        @Override
        public <T> BoundCall<T> next(BoundCall<T> previous, PageCursor cursor) {
            return previous.withParam(name, cursor.value());
        }

        @Override
        public String toString() {
            return "PageMethod.param(" + name + ')';
        }
    }
}
