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

import com.palantir.logsafe.Preconditions;

/** An opaque server-supplied token or next-page URL. */
public final class ContinuationToken implements PageCursor {

    private final String token;

    private ContinuationToken(String token) {
        this.token = token;
    }

    public static ContinuationToken of(String token) {
        Preconditions.checkNotNull(token, "token");
        Preconditions.checkArgument(!token.isEmpty(), "token must not be empty");
        return new ContinuationToken(token);
    }

    @Override
    public String value() {
        return token;
    }

    @Override
    public boolean equals(Object other) {
        return this == other
                || (other instanceof ContinuationToken && token.equals(((ContinuationToken) other).token));
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return "ContinuationToken{length=" + token.length() + '}';
    }
}
