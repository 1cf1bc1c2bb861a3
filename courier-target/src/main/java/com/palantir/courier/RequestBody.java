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

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.errorprone.annotations.Immutable;
import com.palantir.logsafe.Preconditions;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A fully buffered request body. Bodies are part of a call's identity, so they are held in memory rather than
 * streamed.
 */
@Immutable
public final class RequestBody {

    @SuppressWarnings("Immutable") // never exposed without copying
    private final byte[] content;

    private final String contentType;

    private RequestBody(byte[] content, String contentType) {
        this.content = content;
        this.contentType = contentType;
    }

    public static RequestBody of(byte[] content, String contentType) {
        Preconditions.checkNotNull(content, "content");
        Preconditions.checkNotNull(contentType, "contentType");
        return new RequestBody(content.clone(), contentType);
    }

    public static RequestBody ofString(String content, String contentType) {
        Preconditions.checkNotNull(content, "content");
        return of(content.getBytes(StandardCharsets.UTF_8), contentType);
    }

    /** A HTTP content type (e.g., "application/json") indicating the type of content. */
    public String contentType() {
        return contentType;
    }

    public int contentLength() {
        return content.length;
    }

    public byte[] content() {
        return content.clone();
    }

    /** SHA-256 of the content, used when computing call identity. */
    public HashCode sha256() {
        return Hashing.sha256().hashBytes(content);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        RequestBody that = (RequestBody) other;
        return contentType.equals(that.contentType) && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * contentType.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        // Content is excluded to avoid the risk of logging credentials
        return "RequestBody{contentType=" + contentType + ", contentLength=" + content.length + '}';
    }
}
