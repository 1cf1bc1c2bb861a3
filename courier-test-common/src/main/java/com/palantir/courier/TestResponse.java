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

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.net.HttpHeaders;
import com.google.errorprone.annotations.CheckReturnValue;
import com.palantir.logsafe.Preconditions;
import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;

/** A {@link Response} over an in-memory body which remembers whether it was closed. */
public final class TestResponse implements Response {

    private final RecordingStream inputStream;
    private final ListMultimap<String, String> headers =
            MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER).arrayListValues().build();

    private boolean closeCalled = false;
    private int code = 200;

    public TestResponse() {
        this(new byte[] {});
    }

    public TestResponse(byte[] bytes) {
        this.inputStream = new RecordingStream(new ByteArrayInputStream(bytes));
    }

    public static TestResponse withBody(@Nullable String body) {
        return new TestResponse(body == null ? new byte[] {} : body.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public InputStream body() {
        return inputStream;
    }

    @Override
    public int code() {
        return code;
    }

    @CheckReturnValue
    public TestResponse code(int value) {
        this.code = value;
        return this;
    }

    @Override
    public ListMultimap<String, String> headers() {
        return headers;
    }

    @Override
    public void close() {
        Preconditions.checkState(!closeCalled, "Please don't close twice");
        closeCalled = true;
        try {
            inputStream.close();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to close", e);
        }
    }

    public boolean isClosed() {
        return closeCalled;
    }

    public boolean isBodyClosed() {
        return inputStream.closed;
    }

    @CheckReturnValue
    public TestResponse contentType(String contentType) {
        return withHeader(HttpHeaders.CONTENT_TYPE, contentType);
    }

    @CheckReturnValue
    public TestResponse withHeader(String headerName, String headerValue) {
        headers.put(headerName, headerValue);
        return this;
    }

    private static final class RecordingStream extends FilterInputStream {
        private volatile boolean closed = false;

        RecordingStream(InputStream delegate) {
            super(delegate);
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }
}
