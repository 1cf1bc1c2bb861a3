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

import com.google.common.collect.ImmutableList;
import com.palantir.courier.Request;
import com.palantir.courier.Response;
import com.palantir.courier.TestResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses batch envelopes sent by the {@link Batcher} and builds multipart responses to them. */
final class BatchFixtures {

    static final String RESPONSE_BOUNDARY = "batch_response_boundary";

    private static final Pattern PART = Pattern.compile(
            "Content-ID: <item:(\\d+)>\r\n\r\n([A-Z]+) (\\S+) HTTP/1\\.1\r\n((?:[^\r\n]+\r\n)*)\r\n", Pattern.DOTALL);

    private BatchFixtures() {}

    static final class RequestPart {
        final int index;
        final String method;
        final String target;
        final String headers;

        RequestPart(int index, String method, String target, String headers) {
            this.index = index;
            this.method = method;
            this.target = target;
            this.headers = headers;
        }
    }

    static List<RequestPart> parse(Request envelope) {
        String body = envelope.body()
                .map(value -> new String(value.content(), StandardCharsets.UTF_8))
                .orElse("");
        Matcher matcher = PART.matcher(body);
        List<RequestPart> parts = new ArrayList<>();
        while (matcher.find()) {
            parts.add(new RequestPart(
                    Integer.parseInt(matcher.group(1)), matcher.group(2), matcher.group(3), matcher.group(4)));
        }
        return parts;
    }

    /** A response part in the format batch endpoints use. */
    static String responsePart(int index, int status, String body) {
        return "Content-Type: application/http\r\n"
                + "Content-ID: <response-item:" + index + ">\r\n"
                + "\r\n"
                + "HTTP/1.1 " + status + " Reason\r\n"
                + "Content-Type: application/json; charset=UTF-8\r\n"
                + "Content-Length: " + body.getBytes(StandardCharsets.UTF_8).length + "\r\n"
                + "\r\n"
                + body;
    }

    static TestResponse multipart(List<String> parts) {
        StringBuilder body = new StringBuilder();
        for (String part : parts) {
            body.append("--").append(RESPONSE_BOUNDARY).append("\r\n").append(part).append("\r\n");
        }
        body.append("--").append(RESPONSE_BOUNDARY).append("--\r\n");
        return TestResponse.withBody(body.toString())
                .contentType("multipart/mixed; boundary=" + RESPONSE_BOUNDARY);
    }

    /**
     * A batch endpoint answering each request part with {@code partHandler}. Parts are written in a random order when
     * {@code shuffle} is set.
     */
    static Function<Request, Response> endpoint(Function<RequestPart, String> partHandler, boolean shuffle) {
        return request -> {
            List<String> parts = new ArrayList<>();
            for (RequestPart part : parse(request)) {
                parts.add(partHandler.apply(part));
            }
            if (shuffle) {
                List<String> original = ImmutableList.copyOf(parts);
                Collections.shuffle(parts, new Random(42));
                if (parts.equals(original)) {
                    Collections.reverse(parts);
                }
            }
            return multipart(ImmutableList.copyOf(parts));
        };
    }

    /** Echoes each part's request target as a JSON string with status 200. */
    static Function<Request, Response> echoEndpoint(boolean shuffle) {
        return endpoint(part -> responsePart(part.index, 200, '"' + part.target + '"'), shuffle);
    }
}
