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

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.net.HttpHeaders;
import com.google.common.net.MediaType;
import com.google.common.primitives.Ints;
import com.palantir.courier.BatchPartException;
import com.palantir.courier.BoundCall;
import com.palantir.courier.CallResult;
import com.palantir.courier.RawResponse;
import com.palantir.courier.RequestBody;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads and writes {@code multipart/mixed} batch bodies. Each request part embeds one HTTP request tagged with
 * {@code Content-ID: <item:N>}; response parts are correlated through {@code Content-ID: <response-item:N>} and never
 * by position.
 *
 * <p>Bodies are handled as ISO-8859-1 text so that every byte maps to exactly one character and part payloads
 * round-trip unchanged.
 */
final class MultipartBatchCodec {

    private static final SafeLogger log = SafeLoggerFactory.get(MultipartBatchCodec.class);

    static final String PART_CONTENT_TYPE = "application/http";
    static final String ITEM_PREFIX = "item:";
    static final String RESPONSE_PREFIX = "response-";

    private static final String CRLF = "\r\n";
    private static final SecureRandom RANDOM = new SecureRandom();

    private MultipartBatchCodec() {}

    static String newBoundary() {
        return "batch_" + Long.toHexString(RANDOM.nextLong() & Long.MAX_VALUE) + Long.toHexString(System.nanoTime());
    }

    static String contentId(int index) {
        return '<' + ITEM_PREFIX + index + '>';
    }

    /** A request part to encode: the call, its original index and its rendered request target. */
    static final class Part {
        private final int index;
        private final BoundCall<?> call;
        private final String requestTarget;

        Part(int index, BoundCall<?> call, String requestTarget) {
            this.index = index;
            this.call = call;
            this.requestTarget = requestTarget.isEmpty() ? "/" : requestTarget;
        }

        int index() {
            return index;
        }
    }

    static RequestBody encode(List<Part> parts, String boundary) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Part part : parts) {
            BoundCall<?> call = part.call;
            StringBuilder head = new StringBuilder();
            head.append("--").append(boundary).append(CRLF);
            head.append(HttpHeaders.CONTENT_TYPE).append(": ").append(PART_CONTENT_TYPE).append(CRLF);
            head.append("Content-ID: ").append(contentId(part.index)).append(CRLF);
            head.append(CRLF);
            head.append(call.descriptor().method().name())
                    .append(' ')
                    .append(part.requestTarget)
                    .append(" HTTP/1.1")
                    .append(CRLF);
            call.headerParams().forEach((name, value) -> {
                if (!HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(name)
                        && !HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name)) {
                    head.append(name).append(": ").append(value).append(CRLF);
                }
            });
            Optional<RequestBody> body = call.body();
            if (body.isPresent()) {
                head.append(HttpHeaders.CONTENT_TYPE)
                        .append(": ")
                        .append(body.get().contentType())
                        .append(CRLF);
                head.append(HttpHeaders.CONTENT_LENGTH)
                        .append(": ")
                        .append(body.get().contentLength())
                        .append(CRLF);
            }
            head.append(CRLF);
            out.writeBytes(head.toString().getBytes(StandardCharsets.UTF_8));
            body.ifPresent(value -> out.writeBytes(value.content()));
            out.writeBytes(CRLF.getBytes(StandardCharsets.US_ASCII));
        }
        out.writeBytes(("--" + boundary + "--" + CRLF).getBytes(StandardCharsets.US_ASCII));
        return RequestBody.of(out.toByteArray(), "multipart/mixed; boundary=" + boundary);
    }

    /** The multipart boundary of an envelope response, if it is a multipart response at all. */
    static Optional<String> boundary(RawResponse envelope) {
        Optional<String> contentType = envelope.contentType();
        if (contentType.isEmpty()) {
            return Optional.empty();
        }
        MediaType mediaType;
        try {
            mediaType = MediaType.parse(contentType.get());
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable batch response content type", UnsafeArg.of("contentType", contentType.get()), e);
            return Optional.empty();
        }
        if (!mediaType.type().equals("multipart")) {
            return Optional.empty();
        }
        return mediaType.parameters().get("boundary").stream()
                .filter(value -> !value.isEmpty())
                .findFirst();
    }

    /**
     * Splits a multipart envelope into parts keyed by item index. Parts whose content id cannot be read are
     * dropped; parts with a readable id but an unreadable payload map to a {@link BatchPartException}.
     */
    static Map<Integer, CallResult<RawResponse>> decode(byte[] body, String boundary) {
        Map<Integer, CallResult<RawResponse>> results = new TreeMap<>();
        for (String part : split(new String(body, StandardCharsets.ISO_8859_1), "--" + boundary)) {
            ListMultimap<String, String> partHeaders = LinkedListMultimap.create();
            int payloadStart = readHeaders(part, 0, partHeaders);
            Optional<Integer> index = itemIndex(partHeaders);
            if (index.isEmpty()) {
                log.debug("Ignoring batch response part without a usable Content-ID");
                continue;
            }
            if (results.containsKey(index.get())) {
                log.debug("Ignoring duplicate batch response part", SafeArg.of("index", index.get()));
                continue;
            }
            results.put(index.get(), parsePart(part, payloadStart, index.get()));
        }
        return results;
    }

    private static List<String> split(String text, String delimiter) {
        List<String> parts = new ArrayList<>();
        int position = findDelimiter(text, delimiter, 0);
        while (position >= 0) {
            int afterDelimiter = position + delimiter.length();
            if (text.startsWith("--", afterDelimiter)) {
                break;
            }
            int lineEnd = text.indexOf('\n', afterDelimiter);
            if (lineEnd < 0) {
                break;
            }
            int contentStart = lineEnd + 1;
            int next = findDelimiter(text, delimiter, contentStart);
            if (next < 0) {
                parts.add(text.substring(contentStart));
                break;
            }
            parts.add(text.substring(contentStart, stripLineBreak(text, contentStart, next)));
            position = next;
        }
        return parts;
    }

    /** Delimiters only count at the start of a line. */
    private static int findDelimiter(String text, String delimiter, int from) {
        int candidate = text.indexOf(delimiter, from);
        while (candidate > 0 && text.charAt(candidate - 1) != '\n') {
            candidate = text.indexOf(delimiter, candidate + 1);
        }
        return candidate;
    }

    private static int stripLineBreak(String text, int start, int end) {
        int result = end;
        if (result > start && text.charAt(result - 1) == '\n') {
            result--;
            if (result > start && text.charAt(result - 1) == '\r') {
                result--;
            }
        }
        return result;
    }

    /** Reads header lines into {@code headers}, returning the offset after the blank line or -1 if there is none. */
    private static int readHeaders(String text, int start, ListMultimap<String, String> headers) {
        int position = start;
        while (position < text.length()) {
            int lineEnd = text.indexOf('\n', position);
            int next = lineEnd < 0 ? text.length() : lineEnd + 1;
            String line = stripCarriageReturn(text.substring(position, lineEnd < 0 ? text.length() : lineEnd));
            if (line.isEmpty()) {
                return next;
            }
            int colon = line.indexOf(':');
            if (colon > 0) {
                headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
            }
            position = next;
        }
        return -1;
    }

    private static Optional<Integer> itemIndex(ListMultimap<String, String> partHeaders) {
        for (Map.Entry<String, String> header : partHeaders.entries()) {
            if (!header.getKey().equalsIgnoreCase("Content-ID")) {
                continue;
            }
            String id = header.getValue();
            if (id.startsWith("<") && id.endsWith(">")) {
                id = id.substring(1, id.length() - 1);
            }
            if (id.startsWith(RESPONSE_PREFIX)) {
                id = id.substring(RESPONSE_PREFIX.length());
            }
            if (!id.startsWith(ITEM_PREFIX)) {
                return Optional.empty();
            }
            Integer index = Ints.tryParse(id.substring(ITEM_PREFIX.length()));
            return index == null || index < 0 ? Optional.empty() : Optional.of(index);
        }
        return Optional.empty();
    }

    private static CallResult<RawResponse> parsePart(String part, int payloadStart, int index) {
        if (payloadStart < 0) {
            return CallResult.failure(
                    new BatchPartException("Batch response part has no header terminator", index, null));
        }
        try {
            return CallResult.success(parseResponse(part, payloadStart, index));
        } catch (BatchPartException e) {
            return CallResult.failure(e);
        }
    }

    private static RawResponse parseResponse(String part, int start, int index) {
        int lineEnd = part.indexOf('\n', start);
        if (lineEnd < 0) {
            throw new BatchPartException("Batch response part has no status line", index, null);
        }
        String statusLine = stripCarriageReturn(part.substring(start, lineEnd));
        int code = parseStatus(statusLine, index);

        ListMultimap<String, String> headers = LinkedListMultimap.create();
        int bodyStart = readHeaders(part, lineEnd + 1, headers);
        String body = bodyStart < 0 ? "" : part.substring(bodyStart);
        body = truncateToContentLength(body, headers, index);

        RawResponse.Builder builder = RawResponse.builder().code(code).putAllHeaders(headers);
        return builder.body(body.getBytes(StandardCharsets.ISO_8859_1)).build();
    }

    private static int parseStatus(String statusLine, int index) {
        String[] tokens = statusLine.split(" ", 3);
        Integer code = tokens.length >= 2 && tokens[0].startsWith("HTTP/") ? Ints.tryParse(tokens[1]) : null;
        if (code == null || code < 100 || code > 999) {
            throw new BatchPartException(
                    "Batch response part has a malformed status line",
                    index,
                    null,
                    UnsafeArg.of("statusLine", statusLine));
        }
        return code;
    }

    private static String truncateToContentLength(String body, ListMultimap<String, String> headers, int index) {
        Optional<String> header = headers.entries().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(HttpHeaders.CONTENT_LENGTH))
                .map(Map.Entry::getValue)
                .findFirst();
        if (header.isEmpty()) {
            return body;
        }
        String contentLength = header.get();
        Integer length = Ints.tryParse(contentLength);
        if (length == null || length < 0 || length > body.length()) {
            throw new BatchPartException(
                    "Batch response part body does not match its Content-Length",
                    index,
                    null,
                    SafeArg.of("contentLength", contentLength),
                    SafeArg.of("available", body.length()));
        }
        return body.substring(0, length);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
