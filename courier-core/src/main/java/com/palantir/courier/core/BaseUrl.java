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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.palantir.courier.BindingException;
import com.palantir.courier.BoundCall;
import com.palantir.courier.UrlBuilder;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.io.ByteArrayOutputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** Renders {@link BoundCall bound calls} into absolute URLs below a fixed base. */
public final class BaseUrl {

    private static final Joiner PATH_JOINER = Joiner.on('/');
    private static final Joiner.MapJoiner QUERY_JOINER = Joiner.on('&').withKeyValueSeparator('=');

    private final URL base;
    private final String protocol;
    private final String host;
    private final int port;
    private final List<String> basePathSegments;

    public static BaseUrl of(URL baseUrl) {
        // Sanitize path syntax and strip all irrelevant URL components
        if (!baseUrl.getProtocol().equals("http") && !baseUrl.getProtocol().equals("https")) {
            throw new SafeIllegalArgumentException(
                    "unsupported protocol", SafeArg.of("protocol", baseUrl.getProtocol()));
        }
        if (Strings.emptyToNull(baseUrl.getQuery()) != null) {
            throw new SafeIllegalArgumentException(
                    "baseUrl query must be empty", UnsafeArg.of("query", baseUrl.getQuery()));
        }
        if (Strings.emptyToNull(baseUrl.getRef()) != null) {
            throw new SafeIllegalArgumentException("baseUrl ref must be empty", UnsafeArg.of("ref", baseUrl.getRef()));
        }
        if (Strings.emptyToNull(baseUrl.getUserInfo()) != null) {
            // the value of baseUrl.getUserInfo() may contain credential information and mustn't be logged
            throw new SafeIllegalArgumentException("baseUrl user info must be empty");
        }
        return new BaseUrl(baseUrl);
    }

    private BaseUrl(URL url) {
        this.base = url;
        this.protocol = url.getProtocol();
        this.host = url.getHost();
        this.port = url.getPort();
        Preconditions.checkArgument(port >= -1 && port <= 65535, "port must be in range [0, 65535] or default [-1]");
        this.basePathSegments = new ArrayList<>();
        String strippedBasePath = stripSlashes(url.getPath());
        if (!strippedBasePath.isEmpty()) {
            if (!UrlEncoder.isPath(strippedBasePath)) {
                throw new SafeIllegalArgumentException(
                        "invalid characters in encoded path segments", UnsafeArg.of("segments", strippedBasePath));
            }
            basePathSegments.add(strippedBasePath);
        }
    }

    /**
     * The absolute URL of a call: the call's URL override when present, otherwise the base URL followed by the
     * rendered path template and query parameters.
     */
    public URL render(BoundCall<?> call) {
        if (call.urlOverride().isPresent()) {
            return parseOverride(call.urlOverride().get());
        }
        DefaultUrlBuilder url = new DefaultUrlBuilder();
        call.renderPath(url);
        return url.build();
    }

    /** The path and query of a rendered call, as written on an HTTP request line. */
    public String renderRequestTarget(BoundCall<?> call) {
        return render(call).getFile();
    }

    public URL base() {
        return base;
    }

    private static URL parseOverride(String value) {
        try {
            URL url = new URL(value);
            if (!url.getProtocol().equals("http") && !url.getProtocol().equals("https")) {
                throw new BindingException(
                        "URL override has an unsupported protocol", SafeArg.of("protocol", url.getProtocol()));
            }
            return url;
        } catch (MalformedURLException e) {
            throw new BindingException("URL override is malformed", UnsafeArg.of("url", value));
        }
    }

    @Override
    public String toString() {
        return "BaseUrl{" + base + '}';
    }

    private final class DefaultUrlBuilder implements UrlBuilder {

        private final List<String> pathSegments = new ArrayList<>(basePathSegments);
        private final ListMultimap<String, String> queryNamesAndValues =
                MultimapBuilder.linkedHashKeys().arrayListValues(1).build();

        @Override
        public DefaultUrlBuilder pathSegment(String thePath) {
            pathSegments.add(UrlEncoder.encodePathSegment(thePath));
            return this;
        }

        @Override
        public DefaultUrlBuilder queryParam(String name, String value) {
            queryNamesAndValues.put(UrlEncoder.encodeQueryNameOrValue(name), UrlEncoder.encodeQueryNameOrValue(value));
            return this;
        }

        URL build() {
            StringBuilder file = new StringBuilder();
            file.append('/');
            PATH_JOINER.appendTo(file, pathSegments);
            if (!queryNamesAndValues.isEmpty()) {
                file.append('?');
                QUERY_JOINER.appendTo(file, queryNamesAndValues.entries());
            }
            try {
                return new URL(protocol, host, port, file.toString());
            } catch (MalformedURLException e) {
                throw new SafeIllegalArgumentException("Malformed URL", e);
            }
        }
    }

    private static String stripSlashes(String path) {
        if (path.isEmpty() || path.equals("/")) {
            return "";
        }
        int stripStart = path.startsWith("/") ? 1 : 0;
        int stripEnd = path.endsWith("/") ? 1 : 0;
        return path.substring(stripStart, path.length() - stripEnd);
    }

    /** Encodes URL components per https://tools.ietf.org/html/rfc3986 . */
    @VisibleForTesting
    static final class UrlEncoder {
        private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
        private static final CharMatcher ALPHA = CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));
        private static final CharMatcher UNRESERVED = DIGIT.or(ALPHA).or(CharMatcher.anyOf("-._~"));
        private static final CharMatcher SUB_DELIMS = CharMatcher.anyOf("!$&'()*+,;=");
        private static final CharMatcher IS_P_CHAR = UNRESERVED.or(CharMatcher.anyOf(":@"));
        private static final CharMatcher IS_PATH = UNRESERVED.or(SUB_DELIMS).or(CharMatcher.anyOf("/:@%"));
        // Sub-delimiters are percent encoded in query components so that values such as Drive search expressions
        // ("name = 'x' and trashed = false") survive intact.
        private static final CharMatcher IS_QUERY_CHAR = IS_P_CHAR.or(CharMatcher.anyOf("/?"));

        private UrlEncoder() {}

        static boolean isPath(String path) {
            return IS_PATH.matchesAllOf(path);
        }

        static String encodePathSegment(String pathComponent) {
            return encode(pathComponent, IS_P_CHAR);
        }

        static String encodeQueryNameOrValue(String nameOrValue) {
            return encode(nameOrValue, IS_QUERY_CHAR);
        }

        // percent-encodes every byte not matched by charactersToKeep (in its unsigned char sense)
        @VisibleForTesting
        static String encode(String source, CharMatcher charactersToKeep) {
            byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
            ByteArrayOutputStream bos = new ByteArrayOutputStream(source.length());
            boolean wasChanged = false;
            for (byte b : bytes) {
                char unsigned = (char) (b & 0xFF);
                if (charactersToKeep.matches(unsigned)) {
                    bos.write(b);
                } else {
                    bos.write('%');
                    bos.write(Character.toUpperCase(Character.forDigit((b >> 4) & 0xF, 16)));
                    bos.write(Character.toUpperCase(Character.forDigit(b & 0xF, 16)));
                    wasChanged = true;
                }
            }
            return wasChanged ? new String(bos.toByteArray(), StandardCharsets.UTF_8) : source;
        }
    }
}
