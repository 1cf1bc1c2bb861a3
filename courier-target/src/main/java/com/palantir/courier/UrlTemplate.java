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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A parsed path template such as {@code /drive/v3/files/{fileId}/permissions}. Segments wrapped in braces are
 * placeholders which must be bound before the path can be rendered.
 */
@Immutable
public final class UrlTemplate {

    private static final Splitter SLASH_SPLITTER = Splitter.on('/').omitEmptyStrings();

    private final String template;
    private final ImmutableList<Segment> segments;
    private final ImmutableSet<String> variables;

    private UrlTemplate(String template, ImmutableList<Segment> segments) {
        this.template = template;
        this.segments = segments;
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        int variableCount = 0;
        for (Segment segment : segments) {
            if (segment.variable != null) {
                names.add(segment.variable);
                variableCount++;
            }
        }
        this.variables = names.build();
        Preconditions.checkArgument(
                variables.size() == variableCount,
                "Duplicate segment variable names not allowed",
                UnsafeArg.of("template", template));
    }

    public static UrlTemplate parse(String template) {
        Preconditions.checkNotNull(template, "template");
        ImmutableList.Builder<Segment> segments = ImmutableList.builder();
        for (String part : SLASH_SPLITTER.split(template)) {
            if (part.startsWith("{") && part.endsWith("}")) {
                String name = part.substring(1, part.length() - 1);
                if (name.isEmpty() || name.contains("{") || name.contains("}")) {
                    throw new SafeIllegalArgumentException(
                            "Invalid placeholder in url template", UnsafeArg.of("template", template));
                }
                segments.add(Segment.variable(name));
            } else if (part.contains("{") || part.contains("}")) {
                throw new SafeIllegalArgumentException(
                        "Placeholders must span a whole path segment", UnsafeArg.of("template", template));
            } else {
                segments.add(Segment.fixed(part));
            }
        }
        return new UrlTemplate(template, segments.build());
    }

    /** Names of every placeholder, in path order. */
    public Set<String> variables() {
        return variables;
    }

    /** Populates this template with the given named parameters. */
    public void fill(Map<String, String> parameters, UrlBuilder url) {
        for (Segment segment : segments) {
            if (segment.fixed != null) {
                url.pathSegment(segment.fixed);
            } else {
                String value = parameters.get(segment.variable);
                if (value == null) {
                    throw new BindingException(
                            "Missing value for path placeholder", SafeArg.of("placeholder", segment.variable));
                }
                url.pathSegment(value);
            }
        }
    }

    @Override
    public String toString() {
        return template;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof UrlTemplate && segments.equals(((UrlTemplate) other).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Immutable
    private static final class Segment {
        @Nullable
        private final String fixed;

        @Nullable
        private final String variable;

        private Segment(@Nullable String fixed, @Nullable String variable) {
            this.fixed = fixed;
            this.variable = variable;
        }

        static Segment fixed(String fixed) {
            return new Segment(fixed, null);
        }

        static Segment variable(String variable) {
            return new Segment(null, variable);
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Segment)) {
                return false;
            }
            Segment that = (Segment) other;
            return Objects.equals(fixed, that.fixed) && Objects.equals(variable, that.variable);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fixed, variable);
        }
    }
}
