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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class UrlTemplateTest {

    @Test
    public void testVariablesInPathOrder() {
        UrlTemplate template = UrlTemplate.parse("/users/{userId}/messages/{id}");
        assertThat(template.variables()).containsExactly("userId", "id");
    }

    @Test
    public void testFill() {
        RecordingUrlBuilder url = new RecordingUrlBuilder();
        UrlTemplate.parse("/users/{userId}/messages/{id}")
                .fill(ImmutableMap.of("userId", "me", "id", "a b"), url);
        assertThat(url.segments).containsExactly("users", "me", "messages", "a b");
    }

    @Test
    public void testFillMissingValue() {
        UrlTemplate template = UrlTemplate.parse("/users/{userId}");
        assertThatThrownBy(() -> template.fill(ImmutableMap.of(), new RecordingUrlBuilder()))
                .isInstanceOf(BindingException.class)
                .hasMessageContaining("userId");
    }

    @Test
    public void testDuplicateVariable() {
        assertThatThrownBy(() -> UrlTemplate.parse("/{a}/{a}")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testPartialSegmentPlaceholder() {
        assertThatThrownBy(() -> UrlTemplate.parse("/files/id-{id}")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> UrlTemplate.parse("/files/{}")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testEquality() {
        assertThat(UrlTemplate.parse("/a/{b}")).isEqualTo(UrlTemplate.parse("a/{b}/"));
        assertThat(UrlTemplate.parse("/a/{b}")).isNotEqualTo(UrlTemplate.parse("/a/{c}"));
    }

    private static final class RecordingUrlBuilder implements UrlBuilder {
        private final List<String> segments = new ArrayList<>();

        @Override
        public UrlBuilder pathSegment(String thePath) {
            segments.add(thePath);
            return this;
        }

        @Override
        public UrlBuilder queryParam(String name, String value) {
            return this;
        }
    }
}
