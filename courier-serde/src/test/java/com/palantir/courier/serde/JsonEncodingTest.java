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

package com.palantir.courier.serde;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.palantir.courier.DecodeException;
import com.palantir.courier.Deserializer;
import com.palantir.courier.RawResponse;
import com.palantir.courier.RequestBody;
import com.palantir.logsafe.exceptions.SafeNullPointerException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public final class JsonEncodingTest {

    private final JsonEncoding json = JsonEncoding.json();

    @Test
    public void testDeserializeIgnoresUnknownProperties() {
        File file = json.deserializer(File.class)
                .deserialize(response(200, "{\"id\":\"abc\",\"name\":\"notes.txt\",\"size\":\"12\"}"));

        assertThat(file.id).isEqualTo("abc");
        assertThat(file.name).hasValue("notes.txt");
    }

    @Test
    public void testOptionalFields() {
        File file = json.deserializer(File.class).deserialize(response(200, "{\"id\":\"abc\"}"));
        assertThat(file.name).isEmpty();
    }

    @Test
    public void testGenericTypes() {
        Map<String, List<Integer>> value = json.deserializer(new TypeReference<Map<String, List<Integer>>>() {})
                .deserialize(response(200, "{\"a\":[1,2],\"b\":[]}"));

        assertThat(value).containsEntry("a", List.of(1, 2)).containsEntry("b", List.of());
        assertThat(json.deserializer(new TypeReference<Optional<String>>() {}).deserialize(response(200, "null")))
                .isEmpty();
    }

    @Test
    public void testUnsuccessfulResponsesAreDecodeFailures() {
        assertThatThrownBy(() -> json.deserializer(File.class).deserialize(response(403, "{\"error\":{}}")))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("status=403");
    }

    @Test
    public void testContentType() {
        Deserializer<File> deserializer = json.deserializer(File.class);

        assertThat(deserializer
                        .deserialize(RawResponse.builder().body("{\"id\":\"a\"}").build())
                        .id)
                .isEqualTo("a");
        assertThatThrownBy(() -> deserializer.deserialize(RawResponse.builder()
                        .putHeaders("Content-Type", "text/html")
                        .body("<html/>")
                        .build()))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("Unexpected response content type");
    }

    @Test
    public void testRejectsNullsAndMalformedJson() {
        assertThatThrownBy(() -> json.deserializer(String.class).deserialize(response(200, "null")))
                .isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> json.deserializer(File.class).deserialize(response(200, "{\"id\":")))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("Failed to deserialize JSON response");
    }

    @Test
    public void testOptionalDeserializer() {
        Deserializer<Optional<File>> deserializer = json.optionalDeserializer(File.class);

        assertThat(deserializer.deserialize(response(404, "{\"error\":{}}"))).isEmpty();
        assertThat(deserializer.deserialize(RawResponse.builder().code(204).build()))
                .isEmpty();
        assertThat(deserializer.deserialize(response(200, "{\"id\":\"x\"}")))
                .hasValueSatisfying(file -> assertThat(file.id).isEqualTo("x"));
        assertThatThrownBy(() -> deserializer.deserialize(response(500, "{}")))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    public void testBody() {
        RequestBody body = json.body(Map.of("name", "renamed.txt"));

        assertThat(body.contentType()).isEqualTo("application/json");
        assertThat(new String(body.content(), StandardCharsets.UTF_8)).isEqualTo("{\"name\":\"renamed.txt\"}");
        assertThatThrownBy(() -> json.body(null)).isInstanceOf(SafeNullPointerException.class);
    }

    @Test
    public void testCustomMapper() {
        JsonEncoding strict =
                JsonEncoding.of(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

        assertThatThrownBy(() -> strict.deserializer(Id.class).deserialize(response(200, "{\"id\":\"a\",\"b\":1}")))
                .isInstanceOf(DecodeException.class);
        assertThat(strict.deserializer(Id.class).deserialize(response(200, "{\"id\":\"a\"}")).id)
                .isEqualTo("a");
    }

    private static RawResponse response(int code, String body) {
        return RawResponse.builder()
                .code(code)
                .putHeaders("Content-Type", "application/json; charset=UTF-8")
                .body(body)
                .build();
    }

    static final class File {
        final String id;
        final Optional<String> name;

        @JsonCreator
        File(@JsonProperty("id") String id, @JsonProperty("name") Optional<String> name) {
            this.id = id;
            this.name = name;
        }
    }

    static final class Id {
        final String id;

        @JsonCreator
        Id(@JsonProperty("id") String id) {
            this.id = id;
        }
    }
}
