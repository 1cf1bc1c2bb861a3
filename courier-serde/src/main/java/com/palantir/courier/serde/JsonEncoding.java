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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.base.Suppliers;
import com.palantir.courier.DecodeException;
import com.palantir.courier.Deserializer;
import com.palantir.courier.RawResponse;
import com.palantir.courier.RequestBody;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeUncheckedIoException;
import java.io.IOException;
import java.util.Optional;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * JSON request bodies and response deserializers backed by Jackson. Deserializers only accept 2xx responses; any
 * other status is reported as a {@link DecodeException} carrying the status so that callers can still inspect it.
 */
public final class JsonEncoding {

    static final String CONTENT_TYPE = "application/json";

    private static final Supplier<JsonEncoding> DEFAULT = Suppliers.memoize(() -> new JsonEncoding(defaultMapper()));

    private final ObjectMapper mapper;

    private JsonEncoding(ObjectMapper mapper) {
        this.mapper = Preconditions.checkNotNull(mapper, "ObjectMapper is required");
    }

    /** The shared encoding: unknown properties are ignored and {@link Optional} is supported. */
    public static JsonEncoding json() {
        return DEFAULT.get();
    }

    public static JsonEncoding of(ObjectMapper mapper) {
        return new JsonEncoding(mapper);
    }

    public <T> Deserializer<T> deserializer(Class<T> type) {
        return deserializer(mapper.constructType(type));
    }

    public <T> Deserializer<T> deserializer(TypeReference<T> type) {
        return deserializer(mapper.constructType(type));
    }

    /**
     * Like {@link #deserializer(TypeReference)}, except {@code 204 No Content} and {@code 404 Not Found} decode to
     * {@link Optional#empty()}.
     */
    public <T> Deserializer<Optional<T>> optionalDeserializer(Class<T> type) {
        Deserializer<T> delegate = deserializer(type);
        return response -> {
            if (response.code() == 204 || response.code() == 404) {
                return Optional.empty();
            }
            return Optional.of(delegate.deserialize(response));
        };
    }

    private <T> Deserializer<T> deserializer(JavaType type) {
        ObjectReader reader = mapper.readerFor(type);
        return new Deserializer<T>() {
            @Override
            public T deserialize(RawResponse response) {
                if (!response.isSuccessful()) {
                    throw new DecodeException(
                            "Cannot decode a non-successful response",
                            SafeArg.of("status", response.code()),
                            SafeArg.of("type", type.getRawClass().getSimpleName()));
                }
                if (!matchesContentType(CONTENT_TYPE, response.contentType().orElse(null))) {
                    throw new DecodeException(
                            "Unexpected response content type",
                            SafeArg.of("status", response.code()),
                            SafeArg.of("contentType", response.contentType().orElse("")));
                }
                try {
                    T value = reader.readValue(response.body());
                    if (value == null) {
                        throw new DecodeException(
                                "Cannot deserialize a JSON null value",
                                SafeArg.of("type", type.getRawClass().getSimpleName()));
                    }
                    return value;
                } catch (IOException e) {
                    throw new DecodeException(
                            "Failed to deserialize JSON response",
                            e,
                            SafeArg.of("status", response.code()),
                            SafeArg.of("type", type.getRawClass().getSimpleName()));
                }
            }

            @Override
            public String toString() {
                return "JsonDeserializer{" + type + '}';
            }
        };
    }

    /** Serializes a value as an {@code application/json} request body. */
    public RequestBody body(Object value) {
        Preconditions.checkNotNull(value, "cannot serialize null value");
        ObjectWriter writer = mapper.writer();
        try {
            return RequestBody.of(writer.writeValueAsBytes(value), CONTENT_TYPE);
        } catch (IOException e) {
            throw new SafeUncheckedIoException(
                    "Failed to serialize request body",
                    e,
                    SafeArg.of("type", value.getClass().getSimpleName()),
                    UnsafeArg.of("value", value));
        }
    }

    static boolean matchesContentType(String contentType, @Nullable String typeToCheck) {
        // absent content type is accepted
        return typeToCheck == null
                // Use startsWith to avoid failures due to charset
                || typeToCheck.startsWith(contentType);
    }

    private static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new Jdk8Module())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public String toString() {
        return "JsonEncoding{" + CONTENT_TYPE + '}';
    }
}
