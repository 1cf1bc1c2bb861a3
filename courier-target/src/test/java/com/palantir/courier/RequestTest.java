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

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.net.MalformedURLException;
import java.net.URL;
import org.junit.jupiter.api.Test;

public final class RequestTest {

    @Test
    public void testPutAllHeaderParamsFromCaseInsensitiveMultimap() throws MalformedURLException {
        ListMultimap<String, String> headers =
                MultimapBuilder.treeKeys(String.CASE_INSENSITIVE_ORDER).arrayListValues().build();
        headers.put("X-Goog-User-Project", "p");
        headers.put("Accept", "application/json");

        Request request = Request.builder()
                .method(HttpMethod.GET)
                .url(new URL("https://www.googleapis.com/drive/v3/files"))
                .putAllHeaderParams(headers)
                .build();

        assertThat(request.headerParams().get("x-goog-user-project")).containsExactly("p");
        assertThat(request.headerParams().get("ACCEPT")).containsExactly("application/json");
    }

    @Test
    public void testBodyRejectedForGet() {
        assertThatThrownBy(() -> Request.builder()
                        .method(HttpMethod.GET)
                        .url(new URL("https://www.googleapis.com/drive/v3/files"))
                        .body(RequestBody.ofString("{}", "application/json"))
                        .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
