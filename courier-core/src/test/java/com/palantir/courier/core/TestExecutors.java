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

import com.palantir.courier.Channel;
import com.palantir.courier.CredentialSupplier;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.Optional;

final class TestExecutors {

    static final String BASE_URL = "https://www.googleapis.com";

    private TestExecutors() {}

    static ChannelCallExecutor network(Channel channel) {
        return new ChannelCallExecutor(
                channel,
                BaseUrl.of(url(BASE_URL)),
                CredentialSupplier.none(),
                Optional.empty(),
                CourierExecutors.timeoutScheduler.get());
    }

    static URL url(String value) {
        try {
            return new URL(value);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
