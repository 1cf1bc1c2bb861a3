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

import com.palantir.logsafe.Preconditions;
import java.util.Optional;
import java.util.function.Function;

public final class PageAdvancers {

    /**
     * Follows a continuation token or next-page URL read from each page. A missing or empty token ends the
     * sequence.
     */
    public static <T> PageAdvancer<T> token(Function<? super T, Optional<String>> extractor) {
        Preconditions.checkNotNull(extractor, "extractor");
        return page -> extractor.apply(page).filter(token -> !token.isEmpty()).map(ContinuationToken::of);
    }

    /**
     * Steps through an offset/limit result set. The extractor describes the page it was given; the sequence ends
     * once the next start index would pass the total count.
     */
    public static <T> PageAdvancer<T> offset(Function<? super T, OffsetCursor> extractor) {
        Preconditions.checkNotNull(extractor, "extractor");
        return page -> extractor.apply(page).next().map(PageCursor.class::cast);
    }

    private PageAdvancers() {}
}
