/*
 * LookupIndexes.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2026 Apple Inc. and the FoundationDB project authors
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

package com.apple.foundationdb.summary.index;

import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.metadata.GroupingKey;

import javax.annotation.Nonnull;

/**
 * Chooses the {@link LookupIndex} variant for a grouping.
 */
@API(API.Status.INTERNAL)
public final class LookupIndexes {
    private LookupIndexes() {
    }

    /**
     * Get the index kind a grouping calls for: {@link IndexKind#EQUALITY} if every grouping column is scalar,
     * {@link IndexKind#MEMBERSHIP} otherwise.
     * @param groupingKey the grouping
     * @return the index kind
     */
    @Nonnull
    public static IndexKind kindFor(@Nonnull GroupingKey groupingKey) {
        return groupingKey.isAllScalar() ? IndexKind.EQUALITY : IndexKind.MEMBERSHIP;
    }

    /**
     * Create an empty index of the kind a grouping calls for.
     * @param groupingKey the grouping
     * @return a new, empty index
     */
    @Nonnull
    public static LookupIndex forGrouping(@Nonnull GroupingKey groupingKey) {
        switch (kindFor(groupingKey)) {
            case EQUALITY:
                return new EqualityIndex();
            case MEMBERSHIP:
            default:
                return new MembershipIndex(groupingKey.getColumnCount());
        }
    }
}
