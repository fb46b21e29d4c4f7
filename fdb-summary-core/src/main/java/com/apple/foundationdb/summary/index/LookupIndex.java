/*
 * LookupIndex.java
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
import com.apple.foundationdb.summary.metadata.GroupingImage;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An index from key tuples to the source rows that match them, maintained incrementally as source rows change.
 *
 * <p>
 * Implementations are {@link EqualityIndex} and {@link MembershipIndex}; which one a summary uses is decided once,
 * when it is created, by {@link LookupIndexes#forGrouping}. An index is owned by exactly one summary table and is
 * only mutated through {@link #update}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public interface LookupIndex {

    @Nonnull
    IndexKind getKind();

    /**
     * Move a source row from its old grouping image to its new one. Only the difference between the two images is
     * applied: postings present in both are left alone. A {@code null} old image is an insert, a {@code null} new
     * image is a delete.
     * @param oldImage what the row contributed before, or {@code null}
     * @param newImage what the row contributes now, or {@code null}
     */
    void update(@Nullable GroupingImage oldImage, @Nullable GroupingImage newImage);

    /**
     * Get the source rows matching a key tuple.
     * @param key the key tuple
     * @return the ids of the matching source rows, ascending
     */
    @Nonnull
    ImmutableSortedSet<Long> matches(@Nonnull KeyTuple key);

    /**
     * Get the total number of postings held, summed over every posting list.
     * @return the number of postings
     */
    long getPostingCount();

    /**
     * Remove every posting.
     */
    void clear();
}
