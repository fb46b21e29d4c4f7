/*
 * EqualityIndex.java
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
import javax.annotation.concurrent.NotThreadSafe;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * A {@link LookupIndex} that maps each full key tuple to the set of source rows belonging to it.
 * Lookups are a single hash probe.
 */
@API(API.Status.UNSTABLE)
@NotThreadSafe
public class EqualityIndex implements LookupIndex {
    @Nonnull
    private final Map<KeyTuple, NavigableSet<Long>> postings = new HashMap<>();
    private long postingCount;

    @Nonnull
    @Override
    public IndexKind getKind() {
        return IndexKind.EQUALITY;
    }

    /**
     * Add a row to the posting set of a key tuple.
     * @param rowId the source row
     * @param key the key tuple
     * @return {@code true} if the row was not already there
     */
    public boolean add(long rowId, @Nonnull KeyTuple key) {
        final boolean added = postings.computeIfAbsent(key, k -> new TreeSet<>()).add(rowId);
        if (added) {
            postingCount++;
        }
        return added;
    }

    /**
     * Remove a row from the posting set of a key tuple.
     * @param rowId the source row
     * @param key the key tuple
     * @return {@code true} if the row was there
     */
    public boolean remove(long rowId, @Nonnull KeyTuple key) {
        final NavigableSet<Long> rows = postings.get(key);
        if (rows == null || !rows.remove(rowId)) {
            return false;
        }
        if (rows.isEmpty()) {
            postings.remove(key);
        }
        postingCount--;
        return true;
    }

    @Override
    public void update(@Nullable GroupingImage oldImage, @Nullable GroupingImage newImage) {
        final List<KeyTuple> oldTuples = oldImage == null ? Collections.emptyList() : oldImage.getTuples();
        final List<KeyTuple> newTuples = newImage == null ? Collections.emptyList() : newImage.getTuples();
        final Set<KeyTuple> kept = new HashSet<>(oldTuples);
        kept.retainAll(newTuples);
        if (oldImage != null) {
            for (KeyTuple key : oldTuples) {
                if (!kept.contains(key)) {
                    remove(oldImage.getRowId(), key);
                }
            }
        }
        if (newImage != null) {
            for (KeyTuple key : newTuples) {
                if (!kept.contains(key)) {
                    add(newImage.getRowId(), key);
                }
            }
        }
    }

    @Nonnull
    @Override
    public ImmutableSortedSet<Long> matches(@Nonnull KeyTuple key) {
        final NavigableSet<Long> rows = postings.get(key);
        return rows == null ? ImmutableSortedSet.of() : ImmutableSortedSet.copyOfSorted(rows);
    }

    /**
     * Get the number of distinct key tuples with at least one row.
     * @return the number of non-empty posting sets
     */
    public int getKeyCount() {
        return postings.size();
    }

    @Override
    public long getPostingCount() {
        return postingCount;
    }

    @Override
    public void clear() {
        postings.clear();
        postingCount = 0;
    }

    @Override
    public String toString() {
        return "EqualityIndex{keys=" + postings.size() + ", postings=" + postingCount + "}";
    }
}
