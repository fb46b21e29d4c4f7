/*
 * SummaryRow.java
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

package com.apple.foundationdb.summary.summary;

import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.SortedSet;

/**
 * One row of a summary table: a key tuple together with the source rows currently matching it.
 * Rows are immutable; the maintainer replaces a row when its matched set changes.
 */
@API(API.Status.STABLE)
public final class SummaryRow {
    private final long id;
    @Nonnull
    private final KeyTuple groupingValues;
    @Nonnull
    private final ImmutableSortedSet<Long> matchedSourceRows;

    public SummaryRow(long id, @Nonnull KeyTuple groupingValues, @Nonnull SortedSet<Long> matchedSourceRows) {
        this.id = id;
        this.groupingValues = groupingValues;
        this.matchedSourceRows = ImmutableSortedSet.copyOfSorted(matchedSourceRows);
    }

    public long getId() {
        return id;
    }

    @Nonnull
    public KeyTuple getGroupingValues() {
        return groupingValues;
    }

    /**
     * Get the source rows in this row's group.
     * @return the ids of the matching source rows, ascending
     */
    @Nonnull
    public ImmutableSortedSet<Long> getMatchedSourceRows() {
        return matchedSourceRows;
    }

    public int getCount() {
        return matchedSourceRows.size();
    }

    @Nonnull
    SummaryRow withMatchedSourceRows(@Nonnull SortedSet<Long> matched) {
        return new SummaryRow(id, groupingValues, matched);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SummaryRow that = (SummaryRow)o;
        return id == that.id && groupingValues.equals(that.groupingValues)
               && matchedSourceRows.equals(that.matchedSourceRows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, groupingValues, matchedSourceRows);
    }

    @Override
    public String toString() {
        return id + ":" + groupingValues + "->" + matchedSourceRows;
    }
}
