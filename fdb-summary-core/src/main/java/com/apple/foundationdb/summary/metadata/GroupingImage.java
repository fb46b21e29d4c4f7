/*
 * GroupingImage.java
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

package com.apple.foundationdb.summary.metadata;

import com.apple.foundationdb.summary.annotation.API;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * What one source row contributes to a grouping: the atoms of each grouping column, in grouping order, and the
 * key tuples those atoms expand into.
 */
@API(API.Status.INTERNAL)
public final class GroupingImage {
    private final long rowId;
    @Nonnull
    private final ImmutableList<List<Object>> columnAtoms;
    @Nonnull
    private final ImmutableList<KeyTuple> tuples;

    GroupingImage(long rowId, @Nonnull List<List<Object>> columnAtoms, @Nonnull List<KeyTuple> tuples) {
        this.rowId = rowId;
        this.columnAtoms = ImmutableList.copyOf(columnAtoms);
        this.tuples = ImmutableList.copyOf(tuples);
    }

    public long getRowId() {
        return rowId;
    }

    /**
     * Get the atoms of one grouping column. A scalar column has exactly one (possibly {@code null}) atom.
     * @param columnIndex position of the column within the grouping
     * @return the atoms of that column, in declared order
     */
    @Nonnull
    public List<Object> getColumnAtoms(int columnIndex) {
        return columnAtoms.get(columnIndex);
    }

    public int getColumnCount() {
        return columnAtoms.size();
    }

    @Nonnull
    public List<KeyTuple> getTuples() {
        return tuples;
    }

    /**
     * Whether this image groups exactly like another, so that switching between them changes nothing.
     * @param other the other image
     * @return {@code true} if both have the same atoms in every grouping column
     */
    public boolean sameGroupingAs(@Nonnull GroupingImage other) {
        return columnAtoms.equals(other.columnAtoms);
    }

    @Override
    public String toString() {
        return "GroupingImage{" + rowId + ": " + tuples + "}";
    }
}
