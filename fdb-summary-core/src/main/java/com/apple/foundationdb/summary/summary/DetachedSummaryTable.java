/*
 * DetachedSummaryTable.java
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
import com.apple.foundationdb.summary.metadata.ColumnDeclaration;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;

/**
 * A frozen copy of a summary table taken when it was detached. Its columns are no longer bound to the source table
 * and its rows are no longer maintained.
 */
@API(API.Status.STABLE)
public final class DetachedSummaryTable {
    @Nonnull
    private final String name;
    @Nonnull
    private final ImmutableList<ColumnDeclaration> columns;
    @Nonnull
    private final ImmutableSortedMap<Long, SummaryRow> rows;

    DetachedSummaryTable(@Nonnull String name, @Nonnull List<ColumnDeclaration> columns,
                         @Nonnull Collection<SummaryRow> rows) {
        this.name = name;
        this.columns = ImmutableList.copyOf(columns);
        final ImmutableSortedMap.Builder<Long, SummaryRow> builder = ImmutableSortedMap.naturalOrder();
        for (SummaryRow row : rows) {
            builder.put(row.getId(), row);
        }
        this.rows = builder.build();
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public List<ColumnDeclaration> getColumns() {
        return columns;
    }

    @Nonnull
    public Collection<SummaryRow> getRows() {
        return rows.values();
    }

    @Nullable
    public SummaryRow getRow(long rowId) {
        return rows.get(rowId);
    }

    @Override
    public String toString() {
        return "DetachedSummaryTable{" + name + ", rows=" + rows.size() + "}";
    }
}
