/*
 * IndexRegistry.java
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

package com.apple.foundationdb.summary.source;

import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.index.LookupIndex;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.summary.DetachedSummaryException;
import com.apple.foundationdb.summary.summary.StaleTupleReferenceException;
import com.apple.foundationdb.summary.summary.SummaryTable;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The lookup indexes of the summary tables of one source table, keyed by the summary table itself.
 * Summary tables do not override {@code equals}, so lookups are by identity. Iteration follows registration order.
 */
@API(API.Status.INTERNAL)
public class IndexRegistry {
    @Nonnull
    private final Map<SummaryTable, LookupIndex> indexes = new LinkedHashMap<>();

    void register(@Nonnull SummaryTable table, @Nonnull LookupIndex index) {
        if (indexes.putIfAbsent(table, index) != null) {
            throw new StaleTupleReferenceException("summary table already has an index",
                    LogMessageKeys.SUMMARY_TABLE, table.getName());
        }
    }

    void replace(@Nonnull SummaryTable table, @Nonnull LookupIndex index) {
        if (indexes.replace(table, index) == null) {
            throw noIndex(table);
        }
    }

    void unregister(@Nonnull SummaryTable table) {
        if (indexes.remove(table) == null) {
            throw noIndex(table);
        }
    }

    /**
     * Get the index of a summary table.
     * @param table the summary table
     * @return its lookup index
     * @throws DetachedSummaryException if the table has no index here
     */
    @Nonnull
    public LookupIndex getIndex(@Nonnull SummaryTable table) {
        final LookupIndex index = indexes.get(table);
        if (index == null) {
            throw noIndex(table);
        }
        return index;
    }

    public boolean contains(@Nonnull SummaryTable table) {
        return indexes.containsKey(table);
    }

    @Nonnull
    public List<SummaryTable> getTables() {
        return ImmutableList.copyOf(indexes.keySet());
    }

    public int size() {
        return indexes.size();
    }

    @Nonnull
    private static DetachedSummaryException noIndex(@Nonnull SummaryTable table) {
        return new DetachedSummaryException("summary table is not registered with this source table",
                LogMessageKeys.SUMMARY_TABLE, table.getName());
    }
}
