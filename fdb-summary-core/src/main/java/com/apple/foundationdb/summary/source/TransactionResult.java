/*
 * TransactionResult.java
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
import com.apple.foundationdb.summary.summary.ReconcileResult;
import com.apple.foundationdb.summary.summary.SummaryTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a batch of source mutations did: the source rows inserted, and for each summary table the rows created and
 * the rows whose group changed.
 */
@API(API.Status.STABLE)
public final class TransactionResult {
    @Nonnull
    private final ImmutableList<Long> insertedRowIds;
    @Nonnull
    private final ImmutableMap<SummaryTable, ReconcileResult> summaryResults;

    private TransactionResult(@Nonnull ImmutableList<Long> insertedRowIds,
                              @Nonnull ImmutableMap<SummaryTable, ReconcileResult> summaryResults) {
        this.insertedRowIds = insertedRowIds;
        this.summaryResults = summaryResults;
    }

    @Nonnull
    static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public List<Long> getInsertedRowIds() {
        return insertedRowIds;
    }

    /**
     * Get what the batch did to one summary table.
     * @param table the summary table
     * @return the combined result of every reconcile of that table, or {@link ReconcileResult#EMPTY}
     */
    @Nonnull
    public ReconcileResult getResult(@Nonnull SummaryTable table) {
        return summaryResults.getOrDefault(table, ReconcileResult.EMPTY);
    }

    @Nonnull
    public Map<SummaryTable, ReconcileResult> getSummaryResults() {
        return summaryResults;
    }

    @Override
    public String toString() {
        return "TransactionResult{inserted=" + insertedRowIds + ", summaries=" + summaryResults + "}";
    }

    static class Builder {
        private final ImmutableList.Builder<Long> insertedRowIds = ImmutableList.builder();
        private final Map<SummaryTable, ReconcileResult.Builder> summaryResults = new LinkedHashMap<>();

        void addInserted(long rowId) {
            insertedRowIds.add(rowId);
        }

        void add(@Nonnull SummaryTable table, @Nonnull ReconcileResult result) {
            if (!result.isEmpty()) {
                summaryResults.computeIfAbsent(table, t -> ReconcileResult.newBuilder()).addAll(result);
            }
        }

        @Nonnull
        TransactionResult build() {
            final ImmutableMap.Builder<SummaryTable, ReconcileResult> results = ImmutableMap.builder();
            for (Map.Entry<SummaryTable, ReconcileResult.Builder> entry : summaryResults.entrySet()) {
                results.put(entry.getKey(), entry.getValue().build());
            }
            return new TransactionResult(insertedRowIds.build(), results.build());
        }
    }
}
