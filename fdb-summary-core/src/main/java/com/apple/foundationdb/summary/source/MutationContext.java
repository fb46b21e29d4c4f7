/*
 * MutationContext.java
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
import com.apple.foundationdb.summary.logging.KeyValueLogMessage;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.summary.SummaryRow;
import com.apple.foundationdb.summary.summary.SummaryRowJournal;
import com.apple.foundationdb.summary.summary.SummaryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A transaction over a source table and its summaries. Every change made while the context is open is recorded so
 * that, unless {@link #commit()} is called before {@link #close()}, all of it is undone: source rows, summary rows
 * and lookup indexes. Row id counters are not wound back, so ids handed out inside a rolled back context are never
 * reused.
 *
 * <pre><code>
 * try (MutationContext context = source.openContext()) {
 *     source.insertRow(values);
 *     source.renameLabel("tags", "a", "aa");
 *     context.commit();
 * }
 * </code></pre>
 *
 * <p>
 * Only the first change to each row is recorded, which is the state to go back to.
 * </p>
 */
@API(API.Status.STABLE)
public class MutationContext implements AutoCloseable, SummaryRowJournal {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(MutationContext.class);

    @Nonnull
    private final SourceTable source;
    @Nonnull
    private final Map<Long, SourceRow> savedSourceRows = new LinkedHashMap<>();
    @Nonnull
    private final Map<SummaryTable, Map<Long, SummaryRow>> savedSummaryRows = new LinkedHashMap<>();
    private int mutationCount;
    private boolean committed;
    private boolean closed;

    MutationContext(@Nonnull SourceTable source) {
        this.source = source;
    }

    /**
     * Keep every change made in this context.
     */
    public void commit() {
        checkOpen();
        committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    public boolean isClosed() {
        return closed;
    }

    public int getMutationCount() {
        return mutationCount;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!committed) {
                rollback();
            }
        } finally {
            source.endContext(this);
        }
    }

    void recordMutation() {
        checkOpen();
        mutationCount++;
    }

    void beforeSourceRowChange(long rowId, @Nullable SourceRow previous) {
        if (!savedSourceRows.containsKey(rowId)) {
            savedSourceRows.put(rowId, previous);
        }
    }

    @Override
    public void beforeRowChange(@Nonnull SummaryTable table, long rowId, @Nullable SummaryRow previous) {
        final Map<Long, SummaryRow> saved = savedSummaryRows.computeIfAbsent(table, t -> new HashMap<>());
        if (!saved.containsKey(rowId)) {
            saved.put(rowId, previous);
        }
    }

    private void rollback() {
        if (savedSourceRows.isEmpty() && savedSummaryRows.isEmpty()) {
            return;
        }
        for (Map.Entry<Long, SourceRow> entry : savedSourceRows.entrySet()) {
            source.restoreRow(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<SummaryTable, Map<Long, SummaryRow>> entry : savedSummaryRows.entrySet()) {
            final SummaryTable table = entry.getKey();
            for (Map.Entry<Long, SummaryRow> saved : entry.getValue().entrySet()) {
                table.restoreRow(saved.getKey(), saved.getValue());
            }
        }
        source.reindex();
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.of("rolled back source mutations",
                    LogMessageKeys.SOURCE_TABLE, source.getName(),
                    LogMessageKeys.MUTATION_COUNT, mutationCount,
                    LogMessageKeys.ROWS_AFFECTED, savedSourceRows.size()));
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("mutation context is closed");
        }
    }
}
