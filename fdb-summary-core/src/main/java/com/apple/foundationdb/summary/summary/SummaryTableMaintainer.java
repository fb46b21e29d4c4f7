/*
 * SummaryTableMaintainer.java
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
import com.apple.foundationdb.summary.index.LookupIndex;
import com.apple.foundationdb.summary.logging.KeyValueLogMessage;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.properties.SummaryLayerProperties;
import com.apple.foundationdb.summary.properties.SummaryLayerPropertyStorage;
import com.google.common.collect.ImmutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the rows of a {@link SummaryTable} consistent with its {@link LookupIndex}.
 *
 * <p>
 * {@link #reconcile} is handed the key tuples a source change may have affected. A tuple without a row gets a new
 * one with the next id, even when nothing matches it; a tuple with a row has its matched set recomputed from the
 * index in place. Tuples are processed in the order given.
 * </p>
 */
@API(API.Status.INTERNAL)
public class SummaryTableMaintainer {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryTableMaintainer.class);

    @Nonnull
    private final SummaryTable table;
    @Nonnull
    private final LookupIndex index;
    private final boolean verify;
    private final int largeReconcileThreshold;

    public SummaryTableMaintainer(@Nonnull SummaryTable table, @Nonnull LookupIndex index,
                                  @Nonnull SummaryLayerPropertyStorage properties) {
        this.table = table;
        this.index = index;
        this.verify = properties.getPropertyValue(SummaryLayerProperties.VERIFY_AFTER_RECONCILE);
        this.largeReconcileThreshold = properties.getPropertyValue(SummaryLayerProperties.LARGE_RECONCILE_THRESHOLD);
    }

    @Nonnull
    public SummaryTable getTable() {
        return table;
    }

    @Nonnull
    public LookupIndex getIndex() {
        return index;
    }

    @Nonnull
    public ReconcileResult reconcile(@Nonnull List<KeyTuple> affected) {
        return reconcile(affected, SummaryRowJournal.NONE);
    }

    /**
     * Bring the rows for the given key tuples up to date with the index, creating rows for tuples seen for the
     * first time.
     * @param affected the key tuples to reconcile, in the order new rows should be created
     * @param journal told about each row change before it is made
     * @return the rows created and updated
     * @throws StaleTupleReferenceException if a tuple does not fit the grouping, or the key index and rows disagree
     * @throws DetachedSummaryException if the table is no longer maintained
     */
    @Nonnull
    public ReconcileResult reconcile(@Nonnull List<KeyTuple> affected, @Nonnull SummaryRowJournal journal) {
        table.checkActive();
        if (affected.isEmpty()) {
            return ReconcileResult.EMPTY;
        }
        final ReconcileResult.Builder result = ReconcileResult.newBuilder();
        final List<Long> touched = verify ? new ArrayList<>(affected.size()) : null;
        for (KeyTuple key : affected) {
            checkShape(key);
            final ImmutableSortedSet<Long> matched = index.matches(key);
            final Long existingId = table.findRowId(key);
            if (existingId == null) {
                final long rowId = table.getNextRowId();
                journal.beforeRowChange(table, rowId, null);
                table.allocateRowId();
                table.putNewRow(new SummaryRow(rowId, key, matched));
                result.addCreated(rowId);
                if (touched != null) {
                    touched.add(rowId);
                }
            } else {
                final SummaryRow existing = table.rowById(existingId);
                if (existing == null || !existing.getGroupingValues().equals(key)) {
                    throw new StaleTupleReferenceException("key index refers to a missing or different row",
                            LogMessageKeys.SUMMARY_TABLE, table.getName(),
                            LogMessageKeys.SUMMARY_ROW_ID, existingId,
                            LogMessageKeys.KEY_TUPLE, key);
                }
                if (!existing.getMatchedSourceRows().equals(matched)) {
                    journal.beforeRowChange(table, existingId, existing);
                    table.replaceRow(existing.withMatchedSourceRows(matched));
                    result.addUpdated(existingId);
                }
                if (touched != null) {
                    touched.add(existingId);
                }
            }
        }
        if (touched != null) {
            verifyRows(touched);
        }
        final ReconcileResult reconciled = result.build();
        if (affected.size() >= largeReconcileThreshold) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(KeyValueLogMessage.of("large summary reconcile",
                        LogMessageKeys.SUMMARY_TABLE, table.getName(),
                        LogMessageKeys.KEY_COUNT, affected.size(),
                        LogMessageKeys.CREATED_COUNT, reconciled.getCreatedRowIds().size(),
                        LogMessageKeys.UPDATED_COUNT, reconciled.getUpdatedRowIds().size()));
            }
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("reconciled summary rows",
                    LogMessageKeys.SUMMARY_TABLE, table.getName(),
                    LogMessageKeys.KEY_COUNT, affected.size(),
                    LogMessageKeys.CREATED_COUNT, reconciled.getCreatedRowIds().size(),
                    LogMessageKeys.UPDATED_COUNT, reconciled.getUpdatedRowIds().size()));
        }
        return reconciled;
    }

    private void checkShape(@Nonnull KeyTuple key) {
        if (key.size() != table.getGroupingKey().getColumnCount()) {
            throw new StaleTupleReferenceException("key tuple does not fit grouping",
                    LogMessageKeys.SUMMARY_TABLE, table.getName(),
                    LogMessageKeys.KEY_TUPLE, key,
                    LogMessageKeys.GROUPING_COLUMNS, table.getGroupingKey().getColumnNames());
        }
    }

    private void verifyRows(@Nonnull List<Long> rowIds) {
        for (long rowId : rowIds) {
            final SummaryRow row = table.rowById(rowId);
            if (row == null) {
                throw new StaleTupleReferenceException("reconciled row is missing",
                        LogMessageKeys.SUMMARY_TABLE, table.getName(),
                        LogMessageKeys.SUMMARY_ROW_ID, rowId);
            }
            final Long indexed = table.findRowId(row.getGroupingValues());
            if (indexed == null || indexed != rowId) {
                throw new StaleTupleReferenceException("key index disagrees with rows",
                        LogMessageKeys.SUMMARY_TABLE, table.getName(),
                        LogMessageKeys.SUMMARY_ROW_ID, rowId,
                        LogMessageKeys.KEY_TUPLE, row.getGroupingValues(),
                        LogMessageKeys.ACTUAL, indexed);
            }
            final ImmutableSortedSet<Long> expected = index.matches(row.getGroupingValues());
            if (!expected.equals(row.getMatchedSourceRows()) || row.getCount() != expected.size()) {
                throw new StaleTupleReferenceException("summary row disagrees with lookup index",
                        LogMessageKeys.SUMMARY_TABLE, table.getName(),
                        LogMessageKeys.SUMMARY_ROW_ID, rowId,
                        LogMessageKeys.EXPECTED, expected,
                        LogMessageKeys.ACTUAL, row.getMatchedSourceRows());
            }
        }
    }
}
