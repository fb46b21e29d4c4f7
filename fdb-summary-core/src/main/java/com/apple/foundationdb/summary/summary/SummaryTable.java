/*
 * SummaryTable.java
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
import com.apple.foundationdb.summary.index.IndexKind;
import com.apple.foundationdb.summary.index.LookupIndexes;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.metadata.ColumnDeclaration;
import com.apple.foundationdb.summary.metadata.GroupingKey;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.values.ColumnKind;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A table derived from a source table, holding one row per distinct key tuple ever observed over its grouping
 * columns. Each row carries the source rows currently matching its tuple and their count.
 *
 * <p>
 * Rows are append-only: once a key tuple has a row it keeps it, with the same id, even when no source row matches
 * it any more. Row ids are assigned in increasing order, starting at 1, in the order tuples are first seen.
 * </p>
 *
 * <p>
 * A summary table is created by {@link com.apple.foundationdb.summary.source.SourceTable#createSummary} and
 * changed only through the {@link SummaryTableMaintainer} the source table drives. Its lookup index lives in the
 * source table's index registry.
 * </p>
 */
@API(API.Status.STABLE)
@NotThreadSafe
public class SummaryTable {
    /**
     * Name of the column holding the matched source rows.
     */
    public static final String GROUP_COLUMN = "group";
    /**
     * Name of the column holding the number of matched source rows.
     */
    public static final String COUNT_COLUMN = "count";

    /**
     * Lifecycle state of a summary table.
     */
    public enum State {
        ACTIVE,
        DETACHED,
        DROPPED
    }

    @Nonnull
    private final String name;
    @Nonnull
    private final String sourceTableName;
    @Nonnull
    private GroupingKey groupingKey;
    private boolean simple;
    @Nonnull
    private final Map<KeyTuple, Long> keyIndex = new HashMap<>();
    @Nonnull
    private final NavigableMap<Long, SummaryRow> rows = new TreeMap<>();
    private long nextRowId = 1;
    @Nonnull
    private State state = State.ACTIVE;

    @API(API.Status.INTERNAL)
    public SummaryTable(@Nonnull String name, @Nonnull String sourceTableName, @Nonnull GroupingKey groupingKey) {
        this.name = name;
        this.sourceTableName = sourceTableName;
        this.groupingKey = groupingKey;
        this.simple = LookupIndexes.kindFor(groupingKey) == IndexKind.EQUALITY;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public String getSourceTableName() {
        return sourceTableName;
    }

    @Nonnull
    public GroupingKey getGroupingKey() {
        return groupingKey;
    }

    /**
     * Whether this summary groups only by scalar columns and so is served by an equality index. Fixed when the
     * table is created, and only re-selected when a schema change rebuilds it.
     * @return {@code true} in simple mode
     */
    public boolean isSimple() {
        return simple;
    }

    @Nonnull
    public State getState() {
        return state;
    }

    public boolean isActive() {
        return state == State.ACTIVE;
    }

    /**
     * Get the column declarations of this table: one scalar column per grouping column, bound to its source
     * column, followed by the {@value #GROUP_COLUMN} and {@value #COUNT_COLUMN} columns.
     * @return the columns of this table, in order
     */
    @Nonnull
    public List<ColumnDeclaration> getColumns() {
        final ImmutableList.Builder<ColumnDeclaration> columns = ImmutableList.builder();
        for (ColumnDeclaration grouping : groupingKey.getColumns()) {
            columns.add(ColumnDeclaration.derived(grouping.getName(), ColumnKind.SCALAR, grouping.getName()));
        }
        columns.add(ColumnDeclaration.multiValued(GROUP_COLUMN));
        columns.add(ColumnDeclaration.scalar(COUNT_COLUMN));
        return columns.build();
    }

    @Nonnull
    public Collection<SummaryRow> getRows() {
        checkActive();
        return Collections.unmodifiableCollection(rows.values());
    }

    public int getRowCount() {
        checkActive();
        return rows.size();
    }

    @Nullable
    public SummaryRow getRow(long rowId) {
        checkActive();
        return rows.get(rowId);
    }

    /**
     * Find the row for a key tuple.
     * @param key the key tuple
     * @return the row, if the tuple has ever been seen
     */
    @Nonnull
    public Optional<SummaryRow> lookup(@Nonnull KeyTuple key) {
        checkActive();
        final Long rowId = keyIndex.get(key);
        return rowId == null ? Optional.empty() : Optional.ofNullable(rows.get(rowId));
    }

    /**
     * Get the source rows grouped into a summary row.
     * @param rowId the summary row
     * @return the ids of the matching source rows, ascending, or an empty set for an unknown row
     */
    @Nonnull
    public ImmutableSortedSet<Long> getSummarySourceGroup(long rowId) {
        final SummaryRow row = getRow(rowId);
        return row == null ? ImmutableSortedSet.of() : row.getMatchedSourceRows();
    }

    /**
     * Get the key tuples of every row, in row id order.
     * @return the key tuples
     */
    @Nonnull
    public List<KeyTuple> getKeyTuples() {
        final List<KeyTuple> keys = new ArrayList<>(rows.size());
        for (SummaryRow row : rows.values()) {
            keys.add(row.getGroupingValues());
        }
        return keys;
    }

    /**
     * Get the id the next new row will be given.
     * @return the next row id
     */
    @API(API.Status.INTERNAL)
    public long getNextRowId() {
        return nextRowId;
    }

    /**
     * Put a row back the way it was before a change. Used to roll back a failed mutation.
     * @param rowId the row to restore
     * @param previous the row as it was, or {@code null} if it did not exist
     */
    @API(API.Status.INTERNAL)
    public void restoreRow(long rowId, @Nullable SummaryRow previous) {
        final SummaryRow current = rows.get(rowId);
        if (current != null) {
            keyIndex.remove(current.getGroupingValues());
            rows.remove(rowId);
        }
        if (previous != null) {
            rows.put(rowId, previous);
            keyIndex.put(previous.getGroupingValues(), rowId);
        }
    }

    /**
     * Switch to a re-derived grouping after a schema change, re-selecting simple mode. Rows and ids are kept.
     * @param newGroupingKey the grouping over the changed schema
     */
    @API(API.Status.INTERNAL)
    public void rebuild(@Nonnull GroupingKey newGroupingKey) {
        checkActive();
        if (!newGroupingKey.getColumnNames().equals(groupingKey.getColumnNames())) {
            throw new StaleTupleReferenceException("rebuilt grouping has different columns",
                    LogMessageKeys.SUMMARY_TABLE, name,
                    LogMessageKeys.EXPECTED, groupingKey.getColumnNames(),
                    LogMessageKeys.ACTUAL, newGroupingKey.getColumnNames());
        }
        this.groupingKey = newGroupingKey;
        this.simple = LookupIndexes.kindFor(newGroupingKey) == IndexKind.EQUALITY;
    }

    /**
     * Take a snapshot of this table and stop maintaining it.
     * @return an independent copy of the rows
     */
    @API(API.Status.INTERNAL)
    @Nonnull
    public DetachedSummaryTable detach() {
        checkActive();
        final List<ColumnDeclaration> columns = new ArrayList<>();
        for (ColumnDeclaration grouping : groupingKey.getColumns()) {
            columns.add(ColumnDeclaration.scalar(grouping.getName()));
        }
        columns.add(ColumnDeclaration.scalar(COUNT_COLUMN));
        columns.add(ColumnDeclaration.multiValued(GROUP_COLUMN));
        final DetachedSummaryTable detached = new DetachedSummaryTable(name, columns, rows.values());
        state = State.DETACHED;
        return detached;
    }

    @API(API.Status.INTERNAL)
    public void drop() {
        checkActive();
        state = State.DROPPED;
    }

    /**
     * Check that this table is still maintained.
     * @throws DetachedSummaryException if it was detached or dropped
     */
    public void checkActive() {
        if (state != State.ACTIVE) {
            throw new DetachedSummaryException("summary table is no longer maintained",
                    LogMessageKeys.SUMMARY_TABLE, name,
                    LogMessageKeys.VALUE, state);
        }
    }

    @Nullable
    Long findRowId(@Nonnull KeyTuple key) {
        return keyIndex.get(key);
    }

    @Nullable
    SummaryRow rowById(long rowId) {
        return rows.get(rowId);
    }

    long allocateRowId() {
        return nextRowId++;
    }

    void putNewRow(@Nonnull SummaryRow row) {
        if (keyIndex.putIfAbsent(row.getGroupingValues(), row.getId()) != null || rows.containsKey(row.getId())) {
            throw new StaleTupleReferenceException("summary row already exists",
                    LogMessageKeys.SUMMARY_TABLE, name,
                    LogMessageKeys.SUMMARY_ROW_ID, row.getId(),
                    LogMessageKeys.KEY_TUPLE, row.getGroupingValues());
        }
        rows.put(row.getId(), row);
    }

    void replaceRow(@Nonnull SummaryRow row) {
        rows.put(row.getId(), row);
    }

    @Override
    public String toString() {
        return "SummaryTable{" + name + " of " + sourceTableName + " by " + groupingKey.getColumnNames() + "}";
    }
}
