/*
 * SourceTable.java
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

import com.apple.foundationdb.summary.SummaryCoreException;
import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.index.LookupIndex;
import com.apple.foundationdb.summary.index.LookupIndexes;
import com.apple.foundationdb.summary.logging.KeyValueLogMessage;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.metadata.ColumnDeclaration;
import com.apple.foundationdb.summary.metadata.GroupingKey;
import com.apple.foundationdb.summary.metadata.InvalidGroupingSpecException;
import com.apple.foundationdb.summary.metadata.SourceSchema;
import com.apple.foundationdb.summary.properties.SummaryLayerPropertyStorage;
import com.apple.foundationdb.summary.summary.DetachedSummaryTable;
import com.apple.foundationdb.summary.summary.ReconcileResult;
import com.apple.foundationdb.summary.summary.StaleTupleReferenceException;
import com.apple.foundationdb.summary.summary.SummaryRowJournal;
import com.apple.foundationdb.summary.summary.SummaryTable;
import com.apple.foundationdb.summary.values.Atoms;
import com.apple.foundationdb.summary.values.ColumnKind;
import com.apple.foundationdb.summary.values.LabelSet;
import com.apple.foundationdb.summary.values.TypeMismatchException;
import com.apple.foundationdb.summary.values.Value;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * A table of source rows together with the summary tables derived from it.
 *
 * <p>
 * The source table owns the lookup index of every summary table, in its {@link IndexRegistry}, and drives their
 * maintenance: each row mutation is handed to every summary table's {@link SourceChangeAdapter}, in the order the
 * summaries were created, before the next mutation is applied. Mutations run inside a {@link MutationContext};
 * one is opened for each call unless the caller already holds one from {@link #openContext()}.
 * </p>
 *
 * <p>
 * Row ids are positive, increase monotonically and are never reused, even after a row is deleted.
 * </p>
 */
@API(API.Status.STABLE)
@NotThreadSafe
public class SourceTable {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceTable.class);

    @Nonnull
    private final String name;
    @Nonnull
    private SourceSchema schema;
    @Nonnull
    private final SummaryLayerPropertyStorage properties;
    @Nonnull
    private final NavigableMap<Long, SourceRow> rows = new TreeMap<>();
    private long lastRowId;
    @Nonnull
    private final IndexRegistry indexRegistry = new IndexRegistry();
    @Nonnull
    private final Map<SummaryTable, SourceChangeAdapter> adapters = new LinkedHashMap<>();
    @Nullable
    private MutationContext currentContext;

    private SourceTable(@Nonnull Builder builder) {
        this.name = builder.name;
        this.schema = builder.schema;
        this.properties = builder.properties;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public SourceSchema getSchema() {
        return schema;
    }

    @Nonnull
    public SummaryLayerPropertyStorage getProperties() {
        return properties;
    }

    @Nullable
    public SourceRow getRow(long rowId) {
        return rows.get(rowId);
    }

    /**
     * Get every row, in ascending id order.
     * @return the rows
     */
    @Nonnull
    public Collection<SourceRow> getRows() {
        return Collections.unmodifiableCollection(rows.values());
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * Get the highest row id ever assigned, including to rows since deleted.
     * @return the last row id, or 0 if no row was ever inserted
     */
    public long getLastRowId() {
        return lastRowId;
    }

    @Nonnull
    public IndexRegistry getIndexRegistry() {
        return indexRegistry;
    }

    /**
     * Get the summary tables maintained over this table, in creation order.
     * @return the summary tables
     */
    @Nonnull
    public List<SummaryTable> getSummaries() {
        return ImmutableList.copyOf(adapters.keySet());
    }

    // Summary lifecycle

    @Nonnull
    public SummaryTable createSummary(@Nonnull String summaryName, @Nonnull String... groupingColumns) {
        return createSummary(summaryName, Arrays.asList(groupingColumns));
    }

    /**
     * Create a summary table grouped by the given columns, taking each column's kind from the schema, and populate
     * it from the existing rows.
     * @param summaryName the name of the summary table
     * @param groupingColumns the grouping columns, in order
     * @return the new summary table
     * @throws InvalidGroupingSpecException if the grouping is empty, repeats a column or names a missing column,
     * or if the name is already taken
     */
    @Nonnull
    public SummaryTable createSummary(@Nonnull String summaryName, @Nonnull List<String> groupingColumns) {
        checkNoContext();
        return addSummary(summaryName, GroupingKey.forColumns(schema, groupingColumns));
    }

    /**
     * Create a summary table from explicit grouping column declarations, which must agree with the schema.
     * @param summaryName the name of the summary table
     * @param groupingColumns the grouping columns, in order, with the kinds the caller expects
     * @return the new summary table
     * @throws InvalidGroupingSpecException if a declaration disagrees with the schema
     */
    @Nonnull
    public SummaryTable createSummaryWithColumns(@Nonnull String summaryName,
                                                 @Nonnull List<ColumnDeclaration> groupingColumns) {
        checkNoContext();
        return addSummary(summaryName, GroupingKey.fromDeclarations(schema, groupingColumns));
    }

    @Nonnull
    private SummaryTable addSummary(@Nonnull String summaryName, @Nonnull GroupingKey groupingKey) {
        for (SummaryTable existing : adapters.keySet()) {
            if (existing.getName().equals(summaryName)) {
                throw new InvalidGroupingSpecException("summary table name already in use",
                        LogMessageKeys.SOURCE_TABLE, name,
                        LogMessageKeys.SUMMARY_TABLE, summaryName);
            }
        }
        final SummaryTable table = new SummaryTable(summaryName, name, groupingKey);
        final LookupIndex index = LookupIndexes.forGrouping(groupingKey);
        final SourceChangeAdapter adapter = new SourceChangeAdapter(table, index, properties);
        final ReconcileResult populated = adapter.populate(rows.values(), SummaryRowJournal.NONE);
        indexRegistry.register(table, index);
        adapters.put(table, adapter);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("created summary table",
                    LogMessageKeys.SOURCE_TABLE, name,
                    LogMessageKeys.SUMMARY_TABLE, summaryName,
                    LogMessageKeys.GROUPING_COLUMNS, groupingKey.getColumnNames(),
                    LogMessageKeys.INDEX_KIND, index.getKind(),
                    LogMessageKeys.CREATED_COUNT, populated.getCreatedRowIds().size()));
        }
        return table;
    }

    /**
     * Stop maintaining a summary table and take an independent snapshot of it.
     * @param table the summary table
     * @return the snapshot
     * @throws com.apple.foundationdb.summary.summary.DetachedSummaryException if the table is not maintained here
     */
    @Nonnull
    public DetachedSummaryTable detachSummary(@Nonnull SummaryTable table) {
        checkNoContext();
        checkOwned(table);
        final DetachedSummaryTable detached = table.detach();
        removeSummary(table);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("detached summary table",
                    LogMessageKeys.SOURCE_TABLE, name,
                    LogMessageKeys.SUMMARY_TABLE, table.getName(),
                    LogMessageKeys.KEY_COUNT, detached.getRows().size()));
        }
        return detached;
    }

    /**
     * Stop maintaining a summary table and discard it.
     * @param table the summary table
     */
    public void dropSummary(@Nonnull SummaryTable table) {
        checkNoContext();
        checkOwned(table);
        table.drop();
        removeSummary(table);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("dropped summary table",
                    LogMessageKeys.SOURCE_TABLE, name,
                    LogMessageKeys.SUMMARY_TABLE, table.getName()));
        }
    }

    private void removeSummary(@Nonnull SummaryTable table) {
        indexRegistry.unregister(table);
        adapters.remove(table);
    }

    private void checkOwned(@Nonnull SummaryTable table) {
        table.checkActive();
        if (!adapters.containsKey(table)) {
            throw new InvalidGroupingSpecException("summary table belongs to another source table",
                    LogMessageKeys.SOURCE_TABLE, name,
                    LogMessageKeys.SUMMARY_TABLE, table.getName());
        }
    }

    // Row mutations

    /**
     * Open a context grouping the following mutations into one transaction. Mutations made while it is open join it.
     * @return the context, to be committed and closed by the caller
     */
    @Nonnull
    public MutationContext openContext() {
        checkNoContext();
        currentContext = new MutationContext(this);
        return currentContext;
    }

    /**
     * Insert a row with the next id.
     * @param values the cells; missing columns hold null (scalar) or no labels (multi-valued)
     * @return the id of the new row
     */
    public long insertRow(@Nonnull Map<String, ?> values) {
        return apply(Collections.singletonList(SourceMutation.insert(values))).getInsertedRowIds().get(0);
    }

    /**
     * Insert a row with an explicit id, which must be greater than every id used so far.
     * @param rowId the id of the new row
     * @param values the cells
     * @return {@code rowId}
     */
    public long insertRow(long rowId, @Nonnull Map<String, ?> values) {
        return apply(Collections.singletonList(SourceMutation.insert(rowId, values))).getInsertedRowIds().get(0);
    }

    @Nonnull
    public TransactionResult updateRow(long rowId, @Nonnull Map<String, ?> newValues) {
        return apply(Collections.singletonList(SourceMutation.update(rowId, newValues)));
    }

    @Nonnull
    public TransactionResult deleteRow(long rowId) {
        return apply(Collections.singletonList(SourceMutation.delete(rowId)));
    }

    @Nonnull
    public TransactionResult renameLabels(@Nonnull String column, @Nonnull Map<?, ?> renames) {
        return apply(Collections.singletonList(SourceMutation.renameLabels(column, renames)));
    }

    @Nonnull
    public TransactionResult renameLabel(@Nonnull String column, @Nonnull Object oldLabel, @Nullable Object newLabel) {
        return apply(Collections.singletonList(SourceMutation.renameLabel(column, oldLabel, newLabel)));
    }

    /**
     * Apply mutations in order as one transaction. If any of them fails, none of them has any effect, unless they
     * joined a context opened by the caller, in which case that context decides.
     * @param mutations the mutations
     * @return what the mutations did
     */
    @Nonnull
    public TransactionResult apply(@Nonnull List<? extends SourceMutation> mutations) {
        final TransactionResult.Builder result = TransactionResult.newBuilder();
        if (currentContext != null) {
            applyAll(currentContext, mutations, result);
            return result.build();
        }
        try (MutationContext context = openContext()) {
            applyAll(context, mutations, result);
            context.commit();
        }
        return result.build();
    }

    private void applyAll(@Nonnull MutationContext context, @Nonnull List<? extends SourceMutation> mutations,
                          @Nonnull TransactionResult.Builder result) {
        for (SourceMutation mutation : mutations) {
            context.recordMutation();
            mutation.applyTo(this, context, result);
        }
    }

    long doInsert(@Nonnull MutationContext context, @Nullable Long requestedId, @Nonnull Map<String, ?> values,
                  @Nonnull TransactionResult.Builder result) {
        final long rowId;
        if (requestedId == null) {
            rowId = lastRowId + 1;
        } else if (requestedId <= lastRowId) {
            throw new UnknownRowException("row id already used",
                    LogMessageKeys.SOURCE_TABLE, name,
                    LogMessageKeys.ROW_ID, requestedId,
                    LogMessageKeys.EXPECTED, "> " + lastRowId);
        } else {
            rowId = requestedId;
        }
        final Map<String, Value> cells = new LinkedHashMap<>();
        for (ColumnDeclaration column : schema.getColumns()) {
            cells.put(column.getName(), defaultValue(column.getKind()));
        }
        cells.putAll(toValues(values));
        final SourceRow row = new SourceRow(rowId, cells);
        context.beforeSourceRowChange(rowId, null);
        lastRowId = rowId;
        rows.put(rowId, row);
        propagate(context, null, row, result);
        return rowId;
    }

    void doUpdate(@Nonnull MutationContext context, long rowId, @Nullable Map<String, ?> oldValues,
                  @Nonnull Map<String, ?> newValues, @Nonnull TransactionResult.Builder result) {
        final SourceRow oldRow = existingRow(rowId);
        if (oldValues != null) {
            for (Map.Entry<String, Value> expected : toValues(oldValues).entrySet()) {
                final Value actual = oldRow.getValue(expected.getKey());
                if (!actual.equals(expected.getValue())) {
                    throw new StaleTupleReferenceException("update does not match stored row",
                            LogMessageKeys.SOURCE_TABLE, name,
                            LogMessageKeys.ROW_ID, rowId,
                            LogMessageKeys.COLUMN_NAME, expected.getKey(),
                            LogMessageKeys.EXPECTED, expected.getValue(),
                            LogMessageKeys.ACTUAL, actual);
                }
            }
        }
        replaceRow(context, oldRow, oldRow.withValues(toValues(newValues)), result);
    }

    void doDelete(@Nonnull MutationContext context, long rowId, @Nonnull TransactionResult.Builder result) {
        final SourceRow oldRow = existingRow(rowId);
        context.beforeSourceRowChange(rowId, oldRow);
        rows.remove(rowId);
        propagate(context, oldRow, null, result);
    }

    void doRenameLabels(@Nonnull MutationContext context, @Nonnull String columnName, @Nonnull Map<?, ?> renames,
                        @Nonnull TransactionResult.Builder result) {
        final ColumnDeclaration column = schema.getColumn(columnName);
        final Map<Object, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : renames.entrySet()) {
            final Object newLabel = Atoms.normalize(entry.getValue());
            if (newLabel == null && column.getKind() == ColumnKind.MULTI_VALUED) {
                throw new TypeMismatchException("label cannot be renamed to null",
                        LogMessageKeys.COLUMN_NAME, columnName,
                        LogMessageKeys.OLD, entry.getKey());
            }
            normalized.put(Atoms.normalize(entry.getKey()), newLabel);
        }
        final List<SourceRow> affected = new ArrayList<>();
        for (SourceRow row : rows.values()) {
            final Value value = row.getValue(columnName);
            for (Object oldLabel : normalized.keySet()) {
                if (value.contains(oldLabel)) {
                    affected.add(row);
                    break;
                }
            }
        }
        for (SourceRow oldRow : affected) {
            final Value renamed = oldRow.getValue(columnName).rename(normalized);
            replaceRow(context, oldRow, oldRow.withValues(Collections.singletonMap(columnName, renamed)), result);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("renamed labels",
                    LogMessageKeys.SOURCE_TABLE, name,
                    LogMessageKeys.COLUMN_NAME, columnName,
                    LogMessageKeys.RENAMES, normalized,
                    LogMessageKeys.ROWS_AFFECTED, affected.size()));
        }
    }

    private void replaceRow(@Nonnull MutationContext context, @Nonnull SourceRow oldRow, @Nonnull SourceRow newRow,
                            @Nonnull TransactionResult.Builder result) {
        if (oldRow.equals(newRow)) {
            return;
        }
        context.beforeSourceRowChange(oldRow.getId(), oldRow);
        rows.put(newRow.getId(), newRow);
        propagate(context, oldRow, newRow, result);
    }

    private void propagate(@Nonnull MutationContext context, @Nullable SourceRow oldRow, @Nullable SourceRow newRow,
                           @Nonnull TransactionResult.Builder result) {
        for (Map.Entry<SummaryTable, SourceChangeAdapter> entry : adapters.entrySet()) {
            result.add(entry.getKey(), entry.getValue().onChange(oldRow, newRow, context));
        }
    }

    @Nonnull
    private SourceRow existingRow(long rowId) {
        final SourceRow row = rows.get(rowId);
        if (row == null) {
            throw new UnknownRowException("no such source row",
                    LogMessageKeys.SOURCE_TABLE, name,
                    LogMessageKeys.ROW_ID, rowId);
        }
        return row;
    }

    @Nonnull
    private Map<String, Value> toValues(@Nonnull Map<String, ?> raw) {
        final Map<String, Value> values = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            final ColumnDeclaration column = schema.getColumn(entry.getKey());
            try {
                values.put(column.getName(), Value.of(column.getKind(), entry.getValue()));
            } catch (TypeMismatchException e) {
                throw e.addLogInfo(LogMessageKeys.SOURCE_TABLE, name, LogMessageKeys.COLUMN_NAME, column.getName());
            }
        }
        return values;
    }

    @Nonnull
    private static Value defaultValue(@Nonnull ColumnKind kind) {
        return kind == ColumnKind.MULTI_VALUED ? LabelSet.EMPTY : Value.scalar(null);
    }

    // Schema changes

    /**
     * Change the kind of a column, converting every row's cell, and rebuild every summary table grouped by it.
     * A scalar {@code x} becomes {@code [x]} and null becomes {@code []}; {@code [x]} becomes {@code x} and
     * {@code []} becomes null. Summary rows keep their ids.
     * @param columnName the column
     * @param kind the new kind
     * @return what rebuilding did to the affected summary tables
     * @throws TypeMismatchException if a cell cannot be converted, in which case nothing changes
     */
    @Nonnull
    public TransactionResult changeColumnKind(@Nonnull String columnName, @Nonnull ColumnKind kind) {
        checkNoContext();
        final ColumnDeclaration column = schema.getColumn(columnName);
        final TransactionResult.Builder result = TransactionResult.newBuilder();
        if (column.getKind() == kind) {
            return result.build();
        }
        final List<SourceRow> converted = new ArrayList<>(rows.size());
        for (SourceRow row : rows.values()) {
            final Value value = row.getValue(columnName);
            try {
                converted.add(row.withValues(Collections.singletonMap(columnName, value.convertTo(kind))));
            } catch (TypeMismatchException e) {
                throw e.addLogInfo(LogMessageKeys.SOURCE_TABLE, name, LogMessageKeys.ROW_ID, row.getId(),
                        LogMessageKeys.COLUMN_NAME, columnName);
            }
        }
        schema = schema.withColumnKind(columnName, kind);
        for (SourceRow row : converted) {
            rows.put(row.getId(), row);
        }
        for (SummaryTable table : ImmutableList.copyOf(adapters.keySet())) {
            if (table.getGroupingKey().getColumnNames().contains(columnName)) {
                result.add(table, rebuildSummary(table));
            }
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("changed source column kind",
                    LogMessageKeys.SOURCE_TABLE, name,
                    LogMessageKeys.COLUMN_NAME, columnName,
                    LogMessageKeys.OLD, column.getKind(),
                    LogMessageKeys.NEW, kind,
                    LogMessageKeys.ROWS_AFFECTED, converted.size()));
        }
        return result.build();
    }

    @Nonnull
    private ReconcileResult rebuildSummary(@Nonnull SummaryTable table) {
        final GroupingKey groupingKey = table.getGroupingKey().rederive(schema);
        table.rebuild(groupingKey);
        final LookupIndex index = LookupIndexes.forGrouping(groupingKey);
        final SourceChangeAdapter adapter = new SourceChangeAdapter(table, index, properties);
        final ReconcileResult rebuilt = adapter.populate(rows.values(), SummaryRowJournal.NONE);
        indexRegistry.replace(table, index);
        adapters.put(table, adapter);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("rebuilt summary table",
                    LogMessageKeys.SOURCE_TABLE, name,
                    LogMessageKeys.SUMMARY_TABLE, table.getName(),
                    LogMessageKeys.INDEX_KIND, index.getKind(),
                    LogMessageKeys.CREATED_COUNT, rebuilt.getCreatedRowIds().size()));
        }
        return rebuilt;
    }

    // Support for MutationContext

    void endContext(@Nonnull MutationContext context) {
        if (currentContext == context) {
            currentContext = null;
        }
    }

    void restoreRow(long rowId, @Nullable SourceRow previous) {
        if (previous == null) {
            rows.remove(rowId);
        } else {
            rows.put(rowId, previous);
        }
    }

    /**
     * Rebuild every lookup index from the current rows, leaving summary rows alone.
     */
    void reindex() {
        for (SourceChangeAdapter adapter : adapters.values()) {
            final LookupIndex index = adapter.getIndex();
            index.clear();
            for (SourceRow row : rows.values()) {
                index.update(null, adapter.getTable().getGroupingKey().image(row, Integer.MAX_VALUE));
            }
        }
    }

    private void checkNoContext() {
        if (currentContext != null) {
            throw new SummaryCoreException("operation not allowed while a mutation context is open",
                    LogMessageKeys.SOURCE_TABLE, name);
        }
    }

    @Override
    public String toString() {
        return "SourceTable{" + name + ", rows=" + rows.size() + ", summaries=" + adapters.size() + "}";
    }

    /**
     * Builder for {@link SourceTable}.
     */
    public static class Builder {
        @Nullable
        private String name;
        @Nullable
        private SourceSchema schema;
        @Nonnull
        private SummaryLayerPropertyStorage properties = SummaryLayerPropertyStorage.getEmptyInstance();

        private Builder() {
        }

        @Nonnull
        public Builder setName(@Nonnull String name) {
            this.name = name;
            return this;
        }

        @Nonnull
        public Builder setSchema(@Nonnull SourceSchema schema) {
            this.schema = schema;
            return this;
        }

        @Nonnull
        public Builder setProperties(@Nonnull SummaryLayerPropertyStorage properties) {
            this.properties = properties;
            return this;
        }

        @Nonnull
        public SourceTable build() {
            if (name == null || schema == null) {
                throw new SummaryCoreException("source table needs a name and a schema");
            }
            return new SourceTable(this);
        }
    }
}
