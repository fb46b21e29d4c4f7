/*
 * GroupingKey.java
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
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.metadata.expressions.KeyExpression;
import com.apple.foundationdb.summary.source.SourceRow;
import com.apple.foundationdb.summary.values.ColumnKind;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The ordered grouping columns of a summary table together with the key expression that expands a source row into
 * the key tuples it belongs to.
 *
 * <p>
 * A row over all-scalar grouping columns expands into exactly one tuple. A row with any multi-valued grouping column
 * expands into the cross product of each column's atoms, scalar columns contributing a single atom; if any
 * multi-valued column is empty the row expands into nothing. Components follow the grouping column order, and the
 * product enumerates labels in the order they were declared in the row, so expansion is deterministic.
 * </p>
 */
@API(API.Status.STABLE)
public final class GroupingKey {
    @Nonnull
    private final ImmutableList<ColumnDeclaration> columns;
    @Nonnull
    private final KeyExpression expression;

    private GroupingKey(@Nonnull List<ColumnDeclaration> columns) {
        this.columns = ImmutableList.copyOf(columns);
        this.expression = Key.Expressions.grouping(this.columns);
    }

    /**
     * Build a grouping key over the named columns of a schema, taking each column's kind from the schema.
     * @param schema the source schema
     * @param columnNames the grouping columns, in order
     * @return a validated grouping key
     * @throws InvalidGroupingSpecException if no column is given, a column is repeated or a column does not exist
     */
    @Nonnull
    public static GroupingKey forColumns(@Nonnull SourceSchema schema, @Nonnull List<String> columnNames) {
        checkNames(columnNames);
        final List<ColumnDeclaration> columns = new ArrayList<>(columnNames.size());
        for (String name : columnNames) {
            columns.add(schema.getColumn(name));
        }
        final GroupingKey key = new GroupingKey(columns);
        key.validate(schema);
        return key;
    }

    /**
     * Build a grouping key from explicit declarations, checking that each declared kind agrees with the schema.
     * @param schema the source schema
     * @param declared the grouping columns, in order, with the kinds the caller expects
     * @return a validated grouping key
     * @throws InvalidGroupingSpecException if the declarations do not fit the schema
     */
    @Nonnull
    public static GroupingKey fromDeclarations(@Nonnull SourceSchema schema, @Nonnull List<ColumnDeclaration> declared) {
        final List<String> names = new ArrayList<>(declared.size());
        for (ColumnDeclaration column : declared) {
            names.add(column.getName());
        }
        checkNames(names);
        final GroupingKey key = new GroupingKey(declared);
        key.validate(schema);
        return key;
    }

    private static void checkNames(@Nonnull List<String> columnNames) {
        if (columnNames.isEmpty()) {
            throw new InvalidGroupingSpecException("grouping needs at least one column");
        }
        final Set<String> seen = new HashSet<>();
        for (String name : columnNames) {
            if (!seen.add(name)) {
                throw new InvalidGroupingSpecException("grouping column repeated",
                        LogMessageKeys.COLUMN_NAME, name);
            }
        }
    }

    /**
     * Check this grouping against a source schema.
     * @param schema the schema of the source table
     * @throws InvalidGroupingSpecException if a column is missing or its kind disagrees with the schema
     */
    public void validate(@Nonnull SourceSchema schema) {
        expression.validate(schema);
    }

    /**
     * Re-derive this grouping against a changed schema, keeping the column order.
     * @param schema the changed schema
     * @return a grouping key whose column kinds follow {@code schema}
     */
    @Nonnull
    public GroupingKey rederive(@Nonnull SourceSchema schema) {
        return forColumns(schema, getColumnNames());
    }

    @Nonnull
    public List<ColumnDeclaration> getColumns() {
        return columns;
    }

    @Nonnull
    public List<String> getColumnNames() {
        final List<String> names = new ArrayList<>(columns.size());
        for (ColumnDeclaration column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    public int getColumnCount() {
        return columns.size();
    }

    @Nonnull
    public KeyExpression getExpression() {
        return expression;
    }

    /**
     * Whether every grouping column is scalar, in which case each row belongs to exactly one key tuple.
     * @return {@code true} if no grouping column is multi-valued
     */
    public boolean isAllScalar() {
        for (ColumnDeclaration column : columns) {
            if (column.getKind() != ColumnKind.SCALAR) {
                return false;
            }
        }
        return true;
    }

    /**
     * Count how many key tuples a row expands into, without building them.
     * @param row the source row
     * @return the product of the number of atoms of each grouping column
     */
    public long countTuples(@Nonnull SourceRow row) {
        long count = 1;
        for (ColumnDeclaration column : columns) {
            count *= row.getValue(column.getName()).getAtoms().size();
        }
        return count;
    }

    /**
     * Expand a row into the key tuples it belongs to.
     * @param row the source row, or {@code null} for a row that does not exist
     * @param maxFanOut the most tuples the row may expand into
     * @return the distinct key tuples of the row, in expansion order
     * @throws KeyFanOutLimitException if the row would expand into more than {@code maxFanOut} tuples
     */
    @Nonnull
    public List<KeyTuple> expand(@Nullable SourceRow row, int maxFanOut) {
        if (row == null) {
            return ImmutableList.of();
        }
        final long count = countTuples(row);
        if (count > maxFanOut) {
            throw new KeyFanOutLimitException("source row expands into too many key tuples",
                    LogMessageKeys.ROW_ID, row.getId(),
                    LogMessageKeys.FAN_OUT, count,
                    LogMessageKeys.FAN_OUT_LIMIT, maxFanOut,
                    LogMessageKeys.GROUPING_COLUMNS, getColumnNames());
        }
        return expression.evaluate(row);
    }

    /**
     * Capture what a row contributes to this grouping.
     * @param row the source row, or {@code null} for a row that does not exist
     * @param maxFanOut the most tuples the row may expand into
     * @return the grouping image of the row, or {@code null} if {@code row} is {@code null}
     */
    @Nullable
    public GroupingImage image(@Nullable SourceRow row, int maxFanOut) {
        if (row == null) {
            return null;
        }
        final List<KeyTuple> tuples = expand(row, maxFanOut);
        final List<List<Object>> columnAtoms = new ArrayList<>(columns.size());
        for (ColumnDeclaration column : columns) {
            columnAtoms.add(row.getValue(column.getName()).getAtoms());
        }
        return new GroupingImage(row.getId(), columnAtoms, tuples);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return columns.equals(((GroupingKey)o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "GroupingKey" + columns;
    }
}
