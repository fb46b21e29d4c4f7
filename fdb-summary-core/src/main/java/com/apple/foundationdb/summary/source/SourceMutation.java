/*
 * SourceMutation.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One change to a source table, as submitted to {@link SourceTable#apply}.
 *
 * <p>
 * Cell values may be given as {@link com.apple.foundationdb.summary.values.Value}s or raw: a single atom for a
 * scalar column, a collection of labels for a multi-valued one.
 * </p>
 */
@API(API.Status.STABLE)
public abstract class SourceMutation {

    SourceMutation() {
    }

    @Nonnull
    public static Insert insert(@Nonnull Map<String, ?> values) {
        return new Insert(null, values);
    }

    @Nonnull
    public static Insert insert(long rowId, @Nonnull Map<String, ?> values) {
        return new Insert(rowId, values);
    }

    @Nonnull
    public static Update update(long rowId, @Nonnull Map<String, ?> newValues) {
        return new Update(rowId, null, newValues);
    }

    /**
     * An update that also states what the changed cells held before. If they hold something else when the update
     * is applied, it fails with a {@link com.apple.foundationdb.summary.summary.StaleTupleReferenceException}.
     * @param rowId the row to change
     * @param oldValues the cells as the caller believes them to be
     * @param newValues the new cells
     * @return the mutation
     */
    @Nonnull
    public static Update update(long rowId, @Nonnull Map<String, ?> oldValues, @Nonnull Map<String, ?> newValues) {
        return new Update(rowId, oldValues, newValues);
    }

    @Nonnull
    public static Delete delete(long rowId) {
        return new Delete(rowId);
    }

    @Nonnull
    public static RenameLabels renameLabels(@Nonnull String column, @Nonnull Map<?, ?> renames) {
        return new RenameLabels(column, renames);
    }

    @Nonnull
    public static RenameLabels renameLabel(@Nonnull String column, @Nonnull Object oldLabel, @Nullable Object newLabel) {
        return new RenameLabels(column, Collections.singletonMap(oldLabel, newLabel));
    }

    abstract void applyTo(@Nonnull SourceTable table, @Nonnull MutationContext context,
                          @Nonnull TransactionResult.Builder result);

    @Nonnull
    private static Map<String, Object> copyCells(@Nonnull Map<String, ?> values) {
        // Cells may legitimately be null, which ImmutableMap does not allow.
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Add a row, with the next id or an explicit one.
     */
    public static final class Insert extends SourceMutation {
        @Nullable
        private final Long rowId;
        @Nonnull
        private final Map<String, Object> values;

        private Insert(@Nullable Long rowId, @Nonnull Map<String, ?> values) {
            this.rowId = rowId;
            this.values = copyCells(values);
        }

        @Nullable
        public Long getRowId() {
            return rowId;
        }

        @Nonnull
        public Map<String, Object> getValues() {
            return values;
        }

        @Override
        void applyTo(@Nonnull SourceTable table, @Nonnull MutationContext context,
                     @Nonnull TransactionResult.Builder result) {
            result.addInserted(table.doInsert(context, rowId, values, result));
        }

        @Override
        public String toString() {
            return "Insert(" + rowId + ", " + values + ")";
        }
    }

    /**
     * Change some cells of a row.
     */
    public static final class Update extends SourceMutation {
        private final long rowId;
        @Nullable
        private final Map<String, Object> oldValues;
        @Nonnull
        private final Map<String, Object> newValues;

        private Update(long rowId, @Nullable Map<String, ?> oldValues, @Nonnull Map<String, ?> newValues) {
            this.rowId = rowId;
            this.oldValues = oldValues == null ? null : copyCells(oldValues);
            this.newValues = copyCells(newValues);
        }

        public long getRowId() {
            return rowId;
        }

        @Nullable
        public Map<String, Object> getOldValues() {
            return oldValues;
        }

        @Nonnull
        public Map<String, Object> getNewValues() {
            return newValues;
        }

        @Override
        void applyTo(@Nonnull SourceTable table, @Nonnull MutationContext context,
                     @Nonnull TransactionResult.Builder result) {
            table.doUpdate(context, rowId, oldValues, newValues, result);
        }

        @Override
        public String toString() {
            return "Update(" + rowId + ", " + newValues + ")";
        }
    }

    /**
     * Remove a row.
     */
    public static final class Delete extends SourceMutation {
        private final long rowId;

        private Delete(long rowId) {
            this.rowId = rowId;
        }

        public long getRowId() {
            return rowId;
        }

        @Override
        void applyTo(@Nonnull SourceTable table, @Nonnull MutationContext context,
                     @Nonnull TransactionResult.Builder result) {
            table.doDelete(context, rowId, result);
        }

        @Override
        public String toString() {
            return "Delete(" + rowId + ")";
        }
    }

    /**
     * Replace labels throughout one column: each old label by its new one. On a scalar column a cell equal to an
     * old label is replaced; on a multi-valued column the label is replaced within each set that contains it.
     */
    public static final class RenameLabels extends SourceMutation {
        @Nonnull
        private final String column;
        @Nonnull
        private final Map<Object, Object> renames;

        private RenameLabels(@Nonnull String column, @Nonnull Map<?, ?> renames) {
            this.column = column;
            this.renames = Collections.unmodifiableMap(new LinkedHashMap<>(renames));
        }

        @Nonnull
        public String getColumn() {
            return column;
        }

        @Nonnull
        public Map<Object, Object> getRenames() {
            return renames;
        }

        @Override
        void applyTo(@Nonnull SourceTable table, @Nonnull MutationContext context,
                     @Nonnull TransactionResult.Builder result) {
            table.doRenameLabels(context, column, renames, result);
        }

        @Override
        public String toString() {
            return "RenameLabels(" + column + ", " + renames + ")";
        }
    }
}
