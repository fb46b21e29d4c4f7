/*
 * ColumnKeyExpression.java
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

package com.apple.foundationdb.summary.metadata.expressions;

import com.apple.foundationdb.summary.SummaryCoreException;
import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.metadata.ColumnDeclaration;
import com.apple.foundationdb.summary.metadata.InvalidGroupingSpecException;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.metadata.SourceSchema;
import com.apple.foundationdb.summary.source.SourceRow;
import com.apple.foundationdb.summary.values.ColumnKind;
import com.apple.foundationdb.summary.values.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Take keys from a column of a source row.
 * With <code>FanType.FanOut</code> the column must be multi-valued and there is one single-component
 * <code>KeyTuple</code> for each label, in declared order; an empty label set yields no tuples. With
 * <code>FanType.None</code> the column must be scalar and there is exactly one tuple holding its atom.
 * Evaluated on the <code>null</code> row, this returns no tuples for <code>FanOut</code> and a single
 * <code>null</code> tuple for <code>None</code>.
 */
@API(API.Status.UNSTABLE)
public class ColumnKeyExpression implements KeyExpression {
    @Nonnull
    private final String columnName;
    @Nonnull
    private final FanType fanType;

    public ColumnKeyExpression(@Nonnull String columnName, @Nonnull FanType fanType) {
        this.columnName = columnName;
        this.fanType = fanType;
    }

    @Nonnull
    public static FanType fanTypeFor(@Nonnull ColumnKind kind) {
        return kind == ColumnKind.MULTI_VALUED ? FanType.FanOut : FanType.None;
    }

    @Nonnull
    @Override
    public List<KeyTuple> evaluate(@Nullable SourceRow row) {
        if (row == null) {
            return getNullResult();
        }
        final Value value = row.getValue(columnName);
        switch (fanType) {
            case FanOut:
                value.checkKind(ColumnKind.MULTI_VALUED);
                return KeyTuple.fan(value.getAtoms());
            case None:
                value.checkKind(ColumnKind.SCALAR);
                return Collections.singletonList(KeyTuple.fromList(value.getAtoms()));
            default:
                throw new SummaryCoreException("unknown fan type").addLogInfo(LogMessageKeys.VALUE, fanType);
        }
    }

    @Nonnull
    private List<KeyTuple> getNullResult() {
        switch (fanType) {
            case FanOut:
                return Collections.emptyList();
            case None:
                return Collections.singletonList(KeyTuple.scalar(null));
            default:
                throw new SummaryCoreException("unknown fan type").addLogInfo(LogMessageKeys.VALUE, fanType);
        }
    }

    @Override
    public void validate(@Nonnull SourceSchema schema) {
        final Optional<ColumnDeclaration> column = schema.findColumn(columnName);
        if (column.isEmpty()) {
            throw new InvalidGroupingSpecException("Source table does not have column",
                    LogMessageKeys.COLUMN_NAME, columnName);
        }
        final ColumnKind kind = column.get().getKind();
        switch (fanType) {
            case FanOut:
                if (kind != ColumnKind.MULTI_VALUED) {
                    throw new InvalidGroupingSpecException(columnName + " is not multi-valued with FanType." + fanType,
                            LogMessageKeys.COLUMN_NAME, columnName,
                            LogMessageKeys.COLUMN_KIND, kind);
                }
                break;
            case None:
                if (kind != ColumnKind.SCALAR) {
                    throw new InvalidGroupingSpecException(columnName + " is multi-valued with FanType.None",
                            LogMessageKeys.COLUMN_NAME, columnName,
                            LogMessageKeys.COLUMN_KIND, kind);
                }
                break;
            default:
                throw new InvalidGroupingSpecException("Unexpected FanType." + fanType);
        }
    }

    @Override
    public boolean createsDuplicates() {
        return fanType == FanType.FanOut;
    }

    @Override
    public int getColumnSize() {
        return 1;
    }

    @Nonnull
    @Override
    public List<ColumnKeyExpression> normalizeKeyForPositions() {
        return Collections.singletonList(this);
    }

    @Nonnull
    public String getColumnName() {
        return columnName;
    }

    @Nonnull
    public FanType getFanType() {
        return fanType;
    }

    @Nonnull
    public ColumnKind getColumnKind() {
        return fanType == FanType.FanOut ? ColumnKind.MULTI_VALUED : ColumnKind.SCALAR;
    }

    @Override
    public String toString() {
        return "Column { '" + columnName + "' " + fanType + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof ColumnKeyExpression)) {
            return false;
        }
        final ColumnKeyExpression that = (ColumnKeyExpression)o;
        return this.columnName.equals(that.columnName) && this.fanType == that.fanType;
    }

    @Override
    public int hashCode() {
        return columnName.hashCode() + fanType.name().hashCode();
    }
}
