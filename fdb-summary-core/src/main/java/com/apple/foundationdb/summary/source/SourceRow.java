/*
 * SourceRow.java
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
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.metadata.InvalidGroupingSpecException;
import com.apple.foundationdb.summary.values.Value;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable image of one row of a {@link SourceTable}: its id and the value of every column.
 */
@API(API.Status.STABLE)
public final class SourceRow {
    private final long id;
    @Nonnull
    private final ImmutableMap<String, Value> values;

    public SourceRow(long id, @Nonnull Map<String, Value> values) {
        this.id = id;
        this.values = ImmutableMap.copyOf(values);
    }

    public long getId() {
        return id;
    }

    @Nonnull
    public Value getValue(@Nonnull String column) {
        final Value value = values.get(column);
        if (value == null) {
            throw new InvalidGroupingSpecException("row has no value for column",
                    LogMessageKeys.ROW_ID, id,
                    LogMessageKeys.COLUMN_NAME, column);
        }
        return value;
    }

    @Nonnull
    public Map<String, Value> getValues() {
        return values;
    }

    /**
     * Get a new image of this row with some values replaced.
     * @param changes the new values, by column
     * @return the changed row
     */
    @Nonnull
    public SourceRow withValues(@Nonnull Map<String, Value> changes) {
        final Map<String, Value> changed = new LinkedHashMap<>(values);
        changed.putAll(changes);
        return new SourceRow(id, changed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SourceRow that = (SourceRow)o;
        return id == that.id && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, values);
    }

    @Override
    public String toString() {
        return "SourceRow{" + id + ": " + values + "}";
    }
}
