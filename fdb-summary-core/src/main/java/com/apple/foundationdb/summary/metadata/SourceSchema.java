/*
 * SourceSchema.java
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
import com.apple.foundationdb.summary.values.ColumnKind;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The columns of a source table, in declared order.
 */
@API(API.Status.STABLE)
public final class SourceSchema {
    @Nonnull
    private final ImmutableMap<String, ColumnDeclaration> columns;

    private SourceSchema(@Nonnull ImmutableMap<String, ColumnDeclaration> columns) {
        this.columns = columns;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Collection<ColumnDeclaration> getColumns() {
        return columns.values();
    }

    @Nonnull
    public Optional<ColumnDeclaration> findColumn(@Nonnull String name) {
        return Optional.ofNullable(columns.get(name));
    }

    @Nonnull
    public ColumnDeclaration getColumn(@Nonnull String name) {
        final ColumnDeclaration column = columns.get(name);
        if (column == null) {
            throw new InvalidGroupingSpecException("source table has no such column",
                    LogMessageKeys.COLUMN_NAME, name);
        }
        return column;
    }

    public boolean hasColumn(@Nonnull String name) {
        return columns.containsKey(name);
    }

    /**
     * Get a copy of this schema in which one column has a different kind.
     * @param name the column to change
     * @param kind the new kind
     * @return the changed schema
     */
    @Nonnull
    public SourceSchema withColumnKind(@Nonnull String name, @Nonnull ColumnKind kind) {
        final ColumnDeclaration column = getColumn(name);
        final Map<String, ColumnDeclaration> changed = new LinkedHashMap<>(columns);
        changed.put(name, column.withKind(kind));
        return new SourceSchema(ImmutableMap.copyOf(changed));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return columns.equals(((SourceSchema)o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return columns.values().toString();
    }

    /**
     * Builder for {@link SourceSchema}.
     */
    public static class Builder {
        private final Map<String, ColumnDeclaration> columns = new LinkedHashMap<>();

        private Builder() {
        }

        @Nonnull
        public Builder addColumn(@Nonnull ColumnDeclaration column) {
            if (columns.putIfAbsent(column.getName(), column) != null) {
                throw new InvalidGroupingSpecException("duplicate column in source schema",
                        LogMessageKeys.COLUMN_NAME, column.getName());
            }
            return this;
        }

        @Nonnull
        public Builder addScalarColumn(@Nonnull String name) {
            return addColumn(ColumnDeclaration.scalar(name));
        }

        @Nonnull
        public Builder addMultiValuedColumn(@Nonnull String name) {
            return addColumn(ColumnDeclaration.multiValued(name));
        }

        @Nonnull
        public SourceSchema build() {
            return new SourceSchema(ImmutableMap.copyOf(columns));
        }
    }
}
