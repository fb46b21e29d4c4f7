/*
 * ColumnDeclaration.java
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
import com.apple.foundationdb.summary.values.ColumnKind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Declaration of one column of a source or summary table. Grouping columns of a summary table name the source
 * column they were derived from; every other column has no source column.
 */
@API(API.Status.STABLE)
public final class ColumnDeclaration {
    @Nonnull
    private final String name;
    @Nonnull
    private final ColumnKind kind;
    @Nullable
    private final String sourceColumn;

    private ColumnDeclaration(@Nonnull String name, @Nonnull ColumnKind kind, @Nullable String sourceColumn) {
        this.name = name;
        this.kind = kind;
        this.sourceColumn = sourceColumn;
    }

    @Nonnull
    public static ColumnDeclaration scalar(@Nonnull String name) {
        return new ColumnDeclaration(name, ColumnKind.SCALAR, null);
    }

    @Nonnull
    public static ColumnDeclaration multiValued(@Nonnull String name) {
        return new ColumnDeclaration(name, ColumnKind.MULTI_VALUED, null);
    }

    @Nonnull
    public static ColumnDeclaration of(@Nonnull String name, @Nonnull ColumnKind kind) {
        return new ColumnDeclaration(name, kind, null);
    }

    @Nonnull
    public static ColumnDeclaration derived(@Nonnull String name, @Nonnull ColumnKind kind, @Nonnull String sourceColumn) {
        return new ColumnDeclaration(name, kind, sourceColumn);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public ColumnKind getKind() {
        return kind;
    }

    @Nullable
    public String getSourceColumn() {
        return sourceColumn;
    }

    @Nonnull
    public ColumnDeclaration withKind(@Nonnull ColumnKind newKind) {
        return newKind == kind ? this : new ColumnDeclaration(name, newKind, sourceColumn);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ColumnDeclaration that = (ColumnDeclaration)o;
        return name.equals(that.name) && kind == that.kind && Objects.equals(sourceColumn, that.sourceColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, sourceColumn);
    }

    @Override
    public String toString() {
        return name + ":" + kind + (sourceColumn == null ? "" : "<-" + sourceColumn);
    }
}
