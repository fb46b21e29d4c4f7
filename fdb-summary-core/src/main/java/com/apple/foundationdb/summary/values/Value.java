/*
 * Value.java
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

package com.apple.foundationdb.summary.values;

import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * The value of one column in one row: either a {@link ScalarValue} holding a single atom, or a {@link LabelSet}
 * holding an ordered set of labels.
 *
 * <p>
 * Values are immutable and compare by content. A scalar never equals a label set, even a singleton one.
 * </p>
 */
@API(API.Status.STABLE)
public abstract class Value {

    Value() {
    }

    /**
     * Create a scalar value.
     * @param atom the atom, or {@code null} for an empty cell
     * @return a new scalar value
     * @throws TypeMismatchException if {@code atom} is a collection or unsupported type
     */
    @Nonnull
    public static ScalarValue scalar(@Nullable Object atom) {
        return new ScalarValue(Atoms.normalize(atom));
    }

    /**
     * Create a label set from the given labels. Duplicates are collapsed, keeping the first occurrence.
     * @param labels the labels, in declared order
     * @return a new label set
     */
    @Nonnull
    public static LabelSet labels(@Nonnull Object... labels) {
        return LabelSet.copyOf(Arrays.asList(labels));
    }

    /**
     * Create a label set from the given labels. Duplicates are collapsed, keeping the first occurrence.
     * @param labels the labels, in declared order
     * @return a new label set
     */
    @Nonnull
    public static LabelSet labels(@Nonnull Iterable<?> labels) {
        return LabelSet.copyOf(labels);
    }

    /**
     * Convert a raw cell, as supplied from outside the core, into a value of the given kind. A multi-valued
     * column must be given a collection (or a {@link LabelSet}), a scalar column must be given a single atom
     * (or a {@link ScalarValue}).
     * @param kind the kind of the column the cell belongs to
     * @param raw the raw cell contents
     * @return the value
     * @throws TypeMismatchException if the shape of {@code raw} does not match {@code kind}
     */
    @Nonnull
    public static Value of(@Nonnull ColumnKind kind, @Nullable Object raw) {
        if (raw instanceof Value) {
            final Value value = (Value)raw;
            value.checkKind(kind);
            return value;
        }
        switch (kind) {
            case SCALAR:
                return scalar(raw);
            case MULTI_VALUED:
                if (!(raw instanceof Collection<?>)) {
                    throw new TypeMismatchException("multi-valued column given a scalar",
                            LogMessageKeys.ACTUAL_TYPE, raw == null ? "null" : raw.getClass().getName());
                }
                return labels((Collection<?>)raw);
            default:
                throw new TypeMismatchException("unknown column kind", LogMessageKeys.COLUMN_KIND, kind);
        }
    }

    @Nonnull
    public abstract ColumnKind getKind();

    /**
     * Get the atoms of this value that take part in key tuples: the single atom of a scalar, or the labels of a
     * label set in declared order.
     * @return the atoms of this value
     */
    @Nonnull
    public abstract List<Object> getAtoms();

    /**
     * Whether this value is or contains the given atom.
     * @param atom the atom to look for
     * @return {@code true} if a scalar equals {@code atom} or a label set contains it
     */
    public abstract boolean contains(@Nullable Object atom);

    /**
     * Replace atoms according to a mapping. Atoms not in the mapping are kept.
     * @param renames map from old atom to new atom
     * @return a value of the same kind with the atoms replaced, or this value if nothing was replaced
     */
    @Nonnull
    public abstract Value rename(@Nonnull Map<?, ?> renames);

    /**
     * Convert this value to a value of another kind, for when a column changes kind. A scalar becomes a
     * singleton label set ({@code null} becomes the empty set); a label set of at most one label becomes a scalar.
     * @param kind the new kind
     * @return the converted value
     * @throws TypeMismatchException if a label set with more than one label is converted to a scalar
     */
    @Nonnull
    public abstract Value convertTo(@Nonnull ColumnKind kind);

    /**
     * Check that this value is of the given kind.
     * @param kind the expected kind
     * @throws TypeMismatchException if it is not
     */
    public void checkKind(@Nonnull ColumnKind kind) {
        if (getKind() != kind) {
            throw new TypeMismatchException("value kind does not match column kind",
                    LogMessageKeys.EXPECTED_TYPE, kind,
                    LogMessageKeys.ACTUAL_TYPE, getKind(),
                    LogMessageKeys.VALUE, this);
        }
    }
}
