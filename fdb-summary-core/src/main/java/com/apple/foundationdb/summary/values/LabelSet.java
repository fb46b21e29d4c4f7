/*
 * LabelSet.java
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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * A {@link Value} holding an ordered set of labels, such as the tags of a tag-set column. Labels keep the order in
 * which they were first declared and duplicates collapse onto the first occurrence. The empty set is legal.
 */
@API(API.Status.STABLE)
public final class LabelSet extends Value {
    /**
     * The label set with no labels.
     */
    @Nonnull
    public static final LabelSet EMPTY = new LabelSet(ImmutableSet.of());

    @Nonnull
    private final ImmutableSet<Object> labels;

    private LabelSet(@Nonnull ImmutableSet<Object> labels) {
        this.labels = labels;
    }

    @Nonnull
    static LabelSet copyOf(@Nonnull Iterable<?> labels) {
        final ImmutableSet.Builder<Object> builder = ImmutableSet.builder();
        for (Object label : labels) {
            if (label == null) {
                throw new TypeMismatchException("label set cannot contain null");
            }
            builder.add(Atoms.normalize(label));
        }
        final ImmutableSet<Object> built = builder.build();
        return built.isEmpty() ? EMPTY : new LabelSet(built);
    }

    @Nonnull
    @Override
    public ColumnKind getKind() {
        return ColumnKind.MULTI_VALUED;
    }

    @Nonnull
    @Override
    public List<Object> getAtoms() {
        return labels.asList();
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    @Override
    public boolean contains(@Nullable Object atom) {
        return atom != null && labels.contains(Atoms.normalize(atom));
    }

    @Nonnull
    @Override
    public LabelSet rename(@Nonnull Map<?, ?> renames) {
        boolean changed = false;
        final ImmutableList.Builder<Object> renamed = ImmutableList.builderWithExpectedSize(labels.size());
        for (Object label : labels) {
            if (renames.containsKey(label)) {
                renamed.add(renames.get(label));
                changed = true;
            } else {
                renamed.add(label);
            }
        }
        return changed ? copyOf(renamed.build()) : this;
    }

    @Nonnull
    @Override
    public Value convertTo(@Nonnull ColumnKind kind) {
        if (kind == ColumnKind.MULTI_VALUED) {
            return this;
        }
        if (labels.size() > 1) {
            throw new TypeMismatchException("cannot convert more than one label to a scalar",
                    LogMessageKeys.VALUE, this);
        }
        return labels.isEmpty() ? Value.scalar(null) : Value.scalar(labels.iterator().next());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        // Order is part of identity: it decides key tuple enumeration order.
        return labels.asList().equals(((LabelSet)o).labels.asList());
    }

    @Override
    public int hashCode() {
        return labels.asList().hashCode();
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
