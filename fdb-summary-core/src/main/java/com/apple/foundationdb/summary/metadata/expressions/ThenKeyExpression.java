/*
 * ThenKeyExpression.java
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

import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.metadata.SourceSchema;
import com.apple.foundationdb.summary.source.SourceRow;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Combine keys from two or more child keys. Each child is evaluated and the result is the cross product of the
 * children's tuples, concatenated in child order. The first child varies slowest, so for children yielding
 * {@code [a, b]} and {@code [c, d]} the result is {@code (a, c), (a, d), (b, c), (b, d)}. If any child yields no
 * tuples, neither does this expression.
 */
@API(API.Status.UNSTABLE)
public class ThenKeyExpression implements KeyExpression {
    @Nonnull
    private final ImmutableList<KeyExpression> children;

    public ThenKeyExpression(@Nonnull KeyExpression first, @Nonnull KeyExpression second, @Nonnull KeyExpression... children) {
        this(ImmutableList.<KeyExpression>builder().add(first).add(second).add(children).build());
    }

    public ThenKeyExpression(@Nonnull List<KeyExpression> children) {
        this.children = ImmutableList.copyOf(children);
    }

    @Nonnull
    @Override
    public List<KeyTuple> evaluate(@Nullable SourceRow row) {
        final List<List<KeyTuple>> childrenValues = new ArrayList<>(children.size());
        long totalCount = 1;
        for (KeyExpression child : children) {
            final List<KeyTuple> childValues = child.evaluate(row);
            childrenValues.add(childValues);
            totalCount *= childValues.size();
        }
        if (totalCount == 0) {
            return ImmutableList.of();
        }
        if (childrenValues.isEmpty()) {
            return ImmutableList.of(KeyTuple.EMPTY);
        }
        return combine(childrenValues, (int)Math.min(totalCount, Integer.MAX_VALUE));
    }

    @Nonnull
    private List<KeyTuple> combine(@Nonnull List<List<KeyTuple>> childrenValues, int totalCount) {
        final List<KeyTuple> combined = new ArrayList<>(totalCount);
        for (KeyTuple childValue : childrenValues.get(0)) {
            combine(combined, childValue, 1, childrenValues);
        }
        validateColumnCounts(combined);
        return combined;
    }

    private void combine(@Nonnull List<KeyTuple> combined, @Nonnull KeyTuple prefix, int valuesIndex,
                         @Nonnull List<List<KeyTuple>> childrenValues) {
        if (valuesIndex == childrenValues.size()) {
            combined.add(prefix);
        } else {
            for (KeyTuple childValue : childrenValues.get(valuesIndex)) {
                combine(combined, prefix.append(childValue), valuesIndex + 1, childrenValues);
            }
        }
    }

    private void validateColumnCounts(@Nonnull List<KeyTuple> tuples) {
        final int columnSize = getColumnSize();
        for (KeyTuple tuple : tuples) {
            if (tuple.size() != columnSize) {
                throw new InvalidResultException("Key tuple has wrong number of components",
                        LogMessageKeys.EXPECTED, columnSize,
                        LogMessageKeys.ACTUAL, tuple.size(),
                        LogMessageKeys.KEY_TUPLE, tuple);
            }
        }
    }

    @Override
    public void validate(@Nonnull SourceSchema schema) {
        for (KeyExpression child : children) {
            child.validate(schema);
        }
    }

    @Override
    public boolean createsDuplicates() {
        for (KeyExpression child : children) {
            if (child.createsDuplicates()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getColumnSize() {
        int size = 0;
        for (KeyExpression child : children) {
            size += child.getColumnSize();
        }
        return size;
    }

    @Nonnull
    @Override
    public List<ColumnKeyExpression> normalizeKeyForPositions() {
        final List<ColumnKeyExpression> normalized = new ArrayList<>(getColumnSize());
        for (KeyExpression child : children) {
            normalized.addAll(child.normalizeKeyForPositions());
        }
        return normalized;
    }

    @Nonnull
    public List<KeyExpression> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return children.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((ThenKeyExpression)o).children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }
}
