/*
 * KeyExpression.java
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
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.metadata.SourceSchema;
import com.apple.foundationdb.summary.source.SourceRow;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/**
 * Interface for expressions that evaluate a source row to the key tuples it belongs to.
 */
@API(API.Status.UNSTABLE)
public interface KeyExpression {
    /**
     * Evaluate against a given row, producing the list of key tuples it contributes to, in a deterministic order.
     * A {@code null} row (one that does not exist) evaluates as if every column were empty.
     * @param row the row
     * @return the key tuples for the given row
     * @throws InvalidResultException if any tuple has some number of columns other than {@link #getColumnSize()}
     */
    @Nonnull
    List<KeyTuple> evaluate(@Nullable SourceRow row);

    /**
     * Evaluate this expression with the expectation of getting exactly one result.
     * @param row the row
     * @return the single key tuple
     */
    @Nonnull
    default KeyTuple evaluateSingleton(@Nullable SourceRow row) {
        final List<KeyTuple> keys = evaluate(row);
        if (keys.size() != 1) {
            throw new InvalidResultException("Should evaluate to single key only",
                    LogMessageKeys.KEY_COUNT, keys.size());
        }
        return keys.get(0);
    }

    /**
     * Whether this expression can evaluate to more than one tuple for a single row, that is, whether it fans out
     * a multi-valued column (either directly or through a child).
     * @return {@code true} if evaluation can produce several tuples
     */
    boolean createsDuplicates();

    /**
     * Validate this expression against a source schema.
     * @param schema the schema of the table the expression will be evaluated on
     * @throws com.apple.foundationdb.summary.metadata.InvalidGroupingSpecException if a column is missing or
     * has a kind that does not fit its fan type
     */
    void validate(@Nonnull SourceSchema schema);

    /**
     * Returns the number of components in every tuple this expression evaluates to.
     * @return the size of each evaluated tuple
     */
    int getColumnSize();

    /**
     * Get the column expressions in key position order.
     * @return a list of column expressions, one per tuple component
     */
    @Nonnull
    default List<ColumnKeyExpression> normalizeKeyForPositions() {
        return Collections.emptyList();
    }

    /**
     * How multi-valued columns are handled.
     * These names don't meet our naming convention, but they read better at the call sites.
     */
    @SuppressWarnings({"squid:S00115", "PMD.FieldNamingConventions"})
    enum FanType {
        /**
         * One tuple for each label of a multi-valued column.
         */
        FanOut,
        /**
         * Nothing, only allowed with scalar columns.
         */
        None
    }

    /**
     * Exception thrown when an expression produces tuples of the wrong size or number.
     */
    @SuppressWarnings("serial")
    class InvalidResultException extends SummaryCoreException {
        public InvalidResultException(@Nonnull String msg, @Nullable Object... keyValues) {
            super(msg, keyValues);
        }
    }
}
