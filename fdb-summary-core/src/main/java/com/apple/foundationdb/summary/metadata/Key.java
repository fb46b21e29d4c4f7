/*
 * Key.java
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
import com.apple.foundationdb.summary.metadata.expressions.ColumnKeyExpression;
import com.apple.foundationdb.summary.metadata.expressions.KeyExpression;
import com.apple.foundationdb.summary.metadata.expressions.ThenKeyExpression;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Namespace for classes related to {@link KeyExpression} construction.
 */
@API(API.Status.STABLE)
public class Key {

    /**
     * Holder class for the static methods for creating Key Expressions.
     */
    public static class Expressions {
        private Expressions() {
        }

        /**
         * Create an expression of a single scalar column.
         * @param name the name of the column to evaluate
         * @return a new column expression
         */
        @Nonnull
        public static ColumnKeyExpression column(@Nonnull String name) {
            return column(name, KeyExpression.FanType.None);
        }

        /**
         * Create an expression of a column, fanning out its labels if it is multi-valued.
         * @param name the name of the column to evaluate
         * @param fanType how to handle the column's labels
         * @return a new column expression
         */
        @Nonnull
        public static ColumnKeyExpression column(@Nonnull String name, @Nonnull KeyExpression.FanType fanType) {
            return new ColumnKeyExpression(name, fanType);
        }

        /**
         * Create an expression for a declared column, choosing the fan type from the column's kind.
         * @param column the declaration of the column
         * @return a new column expression
         */
        @Nonnull
        public static ColumnKeyExpression column(@Nonnull ColumnDeclaration column) {
            return column(column.getName(), ColumnKeyExpression.fanTypeFor(column.getKind()));
        }

        /**
         * Concatenate multiple expressions together.
         * @param first the first child expression to use
         * @param second the second child expression to use
         * @param rest this supports any number children (at least 2), this is the rest of them
         * @return a new expression which evaluates each child and returns the cross product
         */
        @Nonnull
        public static ThenKeyExpression concat(@Nonnull KeyExpression first, @Nonnull KeyExpression second,
                                               @Nonnull KeyExpression... rest) {
            return new ThenKeyExpression(first, second, rest);
        }

        /**
         * Concatenate multiple expressions together.
         * @param children expressions to combine
         * @return a new expression which evaluates each child and returns the cross product
         */
        @Nonnull
        public static ThenKeyExpression concat(@Nonnull List<KeyExpression> children) {
            return new ThenKeyExpression(children);
        }

        /**
         * Build the key expression for a list of grouping columns: the column itself for a single column, or the
         * concatenation of all of them.
         * @param columns the grouping columns, in order
         * @return an expression producing one component per column
         */
        @Nonnull
        public static KeyExpression grouping(@Nonnull List<ColumnDeclaration> columns) {
            if (columns.size() == 1) {
                return column(columns.get(0));
            }
            final List<KeyExpression> children = new ArrayList<>(columns.size());
            for (ColumnDeclaration column : columns) {
                children.add(column(column));
            }
            return concat(Collections.unmodifiableList(children));
        }
    }

    private Key() {
    }
}
