/*
 * KeyExpressionTest.java
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

import com.apple.foundationdb.summary.metadata.InvalidGroupingSpecException;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.metadata.SourceSchema;
import com.apple.foundationdb.summary.source.SourceRow;
import com.apple.foundationdb.summary.values.TypeMismatchException;
import com.apple.foundationdb.summary.values.Value;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static com.apple.foundationdb.summary.metadata.Key.Expressions.column;
import static com.apple.foundationdb.summary.metadata.Key.Expressions.concat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link KeyExpression}.
 */
public class KeyExpressionTest {
    private static final SourceSchema SCHEMA = SourceSchema.newBuilder()
            .addScalarColumn("owner")
            .addMultiValuedColumn("tags1")
            .addMultiValuedColumn("tags2")
            .build();

    private static final SourceRow ROW = new SourceRow(21, ImmutableMap.of(
            "owner", Value.scalar("foo"),
            "tags1", Value.labels("a", "b"),
            "tags2", Value.labels("c", "d", "e")));

    private static final SourceRow NO_TAGS = new SourceRow(22, ImmutableMap.of(
            "owner", Value.scalar("bar"),
            "tags1", Value.labels("a"),
            "tags2", Value.labels()));

    @Test
    public void scalarColumn() {
        final KeyExpression expression = column("owner");
        assertEquals(ImmutableList.of(KeyTuple.of("foo")), expression.evaluate(ROW));
        assertEquals(KeyTuple.of("foo"), expression.evaluateSingleton(ROW));
        assertFalse(expression.createsDuplicates());
        assertEquals(ImmutableList.of(KeyTuple.scalar(null)), expression.evaluate(null));
    }

    @Test
    public void fanOutColumn() {
        final KeyExpression expression = column("tags1", KeyExpression.FanType.FanOut);
        assertEquals(ImmutableList.of(KeyTuple.of("a"), KeyTuple.of("b")), expression.evaluate(ROW));
        assertTrue(expression.createsDuplicates());
        assertEquals(ImmutableList.of(), expression.evaluate(null));
    }

    @Test
    public void crossProductFollowsColumnOrder() {
        final KeyExpression expression = concat(
                column("tags1", KeyExpression.FanType.FanOut),
                column("owner"),
                column("tags2", KeyExpression.FanType.FanOut));
        assertEquals(3, expression.getColumnSize());
        assertEquals(ImmutableList.of(
                KeyTuple.of("a", "foo", "c"), KeyTuple.of("a", "foo", "d"), KeyTuple.of("a", "foo", "e"),
                KeyTuple.of("b", "foo", "c"), KeyTuple.of("b", "foo", "d"), KeyTuple.of("b", "foo", "e")),
                expression.evaluate(ROW));
        assertEquals(ImmutableList.of(), expression.evaluate(NO_TAGS));
        assertEquals(3, expression.normalizeKeyForPositions().size());
    }

    @Test
    public void wrongKindAtEvaluation() {
        assertThrows(TypeMismatchException.class, () -> column("tags1").evaluate(ROW));
        assertThrows(TypeMismatchException.class, () -> column("owner", KeyExpression.FanType.FanOut).evaluate(ROW));
        assertThrows(KeyExpression.InvalidResultException.class,
                () -> column("tags1", KeyExpression.FanType.FanOut).evaluateSingleton(ROW));
    }

    @Test
    public void validateAgainstSchema() {
        column("owner").validate(SCHEMA);
        concat(column("owner"), column("tags2", KeyExpression.FanType.FanOut)).validate(SCHEMA);
        assertThrows(InvalidGroupingSpecException.class, () -> column("missing").validate(SCHEMA));
        assertThrows(InvalidGroupingSpecException.class, () -> column("tags1").validate(SCHEMA));
        assertThrows(InvalidGroupingSpecException.class,
                () -> column("owner", KeyExpression.FanType.FanOut).validate(SCHEMA));
    }

    @Test
    public void equality() {
        assertEquals(column("owner"), column("owner", KeyExpression.FanType.None));
        assertEquals(concat(column("owner"), column("tags1", KeyExpression.FanType.FanOut)),
                concat(column("owner"), column("tags1", KeyExpression.FanType.FanOut)));
        assertFalse(column("tags1").equals(column("tags1", KeyExpression.FanType.FanOut)));
    }
}
