/*
 * GroupingKeyTest.java
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

import com.apple.foundationdb.summary.metadata.expressions.ColumnKeyExpression;
import com.apple.foundationdb.summary.metadata.expressions.ThenKeyExpression;
import com.apple.foundationdb.summary.source.SourceRow;
import com.apple.foundationdb.summary.values.ColumnKind;
import com.apple.foundationdb.summary.values.Value;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link GroupingKey}.
 */
public class GroupingKeyTest {
    private static final SourceSchema SCHEMA = SourceSchema.newBuilder()
            .addScalarColumn("owner")
            .addScalarColumn("state")
            .addMultiValuedColumn("tags1")
            .addMultiValuedColumn("tags2")
            .build();

    private static SourceRow row(long id, String owner, List<String> tags1, List<String> tags2) {
        return new SourceRow(id, ImmutableMap.of(
                "owner", Value.scalar(owner),
                "state", Value.scalar(null),
                "tags1", Value.labels(tags1),
                "tags2", Value.labels(tags2)));
    }

    private static List<String> labels(int count) {
        final List<String> labels = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            labels.add("l" + i);
        }
        return labels;
    }

    @Test
    public void allScalarGivesOneTuple() {
        final GroupingKey key = GroupingKey.forColumns(SCHEMA, ImmutableList.of("owner", "state"));
        assertTrue(key.isAllScalar());
        assertThat(key.getExpression(), instanceOf(ThenKeyExpression.class));
        final SourceRow row = row(1, "foo", ImmutableList.of("a", "b"), ImmutableList.of("c"));
        assertEquals(ImmutableList.of(KeyTuple.fromList(Arrays.asList("foo", null))), key.expand(row, 10));
    }

    @Test
    public void singleColumnUsesColumnExpression() {
        final GroupingKey key = GroupingKey.forColumns(SCHEMA, ImmutableList.of("tags1"));
        assertThat(key.getExpression(), instanceOf(ColumnKeyExpression.class));
        assertFalse(key.isAllScalar());
        assertEquals(ImmutableList.of(ColumnDeclaration.multiValued("tags1")), key.getColumns());
    }

    @ParameterizedTest
    @CsvSource({"0, 0", "0, 3", "1, 1", "2, 2", "3, 4", "5, 1"})
    public void cartesianExpansion(int m, int n) {
        final GroupingKey key = GroupingKey.forColumns(SCHEMA, ImmutableList.of("tags1", "owner", "tags2"));
        final SourceRow row = row(1, "foo", labels(m), labels(n));
        final List<KeyTuple> tuples = key.expand(row, 1000);
        assertEquals(m * n, tuples.size());
        assertEquals(m * n, key.countTuples(row));
        final Set<KeyTuple> distinct = new HashSet<>(tuples);
        assertEquals(tuples.size(), distinct.size());
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) {
                assertTrue(distinct.contains(KeyTuple.of("l" + i, "foo", "l" + j)));
            }
        }
    }

    @Test
    public void expansionIsDeterministic() {
        final GroupingKey key = GroupingKey.forColumns(SCHEMA, ImmutableList.of("tags2", "tags1"));
        final SourceRow row = row(1, "foo", ImmutableList.of("b", "a"), ImmutableList.of("d", "c"));
        assertEquals(ImmutableList.of(
                KeyTuple.of("d", "b"), KeyTuple.of("d", "a"), KeyTuple.of("c", "b"), KeyTuple.of("c", "a")),
                key.expand(row, 10));
    }

    @Test
    public void fanOutLimit() {
        final GroupingKey key = GroupingKey.forColumns(SCHEMA, ImmutableList.of("tags1", "tags2"));
        final SourceRow row = row(7, "foo", labels(3), labels(3));
        assertEquals(9, key.expand(row, 9).size());
        final KeyFanOutLimitException e = assertThrows(KeyFanOutLimitException.class, () -> key.expand(row, 8));
        assertEquals(9L, e.getLogInfo().get("fan_out"));
    }

    @Test
    public void images() {
        final GroupingKey key = GroupingKey.forColumns(SCHEMA, ImmutableList.of("owner", "tags1"));
        assertNull(key.image(null, 10));
        final GroupingImage image = key.image(row(3, "foo", ImmutableList.of("a", "b"), ImmutableList.of()), 10);
        assertEquals(3L, image.getRowId());
        assertEquals(2, image.getColumnCount());
        assertEquals(ImmutableList.of("a", "b"), image.getColumnAtoms(1));
        assertEquals(ImmutableList.of(KeyTuple.of("foo", "a"), KeyTuple.of("foo", "b")), image.getTuples());
        final GroupingImage sameGrouping = key.image(row(3, "foo", ImmutableList.of("a", "b"), ImmutableList.of("x")), 10);
        assertTrue(image.sameGroupingAs(sameGrouping));
        assertFalse(image.sameGroupingAs(key.image(row(3, "foo", ImmutableList.of("b", "a"), ImmutableList.of()), 10)));
    }

    @Test
    public void invalidGroupings() {
        assertThrows(InvalidGroupingSpecException.class, () -> GroupingKey.forColumns(SCHEMA, ImmutableList.of()));
        assertThrows(InvalidGroupingSpecException.class,
                () -> GroupingKey.forColumns(SCHEMA, ImmutableList.of("owner", "missing")));
        assertThrows(InvalidGroupingSpecException.class,
                () -> GroupingKey.forColumns(SCHEMA, ImmutableList.of("tags1", "tags1")));
    }

    @Test
    public void declarationsMustAgreeWithSchema() {
        final GroupingKey key = GroupingKey.fromDeclarations(SCHEMA,
                ImmutableList.of(ColumnDeclaration.scalar("owner"), ColumnDeclaration.multiValued("tags1")));
        assertEquals(ImmutableList.of("owner", "tags1"), key.getColumnNames());
        assertThrows(InvalidGroupingSpecException.class, () -> GroupingKey.fromDeclarations(SCHEMA,
                ImmutableList.of(ColumnDeclaration.multiValued("owner"))));
        assertThrows(InvalidGroupingSpecException.class, () -> GroupingKey.fromDeclarations(SCHEMA,
                ImmutableList.of(ColumnDeclaration.scalar("tags2"))));
    }

    @Test
    public void rederiveAfterKindChange() {
        final GroupingKey key = GroupingKey.forColumns(SCHEMA, ImmutableList.of("owner", "state"));
        final SourceSchema changed = SCHEMA.withColumnKind("state", ColumnKind.MULTI_VALUED);
        assertThrows(InvalidGroupingSpecException.class, () -> key.validate(changed));
        final GroupingKey rederived = key.rederive(changed);
        assertEquals(key.getColumnNames(), rederived.getColumnNames());
        assertFalse(rederived.isAllScalar());
    }
}
