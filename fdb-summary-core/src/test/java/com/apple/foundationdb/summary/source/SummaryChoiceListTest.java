/*
 * SummaryChoiceListTest.java
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

import com.apple.foundationdb.summary.index.IndexKind;
import com.apple.foundationdb.summary.metadata.ColumnDeclaration;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.metadata.SourceSchema;
import com.apple.foundationdb.summary.summary.DetachedSummaryException;
import com.apple.foundationdb.summary.summary.DetachedSummaryTable;
import com.apple.foundationdb.summary.summary.SummaryRow;
import com.apple.foundationdb.summary.summary.SummaryTable;
import com.apple.foundationdb.summary.values.ColumnKind;
import com.apple.foundationdb.summary.values.TypeMismatchException;
import com.apple.foundationdb.summary.values.Value;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.apple.foundationdb.summary.summary.SummaryRows.assertRows;
import static com.apple.foundationdb.summary.summary.SummaryRows.row;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for summary tables grouped by multi-valued columns.
 */
public class SummaryChoiceListTest {
    private SourceTable source;

    @BeforeEach
    public void setUp() {
        source = SourceTable.newBuilder()
                .setName("Source")
                .setSchema(SourceSchema.newBuilder()
                        .addScalarColumn("other")
                        .addMultiValuedColumn("choices1")
                        .addMultiValuedColumn("choices2")
                        .build())
                .build();
        source.insertRow(21, ImmutableMap.of(
                "choices1", Arrays.asList("a", "b"),
                "choices2", Arrays.asList("c", "d"),
                "other", "foo"));
    }

    @Test
    public void summaryByChoiceList() {
        final SummaryTable summary1 = source.createSummary("Summary1", "choices1");
        final SummaryTable summary2 = source.createSummary("Summary2", "choices1", "choices2");
        final SummaryTable summary3 = source.createSummary("Summary3", "other");
        final SummaryTable summary4 = source.createSummary("Summary4", "other", "choices1");

        assertEquals(ImmutableList.of(summary1, summary2, summary3, summary4), source.getSummaries());
        assertEquals(ImmutableList.of(
                        ColumnDeclaration.derived("choices1", ColumnKind.SCALAR, "choices1"),
                        ColumnDeclaration.derived("choices2", ColumnKind.SCALAR, "choices2"),
                        ColumnDeclaration.multiValued(SummaryTable.GROUP_COLUMN),
                        ColumnDeclaration.scalar(SummaryTable.COUNT_COLUMN)),
                summary2.getColumns());

        assertRows(summary1, row(1, "a", 21L), row(2, "b", 21L));
        assertRows(summary2,
                row(1, "a", "c", 21L), row(2, "a", "d", 21L),
                row(3, "b", "c", 21L), row(4, "b", "d", 21L));
        assertRows(summary3, row(1, "foo", 21L));
        assertRows(summary4, row(1, "foo", "a", 21L), row(2, "foo", "b", 21L));

        // Only the summary without multi-valued columns is simple.
        assertFalse(summary1.isSimple());
        assertFalse(summary2.isSimple());
        assertTrue(summary3.isSimple());
        assertFalse(summary4.isSimple());
        final IndexRegistry registry = source.getIndexRegistry();
        assertEquals(IndexKind.MEMBERSHIP, registry.getIndex(summary1).getKind());
        assertEquals(IndexKind.MEMBERSHIP, registry.getIndex(summary2).getKind());
        assertEquals(IndexKind.EQUALITY, registry.getIndex(summary3).getKind());
        assertEquals(IndexKind.MEMBERSHIP, registry.getIndex(summary4).getKind());

        // Remove 'b' from choices1.
        TransactionResult result = source.updateRow(21, ImmutableMap.of("choices1", ImmutableList.of("a")));
        assertEquals(Value.labels("a"), source.getRow(21).getValue("choices1"));
        assertRows(summary1, row(1, "a", 21L), row(2, "b"));
        assertRows(summary2,
                row(1, "a", "c", 21L), row(2, "a", "d", 21L),
                row(3, "b", "c"), row(4, "b", "d"));
        assertThat(result.getResult(summary2).getCreatedRowIds(), empty());
        assertThat(result.getResult(summary2).getUpdatedRowIds(), contains(3L, 4L));
        assertTrue(result.getResult(summary3).isEmpty());

        // Add 'e' to choices2.
        result = source.updateRow(21, ImmutableMap.of("choices2", ImmutableList.of("c", "d", "e")));
        assertRows(summary1, row(1, "a", 21L), row(2, "b"));
        assertRows(summary2,
                row(1, "a", "c", 21L), row(2, "a", "d", 21L),
                row(3, "b", "c"), row(4, "b", "d"),
                row(5, "a", "e", 21L));
        assertThat(result.getResult(summary2).getCreatedRowIds(), contains(5L));
        assertTrue(result.getResult(summary1).isEmpty());

        // Remove the record; every row stays, now empty.
        source.deleteRow(21);
        assertRows(summary1, row(1, "a"), row(2, "b"));
        assertRows(summary2,
                row(1, "a", "c"), row(2, "a", "d"),
                row(3, "b", "c"), row(4, "b", "d"),
                row(5, "a", "e"));

        // Rows with every combination of {a,b,ab} and {c,d,cd}.
        final List<SourceMutation> inserts = new ArrayList<>();
        long rowId = 101;
        for (List<String> choices2 : ImmutableList.of(ImmutableList.of("c"), ImmutableList.of("d"), ImmutableList.of("c", "d"))) {
            for (List<String> choices1 : ImmutableList.of(ImmutableList.of("a"), ImmutableList.of("b"), ImmutableList.of("a", "b"))) {
                inserts.add(SourceMutation.insert(rowId++, ImmutableMap.of("choices1", choices1, "choices2", choices2)));
            }
        }
        result = source.apply(inserts);
        assertEquals(ImmutableList.of(101L, 102L, 103L, 104L, 105L, 106L, 107L, 108L, 109L), result.getInsertedRowIds());

        assertRows(summary1,
                row(1, "a", 101L, 103L, 104L, 106L, 107L, 109L),
                row(2, "b", 102L, 103L, 105L, 106L, 108L, 109L));
        final SummaryRow[] summaryData = {
                row(1, "a", "c", 101L, 103L, 107L, 109L),
                row(2, "a", "d", 104L, 106L, 107L, 109L),
                row(3, "b", "c", 102L, 103L, 108L, 109L),
                row(4, "b", "d", 105L, 106L, 108L, 109L),
                row(5, "a", "e"),
        };
        assertRows(summary2, summaryData);
        // The new rows have no value for "other".
        assertRows(summary3,
                row(1, "foo"),
                row(2, KeyTuple.scalar(null), 101L, 102L, 103L, 104L, 105L, 106L, 107L, 108L, 109L));
        assertEquals(4, summary2.lookup(KeyTuple.of("a", "c")).orElseThrow().getCount());
        assertEquals(ImmutableList.of(101L, 103L, 107L, 109L), summary2.getSummarySourceGroup(1).asList());

        // Detach the summary grouped by both columns.
        final DetachedSummaryTable detached = source.detachSummary(summary2);
        assertEquals(ImmutableList.of(summary1, summary3, summary4), source.getSummaries());
        assertFalse(source.getIndexRegistry().contains(summary2));
        assertEquals(Arrays.asList(summaryData), new ArrayList<>(detached.getRows()));
        assertEquals(ImmutableList.of(
                        ColumnDeclaration.scalar("choices1"),
                        ColumnDeclaration.scalar("choices2"),
                        ColumnDeclaration.scalar(SummaryTable.COUNT_COLUMN),
                        ColumnDeclaration.multiValued(SummaryTable.GROUP_COLUMN)),
                detached.getColumns());
        assertEquals(SummaryTable.State.DETACHED, summary2.getState());
        assertThrows(DetachedSummaryException.class, summary2::getRows);
        assertThrows(DetachedSummaryException.class, () -> source.detachSummary(summary2));

        // The snapshot no longer follows the source.
        source.deleteRow(109);
        assertEquals(4, detached.getRow(1).getCount());
        assertEquals(5, summary1.lookup(KeyTuple.of("a")).orElseThrow().getCount());
    }

    @Test
    public void changeScalarToMultiValued() {
        final SourceTable choices = SourceTable.newBuilder()
                .setName("Source")
                .setSchema(SourceSchema.newBuilder()
                        .addScalarColumn("other")
                        .addScalarColumn("choices1")
                        .build())
                .build();
        choices.insertRow(21, ImmutableMap.of("choices1", "a", "other", "foo"));
        choices.insertRow(22, ImmutableMap.of("choices1", "b", "other", "bar"));

        final SummaryTable summary = choices.createSummary("Summary", "choices1");
        assertTrue(summary.isSimple());
        assertRows(summary, row(1, "a", 21L), row(2, "b", 22L));

        final TransactionResult result = choices.changeColumnKind("choices1", ColumnKind.MULTI_VALUED);
        assertTrue(result.getResult(summary).isEmpty());
        assertEquals(ColumnKind.MULTI_VALUED, choices.getSchema().getColumn("choices1").getKind());
        assertEquals(Value.labels("a"), choices.getRow(21).getValue("choices1"));
        assertEquals(Value.labels("b"), choices.getRow(22).getValue("choices1"));

        // Same rows, same ids, but now served by a membership index.
        assertRows(summary, row(1, "a", 21L), row(2, "b", 22L));
        assertFalse(summary.isSimple());
        assertEquals(IndexKind.MEMBERSHIP, choices.getIndexRegistry().getIndex(summary).getKind());

        choices.updateRow(22, ImmutableMap.of("choices1", ImmutableList.of("a", "b")));
        assertRows(summary, row(1, "a", 21L, 22L), row(2, "b", 22L));
    }

    @Test
    public void changeMultiValuedToScalarRejectsSeveralLabels() {
        final SummaryTable summary = source.createSummary("Summary", "choices1");
        assertThrows(TypeMismatchException.class, () -> source.changeColumnKind("choices1", ColumnKind.SCALAR));

        // Nothing changed.
        assertEquals(ColumnKind.MULTI_VALUED, source.getSchema().getColumn("choices1").getKind());
        assertEquals(Value.labels("a", "b"), source.getRow(21).getValue("choices1"));
        assertFalse(summary.isSimple());
        assertRows(summary, row(1, "a", 21L), row(2, "b", 21L));
    }

    @Test
    public void changeKindLeavesOtherSummariesAlone() {
        final SummaryTable byOther = source.createSummary("ByOther", "other");
        final SummaryTable byChoices2 = source.createSummary("ByChoices2", "choices2");
        source.updateRow(21, ImmutableMap.of("choices2", ImmutableList.of("c")));
        final TransactionResult result = source.changeColumnKind("choices2", ColumnKind.SCALAR);

        assertTrue(byOther.isSimple());
        assertTrue(byChoices2.isSimple());
        assertTrue(result.getSummaryResults().isEmpty());
        assertRows(byChoices2, row(1, "c", 21L), row(2, "d"));
        assertRows(byOther, row(1, "foo", 21L));
    }

    @Test
    public void emptyLabelSetMatchesNothing() {
        final SummaryTable summary = source.createSummary("Summary", "choices1", "choices2");
        final long rowId = source.insertRow(ImmutableMap.of("choices1", ImmutableList.of("a")));
        assertEquals(22L, rowId);
        assertRows(summary,
                row(1, "a", "c", 21L), row(2, "a", "d", 21L),
                row(3, "b", "c", 21L), row(4, "b", "d", 21L));
    }

    @Test
    public void createSummaryOverEmptySource() {
        final SourceTable empty = SourceTable.newBuilder()
                .setName("Empty")
                .setSchema(SourceSchema.newBuilder().addMultiValuedColumn("tags").build())
                .build();
        final SummaryTable summary = empty.createSummary("Summary", "tags");
        assertThat(summary.getRows(), empty());

        final Map<String, ?> values = ImmutableMap.of("tags", ImmutableList.of("x", "y", "x"));
        empty.insertRow(values);
        assertEquals(Value.labels("x", "y"), empty.getRow(1).getValue("tags"));
        assertRows(summary, row(1, "x", 1L), row(2, "y", 1L));
    }
}
