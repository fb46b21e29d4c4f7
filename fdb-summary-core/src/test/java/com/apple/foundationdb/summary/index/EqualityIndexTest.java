/*
 * EqualityIndexTest.java
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

package com.apple.foundationdb.summary.index;

import com.apple.foundationdb.summary.metadata.GroupingImage;
import com.apple.foundationdb.summary.metadata.GroupingKey;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.metadata.SourceSchema;
import com.apple.foundationdb.summary.source.SourceRow;
import com.apple.foundationdb.summary.values.Value;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link EqualityIndex}.
 */
public class EqualityIndexTest {
    private static final SourceSchema SCHEMA = SourceSchema.newBuilder()
            .addScalarColumn("owner")
            .addScalarColumn("state")
            .build();
    private static final GroupingKey KEY = GroupingKey.forColumns(SCHEMA, ImmutableList.of("owner", "state"));

    private static GroupingImage image(long id, String owner, String state) {
        return KEY.image(new SourceRow(id, ImmutableMap.of("owner", Value.scalar(owner), "state", Value.scalar(state))), 1);
    }

    @Test
    public void addAndRemoveAreIdempotent() {
        final EqualityIndex index = new EqualityIndex();
        assertTrue(index.add(1, KeyTuple.of("a", "x")));
        assertFalse(index.add(1, KeyTuple.of("a", "x")));
        assertTrue(index.add(2, KeyTuple.of("a", "x")));
        assertEquals(2, index.getPostingCount());
        assertThat(index.matches(KeyTuple.of("a", "x")), contains(1L, 2L));

        assertTrue(index.remove(1, KeyTuple.of("a", "x")));
        assertFalse(index.remove(1, KeyTuple.of("a", "x")));
        assertFalse(index.remove(3, KeyTuple.of("b", "y")));
        assertThat(index.matches(KeyTuple.of("a", "x")), contains(2L));

        index.remove(2, KeyTuple.of("a", "x"));
        assertEquals(0, index.getKeyCount());
        assertThat(index.matches(KeyTuple.of("a", "x")), empty());
    }

    @Test
    public void updateMovesRows() {
        final EqualityIndex index = new EqualityIndex();
        index.update(null, image(1, "a", "x"));
        index.update(null, image(2, "a", "x"));
        index.update(null, image(3, "b", null));
        assertThat(index.matches(KeyTuple.of("a", "x")), contains(1L, 2L));
        assertThat(index.matches(KeyTuple.fromList(Arrays.asList("b", null))), contains(3L));

        index.update(image(2, "a", "x"), image(2, "b", null));
        assertThat(index.matches(KeyTuple.of("a", "x")), contains(1L));
        assertThat(index.matches(KeyTuple.fromList(Arrays.asList("b", null))), contains(2L, 3L));

        index.update(image(1, "a", "x"), null);
        assertThat(index.matches(KeyTuple.of("a", "x")), empty());
        assertEquals(2, index.getPostingCount());

        index.clear();
        assertEquals(0, index.getPostingCount());
    }

    @Test
    public void chosenForAllScalarGroupings() {
        assertEquals(IndexKind.EQUALITY, LookupIndexes.kindFor(KEY));
        assertThat(LookupIndexes.forGrouping(KEY), instanceOf(EqualityIndex.class));
    }
}
