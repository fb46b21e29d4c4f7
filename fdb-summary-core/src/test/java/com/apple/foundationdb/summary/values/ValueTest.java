/*
 * ValueTest.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Value}, {@link ScalarValue} and {@link LabelSet}.
 */
public class ValueTest {

    @Test
    public void labelSetsCollapseDuplicates() {
        final LabelSet labels = Value.labels("b", "a", "b", "c", "a");
        assertThat(labels.getAtoms(), contains("b", "a", "c"));
        assertEquals(3, labels.size());
        assertTrue(labels.contains("a"));
        assertFalse(labels.contains("d"));
        assertFalse(labels.contains(null));
    }

    @Test
    public void labelOrderIsPartOfIdentity() {
        assertEquals(Value.labels("a", "b"), Value.labels(ImmutableList.of("a", "b")));
        assertNotEquals(Value.labels("a", "b"), Value.labels("b", "a"));
        assertNotEquals(Value.scalar("a"), Value.labels("a"));
        assertSame(LabelSet.EMPTY, Value.labels(Collections.emptyList()));
    }

    @Test
    public void nullLabelsAreRejected() {
        assertThrows(TypeMismatchException.class, () -> Value.labels("a", null));
    }

    static Stream<Arguments> normalizedAtoms() {
        return Stream.of(
                Arguments.of(1, 1L),
                Arguments.of((short)7, 7L),
                Arguments.of((byte)3, 3L),
                Arguments.of(1.5f, 1.5d),
                Arguments.of(BigInteger.TEN, 10L),
                Arguments.of("x", "x"),
                Arguments.of(true, true));
    }

    @ParameterizedTest
    @MethodSource("normalizedAtoms")
    public void atomsAreNormalized(Object raw, Object normalized) {
        assertEquals(normalized, Value.scalar(raw).getAtom());
        assertEquals(Value.scalar(normalized), Value.scalar(raw));
        assertTrue(Value.labels(raw).contains(normalized));
    }

    @Test
    public void hugeIntegersStayBig() {
        final BigInteger huge = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);
        assertEquals(huge, Value.scalar(huge).getAtom());
    }

    @Test
    public void scalarsRejectCollections() {
        assertThrows(TypeMismatchException.class, () -> Value.scalar(ImmutableList.of("a")));
        assertThrows(TypeMismatchException.class, () -> Value.scalar(ImmutableMap.of("a", 1)));
        assertThrows(TypeMismatchException.class, () -> Value.scalar(new String[] {"a"}));
        assertThrows(TypeMismatchException.class, () -> Value.scalar(Value.scalar("a")));
        assertThrows(TypeMismatchException.class, () -> Value.scalar(new Object()));
    }

    @Test
    public void rawValuesMustFitTheColumnKind() {
        assertEquals(Value.labels("a"), Value.of(ColumnKind.MULTI_VALUED, Arrays.asList("a")));
        assertEquals(Value.scalar("a"), Value.of(ColumnKind.SCALAR, "a"));
        assertThrows(TypeMismatchException.class, () -> Value.of(ColumnKind.MULTI_VALUED, "a"));
        assertThrows(TypeMismatchException.class, () -> Value.of(ColumnKind.MULTI_VALUED, null));
        assertThrows(TypeMismatchException.class, () -> Value.of(ColumnKind.SCALAR, ImmutableList.of("a")));
        assertThrows(TypeMismatchException.class, () -> Value.of(ColumnKind.SCALAR, Value.labels("a")));
        assertThat(Value.of(ColumnKind.SCALAR, null), instanceOf(ScalarValue.class));
    }

    @Test
    public void renameLabels() {
        final LabelSet labels = Value.labels("a", "b", "c");
        assertEquals(Value.labels("a", "x", "c"), labels.rename(ImmutableMap.of("b", "x")));
        assertEquals(Value.labels("c", "b"), labels.rename(ImmutableMap.of("a", "c")));
        assertSame(labels, labels.rename(ImmutableMap.of("z", "y")));
        assertEquals(Value.scalar("y"), Value.scalar("x").rename(ImmutableMap.of("x", "y")));
        final ScalarValue unchanged = Value.scalar("x");
        assertSame(unchanged, unchanged.rename(ImmutableMap.of("y", "z")));
    }

    @Test
    public void convertBetweenKinds() {
        assertEquals(Value.labels("a"), Value.scalar("a").convertTo(ColumnKind.MULTI_VALUED));
        assertSame(LabelSet.EMPTY, Value.scalar(null).convertTo(ColumnKind.MULTI_VALUED));
        assertEquals(Value.scalar("a"), Value.labels("a").convertTo(ColumnKind.SCALAR));
        assertNull(((ScalarValue)LabelSet.EMPTY.convertTo(ColumnKind.SCALAR)).getAtom());
        assertThrows(TypeMismatchException.class, () -> Value.labels("a", "b").convertTo(ColumnKind.SCALAR));
    }
}
