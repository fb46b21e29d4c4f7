/*
 * KeyTuple.java
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
import com.apple.foundationdb.summary.values.Atoms;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An ordered combination of atoms, one per grouping column, identifying one summary row. Two tuples are equal
 * when all their components are equal, regardless of which source rows produced them.
 */
@API(API.Status.STABLE)
public final class KeyTuple {
    /**
     * A tuple with no components.
     */
    @Nonnull
    public static final KeyTuple EMPTY = new KeyTuple(Collections.emptyList());

    @Nonnull
    private final List<Object> values;

    private KeyTuple(@Nonnull List<Object> values) {
        this.values = values;
    }

    /**
     * Creates a new tuple with just a single component.
     * @param atom the lone component
     * @return a new tuple
     */
    @Nonnull
    public static KeyTuple scalar(@Nullable Object atom) {
        return new KeyTuple(Collections.singletonList(Atoms.normalize(atom)));
    }

    /**
     * Fan out a list of atoms into a single-component tuple for each of them.
     * @param atoms the atoms
     * @return one tuple for each atom, in order
     */
    @Nonnull
    public static List<KeyTuple> fan(@Nonnull List<Object> atoms) {
        final List<KeyTuple> tuples = new ArrayList<>(atoms.size());
        for (Object atom : atoms) {
            tuples.add(scalar(atom));
        }
        return tuples;
    }

    /**
     * Shorthand for a tuple of the given components, mostly for tests.
     * @param first the first component
     * @param rest the remaining components
     * @return a new tuple
     */
    @Nonnull
    public static KeyTuple of(@Nullable Object first, @Nullable Object... rest) {
        final List<Object> values = new ArrayList<>(rest.length + 1);
        values.add(Atoms.normalize(first));
        for (Object atom : rest) {
            values.add(Atoms.normalize(atom));
        }
        return new KeyTuple(Collections.unmodifiableList(values));
    }

    @Nonnull
    public static KeyTuple fromList(@Nonnull List<?> components) {
        final List<Object> values = new ArrayList<>(components.size());
        for (Object atom : components) {
            values.add(Atoms.normalize(atom));
        }
        return new KeyTuple(Collections.unmodifiableList(values));
    }

    /**
     * Creates a new tuple by appending another tuple to this one.
     * @param other the tuple forming the second part
     * @return a new tuple with the components of this tuple followed by those of {@code other}
     */
    @Nonnull
    public KeyTuple append(@Nonnull KeyTuple other) {
        final List<Object> combined = new ArrayList<>(values.size() + other.values.size());
        combined.addAll(values);
        combined.addAll(other.values);
        return new KeyTuple(Collections.unmodifiableList(combined));
    }

    @Nullable
    public Object get(int idx) {
        return values.get(idx);
    }

    public int size() {
        return values.size();
    }

    @Nonnull
    public List<Object> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((KeyTuple)o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return Arrays.toString(values.toArray());
    }
}
