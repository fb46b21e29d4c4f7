/*
 * ScalarValue.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link Value} holding exactly one atom.
 */
@API(API.Status.STABLE)
public final class ScalarValue extends Value {
    @Nullable
    private final Object atom;

    ScalarValue(@Nullable Object atom) {
        this.atom = atom;
    }

    @Nullable
    public Object getAtom() {
        return atom;
    }

    @Nonnull
    @Override
    public ColumnKind getKind() {
        return ColumnKind.SCALAR;
    }

    @Nonnull
    @Override
    public List<Object> getAtoms() {
        return Collections.singletonList(atom);
    }

    @Override
    public boolean contains(@Nullable Object other) {
        return Objects.equals(atom, Atoms.normalize(other));
    }

    @Nonnull
    @Override
    public Value rename(@Nonnull Map<?, ?> renames) {
        if (!renames.containsKey(atom)) {
            return this;
        }
        return Value.scalar(renames.get(atom));
    }

    @Nonnull
    @Override
    public Value convertTo(@Nonnull ColumnKind kind) {
        if (kind == ColumnKind.SCALAR) {
            return this;
        }
        return atom == null ? LabelSet.EMPTY : Value.labels(atom);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(atom, ((ScalarValue)o).atom);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(atom);
    }

    @Override
    public String toString() {
        return atom instanceof String ? "'" + atom + "'" : String.valueOf(atom);
    }
}
