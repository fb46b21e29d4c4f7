/*
 * Atoms.java
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
import com.apple.foundationdb.summary.logging.LogMessageKeys;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * Normalization of the atoms stored in column values and key tuples. Two atoms that normalize to equal objects
 * are the same key component, so an {@code Integer} 3 and a {@code Long} 3 group together.
 */
@API(API.Status.INTERNAL)
public final class Atoms {
    private static final BigInteger BIG_INT_MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);
    private static final BigInteger BIG_INT_MIN_LONG = BigInteger.valueOf(Long.MIN_VALUE);

    private Atoms() {
    }

    /**
     * Normalize a single atom. Supported atoms are {@code null}, strings, booleans, integral numbers (widened to
     * {@code Long} when they fit) and floating-point numbers (widened to {@code Double}).
     * @param atom the atom to normalize
     * @return the normalized atom
     * @throws TypeMismatchException if {@code atom} is a collection, a map, an array or any other type
     */
    @Nullable
    public static Object normalize(@Nullable Object atom) {
        if (atom == null || atom instanceof String || atom instanceof Boolean || atom instanceof Long || atom instanceof Double) {
            return atom;
        } else if (atom instanceof Byte || atom instanceof Short || atom instanceof Integer) {
            return ((Number)atom).longValue();
        } else if (atom instanceof Float) {
            return ((Float)atom).doubleValue();
        } else if (atom instanceof BigInteger) {
            final BigInteger bigInt = (BigInteger)atom;
            if (bigInt.compareTo(BIG_INT_MIN_LONG) >= 0 && bigInt.compareTo(BIG_INT_MAX_LONG) <= 0) {
                return bigInt.longValue();
            }
            return bigInt;
        } else if (atom instanceof Collection<?> || atom instanceof Map<?, ?> || atom instanceof Value || atom.getClass().isArray()) {
            throw new TypeMismatchException("multiple values given where a single atom is expected",
                    LogMessageKeys.ACTUAL_TYPE, atom.getClass().getName());
        } else {
            throw new TypeMismatchException("unsupported atom type",
                    LogMessageKeys.ACTUAL_TYPE, atom.getClass().getName());
        }
    }
}
