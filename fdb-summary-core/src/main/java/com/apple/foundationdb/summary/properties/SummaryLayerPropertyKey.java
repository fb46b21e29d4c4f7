/*
 * SummaryLayerPropertyKey.java
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

package com.apple.foundationdb.summary.properties;

import com.apple.foundationdb.summary.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A typed key for a configuration property, with a default used when the property is not set.
 * Keys are compared by name.
 *
 * @param <T> the type of the property's value
 */
@API(API.Status.EXPERIMENTAL)
public final class SummaryLayerPropertyKey<T> {
    @Nonnull
    private final String name;
    @Nonnull
    private final T defaultValue;
    @Nonnull
    private final Class<T> type;

    private SummaryLayerPropertyKey(@Nonnull String name, @Nonnull T defaultValue, @Nonnull Class<T> type) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.type = type;
    }

    @Nonnull
    public static SummaryLayerPropertyKey<Boolean> booleanPropertyKey(@Nonnull String name, boolean defaultValue) {
        return new SummaryLayerPropertyKey<>(name, defaultValue, Boolean.class);
    }

    @Nonnull
    public static SummaryLayerPropertyKey<Integer> integerPropertyKey(@Nonnull String name, int defaultValue) {
        return new SummaryLayerPropertyKey<>(name, defaultValue, Integer.class);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public T getDefaultValue() {
        return defaultValue;
    }

    @Nonnull
    public Class<T> getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SummaryLayerPropertyKey<?> that = (SummaryLayerPropertyKey<?>) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + "(" + type.getSimpleName() + ")";
    }
}
