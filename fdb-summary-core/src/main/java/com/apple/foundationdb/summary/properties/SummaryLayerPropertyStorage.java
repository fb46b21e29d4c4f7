/*
 * SummaryLayerPropertyStorage.java
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

import com.apple.foundationdb.summary.SummaryCoreException;
import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.Map;

/**
 * An immutable set of configuration property values. Keys that have not been set resolve to their default.
 */
@API(API.Status.EXPERIMENTAL)
public final class SummaryLayerPropertyStorage {
    @Nonnull
    private static final SummaryLayerPropertyStorage EMPTY = new SummaryLayerPropertyStorage(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<SummaryLayerPropertyKey<?>, Object> propertyMap;

    private SummaryLayerPropertyStorage(@Nonnull ImmutableMap<SummaryLayerPropertyKey<?>, Object> propertyMap) {
        this.propertyMap = propertyMap;
    }

    /**
     * Get a storage in which every property has its default value.
     * @return the empty storage
     */
    @Nonnull
    public static SummaryLayerPropertyStorage getEmptyInstance() {
        return EMPTY;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder(new HashMap<>());
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(new HashMap<>(propertyMap));
    }

    @Nonnull
    public <T> T getPropertyValue(@Nonnull SummaryLayerPropertyKey<T> key) {
        final Object value = propertyMap.get(key);
        return value == null ? key.getDefaultValue() : key.getType().cast(value);
    }

    public boolean isSet(@Nonnull SummaryLayerPropertyKey<?> key) {
        return propertyMap.containsKey(key);
    }

    @Override
    public String toString() {
        return propertyMap.toString();
    }

    /**
     * Builder for {@link SummaryLayerPropertyStorage}.
     */
    public static final class Builder {
        @Nonnull
        private final Map<SummaryLayerPropertyKey<?>, Object> propertyMap;

        private Builder(@Nonnull Map<SummaryLayerPropertyKey<?>, Object> propertyMap) {
            this.propertyMap = propertyMap;
        }

        @Nonnull
        public <T> Builder addProp(@Nonnull SummaryLayerPropertyKey<T> key, @Nonnull T value) {
            if (propertyMap.containsKey(key)) {
                throw new SummaryCoreException("Duplicate property name is added")
                        .addLogInfo(LogMessageKeys.VALUE, key.getName());
            }
            propertyMap.put(key, value);
            return this;
        }

        @Nonnull
        public <T> Builder setProp(@Nonnull SummaryLayerPropertyKey<T> key, @Nonnull T value) {
            propertyMap.put(key, value);
            return this;
        }

        @Nonnull
        public SummaryLayerPropertyStorage build() {
            return new SummaryLayerPropertyStorage(ImmutableMap.copyOf(propertyMap));
        }
    }
}
