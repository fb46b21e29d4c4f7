/*
 * ReconcileResult.java
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

package com.apple.foundationdb.summary.summary;

import com.apple.foundationdb.summary.annotation.API;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What one reconcile did to a summary table: the rows it created and the existing rows whose matched set changed,
 * each in processing order.
 */
@API(API.Status.STABLE)
public final class ReconcileResult {
    @Nonnull
    public static final ReconcileResult EMPTY = new ReconcileResult(ImmutableList.of(), ImmutableList.of());

    @Nonnull
    private final ImmutableList<Long> createdRowIds;
    @Nonnull
    private final ImmutableList<Long> updatedRowIds;

    private ReconcileResult(@Nonnull ImmutableList<Long> createdRowIds, @Nonnull ImmutableList<Long> updatedRowIds) {
        this.createdRowIds = createdRowIds;
        this.updatedRowIds = updatedRowIds;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public List<Long> getCreatedRowIds() {
        return createdRowIds;
    }

    @Nonnull
    public List<Long> getUpdatedRowIds() {
        return updatedRowIds;
    }

    public boolean isEmpty() {
        return createdRowIds.isEmpty() && updatedRowIds.isEmpty();
    }

    @Override
    public String toString() {
        return "ReconcileResult{created=" + createdRowIds + ", updated=" + updatedRowIds + "}";
    }

    /**
     * Builder for {@link ReconcileResult}. Row ids are kept once each, in the order first added, and a row created
     * through this builder is never also reported as updated.
     */
    public static class Builder {
        private final Set<Long> created = new LinkedHashSet<>();
        private final Set<Long> updated = new LinkedHashSet<>();

        private Builder() {
        }

        @Nonnull
        public Builder addCreated(long rowId) {
            created.add(rowId);
            updated.remove(rowId);
            return this;
        }

        @Nonnull
        public Builder addUpdated(long rowId) {
            if (!created.contains(rowId)) {
                updated.add(rowId);
            }
            return this;
        }

        /**
         * Merge the result of a later reconcile of the same table.
         * @param other the later result
         * @return this builder
         */
        @Nonnull
        public Builder addAll(@Nonnull ReconcileResult other) {
            for (long rowId : other.createdRowIds) {
                addCreated(rowId);
            }
            for (long rowId : other.updatedRowIds) {
                addUpdated(rowId);
            }
            return this;
        }

        @Nonnull
        public ReconcileResult build() {
            if (created.isEmpty() && updated.isEmpty()) {
                return EMPTY;
            }
            return new ReconcileResult(ImmutableList.copyOf(created), ImmutableList.copyOf(updated));
        }
    }
}
