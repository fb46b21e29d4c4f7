/*
 * SummaryRowJournal.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Told about every summary row change before it happens, so that the change can be undone.
 */
@API(API.Status.INTERNAL)
@FunctionalInterface
public interface SummaryRowJournal {
    /**
     * A journal that records nothing.
     */
    SummaryRowJournal NONE = (table, rowId, previous) -> { };

    /**
     * Called before a summary row is created or replaced.
     * @param table the summary table
     * @param rowId the id of the row about to change; for a new row, the id it is about to be given
     * @param previous the row as it is now, or {@code null} if it is about to be created
     */
    void beforeRowChange(@Nonnull SummaryTable table, long rowId, @Nullable SummaryRow previous);
}
