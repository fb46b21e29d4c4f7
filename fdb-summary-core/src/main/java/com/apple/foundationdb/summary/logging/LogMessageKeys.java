/*
 * LogMessageKeys.java
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

package com.apple.foundationdb.summary.logging;

import com.apple.foundationdb.summary.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the Summary Layer core.
 * All of the keys are kept here, so that it's easy to check for collisions and keep them consistent.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    TITLE("ttl"),
    OLD,
    NEW,
    VALUE,
    EXPECTED,
    ACTUAL,
    EXPECTED_TYPE,
    ACTUAL_TYPE,
    // tables and columns
    SOURCE_TABLE,
    SUMMARY_TABLE,
    COLUMN_NAME,
    COLUMN_KIND,
    GROUPING_COLUMNS,
    // rows and keys
    ROW_ID,
    SUMMARY_ROW_ID,
    KEY_TUPLE,
    KEY_COUNT,
    FAN_OUT,
    FAN_OUT_LIMIT,
    // indexes
    INDEX_KIND,
    POSTING_COUNT,
    // reconcile and transactions
    CREATED_COUNT,
    UPDATED_COUNT,
    MUTATION,
    MUTATION_COUNT,
    RENAMES,
    ROWS_AFFECTED;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
