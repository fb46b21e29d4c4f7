/*
 * SummaryLayerProperties.java
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

/**
 * Property keys for {@link com.apple.foundationdb.summary.source.SourceTable} and the summaries maintained on it.
 * None of these change what a summary contains; they control checking, limits and logging.
 */
@API(API.Status.EXPERIMENTAL)
public final class SummaryLayerProperties {
    /**
     * Whether every reconcile re-reads the lookup index for each touched summary row and checks it against
     * the row's matched set and count, and checks that the key index and rows agree. A disagreement is
     * raised as a {@link com.apple.foundationdb.summary.summary.StaleTupleReferenceException}.
     */
    public static final SummaryLayerPropertyKey<Boolean> VERIFY_AFTER_RECONCILE = SummaryLayerPropertyKey.booleanPropertyKey(
            "com.apple.foundationdb.summary.verify_after_reconcile", false);

    /**
     * The most key tuples a single source row may expand into. A row carrying two multi-valued columns with
     * a thousand labels each would otherwise add a million postings to an equality index and touch a million
     * summary rows on every update.
     */
    public static final SummaryLayerPropertyKey<Integer> MAX_KEY_FAN_OUT = SummaryLayerPropertyKey.integerPropertyKey(
            "com.apple.foundationdb.summary.max_key_fan_out", 100_000);

    /**
     * Reconciles touching at least this many key tuples are logged at {@code INFO}.
     */
    public static final SummaryLayerPropertyKey<Integer> LARGE_RECONCILE_THRESHOLD = SummaryLayerPropertyKey.integerPropertyKey(
            "com.apple.foundationdb.summary.large_reconcile_threshold", 1000);

    private SummaryLayerProperties() {
        throw new SummaryCoreException("should not instantiate class of static prop");
    }
}
