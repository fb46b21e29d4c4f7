/*
 * InvalidGroupingSpecException.java
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

import com.apple.foundationdb.summary.SummaryCoreException;
import com.apple.foundationdb.summary.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A grouping specification does not fit the source schema: a column is missing or repeated, no column was given,
 * or a column was declared with a role that disagrees with its kind in the source schema.
 * No summary table is created.
 */
@API(API.Status.STABLE)
@SuppressWarnings("serial")
public class InvalidGroupingSpecException extends SummaryCoreException {
    public InvalidGroupingSpecException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }
}
