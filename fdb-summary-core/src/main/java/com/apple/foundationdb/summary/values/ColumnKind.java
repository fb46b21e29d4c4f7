/*
 * ColumnKind.java
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

/**
 * How many values a column holds per row.
 */
@API(API.Status.STABLE)
public enum ColumnKind {
    /**
     * Exactly one atom per row, possibly {@code null}.
     */
    SCALAR,
    /**
     * An ordered, de-duplicated set of labels per row, possibly empty. Grouping by such a column fans a row
     * out into one key component per label.
     */
    MULTI_VALUED
}
