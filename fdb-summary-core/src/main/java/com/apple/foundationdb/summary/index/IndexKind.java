/*
 * IndexKind.java
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

package com.apple.foundationdb.summary.index;

import com.apple.foundationdb.summary.annotation.API;

/**
 * The two lookup index variants.
 */
@API(API.Status.STABLE)
public enum IndexKind {
    /**
     * Postings keyed by the full key tuple. Used when every grouping column is scalar.
     */
    EQUALITY,
    /**
     * Postings keyed by (grouping column, atom), intersected at lookup. Used when any grouping column is
     * multi-valued.
     */
    MEMBERSHIP
}
