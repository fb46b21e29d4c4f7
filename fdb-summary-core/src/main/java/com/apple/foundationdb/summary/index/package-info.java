/*
 * package-info.java
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

/**
 * Lookup indexes from key tuples to matching source rows.
 *
 * <p>
 * An {@link com.apple.foundationdb.summary.index.EqualityIndex} stores postings per full key tuple and serves
 * groupings whose columns are all scalar. A {@link com.apple.foundationdb.summary.index.MembershipIndex} stores
 * postings per (column, atom) pair and answers tuple lookups by intersection, which keeps the index linear in the
 * number of labels when multi-valued columns fan rows out.
 * </p>
 */
package com.apple.foundationdb.summary.index;
