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
 * Summary tables and their maintenance.
 *
 * <p>
 * A {@link com.apple.foundationdb.summary.summary.SummaryTable} holds one row per key tuple ever observed in its
 * source table. The {@link com.apple.foundationdb.summary.summary.SummaryTableMaintainer} creates rows for new key
 * tuples and recomputes matched sets of existing ones from the lookup index.
 * </p>
 */
package com.apple.foundationdb.summary.summary;
