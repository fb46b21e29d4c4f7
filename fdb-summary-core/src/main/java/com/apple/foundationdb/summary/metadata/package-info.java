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
 * Schema and grouping structures.
 *
 * <p>
 * A {@link com.apple.foundationdb.summary.metadata.SourceSchema} declares the columns of a source table.
 * A {@link com.apple.foundationdb.summary.metadata.GroupingKey} picks an ordered subset of them and evaluates a
 * {@link com.apple.foundationdb.summary.metadata.expressions.KeyExpression} to turn each source row into the
 * {@link com.apple.foundationdb.summary.metadata.KeyTuple}s it belongs to.
 * </p>
 */
package com.apple.foundationdb.summary.metadata;
