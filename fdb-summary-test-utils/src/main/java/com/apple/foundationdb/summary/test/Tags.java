/*
 * Tags.java
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

package com.apple.foundationdb.summary.test;

/**
 * Annotation {@link org.junit.jupiter.api.Tag}s for Summary Layer tests.
 */
@SuppressWarnings("PMD.FieldNamingConventions")
public final class Tags {
    /**
     * Tests that drive long randomized mutation sequences and compare against a full recomputation.
     */
    public static final String Randomized = "Randomized";
    /**
     * Tests that are for performance investigations, and not for correctness validation.
     */
    public static final String Performance = "Performance";

    private Tags() {
    }
}
