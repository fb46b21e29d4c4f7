/*
 * TypeMismatchException.java
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

import com.apple.foundationdb.summary.SummaryCoreException;
import com.apple.foundationdb.summary.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A value was offered with the wrong shape: a collection where a scalar atom belongs, a scalar where a label set
 * belongs, or an atom of an unsupported type. Values are never coerced.
 */
@API(API.Status.STABLE)
@SuppressWarnings("serial")
public class TypeMismatchException extends SummaryCoreException {
    public TypeMismatchException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }
}
