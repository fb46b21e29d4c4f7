/*
 * SummaryCoreException.java
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

package com.apple.foundationdb.summary;

import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An exception thrown by the core of the Summary Layer.
 */
@API(API.Status.STABLE)
@SuppressWarnings("serial")
public class SummaryCoreException extends LoggableException {

    public SummaryCoreException(@Nonnull String msg, @Nullable Object ... keyValues) {
        super(msg, keyValues);
    }

    public SummaryCoreException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public SummaryCoreException(@Nonnull String msg) {
        super(msg);
    }

    @Nonnull
    @Override
    public SummaryCoreException addLogInfo(@Nonnull String description, @Nullable Object object) {
        super.addLogInfo(description, object);
        return this;
    }

    @Nonnull
    @Override
    public SummaryCoreException addLogInfo(@Nonnull Object ... keyValue) {
        super.addLogInfo(keyValue);
        return this;
    }
}
