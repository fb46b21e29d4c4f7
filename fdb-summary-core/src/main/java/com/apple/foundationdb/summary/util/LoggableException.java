/*
 * LoggableException.java
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

package com.apple.foundationdb.summary.util;

import com.apple.foundationdb.summary.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception type with support for adding keys and values to its log info. This can then
 * be logged in a way that better supports searching later.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    @Nonnull
    private final Map<String, Object> logInfo = new LinkedHashMap<>();

    /**
     * Create an exception with the given message and a sequence of key-value pairs.
     *
     * @param msg error message
     * @param keyValues flattened key-value pairs
     * @throws IllegalArgumentException if <code>keyValues</code> has odd length
     * @see #addLogInfo(Object...)
     */
    public LoggableException(@Nonnull String msg, @Nullable Object ... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    /**
     * Get the log information associated with this exception as a map.
     *
     * @return an unmodifiable view of all log information, in the order it was added
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Add a key/value pair to the log information.
     *
     * @param description description of the log info pair
     * @param object value of the log info pair
     * @return this <code>LoggableException</code>
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull String description, @Nullable Object object) {
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add a list of key/value pairs to the log information. Every even element is a key
     * and every odd element is the value of the key preceding it. Keys are converted
     * with {@link Object#toString()}, so {@link com.apple.foundationdb.summary.logging.LogMessageKeys}
     * can be passed directly.
     *
     * @param keyValue flattened map of key-value pairs
     * @return this <code>LoggableException</code>
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object ... keyValue) {
        if (keyValue.length % 2 != 0) {
            throw new IllegalArgumentException("Tried to add log info with odd number of keys and values");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            logInfo.put(keyValue[i].toString(), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Export the log information to a flattened array, in the format accepted by {@link #addLogInfo(Object...)}.
     *
     * @return a flattened map of key-value pairs
     */
    @Nonnull
    public Object[] exportLogInfo() {
        final Object[] flattened = new Object[logInfo.size() * 2];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            flattened[i++] = entry.getKey();
            flattened[i++] = entry.getValue();
        }
        return flattened;
    }
}
