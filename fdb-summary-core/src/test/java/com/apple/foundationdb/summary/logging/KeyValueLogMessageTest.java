/*
 * KeyValueLogMessageTest.java
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

package com.apple.foundationdb.summary.logging;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link KeyValueLogMessage}.
 */
public class KeyValueLogMessageTest {
    @Test
    public void keysAreSorted() {
        assertEquals("reconciled created_count=\"2\" summary_table=\"Summary\" ttl=\"x\"",
                KeyValueLogMessage.of("reconciled",
                        LogMessageKeys.TITLE, "x",
                        LogMessageKeys.SUMMARY_TABLE, "Summary",
                        LogMessageKeys.CREATED_COUNT, 2));
    }

    @Test
    public void quotesAndEqualsAreEscaped() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("renamed")
                .addKeyAndValue("a=b", "say \"hi\"")
                .addKeyAndValue(LogMessageKeys.VALUE, null);
        assertEquals(ImmutableMap.of("ab", "say 'hi'", "value", "null"), message.getKeyValueMap());
        assertEquals("renamed", message.getStaticMessage());
    }

    @Test
    public void addKeysAndValues() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("moved", LogMessageKeys.ROW_ID, 3L)
                .addKeysAndValues(ImmutableMap.of(LogMessageKeys.OLD, "red", LogMessageKeys.NEW, "blue"));
        assertEquals("moved new=\"blue\" old=\"red\" row_id=\"3\"", message.toString());
    }

    @Test
    public void mismatchedKeysAndValues() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("odd", LogMessageKeys.VALUE));
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.build("null key").addKeyAndValue(null, 1));
    }
}
