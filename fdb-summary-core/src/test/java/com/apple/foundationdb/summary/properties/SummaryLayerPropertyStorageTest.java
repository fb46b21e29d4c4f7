/*
 * SummaryLayerPropertyStorageTest.java
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

package com.apple.foundationdb.summary.properties;

import com.apple.foundationdb.summary.SummaryCoreException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SummaryLayerPropertyStorage}.
 */
public class SummaryLayerPropertyStorageTest {
    @Test
    public void defaults() {
        final SummaryLayerPropertyStorage storage = SummaryLayerPropertyStorage.getEmptyInstance();
        assertFalse(storage.getPropertyValue(SummaryLayerProperties.VERIFY_AFTER_RECONCILE));
        assertEquals(100_000, storage.getPropertyValue(SummaryLayerProperties.MAX_KEY_FAN_OUT));
        assertEquals(1000, storage.getPropertyValue(SummaryLayerProperties.LARGE_RECONCILE_THRESHOLD));
        assertFalse(storage.isSet(SummaryLayerProperties.MAX_KEY_FAN_OUT));
    }

    @Test
    public void addPropRejectsDuplicates() {
        final SummaryLayerPropertyStorage.Builder builder = SummaryLayerPropertyStorage.newBuilder()
                .addProp(SummaryLayerProperties.MAX_KEY_FAN_OUT, 10);
        final SummaryCoreException err = assertThrows(SummaryCoreException.class,
                () -> builder.addProp(SummaryLayerProperties.MAX_KEY_FAN_OUT, 20));
        assertEquals(SummaryLayerProperties.MAX_KEY_FAN_OUT.getName(), err.getLogInfo().get("value"));
    }

    @Test
    public void setPropOverrides() {
        final SummaryLayerPropertyStorage storage = SummaryLayerPropertyStorage.newBuilder()
                .addProp(SummaryLayerProperties.MAX_KEY_FAN_OUT, 10)
                .setProp(SummaryLayerProperties.MAX_KEY_FAN_OUT, 20)
                .build();
        assertEquals(20, storage.getPropertyValue(SummaryLayerProperties.MAX_KEY_FAN_OUT));
        assertTrue(storage.isSet(SummaryLayerProperties.MAX_KEY_FAN_OUT));
    }

    @Test
    public void toBuilderKeepsValues() {
        final SummaryLayerPropertyStorage original = SummaryLayerPropertyStorage.newBuilder()
                .addProp(SummaryLayerProperties.VERIFY_AFTER_RECONCILE, true)
                .build();
        final SummaryLayerPropertyStorage extended = original.toBuilder()
                .addProp(SummaryLayerProperties.LARGE_RECONCILE_THRESHOLD, 5)
                .build();
        assertTrue(extended.getPropertyValue(SummaryLayerProperties.VERIFY_AFTER_RECONCILE));
        assertEquals(5, extended.getPropertyValue(SummaryLayerProperties.LARGE_RECONCILE_THRESHOLD));
        assertEquals(1000, original.getPropertyValue(SummaryLayerProperties.LARGE_RECONCILE_THRESHOLD));
    }
}
