/*
 * SourceChangeAdapter.java
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

package com.apple.foundationdb.summary.source;

import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.index.LookupIndex;
import com.apple.foundationdb.summary.logging.KeyValueLogMessage;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.metadata.GroupingImage;
import com.apple.foundationdb.summary.metadata.GroupingKey;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.properties.SummaryLayerProperties;
import com.apple.foundationdb.summary.properties.SummaryLayerPropertyStorage;
import com.apple.foundationdb.summary.summary.ReconcileResult;
import com.apple.foundationdb.summary.summary.SummaryRowJournal;
import com.apple.foundationdb.summary.summary.SummaryTable;
import com.apple.foundationdb.summary.summary.SummaryTableMaintainer;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns changes to source rows into lookup index updates for one summary table, then reconciles the key tuples the
 * change may have affected.
 *
 * <p>
 * Every change is handled as a move from an old row image to a new one: an insert has no old image, a delete has no
 * new image. Only the difference between the images reaches the index. The affected tuples are the old image's
 * tuples followed by the new image's, without repeats, which fixes the order in which new summary rows are created.
 * </p>
 */
@API(API.Status.INTERNAL)
public class SourceChangeAdapter {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceChangeAdapter.class);

    @Nonnull
    private final SummaryTable table;
    @Nonnull
    private final GroupingKey groupingKey;
    @Nonnull
    private final LookupIndex index;
    @Nonnull
    private final SummaryTableMaintainer maintainer;
    private final int maxFanOut;

    public SourceChangeAdapter(@Nonnull SummaryTable table, @Nonnull LookupIndex index,
                               @Nonnull SummaryLayerPropertyStorage properties) {
        this.table = table;
        this.groupingKey = table.getGroupingKey();
        this.index = index;
        this.maintainer = new SummaryTableMaintainer(table, index, properties);
        this.maxFanOut = properties.getPropertyValue(SummaryLayerProperties.MAX_KEY_FAN_OUT);
    }

    @Nonnull
    public SummaryTable getTable() {
        return table;
    }

    @Nonnull
    public LookupIndex getIndex() {
        return index;
    }

    /**
     * Apply a change to one source row.
     * @param oldRow the row before the change, or {@code null} for an insert
     * @param newRow the row after the change, or {@code null} for a delete
     * @param journal told about each summary row change
     * @return what the change did to the summary table
     */
    @Nonnull
    public ReconcileResult onChange(@Nullable SourceRow oldRow, @Nullable SourceRow newRow,
                                    @Nonnull SummaryRowJournal journal) {
        if (oldRow == null && newRow == null) {
            return ReconcileResult.EMPTY;
        }
        final GroupingImage oldImage = groupingKey.image(oldRow, maxFanOut);
        final GroupingImage newImage = groupingKey.image(newRow, maxFanOut);
        if (oldImage != null && newImage != null && oldImage.sameGroupingAs(newImage)) {
            return ReconcileResult.EMPTY;
        }
        index.update(oldImage, newImage);
        final Set<KeyTuple> affected = new LinkedHashSet<>();
        if (oldImage != null) {
            affected.addAll(oldImage.getTuples());
        }
        if (newImage != null) {
            affected.addAll(newImage.getTuples());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("applied source change to lookup index",
                    LogMessageKeys.SUMMARY_TABLE, table.getName(),
                    LogMessageKeys.ROW_ID, newRow != null ? newRow.getId() : oldRow.getId(),
                    LogMessageKeys.INDEX_KIND, index.getKind(),
                    LogMessageKeys.KEY_COUNT, affected.size(),
                    LogMessageKeys.POSTING_COUNT, index.getPostingCount()));
        }
        return maintainer.reconcile(ImmutableList.copyOf(affected), journal);
    }

    /**
     * Index every given row from scratch and reconcile. Tuples already in the summary table come first, in row id
     * order, followed by new tuples in source row order.
     * @param rows the source rows, in ascending id order
     * @param journal told about each summary row change
     * @return what populating did to the summary table
     */
    @Nonnull
    public ReconcileResult populate(@Nonnull Collection<SourceRow> rows, @Nonnull SummaryRowJournal journal) {
        final List<GroupingImage> images = new ArrayList<>(rows.size());
        for (SourceRow row : rows) {
            images.add(groupingKey.image(row, maxFanOut));
        }
        index.clear();
        final Set<KeyTuple> affected = new LinkedHashSet<>(table.getKeyTuples());
        for (GroupingImage image : images) {
            index.update(null, image);
            affected.addAll(image.getTuples());
        }
        return maintainer.reconcile(ImmutableList.copyOf(affected), journal);
    }
}
