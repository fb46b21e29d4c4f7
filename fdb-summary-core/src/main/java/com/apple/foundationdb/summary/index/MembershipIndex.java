/*
 * MembershipIndex.java
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

package com.apple.foundationdb.summary.index;

import com.apple.foundationdb.summary.annotation.API;
import com.apple.foundationdb.summary.logging.LogMessageKeys;
import com.apple.foundationdb.summary.metadata.GroupingImage;
import com.apple.foundationdb.summary.metadata.KeyTuple;
import com.apple.foundationdb.summary.summary.StaleTupleReferenceException;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * A {@link LookupIndex} that keeps one posting list per grouping column, mapping each atom to the source rows whose
 * column equals it (scalar) or contains it (multi-valued). The rows matching a key tuple are the intersection of
 * the posting sets of its components.
 *
 * <p>
 * A row whose multi-valued columns hold {@code m} and {@code n} labels costs {@code m + n} postings here rather
 * than the {@code m * n} an {@link EqualityIndex} would need.
 * </p>
 */
@API(API.Status.UNSTABLE)
@NotThreadSafe
public class MembershipIndex implements LookupIndex {
    @Nonnull
    private final List<Map<Object, NavigableSet<Long>>> postingLists;
    private long postingCount;

    public MembershipIndex(int columnCount) {
        postingLists = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            postingLists.add(new HashMap<>());
        }
    }

    @Nonnull
    @Override
    public IndexKind getKind() {
        return IndexKind.MEMBERSHIP;
    }

    public int getColumnCount() {
        return postingLists.size();
    }

    /**
     * Add a row to the posting list of one atom of one grouping column.
     * @param rowId the source row
     * @param columnIndex position of the column within the grouping
     * @param atom the atom
     * @return {@code true} if the row was not already there
     */
    public boolean add(long rowId, int columnIndex, @Nullable Object atom) {
        final boolean added = postingLists.get(columnIndex).computeIfAbsent(atom, k -> new TreeSet<>()).add(rowId);
        if (added) {
            postingCount++;
        }
        return added;
    }

    /**
     * Remove a row from the posting list of one atom of one grouping column.
     * @param rowId the source row
     * @param columnIndex position of the column within the grouping
     * @param atom the atom
     * @return {@code true} if the row was there
     */
    public boolean remove(long rowId, int columnIndex, @Nullable Object atom) {
        final Map<Object, NavigableSet<Long>> postingList = postingLists.get(columnIndex);
        final NavigableSet<Long> rows = postingList.get(atom);
        if (rows == null || !rows.remove(rowId)) {
            return false;
        }
        if (rows.isEmpty()) {
            postingList.remove(atom);
        }
        postingCount--;
        return true;
    }

    /**
     * Get the rows whose column holds an atom.
     * @param columnIndex position of the column within the grouping
     * @param atom the atom
     * @return the ids of the rows, ascending
     */
    @Nonnull
    public ImmutableSortedSet<Long> rowsContaining(int columnIndex, @Nullable Object atom) {
        final NavigableSet<Long> rows = postingLists.get(columnIndex).get(atom);
        return rows == null ? ImmutableSortedSet.of() : ImmutableSortedSet.copyOfSorted(rows);
    }

    @Override
    public void update(@Nullable GroupingImage oldImage, @Nullable GroupingImage newImage) {
        for (int i = 0; i < postingLists.size(); i++) {
            final List<Object> oldAtoms = oldImage == null ? Collections.emptyList() : oldImage.getColumnAtoms(i);
            final List<Object> newAtoms = newImage == null ? Collections.emptyList() : newImage.getColumnAtoms(i);
            final Set<Object> kept = new HashSet<>(oldAtoms);
            kept.retainAll(newAtoms);
            if (oldImage != null) {
                for (Object atom : oldAtoms) {
                    if (!kept.contains(atom)) {
                        remove(oldImage.getRowId(), i, atom);
                    }
                }
            }
            if (newImage != null) {
                for (Object atom : newAtoms) {
                    if (!kept.contains(atom)) {
                        add(newImage.getRowId(), i, atom);
                    }
                }
            }
        }
    }

    @Nonnull
    @Override
    public ImmutableSortedSet<Long> matches(@Nonnull KeyTuple key) {
        if (key.size() != postingLists.size()) {
            throw new StaleTupleReferenceException("key tuple does not fit grouping",
                    LogMessageKeys.KEY_TUPLE, key,
                    LogMessageKeys.EXPECTED, postingLists.size());
        }
        final List<NavigableSet<Long>> sets = new ArrayList<>(postingLists.size());
        for (int i = 0; i < postingLists.size(); i++) {
            final NavigableSet<Long> rows = postingLists.get(i).get(key.get(i));
            if (rows == null) {
                return ImmutableSortedSet.of();
            }
            sets.add(rows);
        }
        sets.sort(Comparator.comparingInt(Set::size));
        final NavigableSet<Long> smallest = sets.get(0);
        if (sets.size() == 1) {
            return ImmutableSortedSet.copyOfSorted(smallest);
        }
        final ImmutableSortedSet.Builder<Long> result = ImmutableSortedSet.naturalOrder();
        for (Long rowId : smallest) {
            boolean inAll = true;
            for (int i = 1; i < sets.size() && inAll; i++) {
                inAll = sets.get(i).contains(rowId);
            }
            if (inAll) {
                result.add(rowId);
            }
        }
        return result.build();
    }

    @Override
    public long getPostingCount() {
        return postingCount;
    }

    @Override
    public void clear() {
        for (Map<Object, NavigableSet<Long>> postingList : postingLists) {
            postingList.clear();
        }
        postingCount = 0;
    }

    @Override
    public String toString() {
        return "MembershipIndex{columns=" + postingLists.size() + ", postings=" + postingCount + "}";
    }
}
