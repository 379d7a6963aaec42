/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cellgraph.graph.adjacency;

import org.cellgraph.ErrorKind;
import org.cellgraph.Outcome;
import org.cellgraph.cell.CellId;
import org.cellgraph.store.CellTransaction;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Chaining policy of Id List segments and operations over a chain starting at given head segment. All segments
 * of one call are read in the same transaction.
 */
public class SegmentChain {

    private static final Logger logger = LoggerFactory.getLogger(SegmentChain.class);

    private final int capacity;
    private final boolean reclaimEmptySegments;

    public SegmentChain(final int capacity, final boolean reclaimEmptySegments) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Segment capacity should be positive: " + capacity);
        }
        this.capacity = capacity;
        this.reclaimEmptySegments = reclaimEmptySegments;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isReclaimEmptySegments() {
        return reclaimEmptySegments;
    }

    /**
     * @return segments of the chain from head to tail, empty list if there is no head segment
     */
    @NotNull
    public Outcome<List<Segment>> segments(@NotNull final CellTransaction txn, @NotNull final CellId headId) {
        final List<Segment> result = new ArrayList<>();
        final Set<CellId> visited = new HashSet<>();
        CellId id = headId;
        while (!id.isUnit()) {
            if (!visited.add(id)) {
                return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Segment chain " + headId + " has a cycle at " + id);
            }
            final Outcome<Segment> read = Segment.read(txn, id);
            if (!read.isOk()) {
                return read.cast();
            }
            final Segment segment = read.get();
            if (segment == null) {
                if (id.equals(headId)) {
                    return Outcome.ok(Collections.emptyList());
                }
                return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Segment " + id + " of chain " + headId + " is missing");
            }
            result.add(segment);
            id = segment.getNext();
        }
        return Outcome.ok(result);
    }

    @NotNull
    public Outcome<List<CellId>> members(@NotNull final CellTransaction txn, @NotNull final CellId headId) {
        return segments(txn, headId).map(segments -> {
            final List<CellId> result = new ArrayList<>();
            for (final Segment segment : segments) {
                result.addAll(segment.getMembers());
            }
            return result;
        });
    }

    /**
     * Appends the member to the tail segment, creates the head segment if it doesn't exist and chains new segment
     * if the tail is full.
     *
     * @return {@code true} if the head segment was created
     */
    @NotNull
    public Outcome<Boolean> append(@NotNull final CellTransaction txn, @NotNull final CellId headId, @NotNull final CellId member) {
        final Outcome<List<Segment>> read = segments(txn, headId);
        if (!read.isOk()) {
            return read.cast();
        }
        final List<Segment> segments = read.get();
        if (segments.isEmpty()) {
            return txn.write(new Segment(headId, Collections.singletonList(member), CellId.UNIT).toCell()).map(v -> true);
        }
        final Segment tail = segments.get(segments.size() - 1);
        if (tail.size() < capacity) {
            final List<CellId> members = new ArrayList<>(tail.getMembers());
            members.add(member);
            return txn.update(tail.withMembers(members).toCell()).map(v -> false);
        }
        final Segment allocated = new Segment(CellId.random(), Collections.singletonList(member), CellId.UNIT);
        final Outcome<Void> written = txn.write(allocated.toCell());
        if (!written.isOk()) {
            return written.cast();
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Allocated segment " + allocated.getId() + " after " + tail.getId() + " in chain " + headId);
        }
        return txn.update(tail.withNext(allocated.getId()).toCell()).map(v -> false);
    }

    /**
     * Removes the first occurrence of the member. Other members keep their order.
     */
    @NotNull
    public Outcome<Void> remove(@NotNull final CellTransaction txn, @NotNull final CellId headId, @NotNull final CellId member) {
        final Outcome<List<Segment>> read = segments(txn, headId);
        if (!read.isOk()) {
            return read.cast();
        }
        final List<Segment> segments = read.get();
        for (int i = 0; i < segments.size(); ++i) {
            final Segment segment = segments.get(i);
            final int index = segment.getMembers().indexOf(member);
            if (index < 0) {
                continue;
            }
            final List<CellId> members = new ArrayList<>(segment.getMembers());
            members.remove(index);
            if (members.isEmpty() && i > 0 && reclaimEmptySegments) {
                final Segment previous = segments.get(i - 1);
                final Outcome<Void> relinked = txn.update(previous.withNext(segment.getNext()).toCell());
                if (!relinked.isOk()) {
                    return relinked;
                }
                if (logger.isDebugEnabled()) {
                    logger.debug("Reclaimed empty segment " + segment.getId() + " of chain " + headId);
                }
                return txn.remove(segment.getId());
            }
            return txn.update(segment.withMembers(members).toCell());
        }
        return Outcome.fatal(ErrorKind.LIST_MEMBER_NOT_FOUND, "Member " + member + " is not found in list " + headId);
    }

    /**
     * Deletes all segments of the chain.
     */
    @NotNull
    public Outcome<Void> delete(@NotNull final CellTransaction txn, @NotNull final CellId headId) {
        final Outcome<List<Segment>> read = segments(txn, headId);
        if (!read.isOk()) {
            return read.cast();
        }
        for (final Segment segment : read.get()) {
            final Outcome<Void> removed = txn.remove(segment.getId());
            if (!removed.isOk()) {
                return removed;
            }
        }
        return Outcome.done();
    }
}
