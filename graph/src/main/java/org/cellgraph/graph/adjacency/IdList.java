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

import org.cellgraph.Outcome;
import org.cellgraph.cell.CellId;
import org.cellgraph.graph.Direction;
import org.cellgraph.store.CellTransaction;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Adjacency list of one vertex for one direction and one edge schema, bound to a transaction. Members are stored in
 * a {@linkplain SegmentChain chain} of segments whose head id is derived from the key, the head is registered in the
 * vertex's {@linkplain TypeList type list} when created.
 * <p>Methods return {@code RETRY} if the transaction should be re-executed, {@code LIST_CORRUPTED} if the chain is
 * inconsistent.
 */
public final class IdList {

    @NotNull
    private final CellTransaction txn;
    @NotNull
    private final SegmentChain chain;
    @NotNull
    private final CellId owner;
    @NotNull
    private final Direction direction;
    private final int schemaId;
    @NotNull
    private final CellId headId;

    private IdList(@NotNull final CellTransaction txn,
                   @NotNull final SegmentChain chain,
                   @NotNull final CellId owner,
                   @NotNull final Direction direction,
                   final int schemaId) {
        this.txn = txn;
        this.chain = chain;
        this.owner = owner;
        this.direction = direction;
        this.schemaId = schemaId;
        headId = headIdFor(owner, direction, schemaId);
    }

    @NotNull
    public static IdList open(@NotNull final CellTransaction txn,
                              @NotNull final SegmentChain chain,
                              @NotNull final CellId owner,
                              @NotNull final Direction direction,
                              final int schemaId) {
        return new IdList(txn, chain, owner, direction, schemaId);
    }

    @NotNull
    public static CellId headIdFor(@NotNull final CellId owner, @NotNull final Direction direction, final int schemaId) {
        return CellId.hash(owner, direction.ordinal(), schemaId);
    }

    @NotNull
    public CellId getOwner() {
        return owner;
    }

    @NotNull
    public Direction getDirection() {
        return direction;
    }

    public int getSchemaId() {
        return schemaId;
    }

    @NotNull
    public CellId getHeadId() {
        return headId;
    }

    /**
     * @return all members in order, empty list if nothing was ever appended
     */
    @NotNull
    public Outcome<List<CellId>> all() {
        return chain.members(txn, headId);
    }

    @NotNull
    public Outcome<Integer> size() {
        return chain.segments(txn, headId).map(segments -> {
            int result = 0;
            for (final Segment segment : segments) {
                result += segment.size();
            }
            return result;
        });
    }

    @NotNull
    public Outcome<Void> append(@NotNull final CellId member) {
        final Outcome<Boolean> appended = chain.append(txn, headId, member);
        if (!appended.isOk()) {
            return appended.cast();
        }
        if (!appended.get()) {
            return Outcome.done();
        }
        return TypeList.load(txn, owner, direction).then(types -> types.add(txn, schemaId, headId));
    }

    /**
     * Removes the first occurrence of the member, fails with {@code LIST_MEMBER_NOT_FOUND} if it is absent.
     */
    @NotNull
    public Outcome<Void> remove(@NotNull final CellId member) {
        return chain.remove(txn, headId, member);
    }

    /**
     * Deletes all segments and unregisters the list from the type list.
     */
    @NotNull
    public Outcome<Void> delete() {
        final Outcome<Void> deleted = chain.delete(txn, headId);
        if (!deleted.isOk()) {
            return deleted;
        }
        return TypeList.load(txn, owner, direction).then(types -> types.remove(txn, schemaId));
    }
}
