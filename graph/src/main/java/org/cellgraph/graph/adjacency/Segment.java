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
import org.cellgraph.cell.Cell;
import org.cellgraph.cell.CellHeader;
import org.cellgraph.cell.CellId;
import org.cellgraph.store.CellTransaction;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.cellgraph.graph.GraphSchemas.ID_LIST_MEMBERS_FIELD;
import static org.cellgraph.graph.GraphSchemas.ID_LIST_NEXT_FIELD;
import static org.cellgraph.graph.GraphSchemas.ID_LIST_SCHEMA_ID;

/**
 * One cell of an Id List: ordered member ids and the id of the next segment, {@linkplain CellId#UNIT} for the tail.
 */
public final class Segment {

    @NotNull
    private final CellId id;
    @NotNull
    private final List<CellId> members;
    @NotNull
    private final CellId next;

    public Segment(@NotNull final CellId id, @NotNull final List<CellId> members, @NotNull final CellId next) {
        this.id = id;
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
        this.next = next;
    }

    @NotNull
    public CellId getId() {
        return id;
    }

    @NotNull
    public List<CellId> getMembers() {
        return members;
    }

    @NotNull
    public CellId getNext() {
        return next;
    }

    public boolean isTail() {
        return next.isUnit();
    }

    public int size() {
        return members.size();
    }

    @NotNull
    public Segment withMembers(@NotNull final List<CellId> members) {
        return new Segment(id, members, next);
    }

    @NotNull
    public Segment withNext(@NotNull final CellId next) {
        return new Segment(id, members, next);
    }

    @NotNull
    public Cell toCell() {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put(ID_LIST_MEMBERS_FIELD, members);
        data.put(ID_LIST_NEXT_FIELD, next);
        return new Cell(new CellHeader(ID_LIST_SCHEMA_ID, id), data);
    }

    /**
     * @return {@code OK(null)} if there is no such segment, {@code LIST_CORRUPTED} if the cell is not a segment
     */
    @NotNull
    static Outcome<Segment> read(@NotNull final CellTransaction txn, @NotNull final CellId id) {
        final Outcome<Cell> read = txn.read(id);
        if (!read.isOk()) {
            return read.cast();
        }
        final Cell cell = read.get();
        if (cell == null) {
            return Outcome.done();
        }
        if (cell.getSchemaId() != ID_LIST_SCHEMA_ID) {
            return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Cell " + id + " is not an id list segment");
        }
        final Object list = cell.get(ID_LIST_MEMBERS_FIELD);
        final Object next = cell.get(ID_LIST_NEXT_FIELD);
        if (!(list instanceof List) || !(next instanceof CellId)) {
            return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Segment " + id + " is malformed");
        }
        final List<CellId> members = new ArrayList<>();
        for (final Object member : (List<?>) list) {
            if (!(member instanceof CellId)) {
                return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Segment " + id + " has non-id member " + member);
            }
            members.add((CellId) member);
        }
        return Outcome.ok(new Segment(id, members, (CellId) next));
    }

    @Override
    public String toString() {
        return "Segment{" + id + ", size=" + members.size() + ", next=" + next + '}';
    }
}
