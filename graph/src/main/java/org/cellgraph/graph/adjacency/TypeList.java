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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.cellgraph.ErrorKind;
import org.cellgraph.Outcome;
import org.cellgraph.cell.Cell;
import org.cellgraph.cell.CellHeader;
import org.cellgraph.cell.CellId;
import org.cellgraph.graph.Direction;
import org.cellgraph.store.CellTransaction;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.cellgraph.graph.GraphSchemas.TYPE_LIST_LISTS_FIELD;
import static org.cellgraph.graph.GraphSchemas.TYPE_LIST_SCHEMA_ID;
import static org.cellgraph.graph.GraphSchemas.TYPE_LIST_TYPES_FIELD;

/**
 * List of lists of one vertex in one direction: maps edge schema ids to heads of their Id Lists. Its id is the
 * adjacency handle the vertex keeps for the direction.
 */
public final class TypeList {

    @NotNull
    private final CellId id;
    @NotNull
    private final IntArrayList schemaIds;
    @NotNull
    private final List<CellId> heads;
    private final boolean isStored;

    private TypeList(@NotNull final CellId id,
                     @NotNull final IntArrayList schemaIds,
                     @NotNull final List<CellId> heads,
                     final boolean isStored) {
        this.id = id;
        this.schemaIds = schemaIds;
        this.heads = heads;
        this.isStored = isStored;
    }

    @NotNull
    public static CellId idFor(@NotNull final CellId owner, @NotNull final Direction direction) {
        return CellId.hash(owner, direction.ordinal());
    }

    /**
     * Reads the type list, if it doesn't exist returns an empty unsaved one.
     */
    @NotNull
    public static Outcome<TypeList> load(@NotNull final CellTransaction txn,
                                         @NotNull final CellId owner,
                                         @NotNull final Direction direction) {
        final CellId id = idFor(owner, direction);
        final Outcome<Cell> read = txn.read(id);
        if (!read.isOk()) {
            return read.cast();
        }
        final Cell cell = read.get();
        if (cell == null) {
            return Outcome.ok(new TypeList(id, new IntArrayList(), new ArrayList<>(), false));
        }
        if (cell.getSchemaId() != TYPE_LIST_SCHEMA_ID) {
            return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Cell " + id + " is not a type list");
        }
        final Object types = cell.get(TYPE_LIST_TYPES_FIELD);
        final Object lists = cell.get(TYPE_LIST_LISTS_FIELD);
        if (!(types instanceof List) || !(lists instanceof List) || ((List<?>) types).size() != ((List<?>) lists).size()) {
            return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Type list " + id + " is malformed");
        }
        final IntArrayList schemaIds = new IntArrayList();
        final List<CellId> heads = new ArrayList<>();
        for (final Object type : (List<?>) types) {
            if (!(type instanceof Integer)) {
                return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Type list " + id + " has non-int schema id " + type);
            }
            schemaIds.add(((Integer) type).intValue());
        }
        for (final Object head : (List<?>) lists) {
            if (!(head instanceof CellId)) {
                return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Type list " + id + " has non-id head " + head);
            }
            heads.add((CellId) head);
        }
        return Outcome.ok(new TypeList(id, schemaIds, heads, true));
    }

    @NotNull
    public CellId getId() {
        return id;
    }

    public boolean isStored() {
        return isStored;
    }

    public boolean isEmpty() {
        return schemaIds.isEmpty();
    }

    @NotNull
    public IntList getSchemaIds() {
        return IntLists.unmodifiable(schemaIds);
    }

    @Nullable
    public CellId getHead(final int schemaId) {
        final int index = schemaIds.indexOf(schemaId);
        return index < 0 ? null : heads.get(index);
    }

    /**
     * Registers the head of an Id List and saves the type list.
     */
    @NotNull
    public Outcome<Void> add(@NotNull final CellTransaction txn, final int schemaId, @NotNull final CellId head) {
        final int index = schemaIds.indexOf(schemaId);
        if (index >= 0) {
            if (heads.get(index).equals(head)) {
                return Outcome.done();
            }
            return Outcome.fatal(ErrorKind.LIST_CORRUPTED,
                    "Type list " + id + " refers to " + heads.get(index) + " for schema " + schemaId + ", not to " + head);
        }
        schemaIds.add(schemaId);
        heads.add(head);
        return isStored ? txn.update(toCell()) : txn.write(toCell());
    }

    /**
     * Unregisters the Id List of the schema and saves the type list, an emptied type list is deleted.
     */
    @NotNull
    public Outcome<Void> remove(@NotNull final CellTransaction txn, final int schemaId) {
        final int index = schemaIds.indexOf(schemaId);
        if (index < 0) {
            return Outcome.done();
        }
        schemaIds.removeInt(index);
        heads.remove(index);
        if (!isStored) {
            return Outcome.done();
        }
        return schemaIds.isEmpty() ? txn.remove(id) : txn.update(toCell());
    }

    @NotNull
    private Cell toCell() {
        final List<Integer> types = new ArrayList<>(schemaIds.size());
        for (int i = 0; i < schemaIds.size(); ++i) {
            types.add(schemaIds.getInt(i));
        }
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put(TYPE_LIST_TYPES_FIELD, types);
        data.put(TYPE_LIST_LISTS_FIELD, heads);
        return new Cell(new CellHeader(TYPE_LIST_SCHEMA_ID, id), data);
    }

    @Override
    public String toString() {
        return "TypeList{" + id + ", schemas=" + schemaIds + '}';
    }
}
