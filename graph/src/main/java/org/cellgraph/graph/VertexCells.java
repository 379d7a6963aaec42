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
package org.cellgraph.graph;

import org.cellgraph.ErrorKind;
import org.cellgraph.Outcome;
import org.cellgraph.cell.Cell;
import org.cellgraph.cell.CellHeader;
import org.cellgraph.schema.Schema;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Packs vertices to cells and back. Adjacency handles are stored as hidden fields of the cell next to user data,
 * no other code reads or writes them.
 */
final class VertexCells {

    private VertexCells() {
    }

    @NotNull
    static Cell toCell(@NotNull final Vertex vertex) {
        return new Cell(new CellHeader(vertex.getSchemaId(), vertex.getId()), pack(vertex.getData(), vertex.getAdjacency()));
    }

    @NotNull
    static Vertex fromCell(@NotNull final Cell cell) {
        final Map<String, Object> data = new LinkedHashMap<>(cell.getData());
        Adjacency adjacency = Adjacency.EMPTY;
        for (final Direction direction : Direction.values()) {
            data.remove(direction.getFieldName());
            adjacency = adjacency.with(direction, cell.getCellId(direction.getFieldName()));
        }
        return new Vertex(cell.getId(), cell.getSchemaId(), data, adjacency);
    }

    /**
     * Checks user data of a vertex against its schema.
     */
    @NotNull
    static Outcome<Void> checkData(@NotNull final Schema schema, @NotNull final Map<String, ?> data) {
        for (final String field : data.keySet()) {
            if (GraphSchemas.isReserved(field)) {
                return Outcome.fatal(ErrorKind.RESERVED_FIELD, "Field " + field + " is reserved");
            }
        }
        final String mismatch = schema.checkData(pack(data, Adjacency.EMPTY));
        return mismatch == null ? Outcome.done() : Outcome.fatal(ErrorKind.DATA_NOT_MATCH_SCHEMA, mismatch);
    }

    @NotNull
    private static Map<String, Object> pack(@NotNull final Map<String, ?> data, @NotNull final Adjacency adjacency) {
        final Map<String, Object> result = new LinkedHashMap<>(data);
        for (final Direction direction : Direction.values()) {
            result.put(direction.getFieldName(), adjacency.get(direction));
        }
        return result;
    }
}
