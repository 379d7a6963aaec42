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
import org.cellgraph.cell.CellId;
import org.cellgraph.schema.EdgeType;
import org.cellgraph.schema.Schema;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.cellgraph.graph.GraphSchemas.EDGE_VERTEX_A_FIELD;
import static org.cellgraph.graph.GraphSchemas.EDGE_VERTEX_B_FIELD;

/**
 * Packs body edges to body cells and back. The endpoints are hidden fields of the body cell.
 */
final class EdgeCells {

    private EdgeCells() {
    }

    @NotNull
    static Cell toCell(@NotNull final Edge edge) {
        final Map<String, Object> body = edge.getBody();
        if (body == null) {
            throw new IllegalArgumentException("Lightweight edge has no cell: " + edge);
        }
        return new Cell(new CellHeader(edge.getSchemaId(), edge.getBodyId()), pack(body, edge.vertexA, edge.vertexB));
    }

    @NotNull
    static Outcome<Edge> fromCell(@NotNull final Cell cell, @NotNull final EdgeType type) {
        final CellId a = cell.getCellId(EDGE_VERTEX_A_FIELD);
        final CellId b = cell.getCellId(EDGE_VERTEX_B_FIELD);
        if (a.isUnit() || b.isUnit()) {
            return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Edge body " + cell.getId() + " has no endpoints");
        }
        final Map<String, Object> body = new LinkedHashMap<>(cell.getData());
        body.remove(EDGE_VERTEX_A_FIELD);
        body.remove(EDGE_VERTEX_B_FIELD);
        return Outcome.ok(Edge.of(type, cell.getSchemaId(), a, b, cell.getId(), body));
    }

    @NotNull
    static Outcome<Void> checkBody(@NotNull final Schema schema, @NotNull final Map<String, ?> body) {
        for (final String field : body.keySet()) {
            if (GraphSchemas.isReserved(field)) {
                return Outcome.fatal(ErrorKind.RESERVED_FIELD, "Field " + field + " is reserved");
            }
        }
        final String mismatch = schema.checkData(pack(body, CellId.UNIT, CellId.UNIT));
        return mismatch == null ? Outcome.done() : Outcome.fatal(ErrorKind.DATA_NOT_MATCH_SCHEMA, mismatch);
    }

    @NotNull
    private static Map<String, Object> pack(@NotNull final Map<String, ?> body, @NotNull final CellId a, @NotNull final CellId b) {
        final Map<String, Object> result = new LinkedHashMap<>(body);
        result.put(EDGE_VERTEX_A_FIELD, a);
        result.put(EDGE_VERTEX_B_FIELD, b);
        return result;
    }
}
