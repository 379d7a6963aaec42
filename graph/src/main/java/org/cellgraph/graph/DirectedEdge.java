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

import org.cellgraph.Outcome;
import org.cellgraph.cell.CellId;
import org.cellgraph.schema.EdgeType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Edge from start vertex to end vertex, listed in the outbound list of the start and the inbound list of the end.
 */
public final class DirectedEdge extends Edge {

    DirectedEdge(final int schemaId,
                 @NotNull final CellId start,
                 @NotNull final CellId end,
                 @NotNull final CellId bodyId,
                 @Nullable final Map<String, ?> body) {
        super(schemaId, start, end, bodyId, body);
    }

    @NotNull
    @Override
    public EdgeType getEdgeType() {
        return EdgeType.DIRECTED;
    }

    @NotNull
    public CellId getStart() {
        return vertexA;
    }

    @NotNull
    public CellId getEnd() {
        return vertexB;
    }

    @NotNull
    @Override
    Outcome<Void> register(@NotNull final GraphTransaction txn) {
        final Outcome<Void> outbound = txn.addToList(vertexA, Direction.OUTBOUND, schemaId, memberIdFor(vertexA));
        if (!outbound.isOk()) {
            return outbound;
        }
        return txn.addToList(vertexB, Direction.INBOUND, schemaId, memberIdFor(vertexB));
    }

    @NotNull
    @Override
    Outcome<Void> deregister(@NotNull final GraphTransaction txn) {
        final Outcome<Void> outbound = txn.removeFromList(vertexA, Direction.OUTBOUND, schemaId, memberIdFor(vertexA));
        if (!outbound.isOk()) {
            return outbound;
        }
        return txn.removeFromList(vertexB, Direction.INBOUND, schemaId, memberIdFor(vertexB));
    }

    @Override
    public String toString() {
        return "DirectedEdge{" + vertexA + " -> " + vertexB + ", schema=" + schemaId + (hasBody() ? ", body=" + getBody() : "") + '}';
    }
}
