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
 * Edge listed in the undirected lists of both endpoints. A self-loop is listed once.
 */
public final class UndirectedEdge extends Edge {

    UndirectedEdge(final int schemaId,
                   @NotNull final CellId vertexA,
                   @NotNull final CellId vertexB,
                   @NotNull final CellId bodyId,
                   @Nullable final Map<String, ?> body) {
        super(schemaId, vertexA, vertexB, bodyId, body);
    }

    @NotNull
    @Override
    public EdgeType getEdgeType() {
        return EdgeType.UNDIRECTED;
    }

    @NotNull
    public CellId getVertexA() {
        return vertexA;
    }

    @NotNull
    public CellId getVertexB() {
        return vertexB;
    }

    public boolean isSelfLoop() {
        return vertexA.equals(vertexB);
    }

    @NotNull
    @Override
    Outcome<Void> register(@NotNull final GraphTransaction txn) {
        final Outcome<Void> first = txn.addToList(vertexA, Direction.UNDIRECTED, schemaId, memberIdFor(vertexA));
        if (!first.isOk() || isSelfLoop()) {
            return first;
        }
        return txn.addToList(vertexB, Direction.UNDIRECTED, schemaId, memberIdFor(vertexB));
    }

    @NotNull
    @Override
    Outcome<Void> deregister(@NotNull final GraphTransaction txn) {
        final Outcome<Void> first = txn.removeFromList(vertexA, Direction.UNDIRECTED, schemaId, memberIdFor(vertexA));
        if (!first.isOk() || isSelfLoop()) {
            return first;
        }
        return txn.removeFromList(vertexB, Direction.UNDIRECTED, schemaId, memberIdFor(vertexB));
    }

    @Override
    public String toString() {
        return "UndirectedEdge{" + vertexA + " -- " + vertexB + ", schema=" + schemaId + (hasBody() ? ", body=" + getBody() : "") + '}';
    }
}
