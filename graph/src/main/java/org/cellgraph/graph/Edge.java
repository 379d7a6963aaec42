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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relationship between two vertices. Lightweight edges exist only as entries of adjacency lists, the entry is the id
 * of the opposite vertex. Edges of schemas requiring a body own a body cell, their adjacency entries are the id of
 * the body cell.
 */
public abstract class Edge {

    protected final int schemaId;
    @NotNull
    protected final CellId vertexA;
    @NotNull
    protected final CellId vertexB;
    @NotNull
    private final CellId bodyId;
    @Nullable
    private final Map<String, Object> body;

    Edge(final int schemaId,
         @NotNull final CellId vertexA,
         @NotNull final CellId vertexB,
         @NotNull final CellId bodyId,
         @Nullable final Map<String, ?> body) {
        this.schemaId = schemaId;
        this.vertexA = vertexA;
        this.vertexB = vertexB;
        this.bodyId = bodyId;
        this.body = body == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    @NotNull
    static Edge of(@NotNull final EdgeType type,
                   final int schemaId,
                   @NotNull final CellId vertexA,
                   @NotNull final CellId vertexB,
                   @NotNull final CellId bodyId,
                   @Nullable final Map<String, ?> body) {
        return type == EdgeType.DIRECTED ?
                new DirectedEdge(schemaId, vertexA, vertexB, bodyId, body) :
                new UndirectedEdge(schemaId, vertexA, vertexB, bodyId, body);
    }

    @NotNull
    public abstract EdgeType getEdgeType();

    public int getSchemaId() {
        return schemaId;
    }

    public boolean hasBody() {
        return !bodyId.isUnit();
    }

    /**
     * @return id of the body cell, {@linkplain CellId#UNIT} for lightweight edges
     */
    @NotNull
    public CellId getBodyId() {
        return bodyId;
    }

    /**
     * @return user data of the body, {@code null} for lightweight edges
     */
    @Nullable
    public Map<String, Object> getBody() {
        return body;
    }

    /**
     * @throws IllegalArgumentException if the vertex is not an endpoint of the edge
     */
    @NotNull
    public CellId opposite(@NotNull final CellId vertex) {
        if (vertex.equals(vertexA)) {
            return vertexB;
        }
        if (vertex.equals(vertexB)) {
            return vertexA;
        }
        throw new IllegalArgumentException("Vertex " + vertex + " is not an endpoint of " + this);
    }

    /**
     * @return the id the edge is listed under in adjacency lists of specified endpoint
     */
    @NotNull
    CellId memberIdFor(@NotNull final CellId vertex) {
        return hasBody() ? bodyId : opposite(vertex);
    }

    /**
     * Appends the edge to adjacency lists of its endpoints.
     */
    @NotNull
    abstract Outcome<Void> register(@NotNull GraphTransaction txn);

    /**
     * Removes the edge from adjacency lists of its endpoints, the body cell is left intact.
     */
    @NotNull
    abstract Outcome<Void> deregister(@NotNull GraphTransaction txn);

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        final Edge that = (Edge) obj;
        return schemaId == that.schemaId && vertexA.equals(that.vertexA) && vertexB.equals(that.vertexB) &&
                bodyId.equals(that.bodyId);
    }

    @Override
    public int hashCode() {
        return ((vertexA.hashCode() * 31 + vertexB.hashCode()) * 31 + bodyId.hashCode()) * 31 + schemaId;
    }
}
