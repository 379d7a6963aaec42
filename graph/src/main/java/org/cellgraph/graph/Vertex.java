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

import org.cellgraph.cell.CellId;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Graph vertex: identity, schema id, user data and {@linkplain Adjacency adjacency handles}. User data never
 * contains the hidden adjacency fields of the underlying cell. Vertices are immutable, updates return copies.
 * <pre>
 *     graph.transaction(txn -> txn.updateVertex(id, v -> v.with("age", 42)));
 * </pre>
 */
public final class Vertex {

    @NotNull
    private final CellId id;
    private final int schemaId;
    @NotNull
    private final Map<String, Object> data;
    @NotNull
    private final Adjacency adjacency;

    Vertex(@NotNull final CellId id, final int schemaId, @NotNull final Map<String, ?> data, @NotNull final Adjacency adjacency) {
        this.id = id;
        this.schemaId = schemaId;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.adjacency = adjacency;
    }

    /**
     * Creates unsaved vertex with null adjacency handles.
     */
    @NotNull
    public static Vertex create(final int schemaId, @NotNull final Map<String, ?> data) {
        return new Vertex(CellId.UNIT, schemaId, data, Adjacency.EMPTY);
    }

    /**
     * @return id of the vertex, {@linkplain CellId#UNIT} if the vertex is not saved
     */
    @NotNull
    public CellId getId() {
        return id;
    }

    public int getSchemaId() {
        return schemaId;
    }

    @NotNull
    public Map<String, Object> getData() {
        return data;
    }

    @Nullable
    public Object get(@NotNull final String field) {
        return data.get(field);
    }

    @NotNull
    public Adjacency getAdjacency() {
        return adjacency;
    }

    @NotNull
    public Vertex withData(@NotNull final Map<String, ?> data) {
        return new Vertex(id, schemaId, data, adjacency);
    }

    @NotNull
    public Vertex with(@NotNull final String field, @Nullable final Object value) {
        final Map<String, Object> result = new LinkedHashMap<>(data);
        result.put(field, value);
        return new Vertex(id, schemaId, result, adjacency);
    }

    @NotNull
    Vertex withId(@NotNull final CellId id) {
        return new Vertex(id, schemaId, data, adjacency);
    }

    @NotNull
    Vertex withAdjacency(@NotNull final Adjacency adjacency) {
        return new Vertex(id, schemaId, data, adjacency);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Vertex)) {
            return false;
        }
        final Vertex that = (Vertex) obj;
        return schemaId == that.schemaId && id.equals(that.id) && data.equals(that.data) && adjacency.equals(that.adjacency);
    }

    @Override
    public int hashCode() {
        return id.hashCode() * 31 + schemaId;
    }

    @Override
    public String toString() {
        return "Vertex{" + id + ", schema=" + schemaId + ", data=" + data + '}';
    }
}
