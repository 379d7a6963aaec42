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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.cellgraph.ErrorKind;
import org.cellgraph.Outcome;
import org.cellgraph.cell.Cell;
import org.cellgraph.cell.CellId;
import org.cellgraph.graph.adjacency.IdList;
import org.cellgraph.graph.adjacency.SegmentChain;
import org.cellgraph.graph.adjacency.TypeList;
import org.cellgraph.schema.EdgeAttributes;
import org.cellgraph.schema.EdgeType;
import org.cellgraph.schema.Schema;
import org.cellgraph.schema.SchemaType;
import org.cellgraph.store.CellTransaction;
import org.cellgraph.store.TransactionFinishedException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Graph operations bound to one store transaction. All reads see the same snapshot, all writes of the enclosing
 * {@linkplain Graph#transaction(GraphTransactionalComputable) transactional closure} are committed atomically.
 * <p>Every method returns an {@linkplain Outcome}: {@code RETRY} should be returned from the closure as is to let the
 * store re-execute it, {@code FATAL} is a validation, storage or list error which retrying won't fix.
 * <p>The handle is valid only within the closure it was passed to, afterwards any method throws
 * {@linkplain TransactionFinishedException}.
 */
public class GraphTransaction {

    private static final Logger logger = LoggerFactory.getLogger(GraphTransaction.class);

    @NotNull
    private final Graph graph;
    @NotNull
    private final CellTransaction txn;
    @NotNull
    private final SegmentChain chain;
    private volatile boolean isFinished;

    GraphTransaction(@NotNull final Graph graph, @NotNull final CellTransaction txn) {
        this.graph = graph;
        this.txn = txn;
        final GraphConfig config = graph.getConfig();
        chain = new SegmentChain(config.getIdListSegmentCapacity(), config.isIdListReclaimEmptySegments());
    }

    @NotNull
    public Graph getGraph() {
        return graph;
    }

    public boolean isFinished() {
        return isFinished;
    }

    // vertices

    @NotNull
    public Outcome<Vertex> newVertex(final int schemaId, @NotNull final Map<String, ?> data) {
        checkIsFinished();
        final Outcome<Cell> prepared = graph.prepareVertexCell(schemaId, data);
        if (!prepared.isOk()) {
            return prepared.cast();
        }
        final Cell cell = prepared.get();
        return txn.write(cell).map(v -> VertexCells.fromCell(cell));
    }

    /**
     * @return {@code OK(null)} if there is no cell with such id
     */
    @NotNull
    public Outcome<Vertex> readVertex(@NotNull final CellId id) {
        checkIsFinished();
        return txn.read(id).then(graph::toVertex);
    }

    @NotNull
    public Outcome<Vertex> getVertex(final int schemaId, @NotNull final Object key) {
        return readVertex(graph.getStore().encodeKey(schemaId, key));
    }

    /**
     * Replaces user data of the vertex with data of the vertex returned by {@code update}. If {@code update} returns
     * {@code null}, nothing is changed and the current vertex is returned. Adjacency handles are kept, the schema and
     * the key of the vertex can't be changed.
     */
    @NotNull
    public Outcome<Vertex> updateVertex(@NotNull final CellId id, @NotNull final Function<? super Vertex, ? extends Vertex> update) {
        final Outcome<Vertex> read = requireVertex(id);
        if (!read.isOk()) {
            return read;
        }
        final Vertex current = read.get();
        final Vertex updated = update.apply(current);
        if (updated == null) {
            return read;
        }
        final int schemaId = current.getSchemaId();
        if (updated.getSchemaId() != schemaId) {
            return Outcome.fatal(ErrorKind.DATA_NOT_MATCH_SCHEMA,
                    "Schema of vertex " + id + " can't be changed from " + schemaId + " to " + updated.getSchemaId());
        }
        final Schema schema = graph.getCatalog().getSchema(schemaId);
        if (schema == null) {
            return Outcome.fatal(ErrorKind.SCHEMA_NOT_FOUND, "Schema " + schemaId + " is not found");
        }
        final Outcome<Void> checked = VertexCells.checkData(schema, updated.getData());
        if (!checked.isOk()) {
            return checked.cast();
        }
        final String keyField = schema.getKeyField();
        if (keyField != null && !graph.getStore().encodeKey(schemaId, updated.get(keyField)).equals(id)) {
            return Outcome.fatal(ErrorKind.KEY_FIELD_CHANGED, "Key field " + keyField + " of vertex " + id + " can't be changed");
        }
        final Vertex result = current.withData(updated.getData());
        return txn.update(VertexCells.toCell(result)).map(v -> result);
    }

    @NotNull
    public Outcome<Vertex> updateVertexByKey(final int schemaId,
                                             @NotNull final Object key,
                                             @NotNull final Function<? super Vertex, ? extends Vertex> update) {
        return updateVertex(graph.getStore().encodeKey(schemaId, key), update);
    }

    /**
     * Removes the vertex. Depending on {@linkplain GraphConfig#VERTEX_CASCADE_REMOVE} either unlinks all its edges
     * or fails with {@code VERTEX_HAS_EDGES} if there are any. Adjacency lists of the vertex are deleted.
     */
    @NotNull
    public Outcome<Void> removeVertex(@NotNull final CellId id) {
        final Outcome<Vertex> read = requireVertex(id);
        if (!read.isOk()) {
            return read.cast();
        }
        final Adjacency adjacency = read.get().getAdjacency();
        final boolean cascade = graph.getConfig().isVertexCascadeRemove();
        for (final Direction direction : Direction.values()) {
            if (adjacency.get(direction).isUnit()) {
                continue;
            }
            final Outcome<Void> detached = cascade ? unlinkAll(id, direction) : checkNoEdges(id, direction);
            if (!detached.isOk()) {
                return detached;
            }
        }
        for (final Direction direction : Direction.values()) {
            if (adjacency.get(direction).isUnit()) {
                continue;
            }
            final Outcome<Void> deleted = deleteLists(id, direction);
            if (!deleted.isOk()) {
                return deleted;
            }
        }
        return txn.remove(id);
    }

    @NotNull
    public Outcome<Void> removeVertexByKey(final int schemaId, @NotNull final Object key) {
        return removeVertex(graph.getStore().encodeKey(schemaId, key));
    }

    // edges

    @NotNull
    public Outcome<Edge> link(final int schemaId, @NotNull final CellId from, @NotNull final CellId to) {
        return link(schemaId, from, to, null);
    }

    /**
     * Links two vertices with an edge of specified schema. Schema and body are validated before the store is
     * touched: the schema should be an edge one, the body should be present if and only if the schema requires it.
     *
     * @param schemaId edge schema id
     * @param from     start vertex of directed edge, or one of endpoints of undirected edge
     * @param to       end vertex of directed edge, or another endpoint of undirected edge
     * @param body     body data, {@code null} for lightweight edges
     * @return the edge
     */
    @NotNull
    public Outcome<Edge> link(final int schemaId,
                              @NotNull final CellId from,
                              @NotNull final CellId to,
                              @Nullable final Map<String, ?> body) {
        checkIsFinished();
        final Schema schema = graph.getCatalog().getSchema(schemaId);
        final Outcome<EdgeAttributes> resolved = edgeAttributes(schemaId, schema);
        if (!resolved.isOk()) {
            return resolved.cast();
        }
        final EdgeAttributes attributes = resolved.get();
        if (attributes.hasBody() && body == null) {
            return Outcome.fatal(ErrorKind.BODY_REQUIRED, "Edges of schema " + schemaId + " require body");
        }
        if (!attributes.hasBody() && body != null) {
            return Outcome.fatal(ErrorKind.BODY_SHOULD_NOT_EXIST, "Edges of schema " + schemaId + " can't have body");
        }
        if (body != null) {
            final Outcome<Void> checked = EdgeCells.checkBody(schema, body);
            if (!checked.isOk()) {
                return checked.cast();
            }
        }
        final Outcome<Vertex> start = requireVertex(from);
        if (!start.isOk()) {
            return start.cast();
        }
        if (!to.equals(from)) {
            final Outcome<Vertex> end = requireVertex(to);
            if (!end.isOk()) {
                return end.cast();
            }
        }
        final Edge edge = Edge.of(attributes.getEdgeType(), schemaId, from, to, body == null ? CellId.UNIT : CellId.random(), body);
        if (edge.hasBody()) {
            final Outcome<Void> written = txn.write(EdgeCells.toCell(edge));
            if (!written.isOk()) {
                return written.cast();
            }
        }
        final Outcome<Void> registered = edge.register(this);
        if (!registered.isOk()) {
            return registered.cast();
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Linked " + edge);
        }
        return Outcome.ok(edge);
    }

    /**
     * Removes one edge of specified schema from {@code from} to {@code to}, or between them if the schema is
     * undirected. Fails with {@code EDGE_NOT_FOUND} if there is no such edge.
     *
     * @return removed edge
     */
    @NotNull
    public Outcome<Edge> unlink(final int schemaId, @NotNull final CellId from, @NotNull final CellId to) {
        checkIsFinished();
        final Outcome<EdgeAttributes> resolved = edgeAttributes(schemaId, graph.getCatalog().getSchema(schemaId));
        if (!resolved.isOk()) {
            return resolved.cast();
        }
        final Direction direction = resolved.get().getEdgeType() == EdgeType.DIRECTED ? Direction.OUTBOUND : Direction.UNDIRECTED;
        final Outcome<List<Edge>> edges = neighbourhoods(from, schemaId, direction);
        if (!edges.isOk()) {
            return edges.cast();
        }
        for (final Edge edge : edges.get()) {
            if (edge.opposite(from).equals(to)) {
                return removeEdge(edge).map(v -> edge);
            }
        }
        return Outcome.fatal(ErrorKind.EDGE_NOT_FOUND, "No edge of schema " + schemaId + " between " + from + " and " + to);
    }

    // neighbourhoods

    /**
     * Lists edges of specified schema registered in the adjacency list of the vertex in specified direction. Fails
     * on the first member that can't be resolved to an edge, no partial result is returned.
     */
    @NotNull
    public Outcome<List<Edge>> neighbourhoods(@NotNull final CellId vertex, final int schemaId, @NotNull final Direction direction) {
        checkIsFinished();
        final Outcome<EdgeAttributes> resolved = edgeAttributes(schemaId, graph.getCatalog().getSchema(schemaId));
        if (!resolved.isOk()) {
            return resolved.cast();
        }
        final Outcome<List<CellId>> members = IdList.open(txn, chain, vertex, direction, schemaId).all();
        if (!members.isOk()) {
            return members.cast();
        }
        final EdgeType type = direction == Direction.UNDIRECTED ? EdgeType.UNDIRECTED : EdgeType.DIRECTED;
        final List<Edge> result = new ArrayList<>(members.get().size());
        for (final CellId member : members.get()) {
            final Outcome<Edge> edge = resolve(vertex, direction, schemaId, type, member);
            if (!edge.isOk()) {
                return edge.cast();
            }
            result.add(edge.get());
        }
        return Outcome.ok(result);
    }

    /**
     * Lists edges of all schemas registered in the adjacency lists of the vertex in specified direction.
     */
    @NotNull
    public Outcome<List<Edge>> neighbourhoods(@NotNull final CellId vertex, @NotNull final Direction direction) {
        checkIsFinished();
        final Outcome<TypeList> types = TypeList.load(txn, vertex, direction);
        if (!types.isOk()) {
            return types.cast();
        }
        final List<Edge> result = new ArrayList<>();
        final IntList schemaIds = types.get().getSchemaIds();
        for (int i = 0; i < schemaIds.size(); ++i) {
            final Outcome<List<Edge>> edges = neighbourhoods(vertex, schemaIds.getInt(i), direction);
            if (!edges.isOk()) {
                return edges;
            }
            result.addAll(edges.get());
        }
        return Outcome.ok(result);
    }

    /**
     * Lists all edges of the vertex in all directions. A directed self-loop is listed twice.
     */
    @NotNull
    public Outcome<List<Edge>> neighbourhoods(@NotNull final CellId vertex) {
        final List<Edge> result = new ArrayList<>();
        for (final Direction direction : Direction.values()) {
            final Outcome<List<Edge>> edges = neighbourhoods(vertex, direction);
            if (!edges.isOk()) {
                return edges;
            }
            result.addAll(edges.get());
        }
        return Outcome.ok(result);
    }

    /**
     * @return number of entries in the adjacency list of specified schema and direction
     */
    @NotNull
    public Outcome<Integer> degree(@NotNull final CellId vertex, final int schemaId, @NotNull final Direction direction) {
        checkIsFinished();
        final Outcome<EdgeAttributes> resolved = edgeAttributes(schemaId, graph.getCatalog().getSchema(schemaId));
        if (!resolved.isOk()) {
            return resolved.cast();
        }
        return IdList.open(txn, chain, vertex, direction, schemaId).size();
    }

    /**
     * @return number of entries in all adjacency lists of the vertex
     */
    @NotNull
    public Outcome<Integer> degree(@NotNull final CellId vertex) {
        checkIsFinished();
        int result = 0;
        for (final Direction direction : Direction.values()) {
            final Outcome<TypeList> types = TypeList.load(txn, vertex, direction);
            if (!types.isOk()) {
                return types.cast();
            }
            final IntList schemaIds = types.get().getSchemaIds();
            for (int i = 0; i < schemaIds.size(); ++i) {
                final Outcome<Integer> size = IdList.open(txn, chain, vertex, direction, schemaIds.getInt(i)).size();
                if (!size.isOk()) {
                    return size;
                }
                result += size.get();
            }
        }
        return Outcome.ok(result);
    }

    // package-private api of edges

    @NotNull
    Outcome<Void> addToList(@NotNull final CellId owner, @NotNull final Direction direction, final int schemaId, @NotNull final CellId member) {
        final Outcome<Void> appended = IdList.open(txn, chain, owner, direction, schemaId).append(member);
        if (!appended.isOk()) {
            return appended;
        }
        final Outcome<Vertex> read = requireVertex(owner);
        if (!read.isOk()) {
            return read.cast();
        }
        final Vertex vertex = read.get();
        final Adjacency adjacency = vertex.getAdjacency();
        if (!adjacency.get(direction).isUnit()) {
            return Outcome.done();
        }
        final CellId handle = TypeList.idFor(owner, direction);
        return txn.update(VertexCells.toCell(vertex.withAdjacency(adjacency.with(direction, handle))));
    }

    @NotNull
    Outcome<Void> removeFromList(@NotNull final CellId owner, @NotNull final Direction direction, final int schemaId, @NotNull final CellId member) {
        return IdList.open(txn, chain, owner, direction, schemaId).remove(member);
    }

    void finish() {
        isFinished = true;
    }

    @NotNull
    private Outcome<Vertex> requireVertex(@NotNull final CellId id) {
        final Outcome<Vertex> read = readVertex(id);
        if (read.isOk() && read.get() == null) {
            return Outcome.fatal(ErrorKind.VERTEX_NOT_FOUND, "Vertex " + id + " is not found");
        }
        return read;
    }

    @NotNull
    private Outcome<Void> removeEdge(@NotNull final Edge edge) {
        final Outcome<Void> deregistered = edge.deregister(this);
        if (!deregistered.isOk()) {
            return deregistered;
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Unlinked " + edge);
        }
        return edge.hasBody() ? txn.remove(edge.getBodyId()) : deregistered;
    }

    @NotNull
    private Outcome<Edge> resolve(@NotNull final CellId vertex,
                                  @NotNull final Direction direction,
                                  final int schemaId,
                                  @NotNull final EdgeType type,
                                  @NotNull final CellId member) {
        final Outcome<Cell> read = txn.read(member);
        if (!read.isOk()) {
            return read.cast();
        }
        final Cell cell = read.get();
        if (cell == null) {
            return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Member " + member + " of " + direction + " list of " + vertex + " doesn't exist");
        }
        if (cell.getSchemaId() == schemaId) {
            return EdgeCells.fromCell(cell, type);
        }
        final SchemaType memberType = graph.getCatalog().schemaType(cell.getSchemaId());
        if (memberType == null || !memberType.isVertex()) {
            return Outcome.fatal(ErrorKind.LIST_CORRUPTED, "Member " + member + " of " + direction + " list of " + vertex + " is neither a vertex nor an edge body");
        }
        return Outcome.ok(direction == Direction.INBOUND ?
                Edge.of(type, schemaId, member, vertex, CellId.UNIT, null) :
                Edge.of(type, schemaId, vertex, member, CellId.UNIT, null));
    }

    @NotNull
    private Outcome<Void> unlinkAll(@NotNull final CellId vertex, @NotNull final Direction direction) {
        final Outcome<TypeList> types = TypeList.load(txn, vertex, direction);
        if (!types.isOk()) {
            return types.cast();
        }
        final IntList schemaIds = new IntArrayList(types.get().getSchemaIds());
        for (int i = 0; i < schemaIds.size(); ++i) {
            final Outcome<List<Edge>> edges = neighbourhoods(vertex, schemaIds.getInt(i), direction);
            if (!edges.isOk()) {
                return edges.cast();
            }
            for (final Edge edge : edges.get()) {
                final Outcome<Void> removed = removeEdge(edge);
                if (!removed.isOk()) {
                    return removed;
                }
            }
        }
        return Outcome.done();
    }

    @NotNull
    private Outcome<Void> checkNoEdges(@NotNull final CellId vertex, @NotNull final Direction direction) {
        final Outcome<TypeList> types = TypeList.load(txn, vertex, direction);
        if (!types.isOk()) {
            return types.cast();
        }
        final IntList schemaIds = types.get().getSchemaIds();
        for (int i = 0; i < schemaIds.size(); ++i) {
            final Outcome<Integer> size = IdList.open(txn, chain, vertex, direction, schemaIds.getInt(i)).size();
            if (!size.isOk()) {
                return size.cast();
            }
            if (size.get() > 0) {
                return Outcome.fatal(ErrorKind.VERTEX_HAS_EDGES, "Vertex " + vertex + " has " + direction + " edges of schema " + schemaIds.getInt(i));
            }
        }
        return Outcome.done();
    }

    @NotNull
    private Outcome<Void> deleteLists(@NotNull final CellId vertex, @NotNull final Direction direction) {
        final Outcome<TypeList> types = TypeList.load(txn, vertex, direction);
        if (!types.isOk()) {
            return types.cast();
        }
        final IntList schemaIds = new IntArrayList(types.get().getSchemaIds());
        for (int i = 0; i < schemaIds.size(); ++i) {
            final Outcome<Void> deleted = IdList.open(txn, chain, vertex, direction, schemaIds.getInt(i)).delete();
            if (!deleted.isOk()) {
                return deleted;
            }
        }
        return Outcome.done();
    }

    @NotNull
    private static Outcome<EdgeAttributes> edgeAttributes(final int schemaId, @Nullable final Schema schema) {
        if (schema == null) {
            return Outcome.fatal(ErrorKind.SCHEMA_NOT_FOUND, "Schema " + schemaId + " is not found");
        }
        final EdgeAttributes attributes = schema.getSchemaType().getEdgeAttributes();
        if (attributes == null) {
            return Outcome.fatal(ErrorKind.SCHEMA_NOT_EDGE, "Schema " + schema.getName() + " is not an edge schema");
        }
        return Outcome.ok(attributes);
    }

    private void checkIsFinished() {
        if (isFinished) {
            throw new TransactionFinishedException();
        }
    }
}
