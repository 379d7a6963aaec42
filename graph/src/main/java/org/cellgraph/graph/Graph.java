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
import org.cellgraph.cell.CellId;
import org.cellgraph.schema.EdgeAttributes;
import org.cellgraph.schema.Field;
import org.cellgraph.schema.Schema;
import org.cellgraph.schema.SchemaCatalog;
import org.cellgraph.schema.SchemaDescriptor;
import org.cellgraph.schema.SchemaType;
import org.cellgraph.store.CellStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Property graph over a {@linkplain CellStore cell store}. Multi-cell operations are executed in
 * {@linkplain #transaction(GraphTransactionalComputable) transactions}, single-vertex creation and reads are available
 * without explicit transaction.
 * <pre>
 *     GraphSchemas.ensureInitialized(catalog);
 *     final Graph graph = new Graph(store, catalog, new GraphConfig());
 *     final Outcome&lt;Edge&gt; edge = graph.transaction(txn -&gt; txn.link(knows, alice, bob));
 * </pre>
 *
 * @see Graphs
 */
public class Graph {

    private static final Logger logger = LoggerFactory.getLogger(Graph.class);

    @NotNull
    private final CellStore store;
    @NotNull
    private final SchemaCatalog catalog;
    @NotNull
    private final GraphConfig config;

    /**
     * @throws GraphBootstrapException if built-in schemas are not registered in the catalog
     */
    public Graph(@NotNull final CellStore store, @NotNull final SchemaCatalog catalog, @NotNull final GraphConfig config) {
        GraphSchemas.verify(catalog);
        this.store = store;
        this.catalog = catalog;
        this.config = config;
    }

    @NotNull
    public CellStore getStore() {
        return store;
    }

    @NotNull
    public SchemaCatalog getCatalog() {
        return catalog;
    }

    @NotNull
    public GraphConfig getConfig() {
        return config;
    }

    /**
     * Registers vertex schema. Hidden adjacency fields are added to the registered layout.
     */
    @NotNull
    public Outcome<Schema> defineVertexSchema(@NotNull final SchemaDescriptor descriptor) {
        return define(descriptor, SchemaType.VERTEX, GraphSchemas.vertexHiddenFields());
    }

    /**
     * Registers edge schema. Layout of schemas with body gets hidden endpoint fields. Body-less schemas can't declare
     * fields, edge schemas never have a key field.
     */
    @NotNull
    public Outcome<Schema> defineEdgeSchema(@NotNull final SchemaDescriptor descriptor, @NotNull final EdgeAttributes attributes) {
        if (descriptor.getKeyField() != null) {
            return Outcome.fatal(ErrorKind.INVALID_SCHEMA, "Edge schema " + descriptor.getName() + " can't have a key field");
        }
        if (!attributes.hasBody() && (!descriptor.getFields().isEmpty() || descriptor.isDynamic())) {
            return Outcome.fatal(ErrorKind.INVALID_SCHEMA, "Edge schema " + descriptor.getName() + " without body can't declare fields");
        }
        return define(descriptor, SchemaType.edge(attributes),
                attributes.hasBody() ? GraphSchemas.edgeHiddenFields() : Collections.emptyList());
    }

    @NotNull
    public Outcome<Vertex> newVertex(final int schemaId, @NotNull final Map<String, ?> data) {
        final Outcome<Cell> prepared = prepareVertexCell(schemaId, data);
        if (!prepared.isOk()) {
            return prepared.cast();
        }
        final Cell cell = prepared.get();
        return store.write(cell).map(header -> VertexCells.fromCell(cell.withHeader(header)));
    }

    /**
     * @return {@code OK(null)} if there is no cell with such id
     */
    @NotNull
    public Outcome<Vertex> readVertex(@NotNull final CellId id) {
        return store.read(id).then(this::toVertex);
    }

    @NotNull
    public Outcome<Vertex> getVertex(final int schemaId, @NotNull final Object key) {
        return readVertex(store.encodeKey(schemaId, key));
    }

    @NotNull
    public Outcome<Vertex> updateVertex(@NotNull final CellId id, @NotNull final Function<? super Vertex, ? extends Vertex> update) {
        return transaction(txn -> txn.updateVertex(id, update));
    }

    @NotNull
    public Outcome<Vertex> updateVertexByKey(final int schemaId,
                                             @NotNull final Object key,
                                             @NotNull final Function<? super Vertex, ? extends Vertex> update) {
        return transaction(txn -> txn.updateVertexByKey(schemaId, key, update));
    }

    @NotNull
    public Outcome<Void> removeVertex(@NotNull final CellId id) {
        return transaction(txn -> txn.removeVertex(id));
    }

    @NotNull
    public Outcome<Void> removeVertexByKey(final int schemaId, @NotNull final Object key) {
        return transaction(txn -> txn.removeVertexByKey(schemaId, key));
    }

    /**
     * Executes the computable in a store transaction. The computable is re-executed on conflicts with concurrent
     * transactions; if the store gives up, {@code RETRY} is returned and the caller should invoke this method once
     * more. {@code FATAL} outcome of the computable aborts the transaction.
     */
    @NotNull
    public <T> Outcome<T> transaction(@NotNull final GraphTransactionalComputable<T> computable) {
        return store.computeInTransaction(txn -> {
            final GraphTransaction graphTxn = new GraphTransaction(this, txn);
            try {
                return computable.compute(graphTxn);
            } finally {
                graphTxn.finish();
            }
        });
    }

    @NotNull
    Outcome<Cell> prepareVertexCell(final int schemaId, @NotNull final Map<String, ?> data) {
        final Schema schema = catalog.getSchema(schemaId);
        if (schema == null) {
            return Outcome.fatal(ErrorKind.SCHEMA_NOT_FOUND, "Schema " + schemaId + " is not found");
        }
        if (!schema.getSchemaType().isVertex()) {
            return Outcome.fatal(ErrorKind.SCHEMA_NOT_VERTEX, "Schema " + schema.getName() + " is not a vertex schema");
        }
        final Outcome<Void> checked = VertexCells.checkData(schema, data);
        if (!checked.isOk()) {
            return checked.cast();
        }
        final String keyField = schema.getKeyField();
        final Object key = keyField == null ? null : data.get(keyField);
        final CellId id = key == null ? CellId.random() : store.encodeKey(schemaId, key);
        return Outcome.ok(VertexCells.toCell(Vertex.create(schemaId, data).withId(id)));
    }

    @NotNull
    Outcome<Vertex> toVertex(@Nullable final Cell cell) {
        if (cell == null) {
            return Outcome.done();
        }
        final SchemaType type = catalog.schemaType(cell.getSchemaId());
        if (type == null || !type.isVertex()) {
            return Outcome.fatal(ErrorKind.SCHEMA_NOT_VERTEX, "Cell " + cell.getId() + " is not a vertex");
        }
        return Outcome.ok(VertexCells.fromCell(cell));
    }

    @NotNull
    private Outcome<Schema> define(@NotNull final SchemaDescriptor descriptor,
                                   @NotNull final SchemaType type,
                                   @NotNull final List<Field> hiddenFields) {
        for (final Field field : descriptor.getFields()) {
            if (GraphSchemas.isReserved(field.getName())) {
                return Outcome.fatal(ErrorKind.RESERVED_FIELD, "Field " + field.getName() + " is reserved");
            }
        }
        final Outcome<Schema> registered = catalog.register(descriptor.copy().setSchemaType(type).addFields(hiddenFields));
        if (registered.isOk()) {
            logger.info("Defined " + type + " schema " + registered.get().getName());
        }
        return registered;
    }
}
