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
import org.cellgraph.schema.Field;
import org.cellgraph.schema.FieldType;
import org.cellgraph.schema.Schema;
import org.cellgraph.schema.SchemaCatalog;
import org.cellgraph.schema.SchemaDescriptor;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Built-in schemas backing adjacency cells, and names of hidden fields the graph layer adds to user schemas.
 */
public final class GraphSchemas {

    private static final Logger logger = LoggerFactory.getLogger(GraphSchemas.class);

    public static final int ID_LIST_SCHEMA_ID = 100;
    public static final String ID_LIST_SCHEMA_NAME = "_id_list";
    public static final String ID_LIST_MEMBERS_FIELD = "list";
    public static final String ID_LIST_NEXT_FIELD = "next";

    public static final int TYPE_LIST_SCHEMA_ID = 101;
    public static final String TYPE_LIST_SCHEMA_NAME = "_type_list";
    public static final String TYPE_LIST_TYPES_FIELD = "types";
    public static final String TYPE_LIST_LISTS_FIELD = "lists";

    public static final String RESERVED_PREFIX = "_";
    public static final String EDGE_VERTEX_A_FIELD = "_vertex_a";
    public static final String EDGE_VERTEX_B_FIELD = "_vertex_b";

    private static final List<Field> ID_LIST_FIELDS = Collections.unmodifiableList(Arrays.asList(
            new Field(ID_LIST_MEMBERS_FIELD, FieldType.ID, true, false),
            new Field(ID_LIST_NEXT_FIELD, FieldType.ID)));

    private static final List<Field> TYPE_LIST_FIELDS = Collections.unmodifiableList(Arrays.asList(
            new Field(TYPE_LIST_TYPES_FIELD, FieldType.INT, true, false),
            new Field(TYPE_LIST_LISTS_FIELD, FieldType.ID, true, false)));

    private GraphSchemas() {
    }

    /**
     * Registers built-in schemas unless they are already registered. Should be called once per catalog before any
     * {@linkplain Graph} is constructed over it, repeated calls don't change the catalog.
     *
     * @throws GraphBootstrapException if the catalog rejects any of built-in schemas
     */
    public static void ensureInitialized(@NotNull final SchemaCatalog catalog) {
        bootstrap(catalog, ID_LIST_SCHEMA_ID, ID_LIST_SCHEMA_NAME, ID_LIST_FIELDS);
        bootstrap(catalog, TYPE_LIST_SCHEMA_ID, TYPE_LIST_SCHEMA_NAME, TYPE_LIST_FIELDS);
    }

    /**
     * @throws GraphBootstrapException if built-in schemas are missing in the catalog or have foreign definition
     */
    public static void verify(@NotNull final SchemaCatalog catalog) {
        verify(catalog, ID_LIST_SCHEMA_ID, ID_LIST_SCHEMA_NAME, ID_LIST_FIELDS);
        verify(catalog, TYPE_LIST_SCHEMA_ID, TYPE_LIST_SCHEMA_NAME, TYPE_LIST_FIELDS);
    }

    public static boolean isReserved(@NotNull final String fieldName) {
        return fieldName.startsWith(RESERVED_PREFIX);
    }

    @NotNull
    static List<Field> vertexHiddenFields() {
        final Direction[] directions = Direction.values();
        final Field[] result = new Field[directions.length];
        for (int i = 0; i < directions.length; ++i) {
            result[i] = new Field(directions[i].getFieldName(), FieldType.ID);
        }
        return Arrays.asList(result);
    }

    @NotNull
    static List<Field> edgeHiddenFields() {
        return Arrays.asList(new Field(EDGE_VERTEX_A_FIELD, FieldType.ID), new Field(EDGE_VERTEX_B_FIELD, FieldType.ID));
    }

    private static void bootstrap(@NotNull final SchemaCatalog catalog,
                                  final int id,
                                  @NotNull final String name,
                                  @NotNull final List<Field> fields) {
        final Outcome<Schema> result = catalog.bootstrap(id, name, fields);
        if (!result.isOk()) {
            throw result.isFatal() ?
                    new GraphBootstrapException(result.getError()) :
                    new GraphBootstrapException("Catalog asked to retry bootstrap of " + name);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Built-in schema is ready: " + result.get());
        }
    }

    private static void verify(@NotNull final SchemaCatalog catalog,
                               final int id,
                               @NotNull final String name,
                               @NotNull final List<Field> fields) {
        final Schema existing = catalog.getSchema(id);
        final Schema expected = new SchemaDescriptor(name).addFields(fields).toSchema(id);
        if (existing == null) {
            throw new GraphBootstrapException("Built-in schema " + name + " is not registered, call GraphSchemas.ensureInitialized()");
        }
        if (!existing.sameDefinition(expected)) {
            throw new GraphBootstrapException("Schema id " + id + " is taken by " + existing.getName());
        }
    }
}
