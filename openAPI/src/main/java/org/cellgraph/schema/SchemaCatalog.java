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
package org.cellgraph.schema;

import org.cellgraph.Outcome;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Registry mapping schema identifiers to {@linkplain SchemaType classification} and field layout. Catalog is shared
 * and read-mostly, its implementations are safe for concurrent use. Registration is rare and administrator-driven.
 */
public interface SchemaCatalog {

    /**
     * @return type of the schema, or {@code null} if there is no schema with specified id
     */
    @Nullable
    SchemaType schemaType(int id);

    @Nullable
    Schema getSchema(int id);

    /**
     * @return field layout of the schema, or {@code null} if there is no schema with specified id
     */
    @Nullable
    List<Field> getLayout(int id);

    @Nullable
    Schema getSchemaByName(@NotNull String name);

    /**
     * Registers new schema. Fails with {@linkplain org.cellgraph.ErrorKind#SCHEMA_ALREADY_EXISTS} if id or name is
     * taken, with {@linkplain org.cellgraph.ErrorKind#INVALID_SCHEMA} if the descriptor is malformed.
     *
     * @return registered schema
     */
    @NotNull
    Outcome<Schema> register(@NotNull SchemaDescriptor descriptor);

    /**
     * Idempotently registers a system schema with specified id. If the schema already exists with the same definition,
     * nothing is changed. If the id is taken by a different schema the call fails with
     * {@linkplain org.cellgraph.ErrorKind#SCHEMA_ALREADY_EXISTS}.
     */
    @NotNull
    Outcome<Schema> bootstrap(int id, @NotNull String name, @NotNull List<Field> fields);
}
