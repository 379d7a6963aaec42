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

import org.cellgraph.ErrorKind;
import org.cellgraph.Outcome;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@linkplain SchemaCatalog}. Lookups are lock-free, registrations are serialized.
 */
public class MemorySchemaCatalog implements SchemaCatalog {

    private static final Logger logger = LoggerFactory.getLogger(MemorySchemaCatalog.class);

    /**
     * Ids below this one are reserved for system schemas.
     */
    public static final int FIRST_USER_SCHEMA_ID = 1024;

    @NotNull
    private final Map<Integer, Schema> byId;
    @NotNull
    private final Map<String, Schema> byName;
    private int nextId;
    private volatile long version;

    public MemorySchemaCatalog() {
        byId = new ConcurrentHashMap<>();
        byName = new ConcurrentHashMap<>();
        nextId = FIRST_USER_SCHEMA_ID;
    }

    @Nullable
    @Override
    public SchemaType schemaType(final int id) {
        final Schema schema = byId.get(id);
        return schema == null ? null : schema.getSchemaType();
    }

    @Nullable
    @Override
    public Schema getSchema(final int id) {
        return byId.get(id);
    }

    @Nullable
    @Override
    public List<Field> getLayout(final int id) {
        final Schema schema = byId.get(id);
        return schema == null ? null : schema.getFields();
    }

    @Nullable
    @Override
    public Schema getSchemaByName(@NotNull final String name) {
        return byName.get(name);
    }

    @NotNull
    @Override
    public synchronized Outcome<Schema> register(@NotNull final SchemaDescriptor descriptor) {
        final String problem = descriptor.validate();
        if (problem != null) {
            return Outcome.fatal(ErrorKind.INVALID_SCHEMA, problem);
        }
        final String name = descriptor.getName();
        if (byName.containsKey(name)) {
            return Outcome.fatal(ErrorKind.SCHEMA_ALREADY_EXISTS, "Schema " + name + " already exists");
        }
        int id = descriptor.getId();
        if (id == 0) {
            while (byId.containsKey(nextId)) {
                ++nextId;
            }
            id = nextId++;
        } else if (byId.containsKey(id)) {
            return Outcome.fatal(ErrorKind.SCHEMA_ALREADY_EXISTS, "Schema id " + id + " is taken");
        }
        return Outcome.ok(put(descriptor.toSchema(id)));
    }

    @NotNull
    @Override
    public synchronized Outcome<Schema> bootstrap(final int id, @NotNull final String name, @NotNull final List<Field> fields) {
        final Schema schema = new SchemaDescriptor(name).setId(id).addFields(fields).toSchema(id);
        final Schema existing = byId.get(id);
        if (existing != null) {
            if (existing.sameDefinition(schema)) {
                return Outcome.ok(existing);
            }
            return Outcome.fatal(ErrorKind.SCHEMA_ALREADY_EXISTS, "Schema id " + id + " is taken by " + existing.getName());
        }
        if (byName.containsKey(name)) {
            return Outcome.fatal(ErrorKind.SCHEMA_ALREADY_EXISTS, "Schema " + name + " already exists");
        }
        return Outcome.ok(put(schema));
    }

    /**
     * @return number of successful registrations, grows on each change of the catalog
     */
    public long getVersion() {
        return version;
    }

    public int size() {
        return byId.size();
    }

    @NotNull
    private Schema put(@NotNull final Schema schema) {
        byId.put(schema.getId(), schema);
        byName.put(schema.getName(), schema);
        ++version;
        logger.info("Schema registered: " + schema);
        return schema;
    }
}
