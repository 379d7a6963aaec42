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

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable description of a schema to be {@linkplain SchemaCatalog#register(SchemaDescriptor) registered}.
 * Id {@code 0} lets the catalog assign the id.
 * <pre>
 *     final SchemaDescriptor person = new SchemaDescriptor("person")
 *         .addField(new Field("name", FieldType.STRING))
 *         .setKeyField("name");
 * </pre>
 */
public class SchemaDescriptor {

    private int id;
    @NotNull
    private String name;
    @NotNull
    private SchemaType schemaType;
    @NotNull
    private final List<Field> fields;
    @Nullable
    private String keyField;
    private boolean isDynamic;

    public SchemaDescriptor(@NotNull final String name) {
        this.name = name;
        schemaType = SchemaType.UNSPECIFIED;
        fields = new ArrayList<>();
    }

    public int getId() {
        return id;
    }

    public SchemaDescriptor setId(final int id) {
        this.id = id;
        return this;
    }

    @NotNull
    public String getName() {
        return name;
    }

    public SchemaDescriptor setName(@NotNull final String name) {
        this.name = name;
        return this;
    }

    @NotNull
    public SchemaType getSchemaType() {
        return schemaType;
    }

    public SchemaDescriptor setSchemaType(@NotNull final SchemaType schemaType) {
        this.schemaType = schemaType;
        return this;
    }

    @NotNull
    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public SchemaDescriptor addField(@NotNull final Field field) {
        fields.add(field);
        return this;
    }

    public SchemaDescriptor addFields(@NotNull final List<Field> fields) {
        this.fields.addAll(fields);
        return this;
    }

    @Nullable
    public String getKeyField() {
        return keyField;
    }

    public SchemaDescriptor setKeyField(@Nullable final String keyField) {
        this.keyField = keyField;
        return this;
    }

    /**
     * Cells of dynamic schema can have fields not declared by the schema.
     */
    public boolean isDynamic() {
        return isDynamic;
    }

    public SchemaDescriptor setDynamic(final boolean isDynamic) {
        this.isDynamic = isDynamic;
        return this;
    }

    @NotNull
    public SchemaDescriptor copy() {
        return new SchemaDescriptor(name)
                .setId(id)
                .setSchemaType(schemaType)
                .addFields(fields)
                .setKeyField(keyField)
                .setDynamic(isDynamic);
    }

    /**
     * @return description of the first problem found, or {@code null} if the descriptor is well-formed
     */
    @Nullable
    public String validate() {
        if (StringUtils.isBlank(name)) {
            return "Schema name is blank";
        }
        final Set<String> names = new HashSet<>();
        for (final Field field : fields) {
            if (StringUtils.isBlank(field.getName())) {
                return "Field name is blank";
            }
            if (!names.add(field.getName())) {
                return "Duplicate field " + field.getName();
            }
        }
        if (keyField != null) {
            Field key = null;
            for (final Field field : fields) {
                if (field.getName().equals(keyField)) {
                    key = field;
                }
            }
            if (key == null) {
                return "Key field " + keyField + " is not declared";
            }
            if (key.isArray() || key.isNullable() || key.getType() == FieldType.MAP) {
                return "Key field " + keyField + " should be scalar and not nullable";
            }
        }
        return null;
    }

    @NotNull
    public Schema toSchema(final int id) {
        return new Schema(id, name, schemaType, fields, keyField, isDynamic);
    }
}
