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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Registered schema: id, name, {@linkplain SchemaType type} and field layout.
 */
public final class Schema {

    private final int id;
    @NotNull
    private final String name;
    @NotNull
    private final SchemaType schemaType;
    @NotNull
    private final List<Field> fields;
    @Nullable
    private final String keyField;
    private final boolean isDynamic;

    public Schema(final int id,
                  @NotNull final String name,
                  @NotNull final SchemaType schemaType,
                  @NotNull final List<Field> fields,
                  @Nullable final String keyField,
                  final boolean isDynamic) {
        this.id = id;
        this.name = name;
        this.schemaType = schemaType;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.keyField = keyField;
        this.isDynamic = isDynamic;
    }

    public int getId() {
        return id;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public SchemaType getSchemaType() {
        return schemaType;
    }

    @NotNull
    public List<Field> getFields() {
        return fields;
    }

    @Nullable
    public Field getField(@NotNull final String name) {
        for (final Field field : fields) {
            if (field.getName().equals(name)) {
                return field;
            }
        }
        return null;
    }

    @Nullable
    public String getKeyField() {
        return keyField;
    }

    public boolean isDynamic() {
        return isDynamic;
    }

    /**
     * Checks whether cell data conforms to the layout.
     *
     * @return description of the first mismatch, or {@code null} if the data conforms
     */
    @Nullable
    public String checkData(@NotNull final Map<String, ?> data) {
        for (final Field field : fields) {
            final Object value = data.get(field.getName());
            if (!field.accepts(value)) {
                return value == null ?
                        "Field " + field.getName() + " is missing in " + name :
                        "Field " + field.getName() + " of " + name + " expects " + field + ", got " + value.getClass().getSimpleName();
            }
        }
        for (final Map.Entry<String, ?> entry : data.entrySet()) {
            final String fieldName = entry.getKey();
            if (getField(fieldName) == null) {
                if (!isDynamic) {
                    return "Field " + fieldName + " is not declared in " + name;
                }
                if (!FieldType.isSupportedValue(entry.getValue())) {
                    return "Field " + fieldName + " has unsupported value type";
                }
            }
        }
        return null;
    }

    /**
     * @return {@code true} if both schemas have the same name, type and layout
     */
    public boolean sameDefinition(@NotNull final Schema other) {
        return name.equals(other.name) &&
                schemaType.equals(other.schemaType) &&
                fields.equals(other.fields) &&
                (keyField == null ? other.keyField == null : keyField.equals(other.keyField)) &&
                isDynamic == other.isDynamic;
    }

    @Override
    public String toString() {
        return "Schema{" + id + ", " + name + ", " + schemaType + ", " + fields + '}';
    }
}
