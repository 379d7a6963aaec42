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

import java.util.List;

/**
 * Declared field of a {@linkplain Schema schema}.
 */
public final class Field {

    @NotNull
    private final String name;
    @NotNull
    private final FieldType type;
    private final boolean isArray;
    private final boolean isNullable;

    public Field(@NotNull final String name, @NotNull final FieldType type) {
        this(name, type, false, false);
    }

    public Field(@NotNull final String name, @NotNull final FieldType type, final boolean isArray, final boolean isNullable) {
        this.name = name;
        this.type = type;
        this.isArray = isArray;
        this.isNullable = isNullable;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public FieldType getType() {
        return type;
    }

    public boolean isArray() {
        return isArray;
    }

    public boolean isNullable() {
        return isNullable;
    }

    public boolean accepts(@Nullable final Object value) {
        if (value == null) {
            return isNullable;
        }
        if (!isArray) {
            return type.accepts(value);
        }
        if (!(value instanceof List)) {
            return false;
        }
        for (final Object item : (List<?>) value) {
            if (!type.accepts(item)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Field)) {
            return false;
        }
        final Field that = (Field) obj;
        return isArray == that.isArray && isNullable == that.isNullable && type == that.type && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return (name.hashCode() * 31 + type.hashCode()) * 4 + (isArray ? 2 : 0) + (isNullable ? 1 : 0);
    }

    @Override
    public String toString() {
        return name + ':' + type + (isArray ? "[]" : "") + (isNullable ? "?" : "");
    }
}
