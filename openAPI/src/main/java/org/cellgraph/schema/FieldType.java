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

import org.cellgraph.cell.CellId;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

public enum FieldType {

    BOOL {
        @Override
        public boolean accepts(@Nullable final Object value) {
            return value instanceof Boolean;
        }
    },
    INT {
        @Override
        public boolean accepts(@Nullable final Object value) {
            return value instanceof Integer;
        }
    },
    LONG {
        @Override
        public boolean accepts(@Nullable final Object value) {
            return value instanceof Long || value instanceof Integer;
        }
    },
    DOUBLE {
        @Override
        public boolean accepts(@Nullable final Object value) {
            return value instanceof Double || value instanceof Float;
        }
    },
    STRING {
        @Override
        public boolean accepts(@Nullable final Object value) {
            return value instanceof String;
        }
    },
    ID {
        @Override
        public boolean accepts(@Nullable final Object value) {
            return value instanceof CellId;
        }
    },
    /**
     * Map with string keys and values of any supported type.
     */
    MAP {
        @Override
        public boolean accepts(@Nullable final Object value) {
            if (!(value instanceof Map)) {
                return false;
            }
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String) || !isSupportedValue(entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
    };

    public abstract boolean accepts(@Nullable final Object value);

    /**
     * @return {@code true} if the value can be stored in a cell field of dynamic schema
     */
    public static boolean isSupportedValue(@Nullable final Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof List) {
            for (final Object item : (List<?>) value) {
                if (!isSupportedValue(item)) {
                    return false;
                }
            }
            return true;
        }
        for (final FieldType type : values()) {
            if (type.accepts(value)) {
                return true;
            }
        }
        return false;
    }
}
