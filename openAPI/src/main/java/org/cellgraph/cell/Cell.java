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
package org.cellgraph.cell;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single versioned, schema-typed unit of storage: a {@linkplain CellHeader header} and an ordered map of field
 * values. Cells are immutable, the field map and nested lists and maps are copied on construction.
 * <p>Supported field values: {@code Boolean}, {@code Integer}, {@code Long}, {@code Double}, {@code String},
 * {@linkplain CellId}, lists and string-keyed maps of them.
 */
public final class Cell {

    @NotNull
    private final CellHeader header;
    @NotNull
    private final Map<String, Object> data;

    public Cell(@NotNull final CellHeader header, @NotNull final Map<String, ?> data) {
        this.header = header;
        this.data = freezeMap(data);
    }

    @NotNull
    public CellHeader getHeader() {
        return header;
    }

    @NotNull
    public CellId getId() {
        return header.getId();
    }

    public int getSchemaId() {
        return header.getSchemaId();
    }

    public long getVersion() {
        return header.getVersion();
    }

    @NotNull
    public Map<String, Object> getData() {
        return data;
    }

    @Nullable
    public Object get(@NotNull final String field) {
        return data.get(field);
    }

    /**
     * @return value of the field of {@linkplain CellId} type, {@linkplain CellId#UNIT} if the field is absent
     */
    @NotNull
    public CellId getCellId(@NotNull final String field) {
        final Object value = data.get(field);
        return value instanceof CellId ? (CellId) value : CellId.UNIT;
    }

    @NotNull
    public Cell withHeader(@NotNull final CellHeader header) {
        return new Cell(header, data);
    }

    @NotNull
    public Cell withData(@NotNull final Map<String, ?> data) {
        return new Cell(header, data);
    }

    @Override
    public String toString() {
        return "Cell{" + header + ", data=" + data + '}';
    }

    @NotNull
    private static Map<String, Object> freezeMap(@NotNull final Map<String, ?> map) {
        final Map<String, Object> result = new LinkedHashMap<>(map.size() * 2);
        for (final Map.Entry<String, ?> entry : map.entrySet()) {
            result.put(entry.getKey(), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    @SuppressWarnings("unchecked")
    private static Object freeze(@Nullable final Object value) {
        if (value instanceof List) {
            final List<?> list = (List<?>) value;
            final List<Object> result = new ArrayList<>(list.size());
            for (final Object item : list) {
                result.add(freeze(item));
            }
            return Collections.unmodifiableList(result);
        }
        if (value instanceof Map) {
            return freezeMap((Map<String, ?>) value);
        }
        return value;
    }
}
