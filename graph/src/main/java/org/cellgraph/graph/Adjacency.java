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

import org.cellgraph.cell.CellId;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.Map;

/**
 * Adjacency handles of a vertex, one per {@linkplain Direction direction}. A handle is {@linkplain CellId#UNIT}
 * until the first edge registers in that direction.
 */
public final class Adjacency {

    public static final Adjacency EMPTY = new Adjacency(new EnumMap<>(Direction.class));

    @NotNull
    private final Map<Direction, CellId> handles;

    private Adjacency(@NotNull final Map<Direction, CellId> handles) {
        this.handles = handles;
    }

    @NotNull
    public CellId get(@NotNull final Direction direction) {
        final CellId result = handles.get(direction);
        return result == null ? CellId.UNIT : result;
    }

    @NotNull
    public Adjacency with(@NotNull final Direction direction, @NotNull final CellId handle) {
        final Map<Direction, CellId> result = new EnumMap<>(Direction.class);
        result.putAll(handles);
        result.put(direction, handle);
        return new Adjacency(result);
    }

    public boolean isEmpty() {
        for (final CellId handle : handles.values()) {
            if (!handle.isUnit()) {
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
        if (!(obj instanceof Adjacency)) {
            return false;
        }
        final Adjacency that = (Adjacency) obj;
        for (final Direction direction : Direction.values()) {
            if (!get(direction).equals(that.get(direction))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 0;
        for (final Direction direction : Direction.values()) {
            result = result * 31 + get(direction).hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        return "Adjacency" + handles;
    }
}
