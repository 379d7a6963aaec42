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

import org.jetbrains.annotations.NotNull;

/**
 * Which adjacency list of a vertex an edge registers into. Each direction has its own hidden handle field in the
 * vertex cell.
 */
public enum Direction {

    INBOUND("_inbound"),
    OUTBOUND("_outbound"),
    UNDIRECTED("_undirected");

    @NotNull
    private final String fieldName;

    Direction(@NotNull final String fieldName) {
        this.fieldName = fieldName;
    }

    @NotNull
    public String getFieldName() {
        return fieldName;
    }
}
