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

/**
 * Schema-level descriptor of edges: whether they are directed and whether each edge owns a body cell.
 */
public final class EdgeAttributes {

    @NotNull
    private final EdgeType edgeType;
    private final boolean hasBody;

    public EdgeAttributes(@NotNull final EdgeType edgeType, final boolean hasBody) {
        this.edgeType = edgeType;
        this.hasBody = hasBody;
    }

    public static EdgeAttributes directed(final boolean hasBody) {
        return new EdgeAttributes(EdgeType.DIRECTED, hasBody);
    }

    public static EdgeAttributes undirected(final boolean hasBody) {
        return new EdgeAttributes(EdgeType.UNDIRECTED, hasBody);
    }

    @NotNull
    public EdgeType getEdgeType() {
        return edgeType;
    }

    public boolean hasBody() {
        return hasBody;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EdgeAttributes)) {
            return false;
        }
        final EdgeAttributes that = (EdgeAttributes) obj;
        return edgeType == that.edgeType && hasBody == that.hasBody;
    }

    @Override
    public int hashCode() {
        return edgeType.hashCode() * 2 + (hasBody ? 1 : 0);
    }

    @Override
    public String toString() {
        return edgeType + (hasBody ? " with body" : "");
    }
}
