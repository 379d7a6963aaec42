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

/**
 * Classification of a schema: cells of {@linkplain #VERTEX} schemas are graph vertices, cells of edge schemas are
 * edge bodies. {@linkplain #UNSPECIFIED} schemas are bootstrapped system schemas.
 */
public final class SchemaType {

    public enum Kind {
        VERTEX,
        EDGE,
        UNSPECIFIED
    }

    public static final SchemaType VERTEX = new SchemaType(Kind.VERTEX, null);
    public static final SchemaType UNSPECIFIED = new SchemaType(Kind.UNSPECIFIED, null);

    @NotNull
    private final Kind kind;
    @Nullable
    private final EdgeAttributes edgeAttributes;

    private SchemaType(@NotNull final Kind kind, @Nullable final EdgeAttributes edgeAttributes) {
        this.kind = kind;
        this.edgeAttributes = edgeAttributes;
    }

    public static SchemaType edge(@NotNull final EdgeAttributes attributes) {
        return new SchemaType(Kind.EDGE, attributes);
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    public boolean isVertex() {
        return kind == Kind.VERTEX;
    }

    public boolean isEdge() {
        return kind == Kind.EDGE;
    }

    /**
     * @return edge attributes if the schema is edge one, otherwise {@code null}
     */
    @Nullable
    public EdgeAttributes getEdgeAttributes() {
        return edgeAttributes;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SchemaType)) {
            return false;
        }
        final SchemaType that = (SchemaType) obj;
        return kind == that.kind &&
                (edgeAttributes == null ? that.edgeAttributes == null : edgeAttributes.equals(that.edgeAttributes));
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + (edgeAttributes == null ? 0 : edgeAttributes.hashCode());
    }

    @Override
    public String toString() {
        return edgeAttributes == null ? kind.toString() : kind + "(" + edgeAttributes + ')';
    }
}
