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

/**
 * Header of a stored cell. Version is assigned by the store on commit, unsaved cells have version {@code 0}.
 */
public final class CellHeader {

    private final int schemaId;
    @NotNull
    private final CellId id;
    private final long version;

    public CellHeader(final int schemaId, @NotNull final CellId id) {
        this(schemaId, id, 0L);
    }

    public CellHeader(final int schemaId, @NotNull final CellId id, final long version) {
        this.schemaId = schemaId;
        this.id = id;
        this.version = version;
    }

    public int getSchemaId() {
        return schemaId;
    }

    @NotNull
    public CellId getId() {
        return id;
    }

    public long getVersion() {
        return version;
    }

    @NotNull
    public CellHeader withVersion(final long version) {
        return new CellHeader(schemaId, id, version);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CellHeader)) {
            return false;
        }
        final CellHeader that = (CellHeader) obj;
        return schemaId == that.schemaId && version == that.version && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return (id.hashCode() * 31 + schemaId) * 31 + Long.hashCode(version);
    }

    @Override
    public String toString() {
        return "CellHeader{schema=" + schemaId + ", id=" + id + ", version=" + version + '}';
    }
}
