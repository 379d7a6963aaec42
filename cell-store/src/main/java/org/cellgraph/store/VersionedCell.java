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
package org.cellgraph.store;

import org.cellgraph.cell.Cell;
import org.jetbrains.annotations.Nullable;

/**
 * Element of a cell's version chain, newest first. {@code null} cell is a removal mark.
 */
final class VersionedCell {

    final long version;
    @Nullable
    final Cell cell;
    @Nullable
    volatile VersionedCell previous;

    VersionedCell(final long version, @Nullable final Cell cell, @Nullable final VersionedCell previous) {
        this.version = version;
        this.cell = cell;
        this.previous = previous;
    }

    @Nullable
    VersionedCell visibleAt(final long snapshot) {
        VersionedCell result = this;
        while (result != null && result.version > snapshot) {
            result = result.previous;
        }
        return result;
    }

    /**
     * Cuts versions which no snapshot not older than {@code oldestSnapshot} can see.
     */
    void prune(final long oldestSnapshot) {
        final VersionedCell visible = visibleAt(oldestSnapshot);
        if (visible != null) {
            visible.previous = null;
        }
    }
}
