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

import org.cellgraph.Outcome;
import org.cellgraph.cell.Cell;
import org.cellgraph.cell.CellId;
import org.jetbrains.annotations.NotNull;

/**
 * Transaction is required for multi-cell atomic access to the {@linkplain CellStore store}. Any transaction holds a
 * snapshot of the store: all reads within the transaction see the same consistent state, and all writes are committed
 * atomically or not at all.
 * <p>Each operation can return {@linkplain Outcome#retry() RETRY} if the transaction engine decides the transaction
 * can't be committed. In that case the transactional closure should return that outcome as is, and the engine will
 * re-execute the closure against a fresh snapshot.
 *
 * @see CellStore#computeInTransaction(CellTransactionalComputable)
 */
public interface CellTransaction {

    /**
     * @return {@code OK} with the cell, or {@code OK(null)} if the cell doesn't exist in the snapshot
     */
    @NotNull
    Outcome<Cell> read(@NotNull CellId id);

    /**
     * Writes new cell. Fails with {@linkplain org.cellgraph.ErrorKind#CELL_ALREADY_EXISTS} if a cell with the same
     * id exists.
     */
    @NotNull
    Outcome<Void> write(@NotNull Cell cell);

    /**
     * Replaces existing cell. Fails with {@linkplain org.cellgraph.ErrorKind#CELL_NOT_FOUND} if there is no cell
     * with the same id.
     */
    @NotNull
    Outcome<Void> update(@NotNull Cell cell);

    /**
     * Removes existing cell. Fails with {@linkplain org.cellgraph.ErrorKind#CELL_NOT_FOUND} if there is no such cell.
     */
    @NotNull
    Outcome<Void> remove(@NotNull CellId id);

    /**
     * @return commit timestamp of the snapshot the transaction holds
     */
    long getSnapshot();

    boolean isFinished();
}
