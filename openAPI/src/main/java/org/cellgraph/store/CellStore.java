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
import org.cellgraph.cell.CellHeader;
import org.cellgraph.cell.CellId;
import org.jetbrains.annotations.NotNull;

/**
 * Versioned key-value cell store. Single-cell {@linkplain #read(CellId) reads} and {@linkplain #write(Cell) writes}
 * are atomic on their own, multi-cell atomicity requires {@linkplain #computeInTransaction(CellTransactionalComputable)
 * transactions}.
 * <p>Every store-touching operation blocks the calling thread until the store replies.
 */
public interface CellStore {

    /**
     * @return {@code OK} with the latest committed version of the cell, or {@code OK(null)} if it doesn't exist
     */
    @NotNull
    Outcome<Cell> read(@NotNull CellId id);

    /**
     * Writes new cell.
     *
     * @return header of the written cell with assigned version
     */
    @NotNull
    Outcome<CellHeader> write(@NotNull Cell cell);

    /**
     * Executes specified computable in a new transaction. If the computable returns {@code OK} the transaction is
     * committed. If it returns {@code RETRY} or the commit conflicts with concurrent transactions, the computable is
     * executed once more against fresh snapshot, until the engine gives up and returns {@code RETRY} to the caller.
     * {@code FATAL} outcome aborts the transaction and is returned as is.
     *
     * @param computable transactional computable, can be executed several times
     * @return outcome of the last execution of the computable
     */
    @NotNull
    <T> Outcome<T> computeInTransaction(@NotNull CellTransactionalComputable<T> computable);

    @NotNull
    default CellId encodeKey(final int schemaId, @NotNull final Object key) {
        return CellId.encodeKey(schemaId, key);
    }
}
