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

import org.cellgraph.ErrorKind;
import org.cellgraph.Outcome;
import org.cellgraph.cell.Cell;
import org.cellgraph.cell.CellId;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot transaction of {@linkplain MemoryCellStore}. Writes are buffered until {@linkplain #commit()}, reads see
 * the snapshot overlaid with own writes. Commit fails if any cell read or written by the transaction was committed
 * by another transaction after the snapshot was taken.
 */
public class MemoryCellTransaction implements CellTransaction {

    @NotNull
    private final MemoryCellStore store;
    private long snapshot;
    @NotNull
    private final Set<CellId> readSet;
    // null value is a removal
    @NotNull
    private final Map<CellId, Cell> writes;
    private volatile boolean isFinished;

    MemoryCellTransaction(@NotNull final MemoryCellStore store, final long snapshot) {
        this.store = store;
        this.snapshot = snapshot;
        readSet = new HashSet<>();
        writes = new LinkedHashMap<>();
    }

    @NotNull
    @Override
    public Outcome<Cell> read(@NotNull final CellId id) {
        checkIsFinished();
        return Outcome.ok(view(id));
    }

    @NotNull
    @Override
    public Outcome<Void> write(@NotNull final Cell cell) {
        checkIsFinished();
        final CellId id = cell.getId();
        if (isConflicting(id)) {
            return Outcome.retry();
        }
        if (view(id) != null) {
            return Outcome.fatal(ErrorKind.CELL_ALREADY_EXISTS, "Cell " + id + " already exists");
        }
        writes.put(id, cell);
        return Outcome.done();
    }

    @NotNull
    @Override
    public Outcome<Void> update(@NotNull final Cell cell) {
        checkIsFinished();
        final CellId id = cell.getId();
        if (isConflicting(id)) {
            return Outcome.retry();
        }
        if (view(id) == null) {
            return Outcome.fatal(ErrorKind.CELL_NOT_FOUND, "Cell " + id + " doesn't exist");
        }
        writes.put(id, cell);
        return Outcome.done();
    }

    @NotNull
    @Override
    public Outcome<Void> remove(@NotNull final CellId id) {
        checkIsFinished();
        if (isConflicting(id)) {
            return Outcome.retry();
        }
        if (view(id) == null) {
            return Outcome.fatal(ErrorKind.CELL_NOT_FOUND, "Cell " + id + " doesn't exist");
        }
        writes.put(id, null);
        return Outcome.done();
    }

    @Override
    public long getSnapshot() {
        return snapshot;
    }

    @Override
    public boolean isFinished() {
        return isFinished;
    }

    public boolean isReadonly() {
        return writes.isEmpty();
    }

    /**
     * Tries to commit buffered writes.
     *
     * @return {@code true} if the transaction is committed, {@code false} if it conflicts with a concurrent one and
     * should be {@linkplain #revert() reverted}
     */
    public boolean commit() {
        checkIsFinished();
        if (store.commitTransaction(this)) {
            isFinished = true;
            return true;
        }
        return false;
    }

    public void abort() {
        checkIsFinished();
        isFinished = true;
        store.finishTransaction(this);
    }

    /**
     * Drops all changes and moves the transaction to the latest snapshot.
     */
    public void revert() {
        checkIsFinished();
        readSet.clear();
        writes.clear();
        snapshot = store.renewSnapshot(this);
    }

    @NotNull
    Set<CellId> getReadSet() {
        return Collections.unmodifiableSet(readSet);
    }

    @NotNull
    Map<CellId, Cell> getWrites() {
        return Collections.unmodifiableMap(writes);
    }

    @Nullable
    private Cell view(@NotNull final CellId id) {
        if (writes.containsKey(id)) {
            return writes.get(id);
        }
        readSet.add(id);
        return store.readAt(id, snapshot);
    }

    private boolean isConflicting(@NotNull final CellId id) {
        return store.isEarlyConflictDetection() && store.latestVersion(id) > snapshot;
    }

    private void checkIsFinished() {
        if (isFinished) {
            throw new TransactionFinishedException();
        }
    }
}
