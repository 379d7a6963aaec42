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
import org.cellgraph.cell.CellHeader;
import org.cellgraph.cell.CellId;
import org.jctools.maps.NonBlockingHashMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory multi-version {@linkplain CellStore}. Each cell keeps a chain of committed versions, a transaction reads
 * versions not newer than its snapshot. Commits are serialized, each commit gets next commit timestamp which is also
 * the version of all cells it writes. Versions that no active snapshot can see are pruned on commit.
 */
public class MemoryCellStore implements CellStore {

    private static final Logger logger = LoggerFactory.getLogger(MemoryCellStore.class);

    @NotNull
    private final CellStoreConfig config;
    @NotNull
    private final Map<CellId, VersionedCell> cells;
    @NotNull
    private final AtomicLong lastCommitted;
    @NotNull
    private final Object commitLock;
    @NotNull
    private final TransactionSet txns;
    @NotNull
    private final AtomicLong replays;

    public MemoryCellStore(@NotNull final CellStoreConfig config) {
        this.config = config;
        cells = new NonBlockingHashMap<>();
        lastCommitted = new AtomicLong();
        commitLock = new Object();
        txns = new TransactionSet();
        replays = new AtomicLong();
    }

    @NotNull
    public CellStoreConfig getConfig() {
        return config;
    }

    @NotNull
    @Override
    public Outcome<Cell> read(@NotNull final CellId id) {
        final VersionedCell head = cells.get(id);
        return Outcome.ok(head == null ? null : head.cell);
    }

    @NotNull
    @Override
    public Outcome<CellHeader> write(@NotNull final Cell cell) {
        final CellId id = cell.getId();
        synchronized (commitLock) {
            final VersionedCell head = cells.get(id);
            if (head != null && head.cell != null) {
                return Outcome.fatal(ErrorKind.CELL_ALREADY_EXISTS, "Cell " + id + " already exists");
            }
            final long version = lastCommitted.get() + 1;
            final CellHeader header = cell.getHeader().withVersion(version);
            cells.put(id, new VersionedCell(version, cell.withHeader(header), head));
            lastCommitted.set(version);
            prune(id, Math.min(txns.getOldestSnapshot(), version));
            return Outcome.ok(header);
        }
    }

    @NotNull
    @Override
    public <T> Outcome<T> computeInTransaction(@NotNull final CellTransactionalComputable<T> computable) {
        final MemoryCellTransaction txn = beginTransaction();
        try {
            int replayCount = 0;
            while (true) {
                final Outcome<T> result = computable.compute(txn);
                if (result.isFatal()) {
                    return result;
                }
                if (result.isOk() && (txn.isFinished() || txn.commit())) {
                    return result;
                }
                if (++replayCount > config.getTxnReplayMaxCount()) {
                    logger.warn("Transaction gave up after " + (replayCount - 1) + " replays");
                    return Outcome.retry();
                }
                replays.incrementAndGet();
                txn.revert();
            }
        } finally {
            abortIfNotFinished(txn);
        }
    }

    @NotNull
    public MemoryCellTransaction beginTransaction() {
        synchronized (commitLock) {
            final MemoryCellTransaction txn = new MemoryCellTransaction(this, lastCommitted.get());
            txns.add(txn, txn.getSnapshot());
            return txn;
        }
    }

    /**
     * @return total number of transaction replays since the store was created
     */
    public long getReplayCount() {
        return replays.get();
    }

    public int getActiveTransactionCount() {
        return txns.size();
    }

    public long getLastCommitted() {
        return lastCommitted.get();
    }

    /**
     * @return number of retained versions of the cell including removal marks
     */
    public int getVersionCount(@NotNull final CellId id) {
        int result = 0;
        for (VersionedCell v = cells.get(id); v != null; v = v.previous) {
            ++result;
        }
        return result;
    }

    boolean isEarlyConflictDetection() {
        return config.isTxnEarlyConflictDetection();
    }

    @Nullable
    Cell readAt(@NotNull final CellId id, final long snapshot) {
        final VersionedCell head = cells.get(id);
        if (head == null) {
            return null;
        }
        final VersionedCell visible = head.visibleAt(snapshot);
        return visible == null ? null : visible.cell;
    }

    long latestVersion(@NotNull final CellId id) {
        final VersionedCell head = cells.get(id);
        return head == null ? 0L : head.version;
    }

    long renewSnapshot(@NotNull final MemoryCellTransaction txn) {
        synchronized (commitLock) {
            final long snapshot = lastCommitted.get();
            txns.add(txn, snapshot);
            return snapshot;
        }
    }

    boolean commitTransaction(@NotNull final MemoryCellTransaction txn) {
        final Map<CellId, Cell> writes = txn.getWrites();
        final long snapshot = txn.getSnapshot();
        synchronized (commitLock) {
            // read-only transactions always commit
            if (writes.isEmpty()) {
                txns.remove(txn);
                return true;
            }
            final Set<CellId> touched = new LinkedHashSet<>(txn.getReadSet());
            touched.addAll(writes.keySet());
            for (final CellId id : touched) {
                if (latestVersion(id) > snapshot) {
                    if (logger.isDebugEnabled()) {
                        logger.debug("Transaction at snapshot " + snapshot + " conflicts on cell " + id);
                    }
                    return false;
                }
            }
            txns.remove(txn);
            final long version = lastCommitted.get() + 1;
            for (final Map.Entry<CellId, Cell> entry : writes.entrySet()) {
                final CellId id = entry.getKey();
                final Cell cell = entry.getValue();
                cells.put(id, new VersionedCell(version,
                        cell == null ? null : cell.withHeader(cell.getHeader().withVersion(version)), cells.get(id)));
            }
            lastCommitted.set(version);
            final long oldestSnapshot = Math.min(txns.getOldestSnapshot(), version);
            for (final CellId id : writes.keySet()) {
                prune(id, oldestSnapshot);
            }
            return true;
        }
    }

    void finishTransaction(@NotNull final MemoryCellTransaction txn) {
        txns.remove(txn);
    }

    private void prune(@NotNull final CellId id, final long oldestSnapshot) {
        final VersionedCell head = cells.get(id);
        if (head == null) {
            return;
        }
        if (head.cell == null && head.version <= oldestSnapshot) {
            cells.remove(id);
        } else {
            head.prune(oldestSnapshot);
        }
    }

    private static void abortIfNotFinished(@NotNull final MemoryCellTransaction txn) {
        if (!txn.isFinished()) {
            txn.abort();
        }
    }
}
