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

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshots held by active transactions. The oldest one bounds pruning of cell versions.
 */
final class TransactionSet {

    private final Map<MemoryCellTransaction, Long> snapshots;

    TransactionSet() {
        snapshots = new ConcurrentHashMap<>();
    }

    void add(@NotNull final MemoryCellTransaction txn, final long snapshot) {
        snapshots.put(txn, snapshot);
    }

    void remove(@NotNull final MemoryCellTransaction txn) {
        snapshots.remove(txn);
    }

    boolean isEmpty() {
        return snapshots.isEmpty();
    }

    int size() {
        return snapshots.size();
    }

    long getOldestSnapshot() {
        long result = Long.MAX_VALUE;
        for (final long snapshot : snapshots.values()) {
            if (snapshot < result) {
                result = snapshot;
            }
        }
        return result;
    }
}
