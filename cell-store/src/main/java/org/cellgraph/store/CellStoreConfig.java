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

import org.cellgraph.AbstractConfig;
import org.cellgraph.CellGraphException;
import org.cellgraph.ConfigurationStrategy;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Specifies settings of {@linkplain MemoryCellStore}. Default settings are specified by {@linkplain #DEFAULT} which is
 * immutable. Any newly created {@code CellStoreConfig} reads overridden settings from system properties.
 * <pre>
 *     final CellStore store = CellStores.newInstance(new CellStoreConfig().setTxnReplayMaxCount(10));
 * </pre>
 */
@SuppressWarnings({"WeakerAccess", "unused"})
public class CellStoreConfig extends AbstractConfig {

    public static final CellStoreConfig DEFAULT = new CellStoreConfig(ConfigurationStrategy.IGNORE) {
        @Override
        public CellStoreConfig setMutable(boolean isMutable) {
            if (!this.isMutable() && isMutable) {
                throw new CellGraphException("Can't make CellStoreConfig.DEFAULT mutable");
            }
            return super.setMutable(isMutable);
        }
    }.setMutable(false);

    /**
     * Defines the number of times a transactional closure is re-executed after conflicts with concurrent
     * transactions. When the limit is exhausted, {@code RETRY} outcome is returned to the caller.
     * Default value is {@code 100}.
     * <p>Mutable at runtime: yes
     */
    public static final String TXN_REPLAY_MAX_COUNT = "cellgraph.txn.replayMaxCount";

    /**
     * If is set to {@code true}, a write to a cell that was committed by a concurrent transaction after the
     * snapshot of current one was taken fails immediately with {@code RETRY} rather than on commit.
     * Default value is {@code true}.
     * <p>Mutable at runtime: yes
     */
    public static final String TXN_EARLY_CONFLICT_DETECTION = "cellgraph.txn.earlyConflictDetection";

    public CellStoreConfig() {
        this(ConfigurationStrategy.SYSTEM_PROPERTY);
    }

    public CellStoreConfig(@NotNull final ConfigurationStrategy strategy) {
        super(defaults(), strategy);
    }

    @Override
    public CellStoreConfig setSetting(@NotNull final String key, @NotNull final Object value) {
        return (CellStoreConfig) super.setSetting(key, value);
    }

    @Override
    public CellStoreConfig setMutable(boolean isMutable) {
        return (CellStoreConfig) super.setMutable(isMutable);
    }

    public int getTxnReplayMaxCount() {
        return (Integer) getSetting(TXN_REPLAY_MAX_COUNT);
    }

    public CellStoreConfig setTxnReplayMaxCount(final int count) {
        return setSetting(TXN_REPLAY_MAX_COUNT, count);
    }

    public boolean isTxnEarlyConflictDetection() {
        return (Boolean) getSetting(TXN_EARLY_CONFLICT_DETECTION);
    }

    public CellStoreConfig setTxnEarlyConflictDetection(final boolean early) {
        return setSetting(TXN_EARLY_CONFLICT_DETECTION, early);
    }

    private static Map<String, Object> defaults() {
        final Map<String, Object> result = new LinkedHashMap<>();
        result.put(TXN_REPLAY_MAX_COUNT, 100);
        result.put(TXN_EARLY_CONFLICT_DETECTION, true);
        return result;
    }
}
