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

import org.cellgraph.CellGraphException;
import org.cellgraph.ConfigurationStrategy;
import org.cellgraph.InvalidSettingException;
import org.cellgraph.TestUtil;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class CellStoreConfigTest {

    @Test
    public void defaults() {
        final CellStoreConfig config = new CellStoreConfig(ConfigurationStrategy.IGNORE);
        Assert.assertEquals(100, config.getTxnReplayMaxCount());
        Assert.assertTrue(config.isTxnEarlyConflictDetection());
    }

    @Test
    public void defaultIsImmutable() {
        Assert.assertFalse(CellStoreConfig.DEFAULT.isMutable());
        TestUtil.runWithExpectedException(() -> CellStoreConfig.DEFAULT.setTxnReplayMaxCount(1), CellGraphException.class);
        TestUtil.runWithExpectedException(() -> CellStoreConfig.DEFAULT.setMutable(true), CellGraphException.class);
    }

    @Test
    public void systemProperties() {
        final String previous = System.setProperty(CellStoreConfig.TXN_REPLAY_MAX_COUNT, "7");
        try {
            Assert.assertEquals(7, new CellStoreConfig().getTxnReplayMaxCount());
            Assert.assertEquals(100, new CellStoreConfig(ConfigurationStrategy.IGNORE).getTxnReplayMaxCount());
        } finally {
            if (previous == null) {
                System.clearProperty(CellStoreConfig.TXN_REPLAY_MAX_COUNT);
            } else {
                System.setProperty(CellStoreConfig.TXN_REPLAY_MAX_COUNT, previous);
            }
        }
    }

    @Test
    public void setSettings() {
        final CellStoreConfig config = new CellStoreConfig(ConfigurationStrategy.IGNORE);
        final Map<String, String> settings = new HashMap<>();
        settings.put(CellStoreConfig.TXN_REPLAY_MAX_COUNT, "5");
        settings.put(CellStoreConfig.TXN_EARLY_CONFLICT_DETECTION, "false");
        config.setSettings(settings);
        Assert.assertEquals(5, config.getTxnReplayMaxCount());
        Assert.assertFalse(config.isTxnEarlyConflictDetection());
    }

    @Test(expected = InvalidSettingException.class)
    public void unknownSetting() {
        new CellStoreConfig(ConfigurationStrategy.IGNORE).setSettings(Collections.singletonMap("cellgraph.unknown", "1"));
    }

    @Test(expected = InvalidSettingException.class)
    public void malformedSetting() {
        new CellStoreConfig(ConfigurationStrategy.IGNORE).setSettings(Collections.singletonMap(CellStoreConfig.TXN_REPLAY_MAX_COUNT, "many"));
    }
}
