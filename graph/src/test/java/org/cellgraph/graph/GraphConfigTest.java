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
package org.cellgraph.graph;

import org.cellgraph.CellGraphException;
import org.cellgraph.ConfigurationStrategy;
import org.cellgraph.InvalidSettingException;
import org.cellgraph.TestUtil;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;

public class GraphConfigTest {

    @Test
    public void defaults() {
        final GraphConfig config = new GraphConfig(ConfigurationStrategy.IGNORE);
        Assert.assertEquals(1000, config.getIdListSegmentCapacity());
        Assert.assertTrue(config.isIdListReclaimEmptySegments());
        Assert.assertTrue(config.isVertexCascadeRemove());
    }

    @Test
    public void setters() {
        final GraphConfig config = new GraphConfig(ConfigurationStrategy.IGNORE)
                .setIdListSegmentCapacity(16)
                .setIdListReclaimEmptySegments(false)
                .setVertexCascadeRemove(false);
        Assert.assertEquals(16, config.getIdListSegmentCapacity());
        Assert.assertFalse(config.isIdListReclaimEmptySegments());
        Assert.assertFalse(config.isVertexCascadeRemove());
    }

    @Test
    public void settingsFromStrings() {
        final GraphConfig config = new GraphConfig(ConfigurationStrategy.IGNORE);
        config.setSettings(Collections.singletonMap(GraphConfig.ID_LIST_SEGMENT_CAPACITY, "64"));
        Assert.assertEquals(64, config.getIdListSegmentCapacity());
        TestUtil.runWithExpectedException(
                () -> config.setSettings(Collections.singletonMap("cellgraph.unknown", "1")), InvalidSettingException.class);
    }

    @Test
    public void systemProperty() {
        System.setProperty(GraphConfig.VERTEX_CASCADE_REMOVE, "false");
        try {
            Assert.assertFalse(new GraphConfig().isVertexCascadeRemove());
        } finally {
            System.clearProperty(GraphConfig.VERTEX_CASCADE_REMOVE);
        }
    }

    @Test
    public void nonPositiveCapacity() {
        TestUtil.runWithExpectedException(
                () -> new GraphConfig(ConfigurationStrategy.IGNORE).setIdListSegmentCapacity(0), InvalidSettingException.class);
    }

    @Test
    public void defaultIsImmutable() {
        Assert.assertFalse(GraphConfig.DEFAULT.isMutable());
        TestUtil.runWithExpectedException(() -> GraphConfig.DEFAULT.setVertexCascadeRemove(false), CellGraphException.class);
        TestUtil.runWithExpectedException(() -> GraphConfig.DEFAULT.setMutable(true), CellGraphException.class);
    }
}
