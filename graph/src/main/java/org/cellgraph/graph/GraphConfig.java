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

import org.cellgraph.AbstractConfig;
import org.cellgraph.CellGraphException;
import org.cellgraph.ConfigurationStrategy;
import org.cellgraph.InvalidSettingException;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Specifies settings of {@linkplain Graph}. Default settings are specified by {@linkplain #DEFAULT} which is
 * immutable. Any newly created {@code GraphConfig} reads overridden settings from system properties.
 */
@SuppressWarnings({"WeakerAccess", "unused"})
public class GraphConfig extends AbstractConfig {

    public static final GraphConfig DEFAULT = new GraphConfig(ConfigurationStrategy.IGNORE) {
        @Override
        public GraphConfig setMutable(boolean isMutable) {
            if (!this.isMutable() && isMutable) {
                throw new CellGraphException("Can't make GraphConfig.DEFAULT mutable");
            }
            return super.setMutable(isMutable);
        }
    }.setMutable(false);

    /**
     * Maximum number of member ids in one segment of an Id List. When the tail segment is full, new segment is
     * allocated and chained. Default value is {@code 1000}.
     * <p>Mutable at runtime: yes, affects only segments allocated afterwards
     */
    public static final String ID_LIST_SEGMENT_CAPACITY = "cellgraph.idList.segmentCapacity";

    /**
     * If is set to {@code true}, a non-head segment of an Id List emptied by member removal is unlinked from the
     * chain and deleted. Default value is {@code true}.
     * <p>Mutable at runtime: yes
     */
    public static final String ID_LIST_RECLAIM_EMPTY_SEGMENTS = "cellgraph.idList.reclaimEmptySegments";

    /**
     * If is set to {@code true}, removal of a vertex unlinks all its edges in the same transaction. Otherwise removal
     * of a vertex having edges fails with {@code VERTEX_HAS_EDGES}. Default value is {@code true}.
     * <p>Mutable at runtime: yes
     */
    public static final String VERTEX_CASCADE_REMOVE = "cellgraph.vertex.cascadeRemove";

    public GraphConfig() {
        this(ConfigurationStrategy.SYSTEM_PROPERTY);
    }

    public GraphConfig(@NotNull final ConfigurationStrategy strategy) {
        super(defaults(), strategy);
    }

    @Override
    public GraphConfig setSetting(@NotNull final String key, @NotNull final Object value) {
        return (GraphConfig) super.setSetting(key, value);
    }

    @Override
    public GraphConfig setMutable(boolean isMutable) {
        return (GraphConfig) super.setMutable(isMutable);
    }

    public int getIdListSegmentCapacity() {
        return (Integer) getSetting(ID_LIST_SEGMENT_CAPACITY);
    }

    public GraphConfig setIdListSegmentCapacity(final int capacity) {
        if (capacity < 1) {
            throw new InvalidSettingException("Segment capacity should be positive: " + capacity);
        }
        return setSetting(ID_LIST_SEGMENT_CAPACITY, capacity);
    }

    public boolean isIdListReclaimEmptySegments() {
        return (Boolean) getSetting(ID_LIST_RECLAIM_EMPTY_SEGMENTS);
    }

    public GraphConfig setIdListReclaimEmptySegments(final boolean reclaim) {
        return setSetting(ID_LIST_RECLAIM_EMPTY_SEGMENTS, reclaim);
    }

    public boolean isVertexCascadeRemove() {
        return (Boolean) getSetting(VERTEX_CASCADE_REMOVE);
    }

    public GraphConfig setVertexCascadeRemove(final boolean cascade) {
        return setSetting(VERTEX_CASCADE_REMOVE, cascade);
    }

    private static Map<String, Object> defaults() {
        final Map<String, Object> result = new LinkedHashMap<>();
        result.put(ID_LIST_SEGMENT_CAPACITY, 1000);
        result.put(ID_LIST_RECLAIM_EMPTY_SEGMENTS, true);
        result.put(VERTEX_CASCADE_REMOVE, true);
        return result;
    }
}
