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

import org.cellgraph.schema.SchemaCatalog;
import org.cellgraph.store.CellStore;
import org.jetbrains.annotations.NotNull;

/**
 * Utility class for instantiating {@linkplain Graph graphs}. Makes sure built-in schemas are registered in the catalog
 * before the graph is constructed.
 */
public final class Graphs {

    private Graphs() {
    }

    public static Graph newInstance(@NotNull final CellStore store, @NotNull final SchemaCatalog catalog) {
        return newInstance(store, catalog, new GraphConfig());
    }

    public static Graph newInstance(@NotNull final CellStore store,
                                    @NotNull final SchemaCatalog catalog,
                                    @NotNull final GraphConfig config) {
        GraphSchemas.ensureInitialized(catalog);
        return new Graph(store, catalog, config);
    }
}
