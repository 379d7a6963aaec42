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
import org.cellgraph.GraphError;
import org.jetbrains.annotations.NotNull;

/**
 * Is thrown if built-in schemas of the graph layer can't be registered in the catalog, or are missing on
 * construction of a {@linkplain Graph}.
 */
public class GraphBootstrapException extends CellGraphException {

    public GraphBootstrapException(@NotNull final String message) {
        super(message);
    }

    public GraphBootstrapException(@NotNull final GraphError error) {
        super("Failed to bootstrap graph schemas: " + error, error.getCause());
    }
}
