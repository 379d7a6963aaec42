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

import org.cellgraph.Outcome;
import org.jetbrains.annotations.NotNull;

/**
 * A function that can be passed to {@linkplain Graph#transaction(GraphTransactionalComputable)} to be executed and
 * return result within a {@linkplain GraphTransaction}.
 * <p>The function is executed once more each time the transaction conflicts with a concurrent one, so it should
 * only capture values that are safe to recompute and have no side effects beyond the transaction. The
 * {@code GraphTransaction} passed to the function is invalid after the function returns.
 *
 * @param <T> type of returned result
 */
public interface GraphTransactionalComputable<T> {

    @NotNull
    Outcome<T> compute(@NotNull final GraphTransaction txn);
}
