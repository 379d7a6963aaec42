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

import org.cellgraph.Outcome;
import org.jetbrains.annotations.NotNull;

/**
 * A function that can be passed to the {@linkplain CellStore#computeInTransaction(CellTransactionalComputable)} to be
 * executed and return result within a {@linkplain CellTransaction transaction}.
 * <p>The function can be executed several times if the transaction conflicts with concurrent ones, so it shouldn't
 * have side effects beyond the transaction.
 *
 * @param <T> type of returned result
 * @see CellTransaction
 * @see CellStore#computeInTransaction(CellTransactionalComputable)
 */
public interface CellTransactionalComputable<T> {

    @NotNull
    Outcome<T> compute(@NotNull final CellTransaction txn);
}
