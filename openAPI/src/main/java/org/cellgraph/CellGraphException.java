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
package org.cellgraph;

import org.jetbrains.annotations.Nullable;

/**
 * Any cellgraph exception is {@code CellGraphException}. Exceptions signal programming errors or broken invariants;
 * expected failures of graph and store operations are reported as {@linkplain Outcome outcomes}.
 */
public class CellGraphException extends RuntimeException {

    public CellGraphException() {
    }

    public CellGraphException(String message) {
        super(message);
    }

    public CellGraphException(String message, Throwable cause) {
        super(message, cause);
    }

    public CellGraphException(Throwable cause) {
        super(cause);
    }

    public static CellGraphException wrap(Exception e) {
        return e instanceof CellGraphException ? (CellGraphException) e : new CellGraphException(e);
    }

    public static RuntimeException toCellGraphException(final Throwable e, @Nullable final String message) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return message == null ? new CellGraphException(e) : new CellGraphException(message, e);
    }
}
