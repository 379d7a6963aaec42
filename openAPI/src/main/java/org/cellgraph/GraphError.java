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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Terminal failure of a graph or store operation. Carried by {@linkplain Outcome#fatal(GraphError) FATAL}
 * outcomes, never retried.
 */
public final class GraphError {

    @NotNull
    private final ErrorKind kind;
    @NotNull
    private final String message;
    @Nullable
    private final Throwable cause;

    public GraphError(@NotNull final ErrorKind kind, @NotNull final String message) {
        this(kind, message, null);
    }

    public GraphError(@NotNull final ErrorKind kind, @NotNull final String message, @Nullable final Throwable cause) {
        this.kind = kind;
        this.message = message;
        this.cause = cause;
    }

    @NotNull
    public ErrorKind getKind() {
        return kind;
    }

    @NotNull
    public ErrorCategory getCategory() {
        return kind.getCategory();
    }

    @NotNull
    public String getMessage() {
        return message;
    }

    @Nullable
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
