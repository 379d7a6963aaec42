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

public enum ErrorKind {

    SCHEMA_NOT_FOUND(ErrorCategory.VALIDATION),
    SCHEMA_NOT_VERTEX(ErrorCategory.VALIDATION),
    SCHEMA_NOT_EDGE(ErrorCategory.VALIDATION),
    SCHEMA_ALREADY_EXISTS(ErrorCategory.VALIDATION),
    INVALID_SCHEMA(ErrorCategory.VALIDATION),
    DATA_NOT_MATCH_SCHEMA(ErrorCategory.VALIDATION),
    RESERVED_FIELD(ErrorCategory.VALIDATION),
    KEY_FIELD_CHANGED(ErrorCategory.VALIDATION),
    BODY_REQUIRED(ErrorCategory.VALIDATION),
    BODY_SHOULD_NOT_EXIST(ErrorCategory.VALIDATION),
    VERTEX_NOT_FOUND(ErrorCategory.VALIDATION),
    VERTEX_HAS_EDGES(ErrorCategory.VALIDATION),

    CELL_NOT_FOUND(ErrorCategory.STORAGE),
    CELL_ALREADY_EXISTS(ErrorCategory.STORAGE),
    STORAGE_FAILURE(ErrorCategory.STORAGE),

    /**
     * The request definitely was not applied.
     */
    NOT_SENT(ErrorCategory.TRANSPORT),
    /**
     * The connection was lost after the request was sent, it is unknown whether it was applied.
     */
    CONNECTION_LOST(ErrorCategory.TRANSPORT),

    LIST_CORRUPTED(ErrorCategory.LIST),
    LIST_MEMBER_NOT_FOUND(ErrorCategory.LIST),
    EDGE_NOT_FOUND(ErrorCategory.LIST);

    @NotNull
    private final ErrorCategory category;

    ErrorKind(@NotNull final ErrorCategory category) {
        this.category = category;
    }

    @NotNull
    public ErrorCategory getCategory() {
        return category;
    }
}
