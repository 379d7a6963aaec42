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

/**
 * Coarse classification of {@linkplain GraphError errors}. Transaction aborts are not a category: they are
 * reported as {@linkplain Outcome#retry() RETRY} outcomes.
 */
public enum ErrorCategory {

    /**
     * Schema mismatch or absence, malformed data, body presence mismatch. Detected before any write.
     */
    VALIDATION,

    /**
     * The store reported a read or write failure.
     */
    STORAGE,

    /**
     * The store could not be reached.
     */
    TRANSPORT,

    /**
     * Adjacency lists are inconsistent or a member is missing.
     */
    LIST
}
