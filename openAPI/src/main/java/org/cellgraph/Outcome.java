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

import java.util.function.Function;

/**
 * Result of an operation against the cell store. An outcome is in one of three states:
 * <ul>
 * <li>{@code OK}: the operation succeeded, the value can be {@code null} for operations without a result or
 * for reads of absent cells;</li>
 * <li>{@code RETRY}: the transaction engine aborted the transaction, the whole transactional closure should be
 * executed once more;</li>
 * <li>{@code FATAL}: the operation failed with a {@linkplain GraphError}, retrying won't help and the error should be
 * surfaced to the caller.</li>
 * </ul>
 * Combinators {@linkplain #map(Function)} and {@linkplain #then(Function)} are applied to {@code OK} outcomes only,
 * {@code RETRY} and {@code FATAL} are propagated unchanged.
 *
 * @param <T> type of the value
 */
public final class Outcome<T> {

    public enum State {
        OK,
        RETRY,
        FATAL
    }

    private static final Outcome<?> RETRY = new Outcome<>(State.RETRY, null, null);
    private static final Outcome<?> DONE = new Outcome<>(State.OK, null, null);

    @NotNull
    private final State state;
    @Nullable
    private final T value;
    @Nullable
    private final GraphError error;

    private Outcome(@NotNull final State state, @Nullable final T value, @Nullable final GraphError error) {
        this.state = state;
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> ok(@Nullable final T value) {
        return value == null ? done() : new Outcome<>(State.OK, value, null);
    }

    @SuppressWarnings("unchecked")
    public static <T> Outcome<T> done() {
        return (Outcome<T>) DONE;
    }

    @SuppressWarnings("unchecked")
    public static <T> Outcome<T> retry() {
        return (Outcome<T>) RETRY;
    }

    public static <T> Outcome<T> fatal(@NotNull final GraphError error) {
        return new Outcome<>(State.FATAL, null, error);
    }

    public static <T> Outcome<T> fatal(@NotNull final ErrorKind kind, @NotNull final String message) {
        return fatal(new GraphError(kind, message));
    }

    @NotNull
    public State getState() {
        return state;
    }

    public boolean isOk() {
        return state == State.OK;
    }

    public boolean isRetry() {
        return state == State.RETRY;
    }

    public boolean isFatal() {
        return state == State.FATAL;
    }

    /**
     * @return the value of {@code OK} outcome
     * @throws IllegalStateException if the outcome is not {@code OK}
     */
    @Nullable
    public T get() {
        if (state != State.OK) {
            throw new IllegalStateException("Outcome is " + this);
        }
        return value;
    }

    /**
     * @return the error of {@code FATAL} outcome
     * @throws IllegalStateException if the outcome is not {@code FATAL}
     */
    @NotNull
    public GraphError getError() {
        if (error == null) {
            throw new IllegalStateException("Outcome is " + this);
        }
        return error;
    }

    /**
     * @return kind of the error if the outcome is {@code FATAL}, otherwise {@code null}
     */
    @Nullable
    public ErrorKind getErrorKind() {
        return error == null ? null : error.getKind();
    }

    public <U> Outcome<U> map(@NotNull final Function<? super T, ? extends U> mapper) {
        if (state != State.OK) {
            return cast();
        }
        return ok(mapper.apply(value));
    }

    public <U> Outcome<U> then(@NotNull final Function<? super T, Outcome<U>> next) {
        if (state != State.OK) {
            return cast();
        }
        return next.apply(value);
    }

    /**
     * Re-types {@code RETRY} or {@code FATAL} outcome in order to propagate it.
     *
     * @throws IllegalStateException if the outcome is {@code OK}
     */
    @SuppressWarnings("unchecked")
    public <U> Outcome<U> cast() {
        if (state == State.OK) {
            throw new IllegalStateException("Can't cast OK outcome");
        }
        return (Outcome<U>) this;
    }

    @Override
    public String toString() {
        switch (state) {
            case OK:
                return "OK(" + value + ')';
            case RETRY:
                return "RETRY";
            default:
                return "FATAL(" + error + ')';
        }
    }
}
