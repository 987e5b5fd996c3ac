/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/state/QueryState.java
 description: Closed union of query states (running, completed, failed) with exhaustive map and
              the loading-substitution helper when().
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.singleflight.state;

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * State of a {@code Query}: {@link Running}, {@link Completed} or {@link Failed}.
 *
 * <p>A query never idles; it starts running as soon as it is created. Use {@link #map} for an
 * exhaustive match, or {@link #when} to keep showing the previous outcome during a restart.</p>
 *
 * @param <T> value type
 */
public abstract sealed class QueryState<T extends @Nullable Object> extends ObservedState<T, QueryState<T>>
        permits QueryState.Running, QueryState.Completed, QueryState.Failed {

    private QueryState(@Nullable QueryState<T> previousState) {
        super(previousState);
    }

    // 🧩 Section: match

    /**
     * Exhaustive match over the three variants.
     *
     * @param loading called for {@link Running}
     * @param data    called with the value of {@link Completed}
     * @param failed  called with the error of {@link Failed}
     * @param <X>     result type
     * @return the selected function's result
     */
    public abstract <X extends @Nullable Object> X map(
            Supplier<? extends X> loading,
            Function<? super T, ? extends X> data,
            Function<? super Throwable, ? extends X> failed);

    @Override
    public <X extends @Nullable Object> X fold(
            Supplier<? extends X> pending,
            Function<? super T, ? extends X> completed,
            Function<? super Throwable, ? extends X> failed) {
        return map(pending, completed, failed);
    }

    /**
     * Like {@link #map}, but while running may show the previous completed or failed state
     * instead, according to {@code policy}. Avoids a loading flicker on refresh.
     *
     * @param policy  which previous outcomes replace loading
     * @param data    called with the value of the shown completed state
     * @param failed  called with the error of the shown failed state
     * @param loading called when loading is shown
     * @param <X>     result type
     * @return the selected function's result
     */
    public <X extends @Nullable Object> X when(
            LoadingPolicy policy,
            Function<? super T, ? extends X> data,
            Function<? super Throwable, ? extends X> failed,
            Supplier<? extends X> loading) {
        Objects.requireNonNull(policy, "policy");
        return shownFor(policy).map(loading, data, failed);
    }

    /**
     * {@link #when(LoadingPolicy, Function, Function, Supplier)} with {@link LoadingPolicy#DEFAULT}.
     */
    public <X extends @Nullable Object> X when(
            Function<? super T, ? extends X> data,
            Function<? super Throwable, ? extends X> failed,
            Supplier<? extends X> loading) {
        return when(LoadingPolicy.DEFAULT, data, failed, loading);
    }

    /**
     * @return the state {@link #when} renders for this state under {@code policy}
     */
    QueryState<T> shownFor(LoadingPolicy policy) {
        return this;
    }

    /**
     * @return whether this state, as the previous of a running state, replaces loading
     */
    abstract boolean replacesLoading(LoadingPolicy policy);
    // [/🧩 Section: match]

    public boolean isLoading() {
        return map(() -> true, v -> false, e -> false);
    }

    // 🧩 Section: variants

    /**
     * The query function is executing.
     */
    public static final class Running<T extends @Nullable Object> extends QueryState<T> {

        public Running() {
            super(null);
        }

        public Running(@Nullable QueryState<T> previousState) {
            super(previousState);
        }

        @Override
        public <X extends @Nullable Object> X map(
                Supplier<? extends X> loading,
                Function<? super T, ? extends X> data,
                Function<? super Throwable, ? extends X> failed) {
            return loading.get();
        }

        @Override
        QueryState<T> shownFor(LoadingPolicy policy) {
            QueryState<T> previous = previousState();
            return previous != null && previous.replacesLoading(policy) ? previous : this;
        }

        @Override
        boolean replacesLoading(LoadingPolicy policy) {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Running<?>;
        }

        @Override
        public int hashCode() {
            return Running.class.hashCode();
        }

        @Override
        public String toString() {
            return "QueryState.Running";
        }
    }

    /**
     * The query function returned {@link #value()}.
     */
    public static final class Completed<T extends @Nullable Object> extends QueryState<T> {
        private final T value;

        public Completed(T value) {
            this(value, null);
        }

        public Completed(T value, @Nullable QueryState<T> previousState) {
            super(previousState);
            this.value = value;
        }

        @Override
        public T value() {
            return value;
        }

        @Override
        public <X extends @Nullable Object> X map(
                Supplier<? extends X> loading,
                Function<? super T, ? extends X> data,
                Function<? super Throwable, ? extends X> failed) {
            return data.apply(value);
        }

        @Override
        boolean replacesLoading(LoadingPolicy policy) {
            return policy.skipLoadingOnRestartAfterSuccess();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Completed<?> that && Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "QueryState.Completed[" + value + "]";
        }
    }

    /**
     * The query function threw {@link #error()}; its stack trace is kept with the error.
     */
    public static final class Failed<T extends @Nullable Object> extends QueryState<T> {
        private final Throwable error;

        public Failed(Throwable error) {
            this(error, null);
        }

        public Failed(Throwable error, @Nullable QueryState<T> previousState) {
            super(previousState);
            this.error = Objects.requireNonNull(error, "error");
        }

        @Override
        public Throwable error() {
            return error;
        }

        @Override
        public <X extends @Nullable Object> X map(
                Supplier<? extends X> loading,
                Function<? super T, ? extends X> data,
                Function<? super Throwable, ? extends X> failed) {
            return failed.apply(error);
        }

        @Override
        boolean replacesLoading(LoadingPolicy policy) {
            return policy.skipLoadingOnRestartAfterFailure();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Failed<?> that && error.equals(that.error);
        }

        @Override
        public int hashCode() {
            return error.hashCode();
        }

        @Override
        public String toString() {
            return "QueryState.Failed[" + error + "]";
        }
    }
    // [/🧩 Section: variants]
}
