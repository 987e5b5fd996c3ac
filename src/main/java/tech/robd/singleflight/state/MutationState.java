/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/state/MutationState.java
 description: Closed union of mutation states (idle, running, completed, failed) with exhaustive map.
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
 * State of a {@code Mutation}.
 * <ul>
 *   <li>{@link Idle}: not run yet</li>
 *   <li>{@link Running}: executing</li>
 *   <li>{@link Completed}: finished with a value</li>
 *   <li>{@link Failed}: finished with an error</li>
 * </ul>
 *
 * @param <T> value type
 */
public abstract sealed class MutationState<T extends @Nullable Object> extends ObservedState<T, MutationState<T>>
        permits MutationState.Idle, MutationState.Running, MutationState.Completed, MutationState.Failed {

    private MutationState(@Nullable MutationState<T> previousState) {
        super(previousState);
    }

    // 🧩 Section: match

    /**
     * Exhaustive match; a handler is required for each of the four variants.
     */
    public abstract <X extends @Nullable Object> X map(
            Supplier<? extends X> idle,
            Supplier<? extends X> running,
            Function<? super T, ? extends X> data,
            Function<? super Throwable, ? extends X> failed);

    @Override
    public <X extends @Nullable Object> X fold(
            Supplier<? extends X> pending,
            Function<? super T, ? extends X> completed,
            Function<? super Throwable, ? extends X> failed) {
        return map(pending, pending, completed, failed);
    }
    // [/🧩 Section: match]

    public boolean isIdle() {
        return map(() -> true, () -> false, v -> false, e -> false);
    }

    public boolean isLoading() {
        return map(() -> false, () -> true, v -> false, e -> false);
    }

    // 🧩 Section: variants
    public static final class Idle<T extends @Nullable Object> extends MutationState<T> {

        public Idle() {
            super(null);
        }

        public Idle(@Nullable MutationState<T> previousState) {
            super(previousState);
        }

        @Override
        public <X extends @Nullable Object> X map(
                Supplier<? extends X> idle,
                Supplier<? extends X> running,
                Function<? super T, ? extends X> data,
                Function<? super Throwable, ? extends X> failed) {
            return idle.get();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Idle<?>;
        }

        @Override
        public int hashCode() {
            return Idle.class.hashCode();
        }

        @Override
        public String toString() {
            return "MutationState.Idle";
        }
    }

    public static final class Running<T extends @Nullable Object> extends MutationState<T> {

        public Running() {
            super(null);
        }

        public Running(@Nullable MutationState<T> previousState) {
            super(previousState);
        }

        @Override
        public <X extends @Nullable Object> X map(
                Supplier<? extends X> idle,
                Supplier<? extends X> running,
                Function<? super T, ? extends X> data,
                Function<? super Throwable, ? extends X> failed) {
            return running.get();
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
            return "MutationState.Running";
        }
    }

    public static final class Completed<T extends @Nullable Object> extends MutationState<T> {
        private final T value;

        public Completed(T value) {
            this(value, null);
        }

        public Completed(T value, @Nullable MutationState<T> previousState) {
            super(previousState);
            this.value = value;
        }

        @Override
        public T value() {
            return value;
        }

        @Override
        public <X extends @Nullable Object> X map(
                Supplier<? extends X> idle,
                Supplier<? extends X> running,
                Function<? super T, ? extends X> data,
                Function<? super Throwable, ? extends X> failed) {
            return data.apply(value);
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
            return "MutationState.Completed[" + value + "]";
        }
    }

    public static final class Failed<T extends @Nullable Object> extends MutationState<T> {
        private final Throwable error;

        public Failed(Throwable error) {
            this(error, null);
        }

        public Failed(Throwable error, @Nullable MutationState<T> previousState) {
            super(previousState);
            this.error = Objects.requireNonNull(error, "error");
        }

        @Override
        public Throwable error() {
            return error;
        }

        @Override
        public <X extends @Nullable Object> X map(
                Supplier<? extends X> idle,
                Supplier<? extends X> running,
                Function<? super T, ? extends X> data,
                Function<? super Throwable, ? extends X> failed) {
            return failed.apply(error);
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
            return "MutationState.Failed[" + error + "]";
        }
    }
    // [/🧩 Section: variants]
}
