/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/state/ObservedState.java
 description: Base of the observable state unions: single-level previous-state link and the
              pending/completed/failed fold used by the state machine.
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

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Common base of {@link QueryState} and {@link MutationState}.
 *
 * <p>Every state keeps at most one {@linkplain #previousState() previous state}. When a state
 * machine replaces state {@code s} with {@code n}, it first calls {@code s.clearPreviousState()}
 * and then builds {@code n} with {@code s} as its previous, so for any settled state
 * {@code s.previousState() == null || s.previousState().previousState() == null}.
 * Apart from that one-time clearing, states are immutable.</p>
 *
 * <p>{@link #fold} collapses the concrete variants into three outcomes without type tests:
 * still pending (idle or running), completed with a value, or failed with an error.</p>
 *
 * @param <T> value type of the completed variant
 * @param <S> the concrete union type
 */
public abstract class ObservedState<T extends @Nullable Object, S extends ObservedState<T, S>> {

    // 🧩 Section: history
    private volatile @Nullable S previousState;

    protected ObservedState(@Nullable S previousState) {
        this.previousState = previousState;
    }

    /**
     * @return the state this one replaced, or {@code null}
     */
    public @Nullable S previousState() {
        return previousState;
    }

    /**
     * Drop the link to the previous state. Called on the outgoing state just before it becomes
     * the previous state of its successor.
     */
    public void clearPreviousState() {
        previousState = null;
    }
    // [/🧩 Section: history]

    // 🧩 Section: fold

    /**
     * Exhaustive three-way match over the outcome of this state.
     *
     * @param pending   called for idle and running states
     * @param completed called with the value of a completed state
     * @param failed    called with the error of a failed state
     * @param <X>       result type
     * @return the selected function's result
     */
    public abstract <X extends @Nullable Object> X fold(
            Supplier<? extends X> pending,
            Function<? super T, ? extends X> completed,
            Function<? super Throwable, ? extends X> failed);

    /**
     * @return {@code true} for completed and failed states
     */
    public boolean isSettled() {
        return fold(() -> false, v -> true, e -> true);
    }

    public boolean hasValue() {
        return fold(() -> false, v -> true, e -> false);
    }

    public boolean hasFailed() {
        return fold(() -> false, v -> false, e -> true);
    }

    /**
     * @return the value if completed, otherwise {@code null}
     */
    public @Nullable T value() {
        return fold(() -> null, v -> v, e -> null);
    }

    /**
     * @return the error if failed, otherwise {@code null}
     */
    public @Nullable Throwable error() {
        return fold(() -> null, v -> null, e -> e);
    }

    /**
     * @return the stack trace captured with the error if failed, otherwise {@code null}
     */
    public StackTraceElement @Nullable [] stackTrace() {
        Throwable error = error();
        return error == null ? null : error.getStackTrace();
    }
    // [/🧩 Section: fold]
}
