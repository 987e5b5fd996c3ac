/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/CancellationToken.java
 description: Public cancellation handle given to a task body: flag, checkpoints (guard/wait/await)
              and ordered cleanup callbacks.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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

package tech.robd.singleflight;

import java.util.concurrent.CompletionStage;

/**
 * Per-submission cancellation handle handed to every body run by a {@link SingleFlightLock}.
 *
 * <p>Cancellation is cooperative: {@link #cancel()} only flips a flag and runs the registered
 * cleanup callbacks. A body notices it at checkpoints ({@link #guard()}, {@link #wait(ThrowingSupplier)},
 * {@link #await(CompletionStage)}); a body that never checkpoints runs to completion.</p>
 *
 * <p>Transition is monotone: once cancelled, a token stays cancelled.</p>
 */
public interface CancellationToken {

    // 🧩 Section: query

    /**
     * @return {@code true} if this token has been cancelled
     * <p>Thread-safe and non-blocking.</p>
     */
    boolean isCancelled();
    // [/🧩 Section: query]

    // 🧩 Section: checkpoints

    /**
     * Cheap checkpoint.
     *
     * @throws CancelledException if this token has been cancelled
     */
    default void guard() {
        if (isCancelled()) {
            throw new CancelledException();
        }
    }

    /**
     * Run {@code op} between two checkpoints: {@code guard(); r = op.get(); guard(); return r}.
     * <p>The operation itself is not interrupted; if the token is cancelled while it runs, its
     * result is discarded by the second checkpoint.</p>
     *
     * @param op  the operation to run on the calling thread
     * @param <T> result type
     * @return the operation's result
     * @throws CancelledException if cancelled before or after {@code op}
     * @throws Exception          whatever {@code op} throws
     */
    default <T> T wait(ThrowingSupplier<T> op) throws Exception {
        guard();
        T result = op.get();
        guard();
        return result;
    }

    /**
     * Block until {@code stage} settles, checkpointing before and after.
     * <p>Unlike {@link #wait(ThrowingSupplier)}, a cancellation that arrives while blocked releases
     * the caller immediately with {@link CancelledException}. The stage itself keeps running.</p>
     *
     * @param stage the stage to wait for
     * @param <T>   result type
     * @return the stage's value
     * @throws CancelledException if cancelled before, during or after the wait
     * @throws Exception          the stage's failure, unwrapped
     */
    <T> T await(CompletionStage<T> stage) throws Exception;
    // [/🧩 Section: checkpoints]

    // 🧩 Section: registration

    /**
     * Register a cleanup callback, run in registration order on cancellation.
     * <p>If the token is already cancelled the callback runs immediately on the calling thread.
     * Either way it runs at most once. Exceptions thrown by the callback are logged and
     * do not prevent other callbacks from running.</p>
     *
     * @param callback action to run on cancellation (should be fast and non-blocking)
     * @return {@link AutoCloseable} that unregisters the callback when closed
     */
    AutoCloseable onCancel(Runnable callback);
    // [/🧩 Section: registration]

    // 🧩 Section: cancel

    /**
     * Cancel this token and fire its callbacks. Safe to call multiple times.
     *
     * @return {@code true} if this call performed the first cancellation
     */
    boolean cancel();
    // [/🧩 Section: cancel]
}
