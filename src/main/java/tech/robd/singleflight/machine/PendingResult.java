/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/machine/PendingResult.java
 description: One-shot bridge from a state machine's transitions to the future returned by a run;
              settles exactly once and detaches itself on every path.
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

package tech.robd.singleflight.machine;

import org.jspecify.annotations.Nullable;
import tech.robd.singleflight.CancellationToken;
import tech.robd.singleflight.CancelledException;
import tech.robd.singleflight.DisposedException;
import tech.robd.singleflight.state.ObservedState;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Awaitable result of one run.
 *
 * <p>Registered with its machine before the body is submitted, bound to the body's token when
 * the body starts, and settled by whichever comes first:</p>
 * <ul>
 *   <li>a completed or failed state written under that token,</li>
 *   <li>disposal of the machine,</li>
 *   <li>the submission settling without such a write (superseded, or the write was dropped).</li>
 * </ul>
 * <p>Every path removes the result from {@code registry}.</p>
 */
final class PendingResult<R extends @Nullable Object, S extends ObservedState<R, S>> {

    // 🧩 Section: state
    private final CompletableFuture<R> future = new CompletableFuture<>();
    private final Set<PendingResult<R, S>> registry;
    private volatile @Nullable CancellationToken token;
    // [/🧩 Section: state]

    PendingResult(Set<PendingResult<R, S>> registry) {
        this.registry = registry;
        registry.add(this);
    }

    CompletableFuture<R> future() {
        return future;
    }

    void bind(CancellationToken token) {
        this.token = token;
    }

    // 🧩 Section: settle
    void observe(CancellationToken writer, S state) {
        if (writer != token || future.isDone()) return;
        state.fold(
                () -> false,
                value -> settle(() -> future.complete(value)),
                error -> settle(() -> future.completeExceptionally(error)));
    }

    void disposed(String owner) {
        settle(() -> future.completeExceptionally(new DisposedException(owner + " was disposed")));
    }

    /**
     * Called once the lock's submission for this run has settled. Nothing more will be written
     * under this run's token, so anything still pending resolves to a disposal or cancellation.
     */
    void submissionSettled(@Nullable Throwable failure, boolean machineDisposed, String owner) {
        if (future.isDone()) {
            registry.remove(this);
            return;
        }
        if (machineDisposed) {
            disposed(owner);
        } else if (failure == null || failure instanceof CancellationException) {
            settle(() -> future.completeExceptionally(new CancelledException()));
        } else {
            settle(() -> future.completeExceptionally(failure));
        }
    }

    private boolean settle(Runnable completion) {
        completion.run();
        registry.remove(this);
        return true;
    }
    // [/🧩 Section: settle]
}
