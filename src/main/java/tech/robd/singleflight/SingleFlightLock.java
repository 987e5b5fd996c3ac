/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/SingleFlightLock.java
 description: FIFO mutual-exclusion lock that cancels the previous submission's token before
              enqueueing a new body. Blocking (LockedTask) and stage-returning (AsyncLockedTask) bodies.
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

package tech.robd.singleflight;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.singleflight.diagnostics.Diagnostics;
import tech.robd.singleflight.internal.CancellationTokenImpl;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one task body at a time and cancels the previous task whenever a new one is submitted.
 *
 * <p>Useful wherever only the latest request matters: search-as-you-type, refresh buttons,
 * file watching, auto-save.</p>
 *
 * <p>Each {@link #submit(LockedTask)} call:
 * <ol>
 *   <li>cancels the token of the previous submission (callbacks run synchronously, in order),</li>
 *   <li>creates a fresh {@link CancellationToken} and makes it the active one,</li>
 *   <li>queues the body behind every earlier body; it starts only once the previous body's
 *       future has settled, after a checkpoint, so a body superseded while still queued never runs,</li>
 *   <li>returns the body's future.</li>
 * </ol>
 *
 * <p>Cancellation never stops a running body. It keeps the lock until it checkpoints and
 * unwinds or finishes on its own.</p>
 *
 * <pre>{@code
 * SingleFlightLock lock = new SingleFlightLock();
 *
 * void search(String text) {
 *     FireAndForget.ignore(lock.submit(token -> {
 *         token.guard();
 *         List<Hit> hits = token.wait(() -> index.query(text));
 *         view.show(hits);
 *         return null;
 *     }), "search");
 * }
 * }</pre>
 */
public final class SingleFlightLock {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(SingleFlightLock.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: shared-executor
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    /**
     * Cached pool of daemon threads shared by locks created without an explicit executor.
     */
    private static final @NonNull ExecutorService SHARED = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "singleflight-" + THREAD_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    // [/🧩 Section: shared-executor]

    // 🧩 Section: state
    private final int lockId = System.identityHashCode(this);
    private final @NonNull Executor executor;
    private final Object monitor = new Object();

    private @Nullable CancellationTokenImpl activeToken;
    // Settles when the most recently queued body settles; never completes exceptionally
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public SingleFlightLock() {
        this(SHARED);
    }

    /**
     * @param executor runs the task bodies; ordering and exclusion come from the lock, so any
     *                 executor works, including a multi-threaded one
     */
    public SingleFlightLock(@NonNull Executor executor) {
        if (executor == null) throw new IllegalArgumentException("Executor cannot be null");
        this.executor = executor;
    }
    // [/🧩 Section: construction]

    // 🧩 Section: submit

    /**
     * Submit a blocking body. It runs on the lock's executor and holds the lock until it returns or throws.
     *
     * @param body the task body
     * @param <R>  result type
     * @return future of the body's result; fails with {@link CancelledException} if the body
     * was superseded before it started or stopped at a checkpoint
     */
    public <R extends @Nullable Object> CompletableFuture<R> submit(@NonNull LockedTask<R> body) {
        if (body == null) throw new IllegalArgumentException("Body cannot be null");
        return submitAsync(token -> CompletableFuture.completedFuture(body.run(token)));
    }

    /**
     * Submit a body that returns a stage. The lock is held until that stage settles.
     *
     * @param body the task body
     * @param <R>  result type
     * @return future settled with the stage's outcome
     */
    public <R extends @Nullable Object> CompletableFuture<R> submitAsync(@NonNull AsyncLockedTask<R> body) {
        if (body == null) throw new IllegalArgumentException("Body cannot be null");

        CancellationTokenImpl token = new CancellationTokenImpl();
        CompletableFuture<R> result = new CompletableFuture<>();
        CancellationTokenImpl outgoing;
        CompletableFuture<Void> previous;

        // 🧩 Point: submit/swap-token-and-tail
        synchronized (monitor) {
            outgoing = activeToken;
            activeToken = token;
            previous = tail;
            tail = result.handle((r, t) -> null);
        }

        // 🧩 Point: submit/cancel-outgoing
        // Must happen before the new body can be scheduled below
        if (outgoing != null) {
            DIAG.debug("lock#{} submit: cancelling tok#{} for tok#{}", lockId, outgoing.id(), token.id());
            outgoing.cancel();
        }

        // 🧩 Point: submit/abandon-on-cancel
        token.onCancel(() -> FireAndForget.ignore(result, "lock#" + lockId + " tok#" + token.id()));

        // 🧩 Point: submit/release-token
        result.whenComplete((r, t) -> {
            token.markCompleted();
            synchronized (monitor) {
                if (activeToken == token) activeToken = null;
            }
        });

        // 🧩 Point: submit/enqueue
        previous.whenComplete((ignored, ignoredError) -> start(token, body, result));
        return result;
    }
    // [/🧩 Section: submit]

    // 🧩 Section: execution
    private <R> void start(CancellationTokenImpl token, AsyncLockedTask<R> body, CompletableFuture<R> result) {
        try {
            executor.execute(() -> {
                try {
                    token.guard();
                    DIAG.debug("lock#{} tok#{} body start", lockId, token.id());
                    CompletionStage<R> stage = body.run(token);
                    if (stage == null) {
                        result.completeExceptionally(new NullPointerException("Body returned a null stage"));
                        return;
                    }
                    stage.whenComplete((value, error) -> {
                        if (error != null) result.completeExceptionally(unwrap(error));
                        else result.complete(value);
                    });
                } catch (CancelledException ce) {
                    DIAG.debug("lock#{} tok#{} body cancelled before start or at checkpoint", lockId, token.id());
                    result.completeExceptionally(ce);
                } catch (Throwable t) {
                    // The next body waits on this future, so it must settle whatever happens
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException rex) {
            DIAG.warn("lock#{} tok#{} executor rejected body", lockId, token.id());
            result.completeExceptionally(new CancelledException("Lock executor rejected task (probably shut down)"));
        }
    }

    private static Throwable unwrap(Throwable t) {
        if (t instanceof CompletionException && t.getCause() != null) return t.getCause();
        return t;
    }
    // [/🧩 Section: execution]

    // 🧩 Section: introspection

    /**
     * @return the token of the most recent submission while its body has not settled, else {@code null}
     */
    public @Nullable CancellationToken activeToken() {
        synchronized (monitor) {
            return activeToken;
        }
    }

    @Override
    public String toString() {
        CancellationToken active = activeToken();
        return "SingleFlightLock[" + (active == null ? "IDLE" : active.toString()) + "]";
    }
    // [/🧩 Section: introspection]
}
